package org.resmover.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.resmover.cli.CommandLineInterface;
import org.resmover.testing.ModuleFixture;

import picocli.CommandLine;

/**
 * Smoke tests for the move command.
 * Tests command parsing, validation and a complete run.
 */
@Tag("unit")
public class MoveCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void testCommandParses() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKey("move");
    }

    @Test
    void testHelpOutput() {
        execute("move", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("move");
        assertThat(output).contains("--source");
        assertThat(output).contains("--output");
        assertThat(output).contains("--dependency");
        assertThat(output).contains("--include");
        assertThat(output).contains("--exclude");
    }

    @Test
    void testRequiresOutput() {
        int exitCode = execute("move", "-s", tempDir.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--output");
    }

    @Test
    void testIncludeAndExcludeAreMutuallyExclusive() {
        int exitCode = execute("move", "-s", "core", "-o", "checkout", "-i", "drawable", "-e", "string");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("mutually exclusive");
    }

    @Test
    void testRejectsUnknownResourceType() {
        int exitCode = execute("move", "-s", "core", "-o", "checkout", "-i", "pictures");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("pictures is not a valid android resource, pick from [anim, animator");
    }

    @Test
    void testRejectsZeroRounds() {
        int exitCode = execute("-c", testConfig(), "move", "-s", "core", "-o", "checkout", "--max-rounds", "0");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error: maxRounds must be at least 1");
    }

    @Test
    void testInvalidRequestIsLogged() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream logOutput = new ByteArrayOutputStream();
        System.setErr(new PrintStream(logOutput, true, StandardCharsets.UTF_8));
        try {
            execute("-c", testConfig(), "move", "-s", "core", "-o", "checkout", "--max-rounds", "0");
        } finally {
            System.setErr(originalErr);
        }

        assertThat(logOutput.toString(StandardCharsets.UTF_8))
            .contains("ERROR")
            .contains("Invalid move request: maxRounds must be at least 1");
    }

    @Test
    void testMovesResources() {
        ModuleFixture core = ModuleFixture.create(tempDir, "core")
            .resource("drawable/ic_star.png", "star")
            .resource("values/strings.xml", ModuleFixture.values("<string name=\"app_name\">Shop</string>"));
        ModuleFixture checkout = ModuleFixture.create(tempDir, "checkout")
            .source("main/java/Rating.kt", "R.drawable.ic_star + R.string.app_name");

        int exitCode = execute("-c", testConfig(), "move",
            "-s", core.root().toString(), "-o", checkout.root().toString(), "-i", "drawable");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Round #1").contains("1 resource(s) moved.");
        assertThat(checkout.hasResource("drawable/ic_star.png")).isTrue();
        assertThat(core.hasResource("values/strings.xml")).isTrue();
    }

    @Test
    void testTruncatedRunWarns() {
        ModuleFixture core = ModuleFixture.create(tempDir, "core")
            .resource("drawable/ic_star.png", "star");
        ModuleFixture checkout = ModuleFixture.create(tempDir, "checkout")
            .source("main/java/Rating.kt", "R.drawable.ic_star");

        int exitCode = execute("-c", testConfig(), "move",
            "-s", core.root().toString(), "-o", checkout.root().toString(), "--max-rounds", "1");

        assertThat(exitCode).isZero();
        assertThat(err.toString()).contains("Warning: stopped after 1 round(s)");
    }

    static String testConfig() {
        try {
            return new File(MoveCommandTest.class.getClassLoader().getResource("test-config.conf").toURI()).getPath();
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}

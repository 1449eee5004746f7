package org.resmover.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.resmover.report.ProgressReporter.Status;

@Tag("unit")
class ConsoleProgressReporterTest {

    private final StringWriter output = new StringWriter();

    @Test
    void framesAreRuledToWidth() throws IOException {
        ConsoleProgressReporter reporter = new ConsoleProgressReporter(new PrintWriter(output), false, 30);

        int result = reporter.frame(0, "Round #1", depth -> {
            reporter.report(depth, "checkout: Moved 3 matching resource(s).");
            return 3;
        });

        String[] lines = output.toString().split("\\R");
        assertThat(result).isEqualTo(3);
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).startsWith("┏━(Round #1)━").hasSize(30);
        assertThat(lines[1]).isEqualTo("┃ checkout: Moved 3 matching resource(s).");
        assertThat(lines[2]).startsWith("┗━(").matches("┗━\\(\\d+\\.\\d{3}s\\)━+");
    }

    @Test
    void nestedFramesIndent() throws IOException {
        ConsoleProgressReporter reporter = new ConsoleProgressReporter(new PrintWriter(output), false, 20);

        reporter.frame(0, "outer", outer -> reporter.frame(outer, "inner", inner -> {
            reporter.report(inner, "deep");
            return null;
        }));

        assertThat(output.toString()).contains("┃ ┏━(inner)").contains("┃ ┃ deep");
    }

    @Test
    void colorsByStatusWhenEnabled() {
        ConsoleProgressReporter reporter = new ConsoleProgressReporter(new PrintWriter(output), true, 20);

        reporter.report(0, Status.SUCCESS, "ok");
        reporter.report(0, Status.FAILURE, "bad");
        reporter.report(0, "plain");

        assertThat(output.toString())
            .contains("\u001B[32mok\u001B[0m")
            .contains("\u001B[31mbad\u001B[0m")
            .contains("plain");
    }

    @Test
    void frameIsClosedWhenBodyFails() {
        ConsoleProgressReporter reporter = new ConsoleProgressReporter(new PrintWriter(output), false, 20);

        assertThatThrownBy(() -> reporter.frame(0, "Round #1", depth -> {
            throw new IOException("disk gone");
        })).isInstanceOf(IOException.class);

        assertThat(output.toString()).contains("┗━(");
    }
}

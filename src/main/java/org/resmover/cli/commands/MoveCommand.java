package org.resmover.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import org.resmover.cli.CommandLineInterface;
import org.resmover.config.MoverSettings;
import org.resmover.document.ResourceDocumentEditor;
import org.resmover.engine.MoveRequest;
import org.resmover.engine.ResourceMover;
import org.resmover.engine.RunSummary;
import org.resmover.report.ConsoleProgressReporter;
import org.resmover.resources.ConfigurationException;
import org.resmover.resources.ResourceType;
import org.resmover.scan.ModuleResolver;
import org.resmover.scan.ReferenceScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command moving resources from one module into the modules that use them.
 */
@Command(
    name = "move",
    mixinStandardHelpOptions = true,
    description = "Moves resources from one module to many destination modules"
)
public class MoveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MoveCommand.class);

    @Option(
        names = {"-s", "--source"},
        required = true,
        description = "Source module directory"
    )
    private Path source;

    @Option(
        names = {"-o", "--output"},
        required = true,
        description = "Module to move resources to (repeatable)"
    )
    private List<Path> outputs = new ArrayList<>();

    @Option(
        names = {"-d", "--dependency"},
        description = "Module depending on the source module; its references are never moved (repeatable)"
    )
    private List<Path> dependencies = new ArrayList<>();

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    private TypeFilterOptions typeFilterOptions;

    @Option(
        names = {"--max-rounds"},
        description = "Maximum number of rounds (default: resmover.max-rounds from configuration)"
    )
    private Integer maxRounds;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            MoverSettings settings = MoverSettings.fromConfig(parent.getConfig());
            Set<ResourceType> typeFilter = TypeFilterOptions.resolve(typeFilterOptions);
            MoveRequest request = new MoveRequest(source, outputs, dependencies, typeFilter,
                maxRounds != null ? maxRounds : settings.maxRounds());

            ResourceMover mover = new ResourceMover(
                new ModuleResolver(new ReferenceScanner(settings)),
                new ResourceDocumentEditor(settings),
                new ConsoleProgressReporter(out, settings.colorOutput(), settings.frameWidth()));
            RunSummary summary = mover.move(request);

            if (summary.truncated()) {
                err.printf("Warning: stopped after %d round(s) while resources were still being moved; run again to continue.%n",
                    summary.rounds());
            }
            out.printf("%d resource(s) moved.%n", summary.total());
            return 0;

        } catch (ConfigurationException e) {
            log.error("Invalid move request: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Move failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}

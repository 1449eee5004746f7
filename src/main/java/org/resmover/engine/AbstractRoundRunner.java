package org.resmover.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.resmover.report.ProgressReporter;
import org.resmover.report.ProgressReporter.Status;
import org.resmover.resources.ResourceType;
import org.resmover.scan.ModuleInfo;
import org.resmover.scan.ModuleResolver;
import org.slf4j.Logger;

/**
 * Drives rounds of an operation until one makes no progress or the round cap is reached.
 * <p>
 * Every round re-resolves all modules from disk: edits made by one round (e.g. a moved
 * layout now referencing a drawable from its new module) decide what the next round may do.
 */
abstract class AbstractRoundRunner<R> {

    protected final ModuleResolver resolver;
    protected final ProgressReporter reporter;

    /**
     * Wording of one operation's progress messages.
     *
     * @param pastTense  e.g. "Moved".
     * @param participle e.g. "moved".
     * @param gerund     e.g. "moving".
     * @param activity   e.g. "extraction".
     */
    protected record Wording(String pastTense, String participle, String gerund, String activity) {
    }

    protected AbstractRoundRunner(ModuleResolver resolver, ProgressReporter reporter) {
        this.resolver = resolver;
        this.reporter = reporter;
    }

    /**
     * Executes a single round.
     *
     * @param request the run parameters.
     * @param depth frame depth for progress messages.
     * @return the number of resources affected.
     * @throws IOException if scanning or editing fails; the run aborts.
     */
    protected abstract int runRound(R request, int depth) throws IOException;

    protected abstract Wording wording();

    protected abstract Logger log();

    protected final RunSummary runRounds(R request, int maxRounds) throws IOException {
        Wording wording = wording();
        List<Integer> perRound = new ArrayList<>();
        int total = 0;
        boolean truncated = false;

        while (true) {
            int round = perRound.size() + 1;
            int affected = reporter.frame(0, "Round #" + round, depth -> {
                int count = runRound(request, depth);
                if (count > 0) {
                    reporter.report(depth, wording.pastTense() + " " + count + " resource(s). Attempting another round of "
                        + wording.activity() + " to see if new dependencies were introduced.");
                } else {
                    reporter.report(depth, "No resources were " + wording.participle() + ". "
                        + capitalize(wording.activity()) + " is done.");
                }
                return count;
            });
            perRound.add(affected);
            total += affected;
            log().info("Round {}: {} {} resource(s)", round, wording.participle(), affected);

            if (affected == 0) {
                break;
            }
            if (round >= maxRounds) {
                truncated = true;
                log().warn("Exceeded maximum {} rounds ({}); {} resource(s) {} so far", wording.gerund(), maxRounds,
                    total, wording.participle());
                reporter.report(0, Status.FAILURE, "Exceeded maximum " + wording.gerund() + " rounds (" + maxRounds
                    + "). Terminating " + wording.gerund() + ".");
                break;
            }
        }

        RunSummary summary = new RunSummary(total, perRound.size(), perRound, truncated);
        reporter.frame(0, "Resource " + wording.gerund() + " finished.", depth -> {
            reporter.report(depth, summary.total() + " resource(s) " + wording.participle() + " over "
                + summary.rounds() + " round(s).");
            return null;
        });
        return summary;
    }

    protected final List<ModuleInfo> resolveAll(List<Path> directories, Set<ResourceType> typeFilter)
            throws IOException {
        List<ModuleInfo> modules = new ArrayList<>(directories.size());
        for (Path directory : directories) {
            modules.add(resolver.resolve(directory, typeFilter));
        }
        return modules;
    }

    private static String capitalize(String word) {
        return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }
}

package org.resmover.engine;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import org.resmover.document.ResourceDocumentEditor;
import org.resmover.report.ProgressReporter;
import org.resmover.report.ProgressReporter.Status;
import org.resmover.resources.ResourceDependency;
import org.resmover.scan.ModuleInfo;
import org.resmover.scan.ModuleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes resources a module defines but neither it nor any protected module references.
 * <p>
 * Removing a resource can leave the resources it referenced unused, so rounds are
 * repeated until nothing is removed.
 */
public class ResourceRemover extends AbstractRoundRunner<RemoveRequest> {

    private static final Logger log = LoggerFactory.getLogger(ResourceRemover.class);

    private static final Wording WORDING = new Wording("Removed", "removed", "removal", "removal");

    private final ResourceDocumentEditor editor;

    public ResourceRemover(ModuleResolver resolver, ResourceDocumentEditor editor, ProgressReporter reporter) {
        super(resolver, reporter);
        this.editor = editor;
    }

    /**
     * Runs the removal.
     *
     * @param request the run parameters.
     * @return totals per round.
     * @throws IOException if a module cannot be scanned or a resource file cannot be edited.
     */
    public RunSummary remove(RemoveRequest request) throws IOException {
        log.info("Removing unused resources from {} (protected: {})", request.target(),
            request.protectedDirectories());
        return runRounds(request, request.maxRounds());
    }

    @Override
    protected int runRound(RemoveRequest request, int depth) throws IOException {
        ModuleInfo target = resolver.resolve(request.target(), request.typeFilter());
        List<ModuleInfo> protectedModules = resolveAll(request.protectedDirectories(), request.typeFilter());
        Set<ResourceDependency> keep = RoundPlanner.keepSet(target, protectedModules);

        int removed = editor.removeResources(request.target(), request.typeFilter(), keep, request.ignorePattern());
        if (removed > 0) {
            reporter.report(depth, Status.SUCCESS, "Removed " + removed + " matching resource(s).");
        } else {
            reporter.report(depth, Status.NOTICE, "No resources were removed");
        }
        return removed;
    }

    @Override
    protected Wording wording() {
        return WORDING;
    }

    @Override
    protected Logger log() {
        return log;
    }
}

package org.resmover.engine;

import java.io.IOException;
import java.util.ArrayList;
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
 * Moves resources out of a source module into the destination modules that use them.
 * <p>
 * A resource is moved to a destination only if that destination references it and neither
 * the source, any protected module nor any other destination does. Moving a resource can
 * give a destination new references (a moved layout names its drawables), so rounds are
 * repeated until nothing moves.
 */
public class ResourceMover extends AbstractRoundRunner<MoveRequest> {

    private static final Logger log = LoggerFactory.getLogger(ResourceMover.class);

    private static final Wording WORDING = new Wording("Moved", "moved", "moving", "extraction");

    private final ResourceDocumentEditor editor;

    public ResourceMover(ModuleResolver resolver, ResourceDocumentEditor editor, ProgressReporter reporter) {
        super(resolver, reporter);
        this.editor = editor;
    }

    /**
     * Runs the move.
     *
     * @param request the run parameters.
     * @return totals per round.
     * @throws IOException if a module cannot be scanned or a resource file cannot be edited.
     */
    public RunSummary move(MoveRequest request) throws IOException {
        log.info("Moving {} resource type(s) from {} to {}", request.typeFilter().size(), request.source(),
            request.destinations());
        return runRounds(request, request.maxRounds());
    }

    @Override
    protected int runRound(MoveRequest request, int depth) throws IOException {
        ModuleInfo source = resolver.resolve(request.source(), request.typeFilter());
        List<ModuleInfo> protectedModules = resolveAll(request.protectedDirectories(), request.typeFilter());
        List<ModuleInfo> destinations = resolveAll(request.destinations(), request.typeFilter());

        List<ModuleInfo> blocking = new ArrayList<>(protectedModules);
        blocking.add(source);
        Set<ResourceDependency> blocked = RoundPlanner.union(blocking);
        List<Set<ResourceDependency>> candidates = RoundPlanner.moveCandidates(blocked, destinations);

        int moved = 0;
        for (int j = 0; j < destinations.size(); j++) {
            ModuleInfo destination = destinations.get(j);
            Set<ResourceDependency> toMove = candidates.get(j);
            String path = destination.moduleRoot().toString();

            if (toMove.isEmpty()) {
                reporter.report(depth, Status.NOTICE, path + ": No resources can be moved.");
                continue;
            }
            reporter.report(depth, path + ": Only " + toMove.size() + "/" + destination.dependencies().size()
                + " resource(s) referenced can be extracted due to other modules referencing them.");

            int movedHere = editor.moveResources(request.source(), destination.moduleRoot(), toMove);
            if (movedHere > 0) {
                reporter.report(depth, Status.SUCCESS, path + ": Moved " + movedHere + " matching resource(s).");
            } else {
                reporter.report(depth, Status.NOTICE, path + ": No resources were moved.");
            }
            moved += movedHere;
        }
        return moved;
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

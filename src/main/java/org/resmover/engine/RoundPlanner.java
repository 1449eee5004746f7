package org.resmover.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.resmover.resources.ResourceDependency;
import org.resmover.scan.ModuleInfo;

/**
 * Set algebra deciding what a round may move or must keep.
 */
public final class RoundPlanner {

    private RoundPlanner() {
    }

    /**
     * @return the union of the dependencies of all modules.
     */
    public static Set<ResourceDependency> union(Collection<ModuleInfo> modules) {
        Set<ResourceDependency> all = new HashSet<>();
        for (ModuleInfo module : modules) {
            all.addAll(module.dependencies());
        }
        return all;
    }

    /**
     * Computes, per destination, the resources it alone references.
     * <p>
     * A resource is a candidate for destination {@code j} if {@code j} references it, nothing
     * in {@code blocked} does, and no other destination does. A resource wanted by several
     * destinations goes to none of them.
     *
     * @param blocked      references of the source module and of every protected module.
     * @param destinations destination modules, in order.
     * @return one candidate set per destination, in the same order.
     */
    public static List<Set<ResourceDependency>> moveCandidates(Set<ResourceDependency> blocked,
                                                               List<ModuleInfo> destinations) {
        List<Set<ResourceDependency>> candidates = new ArrayList<>(destinations.size());
        for (int j = 0; j < destinations.size(); j++) {
            Set<ResourceDependency> candidate = new HashSet<>(destinations.get(j).dependencies());
            candidate.removeAll(blocked);
            for (int k = 0; k < destinations.size(); k++) {
                if (k != j) {
                    candidate.removeAll(destinations.get(k).dependencies());
                }
            }
            candidates.add(candidate);
        }
        return candidates;
    }

    /**
     * @return every resource referenced by the target or a protected module.
     */
    public static Set<ResourceDependency> keepSet(ModuleInfo target, List<ModuleInfo> protectedModules) {
        Set<ResourceDependency> keep = new HashSet<>(target.dependencies());
        keep.addAll(union(protectedModules));
        return keep;
    }
}

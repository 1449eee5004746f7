package org.resmover.resources;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Derives the set of resource types a run operates on.
 */
public final class TypeFilter {

    private TypeFilter() {
    }

    /**
     * Resolves the type filter from an include list or an exclude list.
     * <p>
     * A non-empty include list is used as is. Otherwise the filter is every type minus the
     * exclude list, so supplying neither selects all types.
     *
     * @param include types to operate on, may be {@code null} or empty.
     * @param exclude types to leave alone, may be {@code null} or empty.
     * @return an unmodifiable set of types.
     * @throws ConfigurationException if both lists are non-empty.
     */
    public static Set<ResourceType> resolve(Collection<ResourceType> include, Collection<ResourceType> exclude) {
        boolean hasInclude = include != null && !include.isEmpty();
        boolean hasExclude = exclude != null && !exclude.isEmpty();

        if (hasInclude && hasExclude) {
            throw new ConfigurationException("Cannot specify both resources to include and resources to exclude");
        }
        if (hasInclude) {
            return Collections.unmodifiableSet(EnumSet.copyOf(include));
        }

        EnumSet<ResourceType> filter = EnumSet.allOf(ResourceType.class);
        if (hasExclude) {
            filter.removeAll(exclude);
        }
        return Collections.unmodifiableSet(filter);
    }
}

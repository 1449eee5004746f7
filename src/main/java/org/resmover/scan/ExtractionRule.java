package org.resmover.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.resmover.resources.ResourceDependency;

/**
 * One way of spotting a resource reference in a line of source or markup.
 *
 * @param name      short identifier used in diagnostics.
 * @param pattern   the pattern searched for (with {@link Matcher#find()}) in each line.
 * @param extractor builds a dependency from a match; empty drops the match.
 */
public record ExtractionRule(
        String name,
        Pattern pattern,
        Function<Matcher, Optional<ResourceDependency>> extractor
) {

    /**
     * Applies this rule to a single line.
     *
     * @param line the line to search.
     * @return every dependency found, in match order.
     */
    public List<ResourceDependency> extract(String line) {
        List<ResourceDependency> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(line);
        while (matcher.find()) {
            extractor.apply(matcher).ifPresent(found::add);
        }
        return found;
    }
}

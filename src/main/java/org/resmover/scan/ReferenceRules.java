package org.resmover.scan;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.resmover.resources.ResourceDependency;
import org.resmover.resources.ResourceType;

/**
 * The built-in reference extraction rules.
 * <p>
 * New reference syntaxes are supported by adding a rule to {@link #defaults()}.
 */
public final class ReferenceRules {

    private static final String RAW_TYPE_NAMES = Arrays.stream(ResourceType.values())
        .map(ResourceType::rawName)
        .sorted(Comparator.comparingInt(String::length).reversed())
        .collect(Collectors.joining("|"));

    private static final Pattern CODE_USAGE_PATTERN =
        Pattern.compile("\\b(" + RAW_TYPE_NAMES + ")\\.(\\w+)");
    private static final Pattern MARKUP_USAGE_PATTERN =
        Pattern.compile("@([A-Za-z]+)/([\\w.]+)");
    private static final Pattern STYLE_PARENT_PATTERN =
        Pattern.compile("parent\\s*=\\s*\"([\\w.]+)\"");
    private static final Pattern DATABINDING_IMPORT_PATTERN =
        Pattern.compile("databinding\\.(\\w+)");
    private static final Pattern IMPLICIT_STYLE_PARENT_PATTERN =
        Pattern.compile("<style\\s+name\\s*=\\s*\"([\\w.]+)\\.\\w+\"");

    private static final String BINDING_SUFFIX = "Binding";

    /** {@code R.drawable.ic_star} */
    public static final ExtractionRule CODE_USAGE = new ExtractionRule(
        "code-usage",
        CODE_USAGE_PATTERN,
        m -> ResourceType.classify(m.group(1)).map(type -> new ResourceDependency(type, m.group(2))));

    /** {@code @drawable/ic_star}, {@code @style/Widget.Button} */
    public static final ExtractionRule MARKUP_USAGE = new ExtractionRule(
        "markup-usage",
        MARKUP_USAGE_PATTERN,
        m -> ResourceType.classify(m.group(1)).map(type -> ResourceDependency.of(type, m.group(2))));

    /** {@code parent="Widget.Button"} */
    public static final ExtractionRule STYLE_PARENT = new ExtractionRule(
        "style-parent",
        STYLE_PARENT_PATTERN,
        m -> Optional.of(ResourceDependency.of(ResourceType.STYLE, m.group(1))));

    /** {@code import com.example.databinding.ActivityMainBinding} */
    public static final ExtractionRule DATABINDING_USAGE = new ExtractionRule(
        "databinding-usage",
        DATABINDING_IMPORT_PATTERN,
        m -> Optional.of(new ResourceDependency(ResourceType.LAYOUT, bindingClassToLayoutName(m.group(1)))));

    /** {@code <style name="Widget.Button.Small">} inherits {@code Widget.Button} */
    public static final ExtractionRule IMPLICIT_STYLE_PARENT = new ExtractionRule(
        "implicit-style-parent",
        IMPLICIT_STYLE_PARENT_PATTERN,
        m -> Optional.of(ResourceDependency.of(ResourceType.STYLE, m.group(1))));

    private static final List<ExtractionRule> DEFAULTS = List.of(
        CODE_USAGE,
        MARKUP_USAGE,
        STYLE_PARENT,
        DATABINDING_USAGE,
        IMPLICIT_STYLE_PARENT
    );

    private ReferenceRules() {
    }

    /**
     * @return the rules applied by a default {@link ReferenceScanner}.
     */
    public static List<ExtractionRule> defaults() {
        return DEFAULTS;
    }

    /**
     * Recovers the layout name from a generated binding class name:
     * {@code ActivityMainBinding} becomes {@code activity_main}.
     *
     * @param className the simple binding class name.
     * @return the snake_case layout name.
     */
    static String bindingClassToLayoutName(String className) {
        String base = className.endsWith(BINDING_SUFFIX) && className.length() > BINDING_SUFFIX.length()
            ? className.substring(0, className.length() - BINDING_SUFFIX.length())
            : className;

        StringBuilder layoutName = new StringBuilder(base.length() + 4);
        for (int i = 0; i < base.length(); i++) {
            char c = base.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    layoutName.append('_');
                }
                layoutName.append(Character.toLowerCase(c));
            } else {
                layoutName.append(c);
            }
        }
        return layoutName.toString();
    }
}

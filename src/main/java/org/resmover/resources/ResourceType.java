package org.resmover.resources;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of Android resource categories.
 * <p>
 * Each type carries a canonical raw name that is used as the {@code R.<raw>} code token,
 * the {@code @<raw>/} markup prefix, the element tag inside {@code values} documents and
 * the name of the resource directory ({@code res/<raw>[-qualifier]}). A few element tags
 * are aliases of a canonical type (e.g. {@code string-array} is an {@link #ARRAY}).
 */
public enum ResourceType {
    ANIMATION("anim"),
    ANIMATOR("animator"),
    ARRAY("array", "string-array", "integer-array"),
    ATTR("attr"),
    BOOL("bool"),
    COLOR("color"),
    DIMEN("dimen"),
    DRAWABLE("drawable"),
    FONT("font"),
    FRACTION("fraction"),
    ID("id"),
    INTEGER("integer"),
    INTERPOLATOR("interpolator"),
    LAYOUT("layout"),
    MENU("menu"),
    MIPMAP("mipmap"),
    NAVIGATION("navigation"),
    PLURALS("plurals"),
    RAW("raw"),
    STRING("string"),
    STYLE("style"),
    STYLEABLE("styleable", "declare-styleable"),
    TRANSITION("transition"),
    XML("xml");

    private static final Map<String, ResourceType> BY_TOKEN;

    static {
        Map<String, ResourceType> tokens = new HashMap<>();
        for (ResourceType type : values()) {
            tokens.put(type.rawName, type);
            for (String alias : type.aliases) {
                tokens.put(alias, type);
            }
        }
        BY_TOKEN = Collections.unmodifiableMap(tokens);
    }

    private final String rawName;
    private final List<String> aliases;

    ResourceType(String rawName, String... aliases) {
        this.rawName = rawName;
        this.aliases = List.of(aliases);
    }

    /**
     * @return the canonical token of this type, e.g. {@code drawable}.
     */
    public String rawName() {
        return rawName;
    }

    /**
     * Maps a raw token (canonical name or element tag alias) to its type.
     *
     * @param token the token to classify, may be {@code null}.
     * @return the matching type, or empty when the token is not a resource type.
     */
    public static Optional<ResourceType> classify(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TOKEN.get(token));
    }

    /**
     * Classifies a resource directory name, ignoring its configuration qualifiers.
     * {@code drawable-hdpi} is a {@link #DRAWABLE}; {@code values-fr} has no type.
     *
     * @param directoryName the bare directory name.
     * @return the matching type, or empty.
     */
    public static Optional<ResourceType> fromDirectoryName(String directoryName) {
        if (directoryName == null) {
            return Optional.empty();
        }
        int qualifierStart = directoryName.indexOf('-');
        String base = qualifierStart >= 0 ? directoryName.substring(0, qualifierStart) : directoryName;
        return classify(base);
    }
}

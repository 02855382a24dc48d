package com.skillmd.federation.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Identifies where a skill came from.
 *
 * A plain value type rather than an enum: new providers can be registered
 * without touching this class. The well-known ids below cover the sources the
 * platform ships with; anything else is carried through verbatim.
 *
 * @param id stable identifier, used as a map key throughout the federation
 */
public record SourceType(@JsonValue String id) {

    public static final SourceType LOCAL     = new SourceType("local");
    public static final SourceType SKILLS_SH = new SourceType("skills.sh");
    public static final SourceType GITHUB    = new SourceType("github");
    public static final SourceType GITLAB    = new SourceType("gitlab");
    public static final SourceType BITBUCKET = new SourceType("bitbucket");
    public static final SourceType CODEBERG  = new SourceType("codeberg");

    private static final List<SourceType> WELL_KNOWN =
            List.of(LOCAL, SKILLS_SH, GITHUB, GITLAB, BITBUCKET, CODEBERG);

    private static final Map<SourceType, String> LABELS = Map.of(
            LOCAL,     "Local",
            SKILLS_SH, "SKILLS.sh",
            GITHUB,    "GitHub",
            GITLAB,    "GitLab",
            BITBUCKET, "Bitbucket",
            CODEBERG,  "Codeberg");

    private static final Map<SourceType, String> BADGE_COLORS = Map.of(
            LOCAL,     "border-terminal-accent text-terminal-accent",
            SKILLS_SH, "border-purple-500 text-purple-400",
            GITHUB,    "border-gray-400 text-gray-300",
            GITLAB,    "border-orange-500 text-orange-400",
            BITBUCKET, "border-blue-500 text-blue-400",
            CODEBERG,  "border-green-500 text-green-400");

    private static final String DEFAULT_BADGE_COLOR = "border-terminal-border text-terminal-muted";

    public SourceType {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("source id must not be blank");
        }
    }

    /**
     * Parse a source id. Well-known ids match case-insensitively and resolve
     * to their canonical constant.
     */
    @JsonCreator
    public static SourceType of(String id) {
        String trimmed = id == null ? "" : id.trim();
        for (SourceType known : WELL_KNOWN) {
            if (known.id.equalsIgnoreCase(trimmed)) {
                return known;
            }
        }
        return new SourceType(trimmed);
    }

    /** All sources the platform ships with, in display order. */
    public static List<SourceType> defaultEnabled() {
        return WELL_KNOWN;
    }

    public boolean isLocal() {
        return LOCAL.equals(this);
    }

    /** Human-readable name, e.g. "GitHub". Unknown sources use their id. */
    public String label() {
        return LABELS.getOrDefault(this, id);
    }

    /** CSS classes for the source badge in the browse UI. */
    public String badgeColor() {
        return BADGE_COLORS.getOrDefault(this, DEFAULT_BADGE_COLOR);
    }

    /** Lower-cased id, safe for metric tags. */
    public String tag() {
        return id.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return id;
    }
}

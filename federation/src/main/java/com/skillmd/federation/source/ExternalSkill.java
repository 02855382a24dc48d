package com.skillmd.federation.source;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A skill document from any source, with its body optionally loaded.
 *
 * The {@code id} is only unique within its {@code source}: two skills are the
 * same entity iff both (source, id) match, so {@link #equals} and
 * {@link #hashCode} look at nothing else.
 *
 * @param id          provider-scoped identifier (e.g. "owner/repo/path/SKILL.md")
 * @param slug        URL-friendly name
 * @param name        display name
 * @param description one-line summary
 * @param tags        tag set; never null
 * @param content     SKILL.md body; empty until fetched lazily
 * @param source      the provider that produced this skill
 * @param sourceUrl   canonical link to the original document
 * @param repoOwner   owning user or group, when the source is a code host
 * @param repoName    repository name, when the source is a code host
 * @param stars       popularity score; 0 when unknown
 * @param contentUrl  where to fetch {@code content} from, if not yet loaded
 * @param version     declared version, if any
 * @param updatedAt   last update, if known
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ExternalSkill(
        String       id,
        String       slug,
        String       name,
        String       description,
        List<String> tags,
        String       content,
        SourceType   source,
        String       sourceUrl,
        String       repoOwner,
        String       repoName,
        int          stars,
        String       contentUrl,
        String       version,
        Instant      updatedAt) {

    public ExternalSkill {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        tags    = tags == null ? List.of() : List.copyOf(tags);
        content = content == null ? "" : content;
        name    = name == null ? "" : name;
    }

    public static Builder builder(SourceType source, String id) {
        return new Builder(source, id);
    }

    @JsonIgnore
    public boolean hasContent() {
        return !content.isEmpty();
    }

    /** Copy of this skill with the body filled in. */
    public ExternalSkill withContent(String newContent) {
        return new ExternalSkill(id, slug, name, description, tags, newContent, source,
                sourceUrl, repoOwner, repoName, stars, contentUrl, version, updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExternalSkill other)) return false;
        return source.equals(other.source) && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, id);
    }

    @Override
    public String toString() {
        return "ExternalSkill[" + source + ":" + id + "]";
    }

    public static final class Builder {
        private final SourceType source;
        private final String id;
        private String slug;
        private String name;
        private String description;
        private List<String> tags;
        private String content;
        private String sourceUrl;
        private String repoOwner;
        private String repoName;
        private int stars;
        private String contentUrl;
        private String version;
        private Instant updatedAt;

        private Builder(SourceType source, String id) {
            this.source = source;
            this.id = id;
        }

        public Builder slug(String slug)               { this.slug = slug; return this; }
        public Builder name(String name)               { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder tags(List<String> tags)         { this.tags = tags; return this; }
        public Builder content(String content)         { this.content = content; return this; }
        public Builder sourceUrl(String sourceUrl)     { this.sourceUrl = sourceUrl; return this; }
        public Builder repoOwner(String repoOwner)     { this.repoOwner = repoOwner; return this; }
        public Builder repoName(String repoName)       { this.repoName = repoName; return this; }
        public Builder stars(int stars)                { this.stars = stars; return this; }
        public Builder contentUrl(String contentUrl)   { this.contentUrl = contentUrl; return this; }
        public Builder version(String version)         { this.version = version; return this; }
        public Builder updatedAt(Instant updatedAt)    { this.updatedAt = updatedAt; return this; }

        public ExternalSkill build() {
            return new ExternalSkill(id, slug, name, description, tags, content, source,
                    sourceUrl, repoOwner, repoName, stars, contentUrl, version, updatedAt);
        }
    }
}

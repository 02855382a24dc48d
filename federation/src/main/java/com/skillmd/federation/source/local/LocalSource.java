package com.skillmd.federation.source.local;

import com.skillmd.federation.source.CallContext;
import com.skillmd.federation.source.ExternalSkill;
import com.skillmd.federation.source.SearchOptions;
import com.skillmd.federation.source.SearchResult;
import com.skillmd.federation.source.Source;
import com.skillmd.federation.source.SourceType;

import java.util.List;
import java.util.Optional;

/**
 * Adapts the local skill registry to {@link Source}.
 *
 * Disabled when switched off or when no store is available. Local results are
 * always current, so the federation never caches them.
 */
public class LocalSource implements Source {

    private final LocalSkillStore store;
    private volatile boolean enabled = true;

    public LocalSource(LocalSkillStore store) {
        this.store = store;
    }

    @Override
    public SourceType name() {
        return SourceType.LOCAL;
    }

    @Override
    public boolean enabled() {
        return enabled && store != null;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * A non-empty query searches; otherwise the first tag filters; otherwise
     * everything is listed.
     */
    @Override
    public SearchResult search(CallContext ctx, SearchOptions options) {
        SearchOptions opts = options.normalized();
        if (store == null) {
            return SearchResult.empty(name(), opts);
        }

        SkillPage page;
        if (!opts.query().isBlank()) {
            page = store.search(opts.query(), opts.page(), opts.perPage());
        } else if (!opts.tags().isEmpty()) {
            page = store.listByTag(opts.tags().get(0), opts.page(), opts.perPage());
        } else {
            page = store.list(opts.page(), opts.perPage());
        }

        List<ExternalSkill> skills = page.skills().stream().map(this::toExternal).toList();
        return SearchResult.of(name(), opts, skills, page.total());
    }

    @Override
    public Optional<ExternalSkill> getSkill(CallContext ctx, String id) {
        if (store == null || id == null || id.isBlank()) {
            return Optional.empty();
        }
        return store.findByIdOrSlug(id).map(this::toExternal);
    }

    @Override
    public String getContent(CallContext ctx, ExternalSkill skill) {
        if (skill.hasContent()) {
            return skill.content();
        }
        if (store == null) {
            return "";
        }
        String key = skill.slug() != null ? skill.slug() : skill.id();
        return store.findByIdOrSlug(key)
                .map(StoredSkill::content)
                .orElse("");
    }

    private ExternalSkill toExternal(StoredSkill s) {
        return ExternalSkill.builder(name(), s.id())
                .slug(s.slug())
                .name(s.name())
                .description(s.description())
                .content(s.content())
                .tags(s.tags())
                .sourceUrl("/skill/" + s.slug())
                .version(s.version())
                .updatedAt(s.updatedAt())
                .build();
    }
}

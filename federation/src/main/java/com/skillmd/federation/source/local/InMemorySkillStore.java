package com.skillmd.federation.source.local;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Process-local {@link LocalSkillStore}, used when no persistent registry is
 * wired in. Listing order is by name so pagination is stable.
 */
public class InMemorySkillStore implements LocalSkillStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySkillStore.class);

    private final Map<String, StoredSkill> byId = new ConcurrentHashMap<>();

    public void save(StoredSkill skill) {
        byId.put(skill.id(), skill);
        log.debug("Stored local skill '{}' ({})", skill.slug(), skill.id());
    }

    public void delete(String id) {
        byId.remove(id);
    }

    @Override
    public SkillPage search(String query, int page, int perPage) {
        String needle = query.toLowerCase(Locale.ROOT);
        return page(s -> contains(s.name(), needle)
                || contains(s.description(), needle)
                || contains(s.slug(), needle), page, perPage);
    }

    @Override
    public SkillPage listByTag(String tag, int page, int perPage) {
        return page(s -> s.tags().stream().anyMatch(t -> t.equalsIgnoreCase(tag)), page, perPage);
    }

    @Override
    public SkillPage list(int page, int perPage) {
        return page(s -> true, page, perPage);
    }

    @Override
    public Optional<StoredSkill> findByIdOrSlug(String idOrSlug) {
        StoredSkill byKey = byId.get(idOrSlug);
        if (byKey != null) {
            return Optional.of(byKey);
        }
        return byId.values().stream()
                .filter(s -> idOrSlug.equals(s.slug()))
                .findFirst();
    }

    private SkillPage page(Predicate<StoredSkill> filter, int page, int perPage) {
        List<StoredSkill> matches = byId.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(StoredSkill::name, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
        long from = Math.max(0L, (page - 1L) * perPage);
        if (from >= matches.size()) {
            return new SkillPage(List.of(), matches.size());
        }
        int to = (int) Math.min(matches.size(), from + perPage);
        return new SkillPage(matches.subList((int) from, to), matches.size());
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}

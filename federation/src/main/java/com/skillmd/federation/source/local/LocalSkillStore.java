package com.skillmd.federation.source.local;

import java.util.Optional;

/**
 * Read access to the local skill registry.
 *
 * The persistent registry lives outside this module; it plugs in by
 * providing a bean of this type. Pages are 1-based.
 */
public interface LocalSkillStore {

    /** Full-text match on name, description and slug. */
    SkillPage search(String query, int page, int perPage);

    SkillPage listByTag(String tag, int page, int perPage);

    SkillPage list(int page, int perPage);

    /** Look up by id first, then by slug. */
    Optional<StoredSkill> findByIdOrSlug(String idOrSlug);
}

package com.skillmd.federation.source.local;

import java.util.List;

/**
 * One page of local skills plus the number of matches across all pages.
 */
public record SkillPage(List<StoredSkill> skills, int total) {

    public SkillPage {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}

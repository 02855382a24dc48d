package com.skillmd.federation.source.local;

import java.time.Instant;
import java.util.List;

/**
 * A skill as kept by the local registry.
 */
public record StoredSkill(
        String       id,
        String       slug,
        String       name,
        String       description,
        String       content,
        List<String> tags,
        String       version,
        Instant      updatedAt) {

    public StoredSkill {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}

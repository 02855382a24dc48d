package com.skillmd.federation.source;

import java.util.Optional;

/**
 * A pluggable provider of skills: the local registry or one external
 * code-hosting / search backend.
 *
 * <p>Failure contract:
 * <ul>
 *   <li>Soft upstream failures (credentials rejected, upstream throttling)
 *       must be absorbed and reported as an empty, zero-total
 *       {@link SearchResult}. One provider being throttled must never look
 *       like an error to the federation.</li>
 *   <li>Transport and decoding failures are thrown as
 *       {@link SourceException}.</li>
 *   <li>{@link #getSkill} returns {@link Optional#empty()} for unknown ids
 *       and for ids it cannot parse; it never throws for a bad id.</li>
 *   <li>{@link #getContent} is idempotent: if the skill already carries its
 *       content, that content is returned without an upstream call.</li>
 * </ul>
 *
 * Every call receives the caller's {@link CallContext}; implementations
 * should bound their I/O by it.
 */
public interface Source {

    /** Constant for the lifetime of the instance. */
    SourceType name();

    /** Current availability; may change at runtime. */
    boolean enabled();

    SearchResult search(CallContext ctx, SearchOptions options);

    Optional<ExternalSkill> getSkill(CallContext ctx, String id);

    String getContent(CallContext ctx, ExternalSkill skill);
}

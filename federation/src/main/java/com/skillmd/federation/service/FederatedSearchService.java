package com.skillmd.federation.service;

import com.skillmd.federation.cache.SearchCache;
import com.skillmd.federation.cache.SkillCache;
import com.skillmd.federation.ratelimit.RateLimit;
import com.skillmd.federation.ratelimit.SourceRateLimiter;
import com.skillmd.federation.source.CallContext;
import com.skillmd.federation.source.ExternalSkill;
import com.skillmd.federation.source.SearchOptions;
import com.skillmd.federation.source.SearchResult;
import com.skillmd.federation.source.Source;
import com.skillmd.federation.source.SourceException;
import com.skillmd.federation.source.SourceType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Searches every registered skill source at once and merges the answers.
 *
 * <p>Each fan-out search dispatches one unit of work per target source onto
 * that source's own bounded worker pool. A unit runs the same pipeline as a
 * single-source call:
 * <pre>
 *   search cache hit?  → contribute the cached result
 *   rate-limit wait    → bounded by the caller's {@link CallContext}
 *   source.search()    → timed, stamped with its source
 *   cache store        → skipped for the local source
 * </pre>
 * Units are isolated from each other: a source that fails or whose wait is
 * cancelled drops out, and the remaining sources still make up the result.
 * No lock is held across a rate-limit wait or a source call.
 *
 * <p>The service exclusively owns its caches, its rate limiter and its worker
 * pools; {@link #close()} releases all of them.
 *
 * <p>Every source call is timed and counted:
 * <pre>
 *   skillmd.source.calls{source, operation, status="success|error|cached|cancelled"}
 *   skillmd.source.duration{source, operation}
 * </pre>
 */
public class FederatedSearchService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FederatedSearchService.class);

    /**
     * Presentation order of merged results: local skills first, then by
     * stars (descending), then by name. Applied with a stable sort.
     */
    static final Comparator<ExternalSkill> MERGE_ORDER = Comparator
            .comparingInt((ExternalSkill s) -> s.source().isLocal() ? 0 : 1)
            .thenComparing(ExternalSkill::stars, Comparator.reverseOrder())
            .thenComparing(ExternalSkill::name);

    /**
     * Tunables for one service instance.
     *
     * @param rateLimits    per-source policies; unknown sources get {@link RateLimit#FALLBACK}
     * @param searchTtl     lifetime of cached search results
     * @param skillTtl      lifetime of cached single skills
     * @param sweepInterval how often the caches purge expired entries
     * @param fanoutThreads upper bound on concurrently running calls to any one source
     */
    public record Settings(
            Map<SourceType, RateLimit> rateLimits,
            Duration searchTtl,
            Duration skillTtl,
            Duration sweepInterval,
            int      fanoutThreads) {

        public static Settings defaults() {
            return new Settings(RateLimit.defaults(), SearchCache.DEFAULT_TTL,
                    SkillCache.DEFAULT_TTL, Duration.ofMinutes(1), 8);
        }
    }

    private final Map<SourceType, Source> sources = new ConcurrentHashMap<>();
    private final SearchCache       searchCache;
    private final SkillCache        skillCache;
    private final SourceRateLimiter rateLimiter;
    private final Map<SourceType, ExecutorService> workers = new ConcurrentHashMap<>();
    private final int               threadsPerSource;
    private final MeterRegistry     meterRegistry;

    public FederatedSearchService(Settings settings, MeterRegistry meterRegistry) {
        this.searchCache   = new SearchCache(settings.searchTtl(), settings.sweepInterval());
        this.skillCache    = new SkillCache(settings.skillTtl(), settings.sweepInterval());
        this.rateLimiter   = new SourceRateLimiter(settings.rateLimits());
        this.meterRegistry = meterRegistry;
        this.threadsPerSource = settings.fanoutThreads();
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /** Add a source, replacing any source already registered under its name. */
    public void registerSource(Source source) {
        Source previous = sources.put(source.name(), source);
        log.info("{} source '{}' ({})", previous == null ? "Registered" : "Replaced",
                source.name(), source.getClass().getSimpleName());
    }

    public Optional<Source> getSource(SourceType type) {
        return Optional.ofNullable(sources.get(type));
    }

    /** Registered sources that currently report themselves enabled, sorted by id. */
    public List<SourceType> enabledSources() {
        return sources.values().stream()
                .filter(Source::enabled)
                .map(Source::name)
                .sorted(Comparator.comparing(SourceType::id))
                .toList();
    }

    /** Replace one source's rate-limit policy; other sources keep their buckets. */
    public void setRateLimit(SourceType type, RateLimit limit) {
        rateLimiter.setLimit(type, limit);
    }

    /** Tokens currently available for {@code type}, or -1 when unlimited. */
    public double availableTokens(SourceType type) {
        return rateLimiter.availableTokens(type);
    }

    // ------------------------------------------------------------------
    // Fan-out search
    // ------------------------------------------------------------------

    /** Search every enabled source. */
    public FederatedResult search(CallContext ctx, SearchOptions options) {
        return searchSources(ctx, options, List.of());
    }

    /**
     * Search the given sources (all enabled sources when {@code filter} is
     * empty) concurrently and merge the results.
     *
     * Never throws: a source that fails is logged, listed in
     * {@link FederatedResult#errors()} and left out; a source whose rate-limit
     * wait is cancelled is logged and left out.
     */
    public FederatedResult searchSources(CallContext ctx, SearchOptions options,
                                         Collection<SourceType> filter) {
        long start = System.nanoTime();
        SearchOptions opts = options.normalized();

        List<Source> targets = resolveTargets(filter);
        if (targets.isEmpty()) {
            log.debug("No enabled sources to search for query '{}'", opts.query());
            return FederatedResult.empty();
        }

        List<CompletableFuture<UnitOutcome>> units = new ArrayList<>(targets.size());
        for (Source source : targets) {
            units.add(dispatch(ctx, source, opts));
        }

        List<UnitOutcome> outcomes = new ArrayList<>(units.size());
        for (int i = 0; i < units.size(); i++) {
            outcomes.add(joinUnit(units.get(i), targets.get(i).name()));
        }

        FederatedResult merged = merge(outcomes);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.info("Federated search '{}' page {}: {} skills from {} sources in {} ms ({} failed)",
                opts.query(), opts.page(), merged.skills().size(), merged.bySource().size(),
                elapsed.toMillis(), merged.errors().size());
        return merged.withSearchTime(elapsed);
    }

    // ------------------------------------------------------------------
    // Single-source operations; these propagate the source's error
    // ------------------------------------------------------------------

    /**
     * Search exactly one source through the cache and its rate limit.
     *
     * @return the source's result, or an empty one if it is unknown or disabled
     * @throws SourceException if the wait is cancelled or the source fails
     */
    public SearchResult searchSource(CallContext ctx, SourceType type, SearchOptions options) {
        SearchOptions opts = options.normalized();
        Source source = availableSource(type);
        if (source == null) {
            return SearchResult.empty(type, opts);
        }
        return fetchSearch(ctx, source, opts);
    }

    /**
     * Look up one skill by its source-scoped id.
     *
     * @return the skill, or empty if the source is unknown or disabled or the
     *         source does not know the id
     * @throws SourceException if the wait is cancelled or the source fails
     */
    public Optional<ExternalSkill> getSkill(CallContext ctx, SourceType type, String id) {
        Source source = availableSource(type);
        if (source == null) {
            return Optional.empty();
        }

        Optional<ExternalSkill> cached = skillCache.get(type, id);
        if (cached.isPresent()) {
            count(type, "get_skill", "cached");
            return cached;
        }

        rateLimiter.acquire(type, ctx);
        Optional<ExternalSkill> skill = instrument(type, "get_skill", () -> source.getSkill(ctx, id));
        if (skill.isPresent() && !type.isLocal()) {
            skillCache.put(type, id, skill.get());
        }
        return skill;
    }

    /**
     * Return the skill's body, fetching it from its source if not yet loaded.
     *
     * @return the content, or "" if the skill's source is unknown or disabled
     * @throws SourceException if the wait is cancelled or the source fails
     */
    public String getContent(CallContext ctx, ExternalSkill skill) {
        if (skill.hasContent()) {
            return skill.content();
        }
        Source source = availableSource(skill.source());
        if (source == null) {
            return "";
        }
        rateLimiter.acquire(skill.source(), ctx);
        String content = instrument(skill.source(), "get_content", () -> source.getContent(ctx, skill));
        return content == null ? "" : content;
    }

    /** Drop every cached search result and skill. */
    public void clearCache() {
        searchCache.clear();
        skillCache.clear();
        log.info("Federation caches cleared");
    }

    @Override
    public void close() {
        workers.values().forEach(ExecutorService::shutdownNow);
        searchCache.close();
        skillCache.close();
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    /** What one fan-out unit contributed: a result, an error, or nothing. */
    private record UnitOutcome(SourceType source, SearchResult result, String error) {
        static UnitOutcome contributed(SearchResult result) { return new UnitOutcome(result.source(), result, null); }
        static UnitOutcome failed(SourceType source, String error) { return new UnitOutcome(source, null, error); }
        static UnitOutcome dropped(SourceType source) { return new UnitOutcome(source, null, null); }
    }

    private List<Source> resolveTargets(Collection<SourceType> filter) {
        Collection<Source> candidates = (filter == null || filter.isEmpty())
                ? sources.values()
                : filter.stream().distinct().map(sources::get).filter(Objects::nonNull).toList();
        return candidates.stream()
                .filter(Source::enabled)
                .sorted(Comparator.comparing(s -> s.name().id()))
                .toList();
    }

    private Source availableSource(SourceType type) {
        Source source = sources.get(type);
        if (source == null) {
            log.debug("No source registered as '{}'", type);
            return null;
        }
        if (!source.enabled()) {
            log.debug("Source '{}' is disabled", type);
            return null;
        }
        return source;
    }

    private CompletableFuture<UnitOutcome> dispatch(CallContext ctx, Source source, SearchOptions opts) {
        try {
            return CompletableFuture.supplyAsync(() -> runUnit(ctx, source, opts), workersFor(source.name()));
        } catch (RejectedExecutionException e) {
            log.error("Could not dispatch search to '{}': {}", source.name(), e.getMessage());
            return CompletableFuture.completedFuture(
                    UnitOutcome.failed(source.name(), "search not dispatched: " + e.getMessage()));
        }
    }

    /**
     * Each source queues on its own pool, so units stuck waiting on one
     * source's rate limit or I/O never hold threads another source needs.
     */
    private ExecutorService workersFor(SourceType type) {
        return workers.computeIfAbsent(type, t -> {
            AtomicInteger threadSeq = new AtomicInteger();
            return Executors.newFixedThreadPool(threadsPerSource, r -> {
                Thread thread = new Thread(r, "federation-" + t.tag() + "-" + threadSeq.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        });
    }

    private UnitOutcome joinUnit(CompletableFuture<UnitOutcome> unit, SourceType type) {
        try {
            return unit.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Search unit for '{}' ended abnormally: {}", type, cause.getMessage(), cause);
            return UnitOutcome.failed(type, String.valueOf(cause.getMessage()));
        }
    }

    /** One fan-out unit. Converts every failure into an outcome. */
    private UnitOutcome runUnit(CallContext ctx, Source source, SearchOptions opts) {
        SourceType type = source.name();
        MDC.put("source", type.id());
        MDC.put("operation", "search");
        try {
            return UnitOutcome.contributed(fetchSearch(ctx, source, opts));
        } catch (SourceException e) {
            if (e.isCancellation()) {
                log.warn("Search of '{}' abandoned: {}", type, e.getMessage());
                return UnitOutcome.dropped(type);
            }
            log.error("Search of '{}' failed: {}", type, e.getMessage(), e);
            return UnitOutcome.failed(type, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Search of '{}' failed unexpectedly: {}", type, e.getMessage(), e);
            return UnitOutcome.failed(type, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            MDC.remove("source");
            MDC.remove("operation");
        }
    }

    /** cache → rate limit → source call → cache store. Throws on failure. */
    private SearchResult fetchSearch(CallContext ctx, Source source, SearchOptions opts) {
        SourceType type = source.name();

        Optional<SearchResult> cached = searchCache.get(type, opts);
        if (cached.isPresent()) {
            count(type, "search", "cached");
            return cached.get();
        }

        rateLimiter.acquire(type, ctx);

        long callStart = System.nanoTime();
        SearchResult raw = instrument(type, "search", () -> source.search(ctx, opts));
        if (raw == null) {
            raw = SearchResult.empty(type, opts);
        }
        SearchResult result = raw.stamped(Duration.ofNanos(System.nanoTime() - callStart), type);

        if (!type.isLocal()) {
            searchCache.put(type, opts, result);
        }
        return result;
    }

    private FederatedResult merge(List<UnitOutcome> outcomes) {
        List<ExternalSkill> skills = new ArrayList<>();
        Map<SourceType, Integer>  bySource    = new LinkedHashMap<>();
        Map<SourceType, String>   errors      = new LinkedHashMap<>();
        Map<SourceType, Duration> sourceTimes = new LinkedHashMap<>();
        int total = 0;

        for (UnitOutcome outcome : outcomes) {
            if (outcome.error() != null) {
                errors.put(outcome.source(), outcome.error());
            }
            SearchResult result = outcome.result();
            if (result == null) {
                continue;
            }
            skills.addAll(result.skills());
            total += result.total();
            bySource.put(outcome.source(), result.total());
            sourceTimes.put(outcome.source(), result.searchTime());
        }

        skills.sort(MERGE_ORDER);
        return new FederatedResult(skills, total, bySource, errors, sourceTimes, Duration.ZERO);
    }

    private <T> T instrument(SourceType type, String operation, Supplier<T> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return call.get();
        } catch (SourceException e) {
            status = e.isCancellation() ? "cancelled" : "error";
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("skillmd.source.duration",
                    "source", type.tag(), "operation", operation));
            count(type, operation, status);
        }
    }

    private void count(SourceType type, String operation, String status) {
        meterRegistry.counter("skillmd.source.calls",
                "source", type.tag(), "operation", operation, "status", status).increment();
    }
}

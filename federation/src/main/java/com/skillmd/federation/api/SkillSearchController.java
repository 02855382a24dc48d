package com.skillmd.federation.api;

import com.skillmd.federation.api.dto.FederatedSearchResponse;
import com.skillmd.federation.api.dto.SearchResultResponse;
import com.skillmd.federation.api.dto.SourceInfo;
import com.skillmd.federation.service.FederatedResult;
import com.skillmd.federation.service.FederatedSearchService;
import com.skillmd.federation.source.CallContext;
import com.skillmd.federation.source.ExternalSkill;
import com.skillmd.federation.source.SearchOptions;
import com.skillmd.federation.source.SourceType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.List;

/**
 * REST API over the skill federation.
 *
 * GET    /api/sources                                 enabled sources
 * GET    /api/skills/search                           search all (or some) sources at once
 * GET    /api/sources/{source}/search                 search one source
 * GET    /api/sources/{source}/skills/{id...}         look up one skill
 * GET    /api/sources/{source}/content/{id...}        the skill's SKILL.md body
 * DELETE /api/cache                                   drop cached searches and skills
 *
 * Skill ids are source-scoped and may contain slashes (owner/repo/path), so
 * they are matched as the remainder of the path.
 */
@RestController
@RequestMapping("/api")
public class SkillSearchController {

    private final FederatedSearchService federation;
    private final Duration               requestTimeout;

    public SkillSearchController(FederatedSearchService federation,
                                 @Value("${skillmd.federation.request-timeout:20s}") Duration requestTimeout) {
        this.federation     = federation;
        this.requestTimeout = requestTimeout;
    }

    @GetMapping("/sources")
    public List<SourceInfo> sources() {
        return federation.enabledSources().stream()
                .map(type -> SourceInfo.from(type, federation.availableTokens(type)))
                .toList();
    }

    /**
     * Federated search. Always 200: sources that fail are listed under
     * {@code errors} and the rest still answer.
     *
     * Example:
     *   curl 'http://localhost:8080/api/skills/search?q=pdf&sources=github,local'
     */
    @GetMapping("/skills/search")
    public FederatedSearchResponse search(@RequestParam(name = "q", defaultValue = "") String query,
                                          @RequestParam(defaultValue = "") List<String> tags,
                                          @RequestParam(defaultValue = "1") int page,
                                          @RequestParam(defaultValue = "20") int perPage,
                                          @RequestParam(defaultValue = "") List<String> sources) {
        SearchOptions options = new SearchOptions(query, nonBlank(tags), page, perPage).normalized();
        List<SourceType> filter = nonBlank(sources).stream().map(SourceType::of).toList();

        FederatedResult result = federation.searchSources(newContext(), options, filter);
        return FederatedSearchResponse.from(result, options);
    }

    @GetMapping("/sources/{source}/search")
    public SearchResultResponse searchSource(@PathVariable String source,
                                             @RequestParam(name = "q", defaultValue = "") String query,
                                             @RequestParam(defaultValue = "") List<String> tags,
                                             @RequestParam(defaultValue = "1") int page,
                                             @RequestParam(defaultValue = "20") int perPage) {
        SourceType type = requireSource(source);
        SearchOptions options = new SearchOptions(query, nonBlank(tags), page, perPage);
        return SearchResultResponse.from(federation.searchSource(newContext(), type, options));
    }

    /** Returns 404 if the source is unknown or does not have the skill. */
    @GetMapping("/sources/{source}/skills/{*id}")
    public ExternalSkill getSkill(@PathVariable String source, @PathVariable String id) {
        SourceType type = requireSource(source);
        return findSkill(newContext(), type, trimLeadingSlash(id));
    }

    @GetMapping("/sources/{source}/content/{*id}")
    public ResponseEntity<String> getContent(@PathVariable String source, @PathVariable String id) {
        SourceType type = requireSource(source);
        CallContext ctx = newContext();
        ExternalSkill skill = findSkill(ctx, type, trimLeadingSlash(id));
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_MARKDOWN)
                .body(federation.getContent(ctx, skill));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        federation.clearCache();
        return ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CallContext newContext() {
        return CallContext.withTimeout(requestTimeout);
    }

    private SourceType requireSource(String id) {
        if (id == null || id.isBlank()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown source: '" + id + "'");
        }
        SourceType type = SourceType.of(id);
        if (federation.getSource(type).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown source: " + id);
        }
        return type;
    }

    private ExternalSkill findSkill(CallContext ctx, SourceType type, String id) {
        return federation.getSkill(ctx, type, id)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Skill not found: " + type + "/" + id));
    }

    private static String trimLeadingSlash(String id) {
        return id.startsWith("/") ? id.substring(1) : id;
    }

    private static List<String> nonBlank(List<String> values) {
        return values.stream().map(String::trim).filter(v -> !v.isEmpty()).toList();
    }
}

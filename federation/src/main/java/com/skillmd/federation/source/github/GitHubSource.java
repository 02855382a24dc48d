package com.skillmd.federation.source.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillmd.federation.source.CallContext;
import com.skillmd.federation.source.ExternalSkill;
import com.skillmd.federation.source.HttpSource;
import com.skillmd.federation.source.SearchOptions;
import com.skillmd.federation.source.SearchResult;
import com.skillmd.federation.source.SourceException;
import com.skillmd.federation.source.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * SKILL.md files found through GitHub code search.
 *
 * Skill ids have the form {@code owner/repo[/path]}; the path defaults to
 * {@code SKILL.md} at the repository root.
 */
public class GitHubSource extends HttpSource {

    private static final Logger log = LoggerFactory.getLogger(GitHubSource.class);

    public static final String DEFAULT_API_URL = "https://api.github.com";

    private static final String SKILL_FILE = "SKILL.md";

    // -------------------------------------------------------------------------
    // Wire records: only the fields we read
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(@JsonProperty("total_count") int totalCount, List<Item> items) {
        SearchResponse {
            items = items == null ? List.of() : items;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Item(String name,
                String path,
                @JsonProperty("html_url") String htmlUrl,
                String url,
                String sha,
                Repo repository) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Repo(long id,
                String name,
                @JsonProperty("full_name") String fullName,
                String description,
                @JsonProperty("html_url") String htmlUrl,
                @JsonProperty("stargazers_count") int stargazersCount,
                @JsonProperty("default_branch") String defaultBranch,
                Owner owner) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Owner(String login) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContentResponse(String content, String encoding) {}

    // -------------------------------------------------------------------------

    public GitHubSource(String apiUrl, String token, ObjectMapper json, HttpClient http) {
        super(apiUrl, token, json, http);
    }

    public GitHubSource(String token, ObjectMapper json) {
        this(DEFAULT_API_URL, token, json, defaultClient());
    }

    @Override
    public SourceType name() {
        return SourceType.GITHUB;
    }

    @Override
    protected void applyHeaders(HttpRequest.Builder request) {
        request.header("Accept", "application/vnd.github.v3+json");
        if (hasToken()) {
            request.header("Authorization", "Bearer " + token);
        }
    }

    @Override
    public SearchResult search(CallContext ctx, SearchOptions options) {
        SearchOptions opts = options.normalized();

        String query = opts.query().isBlank()
                ? "filename:" + SKILL_FILE
                : opts.query() + " filename:" + SKILL_FILE;
        HttpResponse<String> resp = get(ctx, "/search/code?q=" + encodeQuery(query)
                + "&page=" + opts.page() + "&per_page=" + opts.perPage());

        // 401/403 are GitHub's way of saying "no token" or "rate limited";
        // anything else non-OK is treated the same way.
        if (!isOk(resp)) {
            return softFailure(opts, resp.statusCode());
        }

        SearchResponse parsed = decode(resp.body(), SearchResponse.class);
        List<ExternalSkill> skills = parsed.items().stream()
                .filter(item -> item.repository() != null)
                .map(this::toExternal)
                .toList();
        return SearchResult.of(name(), opts, skills, parsed.totalCount());
    }

    @Override
    public Optional<ExternalSkill> getSkill(CallContext ctx, String id) {
        String[] parts = id == null ? new String[0] : id.split("/", 3);
        if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
            log.debug("Ignoring malformed GitHub skill id '{}'", id);
            return Optional.empty();
        }
        String owner = parts[0];
        String repo  = parts[1];
        String path  = parts.length == 3 && !parts[2].isBlank() ? parts[2] : SKILL_FILE;

        HttpResponse<String> resp = get(ctx, "/repos/" + encodeSegment(owner) + "/" + encodeSegment(repo)
                + "/contents/" + encodePath(path));
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (!isOk(resp)) {
            throw new SourceException(SourceException.Kind.UPSTREAM, name(),
                    "unexpected status " + resp.statusCode() + " for " + id);
        }

        ContentResponse file = decode(resp.body(), ContentResponse.class);
        String content = decodeBase64(file.content());

        Repo info = repoInfo(ctx, owner, repo)
                .orElseGet(() -> new Repo(0, repo, owner + "/" + repo, "", null, 0, null, new Owner(owner)));
        String branch = nonBlank(info.defaultBranch()).orElse("main");

        return Optional.of(ExternalSkill.builder(name(), id)
                .slug(owner + "-" + repo)
                .name(owner + "/" + repo)
                .description(info.description())
                .content(content)
                .sourceUrl("https://github.com/" + owner + "/" + repo + "/blob/" + branch + "/" + path)
                .repoOwner(owner)
                .repoName(repo)
                .stars(info.stargazersCount())
                .build());
    }

    /** Repository metadata for the star count; absent if it cannot be fetched. */
    private Optional<Repo> repoInfo(CallContext ctx, String owner, String repo) {
        try {
            HttpResponse<String> resp = get(ctx, "/repos/" + encodeSegment(owner) + "/" + encodeSegment(repo));
            if (!isOk(resp)) {
                return Optional.empty();
            }
            return Optional.of(decode(resp.body(), Repo.class));
        } catch (SourceException e) {
            if (e.isCancellation()) {
                throw e;
            }
            log.debug("Repository info for {}/{} unavailable: {}", owner, repo, e.getMessage());
            return Optional.empty();
        }
    }

    private ExternalSkill toExternal(Item item) {
        Repo repo = item.repository();
        return ExternalSkill.builder(name(), repo.fullName() + "/" + item.path())
                .slug(repo.fullName().replace('/', '-'))
                .name(repo.fullName())
                .description(repo.description())
                .sourceUrl(item.htmlUrl())
                .contentUrl(item.url())
                .repoOwner(repo.owner() == null ? null : repo.owner().login())
                .repoName(repo.name())
                .stars(repo.stargazersCount())
                .build();
    }

    private String decodeBase64(String encoded) {
        if (encoded == null) {
            return "";
        }
        try {
            // GitHub wraps the base64 payload at 60 columns.
            return new String(Base64.getMimeDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new SourceException(SourceException.Kind.DECODE, name(), "invalid base64 content", e);
        }
    }
}

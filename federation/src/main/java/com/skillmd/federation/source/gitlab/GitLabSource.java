package com.skillmd.federation.source.gitlab;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * SKILL.md files found through GitLab blob search.
 *
 * Skill ids have the form {@code projectId[/path]}; the path defaults to
 * {@code SKILL.md}. GitLab does not report a total for blob searches, so the
 * total is the number of distinct projects on the returned page.
 */
public class GitLabSource extends HttpSource {

    private static final Logger log = LoggerFactory.getLogger(GitLabSource.class);

    public static final String DEFAULT_API_URL = "https://gitlab.com/api/v4";

    private static final String SKILL_FILE = "SKILL.md";
    private static final int    MAX_CONTENT_CHARS = 1024 * 1024;

    private static final TypeReference<List<Blob>> BLOB_LIST = new TypeReference<>() {};

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Blob(String filename,
                String path,
                String ref,
                @JsonProperty("project_id") long projectId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Project(long id,
                   String name,
                   String description,
                   @JsonProperty("path_with_namespace") String pathWithNamespace,
                   @JsonProperty("web_url") String webUrl,
                   @JsonProperty("star_count") int starCount,
                   @JsonProperty("default_branch") String defaultBranch) {}

    public GitLabSource(String apiUrl, String token, ObjectMapper json, HttpClient http) {
        super(apiUrl, token, json, http);
    }

    public GitLabSource(String token, ObjectMapper json) {
        this(DEFAULT_API_URL, token, json, defaultClient());
    }

    @Override
    public SourceType name() {
        return SourceType.GITLAB;
    }

    @Override
    protected void applyHeaders(HttpRequest.Builder request) {
        request.header("Accept", "application/json");
        if (hasToken()) {
            request.header("PRIVATE-TOKEN", token);
        }
    }

    @Override
    public SearchResult search(CallContext ctx, SearchOptions options) {
        SearchOptions opts = options.normalized();

        String query = opts.query().isBlank() ? SKILL_FILE : opts.query() + " " + SKILL_FILE;
        HttpResponse<String> resp = get(ctx, "/search?scope=blobs&search=" + encodeQuery(query)
                + "&page=" + opts.page() + "&per_page=" + opts.perPage());
        if (!isOk(resp)) {
            return softFailure(opts, resp.statusCode());
        }

        List<Blob> blobs = decode(resp.body(), BLOB_LIST);
        List<ExternalSkill> skills = new ArrayList<>();
        Set<Long> seenProjects = new HashSet<>();
        for (Blob blob : blobs) {
            if (blob.filename() == null || !blob.filename().endsWith(SKILL_FILE)) {
                continue;
            }
            if (!seenProjects.add(blob.projectId())) {
                continue;
            }
            skills.add(toExternal(ctx, blob));
        }
        return SearchResult.of(name(), opts, skills, skills.size());
    }

    @Override
    public Optional<ExternalSkill> getSkill(CallContext ctx, String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String[] parts = id.split("/", 2);
        String projectId = parts[0];
        String path = parts.length == 2 && !parts[1].isBlank() ? parts[1] : SKILL_FILE;
        if (projectId.isBlank()) {
            return Optional.empty();
        }

        Optional<Project> project = project(ctx, projectId);
        if (project.isEmpty()) {
            return Optional.empty();
        }
        Project p = project.get();
        String branch = nonBlank(p.defaultBranch()).orElse("main");
        Optional<String> content = fileContent(ctx, projectId, path, branch);
        if (content.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(ExternalSkill.builder(name(), id)
                .slug(p.pathWithNamespace().replace('/', '-'))
                .name(p.pathWithNamespace())
                .description(p.description())
                .content(content.get())
                .sourceUrl(p.webUrl() + "/-/blob/" + branch + "/" + path)
                .stars(p.starCount())
                .build());
    }

    /** Project metadata; empty on 404. */
    private Optional<Project> project(CallContext ctx, String projectId) {
        HttpResponse<String> resp = get(ctx, "/projects/" + encodeSegment(projectId));
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (!isOk(resp)) {
            throw new SourceException(SourceException.Kind.UPSTREAM, name(),
                    "unexpected status " + resp.statusCode() + " for project " + projectId);
        }
        return Optional.of(decode(resp.body(), Project.class));
    }

    /** Raw file body, truncated to 1 MiB; empty on 404. */
    private Optional<String> fileContent(CallContext ctx, String projectId, String path, String ref) {
        HttpResponse<String> resp = get(ctx, "/projects/" + encodeSegment(projectId)
                + "/repository/files/" + encodeSegment(path) + "/raw?ref=" + encodeQuery(ref));
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (!isOk(resp)) {
            throw new SourceException(SourceException.Kind.UPSTREAM, name(),
                    "unexpected status " + resp.statusCode() + " for " + projectId + "/" + path);
        }
        String body = resp.body();
        return Optional.of(body.length() > MAX_CONTENT_CHARS ? body.substring(0, MAX_CONTENT_CHARS) : body);
    }

    /**
     * Enrich a search hit with its project's name and stars. A project that
     * cannot be fetched still yields a bare entry rather than dropping the hit.
     */
    private ExternalSkill toExternal(CallContext ctx, Blob blob) {
        String id = blob.projectId() + "/" + blob.path();
        Optional<Project> project;
        try {
            project = project(ctx, String.valueOf(blob.projectId()));
        } catch (SourceException e) {
            if (e.isCancellation()) {
                throw e;
            }
            log.debug("Project {} unavailable: {}", blob.projectId(), e.getMessage());
            project = Optional.empty();
        }

        if (project.isEmpty()) {
            return ExternalSkill.builder(name(), id)
                    .slug("gitlab-" + blob.projectId())
                    .name(blob.filename())
                    .sourceUrl("https://gitlab.com/projects/" + blob.projectId())
                    .build();
        }
        Project p = project.get();
        return ExternalSkill.builder(name(), id)
                .slug(p.pathWithNamespace().replace('/', '-'))
                .name(p.pathWithNamespace())
                .description(p.description())
                .sourceUrl(p.webUrl() + "/-/blob/" + blob.ref() + "/" + blob.path())
                .stars(p.starCount())
                .build();
    }
}

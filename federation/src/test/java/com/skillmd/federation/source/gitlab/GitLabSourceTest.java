package com.skillmd.federation.source.gitlab;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillmd.federation.source.CallContext;
import com.skillmd.federation.source.ExternalSkill;
import com.skillmd.federation.source.SearchOptions;
import com.skillmd.federation.source.SearchResult;
import com.skillmd.federation.source.SourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GitLabSourceTest {

    private static final String BLOBS_JSON = """
            [
              {"filename": "SKILL.md",  "path": "SKILL.md",      "ref": "main", "project_id": 7},
              {"filename": "README.md", "path": "README.md",     "ref": "main", "project_id": 8},
              {"filename": "SKILL.md",  "path": "docs/SKILL.md", "ref": "main", "project_id": 7},
              {"filename": "SKILL.md",  "path": "SKILL.md",      "ref": "main", "project_id": 9}
            ]
            """;

    private static final String PROJECT_7 = """
            {"id": 7, "name": "pdf-skill", "description": "Work with PDFs",
             "path_with_namespace": "acme/pdf-skill", "web_url": "https://gitlab.com/acme/pdf-skill",
             "star_count": 12, "default_branch": "develop"}
            """;

    @Mock HttpClient http;

    GitLabSource source;

    @BeforeEach
    void setUp() {
        source = new GitLabSource("https://gitlab.test/api/v4", "glpat-token", new ObjectMapper(), http);
    }

    @Test
    void search_keepsSkillFilesOnePerProject() throws Exception {
        Map<String, HttpResponse<String>> routes = new LinkedHashMap<>();
        routes.put("/search", response(200, BLOBS_JSON));
        routes.put("/projects/7", response(200, PROJECT_7));
        routes.put("/projects/9", response(500, "internal error"));
        route(routes);

        SearchResult result = source.search(CallContext.background(), SearchOptions.of("pdf"));

        assertThat(result.skills()).extracting(ExternalSkill::id)
                .containsExactly("7/SKILL.md", "9/SKILL.md");
        assertThat(result.total()).isEqualTo(2);

        ExternalSkill enriched = result.skills().get(0);
        assertThat(enriched.name()).isEqualTo("acme/pdf-skill");
        assertThat(enriched.stars()).isEqualTo(12);
        assertThat(enriched.sourceUrl()).isEqualTo("https://gitlab.com/acme/pdf-skill/-/blob/main/SKILL.md");

        // project 9 could not be fetched: bare entry instead of a dropped hit
        ExternalSkill bare = result.skills().get(1);
        assertThat(bare.slug()).isEqualTo("gitlab-9");
        assertThat(bare.stars()).isZero();
    }

    @Test
    void search_sendsPrivateTokenAndBlobScope() throws Exception {
        route(Map.of("/search", response(200, "[]")));

        source.search(CallContext.background(), new SearchOptions("pdf", List.of(), 3, 10));

        HttpRequest sent = sentRequests().get(0);
        assertThat(sent.headers().firstValue("PRIVATE-TOKEN")).contains("glpat-token");
        assertThat(sent.uri().toString())
                .contains("scope=blobs")
                .contains("search=pdf+SKILL.md")
                .contains("page=3")
                .contains("per_page=10");
    }

    @Test
    void search_unauthorized_isSoftFailure() throws Exception {
        route(Map.of("/search", response(401, "{\"message\":\"401 Unauthorized\"}")));

        SearchResult result = source.search(CallContext.background(), SearchOptions.of("pdf"));

        assertThat(result.skills()).isEmpty();
        assertThat(result.total()).isZero();
    }

    @Test
    void search_malformedBody_throwsDecode() throws Exception {
        route(Map.of("/search", response(200, "{\"not\":\"a list\"}")));

        assertThatThrownBy(() -> source.search(CallContext.background(), SearchOptions.of("pdf")))
                .isInstanceOfSatisfying(SourceException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SourceException.Kind.DECODE));
    }

    @Test
    void getSkill_readsRawFileFromDefaultBranch() throws Exception {
        Map<String, HttpResponse<String>> routes = new LinkedHashMap<>();
        routes.put("/projects/7/repository/files/SKILL.md/raw", response(200, "# PDF skill\n"));
        routes.put("/projects/7", response(200, PROJECT_7));
        route(routes);

        Optional<ExternalSkill> skill = source.getSkill(CallContext.background(), "7");

        assertThat(skill).isPresent();
        assertThat(skill.get().content()).isEqualTo("# PDF skill\n");
        assertThat(skill.get().sourceUrl()).isEqualTo("https://gitlab.com/acme/pdf-skill/-/blob/develop/SKILL.md");
        assertThat(sentRequests())
                .anySatisfy(req -> assertThat(req.uri().toString()).contains("raw?ref=develop"));
    }

    @Test
    void getSkill_nestedPath_isEncodedAsOneSegment() throws Exception {
        Map<String, HttpResponse<String>> routes = new LinkedHashMap<>();
        routes.put("/projects/7/repository/files/docs%2FSKILL.md/raw", response(200, "# Nested"));
        routes.put("/projects/7", response(200, PROJECT_7));
        route(routes);

        Optional<ExternalSkill> skill = source.getSkill(CallContext.background(), "7/docs/SKILL.md");

        assertThat(skill).map(ExternalSkill::content).contains("# Nested");
    }

    @Test
    void getSkill_unknownProject_returnsEmpty() throws Exception {
        route(Map.of("/projects/404404", response(404, "{\"message\":\"404 Project Not Found\"}")));

        assertThat(source.getSkill(CallContext.background(), "404404")).isEmpty();
    }

    @Test
    void getSkill_missingFileInExistingProject_returnsEmpty() throws Exception {
        Map<String, HttpResponse<String>> routes = new LinkedHashMap<>();
        routes.put("/projects/7/repository/files/SKILL.md/raw", response(404, "{\"message\":\"404 File Not Found\"}"));
        routes.put("/projects/7", response(200, PROJECT_7));
        route(routes);

        assertThat(source.getSkill(CallContext.background(), "7")).isEmpty();
    }

    @Test
    void getSkill_rawFileServerError_throwsUpstream() throws Exception {
        Map<String, HttpResponse<String>> routes = new LinkedHashMap<>();
        routes.put("/projects/7/repository/files/SKILL.md/raw", response(500, "oops"));
        routes.put("/projects/7", response(200, PROJECT_7));
        route(routes);

        assertThatThrownBy(() -> source.getSkill(CallContext.background(), "7"))
                .isInstanceOfSatisfying(SourceException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SourceException.Kind.UPSTREAM));
    }

    @Test
    void getSkill_blankId_returnsEmptyWithoutRequest() {
        assertThat(source.getSkill(CallContext.background(), " ")).isEmpty();
        assertThat(source.getSkill(CallContext.background(), "/SKILL.md")).isEmpty();
        verifyNoInteractions(http);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void route(Map<String, HttpResponse<String>> byPathSuffix) throws Exception {
        doAnswer(inv -> {
            HttpRequest req = inv.getArgument(0);
            String path = req.uri().getRawPath();
            return byPathSuffix.entrySet().stream()
                    .filter(e -> path.endsWith(e.getKey()))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElseThrow(() -> new AssertionError("Unexpected request: " + req.uri()));
        }).when(http).send(any(HttpRequest.class), any());
    }

    private List<HttpRequest> sentRequests() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http, atLeastOnce()).send(captor.capture(), any());
        return new ArrayList<>(captor.getAllValues());
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> resp = mock(HttpResponse.class);
        lenient().when(resp.statusCode()).thenReturn(status);
        lenient().when(resp.body()).thenReturn(body);
        return resp;
    }
}

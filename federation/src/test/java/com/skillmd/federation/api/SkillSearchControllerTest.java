package com.skillmd.federation.api;

import com.skillmd.federation.service.FederatedResult;
import com.skillmd.federation.service.FederatedSearchService;
import com.skillmd.federation.source.CallContext;
import com.skillmd.federation.source.ExternalSkill;
import com.skillmd.federation.source.SearchOptions;
import com.skillmd.federation.source.SearchResult;
import com.skillmd.federation.source.Source;
import com.skillmd.federation.source.SourceException;
import com.skillmd.federation.source.SourceType;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for SkillSearchController and ApiExceptionHandler.
 * The federation is a mock; no sources, caches or worker threads start.
 */
@WebMvcTest(SkillSearchController.class)
class SkillSearchControllerTest {

    @Autowired   MockMvc                mockMvc;
    @MockitoBean FederatedSearchService federation;

    // ------------------------------------------------------------------
    // GET /api/sources
    // ------------------------------------------------------------------

    @Test
    void sources_listsEnabledSourcesWithLabels() throws Exception {
        when(federation.enabledSources()).thenReturn(List.of(SourceType.GITHUB, SourceType.LOCAL));
        when(federation.availableTokens(SourceType.GITHUB)).thenReturn(4.0);
        when(federation.availableTokens(SourceType.LOCAL)).thenReturn(-1.0);

        mockMvc.perform(get("/api/sources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("github"))
                .andExpect(jsonPath("$[0].label").value("GitHub"))
                .andExpect(jsonPath("$[0].availableTokens").value(4.0))
                .andExpect(jsonPath("$[1].id").value("local"))
                .andExpect(jsonPath("$[1].availableTokens").value(-1.0));
    }

    // ------------------------------------------------------------------
    // GET /api/skills/search
    // ------------------------------------------------------------------

    @Test
    void search_partialFailure_returns200WithErrors() throws Exception {
        ExternalSkill skill = ExternalSkill.builder(SourceType.GITLAB, "7/SKILL.md").name("acme/pdf").stars(3).build();
        FederatedResult result = new FederatedResult(List.of(skill), 9,
                Map.of(SourceType.GITLAB, 9),
                Map.of(SourceType.GITHUB, "[TRANSPORT] github: connection reset"),
                Map.of(SourceType.GITLAB, Duration.ofMillis(120)),
                Duration.ofMillis(130));
        when(federation.searchSources(any(), any(), any())).thenReturn(result);

        mockMvc.perform(get("/api/skills/search").param("q", "pdf"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(9))
                .andExpect(jsonPath("$.skills[0].id").value("7/SKILL.md"))
                .andExpect(jsonPath("$.skills[0].source").value("gitlab"))
                .andExpect(jsonPath("$.bySource.gitlab").value(9))
                .andExpect(jsonPath("$.errors.github").value("[TRANSPORT] github: connection reset"))
                .andExpect(jsonPath("$.sourceTimesMs.gitlab").value(120))
                .andExpect(jsonPath("$.searchTimeMs").value(130));
    }

    @Test
    @SuppressWarnings("unchecked")
    void search_passesNormalizedOptionsAndSourceFilter() throws Exception {
        when(federation.searchSources(any(), any(), any())).thenReturn(FederatedResult.empty());

        mockMvc.perform(get("/api/skills/search")
                        .param("q", "pdf")
                        .param("tags", "docs,office")
                        .param("page", "0")
                        .param("perPage", "-1")
                        .param("sources", "GitHub,local"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.page").value(1))
                .andExpect(jsonPath("$.perPage").value(20));

        ArgumentCaptor<SearchOptions> options = ArgumentCaptor.forClass(SearchOptions.class);
        ArgumentCaptor<Collection<SourceType>> filter = ArgumentCaptor.forClass(Collection.class);
        verify(federation).searchSources(any(CallContext.class), options.capture(), filter.capture());

        assertThat(options.getValue().query()).isEqualTo("pdf");
        assertThat(options.getValue().tags()).containsExactly("docs", "office");
        assertThat(filter.getValue()).containsExactly(SourceType.GITHUB, SourceType.LOCAL);
    }

    // ------------------------------------------------------------------
    // GET /api/sources/{source}/search
    // ------------------------------------------------------------------

    @Test
    void searchSource_unknownSource_returns404() throws Exception {
        when(federation.getSource(SourceType.of("nowhere"))).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sources/{source}/search", "nowhere").param("q", "pdf"))
                .andExpect(status().isNotFound());
    }

    @Test
    void searchSource_blankSource_returns404WithoutQuerying() throws Exception {
        mockMvc.perform(get("/api/sources/{source}/search", " ").param("q", "pdf"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/sources/{source}/skills/acme/skills", " "))
                .andExpect(status().isNotFound());

        verifyNoInteractions(federation);
    }

    @Test
    void searchSource_providerFailure_returns502() throws Exception {
        knownSource(SourceType.GITHUB);
        when(federation.searchSource(any(), eq(SourceType.GITHUB), any()))
                .thenThrow(new SourceException(SourceException.Kind.DECODE, SourceType.GITHUB, "bad json"));

        mockMvc.perform(get("/api/sources/{source}/search", "github").param("q", "pdf"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.source").value("github"))
                .andExpect(jsonPath("$.kind").value("DECODE"));
    }

    @Test
    void searchSource_deadlineExceeded_returns504() throws Exception {
        knownSource(SourceType.GITHUB);
        when(federation.searchSource(any(), eq(SourceType.GITHUB), any()))
                .thenThrow(new SourceException(SourceException.Kind.DEADLINE_EXCEEDED, SourceType.GITHUB, "deadline exceeded"));

        mockMvc.perform(get("/api/sources/{source}/search", "github"))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    void searchSource_success_returnsResult() throws Exception {
        knownSource(SourceType.GITLAB);
        SearchOptions opts = SearchOptions.of("pdf");
        SearchResult result = SearchResult.of(SourceType.GITLAB, opts,
                List.of(ExternalSkill.builder(SourceType.GITLAB, "7/SKILL.md").name("acme/pdf").build()), 1)
                .stamped(Duration.ofMillis(42), SourceType.GITLAB);
        when(federation.searchSource(any(), eq(SourceType.GITLAB), any())).thenReturn(result);

        mockMvc.perform(get("/api/sources/{source}/search", "gitlab").param("q", "pdf"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("gitlab"))
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.searchTimeMs").value(42))
                .andExpect(jsonPath("$.skills[0].name").value("acme/pdf"));
    }

    // ------------------------------------------------------------------
    // Skills and content
    // ------------------------------------------------------------------

    @Test
    void getSkill_idWithSlashes_isPassedWhole() throws Exception {
        knownSource(SourceType.GITHUB);
        ExternalSkill skill = ExternalSkill.builder(SourceType.GITHUB, "acme/skills/pdf/SKILL.md")
                .name("acme/skills").stars(900).build();
        when(federation.getSkill(any(), eq(SourceType.GITHUB), eq("acme/skills/pdf/SKILL.md")))
                .thenReturn(Optional.of(skill));

        mockMvc.perform(get("/api/sources/github/skills/acme/skills/pdf/SKILL.md"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("acme/skills/pdf/SKILL.md"))
                .andExpect(jsonPath("$.stars").value(900));
    }

    @Test
    void getSkill_notFound_returns404() throws Exception {
        knownSource(SourceType.GITHUB);
        when(federation.getSkill(any(), eq(SourceType.GITHUB), eq("acme/missing"))).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sources/github/skills/acme/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getContent_returnsMarkdown() throws Exception {
        knownSource(SourceType.GITHUB);
        ExternalSkill skill = ExternalSkill.builder(SourceType.GITHUB, "acme/skills").build();
        when(federation.getSkill(any(), eq(SourceType.GITHUB), eq("acme/skills"))).thenReturn(Optional.of(skill));
        when(federation.getContent(any(), eq(skill))).thenReturn("# PDF\n");

        mockMvc.perform(get("/api/sources/github/content/acme/skills"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_MARKDOWN))
                .andExpect(content().string("# PDF\n"));
    }

    // ------------------------------------------------------------------
    // DELETE /api/cache
    // ------------------------------------------------------------------

    @Test
    void clearCache_returns204() throws Exception {
        mockMvc.perform(delete("/api/cache"))
                .andExpect(status().isNoContent());

        verify(federation).clearCache();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void knownSource(SourceType type) {
        Source source = mock(Source.class);
        when(federation.getSource(type)).thenReturn(Optional.of(source));
    }
}

package com.skillmd.federation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillmd.federation.ratelimit.RateLimit;
import com.skillmd.federation.service.FederatedSearchService;
import com.skillmd.federation.source.HttpSource;
import com.skillmd.federation.source.Source;
import com.skillmd.federation.source.SourceType;
import com.skillmd.federation.source.github.GitHubSource;
import com.skillmd.federation.source.gitlab.GitLabSource;
import com.skillmd.federation.source.local.InMemorySkillStore;
import com.skillmd.federation.source.local.LocalSkillStore;
import com.skillmd.federation.source.local.LocalSource;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wires the skill sources and the federation that searches them.
 *
 * Every {@link Source} bean is registered with the federation at startup, so
 * adding a provider only requires declaring it here (or anywhere else as a
 * bean). Sources missing from {@code enabled-sources} are registered but
 * start disabled.
 */
@Configuration
@EnableConfigurationProperties(FederationProperties.class)
public class FederationConfig {

    @Bean
    @ConditionalOnMissingBean(LocalSkillStore.class)
    LocalSkillStore localSkillStore() {
        return new InMemorySkillStore();
    }

    @Bean
    LocalSource localSource(LocalSkillStore store, FederationProperties props) {
        LocalSource source = new LocalSource(store);
        source.setEnabled(isEnabled(props, SourceType.LOCAL));
        return source;
    }

    @Bean
    HttpClient skillSourceHttpClient() {
        return HttpSource.defaultClient();
    }

    @Bean
    GitHubSource gitHubSource(FederationProperties props, ObjectMapper objectMapper, HttpClient http) {
        FederationProperties.Remote cfg = props.getGithub();
        GitHubSource source = new GitHubSource(cfg.getApiUrl(), cfg.getToken(), objectMapper, http);
        source.setEnabled(isEnabled(props, SourceType.GITHUB));
        return source;
    }

    @Bean
    GitLabSource gitLabSource(FederationProperties props, ObjectMapper objectMapper, HttpClient http) {
        FederationProperties.Remote cfg = props.getGitlab();
        GitLabSource source = new GitLabSource(cfg.getApiUrl(), cfg.getToken(), objectMapper, http);
        source.setEnabled(isEnabled(props, SourceType.GITLAB));
        return source;
    }

    @Bean
    FederatedSearchService federatedSearchService(List<Source> sources,
                                                  FederationProperties props,
                                                  MeterRegistry meterRegistry) {
        FederatedSearchService federation = new FederatedSearchService(settings(props), meterRegistry);
        sources.forEach(federation::registerSource);
        return federation;
    }

    static FederatedSearchService.Settings settings(FederationProperties props) {
        Map<SourceType, RateLimit> limits = new HashMap<>(RateLimit.defaults());
        props.getRateLimits().forEach((id, limit) -> limits.put(SourceType.of(id),
                new RateLimit(limit.getRequestsPerMinute(), limit.getBurstSize())));

        FederationProperties.Cache cache = props.getCache();
        return new FederatedSearchService.Settings(limits, cache.getSearchTtl(), cache.getSkillTtl(),
                cache.getSweepInterval(), props.getFanoutThreads());
    }

    private static boolean isEnabled(FederationProperties props, SourceType type) {
        Set<SourceType> enabled = props.getEnabledSources().stream()
                .map(SourceType::of)
                .collect(Collectors.toSet());
        return enabled.contains(type);
    }
}

package com.skillmd.federation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under {@code skillmd.federation}.
 *
 * <pre>
 * skillmd:
 *   federation:
 *     enabled-sources: [local, github, gitlab]
 *     request-timeout: 20s
 *     fanout-threads: 8
 *     cache:
 *       search-ttl: 10m
 *       skill-ttl: 10m
 *       sweep-interval: 1m
 *     github:
 *       token: ${GITHUB_TOKEN:}
 *     rate-limits:
 *       github:
 *         requests-per-minute: 30
 *         burst-size: 10
 * </pre>
 */
@ConfigurationProperties(prefix = "skillmd.federation")
public class FederationProperties {

    /** Source ids that start enabled; registered sources not listed start disabled. */
    private List<String> enabledSources = new ArrayList<>(List.of(
            "local", "skills.sh", "github", "gitlab", "bitbucket", "codeberg"));

    /** Deadline applied to every HTTP request handled by the API. */
    private Duration requestTimeout = Duration.ofSeconds(20);

    /** Worker threads per source for fan-out searches. */
    private int fanoutThreads = 8;

    private final Cache cache = new Cache();
    private final Remote github = new Remote("https://api.github.com");
    private final Remote gitlab = new Remote("https://gitlab.com/api/v4");

    /** Per-source overrides of the built-in rate limits, keyed by source id. */
    private Map<String, Limit> rateLimits = new LinkedHashMap<>();

    public List<String> getEnabledSources() { return enabledSources; }
    public void setEnabledSources(List<String> enabledSources) { this.enabledSources = enabledSources; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public int getFanoutThreads() { return fanoutThreads; }
    public void setFanoutThreads(int fanoutThreads) { this.fanoutThreads = fanoutThreads; }

    public Cache getCache()   { return cache; }
    public Remote getGithub() { return github; }
    public Remote getGitlab() { return gitlab; }

    public Map<String, Limit> getRateLimits() { return rateLimits; }
    public void setRateLimits(Map<String, Limit> rateLimits) { this.rateLimits = rateLimits; }

    public static class Cache {
        private Duration searchTtl = Duration.ofMinutes(10);
        private Duration skillTtl = Duration.ofMinutes(10);
        private Duration sweepInterval = Duration.ofMinutes(1);

        public Duration getSearchTtl() { return searchTtl; }
        public void setSearchTtl(Duration searchTtl) { this.searchTtl = searchTtl; }

        public Duration getSkillTtl() { return skillTtl; }
        public void setSkillTtl(Duration skillTtl) { this.skillTtl = skillTtl; }

        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }

    public static class Remote {
        private String apiUrl;
        private String token = "";

        public Remote() {
        }

        Remote(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
    }

    public static class Limit {
        private int requestsPerMinute;
        private int burstSize;

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }

        public int getBurstSize() { return burstSize; }
        public void setBurstSize(int burstSize) { this.burstSize = burstSize; }
    }
}

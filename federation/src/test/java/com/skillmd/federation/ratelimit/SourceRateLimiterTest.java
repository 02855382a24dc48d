package com.skillmd.federation.ratelimit;

import com.skillmd.federation.source.CallContext;
import com.skillmd.federation.source.SourceType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceRateLimiterTest {

    @Test
    void acquire_unlimitedSource_neverBlocks() {
        SourceRateLimiter limiter = new SourceRateLimiter(Map.of(SourceType.LOCAL, RateLimit.unlimited()));
        CallContext cancelled = CallContext.cancellable();
        cancelled.cancel();

        for (int i = 0; i < 1_000; i++) {
            limiter.acquire(SourceType.LOCAL, cancelled);
        }
        assertThat(limiter.availableTokens(SourceType.LOCAL)).isEqualTo(-1.0);
    }

    @Test
    void limitFor_unconfiguredSource_usesFallback() {
        SourceRateLimiter limiter = new SourceRateLimiter(Map.of());

        assertThat(limiter.limitFor(SourceType.of("forgejo"))).isEqualTo(RateLimit.FALLBACK);
    }

    @Test
    void defaults_localUnlimitedGitHubLimited() {
        SourceRateLimiter limiter = new SourceRateLimiter();

        assertThat(limiter.limitFor(SourceType.LOCAL).isUnlimited()).isTrue();
        assertThat(limiter.limitFor(SourceType.GITHUB)).isEqualTo(new RateLimit(10, 5));
        assertThat(limiter.limitFor(SourceType.SKILLS_SH)).isEqualTo(new RateLimit(60, 10));
    }

    @Test
    void bucketFor_sameSource_reusesBucket() {
        SourceRateLimiter limiter = new SourceRateLimiter();

        assertThat(limiter.bucketFor(SourceType.GITHUB)).isSameAs(limiter.bucketFor(SourceType.GITHUB));
    }

    @Test
    void setLimit_onlyAffectsNamedSource() {
        SourceRateLimiter limiter = new SourceRateLimiter();
        TokenBucket gitlabBefore = limiter.bucketFor(SourceType.GITLAB);
        TokenBucket githubBefore = limiter.bucketFor(SourceType.GITHUB);

        limiter.setLimit(SourceType.GITHUB, new RateLimit(600, 2));

        assertThat(limiter.bucketFor(SourceType.GITLAB)).isSameAs(gitlabBefore);
        assertThat(limiter.bucketFor(SourceType.GITHUB)).isNotSameAs(githubBefore);
        assertThat(limiter.bucketFor(SourceType.GITHUB).maxTokens()).isEqualTo(2.0);
        assertThat(limiter.limitFor(SourceType.GITLAB)).isEqualTo(new RateLimit(10, 5));
    }

    @Test
    void setLimit_toUnlimited_removesBucket() {
        SourceRateLimiter limiter = new SourceRateLimiter();
        limiter.bucketFor(SourceType.GITHUB);

        limiter.setLimit(SourceType.GITHUB, RateLimit.unlimited());

        assertThat(limiter.bucketFor(SourceType.GITHUB)).isNull();
    }

    @Test
    void rateLimit_negativeValues_rejected() {
        assertThatThrownBy(() -> new RateLimit(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimit(10, -2)).isInstanceOf(IllegalArgumentException.class);
    }
}

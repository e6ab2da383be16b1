package com.example.formulamap.service.ai;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterServiceTest {

    @Test
    void refusesOnceMinuteQuotaIsUsed() {
        RateLimiterService limiter = new RateLimiterService(2, 100);

        assertThat(limiter.wouldAllow("OpenAI")).isTrue();
        assertThat(limiter.acquire("OpenAI")).isTrue();
        assertThat(limiter.acquire("OpenAI")).isTrue();
        assertThat(limiter.wouldAllow("OpenAI")).isFalse();
        assertThat(limiter.acquire("OpenAI")).isFalse();
    }

    @Test
    void quotasArePerProvider() {
        RateLimiterService limiter = new RateLimiterService(1, 100);

        assertThat(limiter.acquire("OpenAI")).isTrue();
        assertThat(limiter.acquire("Gemini")).isTrue();
        assertThat(limiter.acquire("OpenAI")).isFalse();
    }

    @Test
    void hourQuotaAlsoApplies() {
        RateLimiterService limiter = new RateLimiterService(10, 1);

        assertThat(limiter.acquire("Gemini")).isTrue();
        assertThat(limiter.acquire("Gemini")).isFalse();
    }
}

package com.example.formulamap.service.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps each AI provider under its per-minute and per-hour request quota.
 * A request over quota is refused immediately so the caller can fall back.
 */
@Service
public class RateLimiterService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiterService.class);

    private static final long MINUTE_MS = 60_000L;
    private static final long HOUR_MS = 3_600_000L;

    @Value("${ai.rate-limit.enabled:true}")
    private boolean enabled = true;

    @Value("${ai.rate-limit.requests-per-minute:10}")
    private int requestsPerMinute = 10;

    @Value("${ai.rate-limit.requests-per-hour:600}")
    private int requestsPerHour = 600;

    private final ConcurrentHashMap<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    public RateLimiterService() {
    }

    RateLimiterService(int requestsPerMinute, int requestsPerHour) {
        this.requestsPerMinute = requestsPerMinute;
        this.requestsPerHour = requestsPerHour;
    }

    /**
     * Takes one request token for the provider.
     *
     * @return false when the provider is over quota
     */
    public boolean acquire(String providerName) {
        if (!enabled) {
            return true;
        }
        boolean granted = bucket(providerName).tryAcquire(System.currentTimeMillis());
        if (!granted) {
            logger.debug("Rate limit reached for {}", providerName);
        }
        return granted;
    }

    /**
     * Whether a request would be granted now, without taking a token.
     */
    public boolean wouldAllow(String providerName) {
        if (!enabled) {
            return true;
        }
        TokenBucket bucket = buckets.get(providerName);
        return bucket == null || bucket.hasTokens(System.currentTimeMillis());
    }

    private TokenBucket bucket(String providerName) {
        return buckets.computeIfAbsent(providerName, k -> new TokenBucket(requestsPerMinute, requestsPerHour));
    }

    /**
     * Two fixed windows, one minute and one hour, refilled when the window elapses.
     */
    private static class TokenBucket {
        private final int perMinute;
        private final int perHour;
        private int minuteTokens;
        private int hourTokens;
        private long minuteStart;
        private long hourStart;

        TokenBucket(int perMinute, int perHour) {
            this.perMinute = perMinute;
            this.perHour = perHour;
            this.minuteTokens = perMinute;
            this.hourTokens = perHour;
            long now = System.currentTimeMillis();
            this.minuteStart = now;
            this.hourStart = now;
        }

        synchronized boolean tryAcquire(long now) {
            refill(now);
            if (minuteTokens <= 0 || hourTokens <= 0) {
                return false;
            }
            minuteTokens--;
            hourTokens--;
            return true;
        }

        synchronized boolean hasTokens(long now) {
            refill(now);
            return minuteTokens > 0 && hourTokens > 0;
        }

        private void refill(long now) {
            if (now - minuteStart >= MINUTE_MS) {
                minuteTokens = perMinute;
                minuteStart = now;
            }
            if (now - hourStart >= HOUR_MS) {
                hourTokens = perHour;
                hourStart = now;
            }
        }
    }
}

package com.turdes.backend.modules.auth.presentation;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.turdes.backend.global.config.AuthProperties;
import com.turdes.backend.global.error.ProblemKind;
import com.turdes.backend.global.error.RetryableProblemException;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fixed-window limit on resend-verification calls per caller. A window opens with the first call and
 * every counter expires together with its window.
 */
@Component
public class ResendVerificationThrottle {

    private static final Logger log = LoggerFactory.getLogger(ResendVerificationThrottle.class);

    private final Cache<String, Window> windows;
    private final Ticker ticker;
    private final int limit;
    private final Duration windowLength;

    @Autowired
    public ResendVerificationThrottle(AuthProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    ResendVerificationThrottle(AuthProperties properties, Ticker ticker) {
        this.limit = properties.verification().resendLimit();
        this.windowLength = properties.verification().resendWindow();
        this.ticker = ticker;
        this.windows = Caffeine.newBuilder()
                .expireAfterWrite(windowLength.toNanos(), TimeUnit.NANOSECONDS)
                .ticker(ticker)
                .maximumSize(100_000)
                .build();
    }

    /**
     * Counts one call for {@code callerKey}.
     *
     * @throws RetryableProblemException once the caller has used up the current window
     */
    public void acquire(String callerKey) {
        Window window = windows.get(callerKey, key -> new Window(ticker.read()));
        int used = window.calls.incrementAndGet();
        if (used > limit) {
            long elapsedNanos = ticker.read() - window.openedAtNanos;
            long retryAfterSeconds = Math.max(1L,
                    TimeUnit.NANOSECONDS.toSeconds(windowLength.toNanos() - elapsedNanos + 999_999_999L));
            log.warn("Resend verification throttled for {} ({} calls in window)", callerKey, used);
            throw new RetryableProblemException(ProblemKind.TOO_MANY_REQUESTS, "TOO_MANY_REQUESTS",
                    "Too many verification e-mails requested, please try again later", retryAfterSeconds);
        }
    }

    private static final class Window {
        private final long openedAtNanos;
        private final AtomicInteger calls = new AtomicInteger();

        private Window(long openedAtNanos) {
            this.openedAtNanos = openedAtNanos;
        }
    }
}

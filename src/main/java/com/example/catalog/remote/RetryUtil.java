package com.example.catalog.remote;

import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

public final class RetryUtil {
    private RetryUtil() {}

    public static Retry remoteRetry() {
        // Rate limits and server-side failures only; client errors are final.
        return Retry.backoff(3, Duration.ofMillis(200))
                .maxBackoff(Duration.ofSeconds(2))
                .filter(RetryUtil::isTransient);
    }

    public static <T> Mono<T> withRemoteRetry(Mono<T> mono) {
        return mono.retryWhen(remoteRetry());
    }

    static boolean isTransient(Throwable e) {
        if (e instanceof RemoteApiException rae) {
            int s = rae.status();
            return s == 429 || (s >= 500 && s <= 599);
        }
        return false;
    }
}

package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.model.CanonicalResponse;

import java.time.Duration;
import java.util.List;

/**
 * Result of running the retry loop against one provider.
 *
 * @param response  set only for {@link Kind#SUCCESS}
 * @param attempts  provider calls actually made
 * @param delays    backoff delays waited between attempts, in order
 * @param lastError last provider error, null when none occurred
 */
public record RetryResult(
        Kind kind,
        String providerId,
        CanonicalResponse response,
        int attempts,
        List<Duration> delays,
        Throwable lastError
) {

    public enum Kind {
        SUCCESS,
        /** The breaker denied a call, possibly after earlier attempts. */
        CIRCUIT_OPEN,
        /** Every attempt failed with a retryable error. */
        RETRIES_EXHAUSTED,
        /** The provider rejected the request; retrying cannot help. */
        NON_RETRYABLE,
        /** The request deadline expired or the request was cancelled. */
        DEADLINE_EXCEEDED
    }

    public RetryResult {
        delays = delays != null ? List.copyOf(delays) : List.of();
    }

    static RetryResult success(String providerId, CanonicalResponse response, int attempts, List<Duration> delays) {
        return new RetryResult(Kind.SUCCESS, providerId, response, attempts, delays, null);
    }

    static RetryResult failure(Kind kind, String providerId, int attempts, List<Duration> delays, Throwable lastError) {
        return new RetryResult(kind, providerId, null, attempts, delays, lastError);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }
}

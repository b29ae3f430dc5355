package fr.lapetina.llm.gateway.domain.error;

import fr.lapetina.llm.gateway.domain.model.FailureKind;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Failure reported by a provider adapter, already classified.
 */
public class ProviderCallException extends RuntimeException {

    private final String providerId;
    private final FailureKind failureKind;
    private final boolean providerAttributable;
    private final int statusCode;

    public ProviderCallException(
            String providerId,
            FailureKind failureKind,
            boolean providerAttributable,
            int statusCode,
            String message,
            Throwable cause
    ) {
        super(message, cause);
        this.providerId = providerId;
        this.failureKind = failureKind;
        this.providerAttributable = providerAttributable;
        this.statusCode = statusCode;
    }

    public ProviderCallException(String providerId, FailureKind failureKind, String message) {
        this(providerId, failureKind, failureKind.isProviderAttributable(), 0, message, null);
    }

    public static ProviderCallException retryable(String providerId, String message) {
        return new ProviderCallException(providerId, FailureKind.RETRYABLE, message);
    }

    public static ProviderCallException nonRetryable(String providerId, String message) {
        return new ProviderCallException(providerId, FailureKind.NON_RETRYABLE, message);
    }

    public static ProviderCallException timeout(String providerId, String message) {
        return new ProviderCallException(providerId, FailureKind.TIMEOUT, message);
    }

    /**
     * Classifies an HTTP-like status code: 408, 429 and 5xx are retryable,
     * other 4xx are client errors.
     */
    public static ProviderCallException forStatus(String providerId, int statusCode, String message) {
        if (statusCode == 408) {
            return new ProviderCallException(providerId, FailureKind.TIMEOUT, true, statusCode, message, null);
        }
        if (statusCode == 429 || statusCode >= 500) {
            return new ProviderCallException(providerId, FailureKind.RETRYABLE, true, statusCode, message, null);
        }
        return new ProviderCallException(providerId, FailureKind.NON_RETRYABLE, false, statusCode, message, null);
    }

    /**
     * Classifies any throwable coming out of an adapter. Unknown errors are
     * treated as retryable provider failures.
     */
    public static ProviderCallException classify(String providerId, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof ProviderCallException pce) {
            return pce;
        }
        if (cause instanceof TimeoutException) {
            return new ProviderCallException(
                    providerId, FailureKind.TIMEOUT, true, 0, "Provider call timed out", cause);
        }
        if (cause instanceof IOException) {
            return new ProviderCallException(
                    providerId, FailureKind.RETRYABLE, true, 0, "I/O error: " + cause.getMessage(), cause);
        }
        return new ProviderCallException(
                providerId, FailureKind.RETRYABLE, true, 0,
                "Unexpected adapter error: " + cause.getClass().getSimpleName(), cause);
    }

    /**
     * Strips the async wrappers added by {@link java.util.concurrent.CompletableFuture}.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static boolean isCancellation(Throwable error) {
        return unwrap(error) instanceof CancellationException;
    }

    public String getProviderId() {
        return providerId;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public boolean isRetryable() {
        return failureKind.isRetryable();
    }

    public boolean isProviderAttributable() {
        return providerAttributable;
    }

    /**
     * Status code reported by the provider, 0 when not applicable.
     */
    public int getStatusCode() {
        return statusCode;
    }
}

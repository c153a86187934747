package com.pensionai.orchestration.service;

import com.pensionai.config.AdvisorProperties;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounded retry around calls to external collaborators (route classifier, workers, narrative
 * synthesizer). With the default configuration a failing call is attempted twice.
 *
 * <p>When the run has a deadline every attempt runs on the collaborator executor and is cut
 * off by a {@link TimeLimiter} at the time that is left. Running out of time raises
 * {@link CollaboratorTimeoutException}, which is not retried.
 */
@Component
@Slf4j
public class CollaboratorRetry {

    private final RetryConfig retryConfig;
    private final ExecutorService collaboratorExecutor;

    public CollaboratorRetry(AdvisorProperties properties,
                             @Qualifier("collaboratorExecutor") ExecutorService collaboratorExecutor) {
        AdvisorProperties.RetryConfig config = properties.getRetry();
        Duration wait = config.getWaitDuration() != null ? config.getWaitDuration() : Duration.ofMillis(300);
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, config.getMaxAttempts()))
                .waitDuration(wait)
                .ignoreExceptions(CollaboratorTimeoutException.class)
                .build();
        this.collaboratorExecutor = collaboratorExecutor;
    }

    public <T> T call(String collaborator, Supplier<T> call) {
        return call(collaborator, null, call);
    }

    public <T> T call(String collaborator, @Nullable Instant deadline, Supplier<T> call) {
        Retry retry = Retry.of(collaborator, retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} (attempt {}) after failure: {}",
                collaborator, event.getNumberOfRetryAttempts() + 1, describe(event.getLastThrowable())));
        if (deadline == null) {
            return retry.executeSupplier(call);
        }
        return retry.executeSupplier(() -> callBefore(collaborator, deadline, call));
    }

    private <T> T callBefore(String collaborator, Instant deadline, Supplier<T> call) {
        Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new CollaboratorTimeoutException(collaborator, null);
        }
        TimeLimiter timeLimiter = TimeLimiter.of(collaborator, TimeLimiterConfig.custom()
                .timeoutDuration(remaining)
                .cancelRunningFuture(true)
                .build());
        Callable<T> task = call::get;
        try {
            return timeLimiter.executeFutureSupplier(() -> collaboratorExecutor.submit(task));
        } catch (TimeoutException ex) {
            log.warn("{} timed out after {} ms.", collaborator, remaining.toMillis());
            throw new CollaboratorTimeoutException(collaborator, ex);
        } catch (RuntimeException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + collaborator, ex);
        } catch (Exception ex) {
            throw new IllegalStateException(collaborator + " failed: " + ex.getMessage(), ex);
        }
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown";
        }
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}

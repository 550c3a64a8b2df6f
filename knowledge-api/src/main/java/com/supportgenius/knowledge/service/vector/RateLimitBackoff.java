package com.supportgenius.knowledge.service.vector;

import com.supportgenius.knowledge.exception.KnowledgeErrorCode;
import com.supportgenius.knowledge.exception.KnowledgeException;
import com.supportgenius.knowledge.exception.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retries an operation while it fails with a rate-limit error, waiting {@code baseDelay * 2^n}
 * between attempts. Any other error propagates on the first occurrence. When every attempt was
 * rate limited the last error is wrapped in a {@link RateLimitedException}.
 */
public class RateLimitBackoff {

    private static final Logger log = LoggerFactory.getLogger(RateLimitBackoff.class);
    private static final String RATE_LIMIT_MESSAGE = "rate limit exceeded";

    private final Predicate<Throwable> rateLimited;
    private final int maxAttempts;
    private final RetryTemplate retryTemplate;

    public RateLimitBackoff(Predicate<Throwable> rateLimited, int maxAttempts, long baseDelayMillis, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.rateLimited = rateLimited;
        this.maxAttempts = maxAttempts;

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(baseDelayMillis);
        backOffPolicy.setMultiplier(2.0);
        backOffPolicy.setMaxInterval(baseDelayMillis << (maxAttempts - 1));
        backOffPolicy.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new ClassifyingRetryPolicy(maxAttempts, rateLimited));
        template.setBackOffPolicy(backOffPolicy);
        template.registerListener(new RateLimitLogger(baseDelayMillis));
        this.retryTemplate = template;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        try {
            return retryTemplate.execute(context -> {
                context.setAttribute(RetryContext.NAME, operation);
                return action.get();
            });
        } catch (RuntimeException ex) {
            if (rateLimited.test(ex)) {
                throw new RateLimitedException(operation, maxAttempts, ex);
            }
            throw ex;
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Default classifier: HTTP 429 from either remote service, a {@link KnowledgeException} already
     * tagged {@link KnowledgeErrorCode#RATE_LIMITED}, or a "rate limit exceeded" message anywhere in
     * the cause chain.
     */
    public static boolean isRateLimitError(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof KnowledgeException knowledgeException
                    && knowledgeException.code() == KnowledgeErrorCode.RATE_LIMITED) {
                return true;
            }
            if (current instanceof WebClientResponseException responseException
                    && responseException.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(RATE_LIMIT_MESSAGE)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static final class ClassifyingRetryPolicy extends SimpleRetryPolicy {

        private final Predicate<Throwable> retryable;

        private ClassifyingRetryPolicy(int maxAttempts, Predicate<Throwable> retryable) {
            super(maxAttempts);
            this.retryable = retryable;
        }

        @Override
        public boolean canRetry(RetryContext context) {
            Throwable last = context.getLastThrowable();
            return (last == null || retryable.test(last)) && context.getRetryCount() < getMaxAttempts();
        }
    }

    private final class RateLimitLogger implements RetryListener {

        private final long baseDelayMillis;

        private RateLimitLogger(long baseDelayMillis) {
            this.baseDelayMillis = baseDelayMillis;
        }

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
            int failures = context.getRetryCount();
            if (!rateLimited.test(throwable) || failures >= maxAttempts) {
                return;
            }
            long waitMillis = baseDelayMillis << (failures - 1);
            log.warn("Rate limit hit during {}, waiting {} ms before attempt {}/{}",
                    context.getAttribute(RetryContext.NAME), waitMillis, failures + 1, maxAttempts);
        }
    }
}

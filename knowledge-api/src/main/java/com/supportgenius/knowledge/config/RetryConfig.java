package com.supportgenius.knowledge.config;

import com.supportgenius.knowledge.service.vector.RateLimitBackoff;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ThreadWaitSleeper;

@Configuration
public class RetryConfig {

    @Bean
    public RateLimitBackoff rateLimitBackoff(@Value("${knowledge.backoff.max-attempts:5}") int maxAttempts,
                                             @Value("${knowledge.backoff.base-delay-ms:1000}") long baseDelayMillis) {
        return new RateLimitBackoff(RateLimitBackoff::isRateLimitError, maxAttempts, baseDelayMillis, new ThreadWaitSleeper());
    }
}

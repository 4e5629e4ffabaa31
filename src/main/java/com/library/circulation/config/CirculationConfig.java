package com.library.circulation.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(CirculationProperties.class)
public class CirculationConfig {

    private static final Logger log = LoggerFactory.getLogger(CirculationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Retry template for per-title units of work. Only lock timeouts, deadlocks and
     * optimistic version conflicts ({@link ConcurrencyFailureException} and subclasses)
     * are retried; business rejections propagate on the first attempt.
     */
    @Bean
    public RetryTemplate circulationRetryTemplate(CirculationProperties properties) {
        CirculationProperties.Retry retry = properties.getRetry();

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(retry.getMaxAttempts(),
            Map.of(ConcurrencyFailureException.class, true), true);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(retry.getInitialBackoff().toMillis());
        backOffPolicy.setMultiplier(retry.getMultiplier());
        backOffPolicy.setMaxInterval(retry.getMaxBackoff().toMillis());

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(retryPolicy);
        retryTemplate.setBackOffPolicy(backOffPolicy);
        retryTemplate.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                         Throwable throwable) {
                log.debug("Per-title unit failed on attempt {}: {}", context.getRetryCount(), throwable.toString());
            }
        });
        return retryTemplate;
    }
}

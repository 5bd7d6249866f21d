package dev.bulletin.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/** Activates {@code @Retryable} proxies for the remote knowledge-base download. */
@Configuration
@EnableRetry
public class RetryConfig {}

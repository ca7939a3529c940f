package com.lntracker.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry policy for upstream calls and subscriptions: fixed delay, budget refilled when an
 * attempt ran longer than the tolerance window. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "lntracker.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Retries after the first failed attempt. Default 5. */
    private int maxRetries = 5;

    /** Wait between attempts. Default 300s. */
    private Duration delay = Duration.ofSeconds(300);

    /** An attempt that fails after running this long refills the budget. Default 900s. */
    private Duration toleranceWindow = Duration.ofSeconds(900);
}

package com.lntracker.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection to the lnd REST gateway.
 */
@ConfigurationProperties(prefix = "lntracker.lnd")
@NoArgsConstructor
@Getter
@Setter
public class LndProperties {

    private String baseUrl = "https://localhost:8080";

    /** Path to the admin or readonly macaroon file. Ignored when macaroonHex is set. */
    private String macaroonPath;

    private String macaroonHex;

    /** PEM certificate of the node; when empty the JVM trust store is used. */
    private String tlsCertPath;

    /** Timeout of unary calls (getinfo, list pages). */
    private Duration requestTimeout = Duration.ofSeconds(60);

    /** Max size of one buffered response. lnd pages of 1000 payments can get large. */
    private int maxInMemorySizeMb = 50;
}

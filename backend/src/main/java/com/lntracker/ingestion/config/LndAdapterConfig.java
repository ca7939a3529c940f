package com.lntracker.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lntracker.ingestion.adapter.ErrorClassifier;
import com.lntracker.ingestion.adapter.lnd.LndErrorClassifier;
import com.lntracker.ingestion.adapter.lnd.LndNodeAdapter;
import com.lntracker.ingestion.adapter.lnd.WebClientLndRestClient;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;

/**
 * lnd REST client: base URL, macaroon header, node certificate and buffer limits from {@link LndProperties}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(LndProperties.class)
public class LndAdapterConfig {

    @Bean
    public ErrorClassifier lndErrorClassifier() {
        return new LndErrorClassifier();
    }

    @Bean
    public LndNodeAdapter lndNodeAdapter(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, LndProperties properties) {
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(properties.getBaseUrl())
                .codecs(c -> c.defaultCodecs().maxInMemorySize(properties.getMaxInMemorySizeMb() * 1024 * 1024));
        String macaroon = macaroonHex(properties);
        if (macaroon != null) {
            builder.defaultHeader(WebClientLndRestClient.MACAROON_HEADER, macaroon);
        } else {
            log.warn("No macaroon configured for lnd at {}", properties.getBaseUrl());
        }
        if (properties.getTlsCertPath() != null && !properties.getTlsCertPath().isBlank()) {
            HttpClient httpClient = HttpClient.create()
                    .secure(spec -> spec.sslContext(sslContext(properties.getTlsCertPath())));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        return new WebClientLndRestClient(builder.build(), objectMapper, properties.getRequestTimeout());
    }

    static String macaroonHex(LndProperties properties) {
        if (properties.getMacaroonHex() != null && !properties.getMacaroonHex().isBlank()) {
            return properties.getMacaroonHex().trim();
        }
        if (properties.getMacaroonPath() == null || properties.getMacaroonPath().isBlank()) {
            return null;
        }
        try {
            return HexFormat.of().formatHex(Files.readAllBytes(Path.of(properties.getMacaroonPath())));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read macaroon " + properties.getMacaroonPath(), e);
        }
    }

    private static SslContext sslContext(String certPath) {
        try {
            return SslContextBuilder.forClient().trustManager(new File(certPath)).build();
        } catch (SSLException e) {
            throw new IllegalStateException("Cannot load lnd certificate " + certPath, e);
        }
    }
}

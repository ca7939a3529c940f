package com.lntracker.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lntracker.ingestion.adapter.lnd.LndNodeAdapter;
import com.lntracker.ingestion.adapter.lnd.WebClientLndRestClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LndAdapterConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void macaroonHex_readsFileAsHex() throws Exception {
        Path macaroon = tempDir.resolve("readonly.macaroon");
        Files.write(macaroon, new byte[]{0x02, 0x01, (byte) 0xfe});
        LndProperties properties = new LndProperties();
        properties.setMacaroonPath(macaroon.toString());

        assertThat(LndAdapterConfig.macaroonHex(properties)).isEqualTo("0201fe");
    }

    @Test
    void macaroonHex_inlineValueWinsOverPath() {
        LndProperties properties = new LndProperties();
        properties.setMacaroonHex(" 0a0b \n");
        properties.setMacaroonPath("/does/not/exist");

        assertThat(LndAdapterConfig.macaroonHex(properties)).isEqualTo("0a0b");
    }

    @Test
    void macaroonHex_nothingConfigured_isNull() {
        assertThat(LndAdapterConfig.macaroonHex(new LndProperties())).isNull();
    }

    @Test
    void macaroonHex_missingFile_failsStartup() {
        LndProperties properties = new LndProperties();
        properties.setMacaroonPath(tempDir.resolve("missing.macaroon").toString());

        assertThatThrownBy(() -> LndAdapterConfig.macaroonHex(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing.macaroon");
    }

    @Test
    void lndNodeAdapter_sendsConfiguredMacaroonAndBaseUrl() {
        List<ClientRequest> requests = new CopyOnWriteArrayList<>();
        WebClient.Builder webClientBuilder = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body("{\"identity_pubkey\":\"02abc\"}")
                            .build());
                });
        LndProperties properties = new LndProperties();
        properties.setBaseUrl("http://lnd.test:8080");
        properties.setMacaroonHex("0201");

        LndNodeAdapter adapter = new LndAdapterConfig().lndNodeAdapter(webClientBuilder, new ObjectMapper(), properties);

        assertThat(adapter.getInfo().identityPubkey()).isEqualTo("02abc");
        assertThat(requests).singleElement().satisfies(r -> {
            assertThat(r.url().getHost()).isEqualTo("lnd.test");
            assertThat(r.headers().getFirst(WebClientLndRestClient.MACAROON_HEADER)).isEqualTo("0201");
        });
    }
}

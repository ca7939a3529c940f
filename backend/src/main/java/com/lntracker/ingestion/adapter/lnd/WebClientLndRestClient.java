package com.lntracker.ingestion.adapter.lnd;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lntracker.common.CloseableIterator;
import com.lntracker.ingestion.adapter.RpcException;
import com.lntracker.ingestion.adapter.RpcStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * lnd REST gateway client using WebClient. Streaming endpoints answer with one JSON object
 * per message, either {@code {"result": ...}} or {@code {"error": {"code": .., "message": ..}}}.
 */
@Slf4j
public class WebClientLndRestClient implements LndNodeAdapter {

    public static final String MACAROON_HEADER = "Grpc-Metadata-macaroon";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public WebClientLndRestClient(WebClient webClient, ObjectMapper objectMapper, Duration requestTimeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public NodeInfo getInfo() {
        return get("getinfo", b -> b.path("/v1/getinfo").build(), NodeInfo.class);
    }

    @Override
    public ListPaymentsResponse listPayments(ListPaymentsRequest request) {
        return get("listpayments", b -> {
            b.path("/v1/payments")
                    .queryParam("include_incomplete", request.includeIncomplete())
                    .queryParam("index_offset", request.indexOffset())
                    .queryParam("max_payments", request.maxPayments());
            if (request.creationDateStart() != null) {
                b.queryParam("creation_date_start", request.creationDateStart());
            }
            return b.build();
        }, ListPaymentsResponse.class);
    }

    @Override
    public ListInvoicesResponse listInvoices(ListInvoicesRequest request) {
        return get("listinvoices", b -> {
            b.path("/v1/invoices")
                    .queryParam("index_offset", request.indexOffset())
                    .queryParam("num_max_invoices", request.numMaxInvoices());
            if (request.creationDateStart() != null) {
                b.queryParam("creation_date_start", request.creationDateStart());
            }
            return b.build();
        }, ListInvoicesResponse.class);
    }

    @Override
    public ForwardingHistoryResponse forwardingHistory(ForwardingHistoryRequest request) {
        Map<String, Object> body = Map.of(
                "start_time", "0",
                "index_offset", request.indexOffset(),
                "num_max_events", request.numMaxEvents()
        );
        ForwardingHistoryResponse response = webClient.post()
                .uri("/v1/switch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ForwardingHistoryResponse.class)
                .onErrorMap(e -> toRpcException("forwardinghistory", e))
                .block(requestTimeout);
        return requireBody("forwardinghistory", response);
    }

    @Override
    public CloseableIterator<LndPayment> trackPayments() {
        return subscribe("trackpayments",
                b -> b.path("/v2/router/payments").queryParam("no_inflight_updates", false).build(),
                LndPayment.class);
    }

    @Override
    public CloseableIterator<LndInvoice> subscribeInvoices() {
        return subscribe("subscribeinvoices", b -> b.path("/v1/invoices/subscribe").build(), LndInvoice.class);
    }

    @Override
    public CloseableIterator<LndHtlcEvent> subscribeHtlcEvents() {
        return subscribe("subscribehtlcevents", b -> b.path("/v2/router/htlcevents").build(), LndHtlcEvent.class);
    }

    @Override
    public CloseableIterator<LndChannelEvent> subscribeChannelEvents() {
        return subscribeRaw("subscribechannelevents", "/v1/channels/subscribe", LndChannelEvent::fromJson);
    }

    @Override
    public CloseableIterator<LndPeerEvent> subscribePeerEvents() {
        return subscribeRaw("subscribepeerevents", "/v1/peers/subscribe", LndPeerEvent::fromJson);
    }

    @Override
    public CloseableIterator<LndOnchainTransaction> subscribeTransactions() {
        return subscribeRaw("subscribetransactions", "/v1/transactions/subscribe", LndOnchainTransaction::fromJson);
    }

    @Override
    public CloseableIterator<LndGraphUpdate> subscribeChannelGraph() {
        return subscribeRaw("subscribechannelgraph", "/v1/graph/subscribe", LndGraphUpdate::fromJson);
    }

    private <T> T get(String method, Function<UriBuilder, URI> uri, Class<T> type) {
        T response = webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(type)
                .onErrorMap(e -> toRpcException(method, e))
                .block(requestTimeout);
        return requireBody(method, response);
    }

    private <T> CloseableIterator<T> subscribe(String method, Function<UriBuilder, URI> uri, Class<T> type) {
        Flux<T> flux = streamResults(method, uri).map(node -> convert(method, node, type));
        log.debug("Opening {} subscription", method);
        return new FluxSubscriptionIterator<>(method, flux);
    }

    private <T> CloseableIterator<T> subscribeRaw(String method, String path, Function<JsonNode, T> mapper) {
        Flux<T> flux = streamResults(method, b -> b.path(path).build()).map(mapper);
        log.debug("Opening {} subscription", method);
        return new FluxSubscriptionIterator<>(method, flux);
    }

    private Flux<JsonNode> streamResults(String method, Function<UriBuilder, URI> uri) {
        return webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON, MediaType.APPLICATION_NDJSON)
                .retrieve()
                .bodyToFlux(JsonNode.class)
                .onErrorMap(e -> toRpcException(method, e))
                .<JsonNode>handle((node, sink) -> {
                    JsonNode error = node.get("error");
                    if (error != null && !error.isNull()) {
                        sink.error(rpcExceptionFromErrorNode(method, error));
                        return;
                    }
                    JsonNode result = node.get("result");
                    sink.next(result != null ? result : node);
                });
    }

    private <T> T convert(String method, JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (Exception e) {
            throw new RpcException(RpcStatus.INTERNAL, method + ": cannot read message: " + e.getMessage(), e);
        }
    }

    private static <T> T requireBody(String method, T response) {
        if (response == null) {
            throw new RpcException(RpcStatus.UNKNOWN, method + ": empty response");
        }
        return response;
    }

    private Throwable toRpcException(String method, Throwable e) {
        if (e instanceof RpcException) {
            return e;
        }
        if (e instanceof WebClientResponseException wre) {
            String body = wre.getResponseBodyAsString();
            try {
                JsonNode node = body.isBlank() ? null : objectMapper.readTree(body);
                JsonNode error = node != null && node.has("error") ? node.get("error") : node;
                if (error != null && error.has("code")) {
                    return rpcExceptionFromErrorNode(method, error);
                }
            } catch (Exception parseError) {
                log.debug("{}: error body is not JSON: {}", method, parseError.getMessage());
            }
            return new RpcException(RpcStatus.fromHttpStatus(wre.getStatusCode().value()),
                    method + ": " + wre.getMessage(), wre);
        }
        if (e instanceof WebClientRequestException) {
            return new RpcException(RpcStatus.UNAVAILABLE, method + ": " + e.getMessage(), e);
        }
        return new RpcException(RpcStatus.UNKNOWN, method + ": " + e.getMessage(), e);
    }

    private static RpcException rpcExceptionFromErrorNode(String method, JsonNode error) {
        RpcStatus status = RpcStatus.fromCode(error.path("code").asInt(RpcStatus.UNKNOWN.getCode()));
        String message = error.path("message").asText("");
        return new RpcException(status, method + ": " + message);
    }
}

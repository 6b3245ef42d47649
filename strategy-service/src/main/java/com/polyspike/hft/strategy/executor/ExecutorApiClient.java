package com.polyspike.hft.strategy.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.domain.HftHeaders;
import com.polyspike.hft.polymarket.api.ExecutorAccountResponse;
import com.polyspike.hft.polymarket.api.LimitOrderRequest;
import com.polyspike.hft.polymarket.api.MarketOrderRequest;
import com.polyspike.hft.polymarket.api.OrderSubmissionResult;
import com.polyspike.hft.polymarket.http.HttpRequestFactory;
import com.polyspike.hft.polymarket.http.PolymarketHttpTransport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

/**
 * Client of the executor service, which signs and submits orders on the engine's behalf.
 * <p>
 * Order submissions are sent once. Failures surface as the transport's exceptions so callers can tell a refused
 * request from one whose outcome is unknown.
 */
@Component
@RequiredArgsConstructor
public class ExecutorApiClient {

    private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(5);

    private final HftProperties properties;
    private final PolymarketHttpTransport transport;
    private final ObjectMapper objectMapper;

    public OrderSubmissionResult placeMarketOrder(MarketOrderRequest requestBody) {
        return postOrder("/api/polymarket/orders/market", requestBody);
    }

    public OrderSubmissionResult placeLimitOrder(LimitOrderRequest requestBody) {
        return postOrder("/api/polymarket/orders/limit", requestBody);
    }

    public ExecutorAccountResponse getAccount() {
        HttpRequest request = baseRequest("/api/polymarket/account")
                .GET()
                .timeout(HTTP_TIMEOUT)
                .header("Accept", "application/json")
                .build();
        return transport.sendJson(request, ExecutorAccountResponse.class);
    }

    private OrderSubmissionResult postOrder(String path, Object body) {
        HttpRequest request = baseRequest(path)
                .POST(HttpRequest.BodyPublishers.ofString(writeJson(body)))
                .timeout(HTTP_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .build();
        return transport.sendJson(request, OrderSubmissionResult.class);
    }

    private HttpRequest.Builder baseRequest(String path) {
        HttpRequest.Builder builder = requestFactory().request(path, Map.of());
        if (Boolean.TRUE.equals(properties.executor().sendLiveAck())) {
            builder.header(HftHeaders.LIVE_ACK, "true");
        }
        return builder;
    }

    private HttpRequestFactory requestFactory() {
        return new HttpRequestFactory(URI.create(properties.executor().baseUrl()));
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to encode JSON", e);
        }
    }
}

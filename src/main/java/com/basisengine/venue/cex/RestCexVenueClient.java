package com.basisengine.venue.cex;

import com.basisengine.exception.VenueApiException;
import com.basisengine.venue.RequestSigner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Exchange client over signed REST calls.
 *
 * <p>Endpoints (relative to the venue base URL):
 * <ul>
 *   <li>{@code POST /api/v1/orders}, {@code GET /api/v1/orders/{id}},
 *       {@code GET /api/v1/orders?clientOrderId=}, {@code DELETE /api/v1/orders/{id}}</li>
 *   <li>{@code POST /api/v1/withdrawals}, {@code GET /api/v1/withdrawals/{id}}</li>
 *   <li>{@code GET /api/v1/balances}</li>
 * </ul>
 *
 * <p>HTTP failures become {@link VenueApiException}: 429, 5xx and I/O errors are retryable,
 * other 4xx are not. Error bodies of the form {@code {"code": "...", "message": "..."}} supply
 * the venue code.
 */
public class RestCexVenueClient implements CexVenueClient {

    private static final Logger log = LoggerFactory.getLogger(RestCexVenueClient.class);

    private static final String ORDERS = "/api/v1/orders";
    private static final String WITHDRAWALS = "/api/v1/withdrawals";
    private static final String BALANCES = "/api/v1/balances";

    private final String venueName;
    private final RestClient restClient;
    private final RequestSigner signer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RestCexVenueClient(
            String venueName, RestClient restClient, RequestSigner signer, ObjectMapper objectMapper, Clock clock) {
        this.venueName = venueName;
        this.restClient = restClient;
        this.signer = signer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public CexOrder placeOrder(CexOrderRequest request) {
        return call("placeOrder", () -> post(ORDERS, request, CexOrder.class));
    }

    @Override
    public CexOrder getOrder(String orderId) {
        return call("getOrder", () -> get(ORDERS + "/" + orderId, CexOrder.class));
    }

    @Override
    public Optional<CexOrder> findOrderByClientId(String clientOrderId) {
        try {
            return Optional.ofNullable(
                    call("findOrderByClientId", () -> get(ORDERS + "?clientOrderId=" + clientOrderId, CexOrder.class)));
        } catch (VenueApiException e) {
            if (e.getHttpStatus() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public CexOrder cancelOrder(String orderId) {
        return call("cancelOrder", () -> {
            String path = ORDERS + "/" + orderId;
            return restClient
                    .delete()
                    .uri(path)
                    .headers(h -> signer.apply(h, clock.millis(), HttpMethod.DELETE.name(), path, null))
                    .retrieve()
                    .body(CexOrder.class);
        });
    }

    @Override
    public CexWithdrawal withdraw(CexWithdrawalRequest request) {
        return call("withdraw", () -> post(WITHDRAWALS, request, CexWithdrawal.class));
    }

    @Override
    public CexWithdrawal getWithdrawal(String withdrawalId) {
        return call("getWithdrawal", () -> get(WITHDRAWALS + "/" + withdrawalId, CexWithdrawal.class));
    }

    @Override
    public Map<String, BigDecimal> getBalances() {
        return call("getBalances", () -> restClient
                .get()
                .uri(BALANCES)
                .headers(h -> signer.apply(h, clock.millis(), HttpMethod.GET.name(), BALANCES, null))
                .retrieve()
                .body(new ParameterizedTypeReference<Map<String, BigDecimal>>() {}));
    }

    private <T> T get(String path, Class<T> type) {
        return restClient
                .get()
                .uri(path)
                .headers(h -> signer.apply(h, clock.millis(), HttpMethod.GET.name(), path, null))
                .retrieve()
                .body(type);
    }

    private <T> T post(String path, Object request, Class<T> type) {
        String body = toJson(request);
        return restClient
                .post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> signer.apply(h, clock.millis(), HttpMethod.POST.name(), path, body))
                .body(body)
                .retrieve()
                .body(type);
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("{} rate limited on {}: {}", operation, venueName, e.getMessage());
            throw new VenueApiException(venueName, 429, "RATE_LIMITED", operation + " rate limited", true, e);
        } catch (HttpServerErrorException e) {
            throw new VenueApiException(
                    venueName,
                    e.getStatusCode().value(),
                    venueCode(e),
                    operation + " failed with server error " + e.getStatusCode().value(),
                    true,
                    e);
        } catch (RestClientResponseException e) {
            throw new VenueApiException(
                    venueName,
                    e.getStatusCode().value(),
                    venueCode(e),
                    operation + " rejected (" + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(),
                    false,
                    e);
        } catch (ResourceAccessException e) {
            log.warn("{} I/O error on {}: {}", operation, venueName, e.getMessage());
            throw new VenueApiException(venueName, 0, null, operation + " I/O error: " + e.getMessage(), true, e);
        }
    }

    private String venueCode(RestClientResponseException e) {
        String body = e.getResponseBodyAsString();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node.hasNonNull("code") ? node.get("code").asText() : null;
        } catch (JsonProcessingException ex) {
            log.debug("Non-JSON error body from {}: {}", venueName, body);
            return null;
        }
    }

    private String toJson(Object request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise " + request.getClass().getSimpleName(), e);
        }
    }
}

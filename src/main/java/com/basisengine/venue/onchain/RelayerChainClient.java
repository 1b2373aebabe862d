package com.basisengine.venue.onchain;

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
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Chain client talking to a signing relayer sidecar that holds the wallet key.
 *
 * <p>Relayer API:
 * <ul>
 *   <li>{@code POST /transactions}: body {@link ChainTransaction}, answers {@code {"txHash": "0x.."}}</li>
 *   <li>{@code GET /transactions/{hash}/receipt}: 404 while not mined</li>
 *   <li>{@code GET /blocks/latest}: answers {@code {"number": 123}}</li>
 *   <li>{@code GET /balances}: asset to amount</li>
 * </ul>
 */
public class RelayerChainClient implements ChainClient {

    private static final Logger log = LoggerFactory.getLogger(RelayerChainClient.class);

    private final String venueName;
    private final RestClient restClient;
    private final RequestSigner signer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RelayerChainClient(
            String venueName, RestClient restClient, RequestSigner signer, ObjectMapper objectMapper, Clock clock) {
        this.venueName = venueName;
        this.restClient = restClient;
        this.signer = signer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String broadcast(ChainTransaction transaction) {
        String body = toJson(transaction);
        JsonNode response = call("broadcast", () -> restClient
                .post()
                .uri("/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> signer.apply(h, clock.millis(), HttpMethod.POST.name(), "/transactions", body))
                .body(body)
                .retrieve()
                .body(JsonNode.class));
        if (response == null || !response.hasNonNull("txHash")) {
            throw new VenueApiException(venueName, 200, null, "Relayer answered without txHash", false);
        }
        return response.get("txHash").asText();
    }

    @Override
    public Optional<ChainReceipt> getReceipt(String txHash) {
        String path = "/transactions/" + txHash + "/receipt";
        try {
            return Optional.ofNullable(call("getReceipt", () -> get(path, ChainReceipt.class)));
        } catch (VenueApiException e) {
            if (e.getHttpStatus() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public long latestBlock() {
        JsonNode block = call("latestBlock", () -> get("/blocks/latest", JsonNode.class));
        if (block == null || !block.hasNonNull("number")) {
            throw new VenueApiException(venueName, 200, null, "Relayer answered without block number", true);
        }
        return block.get("number").asLong();
    }

    @Override
    public Map<String, BigDecimal> getBalances() {
        return call("getBalances", () -> restClient
                .get()
                .uri("/balances")
                .headers(h -> signer.apply(h, clock.millis(), HttpMethod.GET.name(), "/balances", null))
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

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpServerErrorException e) {
            throw new VenueApiException(
                    venueName, e.getStatusCode().value(), errorCode(e), operation + " relayer error", true, e);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new VenueApiException(
                    venueName,
                    status,
                    errorCode(e),
                    operation + " rejected (" + status + "): " + e.getResponseBodyAsString(),
                    status == HttpStatus.TOO_MANY_REQUESTS.value(),
                    e);
        } catch (ResourceAccessException e) {
            log.warn("{} I/O error on relayer for {}: {}", operation, venueName, e.getMessage());
            throw new VenueApiException(venueName, 0, null, operation + " I/O error: " + e.getMessage(), true, e);
        }
    }

    private String errorCode(RestClientResponseException e) {
        try {
            JsonNode node = objectMapper.readTree(e.getResponseBodyAsString());
            return node != null && node.hasNonNull("code") ? node.get("code").asText() : null;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise transaction", e);
        }
    }
}

package com.basisengine.venue;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.http.HttpHeaders;

/**
 * HMAC-SHA256 request signing shared by the REST venue clients.
 *
 * <p>The signed payload is {@code timestamp + METHOD + pathAndQuery + body}; the hex digest goes
 * in {@code X-SIGNATURE} next to {@code X-API-KEY} and {@code X-TIMESTAMP}.
 */
public class RequestSigner {

    public static final String API_KEY_HEADER = "X-API-KEY";
    public static final String TIMESTAMP_HEADER = "X-TIMESTAMP";
    public static final String SIGNATURE_HEADER = "X-SIGNATURE";

    private static final String ALGORITHM = "HmacSHA256";

    private final String apiKey;
    private final SecretKeySpec secretKey;

    public RequestSigner(String apiKey, String apiSecret) {
        this.apiKey = apiKey != null ? apiKey : "";
        this.secretKey = new SecretKeySpec(
                (apiSecret != null ? apiSecret : "").getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String sign(long timestamp, String method, String pathAndQuery, String body) {
        String payload = timestamp + method + pathAndQuery + (body != null ? body : "");
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(secretKey);
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC signing unavailable", e);
        }
    }

    /** Adds the three auth headers for one request. */
    public void apply(HttpHeaders headers, long timestamp, String method, String pathAndQuery, String body) {
        headers.set(API_KEY_HEADER, apiKey);
        headers.set(TIMESTAMP_HEADER, Long.toString(timestamp));
        headers.set(SIGNATURE_HEADER, sign(timestamp, method, pathAndQuery, body));
    }
}

package io.cryptomm.engine.exchange;

import io.cryptomm.engine.core.exception.ExchangeException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 request signer. Built on the first trading call, not at startup.
 */
@Slf4j
public class RequestSigner {
    private static final String ALGORITHM = "HmacSHA256";

    @Getter
    private final String apiKey;
    private final SecretKeySpec key;

    public RequestSigner(String apiKey, String apiSecret) {
        if (apiKey == null || apiKey.isBlank() || apiSecret == null || apiSecret.isBlank()) {
            throw new ExchangeException("Exchange credentials are not configured");
        }
        this.apiKey = apiKey;
        this.key = new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        // Fail now rather than on the first signature
        newMac();
        log.info("Request signer initialized for key {}...", apiKey.substring(0, Math.min(4, apiKey.length())));
    }

    public String sign(String payload) {
        byte[] digest = newMac().doFinal(payload.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }

    private Mac newMac() {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac;
        } catch (GeneralSecurityException e) {
            throw new ExchangeException("Cannot initialize " + ALGORITHM + " signer", e);
        }
    }
}

package com.fxtrader.core.api;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * Request signature: lowercase hex HMAC-SHA256 over {@code timestamp + method + path + body}.
 */
public final class HmacSigner {
    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec keySpec;

    public HmacSigner(String apiSecret) {
        this.keySpec = new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    /**
     * @param path request path without query string
     * @param body JSON body, empty for GET
     */
    public String sign(long timestampMs, String method, String path, String body) {
        try {
            Mac hmac = Mac.getInstance(ALGORITHM);
            hmac.init(keySpec);
            String message = timestampMs + method + path + (body == null ? "" : body);
            byte[] signature = hmac.doFinal(message.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(signature);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}

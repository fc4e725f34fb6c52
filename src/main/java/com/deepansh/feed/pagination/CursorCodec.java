package com.deepansh.feed.pagination;

import com.deepansh.feed.config.FeedProperties;
import com.deepansh.feed.exception.InvalidCursorException;
import com.deepansh.feed.model.CursorPosition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;

/**
 * Opaque, tamper-evident cursor encoding.
 *
 * Format: base64url(json{"sid","off"}) + "." + base64url(first 16 bytes of HMAC-SHA256(payload))
 */
@Component
public class CursorCodec {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int SIGNATURE_BYTES = 16;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper objectMapper;
    private final SecretKeySpec key;

    public CursorCodec(ObjectMapper objectMapper, FeedProperties properties) {
        String secret = properties.getCursor().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("feed.cursor.secret must be set");
        }
        this.objectMapper = objectMapper;
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    public String encode(CursorPosition position) {
        ObjectNode node = objectMapper.createObjectNode()
                .put("sid", position.sessionId())
                .put("off", position.offset());
        String payload;
        try {
            payload = ENCODER.encodeToString(objectMapper.writeValueAsBytes(node));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode cursor", e);
        }
        return payload + "." + ENCODER.encodeToString(sign(payload));
    }

    public CursorPosition decode(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            throw new InvalidCursorException("empty");
        }
        int dot = cursor.indexOf('.');
        if (dot <= 0 || dot != cursor.lastIndexOf('.') || dot == cursor.length() - 1) {
            throw new InvalidCursorException("malformed");
        }

        String payload = cursor.substring(0, dot);
        byte[] signature;
        byte[] json;
        try {
            signature = DECODER.decode(cursor.substring(dot + 1));
            json = DECODER.decode(payload);
        } catch (IllegalArgumentException e) {
            throw new InvalidCursorException("not base64url");
        }

        if (!MessageDigest.isEqual(signature, sign(payload))) {
            throw new InvalidCursorException("signature mismatch");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new InvalidCursorException("unreadable payload");
        }

        JsonNode sid = node.get("sid");
        JsonNode off = node.get("off");
        if (sid == null || !sid.isTextual() || sid.asText().isBlank()) {
            throw new InvalidCursorException("missing session");
        }
        if (off == null || !off.isInt() || off.asInt() < 0) {
            throw new InvalidCursorException("bad offset");
        }
        return new CursorPosition(sid.asText(), off.asInt());
    }

    private byte[] sign(String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            byte[] full = mac.doFinal(payload.getBytes(StandardCharsets.US_ASCII));
            return Arrays.copyOf(full, SIGNATURE_BYTES);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}

package com.example.notesweb;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.List;

/**
 * Zamienia {@link ClientSession} na wartość ciasteczka i z powrotem.
 * <p>
 * Format: {@code base64url(json) + "." + base64url(hmacSha256(base64url(json)))}.
 * Wszystko, co nie przejdzie weryfikacji, daje pustą sesję.
 */
@Component
public class SessionCodec {
    private static final Logger log = LoggerFactory.getLogger(SessionCodec.class);

    private static final String ALGORITHM = "HmacSHA256";

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper mapper;
    private final SecretKeySpec key;

    public SessionCodec(ObjectMapper mapper, NotesProperties properties) {
        String secret = properties.session().secretKey();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("notes.session.secret-key must be set (SECRET_KEY)");
        }
        this.mapper = mapper;
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String encode(ClientSession session) {
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(
                    new Payload(session.userId().orElse(null), session.pendingFlashes()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize session", e);
        }
        String payload = ENCODER.encodeToString(json);
        return payload + "." + ENCODER.encodeToString(sign(payload));
    }

    public ClientSession decode(String cookieValue) {
        if (cookieValue == null || cookieValue.isBlank()) {
            return ClientSession.empty();
        }
        int dot = cookieValue.lastIndexOf('.');
        if (dot <= 0) {
            log.warn("Discarding malformed session cookie");
            return ClientSession.empty();
        }
        String payload = cookieValue.substring(0, dot);
        try {
            byte[] signature = DECODER.decode(cookieValue.substring(dot + 1));
            if (!MessageDigest.isEqual(sign(payload), signature)) {
                log.warn("Rejected session cookie with an invalid signature");
                return ClientSession.empty();
            }
            Payload data = mapper.readValue(DECODER.decode(payload), Payload.class);
            return ClientSession.restore(data.userId(), data.flashes());
        } catch (IllegalArgumentException | IOException e) {
            log.warn("Discarding unreadable session cookie: {}", e.getMessage());
            return ClientSession.empty();
        }
    }

    private byte[] sign(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(payload.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record Payload(@JsonProperty("user_id") Long userId,
                   @JsonProperty("_flashes") List<FlashMessage> flashes) {
    }
}

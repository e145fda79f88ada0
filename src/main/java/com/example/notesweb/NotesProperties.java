package com.example.notesweb;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Ustawienia z prefiksem {@code notes.*}.
 *
 * @param session ustawienia podpisanego ciasteczka sesji
 */
@ConfigurationProperties(prefix = "notes")
public record NotesProperties(@DefaultValue Session session) {

    /**
     * @param secretKey  klucz HMAC do podpisu ciasteczka sesji, nie może być pusty
     * @param cookieName nazwa ciasteczka sesji
     */
    public record Session(String secretKey, @DefaultValue("session") String cookieName) {
    }
}

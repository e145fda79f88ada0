package com.example.notesweb;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Stan sesji jednego żądania, odczytany z podpisanego ciasteczka i zapisywany
 * do niego z powrotem. Trzyma id zalogowanego użytkownika i oczekujące
 * komunikaty flash. Każda zmiana oznacza sesję jako zmodyfikowaną, więc
 * ciasteczko zostanie nadpisane.
 */
public final class ClientSession {

    // Limit oczekujących flashy, żeby ciasteczko nie rosło bez końca
    static final int MAX_PENDING_FLASHES = 5;

    private Long userId;
    private final List<FlashMessage> flashes;
    private boolean modified;

    private ClientSession(Long userId, Collection<FlashMessage> flashes) {
        this.userId = userId;
        this.flashes = new ArrayList<>(flashes);
        trimFlashes();
    }

    public static ClientSession empty() {
        return new ClientSession(null, List.of());
    }

    static ClientSession restore(Long userId, Collection<FlashMessage> flashes) {
        return new ClientSession(userId, flashes == null ? List.of() : flashes);
    }

    public Optional<Long> userId() {
        return Optional.ofNullable(userId);
    }

    /**
     * Czyści dotychczasowy stan, razem z flashami, i wiąże sesję z podanym
     * użytkownikiem.
     */
    public void logIn(long userId) {
        clear();
        this.userId = userId;
    }

    public void clear() {
        userId = null;
        flashes.clear();
        modified = true;
    }

    public void flash(String category, String message) {
        flashes.add(new FlashMessage(category, message));
        trimFlashes();
        modified = true;
    }

    /**
     * Zwraca oczekujące flashe i usuwa je z sesji.
     */
    public List<FlashMessage> drainFlashes() {
        if (flashes.isEmpty()) {
            return List.of();
        }
        List<FlashMessage> drained = List.copyOf(flashes);
        flashes.clear();
        modified = true;
        return drained;
    }

    List<FlashMessage> pendingFlashes() {
        return List.copyOf(flashes);
    }

    public boolean isModified() {
        return modified;
    }

    public boolean isEmpty() {
        return userId == null && flashes.isEmpty();
    }

    // Zostają najnowsze
    private void trimFlashes() {
        if (flashes.size() > MAX_PENDING_FLASHES) {
            flashes.subList(0, flashes.size() - MAX_PENDING_FLASHES).clear();
        }
    }
}

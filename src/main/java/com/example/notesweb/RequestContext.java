package com.example.notesweb;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Kto wywołuje bieżące żądanie: zdekodowana sesja oraz użytkownik, jeśli sesja
 * wskazuje istniejącego. Budowany raz przez {@link SessionInterceptor}
 * i przekazywany kontrolerom jako argument metody.
 */
public final class RequestContext {

    static final String ATTRIBUTE = RequestContext.class.getName();

    private final ClientSession session;
    private final User currentUser;

    public RequestContext(ClientSession session, User currentUser) {
        this.session = session;
        this.currentUser = currentUser;
    }

    public ClientSession session() {
        return session;
    }

    public Optional<User> currentUser() {
        return Optional.ofNullable(currentUser);
    }

    public boolean isAuthenticated() {
        return currentUser != null;
    }

    /**
     * @throws IllegalStateException gdy żądanie jest anonimowe; ścieżki, które
     *         to wołają, są za {@link LoginRequiredInterceptor}
     */
    public User requireUser() {
        if (currentUser == null) {
            throw new IllegalStateException("No authenticated user on this request");
        }
        return currentUser;
    }

    static RequestContext from(HttpServletRequest request) {
        if (request.getAttribute(ATTRIBUTE) instanceof RequestContext context) {
            return context;
        }
        throw new IllegalStateException("No request context for " + request.getRequestURI());
    }
}

package com.example.notesweb;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;

/**
 * Zatrzymuje anonimowe żądania przed kontrolerem i przekierowuje je na stronę
 * logowania. Rejestrowany po {@link SessionInterceptor}.
 */
@Component
public class LoginRequiredInterceptor implements HandlerInterceptor {
    private static final Logger log = LoggerFactory.getLogger(LoginRequiredInterceptor.class);

    static final String LOG_IN_PATH = "/log_in";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        if (RequestContext.from(request).isAuthenticated()) {
            return true;
        }
        log.debug("Anonymous {} {} redirected to log-in", request.getMethod(), request.getRequestURI());
        response.sendRedirect(request.getContextPath() + LOG_IN_PATH);
        return false;
    }
}

package com.example.notesweb;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.view.RedirectView;
import org.springframework.web.util.WebUtils;

@Component
public class SessionInterceptor implements HandlerInterceptor {

    private final SessionCodec codec;
    private final UserRepository users;
    private final String cookieName;

    public SessionInterceptor(SessionCodec codec, UserRepository users, NotesProperties properties) {
        this.codec = codec;
        this.users = users;
        this.cookieName = properties.session().cookieName();
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        Cookie cookie = WebUtils.getCookie(request, cookieName);
        ClientSession session = codec.decode(cookie == null ? null : cookie.getValue());
        // nieaktualne id (użytkownik usunięty) traktujemy jak anonimowe żądanie
        User user = session.userId().flatMap(users::findById).orElse(null);
        request.setAttribute(RequestContext.ATTRIBUTE, new RequestContext(session, user));
        return true;
    }

    @Override
    public void postHandle(HttpServletRequest request, HttpServletResponse response, Object handler,
                           ModelAndView modelAndView) {
        RequestContext context = RequestContext.from(request);
        ClientSession session = context.session();

        // flashe przetrwają przekierowanie, zużywa je następna renderowana strona
        if (modelAndView != null && !isRedirect(modelAndView)) {
            modelAndView.addObject("currentUser", context.currentUser().orElse(null));
            modelAndView.addObject("flashes", session.drainFlashes());
        }

        if (session.isModified()) {
            writeCookie(response, session);
        }
    }

    private void writeCookie(HttpServletResponse response, ClientSession session) {
        ResponseCookie.ResponseCookieBuilder cookie = ResponseCookie
                .from(cookieName, session.isEmpty() ? "" : codec.encode(session))
                .path("/")
                .httpOnly(true)
                .sameSite("Lax");
        if (session.isEmpty()) {
            cookie.maxAge(0);
        }
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.build().toString());
    }

    private static boolean isRedirect(ModelAndView modelAndView) {
        String viewName = modelAndView.getViewName();
        return (viewName != null && viewName.startsWith("redirect:"))
                || modelAndView.getView() instanceof RedirectView;
    }
}

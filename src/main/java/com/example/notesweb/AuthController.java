package com.example.notesweb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.Optional;

@Controller
public class AuthController {
    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    static final String LOG_IN_FAILED = "Username or password are incorrect";
    static final int MAX_USERNAME_LENGTH = 80;

    private final UserRepository users;
    private final PasswordEncoder passwordEncoder;

    public AuthController(UserRepository users, PasswordEncoder passwordEncoder) {
        this.users = users;
        this.passwordEncoder = passwordEncoder;
    }

    @GetMapping("/sign_up")
    public String signUpForm() {
        return "sign_up";
    }

    // Rejestracja: pierwsza napotkana przyczyna błędu wygrywa
    @PostMapping("/sign_up")
    public String signUp(RequestContext context,
                         @RequestParam(defaultValue = "") String username,
                         @RequestParam(defaultValue = "") String password) {
        String error = null;
        if (username.isBlank()) {
            error = "Username is required.";
        } else if (password.isEmpty()) {
            error = "Password is required.";
        } else if (username.length() > MAX_USERNAME_LENGTH) {
            error = "Username must be at most " + MAX_USERNAME_LENGTH + " characters.";
        } else if (users.existsByUsername(username)) {
            error = alreadyTaken(username);
        }

        if (error == null) {
            try {
                users.save(new User(username, passwordEncoder.encode(password)));
            } catch (DataIntegrityViolationException e) {
                // przegrany wyścig z równoczesną rejestracją tej samej nazwy
                log.warn("Concurrent sign-up for '{}' rejected by unique constraint", username);
                error = alreadyTaken(username);
            }
        }

        if (error != null) {
            context.session().flash(FlashMessage.ERROR, error);
            return "sign_up";
        }
        log.info("Registered user '{}'", username);
        context.session().flash(FlashMessage.SUCCESS, "Account created, please log in.");
        return "redirect:/log_in";
    }

    @GetMapping("/log_in")
    public String logInForm() {
        return "log_in";
    }

    @PostMapping("/log_in")
    public String logIn(RequestContext context,
                        @RequestParam(defaultValue = "") String username,
                        @RequestParam(defaultValue = "") String password) {
        // nieznany użytkownik i złe hasło dają ten sam komunikat
        Optional<User> user = users.findByUsername(username)
                .filter(candidate -> passwordEncoder.matches(password, candidate.getPasswordHash()));
        if (user.isEmpty()) {
            log.warn("Failed log-in for '{}'", username);
            context.session().flash(FlashMessage.ERROR, LOG_IN_FAILED);
            return "log_in";
        }
        context.session().logIn(user.get().getId());
        log.info("User '{}' logged in", username);
        return "redirect:/";
    }

    @RequestMapping(value = "/log_out", method = {RequestMethod.GET, RequestMethod.DELETE})
    public String logOut(RequestContext context) {
        context.currentUser().ifPresent(user -> log.info("User '{}' logged out", user.getUsername()));
        context.session().clear();
        context.session().flash(FlashMessage.SUCCESS, "You have been logged out.");
        return "redirect:/log_in";
    }

    private static String alreadyTaken(String username) {
        return "Username " + username + " is already taken.";
    }
}

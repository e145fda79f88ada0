package com.example.notesweb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

// Wszystkie ścieżki /notes są za LoginRequiredInterceptor
@Controller
@RequestMapping("/notes")
public class NoteController {
    private static final Logger log = LoggerFactory.getLogger(NoteController.class);

    private final NoteRepository notes;

    public NoteController(NoteRepository notes) {
        this.notes = notes;
    }

    // Notatki zalogowanego użytkownika, najnowsze pierwsze
    @GetMapping
    public String list(RequestContext context, Model model) {
        model.addAttribute("notes", notes.findByOwnerOrderByCreatedAtDescIdDesc(context.requireUser()));
        return "notes/index";
    }

    @GetMapping("/new")
    public String newForm() {
        return "notes/new";
    }

    @PostMapping("/new")
    public String create(RequestContext context,
                         @RequestParam(defaultValue = "") String title,
                         @RequestParam(defaultValue = "") String body) {
        String error = null;
        if (title.isBlank()) {
            error = "Title is required.";
        } else if (title.length() > Note.MAX_TITLE_LENGTH) {
            error = "Title must be at most " + Note.MAX_TITLE_LENGTH + " characters.";
        }
        if (error != null) {
            context.session().flash(FlashMessage.ERROR, error);
            return "notes/new";
        }

        User owner = context.requireUser();
        Note note = notes.save(new Note(owner, title, body));
        log.info("User '{}' created note {}", owner.getUsername(), note.getId());
        context.session().flash(FlashMessage.SUCCESS, "Note created.");
        return "redirect:/notes";
    }

    // Szczegóły notatki; cudza notatka wygląda jak nieistniejąca
    @GetMapping("/{id}")
    public String show(RequestContext context, @PathVariable long id, Model model) {
        Note note = notes.findByIdAndOwner(id, context.requireUser())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Note not found"));
        model.addAttribute("note", note);
        return "notes/show";
    }
}

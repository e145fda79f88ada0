package com.example.notesweb;

import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.view;

final class NoteControllerTest extends AbstractWebTest
{
    @Autowired
    NoteRepository notes;
    
    private User alice;
    private Cookie aliceSession;
    
    @BeforeEach
    void logInAlice() throws Exception {
        alice = createUser("alice", "secret");
        aliceSession = logIn("alice", "secret");
    }
    
    @Test
    void anonymous_requests_are_redirected() throws Exception {
        mvc.perform(get("/notes")).andExpect(status().isFound()).andExpect(redirectedUrl("/log_in"));
        mvc.perform(get("/notes/new")).andExpect(status().isFound()).andExpect(redirectedUrl("/log_in"));
        mvc.perform(post("/notes/new").param("title", "sneaky"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/log_in"));
        
        assertThat(count("notes")).isZero();
    }
    
    @Test
    void forged_cookie_is_anonymous() throws Exception {
        Cookie forged = new Cookie(cookieName(), aliceSession.getValue() + "x");
        mvc.perform(get("/notes").cookie(forged)).andExpect(redirectedUrl("/log_in"));
    }
    
    @Test
    void create_note_then_list_it() throws Exception {
        Cookie session = mvc.perform(post("/notes/new").cookie(aliceSession)
                        .param("title", "Groceries")
                        .param("body", "- **milk**\n- eggs"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/notes"))
                .andReturn().getResponse().getCookie(cookieName());
        assertThat(session).isNotNull();
        
        assertThat(notes.findByOwnerOrderByCreatedAtDescIdDesc(alice))
                .singleElement()
                .satisfies(note -> {
                    assertThat(note.getTitle()).isEqualTo("Groceries");
                    assertThat(note.getCreatedAt()).isNotNull();
                });
        
        String page = mvc.perform(get("/notes").cookie(session))
                .andExpect(status().isOk())
                .andExpect(view().name("notes/index"))
                .andReturn().getResponse().getContentAsString();
        assertThat(page)
                .contains("Note created.")
                .contains("Groceries")
                .contains("<strong>milk</strong>");
    }
    
    @Test
    void note_without_title_is_rejected() throws Exception {
        String page = mvc.perform(post("/notes/new").cookie(aliceSession)
                        .param("title", " ")
                        .param("body", "orphan body"))
                .andExpect(status().isOk())
                .andExpect(view().name("notes/new"))
                .andReturn().getResponse().getContentAsString();
        
        assertThat(page).contains("Title is required.");
        assertThat(count("notes")).isZero();
    }
    
    @Test
    void note_with_too_long_title_is_rejected() throws Exception {
        String page = mvc.perform(post("/notes/new").cookie(aliceSession)
                        .param("title", "t".repeat(Note.MAX_TITLE_LENGTH + 1))
                        .param("body", "too long"))
                .andExpect(status().isOk())
                .andExpect(view().name("notes/new"))
                .andReturn().getResponse().getContentAsString();
        
        assertThat(page).contains("Title must be at most 200 characters.");
        assertThat(count("notes")).isZero();
    }
    
    @Test
    void repeated_creates_without_rendering_keep_cookie_bounded() throws Exception {
        Cookie session = aliceSession;
        for (int i = 0; i < 20; i++) {
            session = mvc.perform(post("/notes/new").cookie(session).param("title", "note " + i))
                    .andExpect(redirectedUrl("/notes"))
                    .andReturn().getResponse().getCookie(cookieName());
        }
        
        ClientSession decoded = codec.decode(session.getValue());
        assertThat(decoded.userId()).contains(alice.getId());
        assertThat(decoded.pendingFlashes()).hasSize(ClientSession.MAX_PENDING_FLASHES);
        assertThat(count("notes")).isEqualTo(20);
    }
    
    @Test
    void listing_is_scoped_to_the_owner() throws Exception {
        createUser("bob", "hunter2");
        Cookie bobSession = logIn("bob", "hunter2");
        notes.save(new Note(alice, "Alice private plans", "nothing for bob"));
        
        String bobPage = mvc.perform(get("/notes").cookie(bobSession))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String alicePage = mvc.perform(get("/notes").cookie(aliceSession))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        
        assertThat(bobPage).doesNotContain("Alice private plans").contains("No notes yet.");
        assertThat(alicePage).contains("Alice private plans");
    }
    
    @Test
    void listing_shows_newest_first() throws Exception {
        notes.save(new Note(alice, "older", ""));
        notes.save(new Note(alice, "newer", ""));
        
        String page = mvc.perform(get("/notes").cookie(aliceSession))
                .andReturn().getResponse().getContentAsString();
        
        assertThat(page.indexOf("newer")).isLessThan(page.indexOf("older"));
    }
    
    @Test
    void show_renders_own_note() throws Exception {
        Note note = notes.save(new Note(alice, "Reading list", "# Books"));
        
        String page = mvc.perform(get("/notes/{id}", note.getId()).cookie(aliceSession))
                .andExpect(status().isOk())
                .andExpect(view().name("notes/show"))
                .andReturn().getResponse().getContentAsString();
        
        assertThat(page).contains("Reading list").contains("<h1>Books</h1>");
    }
    
    @Test
    void show_hides_other_users_notes() throws Exception {
        Note note = notes.save(new Note(alice, "Alice only", ""));
        createUser("bob", "hunter2");
        Cookie bobSession = logIn("bob", "hunter2");
        
        mvc.perform(get("/notes/{id}", note.getId()).cookie(bobSession))
                .andExpect(status().isNotFound());
        mvc.perform(get("/notes/{id}", 999_999L).cookie(aliceSession))
                .andExpect(status().isNotFound());
    }
}

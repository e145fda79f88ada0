package com.example.notesweb;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface NoteRepository extends JpaRepository<Note, Long> {

    // Najnowsze pierwsze; przy tym samym czasie utworzenia decyduje id
    List<Note> findByOwnerOrderByCreatedAtDescIdDesc(User owner);

    Optional<Note> findByIdAndOwner(Long id, User owner);
}

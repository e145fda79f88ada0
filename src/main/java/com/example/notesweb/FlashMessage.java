package com.example.notesweb;

/**
 * Jednorazowy komunikat trzymany w sesji do następnej renderowanej strony.
 */
public record FlashMessage(String category, String message) {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
}

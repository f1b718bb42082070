package com.example.evaluator.model;

import java.util.List;
import java.util.Locale;

/**
 * Kind of document an upload contains, recognised by keywords in its name and text.
 */
public enum DocumentCategory {
    APPLICATION(
            List.of("application", "personal statement", "essay", "activities", "awards",
                    "leadership", "goals", "why", "motivation"),
            "Application essay, personal statement or background information",
            "Upload the application essay or personal statement next."),
    TRANSCRIPT(
            List.of("transcript", "gpa", "credits", "semester", "course", "grade",
                    "honors", "ap ", "ib ", "class rank"),
            "Transcript with courses and grades",
            "Upload the transcript next: grades and the school are read from it."),
    RECOMMENDATION(
            List.of("recommendation", "to whom it may concern", "i recommend", "reference",
                    "counselor", "teacher", "principal"),
            "Teacher or counselor recommendation letters",
            "Upload the recommendation letters next.");

    /** Order in which missing documents are asked for. */
    public static final List<DocumentCategory> UPLOAD_PRIORITY = List.of(TRANSCRIPT, RECOMMENDATION, APPLICATION);

    private final List<String> keywords;
    private final String missingItem;
    private final String uploadHint;

    DocumentCategory(List<String> keywords, String missingItem, String uploadHint) {
        this.keywords = keywords;
        this.missingItem = missingItem;
        this.uploadHint = uploadHint;
    }

    /** Number of this category's keywords found in the file name or the text. */
    public int score(String fileName, String text) {
        String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        String body = text == null ? "" : text.toLowerCase(Locale.ROOT);
        int score = 0;
        for (String keyword : keywords) {
            if (body.contains(keyword) || name.contains(keyword)) {
                score++;
            }
        }
        return score;
    }

    public boolean foundIn(String text) {
        return score(null, text) > 0;
    }

    public String missingItem() {
        return missingItem;
    }

    public String uploadHint() {
        return uploadHint;
    }
}

package com.project.image.bgremover.DTOs;

import java.nio.file.Path;

/** Describes the background to synthesize behind a subject. */
public record BackgroundSpec(Kind kind, String color, Path imagePath, String gradientStart, String gradientEnd) {

    public static final String DEFAULT_GRADIENT_START = "#667eea";
    public static final String DEFAULT_GRADIENT_END = "#764ba2";

    public enum Kind { COLOR, IMAGE, GRADIENT }

    public static BackgroundSpec color(String color) {
        return new BackgroundSpec(Kind.COLOR, color, null, null, null);
    }

    public static BackgroundSpec image(Path imagePath) {
        return new BackgroundSpec(Kind.IMAGE, null, imagePath, null, null);
    }

    public static BackgroundSpec gradient(String start, String end) {
        return new BackgroundSpec(Kind.GRADIENT, null, null,
                start == null || start.isBlank() ? DEFAULT_GRADIENT_START : start,
                end == null || end.isBlank() ? DEFAULT_GRADIENT_END : end);
    }
}

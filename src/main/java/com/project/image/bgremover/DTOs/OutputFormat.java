package com.project.image.bgremover.DTOs;

import com.project.image.bgremover.exceptions.UnsupportedFormatException;

import java.util.Locale;

/** Output encodings the pipeline can produce. */
public enum OutputFormat {
    PNG("png", "image/png"),
    JPG("jpg", "image/jpeg");

    private final String extension;
    private final String contentType;

    OutputFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String extension() { return extension; }

    public String contentType() { return contentType; }

    /**
     * Parses a format token such as {@code png}, {@code jpg} or {@code jpeg}.
     * A blank token means PNG.
     */
    public static OutputFormat parse(String token) {
        if (token == null || token.isBlank()) {
            return PNG;
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("png")) {
            return PNG;
        }
        if (normalized.equals("jpg") || normalized.equals("jpeg")) {
            return JPG;
        }
        throw new UnsupportedFormatException("Unsupported output format: " + token);
    }
}

package com.project.image.bgremover.DTOs;

import java.nio.file.Path;

/**
 * Options for a single background removal call.
 *
 * @param backgroundColor     {@code transparent}, a named color or {@code #RRGGBB}
 * @param backgroundImagePath optional image to use as background; wins over the color when the file exists
 * @param outputFormat        encoding of the result
 */
public record ProcessingOptions(String backgroundColor, Path backgroundImagePath, OutputFormat outputFormat) {

    public static final String TRANSPARENT = "transparent";

    public ProcessingOptions {
        if (backgroundColor == null || backgroundColor.isBlank()) {
            backgroundColor = TRANSPARENT;
        }
        if (outputFormat == null) {
            outputFormat = OutputFormat.PNG;
        }
    }

    public static ProcessingOptions defaults() {
        return new ProcessingOptions(TRANSPARENT, null, OutputFormat.PNG);
    }

    public boolean isTransparent() {
        return backgroundImagePath == null && TRANSPARENT.equalsIgnoreCase(backgroundColor.trim());
    }
}

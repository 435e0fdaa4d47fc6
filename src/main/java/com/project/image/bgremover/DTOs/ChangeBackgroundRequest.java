package com.project.image.bgremover.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/** JSON body of {@code POST /api/change-background}. */
public record ChangeBackgroundRequest(
        @JsonProperty("original_file") @NotBlank String originalFile,
        @JsonProperty("background_type") String backgroundType,
        @JsonProperty("background_value") String backgroundValue,
        Gradient gradient,
        @JsonProperty("output_format") String outputFormat
) {
    public record Gradient(String color1, String color2) {}
}

package com.project.image.bgremover.DTOs;

public record RemovalResult(
        byte[] encoded,
        OutputFormat format,
        int width,
        int height
) {}

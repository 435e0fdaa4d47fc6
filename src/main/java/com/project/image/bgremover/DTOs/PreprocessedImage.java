package com.project.image.bgremover.DTOs;

/** Output of preprocessing: the model input plus the original image it was derived from. */
public record PreprocessedImage(NormalizedArray input, SourceImage source) {

    public int originalWidth() { return source.width(); }

    public int originalHeight() { return source.height(); }
}

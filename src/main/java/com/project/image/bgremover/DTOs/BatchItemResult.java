package com.project.image.bgremover.DTOs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Outcome of one image in a batch; failures carry the error kind and a readable cause. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchItemResult(
        boolean success,
        @JsonProperty("original_filename") String originalFilename,
        @JsonProperty("processed_filename") String processedFilename,
        @JsonProperty("processed_url") String processedUrl,
        @JsonProperty("error_kind") String errorKind,
        String error
) {
    public static BatchItemResult ok(String originalFilename, String processedFilename, String processedUrl) {
        return new BatchItemResult(true, originalFilename, processedFilename, processedUrl, null, null);
    }

    public static BatchItemResult failed(String originalFilename, String errorKind, String error) {
        return new BatchItemResult(false, originalFilename, null, null, errorKind, error);
    }
}

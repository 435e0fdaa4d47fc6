package com.project.image.bgremover.service;

import com.project.image.bgremover.DTOs.NormalizedArray;
import com.project.image.bgremover.DTOs.RawMask;

/**
 * Per-pixel foreground prediction. Implementations are shared by all requests and must allow
 * concurrent calls to {@link #predict}, serializing internally if their runtime requires it.
 */
public interface SaliencyModel {

    /** Whether the weights are loaded and {@link #predict} can be called. */
    boolean isReady();

    /**
     * Runs inference on a preprocessed 1x3xHxW tensor.
     *
     * @return the primary single channel output at model resolution
     * @throws com.project.image.bgremover.exceptions.ModelUnavailableException if not ready
     * @throws com.project.image.bgremover.exceptions.InferenceException if the runtime fails
     */
    RawMask predict(NormalizedArray input);
}

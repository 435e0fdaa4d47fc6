package com.project.image.bgremover.exceptions;

/** The saliency model failed while processing an input. Not retryable for the same input. */
public class InferenceException extends BackgroundRemovalException {
    public InferenceException(String message) { super(message); }
    public InferenceException(String message, Throwable cause) { super(message, cause); }

    @Override
    public String errorKind() { return "InferenceError"; }
}

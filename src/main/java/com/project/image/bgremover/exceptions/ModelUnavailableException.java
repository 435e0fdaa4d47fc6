package com.project.image.bgremover.exceptions;

/** The saliency model is not loaded. */
public class ModelUnavailableException extends BackgroundRemovalException {
    public ModelUnavailableException(String message) { super(message); }
    public ModelUnavailableException(String message, Throwable cause) { super(message, cause); }

    @Override
    public String errorKind() { return "ModelUnavailable"; }
}

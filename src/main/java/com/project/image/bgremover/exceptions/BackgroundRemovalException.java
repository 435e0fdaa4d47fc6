package com.project.image.bgremover.exceptions;

/** Domain-specific root of all processing errors. */
public class BackgroundRemovalException extends RuntimeException {
    public BackgroundRemovalException(String message) { super(message); }
    public BackgroundRemovalException(String message, Throwable cause) { super(message, cause); }

    /** Short error kind reported to callers next to the message. */
    public String errorKind() { return "ProcessingError"; }
}

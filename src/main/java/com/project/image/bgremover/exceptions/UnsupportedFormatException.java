package com.project.image.bgremover.exceptions;

/** Unknown output format token. */
public class UnsupportedFormatException extends BackgroundRemovalException {
    public UnsupportedFormatException(String message) { super(message); }
    public UnsupportedFormatException(String message, Throwable cause) { super(message, cause); }

    @Override
    public String errorKind() { return "UnsupportedFormat"; }
}

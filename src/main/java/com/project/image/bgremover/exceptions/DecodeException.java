package com.project.image.bgremover.exceptions;

/** The input could not be decoded as an image. */
public class DecodeException extends BackgroundRemovalException {
    public DecodeException(String message) { super(message); }
    public DecodeException(String message, Throwable cause) { super(message, cause); }

    @Override
    public String errorKind() { return "DecodeError"; }
}

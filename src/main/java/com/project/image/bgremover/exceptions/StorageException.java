package com.project.image.bgremover.exceptions;

import java.io.IOException;

/** Raised when uploads or results cannot be stored, found or resolved. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }

    public String errorKind() { return "StorageError"; }

    /** True when the filesystem failed, as opposed to a rejected name or file type. */
    public boolean isIoFailure() { return getCause() instanceof IOException; }
}

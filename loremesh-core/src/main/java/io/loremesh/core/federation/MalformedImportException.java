package io.loremesh.core.federation;

public class MalformedImportException extends IllegalArgumentException {

    public MalformedImportException(String message) {
        super(message);
    }

    public MalformedImportException(String message, Throwable cause) {
        super(message, cause);
    }
}

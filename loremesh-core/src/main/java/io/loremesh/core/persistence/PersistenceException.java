package io.loremesh.core.persistence;

import java.io.IOException;

public class PersistenceException extends IOException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

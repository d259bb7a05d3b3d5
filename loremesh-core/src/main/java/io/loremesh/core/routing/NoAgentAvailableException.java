package io.loremesh.core.routing;

public class NoAgentAvailableException extends IllegalStateException {

    public NoAgentAvailableException(String message) {
        super(message);
    }
}

package com.volsignal.core.exception;

/**
 * Raised when a configuration record is constructed with values the engine
 * cannot run on. Never raised for market inputs.
 */
public class SignalEngineException extends RuntimeException {
    private final String component;

    public SignalEngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public SignalEngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}

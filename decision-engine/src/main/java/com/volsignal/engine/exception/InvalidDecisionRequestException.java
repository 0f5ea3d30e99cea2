package com.volsignal.engine.exception;

/**
 * Request rejected before evaluation (missing symbol or snapshot). Answered with HTTP 400.
 */
public class InvalidDecisionRequestException extends RuntimeException {

    public InvalidDecisionRequestException(String message) {
        super(message);
    }
}

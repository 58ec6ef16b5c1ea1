package com.mar.simulator.engine;

/**
 * Fatal simulation error. The run is not resumable once one is thrown.
 */
public class SimulationException extends RuntimeException {

    public enum ErrorCode {
        INVALID_CONFIGURATION,
        INVALID_PRICE_DATA,
        INSUFFICIENT_HISTORY,
        INVARIANT_VIOLATION,
        LEDGER_VIOLATION,
        IO_FAILURE
    }

    private final ErrorCode errorCode;

    public SimulationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SimulationException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

package com.travelrevenue.exception;

public class InvalidPairingException extends RevenueEngineException {
    public InvalidPairingException(String message) {
        super("INVALID_PAIRING", message);
    }
}

package com.travelrevenue.exception;

import lombok.Getter;

@Getter
public abstract class RevenueEngineException extends RuntimeException {
    private final String errorCode;
    protected RevenueEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}

package com.transparenta.analytics.exception;

public class InvalidPeriodException extends InvalidFilterException {

    public InvalidPeriodException(String message) {
        super(message);
    }
}

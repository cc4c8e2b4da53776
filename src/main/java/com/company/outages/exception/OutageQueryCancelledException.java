package com.company.outages.exception;

public class OutageQueryCancelledException extends RuntimeException {
    public OutageQueryCancelledException(String message) {
        super(message);
    }
}

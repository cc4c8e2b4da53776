package com.company.outages.exception;

import lombok.Getter;

@Getter
public class InvalidOutageRequestException extends RuntimeException {

    private final String parameter;

    public InvalidOutageRequestException(String parameter, String value, String reason) {
        super(String.format("Invalid %s '%s': %s", parameter, value, reason));
        this.parameter = parameter;
    }
}

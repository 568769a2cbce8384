package com.taildeck.backend.global.error;

import java.util.List;

import org.springframework.http.HttpStatus;

public class InvalidParameterException extends ProblemException {

    public static final String CODE = "INVALID_PARAMETER";

    private final List<String> validValues;

    public InvalidParameterException(String parameter, List<String> validValues) {
        super(HttpStatus.BAD_REQUEST, CODE, "Invalid " + parameter);
        this.validValues = List.copyOf(validValues);
    }

    public List<String> getValidValues() {
        return validValues;
    }
}

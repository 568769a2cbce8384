package com.taildeck.backend.global.error;

import org.springframework.http.HttpStatus;

public class AuthenticationRequiredException extends ProblemException {

    public static final String CODE = "UNAUTHORIZED";

    public AuthenticationRequiredException() {
        super(HttpStatus.UNAUTHORIZED, CODE, "Unauthorized");
    }
}

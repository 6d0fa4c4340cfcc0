package com.authcore.backend.global.error;

import org.springframework.http.HttpStatus;

public class StoreUnavailableException extends ProblemException {

    public static final String CODE = "STORE_UNAVAILABLE";

    public StoreUnavailableException(String detail, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, CODE, detail, cause);
    }
}

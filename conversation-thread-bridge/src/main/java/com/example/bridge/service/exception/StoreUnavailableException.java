package com.example.bridge.service.exception;

import org.springframework.http.HttpStatus;

/**
 * The mapping store could not answer in time or at all. Callers decide whether to retry, fall back
 * to the hash strategy or fail the message.
 */
public class StoreUnavailableException extends ServiceException {

    public StoreUnavailableException(String message) {
        this(message, null);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, "store_unavailable", cause);
    }
}

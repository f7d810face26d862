package com.example.bridge.service.exception;

import org.springframework.http.HttpStatus;

/**
 * A mapping for the same scope key (or thread id) already exists. Recovered inside the database
 * strategy by re-reading the winning row.
 */
public class StoreConflictException extends ServiceException {

    private final String scopeKey;

    public StoreConflictException(String scopeKey, Throwable cause) {
        super(HttpStatus.CONFLICT, "Mapping already exists for scope", "store_conflict", cause);
        this.scopeKey = scopeKey;
    }

    public String getScopeKey() {
        return scopeKey;
    }
}

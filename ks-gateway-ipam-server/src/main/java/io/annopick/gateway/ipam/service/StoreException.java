package io.annopick.gateway.ipam.service;

import lombok.Getter;

/**
 * A database statement failed. {@code code} carries the SQLSTATE reported by the driver,
 * or {@code null} when the failure never reached the database.
 */
@Getter
public class StoreException extends RuntimeException {

    public static final String UNIQUE_VIOLATION = "23505";

    private final String code;

    public StoreException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public boolean isUniqueViolation() {
        return UNIQUE_VIOLATION.equals(code);
    }
}

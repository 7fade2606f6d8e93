package com.zzf.selfpatch.api;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Request-level failure with a stable error code.
 */
@Getter
public class ApiException extends RuntimeException {
    private final String errorCode;
    private final HttpStatus status;

    public ApiException(String errorCode, String message) {
        this(errorCode, message, HttpStatus.BAD_REQUEST);
    }

    public ApiException(String errorCode, String message, HttpStatus status) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
    }

    public static ApiException notFound(String errorCode, String message) {
        return new ApiException(errorCode, message, HttpStatus.NOT_FOUND);
    }
}

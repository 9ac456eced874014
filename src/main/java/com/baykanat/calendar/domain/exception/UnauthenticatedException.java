package com.baykanat.calendar.domain.exception;

/** Bearer zorunlu yollarda kimlik doğrulanamadı; GlobalExceptionHandler 401 + WWW-Authenticate döner. */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(message, cause);
    }
}

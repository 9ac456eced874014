package com.baykanat.calendar.domain.exception;

/** Token imzası bozuk, yapısı hatalı, subject'i yok, süresi dolmuş ya da sahibi artık yok. */
public class InvalidTokenException extends Exception {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.baykanat.calendar.domain.exception;

/** Aynı kullanıcı adıyla ikinci kayıt denemesi; 409 Conflict. */
public class UsernameTakenException extends RuntimeException {

    public UsernameTakenException(String username, Throwable cause) {
        super("Username already exists: " + username, cause);
    }
}

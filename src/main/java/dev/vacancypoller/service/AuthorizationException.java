package dev.vacancypoller.service;

/**
 * The OAuth callback could not be turned into a linked account.
 */
public class AuthorizationException extends RuntimeException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}

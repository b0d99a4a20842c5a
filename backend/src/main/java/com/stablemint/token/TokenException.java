package com.stablemint.token;

/** A token collaborator refused an operation outright (as opposed to returning {@code false}). */
public class TokenException extends RuntimeException {
    public TokenException(String message) { super(message); }
}

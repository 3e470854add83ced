package com.watchwise.backend.common.web;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by pairing, restriction and detection calls.
 * The message is what the app shows to the user as-is.
 */
public enum ApiErrorCode {

    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "You must be signed in to do this."),
    INVALID_FORMAT(HttpStatus.BAD_REQUEST, "Please enter a valid 6-digit pairing code."),
    CODE_NOT_FOUND(HttpStatus.NOT_FOUND, "Invalid pairing code. Please check the code and try again."),
    CODE_EXPIRED(HttpStatus.GONE, "This pairing code has expired. Please generate a new code."),
    ALREADY_PAIRED(HttpStatus.CONFLICT, "This device is already paired with your account."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "The requested item was not found."),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN, "You are not allowed to change this item."),
    ALREADY_PROCESSED(HttpStatus.CONFLICT, "This item has already been handled."),
    TRANSIENT_STORE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, "Network error. Please check your connection and try again.");

    private final HttpStatus status;
    private final String userMessage;

    ApiErrorCode(HttpStatus status, String userMessage) {
        this.status = status;
        this.userMessage = userMessage;
    }

    public HttpStatus status() { return status; }

    public String userMessage() { return userMessage; }
}

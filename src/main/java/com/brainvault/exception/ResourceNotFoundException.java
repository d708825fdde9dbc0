package com.brainvault.exception;

/**
 * Exception thrown when an owner-scoped resource cannot be found for the caller.
 *
 * A record that exists but belongs to another user is reported exactly like a record that
 * does not exist: same exception, same message, same HTTP 404. The message never includes
 * the requested id, so the response carries no hint about other users' data.
 *
 * GlobalExceptionHandler maps this to HTTP 404 Not Found with RFC 7807 format.
 *
 * @see com.brainvault.exception.GlobalExceptionHandler
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException idea() {
        return new ResourceNotFoundException("Idea not found");
    }

    public static ResourceNotFoundException user() {
        return new ResourceNotFoundException("User not found");
    }
}

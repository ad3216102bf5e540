package com.venuebooking.booking.exception;

/**
 * The cache could not be invalidated. The write that triggered the invalidation
 * has committed but must not be acknowledged; retrying the write is safe.
 */
public class CacheUnavailableException extends BookingException {

    public CacheUnavailableException(String message, Throwable cause) {
        super("CACHE_UNAVAILABLE", message, true, cause);
    }
}

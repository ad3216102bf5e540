package com.venuebooking.booking.exception;

/**
 * Thrown when a tenant-scoped resource does not exist for the requesting tenant.
 */
public class ResourceNotFoundException extends BookingException {

    public ResourceNotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static ResourceNotFoundException booking(String bookingId) {
        return new ResourceNotFoundException("BOOKING_NOT_FOUND", "Booking not found: " + bookingId);
    }

    public static ResourceNotFoundException packageSlug(String slug) {
        return new ResourceNotFoundException("PACKAGE_NOT_FOUND", "Package not found: " + slug);
    }

    public static ResourceNotFoundException packageId(String packageId) {
        return new ResourceNotFoundException("PACKAGE_NOT_FOUND", "Package not found: " + packageId);
    }

    public static ResourceNotFoundException addOn(String addOnId) {
        return new ResourceNotFoundException("ADD_ON_NOT_FOUND", "Add-on not found: " + addOnId);
    }

    public static ResourceNotFoundException blackout(String date) {
        return new ResourceNotFoundException("BLACKOUT_NOT_FOUND", "Blackout not found: " + date);
    }
}

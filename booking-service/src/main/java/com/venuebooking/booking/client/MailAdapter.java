package com.venuebooking.booking.client;

import com.venuebooking.booking.dto.BookingConfirmationDetails;

public interface MailAdapter {

    void sendBookingConfirmation(String email, BookingConfirmationDetails details);
}

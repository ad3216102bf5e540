package com.venuebooking.booking.mapper;

import com.venuebooking.booking.dto.BookingEntry;
import com.venuebooking.booking.model.Booking;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class BookingMapper {

    public BookingEntry toEntry(Booking booking) {
        if (booking == null) {
            return null;
        }

        return BookingEntry.builder()
                .bookingId(booking.getBookingId())
                .tenantId(booking.getTenantId())
                .packageId(booking.getPackageId())
                .eventDate(booking.getEventDate())
                .customerName(booking.getCustomerName())
                .email(booking.getEmail())
                .addOnIds(List.copyOf(booking.getAddOnIds()))
                .totalCents(booking.getTotalCents())
                .status(booking.getStatus().name())
                .cancellationReason(booking.getCancellationReason())
                .createdAt(booking.getCreatedAt())
                .build();
    }
}

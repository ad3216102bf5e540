package com.venuebooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingConfirmationDetails {

    String bookingId;
    String tenantId;
    String customerName;
    LocalDate eventDate;
    String packageTitle;
    List<String> addOnTitles;
    Long totalCents;
}

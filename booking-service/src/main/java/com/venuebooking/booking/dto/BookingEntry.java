package com.venuebooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingEntry {

    String bookingId;
    String tenantId;
    String packageId;
    LocalDate eventDate;
    String customerName;
    String email;
    List<String> addOnIds;
    Long totalCents;
    String status;
    String cancellationReason;
    LocalDateTime createdAt;
}

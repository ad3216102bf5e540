package com.venuebooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class CheckoutEntry {

    String bookingId;
    String checkoutUrl;
    Long totalCents;
    String status;
}

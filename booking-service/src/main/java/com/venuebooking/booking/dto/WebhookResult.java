package com.venuebooking.booking.dto;

import com.venuebooking.booking.enums.WebhookOutcome;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class WebhookResult {

    String eventId;
    WebhookOutcome outcome;
    String bookingId;
}

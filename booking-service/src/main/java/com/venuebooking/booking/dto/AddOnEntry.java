package com.venuebooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AddOnEntry {

    String addOnId;
    String packageId;
    String title;
    Long priceCents;
}

package com.venuebooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PackageEntry {

    String packageId;
    String slug;
    String title;
    String description;
    Long priceCents;
    String segmentId;
    List<AddOnEntry> addOns;
}

package com.venuebooking.booking.dto;

import com.venuebooking.booking.enums.UnavailableReason;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AvailabilityEntry {

    LocalDate date;
    boolean available;
    Set<UnavailableReason> reasons;
}

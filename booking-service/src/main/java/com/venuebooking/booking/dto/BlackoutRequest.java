package com.venuebooking.booking.dto;

import com.venuebooking.booking.constants.ValidationMessages;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BlackoutRequest {

    @NotNull(message = ValidationMessages.DATE_REQUIRED)
    LocalDate date;

    String reason;
}

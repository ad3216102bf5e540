package com.venuebooking.booking.dto;

import com.venuebooking.booking.constants.ValidationMessages;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AddOnRequest {

    String packageId;

    @NotBlank(message = ValidationMessages.TITLE_REQUIRED)
    String title;

    @NotNull(message = ValidationMessages.PRICE_REQUIRED)
    @PositiveOrZero(message = ValidationMessages.PRICE_NON_NEGATIVE)
    Long priceCents;

    @Builder.Default
    Boolean active = Boolean.TRUE;
}

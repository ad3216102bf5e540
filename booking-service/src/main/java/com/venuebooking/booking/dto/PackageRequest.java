package com.venuebooking.booking.dto;

import com.venuebooking.booking.constants.ValidationMessages;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PackageRequest {

    @NotBlank(message = ValidationMessages.SLUG_REQUIRED)
    @Pattern(regexp = "^[a-z0-9]+(-[a-z0-9]+)*$", message = ValidationMessages.SLUG_INVALID)
    String slug;

    @NotBlank(message = ValidationMessages.TITLE_REQUIRED)
    String title;

    String description;

    @NotNull(message = ValidationMessages.PRICE_REQUIRED)
    @PositiveOrZero(message = ValidationMessages.PRICE_NON_NEGATIVE)
    Long priceCents;

    @Builder.Default
    Boolean active = Boolean.TRUE;

    String segmentId;
}

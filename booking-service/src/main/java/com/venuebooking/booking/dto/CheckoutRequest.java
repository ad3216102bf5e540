package com.venuebooking.booking.dto;

import com.venuebooking.booking.constants.BookingConstants;
import com.venuebooking.booking.constants.ValidationMessages;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class CheckoutRequest {

    @NotBlank(message = ValidationMessages.PACKAGE_SLUG_REQUIRED)
    String packageSlug;

    @NotNull(message = ValidationMessages.EVENT_DATE_REQUIRED)
    LocalDate eventDate;

    @Size(max = BookingConstants.MAX_ADD_ONS_PER_BOOKING, message = ValidationMessages.ADD_ONS_MAX)
    @Builder.Default
    List<String> addOnIds = new ArrayList<>();

    @NotBlank(message = ValidationMessages.EMAIL_REQUIRED)
    @Email(message = ValidationMessages.EMAIL_INVALID)
    String customerEmail;

    @NotBlank(message = ValidationMessages.CUSTOMER_NAME_REQUIRED)
    String customerName;
}

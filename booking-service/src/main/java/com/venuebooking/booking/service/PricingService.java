package com.venuebooking.booking.service;

import com.venuebooking.booking.exception.BookingValidationException;
import com.venuebooking.booking.model.AddOn;
import com.venuebooking.booking.model.CatalogPackage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class PricingService {

    /**
     * Package price plus the sum of the selected add-ons, in minor units.
     */
    public long calculateTotalCents(CatalogPackage catalogPackage, List<AddOn> addOns) {
        log.debug("Calculating price: packageId={}, addOns={}", catalogPackage.getPackageId(), addOns.size());

        try {
            long total = catalogPackage.getPriceCents();
            for (AddOn addOn : addOns) {
                total = Math.addExact(total, addOn.getPriceCents());
            }
            return total;
        } catch (ArithmeticException e) {
            throw new BookingValidationException("INVALID_TOTAL", "Booking total exceeds the supported amount");
        }
    }
}

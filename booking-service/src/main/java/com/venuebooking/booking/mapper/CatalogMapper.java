package com.venuebooking.booking.mapper;

import com.venuebooking.booking.dto.AddOnEntry;
import com.venuebooking.booking.dto.BlackoutEntry;
import com.venuebooking.booking.dto.PackageEntry;
import com.venuebooking.booking.model.AddOn;
import com.venuebooking.booking.model.Blackout;
import com.venuebooking.booking.model.CatalogPackage;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class CatalogMapper {

    public PackageEntry toPackageEntry(CatalogPackage catalogPackage, List<AddOn> addOns) {
        if (catalogPackage == null) {
            return null;
        }

        return PackageEntry.builder()
                .packageId(catalogPackage.getPackageId())
                .slug(catalogPackage.getSlug())
                .title(catalogPackage.getTitle())
                .description(catalogPackage.getDescription())
                .priceCents(catalogPackage.getPriceCents())
                .segmentId(catalogPackage.getSegmentId())
                .addOns(addOns == null ? List.of() : addOns.stream().map(this::toAddOnEntry).toList())
                .build();
    }

    public AddOnEntry toAddOnEntry(AddOn addOn) {
        if (addOn == null) {
            return null;
        }

        return AddOnEntry.builder()
                .addOnId(addOn.getAddOnId())
                .packageId(addOn.getPackageId())
                .title(addOn.getTitle())
                .priceCents(addOn.getPriceCents())
                .build();
    }

    public BlackoutEntry toBlackoutEntry(Blackout blackout) {
        if (blackout == null) {
            return null;
        }

        return BlackoutEntry.builder()
                .date(blackout.getDate())
                .reason(blackout.getReason())
                .build();
    }
}

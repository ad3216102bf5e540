package com.venuebooking.booking.event;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.List;

/**
 * Published once per booking, after the transaction that confirmed it has committed.
 */
@Getter
@ToString
public class BookingPaidEvent extends DomainEvent {

    public static final String NAME = "BookingPaid";

    private final String bookingId;
    private final String tenantId;
    private final String email;
    private final String customerName;
    private final LocalDate eventDate;
    private final String packageTitle;
    private final List<String> addOnTitles;
    private final Long totalCents;

    @Builder
    public BookingPaidEvent(Object source, String bookingId, String tenantId, String email, String customerName,
                            LocalDate eventDate, String packageTitle, List<String> addOnTitles, Long totalCents) {
        super(source);
        this.bookingId = bookingId;
        this.tenantId = tenantId;
        this.email = email;
        this.customerName = customerName;
        this.eventDate = eventDate;
        this.packageTitle = packageTitle;
        this.addOnTitles = addOnTitles;
        this.totalCents = totalCents;
    }

    @Override
    public String name() {
        return NAME;
    }
}

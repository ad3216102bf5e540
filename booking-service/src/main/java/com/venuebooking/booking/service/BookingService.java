package com.venuebooking.booking.service;

import com.venuebooking.booking.client.PaymentGateway;
import com.venuebooking.booking.constants.BookingConstants;
import com.venuebooking.booking.constants.ValidationMessages;
import com.venuebooking.booking.dto.AvailabilityEntry;
import com.venuebooking.booking.dto.BookingEntry;
import com.venuebooking.booking.dto.CheckoutEntry;
import com.venuebooking.booking.dto.CheckoutRequest;
import com.venuebooking.booking.dto.CheckoutSession;
import com.venuebooking.booking.enums.BookingStatus;
import com.venuebooking.booking.exception.BookingValidationException;
import com.venuebooking.booking.exception.DateUnavailableException;
import com.venuebooking.booking.exception.PaymentGatewayException;
import com.venuebooking.booking.exception.ResourceNotFoundException;
import com.venuebooking.booking.mapper.BookingMapper;
import com.venuebooking.booking.model.AddOn;
import com.venuebooking.booking.model.Booking;
import com.venuebooking.booking.model.CatalogPackage;
import com.venuebooking.booking.repository.BookingRepository;
import com.venuebooking.booking.util.IdGenerator;
import com.venuebooking.booking.util.TenantIds;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Creates bookings and hands them to the payment gateway.
 * <p>
 * The booking row is committed as PENDING_PAYMENT before the gateway is called,
 * so a gateway failure leaves a pending booking that expires on its own.
 * A pending booking never blocks its date; only confirmation does.
 */
@Service
@Slf4j
public class BookingService {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final String BOOKING_ID_PLACEHOLDER = "{bookingId}";

    private final BookingRepository bookingRepository;
    private final AvailabilityService availabilityService;
    private final CatalogService catalogService;
    private final PricingService pricingService;
    private final PaymentGateway paymentGateway;
    private final BookingMapper bookingMapper;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;

    private final String successUrl;
    private final String cancelUrl;

    public BookingService(
            BookingRepository bookingRepository,
            AvailabilityService availabilityService,
            CatalogService catalogService,
            PricingService pricingService,
            PaymentGateway paymentGateway,
            BookingMapper bookingMapper,
            TransactionTemplate transactionTemplate,
            MeterRegistry meterRegistry,
            @Value("${booking.checkout.success-url}") String successUrl,
            @Value("${booking.checkout.cancel-url}") String cancelUrl) {
        this.bookingRepository = bookingRepository;
        this.availabilityService = availabilityService;
        this.catalogService = catalogService;
        this.pricingService = pricingService;
        this.paymentGateway = paymentGateway;
        this.bookingMapper = bookingMapper;
        this.transactionTemplate = transactionTemplate;
        this.meterRegistry = meterRegistry;
        this.successUrl = successUrl;
        this.cancelUrl = cancelUrl;
    }

    /**
     * Starts checkout for one date. The total is computed here from current
     * catalog prices; nothing the client sends about price is trusted.
     */
    public CheckoutEntry createCheckout(String tenantId, CheckoutRequest request) {
        TenantIds.requireValid(tenantId);
        validateCheckoutRequest(request);

        log.info("Creating checkout: tenantId={}, package={}, eventDate={}, addOns={}",
                tenantId, request.getPackageSlug(), request.getEventDate(), request.getAddOnIds().size());

        AvailabilityEntry availability = availabilityService.getAvailability(tenantId, request.getEventDate());
        if (!availability.isAvailable()) {
            meterRegistry.counter("booking.checkout.total", "result", "date_unavailable").increment();
            throw new DateUnavailableException(request.getEventDate(), availability.getReasons());
        }

        CatalogPackage catalogPackage = catalogService.findPackageForCheckout(tenantId, request.getPackageSlug());
        List<AddOn> addOns = catalogService.findAddOnsForCheckout(
                tenantId, catalogPackage.getPackageId(), request.getAddOnIds());
        long totalCents = pricingService.calculateTotalCents(catalogPackage, addOns);

        Booking booking = transactionTemplate.execute(status -> bookingRepository.save(Booking.builder()
                .bookingId(IdGenerator.generateBookingId())
                .tenantId(tenantId)
                .packageId(catalogPackage.getPackageId())
                .eventDate(request.getEventDate())
                .customerName(request.getCustomerName().trim())
                .email(request.getCustomerEmail().trim())
                .addOnIds(addOns.stream().map(AddOn::getAddOnId).collect(Collectors.toList()))
                .totalCents(totalCents)
                .status(BookingStatus.PENDING_PAYMENT)
                .build()));

        log.info("Booking created: bookingId={}, status=PENDING_PAYMENT, totalCents={}",
                booking.getBookingId(), totalCents);

        CheckoutSession session;
        try {
            session = paymentGateway.createCheckoutSession(
                    tenantId,
                    totalCents,
                    resolveUrl(successUrl, booking.getBookingId()),
                    resolveUrl(cancelUrl, booking.getBookingId()),
                    buildMetadata(booking));
        } catch (PaymentGatewayException e) {
            meterRegistry.counter("booking.checkout.total", "result", "gateway_error").increment();
            log.error("Checkout session failed, booking left pending: bookingId={}, timedOut={}, error={}",
                    booking.getBookingId(), e.isTimedOut(), e.getMessage());
            throw e;
        }

        booking.setSessionReference(session.getSessionId());
        transactionTemplate.executeWithoutResult(status -> bookingRepository.save(booking));

        meterRegistry.counter("booking.checkout.total", "result", "success").increment();
        log.info("Checkout ready: bookingId={}, sessionId={}", booking.getBookingId(), session.getSessionId());

        return CheckoutEntry.builder()
                .bookingId(booking.getBookingId())
                .checkoutUrl(session.getCheckoutUrl())
                .totalCents(totalCents)
                .status(BookingStatus.PENDING_PAYMENT.name())
                .build();
    }

    @Transactional(readOnly = true)
    public List<BookingEntry> getBookings(String tenantId) {
        TenantIds.requireValid(tenantId);
        return bookingRepository.findByTenantIdOrderByCreatedAtDesc(tenantId).stream()
                .map(bookingMapper::toEntry)
                .toList();
    }

    @Transactional(readOnly = true)
    public BookingEntry getBooking(String tenantId, String bookingId) {
        TenantIds.requireValid(tenantId);
        if (!StringUtils.hasText(bookingId)) {
            throw new BookingValidationException("INVALID_BOOKING_ID", "Booking ID is required");
        }

        return bookingRepository.findByTenantIdAndBookingId(tenantId, bookingId)
                .map(bookingMapper::toEntry)
                .orElseThrow(() -> ResourceNotFoundException.booking(bookingId));
    }

    // ============ Private Methods ============

    private Map<String, String> buildMetadata(Booking booking) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(BookingConstants.METADATA_TENANT_ID, booking.getTenantId());
        metadata.put(BookingConstants.METADATA_BOOKING_ID, booking.getBookingId());
        metadata.put(BookingConstants.METADATA_PACKAGE_ID, booking.getPackageId());
        metadata.put(BookingConstants.METADATA_EVENT_DATE, booking.getEventDate().toString());
        metadata.put(BookingConstants.METADATA_EMAIL, booking.getEmail());
        return metadata;
    }

    private String resolveUrl(String template, String bookingId) {
        return template.replace(BOOKING_ID_PLACEHOLDER, bookingId);
    }

    private void validateCheckoutRequest(CheckoutRequest request) {
        if (request == null) {
            throw new BookingValidationException("INVALID_REQUEST", ValidationMessages.CHECKOUT_REQUEST_REQUIRED);
        }
        if (!StringUtils.hasText(request.getPackageSlug())) {
            throw new BookingValidationException("INVALID_PACKAGE", ValidationMessages.PACKAGE_SLUG_REQUIRED);
        }
        if (request.getEventDate() == null) {
            throw new BookingValidationException("INVALID_DATE", ValidationMessages.EVENT_DATE_REQUIRED);
        }
        if (!StringUtils.hasText(request.getCustomerName())) {
            throw new BookingValidationException("INVALID_CUSTOMER_NAME", ValidationMessages.CUSTOMER_NAME_REQUIRED);
        }
        if (!StringUtils.hasText(request.getCustomerEmail())) {
            throw new BookingValidationException("INVALID_EMAIL", ValidationMessages.EMAIL_REQUIRED);
        }
        if (!EMAIL_PATTERN.matcher(request.getCustomerEmail().trim()).matches()) {
            throw new BookingValidationException("INVALID_EMAIL", ValidationMessages.EMAIL_INVALID);
        }
        if (request.getAddOnIds() == null) {
            request.setAddOnIds(List.of());
        }
        if (request.getAddOnIds().size() > BookingConstants.MAX_ADD_ONS_PER_BOOKING) {
            throw new BookingValidationException("INVALID_ADD_ONS", ValidationMessages.ADD_ONS_MAX);
        }
    }
}

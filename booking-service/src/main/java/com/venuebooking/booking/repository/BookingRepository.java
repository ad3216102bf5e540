package com.venuebooking.booking.repository;

import com.venuebooking.booking.enums.BookingStatus;
import com.venuebooking.booking.model.Booking;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<Booking, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Booking b where b.tenantId = :tenantId and b.sessionReference = :sessionReference")
    Optional<Booking> lockByTenantIdAndSessionReference(@Param("tenantId") String tenantId,
                                                        @Param("sessionReference") String sessionReference);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Booking b where b.bookingId = :bookingId")
    Optional<Booking> lockByBookingId(@Param("bookingId") String bookingId);

    boolean existsByTenantIdAndConfirmedDate(String tenantId, LocalDate confirmedDate);

    @Query("select b.confirmedDate from Booking b where b.tenantId = :tenantId " +
            "and b.confirmedDate between :start and :end")
    List<LocalDate> findConfirmedDates(@Param("tenantId") String tenantId,
                                       @Param("start") LocalDate start,
                                       @Param("end") LocalDate end);

    Optional<Booking> findByTenantIdAndBookingId(String tenantId, String bookingId);

    List<Booking> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    List<Booking> findByStatusAndCreatedAtBefore(BookingStatus status, LocalDateTime cutoff);
}

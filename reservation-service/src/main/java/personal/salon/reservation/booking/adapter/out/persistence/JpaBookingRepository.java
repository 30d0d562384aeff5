package personal.salon.reservation.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, UUID>,
        JpaSpecificationExecutor<BookingEntity> {

    List<BookingEntity> findByCustomerIdOrderByCreatedAtDesc(UUID customerId);
}

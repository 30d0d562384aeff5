package personal.salon.reservation.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * Spring Data JPA Repository for Service Offering
 */
public interface JpaServiceOfferingRepository extends JpaRepository<ServiceOfferingEntity, UUID> {
}

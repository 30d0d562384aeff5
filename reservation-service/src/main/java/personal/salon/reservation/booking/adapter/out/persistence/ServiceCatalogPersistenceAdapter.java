package personal.salon.reservation.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.port.out.ServiceRepository;
import personal.salon.reservation.booking.domain.model.ServiceOffering;

import java.util.UUID;

/**
 * Service Catalog Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServiceCatalogPersistenceAdapter implements ServiceRepository {

    private final JpaServiceOfferingRepository jpaServiceOfferingRepository;

    @Override
    public Result<ServiceOffering> findById(UUID serviceId) {
        log.debug("Finding service: serviceId={}", serviceId);
        try {
            return jpaServiceOfferingRepository.findById(serviceId)
                    .map(entity -> Result.ok(entity.toDomain()))
                    .orElseGet(() -> Result.err(ErrorCode.SERVICE_NOT_FOUND, "Service not found: " + serviceId));
        } catch (DataAccessException e) {
            log.error("Database error while finding service: serviceId={}", serviceId, e);
            return Result.err(ErrorCode.DATABASE_ERROR, e.getMessage());
        }
    }
}

package personal.salon.reservation.booking.application.port.out;

import personal.salon.common.result.Result;
import personal.salon.reservation.booking.domain.model.ServiceOffering;

import java.util.UUID;

/**
 * Service Repository (Output Port)
 * 시술 소요 시간과 가격 조회 (없으면 SERVICE_NOT_FOUND)
 */
public interface ServiceRepository {

    Result<ServiceOffering> findById(UUID serviceId);
}

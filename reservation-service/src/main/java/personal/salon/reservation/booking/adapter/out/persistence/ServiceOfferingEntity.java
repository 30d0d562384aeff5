package personal.salon.reservation.booking.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.reservation.booking.domain.model.ServiceOffering;

import java.util.UUID;

/**
 * Service Offering JPA Entity
 * 시술 메뉴 테이블 매핑 (조회 전용)
 */
@Entity
@Table(name = "services")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ServiceOfferingEntity {

    @Id
    private UUID id;

    @Column(name = "salon_id", nullable = false)
    private UUID salonId;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(nullable = false)
    private long price;

    @Column(name = "overtime_rate_per_minute", nullable = false)
    private long overtimeRatePerMinute;

    public static ServiceOfferingEntity fromDomain(ServiceOffering offering) {
        ServiceOfferingEntity entity = new ServiceOfferingEntity();
        entity.id = offering.id();
        entity.salonId = offering.salonId();
        entity.name = offering.name();
        entity.durationMinutes = offering.durationMinutes();
        entity.price = offering.price();
        entity.overtimeRatePerMinute = offering.overtimeRatePerMinute();
        return entity;
    }

    public ServiceOffering toDomain() {
        return new ServiceOffering(id, salonId, name, durationMinutes, price, overtimeRatePerMinute);
    }
}

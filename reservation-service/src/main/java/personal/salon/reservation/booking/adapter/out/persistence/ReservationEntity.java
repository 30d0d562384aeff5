package personal.salon.reservation.booking.adapter.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ReservationState;
import personal.salon.reservation.booking.domain.model.ReservationStatus;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Reservation JPA Entity
 * 예약 테이블 매핑
 * 상태 구분값과 상태별 데이터(변경 시각, 처리자, 취소 사유)를 함께 저장한다.
 */
@Entity
@Table(name = "reservations",
        indexes = {
                @Index(name = "idx_reservation_staff_time", columnList = "staff_id, start_time, end_time"),
                @Index(name = "idx_reservation_customer", columnList = "customer_id"),
                @Index(name = "idx_reservation_salon_start", columnList = "salon_id, start_time")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationEntity {

    @Id
    private UUID id;

    @Column(name = "salon_id", nullable = false)
    private UUID salonId;

    @Column(name = "customer_id", nullable = false)
    private UUID customerId;

    @Column(name = "staff_id", nullable = false)
    private UUID staffId;

    @Column(name = "service_id", nullable = false)
    private UUID serviceId;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;

    @Column(length = 1000)
    private String notes;

    @Column(name = "total_amount", nullable = false)
    private long totalAmount;

    @Column(name = "deposit_amount")
    private Long depositAmount;

    @Column(name = "is_paid", nullable = false)
    private boolean paid;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "status_changed_at")
    private LocalDateTime statusChangedAt;

    @Column(name = "status_changed_by", length = 100)
    private String statusChangedBy;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "created_by", length = 100, updatable = false)
    private String createdBy;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "updated_by", length = 100)
    private String updatedBy;

    @Version
    private Long version;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static ReservationEntity fromDomain(Reservation reservation) {
        ReservationEntity entity = new ReservationEntity();
        entity.id = reservation.id();
        entity.salonId = reservation.salonId();
        entity.customerId = reservation.customerId();
        entity.createdAt = reservation.createdAt();
        entity.createdBy = reservation.createdBy();
        entity.paid = reservation.paid();
        entity.applyDetails(reservation);
        entity.applyState(reservation);
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public Reservation toDomain() {
        return new Reservation(id, salonId, customerId, staffId, serviceId, startTime, endTime, notes,
                totalAmount, depositAmount, paid, toState(), createdAt, createdBy, updatedAt, updatedBy, version);
    }

    /**
     * 예약 내용 반영 (영속성 컨텍스트 내에서 사용)
     * 결제 여부는 부킹 결제로만 바뀌므로 여기서 덮어쓰지 않는다.
     */
    public void applyDetails(Reservation reservation) {
        this.staffId = reservation.staffId();
        this.serviceId = reservation.serviceId();
        this.startTime = reservation.startTime();
        this.endTime = reservation.endTime();
        this.notes = reservation.notes();
        this.totalAmount = reservation.totalAmount();
        this.depositAmount = reservation.depositAmount();
        this.updatedAt = reservation.updatedAt();
        this.updatedBy = reservation.updatedBy();
    }

    /**
     * 상태 반영 (영속성 컨텍스트 내에서 사용)
     */
    public void applyState(Reservation reservation) {
        this.status = reservation.status();
        this.cancellationReason = null;
        ReservationState state = reservation.state();
        if (state instanceof ReservationState.Confirmed confirmed) {
            this.statusChangedAt = confirmed.confirmedAt();
            this.statusChangedBy = confirmed.confirmedBy();
        } else if (state instanceof ReservationState.Cancelled cancelled) {
            this.statusChangedAt = cancelled.cancelledAt();
            this.statusChangedBy = cancelled.cancelledBy();
            this.cancellationReason = cancelled.reason();
        } else if (state instanceof ReservationState.Completed completed) {
            this.statusChangedAt = completed.completedAt();
            this.statusChangedBy = completed.completedBy();
        } else if (state instanceof ReservationState.NoShow noShow) {
            this.statusChangedAt = noShow.markedAt();
            this.statusChangedBy = noShow.markedBy();
        } else {
            this.statusChangedAt = null;
            this.statusChangedBy = null;
        }
        this.updatedAt = reservation.updatedAt();
        this.updatedBy = reservation.updatedBy();
    }

    /**
     * 도메인 스냅샷이 읽힌 뒤 다른 쓰기가 있었는지 확인
     */
    public boolean isModifiedSince(Reservation snapshot) {
        return !Objects.equals(version, snapshot.version());
    }

    public void markPaid(String actor, LocalDateTime now) {
        this.paid = true;
        this.updatedAt = now;
        this.updatedBy = actor;
    }

    private ReservationState toState() {
        return switch (status) {
            case PENDING -> ReservationState.pending();
            case CONFIRMED -> new ReservationState.Confirmed(statusChangedAt, statusChangedBy);
            case CANCELLED -> new ReservationState.Cancelled(statusChangedAt, statusChangedBy, cancellationReason);
            case COMPLETED -> new ReservationState.Completed(statusChangedAt, statusChangedBy);
            case NO_SHOW -> new ReservationState.NoShow(statusChangedAt, statusChangedBy);
        };
    }
}

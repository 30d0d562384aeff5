package personal.salon.reservation.booking.adapter.out.persistence;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.salon.reservation.booking.domain.model.Booking;
import personal.salon.reservation.booking.domain.model.BookingState;
import personal.salon.reservation.booking.domain.model.BookingStatus;
import personal.salon.reservation.booking.domain.model.PaymentMethod;
import personal.salon.reservation.booking.domain.model.PaymentStatus;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Booking JPA Entity
 * 부킹 테이블 매핑 (예약 ID 목록은 booking_reservations 테이블)
 */
@Entity
@Table(name = "bookings",
        indexes = @Index(name = "idx_booking_customer", columnList = "customer_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    private UUID id;

    @Column(name = "salon_id", nullable = false)
    private UUID salonId;

    @Column(name = "customer_id", nullable = false)
    private UUID customerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "booking_reservations", joinColumns = @JoinColumn(name = "booking_id"))
    @OrderColumn(name = "position")
    @Column(name = "reservation_id", nullable = false)
    private List<UUID> reservationIds = new ArrayList<>();

    @Column(name = "total_amount", nullable = false)
    private long totalAmount;

    @Column(name = "discount_amount")
    private Long discountAmount;

    @Column(name = "final_amount", nullable = false)
    private long finalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", length = 20)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(length = 1000)
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

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

    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.id = booking.id();
        entity.salonId = booking.salonId();
        entity.customerId = booking.customerId();
        entity.reservationIds = new ArrayList<>(booking.reservationIds());
        entity.totalAmount = booking.totalAmount();
        entity.discountAmount = booking.discountAmount();
        entity.finalAmount = booking.finalAmount();
        entity.notes = booking.notes();
        entity.createdAt = booking.createdAt();
        entity.createdBy = booking.createdBy();
        entity.applyPayment(booking);
        entity.applyState(booking);
        return entity;
    }

    public Booking toDomain() {
        return new Booking(id, salonId, customerId, List.copyOf(reservationIds), totalAmount, discountAmount,
                finalAmount, paymentMethod, paymentStatus, notes, toState(), createdAt, createdBy, updatedAt,
                updatedBy, version);
    }

    /**
     * 내용 반영 (영속성 컨텍스트 내에서 사용)
     * 상태와 결제 상태는 전이 경로로만 바뀌므로 여기서 덮어쓰지 않는다.
     */
    public void applyDetails(Booking booking) {
        this.reservationIds.clear();
        this.reservationIds.addAll(booking.reservationIds());
        this.discountAmount = booking.discountAmount();
        this.finalAmount = booking.finalAmount();
        this.paymentMethod = booking.paymentMethod();
        this.notes = booking.notes();
        this.updatedAt = booking.updatedAt();
        this.updatedBy = booking.updatedBy();
    }

    public boolean isModifiedSince(Booking snapshot) {
        return !Objects.equals(version, snapshot.version());
    }

    /**
     * 상태 반영 (영속성 컨텍스트 내에서 사용)
     */
    public void applyState(Booking booking) {
        this.status = booking.status();
        this.paymentStatus = booking.paymentStatus();
        this.cancellationReason = null;
        BookingState state = booking.state();
        if (state instanceof BookingState.Confirmed confirmed) {
            this.statusChangedAt = confirmed.confirmedAt();
            this.statusChangedBy = confirmed.confirmedBy();
        } else if (state instanceof BookingState.Cancelled cancelled) {
            this.statusChangedAt = cancelled.cancelledAt();
            this.statusChangedBy = cancelled.cancelledBy();
            this.cancellationReason = cancelled.reason();
        } else if (state instanceof BookingState.Completed completed) {
            this.statusChangedAt = completed.completedAt();
            this.statusChangedBy = completed.completedBy();
        } else if (state instanceof BookingState.NoShow noShow) {
            this.statusChangedAt = noShow.markedAt();
            this.statusChangedBy = noShow.markedBy();
        } else {
            this.statusChangedAt = null;
            this.statusChangedBy = null;
        }
        this.updatedAt = booking.updatedAt();
        this.updatedBy = booking.updatedBy();
    }

    /**
     * 결제 정보 반영 (영속성 컨텍스트 내에서 사용)
     */
    public void applyPayment(Booking booking) {
        this.paymentMethod = booking.paymentMethod();
        this.paymentStatus = booking.paymentStatus();
        this.updatedAt = booking.updatedAt();
        this.updatedBy = booking.updatedBy();
    }

    private BookingState toState() {
        return switch (status) {
            case DRAFT -> new BookingState.Draft();
            case CONFIRMED -> new BookingState.Confirmed(statusChangedAt, statusChangedBy);
            case CANCELLED -> new BookingState.Cancelled(statusChangedAt, statusChangedBy, cancellationReason);
            case COMPLETED -> new BookingState.Completed(statusChangedAt, statusChangedBy);
            case NO_SHOW -> new BookingState.NoShow(statusChangedAt, statusChangedBy);
        };
    }
}

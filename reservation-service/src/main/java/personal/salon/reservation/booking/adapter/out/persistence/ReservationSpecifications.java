package personal.salon.reservation.booking.adapter.out.persistence;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import personal.salon.reservation.booking.domain.model.ReservationSearchCriteria;

import java.util.ArrayList;
import java.util.List;

/**
 * 예약 검색 조건 -> JPA Specification 변환
 */
final class ReservationSpecifications {

    private ReservationSpecifications() {
    }

    static Specification<ReservationEntity> matching(ReservationSearchCriteria criteria) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (criteria.salonId() != null) {
                predicates.add(cb.equal(root.get("salonId"), criteria.salonId()));
            }
            if (criteria.customerId() != null) {
                predicates.add(cb.equal(root.get("customerId"), criteria.customerId()));
            }
            if (criteria.staffId() != null) {
                predicates.add(cb.equal(root.get("staffId"), criteria.staffId()));
            }
            if (criteria.status() != null) {
                predicates.add(cb.equal(root.get("status"), criteria.status()));
            }
            if (criteria.startFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("startTime"), criteria.startFrom()));
            }
            if (criteria.startTo() != null) {
                predicates.add(cb.lessThan(root.get("startTime"), criteria.startTo()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}

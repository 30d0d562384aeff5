package personal.salon.reservation.booking.adapter.out.persistence;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import personal.salon.reservation.booking.domain.model.BookingSearchCriteria;

import java.util.ArrayList;
import java.util.List;

/**
 * 부킹 검색 조건 -> JPA Specification 변환
 */
final class BookingSpecifications {

    private BookingSpecifications() {
    }

    static Specification<BookingEntity> matching(BookingSearchCriteria criteria) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (criteria.salonId() != null) {
                predicates.add(cb.equal(root.get("salonId"), criteria.salonId()));
            }
            if (criteria.customerId() != null) {
                predicates.add(cb.equal(root.get("customerId"), criteria.customerId()));
            }
            if (criteria.status() != null) {
                predicates.add(cb.equal(root.get("status"), criteria.status()));
            }
            if (criteria.createdFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), criteria.createdFrom()));
            }
            if (criteria.createdTo() != null) {
                predicates.add(cb.lessThan(root.get("createdAt"), criteria.createdTo()));
            }
            if (criteria.minAmount() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("finalAmount"), criteria.minAmount()));
            }
            if (criteria.maxAmount() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("finalAmount"), criteria.maxAmount()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}

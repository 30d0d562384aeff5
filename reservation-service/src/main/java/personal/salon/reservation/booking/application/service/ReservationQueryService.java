package personal.salon.reservation.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.port.in.CountReservationsUseCase;
import personal.salon.reservation.booking.application.port.in.GetReservationUseCase;
import personal.salon.reservation.booking.application.port.in.ListReservationsUseCase;
import personal.salon.reservation.booking.application.port.out.ReservationRepository;
import personal.salon.reservation.booking.domain.model.PageResult;
import personal.salon.reservation.booking.domain.model.Pagination;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ReservationSearchCriteria;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Reservation Query Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationQueryService implements GetReservationUseCase, ListReservationsUseCase,
        CountReservationsUseCase {

    private final ReservationRepository reservationRepository;

    @Override
    public Result<Reservation> getReservation(UUID reservationId) {
        log.debug("Get reservation: reservationId={}", reservationId);
        if (reservationId == null) {
            return Result.err(ErrorCode.INVALID_INPUT, "Reservation ID is required");
        }
        return reservationRepository.findById(reservationId)
                .mapError(RepositoryFailures.wrap("Failed to load reservation"));
    }

    @Override
    public Result<PageResult<Reservation>> listReservations(ReservationSearchCriteria criteria, Pagination pagination) {
        if (criteria == null || pagination == null) {
            return Result.err(ErrorCode.INVALID_INPUT, "Search criteria and pagination are required");
        }
        log.debug("List reservations: criteria={}, page={}, size={}", criteria, pagination.page(), pagination.size());
        if (criteria.startFrom() != null && criteria.startTo() != null
                && criteria.startFrom().isAfter(criteria.startTo())) {
            return Result.err(ErrorCode.INVALID_TIME_RANGE, "startFrom must not be after startTo");
        }
        return reservationRepository.search(criteria, pagination)
                .mapError(RepositoryFailures.wrap("Failed to search reservations"));
    }

    @Override
    public Result<Long> countByDate(LocalDate date, UUID salonId) {
        if (date == null) {
            return Result.err(ErrorCode.INVALID_INPUT, "Date is required");
        }
        return reservationRepository.countByDate(date, salonId)
                .mapError(RepositoryFailures.wrap("Failed to count reservations"));
    }
}

package personal.salon.reservation.booking.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.FieldError;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.application.config.ReservationPolicyProperties;
import personal.salon.reservation.booking.application.port.in.FindAvailableSlotsQuery;
import personal.salon.reservation.booking.application.port.out.ReservationRepository;
import personal.salon.reservation.booking.application.port.out.ServiceRepository;
import personal.salon.reservation.booking.application.port.out.StaffScheduleRepository;
import personal.salon.reservation.booking.domain.model.AvailableSlot;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ServiceOffering;
import personal.salon.reservation.booking.domain.model.TimeRange;
import personal.salon.reservation.booking.domain.model.WorkingHours;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("AvailableSlotsQueryService 단위 테스트")
class AvailableSlotsQueryServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 9, 0);
    private static final LocalDate DAY = LocalDate.of(2024, 6, 1);
    private static final UUID STAFF_ID = UUID.randomUUID();
    private static final UUID SERVICE_ID = UUID.randomUUID();

    @Mock
    private ServiceRepository serviceRepository;
    @Mock
    private StaffScheduleRepository staffScheduleRepository;
    @Mock
    private ReservationRepository reservationRepository;

    private AvailableSlotsQueryService service(boolean rejectPastSlotQueries) {
        ReservationPolicyProperties policy = new ReservationPolicyProperties(
                Duration.ofHours(1), 3, 10_000_000L, Duration.ZERO, rejectPastSlotQueries);
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        return new AvailableSlotsQueryService(serviceRepository, staffScheduleRepository, reservationRepository,
                policy, clock);
    }

    private void givenHaircut() {
        given(serviceRepository.findById(SERVICE_ID))
                .willReturn(Result.ok(new ServiceOffering(SERVICE_ID, UUID.randomUUID(), "Haircut", 60, 30000L, 0L)));
    }

    @Test
    @DisplayName("09:00-18:00 근무, 10:00-11:00 확정 예약 -> 09:00, 11:00~17:00 시작 슬롯")
    void findAvailableSlots_AroundConfirmedReservation() {
        // given
        givenHaircut();
        given(staffScheduleRepository.findWorkingHours(STAFF_ID, DAY.getDayOfWeek()))
                .willReturn(Result.ok(Optional.of(WorkingHours.of(LocalTime.of(9, 0), LocalTime.of(18, 0)))));
        Reservation existing = Reservation.create(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), STAFF_ID,
                SERVICE_ID, new TimeRange(DAY.atTime(10, 0), DAY.atTime(11, 0)), null, 30000L, null,
                "customer-1", NOW, true);
        given(reservationRepository.findByStaffAndDateRange(STAFF_ID, DAY.atStartOfDay(), DAY.plusDays(1).atStartOfDay()))
                .willReturn(Result.ok(List.of(existing)));

        // when
        Result<List<AvailableSlot>> result = service(false).findAvailableSlots(
                new FindAvailableSlotsQuery(STAFF_ID, DAY, SERVICE_ID));

        // then
        assertThat(result.value())
                .extracting(slot -> slot.startTime().toLocalTime())
                .containsExactly(LocalTime.of(9, 0), LocalTime.of(11, 0), LocalTime.of(12, 0), LocalTime.of(13, 0),
                        LocalTime.of(14, 0), LocalTime.of(15, 0), LocalTime.of(16, 0), LocalTime.of(17, 0));
    }

    @Test
    @DisplayName("근무하지 않는 요일이면 빈 목록")
    void findAvailableSlots_OffDuty() {
        // given
        givenHaircut();
        given(staffScheduleRepository.findWorkingHours(STAFF_ID, DAY.getDayOfWeek()))
                .willReturn(Result.ok(Optional.empty()));

        // when
        Result<List<AvailableSlot>> result = service(false).findAvailableSlots(
                new FindAvailableSlotsQuery(STAFF_ID, DAY, SERVICE_ID));

        // then
        assertThat(result.value()).isEmpty();
        verifyNoInteractions(reservationRepository);
    }

    @Test
    @DisplayName("필수 파라미터가 없으면 필드별 VALIDATION_FAILED")
    void findAvailableSlots_MissingParameters() {
        // when
        Result<List<AvailableSlot>> result = service(false).findAvailableSlots(
                new FindAvailableSlotsQuery(null, null, null));

        // then
        assertThat(result.error().code()).isEqualTo(ErrorCode.VALIDATION_FAILED);
        assertThat(result.error().fieldErrors()).extracting(FieldError::field)
                .containsExactly("staffId", "date", "serviceId");
    }

    @Test
    @DisplayName("지난 날짜 조회는 설정이 켜져 있을 때만 거부된다")
    void findAvailableSlots_PastDate() {
        // given
        LocalDate yesterday = NOW.toLocalDate().minusDays(1);

        // when
        Result<List<AvailableSlot>> rejected = service(true).findAvailableSlots(
                new FindAvailableSlotsQuery(STAFF_ID, yesterday, SERVICE_ID));

        // then
        assertThat(rejected.error().code()).isEqualTo(ErrorCode.PAST_TIME_NOT_ALLOWED);
        verifyNoInteractions(serviceRepository);
    }

    @Test
    @DisplayName("설정이 꺼져 있으면 지난 날짜도 계산한다")
    void findAvailableSlots_PastDateAllowed() {
        // given
        LocalDate yesterday = NOW.toLocalDate().minusDays(1);
        givenHaircut();
        given(staffScheduleRepository.findWorkingHours(STAFF_ID, yesterday.getDayOfWeek()))
                .willReturn(Result.ok(Optional.of(WorkingHours.of(LocalTime.of(10, 0), LocalTime.of(12, 0)))));
        given(reservationRepository.findByStaffAndDateRange(STAFF_ID, yesterday.atStartOfDay(),
                yesterday.plusDays(1).atStartOfDay()))
                .willReturn(Result.ok(List.of()));

        // when
        Result<List<AvailableSlot>> result = service(false).findAvailableSlots(
                new FindAvailableSlotsQuery(STAFF_ID, yesterday, SERVICE_ID));

        // then
        assertThat(result.value()).hasSize(2);
    }

    @Test
    @DisplayName("없는 시술이면 SERVICE_NOT_FOUND")
    void findAvailableSlots_UnknownService() {
        // given
        given(serviceRepository.findById(SERVICE_ID))
                .willReturn(Result.err(ErrorCode.SERVICE_NOT_FOUND, "Service not found"));

        // when
        Result<List<AvailableSlot>> result = service(false).findAvailableSlots(
                new FindAvailableSlotsQuery(STAFF_ID, DAY, SERVICE_ID));

        // then
        assertThat(result.error().code()).isEqualTo(ErrorCode.SERVICE_NOT_FOUND);
    }
}

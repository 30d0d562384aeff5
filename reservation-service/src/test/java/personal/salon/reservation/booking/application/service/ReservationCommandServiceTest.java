package personal.salon.reservation.booking.application.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.FieldError;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.adapter.out.lock.LocalStaffLockAdapter;
import personal.salon.reservation.booking.application.config.ReservationPolicyProperties;
import personal.salon.reservation.booking.application.port.in.CreateReservationCommand;
import personal.salon.reservation.booking.application.port.in.UpdateReservationCommand;
import personal.salon.reservation.booking.application.port.out.ReservationEventPublisher;
import personal.salon.reservation.booking.application.port.out.ReservationRepository;
import personal.salon.reservation.booking.application.port.out.ServiceRepository;
import personal.salon.reservation.booking.domain.model.LifecycleEvent;
import personal.salon.reservation.booking.domain.model.LifecycleEventType;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ReservationStatus;
import personal.salon.reservation.booking.domain.model.ServiceOffering;
import personal.salon.reservation.booking.domain.model.TimeRange;
import personal.salon.reservation.booking.domain.service.ReservationSlotManager;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReservationCommandService 단위 테스트")
class ReservationCommandServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 9, 0);
    private static final LocalDateTime START = LocalDateTime.of(2024, 6, 1, 10, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 6, 1, 11, 0);
    private static final UUID SALON_ID = UUID.randomUUID();
    private static final UUID CUSTOMER_ID = UUID.randomUUID();
    private static final UUID STAFF_ID = UUID.randomUUID();
    private static final UUID SERVICE_ID = UUID.randomUUID();
    private static final String ACTOR = "customer-1";

    @Mock
    private ServiceRepository serviceRepository;
    @Mock
    private ReservationRepository reservationRepository;
    @Mock
    private ReservationEventPublisher eventPublisher;

    private ReservationCommandService reservationCommandService;
    private ServiceOffering haircut;

    @BeforeEach
    void setUp() {
        LocalStaffLockAdapter lock = new LocalStaffLockAdapter(Duration.ofSeconds(1), new SimpleMeterRegistry());
        ReservationSlotManager slotManager = new ReservationSlotManager(reservationRepository, lock);
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        reservationCommandService = new ReservationCommandService(serviceRepository, reservationRepository,
                slotManager, eventPublisher, ReservationPolicyProperties.defaults(), clock);
        haircut = new ServiceOffering(SERVICE_ID, SALON_ID, "Haircut", 60, 30000L, 500L);
    }

    private CreateReservationCommand createCommand(LocalDateTime start, LocalDateTime end, Long amount) {
        return new CreateReservationCommand(SALON_ID, CUSTOMER_ID, STAFF_ID, SERVICE_ID, start, end,
                "first visit", amount, null, ACTOR, false);
    }

    private void givenPersistedAsIs() {
        given(reservationRepository.create(any(Reservation.class)))
                .willAnswer(invocation -> Result.ok(invocation.getArgument(0)));
    }

    @Nested
    @DisplayName("예약 생성")
    class Create {

        @Test
        @DisplayName("빈 시간에 10:00-11:00, 5000원 예약을 만들면 PENDING 으로 저장되고 이벤트가 발행된다")
        void createReservation_Success() {
            // given
            given(serviceRepository.findById(SERVICE_ID)).willReturn(Result.ok(haircut));
            given(reservationRepository.checkTimeSlotConflict(STAFF_ID, START, END, null)).willReturn(Result.ok(false));
            givenPersistedAsIs();

            // when
            Result<Reservation> result = reservationCommandService.createReservation(createCommand(START, END, 5000L));

            // then
            assertThat(result.isOk()).isTrue();
            Reservation reservation = result.value();
            assertThat(reservation.status()).isEqualTo(ReservationStatus.PENDING);
            assertThat(reservation.totalAmount()).isEqualTo(5000L);
            assertThat(reservation.timeRange()).isEqualTo(new TimeRange(START, END));
            assertThat(reservation.createdBy()).isEqualTo(ACTOR);

            ArgumentCaptor<LifecycleEvent> event = ArgumentCaptor.forClass(LifecycleEvent.class);
            then(eventPublisher).should().publish(event.capture());
            assertThat(event.getValue().type()).isEqualTo(LifecycleEventType.RESERVATION_CREATED);
            assertThat(event.getValue().aggregateId()).isEqualTo(reservation.id());
        }

        @Test
        @DisplayName("같은 직원의 겹치는 시간(10:30-11:30)은 SLOT_CONFLICT 이며 저장하지 않는다")
        void createReservation_SlotConflict() {
            // given
            LocalDateTime start = START.plusMinutes(30);
            LocalDateTime end = END.plusMinutes(30);
            given(serviceRepository.findById(SERVICE_ID)).willReturn(Result.ok(haircut));
            given(reservationRepository.checkTimeSlotConflict(STAFF_ID, start, end, null)).willReturn(Result.ok(true));

            // when
            Result<Reservation> result = reservationCommandService.createReservation(createCommand(start, end, 5000L));

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.SLOT_CONFLICT);
            then(reservationRepository).should(never()).create(any());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("종료 시각과 금액이 없으면 시술 소요 시간과 가격으로 채운다")
        void createReservation_DefaultsFromService() {
            // given
            given(serviceRepository.findById(SERVICE_ID)).willReturn(Result.ok(haircut));
            given(reservationRepository.checkTimeSlotConflict(STAFF_ID, START, START.plusMinutes(60), null))
                    .willReturn(Result.ok(false));
            givenPersistedAsIs();

            // when
            Result<Reservation> result = reservationCommandService.createReservation(createCommand(START, null, null));

            // then
            assertThat(result.value().endTime()).isEqualTo(START.plusMinutes(60));
            assertThat(result.value().totalAmount()).isEqualTo(30000L);
        }

        @Test
        @DisplayName("필수 식별자가 없으면 필드별 VALIDATION_FAILED, 저장소는 호출되지 않는다")
        void createReservation_MissingIdentifiers() {
            // given
            CreateReservationCommand command = new CreateReservationCommand(SALON_ID, null, null, SERVICE_ID,
                    START, END, null, 5000L, null, ACTOR, false);

            // when
            Result<Reservation> result = reservationCommandService.createReservation(command);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.VALIDATION_FAILED);
            assertThat(result.error().fieldErrors()).extracting(FieldError::field)
                    .containsExactly("customerId", "staffId");
            verifyNoInteractions(serviceRepository, reservationRepository, eventPublisher);
        }

        @Test
        @DisplayName("다른 살롱의 시술이면 SERVICE_NOT_FOUND")
        void createReservation_ServiceOfOtherSalon() {
            // given
            ServiceOffering otherSalon = new ServiceOffering(SERVICE_ID, UUID.randomUUID(), "Perm", 120, 80000L, 0L);
            given(serviceRepository.findById(SERVICE_ID)).willReturn(Result.ok(otherSalon));

            // when
            Result<Reservation> result = reservationCommandService.createReservation(createCommand(START, END, 5000L));

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.SERVICE_NOT_FOUND);
        }

        @Test
        @DisplayName("과거 시작 시각은 PAST_TIME_NOT_ALLOWED")
        void createReservation_Past() {
            // given
            given(serviceRepository.findById(SERVICE_ID)).willReturn(Result.ok(haircut));

            // when
            Result<Reservation> result = reservationCommandService.createReservation(
                    createCommand(NOW.minusHours(2), NOW.minusHours(1), 5000L));

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.PAST_TIME_NOT_ALLOWED);
        }

        @Test
        @DisplayName("금액 상한을 넘으면 INVALID_AMOUNT")
        void createReservation_AmountTooLarge() {
            // given
            given(serviceRepository.findById(SERVICE_ID)).willReturn(Result.ok(haircut));

            // when
            Result<Reservation> result = reservationCommandService.createReservation(
                    createCommand(START, END, 10_000_001L));

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.INVALID_AMOUNT);
        }

        @Test
        @DisplayName("저장소 장애는 문맥을 붙인 SYSTEM_ERROR 로 전달된다")
        void createReservation_DatabaseError() {
            // given
            given(serviceRepository.findById(SERVICE_ID)).willReturn(Result.ok(haircut));
            given(reservationRepository.checkTimeSlotConflict(STAFF_ID, START, END, null)).willReturn(Result.ok(false));
            given(reservationRepository.create(any(Reservation.class)))
                    .willReturn(Result.err(ErrorCode.DATABASE_ERROR, "deadlock"));

            // when
            Result<Reservation> result = reservationCommandService.createReservation(createCommand(START, END, 5000L));

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.SYSTEM_ERROR);
            assertThat(result.error().message()).contains("deadlock");
            verifyNoInteractions(eventPublisher);
        }
    }

    @Nested
    @DisplayName("예약 변경")
    class Update {

        private Reservation existing;

        @BeforeEach
        void setUp() {
            existing = Reservation.create(UUID.randomUUID(), SALON_ID, CUSTOMER_ID, STAFF_ID, SERVICE_ID,
                    new TimeRange(START, END), "first visit", 30000L, 10000L, ACTOR, NOW, false);
        }

        @Test
        @DisplayName("시작 시각만 바꾸면 소요 시간을 유지하고 자기 자신을 제외하고 충돌을 검사한다")
        void updateReservation_Reschedule() {
            // given
            LocalDateTime newStart = START.plusHours(3);
            given(reservationRepository.findById(existing.id())).willReturn(Result.ok(existing));
            given(reservationRepository.checkTimeSlotConflict(STAFF_ID, newStart, newStart.plusHours(1), existing.id()))
                    .willReturn(Result.ok(false));
            given(reservationRepository.update(any(Reservation.class)))
                    .willAnswer(invocation -> Result.ok(invocation.getArgument(0)));
            UpdateReservationCommand command = new UpdateReservationCommand(existing.id(), null, null,
                    newStart, null, null, null, null, "staff-1");

            // when
            Result<Reservation> result = reservationCommandService.updateReservation(command);

            // then
            assertThat(result.value().startTime()).isEqualTo(newStart);
            assertThat(result.value().endTime()).isEqualTo(newStart.plusHours(1));
            assertThat(result.value().updatedBy()).isEqualTo("staff-1");
            then(eventPublisher).should().publish(any(LifecycleEvent.class));
        }

        @Test
        @DisplayName("메모만 바꾸면 충돌 검사 없이 저장한다")
        void updateReservation_NotesOnly() {
            // given
            given(reservationRepository.findById(existing.id())).willReturn(Result.ok(existing));
            given(reservationRepository.update(any(Reservation.class)))
                    .willAnswer(invocation -> Result.ok(invocation.getArgument(0)));
            UpdateReservationCommand command = new UpdateReservationCommand(existing.id(), null, null,
                    null, null, "bring photo", null, null, "staff-1");

            // when
            Result<Reservation> result = reservationCommandService.updateReservation(command);

            // then
            assertThat(result.value().notes()).isEqualTo("bring photo");
            then(reservationRepository).should(never()).checkTimeSlotConflict(any(), any(), any(), any());
        }

        @Test
        @DisplayName("새 시간이 다른 예약과 겹치면 SLOT_CONFLICT")
        void updateReservation_Conflict() {
            // given
            LocalDateTime newStart = START.plusHours(1);
            given(reservationRepository.findById(existing.id())).willReturn(Result.ok(existing));
            given(reservationRepository.checkTimeSlotConflict(STAFF_ID, newStart, newStart.plusHours(1), existing.id()))
                    .willReturn(Result.ok(true));
            UpdateReservationCommand command = new UpdateReservationCommand(existing.id(), null, null,
                    newStart, newStart.plusHours(1), null, null, null, "staff-1");

            // when
            Result<Reservation> result = reservationCommandService.updateReservation(command);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.SLOT_CONFLICT);
            then(reservationRepository).should(never()).update(any());
        }

        @Test
        @DisplayName("종료 상태 예약은 CANNOT_MODIFY")
        void updateReservation_Terminal() {
            // given
            Reservation cancelled = existing.cancel(ACTOR, "sick", NOW, Duration.ofHours(1)).value();
            given(reservationRepository.findById(existing.id())).willReturn(Result.ok(cancelled));
            UpdateReservationCommand command = new UpdateReservationCommand(existing.id(), null, null,
                    null, null, "late note", null, null, "staff-1");

            // when
            Result<Reservation> result = reservationCommandService.updateReservation(command);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.CANNOT_MODIFY);
        }

        @Test
        @DisplayName("총액을 예약금보다 낮추면 INVALID_AMOUNT")
        void updateReservation_TotalBelowDeposit() {
            // given
            given(reservationRepository.findById(existing.id())).willReturn(Result.ok(existing));
            UpdateReservationCommand command = new UpdateReservationCommand(existing.id(), null, null,
                    null, null, null, 5000L, null, "staff-1");

            // when
            Result<Reservation> result = reservationCommandService.updateReservation(command);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.INVALID_AMOUNT);
        }

        @Test
        @DisplayName("시작 12시간 이내의 예약은 메모 변경도 CANNOT_MODIFY")
        void updateReservation_WithinModificationLeadTime() {
            // given
            LocalDateTime soon = NOW.plusHours(11);
            Reservation upcoming = Reservation.create(UUID.randomUUID(), SALON_ID, CUSTOMER_ID, STAFF_ID, SERVICE_ID,
                    new TimeRange(soon, soon.plusHours(1)), null, 30000L, null, ACTOR, NOW, false);
            given(reservationRepository.findById(upcoming.id())).willReturn(Result.ok(upcoming));
            UpdateReservationCommand command = new UpdateReservationCommand(upcoming.id(), null, null,
                    null, null, "running late", null, null, "staff-1");

            // when
            Result<Reservation> result = reservationCommandService.updateReservation(command);

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.CANNOT_MODIFY);
            then(reservationRepository).should(never()).update(any());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("없는 예약은 RESERVATION_NOT_FOUND")
        void updateReservation_NotFound() {
            // given
            UUID unknown = UUID.randomUUID();
            given(reservationRepository.findById(unknown))
                    .willReturn(Result.err(ErrorCode.RESERVATION_NOT_FOUND, "Reservation not found: " + unknown));

            // when
            Result<Reservation> result = reservationCommandService.updateReservation(
                    new UpdateReservationCommand(unknown, null, null, null, null, "x", null, null, "staff-1"));

            // then
            assertThat(result.error().code()).isEqualTo(ErrorCode.RESERVATION_NOT_FOUND);
        }
    }
}

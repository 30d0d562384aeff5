package personal.salon.reservation.booking.application.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import personal.salon.common.exception.ErrorCode;
import personal.salon.common.result.Result;
import personal.salon.reservation.booking.adapter.out.persistence.JpaReservationRepository;
import personal.salon.reservation.booking.adapter.out.persistence.JpaServiceOfferingRepository;
import personal.salon.reservation.booking.adapter.out.persistence.ServiceOfferingEntity;
import personal.salon.reservation.booking.application.port.in.CreateReservationCommand;
import personal.salon.reservation.booking.application.port.in.CreateReservationUseCase;
import personal.salon.reservation.booking.domain.model.Reservation;
import personal.salon.reservation.booking.domain.model.ServiceOffering;
import personal.salon.reservation.support.MutableClock;
import personal.salon.reservation.support.TestClockConfig;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Import(TestClockConfig.class)
@DisplayName("동시 예약 생성 통합 테스트")
class ReservationConcurrencyTest {

    private static final int CONCURRENT_REQUESTS = 10;
    private static final LocalDateTime START = LocalDateTime.of(2024, 6, 1, 10, 0);

    @Autowired
    private CreateReservationUseCase createReservationUseCase;
    @Autowired
    private JpaServiceOfferingRepository serviceOfferingRepository;
    @Autowired
    private JpaReservationRepository reservationRepository;
    @Autowired
    private MutableClock clock;

    private final UUID salonId = UUID.randomUUID();
    private final UUID staffId = UUID.randomUUID();
    private final UUID serviceId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        clock.setNow(TestClockConfig.DEFAULT_NOW);
        serviceOfferingRepository.save(ServiceOfferingEntity.fromDomain(
                new ServiceOffering(serviceId, salonId, "Haircut", 60, 30000L, 500L)));
    }

    @AfterEach
    void tearDown() {
        reservationRepository.deleteAll();
        serviceOfferingRepository.deleteAll();
    }

    @Test
    @DisplayName("같은 직원의 겹치는 시간대에 동시에 예약하면 정확히 한 건만 성공한다")
    void concurrentOverlappingCreates_ExactlyOneSucceeds() throws Exception {
        // given
        ExecutorService executor = Executors.newFixedThreadPool(CONCURRENT_REQUESTS);
        CountDownLatch ready = new CountDownLatch(1);
        List<CompletableFuture<Result<Reservation>>> futures = IntStream.range(0, CONCURRENT_REQUESTS)
                .mapToObj(i -> CompletableFuture.supplyAsync(() -> {
                    awaitQuietly(ready);
                    LocalDateTime start = START.plusMinutes(i % 3 * 15L);
                    return createReservationUseCase.createReservation(new CreateReservationCommand(
                            salonId, UUID.randomUUID(), staffId, serviceId, start, start.plusHours(1),
                            null, 5000L, null, "customer-" + i, false));
                }, executor))
                .toList();

        // when
        ready.countDown();
        List<Result<Reservation>> results = futures.stream().map(CompletableFuture::join).toList();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(results).filteredOn(Result::isOk).hasSize(1);
        assertThat(results).filteredOn(Result::isErr)
                .allSatisfy(result -> assertThat(result.error().code())
                        .isIn(ErrorCode.SLOT_CONFLICT, ErrorCode.SLOT_NOT_AVAILABLE));
        assertThat(reservationRepository.findByStaffInRange(staffId, START.minusHours(1), START.plusHours(3)))
                .hasSize(1);
    }

    @Test
    @DisplayName("서로 다른 직원은 같은 시간대에 동시에 예약할 수 있다")
    void concurrentCreates_DifferentStaff() {
        // given
        List<CompletableFuture<Result<Reservation>>> futures = IntStream.range(0, 5)
                .mapToObj(i -> CompletableFuture.supplyAsync(() ->
                        createReservationUseCase.createReservation(new CreateReservationCommand(
                                salonId, UUID.randomUUID(), UUID.randomUUID(), serviceId, START, START.plusHours(1),
                                null, 5000L, null, "customer-" + i, false))))
                .toList();

        // when
        List<Result<Reservation>> results = futures.stream().map(CompletableFuture::join).toList();

        // then
        assertThat(results).allMatch(Result::isOk);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

package personal.ai.dialog.popular.adapter.out.external;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.ai.dialog.popular.application.port.out.BookingHistorySource;
import personal.ai.dialog.popular.domain.exception.PopularTimesUnavailableException;
import personal.ai.dialog.popular.domain.model.BookingRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Booking Core History Adapter
 * 예약 코어 서비스의 예약 이력 API 호출 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCoreHistoryAdapter implements BookingHistorySource {

    private static final ParameterizedTypeReference<List<BookingRecord>> BOOKING_LIST = new ParameterizedTypeReference<>() {
    };

    private final RestClient bookingCoreRestClient;

    @Override
    @CircuitBreaker(name = "bookingCore", fallbackMethod = "findBookingsFallback")
    @Retry(name = "bookingCore")
    public List<BookingRecord> findBookings(String salonId, LocalDate since) {
        List<BookingRecord> bookings = bookingCoreRestClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/salons/{salonId}/bookings")
                        .queryParam("since", since)
                        .build(salonId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    log.warn("Booking history lookup failed: salonId={}, status={}", salonId, response.getStatusCode());
                    throw new PopularTimesUnavailableException(salonId);
                })
                .body(BOOKING_LIST);

        log.debug("Booking history fetched: salonId={}, since={}, count={}",
                salonId, since, bookings == null ? 0 : bookings.size());
        return bookings == null ? List.of() : bookings;
    }

    private List<BookingRecord> findBookingsFallback(String salonId, LocalDate since, Exception e) {
        log.warn("Booking history circuit open or call failed: salonId={}, error={}",
                salonId, e.getClass().getSimpleName());
        throw new PopularTimesUnavailableException(salonId);
    }
}

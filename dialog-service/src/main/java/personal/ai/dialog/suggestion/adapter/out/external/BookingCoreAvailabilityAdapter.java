package personal.ai.dialog.suggestion.adapter.out.external;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.ai.dialog.suggestion.application.port.out.AvailabilitySource;
import personal.ai.dialog.suggestion.domain.exception.AvailabilityUnavailableException;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Booking Core Availability Adapter
 * 예약 코어 서비스의 가용 슬롯 API 호출 구현체 (RestClient)
 * <p>
 * 5xx, Timeout → Circuit 실패로 카운트, Fallback에서 AvailabilityUnavailableException 변환
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCoreAvailabilityAdapter implements AvailabilitySource {

    private static final ParameterizedTypeReference<List<SlotSuggestion>> SLOT_LIST = new ParameterizedTypeReference<>() {
    };

    private final RestClient bookingCoreRestClient;

    @Override
    @CircuitBreaker(name = "bookingCore", fallbackMethod = "findAvailableSlotsFallback")
    @Retry(name = "bookingCore")
    public List<SlotSuggestion> findAvailableSlots(String salonId, String serviceId, LocalDate from, LocalDate to) {
        log.debug("Fetching available slots: salonId={}, serviceId={}, from={}, to={}", salonId, serviceId, from, to);

        List<SlotSuggestion> slots = bookingCoreRestClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/salons/{salonId}/availability")
                        .queryParamIfPresent("serviceId", Optional.ofNullable(serviceId))
                        .queryParam("from", from)
                        .queryParam("to", to)
                        .build(salonId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    log.warn("Availability lookup failed: salonId={}, status={}", salonId, response.getStatusCode());
                    throw new AvailabilityUnavailableException(salonId);
                })
                .body(SLOT_LIST);

        log.debug("Available slots fetched: salonId={}, count={}", salonId, slots == null ? 0 : slots.size());
        return slots == null ? List.of() : slots;
    }

    private List<SlotSuggestion> findAvailableSlotsFallback(String salonId, String serviceId, LocalDate from,
                                                            LocalDate to, Exception e) {
        log.warn("Availability circuit open or call failed: salonId={}, serviceId={}, error={}",
                salonId, serviceId, e.getClass().getSimpleName());
        throw new AvailabilityUnavailableException(salonId);
    }
}

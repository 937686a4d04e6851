package personal.ai.dialog.conversation.adapter.out.external;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.ai.dialog.conversation.adapter.out.external.dto.CreateBookingRequest;
import personal.ai.dialog.conversation.application.port.out.BookingCommandPort;
import personal.ai.dialog.conversation.domain.exception.BookingServiceUnavailableException;
import personal.ai.dialog.conversation.domain.model.BookingConfirmation;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

/**
 * Booking Core Command Adapter
 * 예약 코어 서비스에 예약 생성을 요청한다.
 * <p>
 * POST는 멱등하지 않으므로 Retry 없이 Circuit Breaker만 적용
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCoreCommandAdapter implements BookingCommandPort {

    private final RestClient bookingCoreRestClient;

    @Override
    @CircuitBreaker(name = "bookingCore", fallbackMethod = "confirmBookingFallback")
    public BookingConfirmation confirmBooking(String customerId, String salonId, SlotSuggestion slot) {
        log.debug("Creating booking: customerId={}, salonId={}, slotId={}", customerId, salonId, slot.id());

        BookingConfirmation confirmation = bookingCoreRestClient.post()
                .uri("/api/v1/salons/{salonId}/bookings", salonId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(CreateBookingRequest.of(customerId, slot))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    log.warn("Booking creation rejected: salonId={}, slotId={}, status={}",
                            salonId, slot.id(), response.getStatusCode());
                    throw new BookingServiceUnavailableException(salonId, slot.id());
                })
                .body(BookingConfirmation.class);

        if (confirmation == null || confirmation.bookingId() == null) {
            throw new BookingServiceUnavailableException(salonId, slot.id());
        }
        return confirmation;
    }

    private BookingConfirmation confirmBookingFallback(String customerId, String salonId, SlotSuggestion slot,
                                                       Exception e) {
        log.warn("Booking circuit open or call failed: salonId={}, slotId={}, error={}",
                salonId, slot.id(), e.getClass().getSimpleName());
        throw new BookingServiceUnavailableException(salonId, slot.id());
    }
}

package personal.ai.dialog.session.adapter.out.external;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.ai.dialog.session.application.port.out.MessageHistoryReader;
import personal.ai.dialog.session.domain.exception.MessageHistoryUnavailableException;
import personal.ai.dialog.session.domain.model.TransportMessage;

import java.util.List;

/**
 * Booking Core Message History Adapter
 * 예약 코어 서비스에 저장된 메신저 송수신 이력 조회
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCoreMessageHistoryAdapter implements MessageHistoryReader {

    private static final ParameterizedTypeReference<List<TransportMessage>> MESSAGE_LIST = new ParameterizedTypeReference<>() {
    };

    private final RestClient bookingCoreRestClient;

    @Override
    @CircuitBreaker(name = "bookingCore", fallbackMethod = "findRecentMessagesFallback")
    @Retry(name = "bookingCore")
    public List<TransportMessage> findRecentMessages(String customerId, String salonId, int limit) {
        List<TransportMessage> messages = bookingCoreRestClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/salons/{salonId}/customers/{customerId}/messages")
                        .queryParam("limit", limit)
                        .build(salonId, customerId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    log.warn("Message history lookup failed: customerId={}, salonId={}, status={}",
                            customerId, salonId, response.getStatusCode());
                    throw new MessageHistoryUnavailableException(customerId, salonId);
                })
                .body(MESSAGE_LIST);

        log.debug("Message history fetched: customerId={}, salonId={}, count={}",
                customerId, salonId, messages == null ? 0 : messages.size());
        return messages == null ? List.of() : messages;
    }

    private List<TransportMessage> findRecentMessagesFallback(String customerId, String salonId, int limit,
                                                              Exception e) {
        log.warn("Message history circuit open or call failed: customerId={}, salonId={}, error={}",
                customerId, salonId, e.getClass().getSimpleName());
        throw new MessageHistoryUnavailableException(customerId, salonId);
    }
}

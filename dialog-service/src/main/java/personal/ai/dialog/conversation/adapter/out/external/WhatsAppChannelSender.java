package personal.ai.dialog.conversation.adapter.out.external;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import personal.ai.dialog.card.domain.model.InteractivePayload;
import personal.ai.dialog.conversation.adapter.out.external.dto.WhatsAppMessageRequest;
import personal.ai.dialog.conversation.application.port.out.ChannelSender;
import personal.ai.dialog.conversation.domain.exception.ChannelDeliveryFailedException;

/**
 * WhatsApp Channel Sender
 * WhatsApp Cloud API(POST /{phoneNumberId}/messages)로 카드를 발송한다.
 * <p>
 * 발송은 재시도하지 않는다 (중복 메시지 방지). 실패는 ChannelDeliveryFailedException으로 변환.
 */
@Slf4j
@Component
public class WhatsAppChannelSender implements ChannelSender {

    private final RestClient whatsappRestClient;
    private final String phoneNumberId;

    public WhatsAppChannelSender(@Qualifier("whatsappRestClient") RestClient whatsappRestClient,
                                 @Value("${external.whatsapp.phone-number-id}") String phoneNumberId) {
        this.whatsappRestClient = whatsappRestClient;
        this.phoneNumberId = phoneNumberId;
    }

    @Override
    @CircuitBreaker(name = "whatsapp", fallbackMethod = "sendFallback")
    public void send(String customerId, InteractivePayload payload) {
        log.debug("Sending message: customerId={}, type={}", customerId, payload.type());

        whatsappRestClient.post()
                .uri("/{phoneNumberId}/messages", phoneNumberId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(WhatsAppMessageRequest.of(customerId, payload))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    log.warn("WhatsApp rejected message: customerId={}, status={}",
                            customerId, response.getStatusCode());
                    throw new ChannelDeliveryFailedException(customerId);
                })
                .toBodilessEntity();

        log.debug("Message sent: customerId={}", customerId);
    }

    private void sendFallback(String customerId, InteractivePayload payload, Exception e) {
        log.warn("WhatsApp circuit open or call failed: customerId={}, type={}, error={}",
                customerId, payload.type(), e.getClass().getSimpleName());
        throw new ChannelDeliveryFailedException(customerId);
    }
}

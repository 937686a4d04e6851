package personal.ai.dialog.conversation.application.port.out;

import personal.ai.dialog.card.domain.model.InteractivePayload;

/**
 * 메신저 발송 Port
 * 전달/재시도 보장은 구현체(채널)의 책임이다.
 */
public interface ChannelSender {

    /**
     * @throws personal.ai.dialog.conversation.domain.exception.ChannelDeliveryFailedException 발송 실패
     */
    void send(String customerId, InteractivePayload payload);
}

package personal.ai.dialog.conversation.adapter.in.web.dto;

import personal.ai.dialog.card.domain.model.InteractivePayload;
import personal.ai.dialog.conversation.domain.model.OutboundMessage;

/**
 * 이벤트 처리 응답 DTO
 */
public record OutboundMessageResponse(
        InteractivePayload payload,
        String state,
        boolean degraded
) {
    public static OutboundMessageResponse from(OutboundMessage message) {
        return new OutboundMessageResponse(
                message.payload(),
                message.state().code(),
                message.degraded()
        );
    }
}

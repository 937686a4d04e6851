package personal.ai.dialog.session.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * 메신저 전송 계층의 메시지 (이력 복구 입력)
 *
 * @param buttonId  고객이 누른 버튼 id (BUTTON_REPLY)
 * @param optionIds 발송한 카드의 버튼/행 id (INTERACTIVE)
 */
public record TransportMessage(
        String id,
        TransportMessageType type,
        String text,
        String buttonId,
        List<String> optionIds,
        Instant timestamp,
        MessageDirection direction
) {
    public TransportMessage {
        optionIds = optionIds == null ? List.of() : List.copyOf(optionIds);
    }

    public boolean isInbound() {
        return direction == MessageDirection.INBOUND;
    }

    public boolean isOutboundInteractive() {
        return direction == MessageDirection.OUTBOUND && type == TransportMessageType.INTERACTIVE;
    }

    public boolean isInboundText() {
        return isInbound() && type == TransportMessageType.TEXT && text != null && !text.isBlank();
    }
}

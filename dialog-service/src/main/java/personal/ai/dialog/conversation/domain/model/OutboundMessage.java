package personal.ai.dialog.conversation.domain.model;

import personal.ai.dialog.card.domain.model.InteractivePayload;
import personal.ai.dialog.session.domain.model.ConversationState;

/**
 * 이벤트 처리 결과
 *
 * @param degraded 의존 시스템 장애로 대체 경로(이력 복구, 기본 시간대, 사과 메시지)를 사용했는지
 */
public record OutboundMessage(
        InteractivePayload payload,
        ConversationState state,
        boolean degraded
) {
}

package personal.ai.dialog.conversation.application.port.in;

import personal.ai.dialog.conversation.domain.model.InboundEvent;
import personal.ai.dialog.conversation.domain.model.OutboundMessage;

/**
 * 고객 메시지 처리 UseCase
 * 세션 복원 → 슬롯/인기 시간대 → 카드 생성 → 발송 → 세션 저장
 */
public interface HandleInboundEventUseCase {

    OutboundMessage handle(InboundEvent event);
}

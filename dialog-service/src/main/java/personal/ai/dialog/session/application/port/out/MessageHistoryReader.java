package personal.ai.dialog.session.application.port.out;

import personal.ai.dialog.session.domain.model.TransportMessage;

import java.util.List;

/**
 * 메신저 전송 이력 조회 Port (세션 복구 전용)
 */
public interface MessageHistoryReader {

    /**
     * 오래된 순으로 정렬된 최근 메시지
     */
    List<TransportMessage> findRecentMessages(String customerId, String salonId, int limit);
}

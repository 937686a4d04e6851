package personal.ai.dialog.session.application.port.in;

import personal.ai.dialog.session.domain.model.BookingContext;
import personal.ai.dialog.session.domain.model.ChoiceRecord;
import personal.ai.dialog.session.domain.model.ConversationState;
import personal.ai.dialog.session.domain.model.SessionMetadata;
import personal.ai.dialog.session.domain.model.TransportMessage;

import java.util.List;
import java.util.Optional;

/**
 * Session Context UseCase (Input Port)
 * 저장소 장애는 SessionStoreUnavailableException, 세션 없음/만료는 Optional.empty()
 */
public interface SessionContextUseCase {

    /**
     * 생성 후 hard cap을 넘긴 세션은 저장하지 않고 삭제한다.
     *
     * @return 저장 여부
     */
    boolean save(String sessionId, BookingContext context);

    Optional<BookingContext> get(String sessionId);

    Optional<BookingContext> getByCustomer(String customerId, String salonId);

    /**
     * @return 세션이 없으면 false
     */
    boolean extend(String sessionId, long seconds);

    boolean extend(String sessionId);

    /**
     * 종료 상태면 세션을 삭제하고 최종 컨텍스트를 반환한다.
     */
    Optional<BookingContext> updateState(String sessionId, ConversationState state);

    /**
     * @return 세션이 사라졌으면 empty (대화 재시작 필요)
     */
    Optional<BookingContext> addChoice(String sessionId, ChoiceRecord choice);

    boolean delete(String sessionId);

    boolean exists(String sessionId);

    Optional<SessionMetadata> getMetadata(String sessionId);

    /**
     * 전송 이력으로 세션 복구. 모호하면 empty.
     */
    Optional<BookingContext> recoverFromHistory(String customerId, String salonId, List<TransportMessage> messages,
                                                String languageHint);

    /**
     * MessageHistoryReader로 최근 이력을 읽어 복구한다.
     */
    Optional<BookingContext> recoverFromHistory(String customerId, String salonId, String languageHint);

    /**
     * @return 삭제된 세션 수
     */
    int cleanup();

    /**
     * @param salonId null이면 전체
     */
    long getActiveCount(String salonId);

    List<String> getActiveSalonIds();
}

package personal.ai.dialog.session.application.port.out;

import personal.ai.dialog.session.domain.model.BookingContext;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 세션 저장소 Port (TTL 기반 key-value store)
 * 구현체는 저장소 장애를 SessionStoreUnavailableException으로 변환한다.
 */
public interface SessionContextRepository {

    long KEY_NOT_FOUND = -2;
    long NO_EXPIRY = -1;

    /**
     * 읽을 수 없는 값도 empty
     */
    Optional<BookingContext> find(String sessionId);

    void save(BookingContext context, Duration ttl);

    /**
     * TTL을 seconds만큼 늘리되 capSeconds를 넘지 않는다 (원자적).
     *
     * @return 새 TTL, 상한 도달로 삭제되면 0, 키가 없으면 KEY_NOT_FOUND
     */
    long extend(String sessionId, long seconds, long capSeconds);

    boolean delete(String sessionId);

    /**
     * TTL이 없는 키만 삭제한다 (원자적).
     */
    boolean deleteIfNoExpiry(String sessionId);

    /**
     * 값을 읽을 수 없을 때만 삭제한다. 판단 이후 새로 저장된 값은 지우지 않는다.
     */
    boolean deleteIfUnreadable(String sessionId);

    /**
     * @return 남은 TTL(초), 만료 없음 NO_EXPIRY, 키 없음 KEY_NOT_FOUND
     */
    long ttlSeconds(String sessionId);

    List<String> findAllSessionIds();
}

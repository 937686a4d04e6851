package personal.ai.dialog.session.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * 세션 저장소(Redis)에 접근할 수 없을 때 발생
 * 세션 없음(Optional.empty)과 구분된다.
 */
public class SessionStoreUnavailableException extends BusinessException {
    public SessionStoreUnavailableException(String sessionId, Throwable cause) {
        super(ErrorCode.SESSION_STORE_UNAVAILABLE,
                String.format("Session store unavailable: sessionId=%s", sessionId), cause);
    }
}

package personal.ai.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Session Domain (Sxxx)
    SESSION_STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "S001", "세션 저장소에 연결할 수 없습니다."),
    MESSAGE_HISTORY_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "S002", "메시지 이력을 조회할 수 없습니다."),

    // Suggestion / Popular Times (Pxxx)
    INVALID_TIME_FORMAT(HttpStatus.BAD_REQUEST, "P001", "시간 형식이 올바르지 않습니다. (HH:mm)"),
    INVALID_DATE_FORMAT(HttpStatus.BAD_REQUEST, "P002", "날짜 형식이 올바르지 않습니다. (yyyy-MM-dd)"),
    AVAILABILITY_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "P003", "예약 가능 시간을 조회할 수 없습니다."),
    POPULAR_TIMES_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "P004", "인기 시간대를 계산할 수 없습니다."),

    // Message / Card (Mxxx)
    TEMPLATE_NOT_FOUND(HttpStatus.NOT_FOUND, "M001", "메시지 템플릿을 찾을 수 없습니다."),
    MISSING_TEMPLATE_PARAMETER(HttpStatus.BAD_REQUEST, "M002", "메시지 템플릿 파라미터가 누락되었습니다."),
    INVALID_CARD_INPUT(HttpStatus.BAD_REQUEST, "M003", "인터랙티브 카드를 만들 수 없는 입력입니다."),
    INVALID_BUTTON_ID(HttpStatus.BAD_REQUEST, "M004", "알 수 없는 버튼 ID입니다."),

    // External Service (Exxx)
    BOOKING_SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "E001", "예약 서비스에 연결할 수 없습니다."),
    CHANNEL_DELIVERY_FAILED(HttpStatus.SERVICE_UNAVAILABLE, "E002", "메시지를 전송하지 못했습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 외부 의존성(Redis, HTTP) 장애 여부
     * 대화 흐름에서는 장애 시 degraded 모드로 전환한다.
     */
    public boolean isDependencyFailure() {
        return httpStatus == HttpStatus.SERVICE_UNAVAILABLE || httpStatus == HttpStatus.GATEWAY_TIMEOUT;
    }
}

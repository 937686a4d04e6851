package personal.ai.dialog.suggestion.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * 시간 문자열이 HH:mm 형식이 아닐 때 발생
 */
public class InvalidTimeFormatException extends BusinessException {
    public InvalidTimeFormatException(String value) {
        super(ErrorCode.INVALID_TIME_FORMAT, String.format("Invalid time format: value=%s", value));
    }
}

package personal.ai.dialog.suggestion.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * 날짜 문자열이 yyyy-MM-dd 형식이 아닐 때 발생
 */
public class InvalidDateFormatException extends BusinessException {
    public InvalidDateFormatException(String value) {
        super(ErrorCode.INVALID_DATE_FORMAT, String.format("Invalid date format: value=%s", value));
    }
}

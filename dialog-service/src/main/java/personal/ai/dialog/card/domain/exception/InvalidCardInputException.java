package personal.ai.dialog.card.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * 카드로 표현할 수 없는 입력 (슬롯 0개, 10개 초과 등)
 */
public class InvalidCardInputException extends BusinessException {
    public InvalidCardInputException(String message) {
        super(ErrorCode.INVALID_CARD_INPUT, message);
    }
}

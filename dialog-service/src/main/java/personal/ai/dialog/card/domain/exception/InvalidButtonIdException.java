package personal.ai.dialog.card.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

public class InvalidButtonIdException extends BusinessException {
    public InvalidButtonIdException(String buttonId) {
        super(ErrorCode.INVALID_BUTTON_ID, String.format("Invalid button id: buttonId=%s", buttonId));
    }
}

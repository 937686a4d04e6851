package personal.ai.dialog.session.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

public class MessageHistoryUnavailableException extends BusinessException {
    public MessageHistoryUnavailableException(String customerId, String salonId) {
        super(ErrorCode.MESSAGE_HISTORY_UNAVAILABLE,
                String.format("Message history unavailable: customerId=%s, salonId=%s", customerId, salonId));
    }
}

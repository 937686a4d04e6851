package personal.ai.dialog.conversation.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * 메신저 채널로 메시지를 보내지 못했을 때 발생
 */
public class ChannelDeliveryFailedException extends BusinessException {
    public ChannelDeliveryFailedException(String customerId) {
        super(ErrorCode.CHANNEL_DELIVERY_FAILED,
                String.format("Message delivery failed: customerId=%s", customerId));
    }
}

package personal.ai.dialog.suggestion.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * 예약 코어 서비스에서 가용 슬롯을 조회할 수 없을 때 발생 (Circuit Open, Timeout 등)
 */
public class AvailabilityUnavailableException extends BusinessException {
    public AvailabilityUnavailableException(String salonId) {
        super(ErrorCode.AVAILABILITY_UNAVAILABLE,
                String.format("Availability lookup unavailable: salonId=%s", salonId));
    }
}

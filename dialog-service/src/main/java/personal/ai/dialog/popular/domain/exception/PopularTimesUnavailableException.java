package personal.ai.dialog.popular.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * 예약 이력을 조회할 수 없어 인기 시간대를 계산할 수 없을 때 발생
 * 호출 측은 업종 기본 시간대로 fallback 한다.
 */
public class PopularTimesUnavailableException extends BusinessException {
    public PopularTimesUnavailableException(String salonId) {
        super(ErrorCode.POPULAR_TIMES_UNAVAILABLE,
                String.format("Booking history unavailable: salonId=%s", salonId));
    }
}

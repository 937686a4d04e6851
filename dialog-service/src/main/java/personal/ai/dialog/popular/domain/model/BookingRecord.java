package personal.ai.dialog.popular.domain.model;

import java.time.LocalDateTime;

/**
 * 과거 예약 이력 한 건 (인기 시간대 분석 입력)
 */
public record BookingRecord(
        String id,
        String serviceId,
        String masterId,
        LocalDateTime startTime,
        BookingStatus status
) {
    public boolean isCancelled() {
        return status == BookingStatus.CANCELLED;
    }
}

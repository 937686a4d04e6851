package personal.ai.dialog.suggestion.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 예약 가능 슬롯 (불변)
 * 가용 시간 조회 결과이자 카드에 노출되는 선택지 단위
 */
public record SlotSuggestion(
        String id,
        LocalDate date,
        @JsonFormat(pattern = "HH:mm") LocalTime startTime,
        @JsonFormat(pattern = "HH:mm") LocalTime endTime,
        String masterId,
        String masterName,
        String serviceId,
        String serviceName,
        int durationMinutes,
        BigDecimal price
) {
    public SlotSuggestion {
        if (id == null || id.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID cannot be null or blank");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot date cannot be null");
        }
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot start time cannot be null");
        }
        if (durationMinutes < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot duration cannot be negative");
        }
    }

    public LocalDateTime startDateTime() {
        return LocalDateTime.of(date, startTime);
    }

    public boolean hasMaster(String candidateMasterId) {
        return candidateMasterId != null && candidateMasterId.equals(masterId);
    }
}

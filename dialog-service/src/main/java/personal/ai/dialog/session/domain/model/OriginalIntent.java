package personal.ai.dialog.session.domain.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 고객의 최초 예약 요청 (상위 intent 파서가 만든 구조화된 값)
 * 대화 중에는 변경되지 않는다.
 *
 * @param rawText 원문 (이력 복구 시에는 이것만 채워진다)
 */
public record OriginalIntent(
        String serviceId,
        String serviceName,
        LocalDate preferredDate,
        @JsonFormat(pattern = "HH:mm") LocalTime preferredTime,
        String preferredMasterId,
        String rawText
) {
    public static OriginalIntent fromText(String rawText) {
        return new OriginalIntent(null, null, null, null, null, rawText);
    }

    /**
     * 날짜나 시간 중 하나라도 있어야 슬롯을 찾을 수 있다.
     */
    @JsonIgnore
    public boolean isComplete() {
        return preferredDate != null || preferredTime != null;
    }

    public boolean hasTimePreference() {
        return preferredTime != null;
    }
}

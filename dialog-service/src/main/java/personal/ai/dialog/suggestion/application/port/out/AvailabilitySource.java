package personal.ai.dialog.suggestion.application.port.out;

import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.time.LocalDate;
import java.util.List;

/**
 * Availability Source (Output Port)
 * 예약 코어 서비스의 가용 슬롯 조회 인터페이스
 */
public interface AvailabilitySource {

    /**
     * 기간 내 예약 가능 슬롯 조회 (날짜, 시작 시각 오름차순)
     *
     * @param salonId   살롱 ID
     * @param serviceId 서비스 ID
     * @param from      시작 날짜 (포함)
     * @param to        종료 날짜 (포함)
     * @throws personal.ai.dialog.suggestion.domain.exception.AvailabilityUnavailableException 조회 불가 시
     */
    List<SlotSuggestion> findAvailableSlots(String salonId, String serviceId, LocalDate from, LocalDate to);
}

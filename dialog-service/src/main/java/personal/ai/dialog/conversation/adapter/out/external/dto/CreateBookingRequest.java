package personal.ai.dialog.conversation.adapter.out.external.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 예약 생성 요청 DTO
 */
public record CreateBookingRequest(
        String customerId,
        String slotId,
        @JsonFormat(pattern = "yyyy-MM-dd") LocalDate date,
        @JsonFormat(pattern = "HH:mm") LocalTime startTime,
        String masterId,
        String serviceId
) {
    public static CreateBookingRequest of(String customerId, SlotSuggestion slot) {
        return new CreateBookingRequest(
                customerId,
                slot.id(),
                slot.date(),
                slot.startTime(),
                slot.masterId(),
                slot.serviceId()
        );
    }
}

package personal.ai.dialog.conversation.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.ai.dialog.conversation.domain.model.InboundEvent;
import personal.ai.dialog.session.domain.model.OriginalIntent;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 인바운드 이벤트 요청 DTO
 * 채널 웹훅 어댑터가 텍스트/버튼 탭과 intent 파싱 결과를 전달한다.
 */
public record InboundEventRequest(
        @NotBlank(message = "고객 ID는 필수입니다.")
        String customerId,

        @NotBlank(message = "살롱 ID는 필수입니다.")
        String salonId,

        @Size(max = 4096, message = "메시지는 4096자를 넘을 수 없습니다.")
        String text,

        @Size(max = 256, message = "버튼 ID는 256자를 넘을 수 없습니다.")
        String buttonId,

        String language,
        String businessType,
        Intent intent
) {
    public InboundEvent toEvent() {
        OriginalIntent originalIntent = intent == null ? null : intent.toOriginalIntent(text);
        return new InboundEvent(customerId, salonId, text, buttonId, originalIntent, language, businessType);
    }

    /**
     * intent 파서 결과 (모든 필드 선택)
     */
    public record Intent(
            String serviceId,
            String serviceName,
            LocalDate preferredDate,
            @JsonFormat(pattern = "HH:mm") LocalTime preferredTime,
            String preferredMasterId
    ) {
        OriginalIntent toOriginalIntent(String rawText) {
            return new OriginalIntent(serviceId, serviceName, preferredDate, preferredTime, preferredMasterId, rawText);
        }
    }
}

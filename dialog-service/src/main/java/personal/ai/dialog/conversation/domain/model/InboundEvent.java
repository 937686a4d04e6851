package personal.ai.dialog.conversation.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.dialog.session.domain.model.OriginalIntent;

/**
 * 고객 메시지 한 건 (텍스트 또는 버튼 탭)
 *
 * @param intent       상위 intent 파서가 텍스트에서 추출한 요청 (텍스트일 때만)
 * @param language     언어 힌트 (없으면 세션 언어 또는 텍스트로 추정)
 * @param businessType 살롱 업종 코드 (beauty_salon, barbershop ...)
 */
public record InboundEvent(
        String customerId,
        String salonId,
        String text,
        String buttonId,
        OriginalIntent intent,
        String language,
        String businessType
) {
    public InboundEvent {
        if (customerId == null || customerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer ID cannot be null or blank");
        }
        if (salonId == null || salonId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Salon ID cannot be null or blank");
        }
        if (isBlank(text) && isBlank(buttonId)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Either text or buttonId is required");
        }
    }

    public boolean isButtonTap() {
        return !isBlank(buttonId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package personal.ai.dialog.message.domain.model;

import java.util.Map;

/**
 * 맥락 메시지 생성을 위한 비즈니스 정보
 *
 * @param businessType 업종 코드 (beauty_salon, barbershop, spa, nail_salon, generic)
 * @param tone         선호 말투, 없으면 업종 기본 문구
 * @param businessName 살롱 이름, 템플릿 파라미터 businessName으로 전달된다
 * @param params       템플릿 파라미터
 */
public record BusinessContext(
        String businessType,
        Tone tone,
        String businessName,
        Map<String, ?> params
) {
    public BusinessContext {
        params = params == null ? Map.of() : params;
    }
}

package personal.ai.dialog.message.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 메시지 템플릿 (불변, 기동 시 1회 로딩)
 *
 * @param key        메시지 키 (예: SLOT_TAKEN)
 * @param parameters 필수 파라미터 이름
 * @param emotion    감정 톤
 * @param maxLines   최대 줄 수 (빈 줄 포함)
 * @param texts      언어 코드 → 본문
 * @param variations "업종.말투" 또는 "업종" → (언어 코드 → 본문)
 */
public record MessageTemplate(
        String key,
        List<String> parameters,
        EmotionIndicator emotion,
        int maxLines,
        Map<String, String> texts,
        Map<String, Map<String, String>> variations
) {
    public MessageTemplate {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        texts = Map.copyOf(texts);
        variations = variations == null ? Map.of() : Map.copyOf(variations);
    }

    public Optional<String> text(String language) {
        return Optional.ofNullable(texts.get(language));
    }

    public Optional<String> variation(String variationKey, String language) {
        Map<String, String> byLanguage = variations.get(variationKey);
        return byLanguage == null ? Optional.empty() : Optional.ofNullable(byLanguage.get(language));
    }
}

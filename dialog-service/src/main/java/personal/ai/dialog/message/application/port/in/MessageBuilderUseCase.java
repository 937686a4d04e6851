package personal.ai.dialog.message.application.port.in;

import personal.ai.dialog.message.domain.model.BusinessContext;
import personal.ai.dialog.message.domain.model.ChoiceCard;
import personal.ai.dialog.message.domain.model.ChoiceScenario;
import personal.ai.dialog.message.domain.model.EmotionIndicator;
import personal.ai.dialog.message.domain.model.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * Message Builder Use Case
 * 다국어 공감형 메시지 생성
 */
public interface MessageBuilderUseCase {

    /**
     * 템플릿 메시지 생성
     *
     * @throws personal.ai.dialog.message.domain.exception.MissingTemplateParameterException 필수 파라미터 누락
     * @throws personal.ai.dialog.message.domain.exception.TemplateNotFoundException         알 수 없는 키
     */
    String getMessage(String key, String language, Map<String, ?> params);

    /**
     * 업종/말투에 맞춘 메시지 (업종.말투 → 업종 → 기본 순으로 탐색)
     */
    String getContextualMessage(String key, String language, BusinessContext context);

    ChoiceCard getChoiceCard(ChoiceScenario scenario, String language, Map<String, ?> context);

    String getChoiceLabel(String choiceId, String language, Map<String, ?> params);

    ValidationResult validateParameters(String key, Map<String, ?> params);

    EmotionIndicator getEmotion(String key);

    String formatWithLimits(String message, int maxLines);

    String getProximityText(int diffMinutes, String language);

    String getDateProximityText(int dayDiff, String language);

    List<String> getSupportedLanguages();

    List<String> getAvailableMessages();
}

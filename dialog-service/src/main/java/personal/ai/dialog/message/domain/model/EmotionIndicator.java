package personal.ai.dialog.message.domain.model;

/**
 * 메시지의 감정 톤 (타입, 이모지, 강도)
 */
public record EmotionIndicator(EmotionType type, String emoji, EmotionIntensity intensity) {
}

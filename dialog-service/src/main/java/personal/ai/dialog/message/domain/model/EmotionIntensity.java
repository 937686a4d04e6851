package personal.ai.dialog.message.domain.model;

public enum EmotionIntensity {
    LOW,
    MEDIUM,
    HIGH
}

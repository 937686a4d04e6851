package personal.ai.dialog.message.domain.model;

public enum EmotionType {
    EMPATHETIC,
    CELEBRATORY,
    APOLOGETIC,
    INFORMATIVE,
    ENCOURAGING
}

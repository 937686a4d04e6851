package personal.ai.dialog.card.domain.model;

public enum PayloadType {
    TEXT,
    BUTTON,
    LIST
}

package personal.ai.dialog.session.domain.model;

public enum MessageDirection {
    INBOUND,
    OUTBOUND
}

package personal.ai.dialog.session.domain.model;

public enum TransportMessageType {
    TEXT,
    INTERACTIVE,
    BUTTON_REPLY
}

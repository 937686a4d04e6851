package personal.ai.dialog.popular.domain.model;

public enum BookingStatus {
    CONFIRMED,
    COMPLETED,
    NO_SHOW,
    CANCELLED
}

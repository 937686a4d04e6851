package personal.ai.dialog.conversation.domain.model;

/**
 * 예약 생성 결과
 */
public record BookingConfirmation(
        String bookingId,
        String status
) {
}

package personal.ai.dialog.conversation.application.port.out;

import personal.ai.dialog.conversation.domain.model.BookingConfirmation;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

/**
 * 예약 생성 Port (예약 코어 서비스)
 */
public interface BookingCommandPort {

    /**
     * @throws personal.ai.dialog.conversation.domain.exception.BookingServiceUnavailableException 생성 실패
     */
    BookingConfirmation confirmBooking(String customerId, String salonId, SlotSuggestion slot);
}

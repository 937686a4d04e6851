package personal.ai.dialog.conversation.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

public class BookingServiceUnavailableException extends BusinessException {
    public BookingServiceUnavailableException(String salonId, String slotId) {
        super(ErrorCode.BOOKING_SERVICE_UNAVAILABLE,
                String.format("Booking could not be created: salonId=%s, slotId=%s", salonId, slotId));
    }
}

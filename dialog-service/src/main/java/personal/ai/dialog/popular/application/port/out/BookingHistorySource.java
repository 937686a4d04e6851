package personal.ai.dialog.popular.application.port.out;

import personal.ai.dialog.popular.domain.model.BookingRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * 예약 이력 조회 Port
 */
public interface BookingHistorySource {

    /**
     * since 이후 시작하는 살롱의 예약 (취소 포함)
     */
    List<BookingRecord> findBookings(String salonId, LocalDate since);
}

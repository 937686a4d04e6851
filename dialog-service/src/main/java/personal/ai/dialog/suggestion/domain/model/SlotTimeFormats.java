package personal.ai.dialog.suggestion.domain.model;

import personal.ai.dialog.suggestion.domain.exception.InvalidDateFormatException;
import personal.ai.dialog.suggestion.domain.exception.InvalidTimeFormatException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * 경계(HTTP, 버튼 ID)에서 들어오는 시간/날짜 문자열 파싱
 * 시간: HH:mm, 날짜: yyyy-MM-dd
 */
public final class SlotTimeFormats {

    public static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");
    public static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private SlotTimeFormats() {
    }

    public static LocalTime parseTime(String value) {
        if (value == null) {
            throw new InvalidTimeFormatException(null);
        }
        try {
            return LocalTime.parse(value.trim(), TIME);
        } catch (DateTimeParseException e) {
            throw new InvalidTimeFormatException(value);
        }
    }

    public static LocalDate parseDate(String value) {
        if (value == null) {
            throw new InvalidDateFormatException(null);
        }
        try {
            return LocalDate.parse(value.trim(), DATE);
        } catch (DateTimeParseException e) {
            throw new InvalidDateFormatException(value);
        }
    }

    public static String formatTime(LocalTime time) {
        return TIME.format(time);
    }
}

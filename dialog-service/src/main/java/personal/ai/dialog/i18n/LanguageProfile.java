package personal.ai.dialog.i18n;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Currency;
import java.util.Locale;

/**
 * 언어별 포맷 규칙
 * Locale, 통화, 복수형, 근접도 문구를 한 곳에서 관리한다.
 */
public record LanguageProfile(
        String code,
        Locale locale,
        String currencyCode,
        PluralRule pluralRule,
        UnitForms minutes,
        UnitForms hours,
        UnitForms days,
        String earlier,
        String later,
        String exactTime,
        String today,
        String tomorrow,
        String yesterday,
        String dayAfterTomorrow,
        String inDaysPattern,
        String daysEarlierPattern,
        String hourAbbreviation,
        String minuteAbbreviation
) {

    /**
     * 시간 차이 문구
     * 예: -60 → "1 hour earlier", 30 → "30 minutes later", 0 → "exact time"
     * 1시간 이상이면 시간 단위만 표시한다.
     */
    public String formatTimeDifference(int diffMinutes) {
        if (diffMinutes == 0) {
            return exactTime;
        }
        int abs = Math.abs(diffMinutes);
        int h = abs / 60;
        String amount = h > 0
                ? h + " " + hours.select(pluralRule, h)
                : abs + " " + minutes.select(pluralRule, abs);
        return amount + " " + (diffMinutes < 0 ? earlier : later);
    }

    /**
     * 날짜 차이 문구
     * 예: 0 → "Today", 1 → "Tomorrow", 4 → "In 4 days", -3 → "3 days earlier"
     */
    public String formatDayDifference(int dayDiff) {
        if (dayDiff == 0) {
            return today;
        }
        if (dayDiff == 1) {
            return tomorrow;
        }
        if (dayDiff == -1) {
            return yesterday;
        }
        if (dayDiff == 2) {
            return dayAfterTomorrow;
        }
        int abs = Math.abs(dayDiff);
        String pattern = dayDiff > 0 ? inDaysPattern : daysEarlierPattern;
        return String.format(pattern, abs, days.select(pluralRule, abs));
    }

    /**
     * 소요 시간 포맷: 45 → "45min", 90 → "1h 30min", 60 → "1h"
     */
    public String formatDuration(int durationMinutes) {
        int h = durationMinutes / 60;
        int m = durationMinutes % 60;
        if (h == 0) {
            return m + minuteAbbreviation;
        }
        return m == 0 ? h + hourAbbreviation : h + hourAbbreviation + " " + m + minuteAbbreviation;
    }

    public String formatPrice(BigDecimal price) {
        NumberFormat format = NumberFormat.getCurrencyInstance(locale);
        format.setCurrency(Currency.getInstance(currencyCode));
        return format.format(price);
    }

    public String shortWeekday(LocalDate date) {
        return date.getDayOfWeek().getDisplayName(TextStyle.SHORT, locale);
    }

    public String shortWeekday(DayOfWeek dayOfWeek) {
        return dayOfWeek.getDisplayName(TextStyle.SHORT, locale);
    }

    public String weekday(DayOfWeek dayOfWeek) {
        return dayOfWeek.getDisplayName(TextStyle.FULL, locale);
    }

    /**
     * 목록 섹션 제목용 날짜: "Friday, 25 Oct"
     */
    public String formatSectionDate(LocalDate date) {
        return DateTimeFormatter.ofPattern("EEEE, d MMM", locale).format(date);
    }

    public String formatLongDate(LocalDate date) {
        return DateTimeFormatter.ofPattern("EEEE, d MMMM", locale).format(date);
    }
}

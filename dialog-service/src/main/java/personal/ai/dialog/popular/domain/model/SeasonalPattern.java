package personal.ai.dialog.popular.domain.model;

/**
 * 계절성 패턴
 *
 * @param period   WEEKLY: 요일(FRIDAY), MONTHLY: MONTH_START / MONTH_MIDDLE / MONTH_END
 * @param ratio    평균 대비 배수
 * @param bookings 해당 구간 예약 수
 */
public record SeasonalPattern(
        SeasonalPatternType type,
        String period,
        double ratio,
        int bookings
) {
}

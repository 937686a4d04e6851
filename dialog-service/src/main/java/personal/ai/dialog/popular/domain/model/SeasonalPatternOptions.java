package personal.ai.dialog.popular.domain.model;

/**
 * 계절성 탐지 옵션
 *
 * @param includeHolidays 공휴일 캘린더가 없어 현재는 결과에 영향 없음
 */
public record SeasonalPatternOptions(
        int lookbackDays,
        int minOccurrences,
        boolean includeHolidays
) {
    public static SeasonalPatternOptions defaults() {
        return new SeasonalPatternOptions(90, 3, false);
    }
}

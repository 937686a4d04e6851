package personal.ai.dialog.popular.domain.model;

import java.time.LocalDate;

/**
 * 최신성 가중치 옵션
 * 0~30일 recentWeight, 31~60일 mediumWeight, 61일~lookbackDays oldWeight, 그 이전은 제외.
 *
 * @param referenceDate 나이 계산 기준일 (보통 오늘)
 */
public record WeightingOptions(
        double recentWeight,
        double mediumWeight,
        double oldWeight,
        int lookbackDays,
        boolean includeCancelled,
        LocalDate referenceDate
) {
    public static final int DEFAULT_LOOKBACK_DAYS = 90;

    public static WeightingOptions defaults(LocalDate referenceDate) {
        return new WeightingOptions(2.0, 1.5, 1.0, DEFAULT_LOOKBACK_DAYS, false, referenceDate);
    }

    public WeightingOptions withLookback(int days, boolean cancelledIncluded) {
        return new WeightingOptions(recentWeight, mediumWeight, oldWeight, days, cancelledIncluded, referenceDate);
    }
}

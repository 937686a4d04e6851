package personal.ai.dialog.suggestion.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 랭킹 기준 (고객의 원래 요청)
 * 모든 필드는 선택값이며, 없는 요소는 점수에 기여하지 않는다.
 */
public record RankingPreferences(
        LocalDate targetDate,
        LocalTime targetTime,
        String preferredMasterId,
        RankingWeights weights
) {
    public RankingPreferences {
        if (weights == null) {
            weights = RankingWeights.DEFAULT;
        }
    }

    public static RankingPreferences of(LocalDate targetDate, LocalTime targetTime, String preferredMasterId) {
        return new RankingPreferences(targetDate, targetTime, preferredMasterId, RankingWeights.DEFAULT);
    }
}

package personal.ai.dialog.popular.domain.model;

import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.time.DayOfWeek;

/**
 * 인기 시간대
 *
 * @param available         checkAvailability 이후 채워짐, 그 전에는 null
 * @param nextAvailableSlot 해당 시간대의 가장 빠른 가용 슬롯
 */
public record PopularTimeSlot(
        DayOfWeek dayOfWeek,
        int hour,
        double weightedCount,
        int rawCount,
        double confidence,
        String displayText,
        Boolean available,
        SlotSuggestion nextAvailableSlot
) {
    public static PopularTimeSlot of(WeightedScore score, String displayText) {
        return new PopularTimeSlot(score.dayOfWeek(), score.hour(), score.score(), score.count(),
                score.confidence(), displayText, null, null);
    }

    public PopularTimeSlot withAvailability(boolean isAvailable, SlotSuggestion nextSlot) {
        return new PopularTimeSlot(dayOfWeek, hour, weightedCount, rawCount, confidence, displayText,
                isAvailable, nextSlot);
    }
}

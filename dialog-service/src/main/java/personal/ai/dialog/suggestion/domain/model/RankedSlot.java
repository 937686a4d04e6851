package personal.ai.dialog.suggestion.domain.model;

/**
 * 랭킹된 슬롯
 *
 * @param slot        원본 슬롯
 * @param rank        1부터 시작하는 순위
 * @param breakdown   점수 상세
 * @param indicators  별표/근접도 문구/강조 단계
 * @param displayText 카드에 노출될 문구 (예: "⭐ 14:30 (30 minutes later)")
 */
public record RankedSlot(
        SlotSuggestion slot,
        int rank,
        ScoreBreakdown breakdown,
        SlotIndicators indicators,
        String displayText
) {
    public double score() {
        return breakdown.total();
    }

    public RankedSlot withIndicators(SlotIndicators newIndicators, String newDisplayText) {
        return new RankedSlot(slot, rank, breakdown, newIndicators, newDisplayText);
    }
}

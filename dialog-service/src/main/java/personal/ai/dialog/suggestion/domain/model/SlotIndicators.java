package personal.ai.dialog.suggestion.domain.model;

/**
 * 카드 표시용 시각 지표
 */
public record SlotIndicators(
        boolean starred,
        String proximityText,
        HighlightTier highlightTier
) {
    public static SlotIndicators plain(HighlightTier highlightTier) {
        return new SlotIndicators(false, null, highlightTier);
    }
}

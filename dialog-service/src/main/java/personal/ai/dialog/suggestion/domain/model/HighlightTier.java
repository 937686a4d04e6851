package personal.ai.dialog.suggestion.domain.model;

/**
 * 근접도 구간에 따른 강조 단계
 */
public enum HighlightTier {
    BEST,
    GOOD,
    FAIR,
    NONE;

    public static HighlightTier fromTimeBonus(int timeBonus) {
        if (timeBonus >= 500) {
            return BEST;
        }
        if (timeBonus >= 300) {
            return GOOD;
        }
        return timeBonus >= 100 ? FAIR : NONE;
    }

    public static HighlightTier fromDateBonus(int dateBonus) {
        if (dateBonus >= 300) {
            return BEST;
        }
        if (dateBonus >= 180) {
            return GOOD;
        }
        return dateBonus >= 60 ? FAIR : NONE;
    }
}

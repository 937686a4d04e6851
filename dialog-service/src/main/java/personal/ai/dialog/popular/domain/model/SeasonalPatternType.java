package personal.ai.dialog.popular.domain.model;

public enum SeasonalPatternType {
    WEEKLY,
    MONTHLY,
    HOLIDAY
}

package personal.ai.dialog.message.domain.model;

/**
 * 선택지 ID 상수
 * 버튼 ID(choice|...)와 choiceHistory에 그대로 저장된다.
 */
public final class ChoiceIds {

    public static final String SAME_DAY_DIFF_TIME = "same_day_diff_time";
    public static final String DIFF_DAY_SAME_TIME = "diff_day_same_time";
    public static final String POPULAR_TIMES = "popular_times";
    public static final String SEE_MORE = "see_more";
    public static final String CALL_SALON = "call_salon";
    public static final String NEXT_AVAILABLE_DAY = "next_available_day";
    public static final String NEXT_WEEK = "next_week";
    public static final String EARLIEST_AVAILABLE = "earliest_available";

    private ChoiceIds() {
    }
}

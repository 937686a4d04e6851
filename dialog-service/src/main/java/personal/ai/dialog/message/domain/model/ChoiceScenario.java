package personal.ai.dialog.message.domain.model;

import java.util.List;
import java.util.Locale;

/**
 * 선택지 카드 시나리오
 * 각 시나리오는 안내 메시지 키와 고정된 선택지 ID 목록을 가진다.
 */
public enum ChoiceScenario {
    TIME_UNAVAILABLE("SLOT_TAKEN",
            List.of(ChoiceIds.SAME_DAY_DIFF_TIME, ChoiceIds.DIFF_DAY_SAME_TIME, ChoiceIds.POPULAR_TIMES)),
    DAY_FULL("ALL_DAY_BUSY",
            List.of(ChoiceIds.NEXT_AVAILABLE_DAY, ChoiceIds.DIFF_DAY_SAME_TIME, ChoiceIds.CALL_SALON)),
    WEEK_FULL("WEEK_FULL",
            List.of(ChoiceIds.NEXT_WEEK, ChoiceIds.POPULAR_TIMES, ChoiceIds.CALL_SALON)),
    INCOMPLETE_REQUEST("INCOMPLETE_REQUEST",
            List.of(ChoiceIds.POPULAR_TIMES, ChoiceIds.EARLIEST_AVAILABLE)),
    MULTIPLE_OPTIONS("MULTIPLE_OPTIONS",
            List.of(ChoiceIds.EARLIEST_AVAILABLE, ChoiceIds.POPULAR_TIMES, ChoiceIds.SEE_MORE)),
    POPULAR_TIMES("POPULAR_TIMES",
            List.of(ChoiceIds.POPULAR_TIMES, ChoiceIds.EARLIEST_AVAILABLE));

    private final String messageKey;
    private final List<String> choiceIds;

    ChoiceScenario(String messageKey, List<String> choiceIds) {
        this.messageKey = messageKey;
        this.choiceIds = choiceIds;
    }

    public String messageKey() {
        return messageKey;
    }

    public List<String> choiceIds() {
        return choiceIds;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package personal.ai.dialog.message.domain.model;

import java.util.List;

/**
 * 선택지 카드 (안내 메시지 + 선택지 목록)
 */
public record ChoiceCard(
        ChoiceScenario scenario,
        String language,
        String message,
        List<ChoiceOption> options
) {
    public ChoiceCard {
        options = List.copyOf(options);
    }
}

package personal.ai.dialog.session.domain.model;

import java.time.Instant;

/**
 * 고객이 선택한 choice 기록
 *
 * @param resultShown 선택 결과로 보여준 화면 (예: slots_shown)
 */
public record ChoiceRecord(
        String choiceId,
        Instant selectedAt,
        String resultShown
) {
}

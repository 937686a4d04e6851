package personal.ai.dialog.card.application.port.in;

import personal.ai.dialog.card.domain.model.InteractivePayload;
import personal.ai.dialog.message.domain.model.ChoiceCard;
import personal.ai.dialog.popular.domain.model.PopularTimeSlot;
import personal.ai.dialog.suggestion.domain.model.RankedSlot;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.util.List;

/**
 * Interactive Card UseCase (Input Port)
 * 1~3개 → 버튼 카드, 4~10개 → 날짜별 목록 카드. 0개나 10개 초과는 InvalidCardInputException.
 * 10개 초과 후보는 호출 측이 미리 잘라야 한다.
 */
public interface InteractiveCardUseCase {

    int MAX_BUTTONS = 3;
    int MAX_LIST_ROWS = 10;

    /**
     * @param message null이면 서비스명 기반 기본 문구
     */
    InteractivePayload buildSlotSelectionCard(List<SlotSuggestion> slots, String language, String message);

    InteractivePayload buildAlternativeSlotsCard(List<RankedSlot> alternatives, String language, String headerMessage);

    InteractivePayload buildChoiceCard(ChoiceCard choiceCard);

    /**
     * 항상 확인/변경 두 버튼
     */
    InteractivePayload buildConfirmationCard(SlotSuggestion slot, String language);

    InteractivePayload buildPopularTimesCard(List<PopularTimeSlot> popularTimes, String language, String message);

    InteractivePayload buildTextMessage(String text);
}

package personal.ai.dialog.session.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 진행 중인 예약 대화 (세션당 1개)
 * 불변 객체이며 변경은 with* 메서드로 새 인스턴스를 만든다.
 *
 * @param lastShownSlots            마지막으로 보여준 슬롯 (최대 10개)
 * @param lastShownOptionIds        마지막 카드의 버튼/행 id
 * @param pendingConfirmationSlotId 확인 카드를 보낸 슬롯
 */
public record BookingContext(
        String sessionId,
        String customerId,
        String salonId,
        OriginalIntent originalIntent,
        String language,
        ConversationState state,
        List<ChoiceRecord> choiceHistory,
        List<SlotSuggestion> lastShownSlots,
        List<String> lastShownOptionIds,
        String pendingConfirmationSlotId,
        String businessType,
        Instant createdAt,
        Instant lastInteractionAt
) {
    public static final int MAX_SHOWN_SLOTS = 10;

    public BookingContext {
        if (customerId == null || customerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer ID cannot be null or blank");
        }
        if (salonId == null || salonId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Salon ID cannot be null or blank");
        }
        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Created at cannot be null");
        }
        if (sessionId == null) {
            sessionId = sessionIdOf(customerId, salonId);
        }
        if (state == null) {
            state = ConversationState.STARTED;
        }
        if (lastInteractionAt == null) {
            lastInteractionAt = createdAt;
        }
        choiceHistory = choiceHistory == null ? List.of() : List.copyOf(choiceHistory);
        lastShownSlots = lastShownSlots == null ? List.of() : List.copyOf(lastShownSlots);
        lastShownOptionIds = lastShownOptionIds == null ? List.of() : List.copyOf(lastShownOptionIds);
    }

    public static String sessionIdOf(String customerId, String salonId) {
        return customerId + ":" + salonId;
    }

    public static BookingContext start(String customerId, String salonId, String language, String businessType,
                                       Instant now) {
        return new BookingContext(sessionIdOf(customerId, salonId), customerId, salonId, null, language,
                ConversationState.STARTED, List.of(), List.of(), List.of(), null, businessType, now, now);
    }

    public boolean hasOriginalIntent() {
        return originalIntent != null;
    }

    /**
     * 최초 요청은 한 번만 기록된다. 이미 있으면 그대로 반환.
     * 날짜/시간이 없는 요청(인사 등)만 다음 요청으로 대체될 수 있다.
     */
    public BookingContext withOriginalIntent(OriginalIntent intent) {
        if (intent == null || (originalIntent != null && originalIntent.isComplete())) {
            return this;
        }
        return new BookingContext(sessionId, customerId, salonId, intent, language, state, choiceHistory,
                lastShownSlots, lastShownOptionIds, pendingConfirmationSlotId, businessType, createdAt,
                lastInteractionAt);
    }

    public BookingContext withState(ConversationState newState, Instant now) {
        return new BookingContext(sessionId, customerId, salonId, originalIntent, language, newState, choiceHistory,
                lastShownSlots, lastShownOptionIds, pendingConfirmationSlotId, businessType, createdAt, now);
    }

    /**
     * 가장 오래된 기록부터 버려 maxChoices개를 유지한다. 중복도 그대로 추가.
     */
    public BookingContext withChoice(ChoiceRecord choice, int maxChoices, Instant now) {
        List<ChoiceRecord> history = new ArrayList<>(choiceHistory);
        history.add(choice);
        int overflow = history.size() - maxChoices;
        List<ChoiceRecord> trimmed = overflow > 0 ? history.subList(overflow, history.size()) : history;
        return new BookingContext(sessionId, customerId, salonId, originalIntent, language, state, trimmed,
                lastShownSlots, lastShownOptionIds, pendingConfirmationSlotId, businessType, createdAt, now);
    }

    public BookingContext withShownOptions(List<SlotSuggestion> slots, List<String> optionIds, Instant now) {
        List<SlotSuggestion> shown = slots.size() > MAX_SHOWN_SLOTS ? slots.subList(0, MAX_SHOWN_SLOTS) : slots;
        return new BookingContext(sessionId, customerId, salonId, originalIntent, language, state, choiceHistory,
                shown, optionIds, null, businessType, createdAt, now);
    }

    public BookingContext withPendingConfirmation(String slotId, List<String> optionIds, Instant now) {
        return new BookingContext(sessionId, customerId, salonId, originalIntent, language, state, choiceHistory,
                lastShownSlots, optionIds, slotId, businessType, createdAt, now);
    }

    public boolean isExpired(Duration maxLifetime, Instant now) {
        return !createdAt.plus(maxLifetime).isAfter(now);
    }

    /**
     * 상한까지 남은 시간 (초). 0 이하면 만료.
     */
    public long secondsUntilHardCap(Duration maxLifetime, Instant now) {
        return Duration.between(now, createdAt.plus(maxLifetime)).getSeconds();
    }
}

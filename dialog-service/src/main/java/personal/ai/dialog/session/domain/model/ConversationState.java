package personal.ai.dialog.session.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 대화 상태
 * CONFIRMED, ABANDONED는 종료 상태 (세션 삭제 대상)
 */
public enum ConversationState {
    STARTED,
    SLOTS_SHOWN,
    CHOICE_PRESENTED,
    CONFIRMED,
    ABANDONED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == CONFIRMED || this == ABANDONED;
    }
}

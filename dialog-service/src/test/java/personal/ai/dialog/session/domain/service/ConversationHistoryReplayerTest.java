package personal.ai.dialog.session.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ai.dialog.card.domain.model.ButtonId;
import personal.ai.dialog.session.domain.model.BookingContext;
import personal.ai.dialog.session.domain.model.ConversationState;
import personal.ai.dialog.session.domain.model.MessageDirection;
import personal.ai.dialog.session.domain.model.TransportMessage;
import personal.ai.dialog.session.domain.model.TransportMessageType;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConversationHistoryReplayer 단위 테스트")
class ConversationHistoryReplayerTest {

    private static final Instant T0 = Instant.parse("2025-10-24T09:00:00Z");
    private static final Instant NOW = T0.plusSeconds(600);
    private static final SlotSuggestion SLOT = new SlotSuggestion("slot-1", LocalDate.of(2025, 10, 24),
            LocalTime.of(15, 0), null, "m-1", "Anna", "svc-1", "Haircut", 60, null);

    private final ConversationHistoryReplayer replayer = new ConversationHistoryReplayer();

    private static TransportMessage inboundText(String text, int seconds) {
        return new TransportMessage("in-" + seconds, TransportMessageType.TEXT, text, null, null,
                T0.plusSeconds(seconds), MessageDirection.INBOUND);
    }

    private static TransportMessage inboundTap(String buttonId, int seconds) {
        return new TransportMessage("tap-" + seconds, TransportMessageType.BUTTON_REPLY, null, buttonId, null,
                T0.plusSeconds(seconds), MessageDirection.INBOUND);
    }

    private static TransportMessage card(List<String> optionIds, int seconds) {
        return new TransportMessage("out-" + seconds, TransportMessageType.INTERACTIVE, "card", null, optionIds,
                T0.plusSeconds(seconds), MessageDirection.OUTBOUND);
    }

    private Optional<BookingContext> replay(List<TransportMessage> messages, String languageHint) {
        return replayer.replay("cust-1", "salon-1", messages, languageHint, "generic", 10, NOW);
    }

    @Test
    @DisplayName("마지막 카드가 확인 카드면 확인 대기 슬롯과 함께 복구한다")
    void recoversPendingConfirmation() {
        // given
        String confirm = ButtonId.confirm(SLOT).encode();
        String change = ButtonId.change(SLOT.id()).encode();
        List<TransportMessage> messages = List.of(
                inboundText("Haircut friday 3pm", 0),
                card(List.of(ButtonId.choice("same_day_diff_time").encode()), 1),
                inboundTap(ButtonId.choice("same_day_diff_time").encode(), 10),
                card(List.of(confirm, change), 11));

        // when
        Optional<BookingContext> recovered = replay(messages, null);

        // then
        assertThat(recovered).isPresent();
        BookingContext context = recovered.get();
        assertThat(context.state()).isEqualTo(ConversationState.CHOICE_PRESENTED);
        assertThat(context.pendingConfirmationSlotId()).isEqualTo("slot-1");
        assertThat(context.originalIntent().rawText()).isEqualTo("Haircut friday 3pm");
        assertThat(context.choiceHistory()).extracting(c -> c.choiceId()).containsExactly("same_day_diff_time");
        assertThat(context.lastShownOptionIds()).containsExactly(confirm, change);
        assertThat(context.createdAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("마지막 카드가 슬롯 카드면 SLOTS_SHOWN으로 복구한다")
    void recoversSlotsShown() {
        // given
        List<TransportMessage> messages = List.of(
                inboundText("Стрижка в пятницу", 0),
                card(List.of(ButtonId.slot(SLOT).encode()), 1));

        // when
        Optional<BookingContext> recovered = replay(messages, null);

        // then
        assertThat(recovered).get().extracting(BookingContext::state).isEqualTo(ConversationState.SLOTS_SHOWN);
        assertThat(recovered.get().language()).isEqualTo("ru");
    }

    @Test
    @DisplayName("카드를 받은 요청이 둘 이상이면 복구하지 않는다")
    void ambiguousHistory() {
        // given
        List<TransportMessage> messages = List.of(
                inboundText("Haircut friday", 0),
                card(List.of(ButtonId.slot(SLOT).encode()), 1),
                inboundText("Manicure saturday", 5),
                card(List.of(ButtonId.slot(SLOT).encode()), 6));

        // when & then
        assertThat(replay(messages, "en")).isEmpty();
    }

    @Test
    @DisplayName("확정 이후의 메시지만 사용한다")
    void ignoresMessagesBeforeConfirmation() {
        // given: 이전 대화는 확정으로 끝났고, 이후 카드가 없다
        List<TransportMessage> messages = List.of(
                inboundText("Haircut friday", 0),
                card(List.of(ButtonId.confirm(SLOT).encode()), 1),
                inboundTap(ButtonId.confirm(SLOT).encode(), 2),
                inboundText("thanks", 3));

        // when & then
        assertThat(replay(messages, "en")).isEmpty();
    }

    @Test
    @DisplayName("살롱 전화를 선택해 끝난 대화는 복구하지 않는다")
    void ignoresConversationAbandonedByCallSalon() {
        // given
        String callSalon = ButtonId.choice("call_salon").encode();
        List<TransportMessage> messages = List.of(
                inboundText("Haircut friday 3pm", 0),
                card(List.of(ButtonId.choice("same_day_diff_time").encode(), callSalon), 1),
                inboundTap(callSalon, 5),
                new TransportMessage("out-6", TransportMessageType.TEXT, "Call us", null, null,
                        T0.plusSeconds(6), MessageDirection.OUTBOUND));

        // when & then
        assertThat(replay(messages, "en")).isEmpty();
    }

    @Test
    @DisplayName("살롱 전화 이후 새 요청만으로 복구하고 생성 시각은 새 구간의 첫 메시지다")
    void recoversOnlyConversationAfterCallSalon() {
        // given
        String callSalon = ButtonId.choice("call_salon").encode();
        List<TransportMessage> messages = List.of(
                inboundText("Haircut friday 3pm", 0),
                card(List.of(callSalon), 1),
                inboundTap(callSalon, 5),
                inboundText("Manicure saturday", 300),
                card(List.of(ButtonId.slot(SLOT).encode()), 301));

        // when
        Optional<BookingContext> recovered = replay(messages, "en");

        // then
        assertThat(recovered).isPresent();
        assertThat(recovered.get().originalIntent().rawText()).isEqualTo("Manicure saturday");
        assertThat(recovered.get().state()).isEqualTo(ConversationState.SLOTS_SHOWN);
        assertThat(recovered.get().choiceHistory()).isEmpty();
        assertThat(recovered.get().createdAt()).isEqualTo(T0.plusSeconds(300));
    }

    @Test
    @DisplayName("언어 힌트가 지원 언어면 우선 사용한다")
    void languageHintWins() {
        // given
        List<TransportMessage> messages = List.of(
                inboundText("Haircut friday", 0),
                card(List.of(ButtonId.choice("popular_times").encode()), 1));

        // when
        Optional<BookingContext> recovered = replay(messages, "es");

        // then
        assertThat(recovered).get().extracting(BookingContext::language).isEqualTo("es");
        assertThat(recovered.get().state()).isEqualTo(ConversationState.CHOICE_PRESENTED);
    }

    @Test
    @DisplayName("빈 이력은 복구하지 않는다")
    void emptyHistory() {
        assertThat(replay(List.of(), "en")).isEmpty();
    }
}

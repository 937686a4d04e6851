package personal.ai.dialog.session.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.dialog.card.domain.exception.InvalidButtonIdException;
import personal.ai.dialog.card.domain.model.ButtonAction;
import personal.ai.dialog.card.domain.model.ButtonId;
import personal.ai.dialog.i18n.LanguageGuesser;
import personal.ai.dialog.i18n.LanguageProfiles;
import personal.ai.dialog.message.domain.model.ChoiceIds;
import personal.ai.dialog.session.domain.model.BookingContext;
import personal.ai.dialog.session.domain.model.ChoiceRecord;
import personal.ai.dialog.session.domain.model.ConversationState;
import personal.ai.dialog.session.domain.model.OriginalIntent;
import personal.ai.dialog.session.domain.model.TransportMessage;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 전송 이력 재생으로 BookingContext를 복구한다.
 * <p>
 * - 마지막 종료 이벤트(confirm 탭, call_salon 선택) 이후 메시지만 사용
 * - 생성 시각은 남은 구간의 첫 메시지 시각 (hard cap 유지)
 * - 카드 응답을 받은 고객 텍스트가 최초 요청 후보, 후보가 2개 이상이면 복구하지 않음
 * - 마지막 카드의 옵션으로 상태와 확인 대기 슬롯을 결정
 */
@Slf4j
@Component
public class ConversationHistoryReplayer {

    public Optional<BookingContext> replay(String customerId, String salonId, List<TransportMessage> messages,
                                           String languageHint, String businessType, int maxChoices, Instant now) {
        if (messages == null || messages.isEmpty()) {
            return Optional.empty();
        }

        List<TransportMessage> ordered = messages.stream()
                .filter(m -> m.timestamp() != null)
                .sorted(Comparator.comparing(TransportMessage::timestamp))
                .toList();
        List<TransportMessage> window = afterLastTerminalEvent(ordered);

        int lastInteractive = lastOutboundInteractiveIndex(window);
        if (lastInteractive < 0) {
            log.debug("No interactive card in history: customerId={}, salonId={}", customerId, salonId);
            return Optional.empty();
        }

        Set<String> candidates = candidateIntents(window);
        if (candidates.size() > 1) {
            log.info("Ambiguous history recovery: customerId={}, salonId={}, candidates={}",
                    customerId, salonId, candidates.size());
            return Optional.empty();
        }

        String language = resolveLanguage(window, languageHint);
        BookingContext context = BookingContext.start(customerId, salonId, language, businessType,
                window.get(0).timestamp());
        if (!candidates.isEmpty()) {
            context = context.withOriginalIntent(OriginalIntent.fromText(firstCandidateText(window)));
        }

        for (TransportMessage message : window) {
            Optional<ButtonId> tapped = parseQuietly(message.isInbound() ? message.buttonId() : null);
            if (tapped.isPresent() && tapped.get().action() == ButtonAction.CHOICE) {
                context = context.withChoice(new ChoiceRecord(tapped.get().choiceId(), message.timestamp(), null),
                        maxChoices, now);
            }
        }

        List<String> optionIds = window.get(lastInteractive).optionIds();
        List<ButtonId> options = optionIds.stream()
                .map(this::parseQuietly)
                .flatMap(Optional::stream)
                .toList();

        Optional<ButtonId> pendingConfirm = options.stream()
                .filter(option -> option.action() == ButtonAction.CONFIRM)
                .findFirst();
        if (pendingConfirm.isPresent()) {
            context = context.withPendingConfirmation(pendingConfirm.get().slotId(), optionIds, now)
                    .withState(ConversationState.CHOICE_PRESENTED, now);
        } else if (options.stream().anyMatch(option -> option.action() == ButtonAction.SLOT)) {
            context = context.withShownOptions(List.of(), optionIds, now)
                    .withState(ConversationState.SLOTS_SHOWN, now);
        } else if (!options.isEmpty()) {
            context = context.withShownOptions(List.of(), optionIds, now)
                    .withState(ConversationState.CHOICE_PRESENTED, now);
        }

        log.info("Session recovered from history: sessionId={}, state={}, messages={}",
                context.sessionId(), context.state().code(), window.size());
        return Optional.of(context);
    }

    private List<TransportMessage> afterLastTerminalEvent(List<TransportMessage> ordered) {
        int start = 0;
        for (int i = 0; i < ordered.size(); i++) {
            TransportMessage message = ordered.get(i);
            if (message.isInbound() && parseQuietly(message.buttonId())
                    .filter(this::isTerminal)
                    .isPresent()) {
                start = i + 1;
            }
        }
        return ordered.subList(start, ordered.size());
    }

    // 확정 또는 살롱 전화(대화 포기)
    private boolean isTerminal(ButtonId id) {
        return id.action() == ButtonAction.CONFIRM
                || (id.action() == ButtonAction.CHOICE && ChoiceIds.CALL_SALON.equals(id.choiceId()));
    }

    private int lastOutboundInteractiveIndex(List<TransportMessage> window) {
        for (int i = window.size() - 1; i >= 0; i--) {
            if (window.get(i).isOutboundInteractive()) {
                return i;
            }
        }
        return -1;
    }

    // 다음 outbound가 카드인 고객 텍스트
    private Set<String> candidateIntents(List<TransportMessage> window) {
        Set<String> candidates = new LinkedHashSet<>();
        for (int i = 0; i < window.size(); i++) {
            TransportMessage message = window.get(i);
            if (!message.isInboundText()) {
                continue;
            }
            if (nextOutboundIsInteractive(window, i)) {
                candidates.add(message.text().trim().toLowerCase(Locale.ROOT));
            }
        }
        return candidates;
    }

    private String firstCandidateText(List<TransportMessage> window) {
        for (int i = 0; i < window.size(); i++) {
            if (window.get(i).isInboundText() && nextOutboundIsInteractive(window, i)) {
                return window.get(i).text().trim();
            }
        }
        return null;
    }

    private boolean nextOutboundIsInteractive(List<TransportMessage> window, int from) {
        for (int j = from + 1; j < window.size(); j++) {
            TransportMessage next = window.get(j);
            if (next.isInbound()) {
                continue;
            }
            return next.isOutboundInteractive();
        }
        return false;
    }

    private String resolveLanguage(List<TransportMessage> window, String languageHint) {
        if (languageHint != null && LanguageProfiles.isSupported(languageHint)) {
            return LanguageProfiles.normalize(languageHint);
        }
        return window.stream()
                .filter(TransportMessage::isInboundText)
                .findFirst()
                .map(message -> LanguageGuesser.guess(message.text()))
                .orElse(LanguageProfiles.DEFAULT_LANGUAGE);
    }

    private Optional<ButtonId> parseQuietly(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ButtonId.parse(raw));
        } catch (InvalidButtonIdException e) {
            log.debug("Ignoring unparseable button id in history: {}", raw);
            return Optional.empty();
        }
    }
}

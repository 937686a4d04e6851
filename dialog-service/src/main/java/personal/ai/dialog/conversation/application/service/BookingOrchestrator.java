package personal.ai.dialog.conversation.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.dialog.card.application.port.in.InteractiveCardUseCase;
import personal.ai.dialog.card.domain.model.ButtonId;
import personal.ai.dialog.card.domain.model.InteractivePayload;
import personal.ai.dialog.config.DialogProperties;
import personal.ai.dialog.conversation.application.port.in.HandleInboundEventUseCase;
import personal.ai.dialog.conversation.application.port.out.BookingCommandPort;
import personal.ai.dialog.conversation.application.port.out.ChannelSender;
import personal.ai.dialog.conversation.domain.exception.ChannelDeliveryFailedException;
import personal.ai.dialog.conversation.domain.model.BookingConfirmation;
import personal.ai.dialog.conversation.domain.model.InboundEvent;
import personal.ai.dialog.conversation.domain.model.OutboundMessage;
import personal.ai.dialog.i18n.LanguageGuesser;
import personal.ai.dialog.i18n.LanguageProfile;
import personal.ai.dialog.i18n.LanguageProfiles;
import personal.ai.dialog.message.application.port.in.MessageBuilderUseCase;
import personal.ai.dialog.message.domain.model.BusinessContext;
import personal.ai.dialog.message.domain.model.ChoiceCard;
import personal.ai.dialog.message.domain.model.ChoiceIds;
import personal.ai.dialog.message.domain.model.ChoiceScenario;
import personal.ai.dialog.popular.application.port.in.PopularTimesUseCase;
import personal.ai.dialog.popular.domain.exception.PopularTimesUnavailableException;
import personal.ai.dialog.popular.domain.model.BusinessType;
import personal.ai.dialog.popular.domain.model.PopularTimeSlot;
import personal.ai.dialog.popular.domain.model.PopularTimesOptions;
import personal.ai.dialog.session.application.port.in.SessionContextUseCase;
import personal.ai.dialog.session.domain.exception.MessageHistoryUnavailableException;
import personal.ai.dialog.session.domain.exception.SessionStoreUnavailableException;
import personal.ai.dialog.session.domain.model.BookingContext;
import personal.ai.dialog.session.domain.model.ChoiceRecord;
import personal.ai.dialog.session.domain.model.ConversationState;
import personal.ai.dialog.session.domain.model.OriginalIntent;
import personal.ai.dialog.suggestion.application.port.out.AvailabilitySource;
import personal.ai.dialog.suggestion.domain.exception.AvailabilityUnavailableException;
import personal.ai.dialog.suggestion.domain.model.RankedSlot;
import personal.ai.dialog.suggestion.domain.model.RankingPreferences;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;
import personal.ai.dialog.suggestion.domain.model.SlotTimeFormats;
import personal.ai.dialog.suggestion.domain.service.AlternativeSuggester;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Booking Orchestrator
 * 세션 복원 → (인기 시간대 | 대체 슬롯 랭킹) → 카드 생성 → 발송 → 세션 저장
 * <p>
 * 의존 시스템 장애는 대체 경로로 처리하고 OutboundMessage.degraded로 알린다.
 * 고객에게는 항상 현지화된 메시지만 보낸다 (검증 실패/장애는 ERROR 템플릿).
 */
@Slf4j
@Service
public class BookingOrchestrator implements HandleInboundEventUseCase {

    private static final int MAX_BODY_LINES = 8;

    private final SessionContextUseCase sessionContextUseCase;
    private final PopularTimesUseCase popularTimesUseCase;
    private final MessageBuilderUseCase messageBuilder;
    private final InteractiveCardUseCase cardBuilder;
    private final AlternativeSuggester alternativeSuggester;
    private final AvailabilitySource availabilitySource;
    private final BookingCommandPort bookingCommandPort;
    private final ChannelSender channelSender;
    private final DialogProperties.Conversation config;
    private final DialogProperties.Session sessionConfig;
    private final String defaultLanguage;
    private final Clock clock;

    public BookingOrchestrator(SessionContextUseCase sessionContextUseCase,
                               PopularTimesUseCase popularTimesUseCase,
                               MessageBuilderUseCase messageBuilder,
                               InteractiveCardUseCase cardBuilder,
                               AlternativeSuggester alternativeSuggester,
                               AvailabilitySource availabilitySource,
                               BookingCommandPort bookingCommandPort,
                               ChannelSender channelSender,
                               DialogProperties properties,
                               Clock clock) {
        this.sessionContextUseCase = sessionContextUseCase;
        this.popularTimesUseCase = popularTimesUseCase;
        this.messageBuilder = messageBuilder;
        this.cardBuilder = cardBuilder;
        this.alternativeSuggester = alternativeSuggester;
        this.availabilitySource = availabilitySource;
        this.bookingCommandPort = bookingCommandPort;
        this.channelSender = channelSender;
        this.config = properties.conversation();
        this.sessionConfig = properties.session();
        this.defaultLanguage = LanguageProfiles.normalize(properties.messages().defaultLanguage());
        this.clock = clock;
    }

    @Override
    public OutboundMessage handle(InboundEvent event) {
        Resumed resumed = resume(event);
        BookingContext context = resumed.context();

        Turn turn;
        try {
            turn = event.isButtonTap()
                    ? handleTap(context, ButtonId.parse(event.buttonId()))
                    : handleText(context, event);
        } catch (BusinessException e) {
            turn = apology(context, e);
        }

        boolean delivered = deliver(event.customerId(), turn.payload());
        boolean persisted = persist(turn);
        boolean degraded = resumed.degraded() || turn.degraded() || !delivered || !persisted;

        log.info("Inbound event handled: sessionId={}, tap={}, state={}, type={}, degraded={}",
                context.sessionId(), event.isButtonTap(), turn.context().state().code(),
                turn.payload().type(), degraded);
        return new OutboundMessage(turn.payload(), turn.context().state(), degraded);
    }

    // ==================== Session ====================

    private Resumed resume(InboundEvent event) {
        String sessionId = BookingContext.sessionIdOf(event.customerId(), event.salonId());
        try {
            Optional<BookingContext> existing = sessionContextUseCase.get(sessionId);
            if (existing.isPresent()) {
                return new Resumed(existing.get(), false);
            }
        } catch (SessionStoreUnavailableException e) {
            log.warn("Session store unavailable, recovering from history: sessionId={}", sessionId);
            return new Resumed(recover(event).orElseGet(() -> newContext(event)), true);
        }

        // 오래된 카드의 탭이면 TTL이 먼저 끝난 것, 이력으로 복구 시도
        if (event.isButtonTap()) {
            Optional<BookingContext> recovered = recover(event);
            if (recovered.isPresent()) {
                return new Resumed(recovered.get(), false);
            }
        }
        return new Resumed(newContext(event), false);
    }

    private Optional<BookingContext> recover(InboundEvent event) {
        try {
            return sessionContextUseCase.recoverFromHistory(event.customerId(), event.salonId(), event.language());
        } catch (MessageHistoryUnavailableException e) {
            log.warn("History recovery unavailable: customerId={}, salonId={}", event.customerId(), event.salonId());
            return Optional.empty();
        }
    }

    private BookingContext newContext(InboundEvent event) {
        String language;
        if (event.language() != null && LanguageProfiles.isSupported(event.language())) {
            language = LanguageProfiles.normalize(event.language());
        } else if (event.text() != null && !event.text().isBlank()) {
            language = LanguageGuesser.guess(event.text());
        } else {
            language = defaultLanguage;
        }
        String businessType = event.businessType() != null ? event.businessType() : config.defaultBusinessType();
        return BookingContext.start(event.customerId(), event.salonId(), language, businessType, clock.instant());
    }

    private boolean persist(Turn turn) {
        BookingContext context = turn.context();
        try {
            if (context.state().isTerminal()) {
                sessionContextUseCase.updateState(context.sessionId(), context.state());
                return true;
            }
            sessionContextUseCase.save(context.sessionId(), context);
            return true;
        } catch (SessionStoreUnavailableException e) {
            log.warn("Session not persisted: sessionId={}, state={}", context.sessionId(), context.state().code());
            return false;
        }
    }

    private boolean deliver(String customerId, InteractivePayload payload) {
        try {
            channelSender.send(customerId, payload);
            return true;
        } catch (ChannelDeliveryFailedException e) {
            log.error("Outbound delivery failed: customerId={}, type={}", customerId, payload.type(), e);
            return false;
        }
    }

    // ==================== Text ====================

    private Turn handleText(BookingContext current, InboundEvent event) {
        BookingContext context = current.withOriginalIntent(
                event.intent() != null ? event.intent() : OriginalIntent.fromText(event.text()));
        OriginalIntent intent = context.originalIntent();

        if (intent == null || !intent.isComplete()) {
            return clarify(context);
        }
        if (!intent.hasTimePreference()) {
            return showPopularTimes(context, intent.preferredDate());
        }
        return showSlotsForIntent(context, intent);
    }

    private Turn clarify(BookingContext context) {
        String language = context.language();
        ChoiceCard card = messageBuilder.getChoiceCard(ChoiceScenario.INCOMPLETE_REQUEST, language, Map.of());

        if (context.state() == ConversationState.STARTED && context.choiceHistory().isEmpty()) {
            String greeting = messageBuilder.getContextualMessage("GREETING", language,
                    new BusinessContext(context.businessType(), null, null, Map.of()));
            String message = messageBuilder.formatWithLimits(greeting + "\n\n" + card.message(), MAX_BODY_LINES);
            card = new ChoiceCard(card.scenario(), card.language(), message, card.options());
        }
        return choiceTurn(context, cardBuilder.buildChoiceCard(card), false);
    }

    private Turn showSlotsForIntent(BookingContext context, OriginalIntent intent) {
        LocalDate date = targetDate(intent);
        LocalTime time = intent.preferredTime();
        Map<String, Object> params = dayTimeParams(date, time, context.language());

        List<SlotSuggestion> slots = findSlots(context, date, date.plusDays(config.searchDays() - 1L));
        if (slots.isEmpty()) {
            return scenarioTurn(context, ChoiceScenario.WEEK_FULL, params);
        }

        List<SlotSuggestion> sameDay = slots.stream().filter(slot -> slot.date().equals(date)).toList();
        if (sameDay.isEmpty()) {
            return scenarioTurn(context, ChoiceScenario.DAY_FULL, params);
        }

        List<SlotSuggestion> exact = sameDay.stream()
                .filter(slot -> slot.startTime().equals(time))
                .filter(slot -> intent.preferredMasterId() == null || slot.hasMaster(intent.preferredMasterId()))
                .toList();
        if (exact.size() == 1) {
            return confirmationTurn(context, exact.get(0));
        }
        if (!exact.isEmpty()) {
            return slotsTurn(context, exact, messageBuilder.getMessage("SLOT_AVAILABLE", context.language(), params));
        }
        return scenarioTurn(context, ChoiceScenario.TIME_UNAVAILABLE, params);
    }

    private Turn showPopularTimes(BookingContext context, LocalDate from) {
        String salonId = context.salonId();
        String serviceId = serviceId(context);
        LocalDate start = from != null && from.isAfter(today()) ? from : today();
        boolean degraded = false;

        List<PopularTimeSlot> popular;
        try {
            popular = popularTimesUseCase.getPopularTimes(salonId, PopularTimesOptions.forService(serviceId));
        } catch (PopularTimesUnavailableException e) {
            log.warn("Popular times unavailable, using defaults: salonId={}", salonId);
            popular = List.of();
            degraded = true;
        }
        if (popular.isEmpty()) {
            popular = popularTimesUseCase.getDefaultTimes(BusinessType.fromCode(context.businessType()));
        }

        try {
            List<PopularTimeSlot> open = popularTimesUseCase.checkAvailability(salonId, serviceId, popular, start)
                    .stream()
                    .filter(slot -> Boolean.TRUE.equals(slot.available()))
                    .toList();
            if (!open.isEmpty()) {
                popular = open;
            }
        } catch (AvailabilityUnavailableException e) {
            log.warn("Availability check skipped for popular times: salonId={}", salonId);
            degraded = true;
        }

        List<PopularTimeSlot> shown = popular.size() > InteractiveCardUseCase.MAX_LIST_ROWS
                ? popular.subList(0, InteractiveCardUseCase.MAX_LIST_ROWS)
                : popular;
        InteractivePayload payload = cardBuilder.buildPopularTimesCard(shown, context.language(), null);
        return choiceTurn(context, payload, degraded);
    }

    // ==================== Button taps ====================

    private Turn handleTap(BookingContext context, ButtonId buttonId) {
        return switch (buttonId.action()) {
            case SLOT -> confirmationTurn(context, resolveSlot(context, buttonId));
            case CONFIRM -> confirmBooking(context, resolveSlot(context, buttonId));
            case CHANGE -> changeRequested(context);
            case CHOICE -> handleChoice(context, buttonId.choiceId());
            case POPULAR -> popularTimePicked(context, buttonId.dayOfWeek(), buttonId.hour());
        };
    }

    private Turn confirmBooking(BookingContext context, SlotSuggestion slot) {
        BookingConfirmation confirmation = bookingCommandPort.confirmBooking(
                context.customerId(), context.salonId(), slot);
        popularTimesUseCase.invalidateCache(context.salonId(), null);

        log.info("Booking confirmed: sessionId={}, bookingId={}, slotId={}",
                context.sessionId(), confirmation.bookingId(), slot.id());

        String text = messageBuilder.getMessage("BOOKING_CONFIRMED", context.language(),
                dayTimeParams(slot.date(), slot.startTime(), context.language()));
        return new Turn(context.withState(ConversationState.CONFIRMED, clock.instant()),
                cardBuilder.buildTextMessage(text), false);
    }

    private Turn handleChoice(BookingContext context, String choiceId) {
        OriginalIntent intent = context.originalIntent();
        LocalDate date = targetDate(intent);
        LocalTime time = intent != null ? intent.preferredTime() : null;
        String language = context.language();

        Turn turn = switch (choiceId) {
            case ChoiceIds.SAME_DAY_DIFF_TIME -> {
                List<SlotSuggestion> sameDay = findSlots(context, date, date);
                List<RankedSlot> ranked = time != null
                        ? alternativeSuggester.rankByTimeProximity(sameDay, time)
                        : alternativeSuggester.rankByMultipleFactors(sameDay, preferences(intent));
                yield alternativesTurn(context, ranked, sameDayMessage(date, time, language));
            }
            case ChoiceIds.DIFF_DAY_SAME_TIME -> {
                List<SlotSuggestion> sameTime = findSlots(context, date, date.plusDays(config.searchDays() - 1L))
                        .stream()
                        .filter(slot -> !slot.date().equals(date))
                        .filter(slot -> time == null || slot.startTime().equals(time))
                        .toList();
                String message = time != null
                        ? messageBuilder.getMessage("DIFF_DAY_OPTIONS", language,
                        Map.of("time", SlotTimeFormats.formatTime(time)))
                        : null;
                yield alternativesTurn(context, alternativeSuggester.rankByDateProximity(sameTime, date), message);
            }
            case ChoiceIds.POPULAR_TIMES -> showPopularTimes(context, date);
            case ChoiceIds.NEXT_AVAILABLE_DAY -> {
                Optional<LocalDate> nextDay = findSlots(context, date.plusDays(1), date.plusDays(config.searchDays()))
                        .stream()
                        .map(SlotSuggestion::date)
                        .min(Comparator.naturalOrder());
                if (nextDay.isEmpty()) {
                    yield noAlternatives(context);
                }
                List<SlotSuggestion> daySlots = findSlots(context, nextDay.get(), nextDay.get());
                List<RankedSlot> ranked = time != null
                        ? alternativeSuggester.rankByTimeProximity(daySlots, time)
                        : alternativeSuggester.rankByMultipleFactors(daySlots, preferences(intent));
                yield alternativesTurn(context, ranked, sameDayMessage(nextDay.get(), time, language));
            }
            case ChoiceIds.NEXT_WEEK -> {
                LocalDate nextWeek = date.plusWeeks(1);
                List<SlotSuggestion> slots = findSlots(context, nextWeek, nextWeek.plusDays(6));
                RankingPreferences preferences = new RankingPreferences(nextWeek, time,
                        intent != null ? intent.preferredMasterId() : null, null);
                yield nearbyTurn(context, slots, preferences);
            }
            case ChoiceIds.SEE_MORE -> seeMore(context);
            case ChoiceIds.EARLIEST_AVAILABLE -> {
                List<SlotSuggestion> earliest = findSlots(context, today(), today().plusDays(config.searchDays() - 1L))
                        .stream()
                        .sorted(Comparator.comparing(SlotSuggestion::startDateTime))
                        .limit(InteractiveCardUseCase.MAX_LIST_ROWS)
                        .toList();
                yield earliest.isEmpty() ? noAlternatives(context) : slotsTurn(context, earliest, null);
            }
            case ChoiceIds.CALL_SALON -> new Turn(context.withState(ConversationState.ABANDONED, clock.instant()),
                    cardBuilder.buildTextMessage(messageBuilder.getMessage("CALL_SALON_INFO", language, Map.of())),
                    false);
            default -> throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Unknown choice: choiceId=%s", choiceId));
        };

        ChoiceRecord record = new ChoiceRecord(choiceId, clock.instant(), turn.context().state().code());
        return turn.withContext(turn.context().withChoice(record, sessionConfig.maxChoices(), clock.instant()));
    }

    // 확인 카드에서 "변경": 여러 슬롯을 보여줬으면 다시, 아니면 주변 대체 슬롯
    private Turn changeRequested(BookingContext context) {
        if (context.lastShownSlots().size() > 1) {
            return slotsTurn(context, context.lastShownSlots(), null);
        }
        if (context.originalIntent() == null || !context.originalIntent().isComplete()) {
            return clarify(context);
        }
        return seeMore(context);
    }

    private Turn seeMore(BookingContext context) {
        LocalDate date = targetDate(context.originalIntent());
        List<SlotSuggestion> slots = findSlots(context, date, date.plusDays(config.searchDays() - 1L));
        return nearbyTurn(context, slots, preferences(context.originalIntent()));
    }

    private Turn popularTimePicked(BookingContext context, DayOfWeek dayOfWeek, int hour) {
        OriginalIntent intent = context.originalIntent();
        LocalDate from = intent != null && intent.preferredDate() != null && intent.preferredDate().isAfter(today())
                ? intent.preferredDate()
                : today();
        LocalDate date = from.with(TemporalAdjusters.nextOrSame(dayOfWeek));
        LocalTime time = LocalTime.of(hour, 0);

        List<RankedSlot> ranked = alternativeSuggester.rankByTimeProximity(findSlots(context, date, date), time);
        return alternativesTurn(context, ranked, sameDayMessage(date, time, context.language()));
    }

    // ==================== Turns ====================

    private Turn scenarioTurn(BookingContext context, ChoiceScenario scenario, Map<String, ?> params) {
        ChoiceCard card = messageBuilder.getChoiceCard(scenario, context.language(), params);
        return choiceTurn(context, cardBuilder.buildChoiceCard(card), false);
    }

    private Turn choiceTurn(BookingContext context, InteractivePayload payload, boolean degraded) {
        Instant now = clock.instant();
        BookingContext next = context.withShownOptions(List.of(), payload.optionIds(), now)
                .withState(ConversationState.CHOICE_PRESENTED, now);
        return new Turn(next, payload, degraded);
    }

    private Turn confirmationTurn(BookingContext context, SlotSuggestion slot) {
        Instant now = clock.instant();
        InteractivePayload payload = cardBuilder.buildConfirmationCard(slot, context.language());
        BookingContext next = context.withPendingConfirmation(slot.id(), payload.optionIds(), now)
                .withState(ConversationState.CHOICE_PRESENTED, now);
        return new Turn(next, payload, false);
    }

    private Turn slotsTurn(BookingContext context, List<SlotSuggestion> slots, String message) {
        List<SlotSuggestion> shown = slots.size() > InteractiveCardUseCase.MAX_LIST_ROWS
                ? slots.subList(0, InteractiveCardUseCase.MAX_LIST_ROWS)
                : slots;
        InteractivePayload payload = cardBuilder.buildSlotSelectionCard(shown, context.language(), message);
        return shownSlotsTurn(context, shown, payload);
    }

    private Turn alternativesTurn(BookingContext context, List<RankedSlot> ranked, String message) {
        if (ranked.isEmpty()) {
            return noAlternatives(context);
        }
        int max = Math.min(config.maxAlternatives(), InteractiveCardUseCase.MAX_LIST_ROWS);
        List<RankedSlot> top = ranked.size() > max ? ranked.subList(0, max) : ranked;
        List<RankedSlot> highlighted = alternativeSuggester.addVisualIndicators(top, config.highlightLimit(),
                context.language());
        InteractivePayload payload = cardBuilder.buildAlternativeSlotsCard(highlighted, context.language(), message);
        return shownSlotsTurn(context, highlighted.stream().map(RankedSlot::slot).toList(), payload);
    }

    private Turn nearbyTurn(BookingContext context, List<SlotSuggestion> slots, RankingPreferences preferences) {
        int max = Math.min(config.maxAlternatives(), InteractiveCardUseCase.MAX_LIST_ROWS);
        List<RankedSlot> nearby = alternativeSuggester.findNearbyAlternatives(slots, preferences, max,
                context.language());
        if (nearby.isEmpty()) {
            return noAlternatives(context);
        }
        InteractivePayload payload = cardBuilder.buildAlternativeSlotsCard(nearby, context.language(), null);
        return shownSlotsTurn(context, nearby.stream().map(RankedSlot::slot).toList(), payload);
    }

    private Turn shownSlotsTurn(BookingContext context, List<SlotSuggestion> slots, InteractivePayload payload) {
        Instant now = clock.instant();
        BookingContext next = context.withShownOptions(slots, payload.optionIds(), now)
                .withState(ConversationState.SLOTS_SHOWN, now);
        return new Turn(next, payload, false);
    }

    private Turn noAlternatives(BookingContext context) {
        String text = messageBuilder.getMessage("NO_ALTERNATIVES", context.language(), Map.of());
        return new Turn(context.withState(context.state(), clock.instant()), cardBuilder.buildTextMessage(text), false);
    }

    private Turn apology(BookingContext context, BusinessException e) {
        if (e.getErrorCode().isDependencyFailure()) {
            log.warn("Dependency failure, sending apology: sessionId={}, code={}, message={}",
                    context.sessionId(), e.getErrorCode().getCode(), e.getMessage());
        } else {
            log.info("Request rejected, sending apology: sessionId={}, code={}, message={}",
                    context.sessionId(), e.getErrorCode().getCode(), e.getMessage());
        }
        String text = messageBuilder.getMessage("ERROR", context.language(), Map.of());
        return new Turn(context, cardBuilder.buildTextMessage(text), e.getErrorCode().isDependencyFailure());
    }

    // ==================== Helpers ====================

    private List<SlotSuggestion> findSlots(BookingContext context, LocalDate from, LocalDate to) {
        return availabilitySource.findAvailableSlots(context.salonId(), serviceId(context), from, to);
    }

    private SlotSuggestion resolveSlot(BookingContext context, ButtonId buttonId) {
        return context.lastShownSlots().stream()
                .filter(slot -> slot.id().equals(buttonId.slotId()))
                .findFirst()
                .orElseGet(() -> {
                    OriginalIntent intent = context.originalIntent();
                    return new SlotSuggestion(buttonId.slotId(), buttonId.date(), buttonId.startTime(), null,
                            buttonId.masterId(), null,
                            intent != null ? intent.serviceId() : null,
                            intent != null ? intent.serviceName() : null,
                            0, null);
                });
    }

    private RankingPreferences preferences(OriginalIntent intent) {
        if (intent == null) {
            return RankingPreferences.of(today(), null, null);
        }
        return RankingPreferences.of(targetDate(intent), intent.preferredTime(), intent.preferredMasterId());
    }

    private String sameDayMessage(LocalDate date, LocalTime time, String language) {
        if (time == null) {
            return null;
        }
        return messageBuilder.getMessage("SAME_DAY_OPTIONS", language, dayTimeParams(date, time, language));
    }

    private Map<String, Object> dayTimeParams(LocalDate date, LocalTime time, String language) {
        LanguageProfile profile = LanguageProfiles.of(language);
        Map<String, Object> params = new HashMap<>();
        params.put("day", profile.formatLongDate(date));
        if (time != null) {
            params.put("time", SlotTimeFormats.formatTime(time));
        }
        return params;
    }

    private LocalDate targetDate(OriginalIntent intent) {
        if (intent == null || intent.preferredDate() == null) {
            return today();
        }
        return intent.preferredDate();
    }

    private String serviceId(BookingContext context) {
        return context.originalIntent() != null ? context.originalIntent().serviceId() : null;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private record Resumed(BookingContext context, boolean degraded) {
    }

    private record Turn(BookingContext context, InteractivePayload payload, boolean degraded) {
        Turn withContext(BookingContext newContext) {
            return new Turn(newContext, payload, degraded);
        }
    }
}

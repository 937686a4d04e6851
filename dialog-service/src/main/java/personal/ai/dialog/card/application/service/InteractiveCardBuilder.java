package personal.ai.dialog.card.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.dialog.card.application.port.in.InteractiveCardUseCase;
import personal.ai.dialog.card.domain.exception.InvalidCardInputException;
import personal.ai.dialog.card.domain.model.ButtonId;
import personal.ai.dialog.card.domain.model.InteractivePayload;
import personal.ai.dialog.card.domain.model.ListRow;
import personal.ai.dialog.card.domain.model.ListSection;
import personal.ai.dialog.card.domain.model.ReplyButton;
import personal.ai.dialog.i18n.LanguageProfile;
import personal.ai.dialog.i18n.LanguageProfiles;
import personal.ai.dialog.message.application.port.in.MessageBuilderUseCase;
import personal.ai.dialog.message.domain.model.ChoiceCard;
import personal.ai.dialog.message.domain.model.ChoiceOption;
import personal.ai.dialog.popular.domain.model.PopularTimeSlot;
import personal.ai.dialog.suggestion.domain.model.RankedSlot;
import personal.ai.dialog.suggestion.domain.model.SlotIndicators;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;
import personal.ai.dialog.suggestion.domain.model.SlotTimeFormats;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Interactive Card Builder
 * 슬롯/선택지를 채널 제약(버튼 3개, 목록 10행, 글자 수)에 맞는 페이로드로 만든다.
 * <p>
 * 카드 문구는 MessageBuilder 템플릿(CARD_*, CONFIRM_*)에서 가져온다.
 * 후보를 다시 정렬하거나 버리지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InteractiveCardBuilder implements InteractiveCardUseCase {

    static final int BUTTON_TITLE_LIMIT = 20;
    static final int ROW_TITLE_LIMIT = 24;
    static final int ROW_DESCRIPTION_LIMIT = 72;
    static final int SECTION_TITLE_LIMIT = 24;
    static final int HEADER_LIMIT = 60;
    static final int FOOTER_LIMIT = 60;
    static final int BODY_LIMIT = 1024;
    static final int TEXT_LIMIT = 4096;

    private static final String ELLIPSIS = "…";
    private static final String STAR = "⭐ ";
    private static final String SEPARATOR = " • ";

    private final MessageBuilderUseCase messageBuilder;

    @Override
    public InteractivePayload buildSlotSelectionCard(List<SlotSuggestion> slots, String language, String message) {
        List<CardEntry> entries = slots == null ? List.of() : slots.stream()
                .map(slot -> new CardEntry(slot, null))
                .toList();
        return buildSlotCard(entries, language, message);
    }

    @Override
    public InteractivePayload buildAlternativeSlotsCard(List<RankedSlot> alternatives, String language,
                                                        String headerMessage) {
        List<CardEntry> entries = alternatives == null ? List.of() : alternatives.stream()
                .map(ranked -> new CardEntry(ranked.slot(), ranked.indicators()))
                .toList();
        return buildSlotCard(entries, language, headerMessage);
    }

    @Override
    public InteractivePayload buildChoiceCard(ChoiceCard choiceCard) {
        List<ChoiceOption> options = choiceCard.options();
        validateCount(options.size(), "choice options");

        String lang = choiceCard.language();
        String body = truncate(choiceCard.message(), BODY_LIMIT);
        if (options.size() <= MAX_BUTTONS) {
            List<ReplyButton> buttons = options.stream()
                    .map(option -> new ReplyButton(ButtonId.choice(option.id()).encode(),
                            truncate(option.label(), BUTTON_TITLE_LIMIT)))
                    .toList();
            return InteractivePayload.buttons(null, body, null, buttons);
        }

        List<ListRow> rows = options.stream()
                .map(option -> new ListRow(ButtonId.choice(option.id()).encode(),
                        truncate(option.label(), ROW_TITLE_LIMIT), null))
                .toList();
        String title = truncate(template("CARD_HEADER", lang), SECTION_TITLE_LIMIT);
        return InteractivePayload.list(null, body, null, listButtonText(lang), List.of(new ListSection(title, rows)));
    }

    @Override
    public InteractivePayload buildConfirmationCard(SlotSuggestion slot, String language) {
        if (slot == null) {
            throw new InvalidCardInputException("Confirmation card requires a slot");
        }
        LanguageProfile profile = LanguageProfiles.of(language);

        StringBuilder body = new StringBuilder(messageBuilder.getMessage("CONFIRM_PROMPT", language, Map.of(
                "serviceName", serviceLabel(slot, language),
                "date", profile.formatLongDate(slot.date()),
                "time", SlotTimeFormats.formatTime(slot.startTime()))));
        if (slot.masterName() != null && !slot.masterName().isBlank()) {
            body.append('\n').append(messageBuilder.getMessage("CONFIRM_MASTER_LINE", language,
                    Map.of("masterName", slot.masterName())));
        }

        List<ReplyButton> buttons = List.of(
                new ReplyButton(ButtonId.confirm(slot).encode(),
                        truncate(template("CONFIRM_BUTTON", language), BUTTON_TITLE_LIMIT)),
                new ReplyButton(ButtonId.change(slot.id()).encode(),
                        truncate(template("CHANGE_BUTTON", language), BUTTON_TITLE_LIMIT)));
        return InteractivePayload.buttons(null, truncate(body.toString(), BODY_LIMIT), null, buttons);
    }

    @Override
    public InteractivePayload buildPopularTimesCard(List<PopularTimeSlot> popularTimes, String language,
                                                    String message) {
        int count = popularTimes == null ? 0 : popularTimes.size();
        validateCount(count, "popular times");

        LanguageProfile profile = LanguageProfiles.of(language);
        String body = truncate(message != null ? message : template("POPULAR_TIMES", language), BODY_LIMIT);
        String header = truncate(template("CARD_HEADER", language), HEADER_LIMIT);

        if (count <= MAX_BUTTONS) {
            List<ReplyButton> buttons = popularTimes.stream()
                    .map(popular -> new ReplyButton(ButtonId.popular(popular.dayOfWeek(), popular.hour()).encode(),
                            truncate(profile.shortWeekday(popular.dayOfWeek()) + " " + hourText(popular.hour()),
                                    BUTTON_TITLE_LIMIT)))
                    .toList();
            return InteractivePayload.buttons(header, body, null, buttons);
        }

        List<ListRow> rows = popularTimes.stream()
                .map(popular -> new ListRow(ButtonId.popular(popular.dayOfWeek(), popular.hour()).encode(),
                        truncate(profile.weekday(popular.dayOfWeek()) + " " + hourText(popular.hour()), ROW_TITLE_LIMIT),
                        popular.nextAvailableSlot() == null ? null
                                : truncate(profile.formatSectionDate(popular.nextAvailableSlot().date()),
                                ROW_DESCRIPTION_LIMIT)))
                .toList();
        return InteractivePayload.list(header, body, null, listButtonText(language),
                List.of(new ListSection(truncate(header, SECTION_TITLE_LIMIT), rows)));
    }

    @Override
    public InteractivePayload buildTextMessage(String text) {
        return InteractivePayload.text(truncate(text == null ? "" : text, TEXT_LIMIT));
    }

    private InteractivePayload buildSlotCard(List<CardEntry> entries, String language, String message) {
        validateCount(entries.size(), "slots");

        LanguageProfile profile = LanguageProfiles.of(language);
        String header = truncate(template("CARD_HEADER", language), HEADER_LIMIT);
        String footer = truncate(template("CARD_FOOTER", language), FOOTER_LIMIT);
        String body = truncate(message != null ? message : defaultBody(entries.get(0).slot(), language), BODY_LIMIT);

        if (entries.size() <= MAX_BUTTONS) {
            List<ReplyButton> buttons = entries.stream()
                    .map(entry -> new ReplyButton(ButtonId.slot(entry.slot()).encode(),
                            truncate(star(entry) + profile.shortWeekday(entry.slot().date()) + " "
                                    + SlotTimeFormats.formatTime(entry.slot().startTime()), BUTTON_TITLE_LIMIT)))
                    .toList();
            log.debug("Slot button card built: buttons={}, language={}", buttons.size(), language);
            return InteractivePayload.buttons(header, body, footer, buttons);
        }

        Map<LocalDate, List<ListRow>> byDate = new TreeMap<>();
        for (CardEntry entry : entries) {
            byDate.computeIfAbsent(entry.slot().date(), date -> new ArrayList<>())
                    .add(toRow(entry, profile));
        }
        List<ListSection> sections = new ArrayList<>(byDate.size());
        byDate.forEach((date, rows) ->
                sections.add(new ListSection(truncate(profile.formatSectionDate(date), SECTION_TITLE_LIMIT), rows)));

        log.debug("Slot list card built: rows={}, sections={}, language={}", entries.size(), sections.size(), language);
        return InteractivePayload.list(header, body, footer, listButtonText(language), sections);
    }

    private ListRow toRow(CardEntry entry, LanguageProfile profile) {
        SlotSuggestion slot = entry.slot();
        String title = star(entry) + SlotTimeFormats.formatTime(slot.startTime());
        if (slot.masterName() != null && !slot.masterName().isBlank()) {
            title = title + SEPARATOR + slot.masterName();
        }

        List<String> details = new ArrayList<>();
        if (entry.indicators() != null && entry.indicators().proximityText() != null) {
            details.add(entry.indicators().proximityText());
        }
        if (slot.durationMinutes() > 0) {
            details.add(profile.formatDuration(slot.durationMinutes()));
        }
        if (slot.price() != null) {
            details.add(profile.formatPrice(slot.price()));
        }
        String description = details.isEmpty() ? null : truncate(String.join(SEPARATOR, details), ROW_DESCRIPTION_LIMIT);

        return new ListRow(ButtonId.slot(slot).encode(), truncate(title, ROW_TITLE_LIMIT), description);
    }

    private String defaultBody(SlotSuggestion first, String language) {
        if (first.serviceName() != null && !first.serviceName().isBlank()) {
            return messageBuilder.getMessage("CARD_BODY", language, Map.of("serviceName", first.serviceName()));
        }
        return template("CARD_BODY_GENERIC", language);
    }

    private String serviceLabel(SlotSuggestion slot, String language) {
        if (slot.serviceName() != null && !slot.serviceName().isBlank()) {
            return slot.serviceName();
        }
        return template("CARD_HEADER", language);
    }

    private String listButtonText(String language) {
        return truncate(template("CARD_LIST_BUTTON", language), BUTTON_TITLE_LIMIT);
    }

    private String template(String key, String language) {
        return messageBuilder.getMessage(key, language, Map.of());
    }

    private String star(CardEntry entry) {
        return entry.indicators() != null && entry.indicators().starred() ? STAR : "";
    }

    private String hourText(int hour) {
        return String.format("%02d:00", hour);
    }

    private void validateCount(int count, String what) {
        if (count == 0) {
            throw new InvalidCardInputException(String.format("No %s to render", what));
        }
        if (count > MAX_LIST_ROWS) {
            throw new InvalidCardInputException(
                    String.format("Too many %s: %d (max %d)", what, count, MAX_LIST_ROWS));
        }
    }

    /**
     * 코드 포인트 기준으로 자르고 말줄임표를 붙인다 (이모지가 깨지지 않도록).
     */
    static String truncate(String text, int limit) {
        if (text == null) {
            return null;
        }
        int length = text.codePointCount(0, text.length());
        if (length <= limit) {
            return text;
        }
        int end = text.offsetByCodePoints(0, limit - 1);
        return text.substring(0, end).stripTrailing() + ELLIPSIS;
    }

    private record CardEntry(SlotSuggestion slot, SlotIndicators indicators) {
    }
}

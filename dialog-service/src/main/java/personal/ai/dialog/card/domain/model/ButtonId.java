package personal.ai.dialog.card.domain.model;

import personal.ai.dialog.card.domain.exception.InvalidButtonIdException;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 복합 버튼 ID
 * 형식: {action}|{part}|{part}... (각 파트는 URL 인코딩)
 * <p>
 * slot/confirm: slotId, yyyy-MM-dd, HHmm, masterId
 * change: slotId / choice: choiceId / popular: dayOfWeek(1-7), hour
 * 탭 이벤트만으로 슬롯을 식별할 수 있다 (추가 조회 불필요).
 */
public record ButtonId(ButtonAction action, List<String> parts) {

    /** WhatsApp 리스트 row id 최대 길이 */
    public static final int MAX_LENGTH = 200;
    private static final String SEPARATOR = "|";
    private static final DateTimeFormatter COMPACT_TIME = DateTimeFormatter.ofPattern("HHmm");

    public ButtonId {
        parts = List.copyOf(parts);
    }

    public static ButtonId slot(SlotSuggestion slot) {
        return slotScoped(ButtonAction.SLOT, slot);
    }

    public static ButtonId confirm(SlotSuggestion slot) {
        return slotScoped(ButtonAction.CONFIRM, slot);
    }

    public static ButtonId change(String slotId) {
        return new ButtonId(ButtonAction.CHANGE, List.of(slotId));
    }

    public static ButtonId choice(String choiceId) {
        return new ButtonId(ButtonAction.CHOICE, List.of(choiceId));
    }

    public static ButtonId popular(DayOfWeek dayOfWeek, int hour) {
        return new ButtonId(ButtonAction.POPULAR, List.of(String.valueOf(dayOfWeek.getValue()), String.valueOf(hour)));
    }

    private static ButtonId slotScoped(ButtonAction action, SlotSuggestion slot) {
        return new ButtonId(action, Arrays.asList(
                slot.id(),
                slot.date().toString(),
                COMPACT_TIME.format(slot.startTime()),
                slot.masterId() == null ? "" : slot.masterId()));
    }

    public String encode() {
        StringBuilder sb = new StringBuilder(action.prefix());
        for (String part : parts) {
            sb.append(SEPARATOR).append(URLEncoder.encode(part == null ? "" : part, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    /**
     * encode()의 역연산
     *
     * @throws InvalidButtonIdException 알 수 없는 prefix, 파트 개수 불일치, 잘못된 날짜/시각
     */
    public static ButtonId parse(String raw) {
        if (raw == null || raw.isBlank() || raw.length() > MAX_LENGTH) {
            throw new InvalidButtonIdException(raw);
        }
        String[] tokens = raw.split("\\|", -1);
        ButtonAction action = ButtonAction.fromPrefix(tokens[0])
                .orElseThrow(() -> new InvalidButtonIdException(raw));
        if (tokens.length - 1 != action.partCount()) {
            throw new InvalidButtonIdException(raw);
        }

        List<String> parts = new ArrayList<>(action.partCount());
        for (int i = 1; i < tokens.length; i++) {
            try {
                parts.add(URLDecoder.decode(tokens[i], StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e) {
                throw new InvalidButtonIdException(raw);
            }
        }
        ButtonId id = new ButtonId(action, parts);
        id.validate(raw);
        return id;
    }

    private void validate(String raw) {
        try {
            switch (action) {
                case SLOT, CONFIRM -> {
                    if (slotId().isBlank()) {
                        throw new InvalidButtonIdException(raw);
                    }
                    date();
                    startTime();
                }
                case POPULAR -> {
                    dayOfWeek();
                    int hour = hour();
                    if (hour < 0 || hour > 23) {
                        throw new InvalidButtonIdException(raw);
                    }
                }
                default -> {
                    if (parts.get(0).isBlank()) {
                        throw new InvalidButtonIdException(raw);
                    }
                }
            }
        } catch (DateTimeException | NumberFormatException e) {
            throw new InvalidButtonIdException(raw);
        }
    }

    public String slotId() {
        return parts.get(0);
    }

    public LocalDate date() {
        return LocalDate.parse(parts.get(1));
    }

    public LocalTime startTime() {
        return LocalTime.parse(parts.get(2), COMPACT_TIME);
    }

    public String masterId() {
        String masterId = parts.get(3);
        return masterId.isEmpty() ? null : masterId;
    }

    public String choiceId() {
        return parts.get(0);
    }

    public DayOfWeek dayOfWeek() {
        return DayOfWeek.of(Integer.parseInt(parts.get(0)));
    }

    public int hour() {
        return Integer.parseInt(parts.get(1));
    }
}

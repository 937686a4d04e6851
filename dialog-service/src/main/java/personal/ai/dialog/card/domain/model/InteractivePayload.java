package personal.ai.dialog.card.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 채널 중립 인터랙티브 페이로드
 * 전송 어댑터가 채널 포맷(WhatsApp 등)으로 변환한다.
 *
 * @param type           TEXT / BUTTON / LIST
 * @param header         헤더 텍스트 (≤ 60자)
 * @param body           본문 (≤ 1024자, TEXT는 ≤ 4096자)
 * @param footer         푸터 (≤ 60자)
 * @param buttons        BUTTON 타입의 버튼 (1~3개)
 * @param listButtonText LIST 타입의 목록 열기 버튼 문구 (≤ 20자)
 * @param sections       LIST 타입의 섹션
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record InteractivePayload(
        PayloadType type,
        String header,
        String body,
        String footer,
        List<ReplyButton> buttons,
        String listButtonText,
        List<ListSection> sections
) {
    public InteractivePayload {
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public static InteractivePayload text(String body) {
        return new InteractivePayload(PayloadType.TEXT, null, body, null, List.of(), null, List.of());
    }

    public static InteractivePayload buttons(String header, String body, String footer, List<ReplyButton> buttons) {
        return new InteractivePayload(PayloadType.BUTTON, header, body, footer, buttons, null, List.of());
    }

    public static InteractivePayload list(String header, String body, String footer, String listButtonText,
                                          List<ListSection> sections) {
        return new InteractivePayload(PayloadType.LIST, header, body, footer, List.of(), listButtonText, sections);
    }

    /**
     * 카드에 노출된 모든 선택지 ID (버튼 + 목록 행)
     */
    public List<String> optionIds() {
        if (type == PayloadType.BUTTON) {
            return buttons.stream().map(ReplyButton::id).toList();
        }
        return sections.stream()
                .flatMap(section -> section.rows().stream())
                .map(ListRow::id)
                .toList();
    }
}

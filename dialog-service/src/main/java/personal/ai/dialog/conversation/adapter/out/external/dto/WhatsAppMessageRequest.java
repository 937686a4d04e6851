package personal.ai.dialog.conversation.adapter.out.external.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import personal.ai.dialog.card.domain.model.InteractivePayload;
import personal.ai.dialog.card.domain.model.ListRow;
import personal.ai.dialog.card.domain.model.ListSection;
import personal.ai.dialog.card.domain.model.PayloadType;
import personal.ai.dialog.card.domain.model.ReplyButton;

import java.util.List;

/**
 * WhatsApp Cloud API 메시지 요청 본문
 * InteractivePayload → text / interactive(button, list)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WhatsAppMessageRequest(
        @JsonProperty("messaging_product") String messagingProduct,
        @JsonProperty("recipient_type") String recipientType,
        String to,
        String type,
        Text text,
        Interactive interactive
) {
    private static final String PRODUCT = "whatsapp";
    private static final String INDIVIDUAL = "individual";

    public static WhatsAppMessageRequest of(String to, InteractivePayload payload) {
        if (payload.type() == PayloadType.TEXT) {
            return new WhatsAppMessageRequest(PRODUCT, INDIVIDUAL, to, "text",
                    new Text(payload.body(), false), null);
        }
        return new WhatsAppMessageRequest(PRODUCT, INDIVIDUAL, to, "interactive", null, Interactive.from(payload));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Text(
            String body,
            @JsonProperty("preview_url") Boolean previewUrl
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Interactive(
            String type,
            Header header,
            Body body,
            Footer footer,
            Action action
    ) {
        static Interactive from(InteractivePayload payload) {
            Header header = payload.header() == null ? null : new Header("text", payload.header());
            Footer footer = payload.footer() == null ? null : new Footer(payload.footer());
            Body body = new Body(payload.body());

            if (payload.type() == PayloadType.BUTTON) {
                List<Button> buttons = payload.buttons().stream()
                        .map(Button::from)
                        .toList();
                return new Interactive("button", header, body, footer, new Action(null, buttons, null));
            }
            List<Section> sections = payload.sections().stream()
                    .map(Section::from)
                    .toList();
            return new Interactive("list", header, body, footer,
                    new Action(payload.listButtonText(), null, sections));
        }
    }

    public record Header(String type, String text) {}

    public record Body(String text) {}

    public record Footer(String text) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Action(
            String button,
            List<Button> buttons,
            List<Section> sections
    ) {}

    public record Button(String type, Reply reply) {
        static Button from(ReplyButton button) {
            return new Button("reply", new Reply(button.id(), button.title()));
        }
    }

    public record Reply(String id, String title) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Section(String title, List<Row> rows) {
        static Section from(ListSection section) {
            return new Section(section.title(), section.rows().stream().map(Row::from).toList());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Row(String id, String title, String description) {
        static Row from(ListRow row) {
            return new Row(row.id(), row.title(), row.description());
        }
    }
}

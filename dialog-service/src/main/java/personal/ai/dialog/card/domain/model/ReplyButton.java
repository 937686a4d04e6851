package personal.ai.dialog.card.domain.model;

/**
 * Reply 버튼 (title ≤ 20자)
 */
public record ReplyButton(String id, String title) {
}

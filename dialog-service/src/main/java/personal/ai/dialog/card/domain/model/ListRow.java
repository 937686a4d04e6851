package personal.ai.dialog.card.domain.model;

/**
 * 목록 행 (title ≤ 24자, description ≤ 72자)
 */
public record ListRow(String id, String title, String description) {
}

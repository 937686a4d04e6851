package personal.ai.dialog.message.domain.model;

/**
 * 선택지 하나 (ID + 현지화된 라벨)
 */
public record ChoiceOption(String id, String label) {
}

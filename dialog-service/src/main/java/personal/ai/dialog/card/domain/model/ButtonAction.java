package personal.ai.dialog.card.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 버튼 ID의 엔티티 타입 prefix와 파트 개수
 */
public enum ButtonAction {
    SLOT("slot", 4),
    CONFIRM("confirm", 4),
    CHANGE("change", 1),
    CHOICE("choice", 1),
    POPULAR("popular", 2);

    private final String prefix;
    private final int partCount;

    ButtonAction(String prefix, int partCount) {
        this.prefix = prefix;
        this.partCount = partCount;
    }

    public String prefix() {
        return prefix;
    }

    public int partCount() {
        return partCount;
    }

    public static Optional<ButtonAction> fromPrefix(String prefix) {
        return Arrays.stream(values())
                .filter(action -> action.prefix.equals(prefix))
                .findFirst();
    }
}

package personal.ai.dialog.message.domain.model;

import java.util.Locale;

/**
 * 비즈니스 선호 말투
 */
public enum Tone {
    FORMAL,
    CASUAL,
    FRIENDLY;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}

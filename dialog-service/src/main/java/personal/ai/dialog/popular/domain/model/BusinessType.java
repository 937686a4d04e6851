package personal.ai.dialog.popular.domain.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * 업종
 */
public enum BusinessType {
    BEAUTY_SALON,
    BARBERSHOP,
    SPA,
    NAIL_SALON,
    GENERIC;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 알 수 없는 코드는 GENERIC
     */
    public static BusinessType fromCode(String code) {
        if (code == null) {
            return GENERIC;
        }
        return Arrays.stream(values())
                .filter(type -> type.code().equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElse(GENERIC);
    }
}

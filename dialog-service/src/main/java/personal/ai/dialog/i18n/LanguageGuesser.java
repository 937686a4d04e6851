package personal.ai.dialog.i18n;

import java.util.Locale;

/**
 * 문자 체계 기반 언어 추정
 * 상위 Intent 파서가 언어를 주지 않은 경우와 대화 이력 복구 시에만 사용한다.
 */
public final class LanguageGuesser {

    private LanguageGuesser() {
    }

    public static String guess(String text) {
        if (text == null || text.isBlank()) {
            return LanguageProfiles.DEFAULT_LANGUAGE;
        }
        int cyrillic = 0;
        int hebrew = 0;
        for (int i = 0; i < text.length(); i++) {
            Character.UnicodeBlock block = Character.UnicodeBlock.of(text.charAt(i));
            if (block == Character.UnicodeBlock.CYRILLIC) {
                cyrillic++;
            } else if (block == Character.UnicodeBlock.HEBREW) {
                hebrew++;
            }
        }
        if (cyrillic > 0 || hebrew > 0) {
            return cyrillic >= hebrew ? "ru" : "he";
        }

        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.matches(".*[ãõç].*") || lower.contains("você") || lower.contains("obrigad")
                || lower.contains("amanhã")) {
            return "pt";
        }
        if (lower.matches(".*[ñ¿¡].*") || lower.contains("hola") || lower.contains("gracias")
                || lower.contains("mañana") || lower.contains("quiero")) {
            return "es";
        }
        return LanguageProfiles.DEFAULT_LANGUAGE;
    }
}

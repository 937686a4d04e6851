package personal.ai.dialog.i18n;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 지원 언어 테이블 (ru, en, es, pt, he)
 * 지원하지 않는 언어 코드는 기본 언어(en)로 fallback 한다.
 */
public final class LanguageProfiles {

    public static final String DEFAULT_LANGUAGE = "en";

    private static final LanguageProfile ENGLISH = new LanguageProfile(
            "en", Locale.forLanguageTag("en-US"), "USD", PluralRule.SIMPLE,
            UnitForms.of("minute", "minutes"), UnitForms.of("hour", "hours"), UnitForms.of("day", "days"),
            "earlier", "later", "exact time",
            "Today", "Tomorrow", "Yesterday", "Day after tomorrow",
            "In %d %s", "%d %s earlier", "h", "min");

    private static final LanguageProfile RUSSIAN = new LanguageProfile(
            "ru", Locale.forLanguageTag("ru-RU"), "RUB", PluralRule.SLAVIC,
            new UnitForms("минута", "минуты", "минут"), new UnitForms("час", "часа", "часов"),
            new UnitForms("день", "дня", "дней"),
            "раньше", "позже", "точное время",
            "Сегодня", "Завтра", "Вчера", "Послезавтра",
            "Через %d %s", "На %d %s раньше", "ч", "мин");

    private static final LanguageProfile SPANISH = new LanguageProfile(
            "es", Locale.forLanguageTag("es-ES"), "EUR", PluralRule.SIMPLE,
            UnitForms.of("minuto", "minutos"), UnitForms.of("hora", "horas"), UnitForms.of("día", "días"),
            "antes", "después", "hora exacta",
            "Hoy", "Mañana", "Ayer", "Pasado mañana",
            "En %d %s", "%d %s antes", "h", "min");

    private static final LanguageProfile PORTUGUESE = new LanguageProfile(
            "pt", Locale.forLanguageTag("pt-BR"), "BRL", PluralRule.SIMPLE,
            UnitForms.of("minuto", "minutos"), UnitForms.of("hora", "horas"), UnitForms.of("dia", "dias"),
            "antes", "depois", "horário exato",
            "Hoje", "Amanhã", "Ontem", "Depois de amanhã",
            "Em %d %s", "%d %s antes", "h", "min");

    private static final LanguageProfile HEBREW = new LanguageProfile(
            "he", Locale.forLanguageTag("he-IL"), "ILS", PluralRule.SIMPLE,
            UnitForms.of("דקה", "דקות"), UnitForms.of("שעה", "שעות"), UnitForms.of("יום", "ימים"),
            "קודם", "אחרי", "בדיוק בזמן",
            "היום", "מחר", "אתמול", "מחרתיים",
            "בעוד %d %s", "%d %s קודם", "ש׳", "דק׳");

    private static final Map<String, LanguageProfile> PROFILES = Map.of(
            "en", ENGLISH,
            "ru", RUSSIAN,
            "es", SPANISH,
            "pt", PORTUGUESE,
            "he", HEBREW);

    private static final List<String> SUPPORTED = List.of("ru", "en", "es", "pt", "he");

    private LanguageProfiles() {
    }

    public static LanguageProfile of(String languageCode) {
        if (languageCode == null) {
            return ENGLISH;
        }
        return PROFILES.getOrDefault(languageCode.toLowerCase(Locale.ROOT), ENGLISH);
    }

    public static boolean isSupported(String languageCode) {
        return languageCode != null && PROFILES.containsKey(languageCode.toLowerCase(Locale.ROOT));
    }

    /**
     * 지원 언어면 그대로, 아니면 기본 언어 코드
     */
    public static String normalize(String languageCode) {
        return of(languageCode).code();
    }

    public static List<String> supportedLanguages() {
        return SUPPORTED;
    }
}

package personal.ai.dialog.i18n;

/**
 * 단위 명사의 복수형 (minute, hour, day)
 */
public record UnitForms(String one, String few, String many) {

    public static UnitForms of(String one, String other) {
        return new UnitForms(one, other, other);
    }

    public String select(PluralRule rule, int n) {
        return switch (rule.formIndex(n)) {
            case 0 -> one;
            case 1 -> few;
            default -> many;
        };
    }
}

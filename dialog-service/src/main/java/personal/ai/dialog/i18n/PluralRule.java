package personal.ai.dialog.i18n;

/**
 * 복수형 규칙
 * SIMPLE: one / other (en, es, pt, he)
 * SLAVIC: one / few / many (ru)
 */
public enum PluralRule {
    SIMPLE {
        @Override
        public int formIndex(int n) {
            return Math.abs(n) == 1 ? 0 : 2;
        }
    },
    SLAVIC {
        @Override
        public int formIndex(int n) {
            int abs = Math.abs(n);
            int mod10 = abs % 10;
            int mod100 = abs % 100;
            if (mod100 >= 11 && mod100 <= 14) {
                return 2;
            }
            if (mod10 == 1) {
                return 0;
            }
            if (mod10 >= 2 && mod10 <= 4) {
                return 1;
            }
            return 2;
        }
    };

    /**
     * @return 0 = one, 1 = few, 2 = many
     */
    public abstract int formIndex(int n);
}

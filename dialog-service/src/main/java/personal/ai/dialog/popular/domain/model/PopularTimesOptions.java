package personal.ai.dialog.popular.domain.model;

/**
 * 인기 시간대 조회 옵션
 * null 수치는 설정값(dialog.popular-times.*)으로 채워진다.
 *
 * @param masterId 지정 시 캐시를 우회한다
 * @param useCache false면 항상 이력에서 다시 계산한다
 */
public record PopularTimesOptions(
        String serviceId,
        String masterId,
        Integer limit,
        Double minConfidence,
        Integer minBookings,
        Integer lookbackDays,
        boolean includeCancelled,
        boolean useCache
) {
    public static PopularTimesOptions forService(String serviceId) {
        return new PopularTimesOptions(serviceId, null, null, null, null, null, false, true);
    }

    public static PopularTimesOptions defaults() {
        return forService(null);
    }

    public PopularTimesOptions withoutCache() {
        return new PopularTimesOptions(serviceId, masterId, limit, minConfidence, minBookings, lookbackDays,
                includeCancelled, false);
    }
}

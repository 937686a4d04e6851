package personal.ai.dialog.suggestion.domain.model;

/**
 * 슬롯 점수 상세
 *
 * @param masterBonus       담당자 일치 보너스 (가중치 미적용, 0 또는 1000)
 * @param timeBonus         시간 구간 보너스 (500/300/100/0)
 * @param dateBonus         날짜 구간 보너스 (300/180/60/0)
 * @param timeProximity     정규화된 시간 근접도 (0~1)
 * @param dateProximity     정규화된 날짜 근접도 (0~1)
 * @param weightedTime      가중 시간 점수
 * @param weightedDate      가중 날짜 점수
 * @param weightedMaster    가중 담당자 점수
 * @param total             최종 점수
 * @param minutesFromTarget 요청 시각과의 차이(분), 요청 시각이 없으면 null
 * @param daysFromTarget    요청 날짜와의 차이(일), 요청 날짜가 없으면 null
 */
public record ScoreBreakdown(
        int masterBonus,
        int timeBonus,
        int dateBonus,
        double timeProximity,
        double dateProximity,
        double weightedTime,
        double weightedDate,
        double weightedMaster,
        double total,
        Integer minutesFromTarget,
        Integer daysFromTarget
) {
    public int absoluteMinutes() {
        return minutesFromTarget == null ? 0 : Math.abs(minutesFromTarget);
    }

    public int absoluteDays() {
        return daysFromTarget == null ? 0 : Math.abs(daysFromTarget);
    }
}

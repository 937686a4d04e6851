package personal.ai.dialog.popular.domain.model;

import java.time.DayOfWeek;

/**
 * 요일/시간 버킷별 가중 점수
 *
 * @param count      버킷에 속한 예약 수 (가중치 미적용)
 * @param score      최신성 가중치 합
 * @param confidence Wilson score 기반 신뢰도 (0~1)
 */
public record WeightedScore(
        DayOfWeek dayOfWeek,
        int hour,
        int count,
        double score,
        double confidence
) {
}

package personal.ai.dialog.suggestion.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * 다중 요소 랭킹 가중치
 * 정규화된(0~1) 근접도 값에 곱해진다. 0이면 해당 요소는 점수에 기여하지 않는다.
 */
public record RankingWeights(double date, double time, double master) {

    public static final RankingWeights DEFAULT = new RankingWeights(0.3, 0.5, 0.2);

    public RankingWeights {
        if (date < 0 || time < 0 || master < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Ranking weights cannot be negative");
        }
    }
}

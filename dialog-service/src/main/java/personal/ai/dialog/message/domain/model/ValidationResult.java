package personal.ai.dialog.message.domain.model;

import java.util.List;

/**
 * 템플릿 파라미터 검증 결과
 *
 * @param valid   필수 파라미터가 모두 존재하는지
 * @param missing 누락(또는 공백)된 파라미터
 * @param extra   템플릿이 사용하지 않는 파라미터
 */
public record ValidationResult(boolean valid, List<String> missing, List<String> extra) {
}

package personal.ai.dialog.message.domain.exception;

import lombok.Getter;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.util.List;

/**
 * 템플릿 필수 파라미터 누락 시 발생
 * 일부만 채워진 메시지는 절대 반환하지 않는다.
 */
@Getter
public class MissingTemplateParameterException extends BusinessException {

    private final String templateKey;
    private final List<String> missingParameters;

    public MissingTemplateParameterException(String templateKey, List<String> missingParameters) {
        super(ErrorCode.MISSING_TEMPLATE_PARAMETER,
                String.format("Missing template parameters: key=%s, missing=%s", templateKey, missingParameters));
        this.templateKey = templateKey;
        this.missingParameters = List.copyOf(missingParameters);
    }
}

package personal.ai.dialog.message.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

public class TemplateNotFoundException extends BusinessException {
    public TemplateNotFoundException(String key) {
        super(ErrorCode.TEMPLATE_NOT_FOUND, String.format("Template not found: key=%s", key));
    }
}

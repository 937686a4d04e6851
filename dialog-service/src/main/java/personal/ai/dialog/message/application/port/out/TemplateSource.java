package personal.ai.dialog.message.application.port.out;

import personal.ai.dialog.message.domain.model.TemplateCatalog;

/**
 * Template Source (Output Port)
 * 메시지 템플릿 로딩 인터페이스
 */
public interface TemplateSource {

    TemplateCatalog load();
}

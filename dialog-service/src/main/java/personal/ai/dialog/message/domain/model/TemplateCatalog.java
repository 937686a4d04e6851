package personal.ai.dialog.message.domain.model;

import java.util.Map;

/**
 * 전체 템플릿 묶음
 */
public record TemplateCatalog(
        Map<String, MessageTemplate> templates,
        Map<String, ChoiceLabelTemplate> choiceLabels
) {
    public TemplateCatalog {
        templates = Map.copyOf(templates);
        choiceLabels = Map.copyOf(choiceLabels);
    }
}

package personal.ai.dialog.message.domain.model;

import java.util.List;
import java.util.Map;

/**
 * 선택지 버튼 라벨 템플릿
 */
public record ChoiceLabelTemplate(String id, List<String> parameters, Map<String, String> texts) {
    public ChoiceLabelTemplate {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        texts = Map.copyOf(texts);
    }
}

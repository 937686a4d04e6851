package personal.ai.dialog.message.adapter.out.template;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.dialog.message.application.port.out.TemplateSource;
import personal.ai.dialog.message.domain.model.ChoiceLabelTemplate;
import personal.ai.dialog.message.domain.model.EmotionIndicator;
import personal.ai.dialog.message.domain.model.EmotionIntensity;
import personal.ai.dialog.message.domain.model.EmotionType;
import personal.ai.dialog.message.domain.model.MessageTemplate;
import personal.ai.dialog.message.domain.model.TemplateCatalog;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classpath JSON Template Source
 * messages/templates.json을 읽어 TemplateCatalog로 변환한다.
 */
@Slf4j
@Component
public class ClasspathJsonTemplateSource implements TemplateSource {

    private final ObjectMapper objectMapper;
    private final String location;

    public ClasspathJsonTemplateSource(ObjectMapper objectMapper,
                                       @Value("${dialog.messages.template-location:messages/templates.json}") String location) {
        this.objectMapper = objectMapper;
        this.location = location;
    }

    @Override
    public TemplateCatalog load() {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            TemplateDocument document = objectMapper.readValue(in, TemplateDocument.class);

            Map<String, MessageTemplate> templates = new LinkedHashMap<>();
            document.templates().forEach((key, entry) -> {
                checkLineLimit(key, entry);
                templates.put(key, new MessageTemplate(
                        key,
                        entry.parameters(),
                        new EmotionIndicator(
                                EmotionType.valueOf(entry.emotion()),
                                entry.emoji(),
                                EmotionIntensity.valueOf(entry.intensity())),
                        entry.maxLines(),
                        entry.text(),
                        entry.variations()));
            });

            Map<String, ChoiceLabelTemplate> labels = new LinkedHashMap<>();
            document.choiceLabels().forEach((id, entry) ->
                    labels.put(id, new ChoiceLabelTemplate(id, entry.parameters(), entry.text())));

            log.info("Message templates loaded: location={}, templates={}, choiceLabels={}",
                    location, templates.size(), labels.size());
            return new TemplateCatalog(templates, labels);
        } catch (IOException e) {
            log.error("Failed to load message templates: location={}", location, e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to load message templates", e);
        }
    }

    // 문구가 maxLines를 넘으면 기동 실패
    private void checkLineLimit(String key, TemplateEntry entry) {
        List<String> texts = new ArrayList<>(entry.text().values());
        if (entry.variations() != null) {
            entry.variations().values().forEach(byLanguage -> texts.addAll(byLanguage.values()));
        }
        for (String text : texts) {
            int lines = text.split("\n", -1).length;
            if (lines > entry.maxLines()) {
                throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, String.format(
                        "Template exceeds maxLines: key=%s, lines=%d, maxLines=%d", key, lines, entry.maxLines()));
            }
        }
    }

    /**
     * templates.json 구조
     */
    public record TemplateDocument(
            Map<String, TemplateEntry> templates,
            Map<String, LabelEntry> choiceLabels) {
    }

    public record TemplateEntry(
            List<String> parameters,
            String emotion,
            String emoji,
            String intensity,
            int maxLines,
            Map<String, String> text,
            Map<String, Map<String, String>> variations) {
    }

    public record LabelEntry(
            List<String> parameters,
            Map<String, String> text) {
    }
}

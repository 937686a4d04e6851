package personal.ai.dialog.message.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.dialog.i18n.LanguageProfiles;
import personal.ai.dialog.message.application.port.in.MessageBuilderUseCase;
import personal.ai.dialog.message.application.port.out.TemplateSource;
import personal.ai.dialog.message.domain.exception.MissingTemplateParameterException;
import personal.ai.dialog.message.domain.exception.TemplateNotFoundException;
import personal.ai.dialog.message.domain.model.BusinessContext;
import personal.ai.dialog.message.domain.model.ChoiceCard;
import personal.ai.dialog.message.domain.model.ChoiceLabelTemplate;
import personal.ai.dialog.message.domain.model.ChoiceOption;
import personal.ai.dialog.message.domain.model.ChoiceScenario;
import personal.ai.dialog.message.domain.model.EmotionIndicator;
import personal.ai.dialog.message.domain.model.MessageTemplate;
import personal.ai.dialog.message.domain.model.TemplateCatalog;
import personal.ai.dialog.message.domain.model.ValidationResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Message Builder Service
 * 템플릿 기반 다국어 메시지 생성
 * <p>
 * 템플릿은 생성 시 1회 로딩되어 이후 읽기 전용으로 공유된다.
 * 필수 파라미터가 하나라도 빠지면 MissingTemplateParameterException (부분 치환 결과 반환 금지).
 */
@Slf4j
@Service
public class MessageBuilderService implements MessageBuilderUseCase {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(\\w+)\\s*}}");
    private static final String BUSINESS_NAME_PARAM = "businessName";

    private final TemplateCatalog catalog;

    public MessageBuilderService(TemplateSource templateSource) {
        this.catalog = templateSource.load();
    }

    @Override
    public String getMessage(String key, String language, Map<String, ?> params) {
        MessageTemplate template = findTemplate(key);
        String lang = LanguageProfiles.normalize(language);
        String text = template.text(lang)
                .or(() -> template.text(LanguageProfiles.DEFAULT_LANGUAGE))
                .orElseThrow(() -> new TemplateNotFoundException(key));
        return formatWithLimits(render(key, template.parameters(), text, params), template.maxLines());
    }

    @Override
    public String getContextualMessage(String key, String language, BusinessContext context) {
        MessageTemplate template = findTemplate(key);
        String lang = LanguageProfiles.normalize(language);

        Map<String, Object> params = new HashMap<>(context.params());
        if (context.businessName() != null) {
            params.put(BUSINESS_NAME_PARAM, context.businessName());
        }

        String text = findVariation(template, context, lang)
                .or(() -> template.text(lang))
                .or(() -> template.text(LanguageProfiles.DEFAULT_LANGUAGE))
                .orElseThrow(() -> new TemplateNotFoundException(key));
        return formatWithLimits(render(key, template.parameters(), text, params), template.maxLines());
    }

    @Override
    public ChoiceCard getChoiceCard(ChoiceScenario scenario, String language, Map<String, ?> context) {
        String lang = LanguageProfiles.normalize(language);
        String message = getMessage(scenario.messageKey(), lang, context);

        List<ChoiceOption> options = new ArrayList<>();
        for (String choiceId : scenario.choiceIds()) {
            options.add(new ChoiceOption(choiceId, getChoiceLabel(choiceId, lang, context)));
        }
        log.debug("Choice card built: scenario={}, language={}, options={}", scenario.code(), lang, options.size());
        return new ChoiceCard(scenario, lang, message, options);
    }

    @Override
    public String getChoiceLabel(String choiceId, String language, Map<String, ?> params) {
        ChoiceLabelTemplate label = catalog.choiceLabels().get(choiceId);
        if (label == null) {
            throw new TemplateNotFoundException(choiceId);
        }
        String lang = LanguageProfiles.normalize(language);
        String text = Optional.ofNullable(label.texts().get(lang))
                .or(() -> Optional.ofNullable(label.texts().get(LanguageProfiles.DEFAULT_LANGUAGE)))
                .orElseThrow(() -> new TemplateNotFoundException(choiceId));
        return render(choiceId, label.parameters(), text, params);
    }

    @Override
    public ValidationResult validateParameters(String key, Map<String, ?> params) {
        MessageTemplate template = findTemplate(key);
        Map<String, ?> safeParams = params == null ? Map.of() : params;

        List<String> missing = missingParameters(template.parameters(), safeParams);
        List<String> extra = safeParams.keySet().stream()
                .filter(name -> !template.parameters().contains(name))
                .sorted()
                .toList();
        return new ValidationResult(missing.isEmpty(), missing, extra);
    }

    @Override
    public EmotionIndicator getEmotion(String key) {
        return findTemplate(key).emotion();
    }

    /**
     * 줄 단위로만 자른다. 첫 줄은 항상 유지된다.
     */
    @Override
    public String formatWithLimits(String message, int maxLines) {
        if (message == null) {
            return "";
        }
        String[] lines = message.split("\n", -1);
        int limit = Math.max(1, maxLines);
        if (lines.length <= limit) {
            return message;
        }
        int end = limit;
        while (end > 1 && lines[end - 1].isBlank()) {
            end--;
        }
        return String.join("\n", Arrays.copyOfRange(lines, 0, end));
    }

    @Override
    public String getProximityText(int diffMinutes, String language) {
        return LanguageProfiles.of(language).formatTimeDifference(diffMinutes);
    }

    @Override
    public String getDateProximityText(int dayDiff, String language) {
        return LanguageProfiles.of(language).formatDayDifference(dayDiff);
    }

    @Override
    public List<String> getSupportedLanguages() {
        return LanguageProfiles.supportedLanguages();
    }

    @Override
    public List<String> getAvailableMessages() {
        return catalog.templates().keySet().stream().sorted().toList();
    }

    private MessageTemplate findTemplate(String key) {
        MessageTemplate template = catalog.templates().get(key);
        if (template == null) {
            throw new TemplateNotFoundException(key);
        }
        return template;
    }

    private Optional<String> findVariation(MessageTemplate template, BusinessContext context, String language) {
        if (context.businessType() == null) {
            return Optional.empty();
        }
        if (context.tone() != null) {
            Optional<String> toned = template.variation(context.businessType() + "." + context.tone().code(), language);
            if (toned.isPresent()) {
                return toned;
            }
        }
        return template.variation(context.businessType(), language);
    }

    private String render(String key, List<String> required, String text, Map<String, ?> params) {
        Map<String, ?> safeParams = params == null ? Map.of() : params;
        List<String> missing = missingParameters(required, safeParams);
        if (!missing.isEmpty()) {
            log.warn("Template parameters missing: key={}, missing={}", key, missing);
            throw new MissingTemplateParameterException(key, missing);
        }

        Set<String> unresolved = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            Object value = safeParams.get(name);
            if (value == null || String.valueOf(value).isBlank()) {
                unresolved.add(name);
                matcher.appendReplacement(result, "");
            } else {
                matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(value)));
            }
        }
        matcher.appendTail(result);

        if (!unresolved.isEmpty()) {
            log.warn("Template placeholders unresolved: key={}, missing={}", key, unresolved);
            throw new MissingTemplateParameterException(key, List.copyOf(unresolved));
        }
        return result.toString();
    }

    private List<String> missingParameters(List<String> required, Map<String, ?> params) {
        return required.stream()
                .filter(name -> {
                    Object value = params.get(name);
                    return value == null || String.valueOf(value).isBlank();
                })
                .toList();
    }
}

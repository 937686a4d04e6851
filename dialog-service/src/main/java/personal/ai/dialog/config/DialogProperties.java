package personal.ai.dialog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Dialog 설정 Properties
 * application.yml의 dialog.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "dialog")
public record DialogProperties(
        Session session,
        PopularTimes popularTimes,
        Messages messages,
        Conversation conversation,
        String zone
) {
    public DialogProperties {
        if (zone == null || zone.isBlank()) {
            zone = "UTC";
        }
    }

    public record Session(
            long defaultTtlSeconds,
            long maxTtlSeconds,
            long extensionSeconds,
            int maxChoices,
            long cleanupIntervalMs
    ) {}

    public record PopularTimes(
            long cacheTtlSeconds,
            int lookbackDays,
            int minBookings,
            double minConfidence,
            int limit,
            long warmupIntervalMs,
            List<String> warmupSalonIds
    ) {
        public PopularTimes {
            warmupSalonIds = warmupSalonIds == null ? List.of() : List.copyOf(warmupSalonIds);
        }
    }

    public record Messages(
            String defaultLanguage,
            String templateLocation
    ) {}

    public record Conversation(
            int searchDays,
            int maxAlternatives,
            int highlightLimit,
            String defaultBusinessType,
            int historyLimit
    ) {}
}

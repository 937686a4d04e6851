package personal.ai.dialog.session.domain.model;

import java.time.Instant;

public record SessionMetadata(
        boolean exists,
        long ttlSeconds,
        ConversationState state,
        Instant createdAt,
        Instant lastInteractionAt,
        int choiceCount
) {
}

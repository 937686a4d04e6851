package personal.ai.dialog.session.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.dialog.config.DialogProperties;
import personal.ai.dialog.session.application.port.in.SessionContextUseCase;
import personal.ai.dialog.session.application.port.out.MessageHistoryReader;
import personal.ai.dialog.session.application.port.out.SessionContextRepository;
import personal.ai.dialog.session.domain.model.BookingContext;
import personal.ai.dialog.session.domain.model.ChoiceRecord;
import personal.ai.dialog.session.domain.model.ConversationState;
import personal.ai.dialog.session.domain.model.SessionMetadata;
import personal.ai.dialog.session.domain.model.TransportMessage;
import personal.ai.dialog.session.domain.service.ConversationHistoryReplayer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Session Context Service
 * 세션 TTL과 hard cap(생성 시점 기준)을 관리한다.
 * <p>
 * get → 로직 → save 는 원자적이지 않다 (같은 세션은 last-write-wins).
 */
@Slf4j
@Service
public class SessionContextService implements SessionContextUseCase {

    private final SessionContextRepository sessionContextRepository;
    private final MessageHistoryReader messageHistoryReader;
    private final ConversationHistoryReplayer historyReplayer;
    private final DialogProperties.Session config;
    private final DialogProperties.Conversation conversationConfig;
    private final Clock clock;

    public SessionContextService(SessionContextRepository sessionContextRepository,
                                 MessageHistoryReader messageHistoryReader,
                                 ConversationHistoryReplayer historyReplayer,
                                 DialogProperties properties,
                                 Clock clock) {
        this.sessionContextRepository = sessionContextRepository;
        this.messageHistoryReader = messageHistoryReader;
        this.historyReplayer = historyReplayer;
        this.config = properties.session();
        this.conversationConfig = properties.conversation();
        this.clock = clock;
    }

    @Override
    public boolean save(String sessionId, BookingContext context) {
        if (context == null || !context.sessionId().equals(sessionId)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Session ID mismatch: sessionId=%s", sessionId));
        }

        Instant now = clock.instant();
        long untilCap = context.secondsUntilHardCap(maxLifetime(), now);
        if (untilCap <= 0) {
            sessionContextRepository.delete(sessionId);
            log.info("Session reached max lifetime, deleted: sessionId={}, createdAt={}", sessionId, context.createdAt());
            return false;
        }

        long ttl = Math.min(config.defaultTtlSeconds(), untilCap);
        sessionContextRepository.save(context, Duration.ofSeconds(ttl));
        log.debug("Session saved: sessionId={}, state={}, ttl={}s", sessionId, context.state().code(), ttl);
        return true;
    }

    @Override
    public Optional<BookingContext> get(String sessionId) {
        Optional<BookingContext> found = sessionContextRepository.find(sessionId);
        if (found.isPresent() && found.get().isExpired(maxLifetime(), clock.instant())) {
            sessionContextRepository.delete(sessionId);
            log.info("Session expired by max lifetime: sessionId={}", sessionId);
            return Optional.empty();
        }
        return found;
    }

    @Override
    public Optional<BookingContext> getByCustomer(String customerId, String salonId) {
        return get(BookingContext.sessionIdOf(customerId, salonId));
    }

    @Override
    public boolean extend(String sessionId, long seconds) {
        if (seconds <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Extension must be positive: seconds=%d", seconds));
        }
        Optional<BookingContext> context = get(sessionId);
        if (context.isEmpty()) {
            return false;
        }

        long untilCap = context.get().secondsUntilHardCap(maxLifetime(), clock.instant());
        long newTtl = sessionContextRepository.extend(sessionId, seconds, untilCap);
        if (newTtl == SessionContextRepository.KEY_NOT_FOUND) {
            return false;
        }
        if (newTtl == 0) {
            log.info("Session reached max lifetime on extend, deleted: sessionId={}", sessionId);
            return false;
        }
        log.debug("Session extended: sessionId={}, requested={}s, ttl={}s", sessionId, seconds, newTtl);
        return true;
    }

    @Override
    public boolean extend(String sessionId) {
        return extend(sessionId, config.extensionSeconds());
    }

    @Override
    public Optional<BookingContext> updateState(String sessionId, ConversationState state) {
        Optional<BookingContext> current = get(sessionId);
        if (current.isEmpty()) {
            return Optional.empty();
        }

        BookingContext updated = current.get().withState(state, clock.instant());
        if (state.isTerminal()) {
            sessionContextRepository.delete(sessionId);
            log.info("Session finished: sessionId={}, state={}", sessionId, state.code());
            return Optional.of(updated);
        }

        log.info("Session state changed: sessionId={}, {} -> {}",
                sessionId, current.get().state().code(), state.code());
        return save(sessionId, updated) ? Optional.of(updated) : Optional.empty();
    }

    @Override
    public Optional<BookingContext> addChoice(String sessionId, ChoiceRecord choice) {
        Optional<BookingContext> current = get(sessionId);
        if (current.isEmpty()) {
            log.debug("Choice dropped, session gone: sessionId={}, choiceId={}", sessionId, choice.choiceId());
            return Optional.empty();
        }

        BookingContext updated = current.get().withChoice(choice, config.maxChoices(), clock.instant());
        return save(sessionId, updated) ? Optional.of(updated) : Optional.empty();
    }

    @Override
    public boolean delete(String sessionId) {
        boolean deleted = sessionContextRepository.delete(sessionId);
        log.debug("Session deleted: sessionId={}, deleted={}", sessionId, deleted);
        return deleted;
    }

    @Override
    public boolean exists(String sessionId) {
        return get(sessionId).isPresent();
    }

    @Override
    public Optional<SessionMetadata> getMetadata(String sessionId) {
        return get(sessionId).map(context -> new SessionMetadata(
                true,
                sessionContextRepository.ttlSeconds(sessionId),
                context.state(),
                context.createdAt(),
                context.lastInteractionAt(),
                context.choiceHistory().size()));
    }

    @Override
    public Optional<BookingContext> recoverFromHistory(String customerId, String salonId,
                                                       List<TransportMessage> messages, String languageHint) {
        Instant now = clock.instant();
        Instant oldest = now.minus(maxLifetime());
        List<TransportMessage> recent = messages == null ? List.of() : messages.stream()
                .filter(message -> message.timestamp() != null && !message.timestamp().isBefore(oldest))
                .toList();

        String businessType = conversationConfig.defaultBusinessType();
        return historyReplayer.replay(customerId, salonId, recent, languageHint, businessType,
                config.maxChoices(), now);
    }

    @Override
    public Optional<BookingContext> recoverFromHistory(String customerId, String salonId, String languageHint) {
        List<TransportMessage> messages = messageHistoryReader.findRecentMessages(customerId, salonId,
                conversationConfig.historyLimit());
        return recoverFromHistory(customerId, salonId, messages, languageHint);
    }

    /**
     * TTL이 없는 키와 읽을 수 없는 값만 삭제한다. TTL이 남은 정상 세션은 건드리지 않는다.
     */
    @Override
    public int cleanup() {
        int removed = 0;
        for (String sessionId : sessionContextRepository.findAllSessionIds()) {
            if (sessionContextRepository.deleteIfNoExpiry(sessionId)) {
                removed++;
                log.warn("Session without TTL removed: sessionId={}", sessionId);
            } else if (sessionContextRepository.deleteIfUnreadable(sessionId)) {
                removed++;
                log.warn("Unreadable session removed: sessionId={}", sessionId);
            }
        }
        return removed;
    }

    @Override
    public long getActiveCount(String salonId) {
        List<String> sessionIds = sessionContextRepository.findAllSessionIds();
        if (salonId == null) {
            return sessionIds.size();
        }
        return sessionIds.stream()
                .filter(sessionId -> salonId.equals(salonIdOf(sessionId)))
                .count();
    }

    @Override
    public List<String> getActiveSalonIds() {
        return sessionContextRepository.findAllSessionIds().stream()
                .map(this::salonIdOf)
                .filter(salonId -> !salonId.isEmpty())
                .distinct()
                .sorted()
                .toList();
    }

    // sessionId = {customerId}:{salonId}
    private String salonIdOf(String sessionId) {
        int separator = sessionId.lastIndexOf(':');
        return separator < 0 ? "" : sessionId.substring(separator + 1);
    }

    private Duration maxLifetime() {
        return Duration.ofSeconds(config.maxTtlSeconds());
    }
}

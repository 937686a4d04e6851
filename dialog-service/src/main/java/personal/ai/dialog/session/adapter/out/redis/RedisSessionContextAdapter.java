package personal.ai.dialog.session.adapter.out.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;
import personal.ai.dialog.adapter.out.redis.RedisKeyGenerator;
import personal.ai.dialog.adapter.out.redis.RedisKeyScanner;
import personal.ai.dialog.session.application.port.out.SessionContextRepository;
import personal.ai.dialog.session.domain.exception.SessionStoreUnavailableException;
import personal.ai.dialog.session.domain.model.BookingContext;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis Session Context Adapter
 * session:{customerId}:{salonId} 키에 BookingContext를 JSON으로 저장 (SET ... EX)
 * <p>
 * Redis 오류는 SessionStoreUnavailableException으로 변환하여 "세션 없음"과 구분한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisSessionContextAdapter implements SessionContextRepository {

    private final RedisTemplate<String, String> redisTemplate;
    private final RedisScript<Long> extendSessionScript;
    private final RedisScript<Long> deleteSessionIfNoExpiryScript;
    private final RedisScript<Long> deleteSessionIfEqualsScript;
    private final RedisKeyScanner keyScanner;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<BookingContext> find(String sessionId) {
        String key = RedisKeyGenerator.sessionKey(sessionId);
        String json;
        try {
            json = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            throw storeUnavailable(sessionId, e);
        }

        if (json == null) {
            log.debug("Session not found: sessionId={}", sessionId);
            return Optional.empty();
        }
        return deserialize(sessionId, json);
    }

    @Override
    public void save(BookingContext context, Duration ttl) {
        String key = RedisKeyGenerator.sessionKey(context.sessionId());
        String json;
        try {
            json = objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize session: sessionId={}", context.sessionId(), e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR,
                    String.format("Session serialization failed: sessionId=%s", context.sessionId()), e);
        }

        try {
            redisTemplate.opsForValue().set(key, json, ttl);
        } catch (DataAccessException e) {
            throw storeUnavailable(context.sessionId(), e);
        }
    }

    @Override
    public long extend(String sessionId, long seconds, long capSeconds) {
        String key = RedisKeyGenerator.sessionKey(sessionId);
        try {
            Long result = redisTemplate.execute(extendSessionScript,
                    List.of(key),
                    String.valueOf(seconds),
                    String.valueOf(capSeconds));
            return result != null ? result : KEY_NOT_FOUND;
        } catch (DataAccessException e) {
            throw storeUnavailable(sessionId, e);
        }
    }

    @Override
    public boolean delete(String sessionId) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(RedisKeyGenerator.sessionKey(sessionId)));
        } catch (DataAccessException e) {
            throw storeUnavailable(sessionId, e);
        }
    }

    @Override
    public boolean deleteIfNoExpiry(String sessionId) {
        try {
            Long deleted = redisTemplate.execute(deleteSessionIfNoExpiryScript,
                    List.of(RedisKeyGenerator.sessionKey(sessionId)));
            return deleted != null && deleted == 1L;
        } catch (DataAccessException e) {
            throw storeUnavailable(sessionId, e);
        }
    }

    @Override
    public boolean deleteIfUnreadable(String sessionId) {
        String key = RedisKeyGenerator.sessionKey(sessionId);
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null || deserialize(sessionId, json).isPresent()) {
                return false;
            }
            Long deleted = redisTemplate.execute(deleteSessionIfEqualsScript, List.of(key), json);
            return deleted != null && deleted == 1L;
        } catch (DataAccessException e) {
            throw storeUnavailable(sessionId, e);
        }
    }

    @Override
    public long ttlSeconds(String sessionId) {
        try {
            Long ttl = redisTemplate.getExpire(RedisKeyGenerator.sessionKey(sessionId));
            return ttl != null ? ttl : KEY_NOT_FOUND;
        } catch (DataAccessException e) {
            throw storeUnavailable(sessionId, e);
        }
    }

    @Override
    public List<String> findAllSessionIds() {
        try {
            return keyScanner.scan(RedisKeyGenerator.sessionPattern()).stream()
                    .map(RedisKeyGenerator::extractSessionId)
                    .toList();
        } catch (DataAccessException e) {
            throw storeUnavailable("*", e);
        }
    }

    private Optional<BookingContext> deserialize(String sessionId, String json) {
        try {
            return Optional.of(objectMapper.readValue(json, BookingContext.class));
        } catch (JsonProcessingException | BusinessException e) {
            log.warn("Unreadable session payload: sessionId={}, error={}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private SessionStoreUnavailableException storeUnavailable(String sessionId, DataAccessException e) {
        log.warn("Session store unavailable: sessionId={}, error={}", sessionId, e.getMessage());
        return new SessionStoreUnavailableException(sessionId, e);
    }
}

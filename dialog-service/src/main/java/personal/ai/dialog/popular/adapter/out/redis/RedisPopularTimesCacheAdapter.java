package personal.ai.dialog.popular.adapter.out.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;
import personal.ai.dialog.adapter.out.redis.RedisKeyGenerator;
import personal.ai.dialog.adapter.out.redis.RedisKeyScanner;
import personal.ai.dialog.popular.application.port.out.PopularTimesCache;
import personal.ai.dialog.popular.domain.model.PopularTimeSlot;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis Popular Times Cache Adapter
 * JSON 문자열로 저장. Redis 장애는 로그만 남기고 miss로 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisPopularTimesCacheAdapter implements PopularTimesCache {

    private static final TypeReference<List<PopularTimeSlot>> SLOT_LIST = new TypeReference<>() {
    };

    private final RedisTemplate<String, String> redisTemplate;
    private final RedisKeyScanner keyScanner;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<List<PopularTimeSlot>> find(String salonId, String serviceId) {
        String key = RedisKeyGenerator.popularTimesKey(salonId, serviceId);
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                log.debug("Popular times cache miss: key={}", key);
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, SLOT_LIST));
        } catch (DataAccessException e) {
            log.error("Cache GET error - key: {}, error: {}", key, e.getMessage(), e);
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable popular times cache entry, ignoring: key={}", key);
            return Optional.empty();
        }
    }

    @Override
    public void put(String salonId, String serviceId, List<PopularTimeSlot> popularTimes, Duration ttl) {
        String key = RedisKeyGenerator.popularTimesKey(salonId, serviceId);
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(popularTimes), ttl);
            log.debug("Popular times cached: key={}, size={}, ttl={}s", key, popularTimes.size(), ttl.getSeconds());
        } catch (DataAccessException e) {
            log.error("Cache PUT error - key: {}, error: {}", key, e.getMessage(), e);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize popular times: key={}", key, e);
        }
    }

    @Override
    public boolean evict(String salonId, String serviceId) {
        String key = RedisKeyGenerator.popularTimesKey(salonId, serviceId);
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key));
        } catch (DataAccessException e) {
            log.error("Cache EVICT error - key: {}, error: {}", key, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public long evictAll(String salonId) {
        String pattern = RedisKeyGenerator.popularTimesPattern(salonId);
        try {
            List<String> keys = keyScanner.scan(pattern);
            if (keys.isEmpty()) {
                return 0;
            }
            Long deleted = redisTemplate.delete(keys);
            return deleted != null ? deleted : 0;
        } catch (DataAccessException e) {
            log.error("Cache CLEAR error - pattern: {}, error: {}", pattern, e.getMessage(), e);
            return 0;
        }
    }
}

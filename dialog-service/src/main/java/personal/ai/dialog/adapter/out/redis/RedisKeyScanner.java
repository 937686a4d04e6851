package personal.ai.dialog.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * SCAN 기반 키 조회 (KEYS 명령어 금지)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisKeyScanner {

    private static final int SCAN_COUNT = 100;

    private final RedisTemplate<String, String> redisTemplate;

    public List<String> scan(String pattern) {
        List<String> keys = new ArrayList<>();

        redisTemplate.execute((RedisCallback<Object>) connection -> {
            Cursor<byte[]> cursor = null;
            try {
                ScanOptions options = ScanOptions.scanOptions()
                        .match(pattern)
                        .count(SCAN_COUNT)
                        .build();

                cursor = connection.keyCommands().scan(options);
                while (cursor.hasNext()) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            } finally {
                // Cursor 리소스 정리
                if (cursor != null) {
                    try {
                        cursor.close();
                    } catch (Exception e) {
                        log.warn("Failed to close scan cursor: pattern={}", pattern, e);
                    }
                }
            }
            return null;
        });

        log.debug("Scanned keys: pattern={}, count={}", pattern, keys.size());
        return keys;
    }
}

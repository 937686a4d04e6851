package personal.ai.dialog.adapter.out.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis Configuration
 * String Key, String(JSON) Value 기반 RedisTemplate 설정
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, String> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);
        template.setValueSerializer(stringSerializer);
        template.setHashValueSerializer(stringSerializer);

        template.afterPropertiesSet();
        return template;
    }

    /**
     * 세션 TTL 연장 (상한 적용)
     * 반환: 새 TTL(초), 0 = 상한 도달로 삭제, -2 = 세션 없음
     */
    @Bean
    public RedisScript<Long> extendSessionScript() {
        return RedisScript.of(new ClassPathResource("scripts/extend_session.lua"), Long.class);
    }

    /**
     * TTL 없는 세션 삭제. 반환: 1 = 삭제, 0 = TTL 있음 또는 키 없음
     */
    @Bean
    public RedisScript<Long> deleteSessionIfNoExpiryScript() {
        return RedisScript.of(new ClassPathResource("scripts/delete_session_if_no_expiry.lua"), Long.class);
    }

    /**
     * 읽은 값이 그대로일 때만 세션 삭제. 반환: 1 = 삭제, 0 = 그 사이 변경됨
     */
    @Bean
    public RedisScript<Long> deleteSessionIfEqualsScript() {
        return RedisScript.of(new ClassPathResource("scripts/delete_session_if_equals.lua"), Long.class);
    }
}

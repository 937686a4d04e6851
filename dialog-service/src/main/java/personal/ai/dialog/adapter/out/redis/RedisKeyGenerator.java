package personal.ai.dialog.adapter.out.redis;

/**
 * Redis Key 생성 유틸리티
 * <p>
 * Convention: {prefix}:{id}[:{suffix}]
 * - session:{customerId}:{salonId}
 * - popular:{salonId}:{serviceId|all}
 */
public final class RedisKeyGenerator {

    private static final String SESSION_PREFIX = "session:";
    private static final String POPULAR_FORMAT = "popular:%s:%s";
    private static final String POPULAR_ALL_SERVICES = "all";

    private RedisKeyGenerator() {
    }

    public static String sessionKey(String sessionId) {
        return SESSION_PREFIX + sessionId;
    }

    /**
     * session:*
     */
    public static String sessionPattern() {
        return SESSION_PREFIX + "*";
    }

    public static String extractSessionId(String key) {
        if (key.startsWith(SESSION_PREFIX)) {
            return key.substring(SESSION_PREFIX.length());
        }
        throw new IllegalArgumentException("Invalid key format: " + key);
    }

    /**
     * serviceId가 없으면 살롱 전체 집계 키
     */
    public static String popularTimesKey(String salonId, String serviceId) {
        return String.format(POPULAR_FORMAT, salonId, serviceId == null ? POPULAR_ALL_SERVICES : serviceId);
    }

    /**
     * popular:{salonId}:*
     */
    public static String popularTimesPattern(String salonId) {
        return String.format(POPULAR_FORMAT, salonId, "*");
    }
}

package personal.ai.common.dto;

/**
 * Health Check 응답 데이터
 *
 * @param redis       Redis 상태 ("UP" 또는 "DOWN")
 * @param bookingCore 예약 코어 서비스 Circuit 상태 ("UP" 또는 "DOWN")
 */
public record HealthCheckResponse(
        String redis,
        String bookingCore
) {
}

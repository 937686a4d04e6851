package personal.ai.dialog.adapter.in.web;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.ai.common.dto.ApiResponse;
import personal.ai.common.dto.HealthCheckResponse;
import personal.ai.common.health.HealthCheckService;

/**
 * Health Check API Controller
 * Redis 연결과 예약 코어 Circuit 상태를 확인한다. 항상 HTTP 200을 반환한다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    static final String BOOKING_CORE = "bookingCore";

    private final HealthCheckService healthCheckService;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        String redisStatus = healthCheckService.checkRedis();
        String bookingCoreStatus = bookingCoreStatus();
        HealthCheckResponse data = new HealthCheckResponse(redisStatus, bookingCoreStatus);

        if ("UP".equals(redisStatus) && "UP".equals(bookingCoreStatus)) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }

    // OPEN / FORCED_OPEN 만 DOWN (HALF_OPEN은 복구 시도 중)
    private String bookingCoreStatus() {
        CircuitBreaker.State state = circuitBreakerRegistry.circuitBreaker(BOOKING_CORE).getState();
        return state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN ? "DOWN" : "UP";
    }
}

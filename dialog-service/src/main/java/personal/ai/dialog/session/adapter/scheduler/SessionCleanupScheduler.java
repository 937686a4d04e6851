package personal.ai.dialog.session.adapter.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.ai.dialog.session.application.port.in.SessionContextUseCase;

/**
 * Session Cleanup Scheduler
 * TTL 만료가 기본 정리 경로이며, 이 작업은 TTL 없는 키/손상된 값만 정리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCleanupScheduler {

    private final SessionContextUseCase sessionContextUseCase;
    private final MeterRegistry meterRegistry;

    /**
     * 주기: application.yml의 dialog.session.cleanup-interval-ms
     * 기본값: 10분
     */
    @Scheduled(fixedDelayString = "${dialog.session.cleanup-interval-ms:600000}")
    public void cleanupSessions() {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            int removed = sessionContextUseCase.cleanup();

            Counter.builder("scheduler.session.cleanup.removed")
                    .description("Number of stale session keys removed")
                    .register(meterRegistry)
                    .increment(removed);

            if (removed > 0) {
                log.info("Session cleanup completed: removed={}", removed);
            } else {
                log.debug("Session cleanup completed: nothing to remove");
            }
        } catch (Exception e) {
            log.error("Session cleanup failed", e);
        } finally {
            sample.stop(Timer.builder("scheduler.session.cleanup.duration")
                    .description("Time taken to scan and clean session keys")
                    .register(meterRegistry));
        }
    }
}

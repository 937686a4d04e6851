package personal.ai.dialog.popular.adapter.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.ai.dialog.config.DialogProperties;
import personal.ai.dialog.popular.application.port.in.PopularTimesUseCase;
import personal.ai.dialog.session.application.port.in.SessionContextUseCase;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Popular Times Cache Warmup Scheduler
 * 설정된 살롱 + 활성 세션이 있는 살롱의 인기 시간대 캐시를 갱신한다.
 * 요청 경로와는 캐시 외에 공유하는 자원이 없다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PopularTimesCacheWarmupScheduler {

    private final PopularTimesUseCase popularTimesUseCase;
    private final SessionContextUseCase sessionContextUseCase;
    private final DialogProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * 주기: application.yml의 dialog.popular-times.warmup-interval-ms
     * 기본값: 30분
     */
    @Scheduled(fixedDelayString = "${dialog.popular-times.warmup-interval-ms:1800000}",
            initialDelayString = "${dialog.popular-times.warmup-initial-delay-ms:60000}")
    public void warmPopularTimes() {
        Set<String> salonIds = new LinkedHashSet<>(properties.popularTimes().warmupSalonIds());
        try {
            salonIds.addAll(sessionContextUseCase.getActiveSalonIds());
        } catch (Exception e) {
            log.warn("Active salon lookup failed, warming configured salons only: error={}", e.getMessage());
        }

        if (salonIds.isEmpty()) {
            log.debug("No salons to warm");
            return;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            int warmed = popularTimesUseCase.warmCache(salonIds);

            Counter.builder("scheduler.popular.warmup.salons")
                    .tag("result", "success")
                    .description("Number of salons whose popular times were refreshed")
                    .register(meterRegistry)
                    .increment(warmed);
            Counter.builder("scheduler.popular.warmup.salons")
                    .tag("result", "failure")
                    .description("Number of salons whose popular times were refreshed")
                    .register(meterRegistry)
                    .increment(salonIds.size() - warmed);
        } catch (Exception e) {
            log.error("Popular times warmup failed", e);
        } finally {
            sample.stop(Timer.builder("scheduler.popular.warmup.duration")
                    .description("Time taken to warm popular times cache")
                    .register(meterRegistry));
        }
    }
}

package personal.ai.dialog.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 시각 기준 (살롱 현지 시간대)
 * 테스트에서는 Clock.fixed로 대체한다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(DialogProperties properties) {
        return Clock.system(ZoneId.of(properties.zone()));
    }
}

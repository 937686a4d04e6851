package personal.ai.dialog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Dialog Service Application
 * 세션, 대체 슬롯 제안, 인기 시간대, 메시지, 인터랙티브 카드를 묶는 대화형 예약 서비스
 */
@EnableScheduling  // 세션 정리, 인기 시간대 캐시 워밍
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.ai.dialog",
        "personal.ai.common"  // common 모듈의 GlobalExceptionHandler, HealthCheckService 스캔
    }
)
public class DialogServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(DialogServiceApplication.class, args);
    }
}

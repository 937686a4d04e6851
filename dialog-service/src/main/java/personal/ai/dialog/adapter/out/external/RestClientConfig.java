package personal.ai.dialog.adapter.out.external;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * RestClient Configuration
 * <p>
 * Timeout 전략:
 * - Connect Timeout (200ms): TCP 연결 실패 빠른 감지
 * - Read Timeout: Circuit Breaker Slow Call 기준과 일치 (bookingCore 800ms, whatsapp 2000ms)
 */
@Configuration
public class RestClientConfig {

    @Value("${external.booking-core.base-url}")
    private String bookingCoreBaseUrl;

    @Value("${external.booking-core.connect-timeout-ms:200}")
    private int bookingCoreConnectTimeoutMs;

    @Value("${external.booking-core.read-timeout-ms:800}")
    private int bookingCoreReadTimeoutMs;

    @Value("${external.whatsapp.base-url}")
    private String whatsappBaseUrl;

    @Value("${external.whatsapp.access-token:}")
    private String whatsappAccessToken;

    @Value("${external.whatsapp.connect-timeout-ms:200}")
    private int whatsappConnectTimeoutMs;

    @Value("${external.whatsapp.read-timeout-ms:2000}")
    private int whatsappReadTimeoutMs;

    @Bean
    public RestClient bookingCoreRestClient() {
        return RestClient.builder()
                .baseUrl(bookingCoreBaseUrl)
                .requestFactory(requestFactory(bookingCoreConnectTimeoutMs, bookingCoreReadTimeoutMs))
                .build();
    }

    @Bean
    public RestClient whatsappRestClient() {
        return RestClient.builder()
                .baseUrl(whatsappBaseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + whatsappAccessToken)
                .requestFactory(requestFactory(whatsappConnectTimeoutMs, whatsappReadTimeoutMs))
                .build();
    }

    private JdkClientHttpRequestFactory requestFactory(int connectTimeoutMs, int readTimeoutMs) {
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
        return requestFactory;
    }
}

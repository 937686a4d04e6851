package personal.ai.dialog.popular.application.port.out;

import personal.ai.dialog.popular.domain.model.PopularTimeSlot;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 인기 시간대 캐시 Port
 * 구현체는 저장소 장애 시 예외 대신 miss로 동작한다.
 */
public interface PopularTimesCache {

    /**
     * @param serviceId null이면 살롱 전체 ("all")
     */
    Optional<List<PopularTimeSlot>> find(String salonId, String serviceId);

    void put(String salonId, String serviceId, List<PopularTimeSlot> popularTimes, Duration ttl);

    boolean evict(String salonId, String serviceId);

    /**
     * @return 삭제된 키 수
     */
    long evictAll(String salonId);
}

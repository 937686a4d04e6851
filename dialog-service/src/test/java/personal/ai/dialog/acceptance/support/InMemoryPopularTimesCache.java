package personal.ai.dialog.acceptance.support;

import personal.ai.dialog.popular.application.port.out.PopularTimesCache;
import personal.ai.dialog.popular.domain.model.PopularTimeSlot;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryPopularTimesCache implements PopularTimesCache {

    private final Map<String, List<PopularTimeSlot>> entries = new HashMap<>();

    @Override
    public Optional<List<PopularTimeSlot>> find(String salonId, String serviceId) {
        return Optional.ofNullable(entries.get(key(salonId, serviceId)));
    }

    @Override
    public void put(String salonId, String serviceId, List<PopularTimeSlot> popularTimes, Duration ttl) {
        entries.put(key(salonId, serviceId), List.copyOf(popularTimes));
    }

    @Override
    public boolean evict(String salonId, String serviceId) {
        return entries.remove(key(salonId, serviceId)) != null;
    }

    @Override
    public long evictAll(String salonId) {
        int before = entries.size();
        entries.keySet().removeIf(key -> key.startsWith(salonId + ":"));
        return before - entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private String key(String salonId, String serviceId) {
        return salonId + ":" + (serviceId == null ? "all" : serviceId);
    }
}

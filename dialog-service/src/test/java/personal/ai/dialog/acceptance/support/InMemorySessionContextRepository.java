package personal.ai.dialog.acceptance.support;

import personal.ai.dialog.session.application.port.out.SessionContextRepository;
import personal.ai.dialog.session.domain.model.BookingContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Redis 세션 저장소와 같은 TTL 규칙을 따르는 메모리 구현
 */
public class InMemorySessionContextRepository implements SessionContextRepository {

    private final Map<String, Entry> entries = new HashMap<>();
    private final Clock clock;

    public InMemorySessionContextRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<BookingContext> find(String sessionId) {
        return live(sessionId).map(Entry::context);
    }

    @Override
    public void save(BookingContext context, Duration ttl) {
        entries.put(context.sessionId(), new Entry(context, clock.instant().plus(ttl)));
    }

    @Override
    public long extend(String sessionId, long seconds, long capSeconds) {
        Optional<Entry> entry = live(sessionId);
        if (entry.isEmpty()) {
            return KEY_NOT_FOUND;
        }
        if (capSeconds <= 0) {
            entries.remove(sessionId);
            return 0;
        }
        long remaining = Duration.between(clock.instant(), entry.get().expiresAt()).getSeconds();
        long newTtl = Math.min(remaining + seconds, capSeconds);
        entries.put(sessionId, new Entry(entry.get().context(), clock.instant().plusSeconds(newTtl)));
        return newTtl;
    }

    @Override
    public boolean delete(String sessionId) {
        return entries.remove(sessionId) != null;
    }

    // 메모리 구현은 항상 TTL이 있고 값도 객체 그대로 보관한다
    @Override
    public boolean deleteIfNoExpiry(String sessionId) {
        return false;
    }

    @Override
    public boolean deleteIfUnreadable(String sessionId) {
        return false;
    }

    @Override
    public long ttlSeconds(String sessionId) {
        return live(sessionId)
                .map(entry -> Duration.between(clock.instant(), entry.expiresAt()).getSeconds())
                .orElse(KEY_NOT_FOUND);
    }

    @Override
    public List<String> findAllSessionIds() {
        return new ArrayList<>(entries.keySet()).stream()
                .filter(id -> live(id).isPresent())
                .toList();
    }

    private Optional<Entry> live(String sessionId) {
        Entry entry = entries.get(sessionId);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.expiresAt().isAfter(clock.instant())) {
            entries.remove(sessionId);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private record Entry(BookingContext context, Instant expiresAt) {
    }
}

package personal.ai.dialog.popular.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.common.exception.BusinessException;
import personal.ai.dialog.config.DialogProperties;
import personal.ai.dialog.i18n.LanguageProfile;
import personal.ai.dialog.i18n.LanguageProfiles;
import personal.ai.dialog.popular.application.port.in.PopularTimesUseCase;
import personal.ai.dialog.popular.application.port.out.BookingHistorySource;
import personal.ai.dialog.popular.application.port.out.PopularTimesCache;
import personal.ai.dialog.popular.domain.model.BookingRecord;
import personal.ai.dialog.popular.domain.model.BusinessType;
import personal.ai.dialog.popular.domain.model.PopularTimeSlot;
import personal.ai.dialog.popular.domain.model.PopularTimesOptions;
import personal.ai.dialog.popular.domain.model.SeasonalPattern;
import personal.ai.dialog.popular.domain.model.SeasonalPatternOptions;
import personal.ai.dialog.popular.domain.model.WeightedScore;
import personal.ai.dialog.popular.domain.model.WeightingOptions;
import personal.ai.dialog.popular.domain.service.PopularTimesCalculator;
import personal.ai.dialog.suggestion.application.port.out.AvailabilitySource;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Popular Times Service
 * 캐시 → 예약 이력 → 가중 점수 → 필터 순으로 인기 시간대를 계산한다.
 * <p>
 * 캐시에는 필터 적용 전 전체 버킷을 저장하고, 조회 시 limit/minConfidence/minBookings를 적용한다.
 * 담당자 필터, 비기본 lookback, 취소 포함 조회는 캐시를 우회한다.
 */
@Slf4j
@Service
public class PopularTimesService implements PopularTimesUseCase {

    private final PopularTimesCalculator calculator;
    private final BookingHistorySource bookingHistorySource;
    private final PopularTimesCache popularTimesCache;
    private final AvailabilitySource availabilitySource;
    private final DialogProperties.PopularTimes config;
    private final Clock clock;

    public PopularTimesService(PopularTimesCalculator calculator,
                               BookingHistorySource bookingHistorySource,
                               PopularTimesCache popularTimesCache,
                               AvailabilitySource availabilitySource,
                               DialogProperties properties,
                               Clock clock) {
        this.calculator = calculator;
        this.bookingHistorySource = bookingHistorySource;
        this.popularTimesCache = popularTimesCache;
        this.availabilitySource = availabilitySource;
        this.config = properties.popularTimes();
        this.clock = clock;
    }

    @Override
    public List<PopularTimeSlot> getPopularTimes(String salonId, PopularTimesOptions options) {
        PopularTimesOptions opts = options == null ? PopularTimesOptions.defaults() : options;
        boolean cacheable = isCacheable(opts);

        if (cacheable && opts.useCache()) {
            Optional<List<PopularTimeSlot>> cached = popularTimesCache.find(salonId, opts.serviceId());
            if (cached.isPresent()) {
                log.debug("Popular times cache hit: salonId={}, serviceId={}", salonId, opts.serviceId());
                return applyFilters(cached.get(), opts);
            }
        }

        List<PopularTimeSlot> candidates = compute(salonId, opts);
        if (cacheable) {
            popularTimesCache.put(salonId, opts.serviceId(), candidates, Duration.ofSeconds(config.cacheTtlSeconds()));
        }

        List<PopularTimeSlot> result = applyFilters(candidates, opts);
        log.debug("Popular times computed: salonId={}, serviceId={}, candidates={}, result={}",
                salonId, opts.serviceId(), candidates.size(), result.size());
        return result;
    }

    @Override
    public List<PopularTimeSlot> getDefaultTimes(BusinessType businessType) {
        return calculator.getDefaultTimes(businessType == null ? BusinessType.GENERIC : businessType);
    }

    @Override
    public List<PopularTimeSlot> checkAvailability(String salonId, String serviceId,
                                                   List<PopularTimeSlot> popularTimes, LocalDate date) {
        if (popularTimes == null || popularTimes.isEmpty()) {
            return List.of();
        }
        List<SlotSuggestion> slots = availabilitySource.findAvailableSlots(salonId, serviceId, date, date.plusDays(6));

        return popularTimes.stream()
                .map(popular -> {
                    LocalDate occurrence = date.with(TemporalAdjusters.nextOrSame(popular.dayOfWeek()));
                    Optional<SlotSuggestion> earliest = slots.stream()
                            .filter(slot -> slot.date().equals(occurrence))
                            .filter(slot -> slot.startTime().getHour() == popular.hour())
                            .min(Comparator.comparing(SlotSuggestion::startTime));
                    return popular.withAvailability(earliest.isPresent(), earliest.orElse(null));
                })
                .toList();
    }

    @Override
    public List<WeightedScore> calculateWeightedScores(List<BookingRecord> bookings, WeightingOptions options) {
        return calculator.calculateWeightedScores(bookings, options);
    }

    @Override
    public double calculateConfidence(int bookingCount, int totalBookings) {
        return calculator.calculateConfidence(bookingCount, totalBookings);
    }

    @Override
    public boolean invalidateCache(String salonId, String serviceId) {
        boolean removed = serviceId != null
                ? popularTimesCache.evict(salonId, serviceId)
                : popularTimesCache.evictAll(salonId) > 0;
        log.info("Popular times cache invalidated: salonId={}, serviceId={}, removed={}",
                salonId, serviceId == null ? "*" : serviceId, removed);
        return removed;
    }

    @Override
    public int warmCache(Collection<String> salonIds) {
        int warmed = 0;
        for (String salonId : salonIds) {
            try {
                getPopularTimes(salonId, PopularTimesOptions.defaults().withoutCache());
                warmed++;
            } catch (BusinessException e) {
                log.warn("Popular times warmup skipped: salonId={}, code={}", salonId, e.getErrorCode().getCode());
            } catch (RuntimeException e) {
                log.error("Popular times warmup failed: salonId={}", salonId, e);
            }
        }
        log.info("Popular times cache warmed: requested={}, warmed={}", salonIds.size(), warmed);
        return warmed;
    }

    @Override
    public List<SeasonalPattern> detectSeasonalPatterns(String salonId, SeasonalPatternOptions options) {
        SeasonalPatternOptions opts = options == null ? SeasonalPatternOptions.defaults() : options;
        if (opts.includeHolidays()) {
            log.debug("Holiday pattern detection is not supported: salonId={}", salonId);
        }
        LocalDate since = LocalDate.now(clock).minusDays(opts.lookbackDays());
        List<BookingRecord> bookings = bookingHistorySource.findBookings(salonId, since);
        return calculator.detectSeasonalPatterns(bookings, opts.minOccurrences());
    }

    @Override
    public List<String> formatForDisplay(List<PopularTimeSlot> popularTimes, String language) {
        LanguageProfile profile = LanguageProfiles.of(language);
        return popularTimes.stream()
                .map(popular -> calculator.formatDisplay(popular.dayOfWeek(), popular.hour(), profile))
                .toList();
    }

    private List<PopularTimeSlot> compute(String salonId, PopularTimesOptions opts) {
        int lookbackDays = opts.lookbackDays() != null ? opts.lookbackDays() : config.lookbackDays();
        LocalDate today = LocalDate.now(clock);

        List<BookingRecord> bookings = bookingHistorySource.findBookings(salonId, today.minusDays(lookbackDays)).stream()
                .filter(b -> opts.serviceId() == null || opts.serviceId().equals(b.serviceId()))
                .filter(b -> opts.masterId() == null || opts.masterId().equals(b.masterId()))
                .toList();

        WeightingOptions weighting = WeightingOptions.defaults(today)
                .withLookback(lookbackDays, opts.includeCancelled());
        LanguageProfile profile = LanguageProfiles.of(LanguageProfiles.DEFAULT_LANGUAGE);

        return calculator.calculateWeightedScores(bookings, weighting).stream()
                .map(score -> PopularTimeSlot.of(score,
                        calculator.formatDisplay(score.dayOfWeek(), score.hour(), profile)))
                .toList();
    }

    private List<PopularTimeSlot> applyFilters(List<PopularTimeSlot> candidates, PopularTimesOptions opts) {
        int limit = opts.limit() != null ? opts.limit() : config.limit();
        double minConfidence = opts.minConfidence() != null ? opts.minConfidence() : config.minConfidence();
        int minBookings = opts.minBookings() != null ? opts.minBookings() : config.minBookings();

        return candidates.stream()
                .filter(slot -> slot.confidence() >= minConfidence)
                .filter(slot -> slot.rawCount() >= minBookings)
                .limit(Math.max(0, limit))
                .toList();
    }

    private boolean isCacheable(PopularTimesOptions opts) {
        return opts.masterId() == null
                && !opts.includeCancelled()
                && (opts.lookbackDays() == null || Objects.equals(opts.lookbackDays(), config.lookbackDays()));
    }
}

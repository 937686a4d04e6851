package personal.ai.dialog.popular.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.dialog.i18n.LanguageProfile;
import personal.ai.dialog.i18n.LanguageProfiles;
import personal.ai.dialog.popular.domain.model.BookingRecord;
import personal.ai.dialog.popular.domain.model.BusinessType;
import personal.ai.dialog.popular.domain.model.PopularTimeSlot;
import personal.ai.dialog.popular.domain.model.SeasonalPattern;
import personal.ai.dialog.popular.domain.model.SeasonalPatternType;
import personal.ai.dialog.popular.domain.model.WeightedScore;
import personal.ai.dialog.popular.domain.model.WeightingOptions;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.time.DayOfWeek.FRIDAY;
import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.SATURDAY;
import static java.time.DayOfWeek.SUNDAY;
import static java.time.DayOfWeek.THURSDAY;
import static java.time.DayOfWeek.WEDNESDAY;

/**
 * Popular Times Calculator (Domain Service)
 * 예약 이력을 요일/시간 버킷으로 집계하고 최신성 가중치와 신뢰도를 계산한다.
 * I/O 없음.
 */
@Slf4j
@Component
public class PopularTimesCalculator {

    private static final double Z = 1.96;
    private static final double WEEKLY_THRESHOLD = 1.5;
    private static final double MONTHLY_THRESHOLD = 1.3;
    private static final double DEFAULT_TIME_CONFIDENCE = 0.5;

    private static final Map<BusinessType, List<DefaultTime>> DEFAULT_TIMES = defaultTimes();

    /**
     * 요일/시간별 가중 점수 (점수 내림차순, 동점은 요일 → 시간 순)
     */
    public List<WeightedScore> calculateWeightedScores(List<BookingRecord> bookings, WeightingOptions options) {
        if (bookings == null || bookings.isEmpty()) {
            return List.of();
        }

        Map<Bucket, double[]> buckets = new HashMap<>();
        for (BookingRecord booking : bookings) {
            if (booking.startTime() == null) {
                continue;
            }
            if (booking.isCancelled() && !options.includeCancelled()) {
                continue;
            }
            double weight = recencyWeight(booking.startTime().toLocalDate(), options);
            if (weight <= 0) {
                continue;
            }
            Bucket bucket = new Bucket(booking.startTime().getDayOfWeek(), booking.startTime().getHour());
            double[] acc = buckets.computeIfAbsent(bucket, b -> new double[2]);
            acc[0] += 1;
            acc[1] += weight;
        }
        if (buckets.isEmpty()) {
            return List.of();
        }

        int peak = buckets.values().stream().mapToInt(acc -> (int) acc[0]).max().orElse(0);
        List<WeightedScore> scores = new ArrayList<>(buckets.size());
        buckets.forEach((bucket, acc) -> scores.add(new WeightedScore(bucket.dayOfWeek(), bucket.hour(),
                (int) acc[0], acc[1], calculateConfidence((int) acc[0], peak))));

        scores.sort(Comparator.comparingDouble(WeightedScore::score).reversed()
                .thenComparing(WeightedScore::dayOfWeek)
                .thenComparingInt(WeightedScore::hour));
        return scores;
    }

    /**
     * Wilson score 중심값 (z=1.96), [0,1]로 clamp. 표본이 없으면 0.
     */
    public double calculateConfidence(int bookingCount, int totalBookings) {
        if (totalBookings <= 0 || bookingCount <= 0) {
            return 0.0;
        }
        double n = totalBookings;
        double p = Math.min(bookingCount, totalBookings) / n;
        double z2 = Z * Z;
        double centre = (p + z2 / (2 * n)) / (1 + z2 / n);
        return Math.max(0.0, Math.min(1.0, centre));
    }

    /**
     * 0~30일 recent, 31~60일 medium, 61일~lookback old, 그 이전 0 (제외)
     * 미래 예약은 최근으로 취급한다.
     */
    public double recencyWeight(LocalDate bookingDate, WeightingOptions options) {
        long age = ChronoUnit.DAYS.between(bookingDate, options.referenceDate());
        if (age <= 30) {
            return age > options.lookbackDays() ? 0 : options.recentWeight();
        }
        if (age > options.lookbackDays()) {
            return 0;
        }
        if (age <= 60) {
            return options.mediumWeight();
        }
        return options.oldWeight();
    }

    /**
     * 업종별 기본 인기 시간대 (이력이 없는 살롱용)
     */
    public List<PopularTimeSlot> getDefaultTimes(BusinessType businessType) {
        List<DefaultTime> times = DEFAULT_TIMES.getOrDefault(businessType, DEFAULT_TIMES.get(BusinessType.GENERIC));
        LanguageProfile profile = LanguageProfiles.of(LanguageProfiles.DEFAULT_LANGUAGE);
        return times.stream()
                .map(t -> new PopularTimeSlot(t.dayOfWeek(), t.hour(), 0, 0, DEFAULT_TIME_CONFIDENCE,
                        formatDisplay(t.dayOfWeek(), t.hour(), profile), null, null))
                .toList();
    }

    public String formatDisplay(DayOfWeek dayOfWeek, int hour, LanguageProfile profile) {
        return profile.weekday(dayOfWeek) + " " + String.format("%02d:00", hour);
    }

    /**
     * 주간 패턴: 요일 예약 수가 평균의 1.5배 이상
     * 월간 패턴: 월초(1~10) / 월중(11~20) / 월말(21~) 예약 수가 평균의 1.3배 이상
     */
    public List<SeasonalPattern> detectSeasonalPatterns(List<BookingRecord> bookings, int minOccurrences) {
        List<BookingRecord> counted = bookings.stream()
                .filter(b -> b.startTime() != null && !b.isCancelled())
                .toList();
        if (counted.isEmpty()) {
            return List.of();
        }

        List<SeasonalPattern> patterns = new ArrayList<>();

        Map<DayOfWeek, Integer> byWeekday = new EnumMap<>(DayOfWeek.class);
        for (BookingRecord b : counted) {
            byWeekday.merge(b.startTime().getDayOfWeek(), 1, Integer::sum);
        }
        double weekdayMean = counted.size() / 7.0;
        for (DayOfWeek day : DayOfWeek.values()) {
            int count = byWeekday.getOrDefault(day, 0);
            double ratio = count / weekdayMean;
            if (count >= minOccurrences && ratio >= WEEKLY_THRESHOLD) {
                patterns.add(new SeasonalPattern(SeasonalPatternType.WEEKLY, day.name(), round(ratio), count));
            }
        }

        Map<MonthPart, Integer> byMonthPart = new EnumMap<>(MonthPart.class);
        for (BookingRecord b : counted) {
            byMonthPart.merge(MonthPart.of(b.startTime().getDayOfMonth()), 1, Integer::sum);
        }
        double monthPartMean = counted.size() / (double) MonthPart.values().length;
        for (MonthPart part : MonthPart.values()) {
            int count = byMonthPart.getOrDefault(part, 0);
            double ratio = count / monthPartMean;
            if (count >= minOccurrences && ratio >= MONTHLY_THRESHOLD) {
                patterns.add(new SeasonalPattern(SeasonalPatternType.MONTHLY, part.name(), round(ratio), count));
            }
        }

        log.debug("Seasonal patterns detected: bookings={}, patterns={}", counted.size(), patterns.size());
        return patterns;
    }

    private double round(double value) {
        return Math.round(value * 100) / 100.0;
    }

    private static Map<BusinessType, List<DefaultTime>> defaultTimes() {
        Map<BusinessType, List<DefaultTime>> table = new EnumMap<>(BusinessType.class);
        table.put(BusinessType.BEAUTY_SALON, List.of(
                new DefaultTime(FRIDAY, 15), new DefaultTime(SATURDAY, 11), new DefaultTime(SATURDAY, 14),
                new DefaultTime(THURSDAY, 17), new DefaultTime(WEDNESDAY, 18)));
        table.put(BusinessType.BARBERSHOP, List.of(
                new DefaultTime(SATURDAY, 10), new DefaultTime(FRIDAY, 17), new DefaultTime(SATURDAY, 12),
                new DefaultTime(THURSDAY, 18), new DefaultTime(MONDAY, 18)));
        table.put(BusinessType.SPA, List.of(
                new DefaultTime(SATURDAY, 13), new DefaultTime(SUNDAY, 12), new DefaultTime(FRIDAY, 16),
                new DefaultTime(SATURDAY, 16), new DefaultTime(SUNDAY, 15)));
        table.put(BusinessType.NAIL_SALON, List.of(
                new DefaultTime(SATURDAY, 11), new DefaultTime(FRIDAY, 16), new DefaultTime(THURSDAY, 17),
                new DefaultTime(SATURDAY, 14), new DefaultTime(WEDNESDAY, 17)));
        table.put(BusinessType.GENERIC, List.of(
                new DefaultTime(SATURDAY, 11), new DefaultTime(FRIDAY, 15), new DefaultTime(THURSDAY, 17),
                new DefaultTime(SATURDAY, 14), new DefaultTime(WEDNESDAY, 17)));
        return Map.copyOf(table);
    }

    private record Bucket(DayOfWeek dayOfWeek, int hour) {
    }

    private record DefaultTime(DayOfWeek dayOfWeek, int hour) {
    }

    private enum MonthPart {
        MONTH_START, MONTH_MIDDLE, MONTH_END;

        static MonthPart of(int dayOfMonth) {
            if (dayOfMonth <= 10) {
                return MONTH_START;
            }
            return dayOfMonth <= 20 ? MONTH_MIDDLE : MONTH_END;
        }
    }
}

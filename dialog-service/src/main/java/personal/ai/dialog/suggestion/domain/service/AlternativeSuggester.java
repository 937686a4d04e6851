package personal.ai.dialog.suggestion.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.dialog.i18n.LanguageProfile;
import personal.ai.dialog.i18n.LanguageProfiles;
import personal.ai.dialog.suggestion.domain.model.HighlightTier;
import personal.ai.dialog.suggestion.domain.model.RankedSlot;
import personal.ai.dialog.suggestion.domain.model.RankingPreferences;
import personal.ai.dialog.suggestion.domain.model.RankingWeights;
import personal.ai.dialog.suggestion.domain.model.ScoreBreakdown;
import personal.ai.dialog.suggestion.domain.model.SlotIndicators;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;
import personal.ai.dialog.suggestion.domain.model.SlotTimeFormats;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Alternative Suggester (Domain Service)
 * 원래 요청과의 근접도로 대체 슬롯을 랭킹한다.
 * <p>
 * 순수 함수: I/O 없음, 입력 리스트를 변경하지 않음.
 * 동점은 절대 거리, 그 다음 입력 순서로 결정된다 (stable).
 */
@Slf4j
@Component
public class AlternativeSuggester {

    public static final int STAFF_MATCH_BONUS = 1000;
    public static final int DEFAULT_HIGHLIGHT_LIMIT = 3;

    private static final int TIME_TIER_MAX = 500;
    private static final int DATE_TIER_MAX = 300;
    private static final double WEIGHT_SCALE = 1000.0;

    /**
     * 요청 시각과의 근접도로 랭킹
     * ±1h → 500, ±2h → 300, ±3h → 100, 그 외 0
     */
    public List<RankedSlot> rankByTimeProximity(List<SlotSuggestion> slots, LocalTime targetTime) {
        RankingPreferences preferences = new RankingPreferences(null, targetTime, null, RankingWeights.DEFAULT);
        return rank(slots, preferences, Comparator
                .comparingInt((Scored s) -> s.breakdown().timeBonus()).reversed()
                .thenComparingInt(s -> s.breakdown().absoluteMinutes())
                .thenComparingInt(Scored::index),
                breakdown -> breakdown.timeBonus());
    }

    public List<RankedSlot> rankByTimeProximity(List<SlotSuggestion> slots, String targetTime) {
        return rankByTimeProximity(slots, SlotTimeFormats.parseTime(targetTime));
    }

    /**
     * 요청 날짜와의 근접도로 랭킹
     * 같은 날 → 300, ±1일 → 180, ±2일 → 60, 그 외 0
     */
    public List<RankedSlot> rankByDateProximity(List<SlotSuggestion> slots, LocalDate targetDate) {
        RankingPreferences preferences = new RankingPreferences(targetDate, null, null, RankingWeights.DEFAULT);
        return rank(slots, preferences, Comparator
                .comparingInt((Scored s) -> s.breakdown().dateBonus()).reversed()
                .thenComparingInt(s -> s.breakdown().absoluteDays())
                .thenComparingInt(Scored::index),
                breakdown -> breakdown.dateBonus());
    }

    public List<RankedSlot> rankByDateProximity(List<SlotSuggestion> slots, String targetDate) {
        return rankByDateProximity(slots, SlotTimeFormats.parseDate(targetDate));
    }

    /**
     * 날짜, 시간, 담당자를 함께 고려한 랭킹
     * 담당자 일치 +1000은 가중치와 무관하게 항상 적용된다.
     */
    public List<RankedSlot> rankByMultipleFactors(List<SlotSuggestion> slots, RankingPreferences preferences) {
        return rank(slots, preferences, Comparator
                .comparingDouble((Scored s) -> s.breakdown().total()).reversed()
                .thenComparingInt(s -> s.breakdown().absoluteMinutes())
                .thenComparingInt(s -> s.breakdown().absoluteDays())
                .thenComparingInt(Scored::index),
                ScoreBreakdown::total);
    }

    /**
     * 단일 슬롯의 점수 상세 계산
     */
    public ScoreBreakdown calculateProximityScore(SlotSuggestion slot, RankingPreferences target) {
        RankingWeights weights = target.weights();

        Integer minutesFromTarget = null;
        int timeBonus = 0;
        if (target.targetTime() != null) {
            minutesFromTarget = (int) Duration.between(target.targetTime(), slot.startTime()).toMinutes();
            timeBonus = timeTierBonus(Math.abs(minutesFromTarget));
        }

        Integer daysFromTarget = null;
        int dateBonus = 0;
        if (target.targetDate() != null) {
            daysFromTarget = (int) ChronoUnit.DAYS.between(target.targetDate(), slot.date());
            dateBonus = dateTierBonus(Math.abs(daysFromTarget));
        }

        boolean masterMatch = slot.hasMaster(target.preferredMasterId());
        int masterBonus = masterMatch ? STAFF_MATCH_BONUS : 0;

        double timeProximity = (double) timeBonus / TIME_TIER_MAX;
        double dateProximity = (double) dateBonus / DATE_TIER_MAX;
        double weightedTime = weights.time() * timeProximity * WEIGHT_SCALE;
        double weightedDate = weights.date() * dateProximity * WEIGHT_SCALE;
        double weightedMaster = weights.master() * (masterMatch ? 1.0 : 0.0) * WEIGHT_SCALE;
        double total = masterBonus + weightedTime + weightedDate + weightedMaster;

        return new ScoreBreakdown(masterBonus, timeBonus, dateBonus, timeProximity, dateProximity,
                weightedTime, weightedDate, weightedMaster, total, minutesFromTarget, daysFromTarget);
    }

    public List<RankedSlot> addVisualIndicators(List<RankedSlot> rankedSlots) {
        return addVisualIndicators(rankedSlots, DEFAULT_HIGHLIGHT_LIMIT, LanguageProfiles.DEFAULT_LANGUAGE);
    }

    /**
     * 상위 limit개에만 별표와 근접도 문구를 붙인다.
     * 입력 순서(=순위)를 유지한다.
     */
    public List<RankedSlot> addVisualIndicators(List<RankedSlot> rankedSlots, int limit, String language) {
        LanguageProfile profile = LanguageProfiles.of(language);
        List<RankedSlot> result = new ArrayList<>(rankedSlots.size());
        for (int i = 0; i < rankedSlots.size(); i++) {
            RankedSlot ranked = rankedSlots.get(i);
            HighlightTier tier = ranked.indicators() != null
                    ? ranked.indicators().highlightTier()
                    : highlightTier(ranked.breakdown());
            String time = SlotTimeFormats.formatTime(ranked.slot().startTime());

            if (i < limit) {
                String proximityText = proximityText(ranked.breakdown(), profile);
                String displayText = proximityText == null
                        ? "⭐ " + time
                        : "⭐ " + time + " (" + proximityText + ")";
                result.add(ranked.withIndicators(new SlotIndicators(true, proximityText, tier), displayText));
            } else {
                result.add(ranked.withIndicators(SlotIndicators.plain(tier), time));
            }
        }
        return result;
    }

    /**
     * 요청 날짜/시각 주변의 대체 슬롯 상위 N개 (표시 지표 포함)
     */
    public List<RankedSlot> findNearbyAlternatives(List<SlotSuggestion> slots, RankingPreferences preferences,
                                                   int maxAlternatives, String language) {
        if (slots == null || slots.isEmpty()) {
            return List.of();
        }
        List<RankedSlot> ranked = rankByMultipleFactors(slots, preferences);
        List<RankedSlot> top = ranked.subList(0, Math.min(maxAlternatives, ranked.size()));
        return addVisualIndicators(top, DEFAULT_HIGHLIGHT_LIMIT, language);
    }

    private List<RankedSlot> rank(List<SlotSuggestion> slots, RankingPreferences preferences,
                                  Comparator<Scored> order, ToDoubleFunction<ScoreBreakdown> scoreOf) {
        if (slots == null || slots.isEmpty()) {
            return List.of();
        }
        List<Scored> scored = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            SlotSuggestion slot = slots.get(i);
            ScoreBreakdown breakdown = calculateProximityScore(slot, preferences);
            scored.add(new Scored(slot, i, withTotal(breakdown, scoreOf.applyAsDouble(breakdown))));
        }
        scored.sort(order);

        List<RankedSlot> result = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Scored s = scored.get(i);
            result.add(new RankedSlot(s.slot(), i + 1, s.breakdown(),
                    SlotIndicators.plain(highlightTier(s.breakdown())),
                    SlotTimeFormats.formatTime(s.slot().startTime())));
        }
        log.debug("Ranked slots: count={}, target(date={}, time={}, master={})",
                result.size(), preferences.targetDate(), preferences.targetTime(), preferences.preferredMasterId());
        return result;
    }

    private ScoreBreakdown withTotal(ScoreBreakdown b, double total) {
        if (b.total() == total) {
            return b;
        }
        return new ScoreBreakdown(b.masterBonus(), b.timeBonus(), b.dateBonus(), b.timeProximity(),
                b.dateProximity(), b.weightedTime(), b.weightedDate(), b.weightedMaster(), total,
                b.minutesFromTarget(), b.daysFromTarget());
    }

    private HighlightTier highlightTier(ScoreBreakdown breakdown) {
        if (breakdown.minutesFromTarget() != null) {
            return HighlightTier.fromTimeBonus(breakdown.timeBonus());
        }
        if (breakdown.daysFromTarget() != null) {
            return HighlightTier.fromDateBonus(breakdown.dateBonus());
        }
        return HighlightTier.NONE;
    }

    // 다른 날이면 날짜 문구, 같은 날이면 시간 문구
    private String proximityText(ScoreBreakdown breakdown, LanguageProfile profile) {
        Integer days = breakdown.daysFromTarget();
        Integer minutes = breakdown.minutesFromTarget();
        if (days != null && days != 0) {
            return profile.formatDayDifference(days);
        }
        if (minutes != null) {
            return profile.formatTimeDifference(minutes);
        }
        return days != null ? profile.formatDayDifference(days) : null;
    }

    static int timeTierBonus(int absoluteMinutes) {
        if (absoluteMinutes <= 60) {
            return 500;
        }
        if (absoluteMinutes <= 120) {
            return 300;
        }
        return absoluteMinutes <= 180 ? 100 : 0;
    }

    static int dateTierBonus(int absoluteDays) {
        if (absoluteDays == 0) {
            return 300;
        }
        if (absoluteDays == 1) {
            return 180;
        }
        return absoluteDays == 2 ? 60 : 0;
    }

    private record Scored(SlotSuggestion slot, int index, ScoreBreakdown breakdown) {
    }
}

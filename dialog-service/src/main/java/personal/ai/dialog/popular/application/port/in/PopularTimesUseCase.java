package personal.ai.dialog.popular.application.port.in;

import personal.ai.dialog.popular.domain.model.BookingRecord;
import personal.ai.dialog.popular.domain.model.BusinessType;
import personal.ai.dialog.popular.domain.model.PopularTimeSlot;
import personal.ai.dialog.popular.domain.model.PopularTimesOptions;
import personal.ai.dialog.popular.domain.model.SeasonalPattern;
import personal.ai.dialog.popular.domain.model.SeasonalPatternOptions;
import personal.ai.dialog.popular.domain.model.WeightedScore;
import personal.ai.dialog.popular.domain.model.WeightingOptions;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Popular Times UseCase (Input Port)
 */
public interface PopularTimesUseCase {

    /**
     * 이력 기반 인기 시간대
     * 이력이 없으면 빈 리스트 (기본 시간대로 대체하지 않음)
     *
     * @throws personal.ai.dialog.popular.domain.exception.PopularTimesUnavailableException 이력 조회 실패
     */
    List<PopularTimeSlot> getPopularTimes(String salonId, PopularTimesOptions options);

    List<PopularTimeSlot> getDefaultTimes(BusinessType businessType);

    /**
     * 각 인기 시간대의 date 이후 첫 해당 요일 가용 여부
     */
    List<PopularTimeSlot> checkAvailability(String salonId, String serviceId,
                                            List<PopularTimeSlot> popularTimes, LocalDate date);

    List<WeightedScore> calculateWeightedScores(List<BookingRecord> bookings, WeightingOptions options);

    double calculateConfidence(int bookingCount, int totalBookings);

    /**
     * @param serviceId null이면 살롱의 모든 캐시 키 삭제
     * @return 삭제된 항목이 있었는지
     */
    boolean invalidateCache(String salonId, String serviceId);

    /**
     * @return 갱신에 성공한 살롱 수
     */
    int warmCache(Collection<String> salonIds);

    List<SeasonalPattern> detectSeasonalPatterns(String salonId, SeasonalPatternOptions options);

    List<String> formatForDisplay(List<PopularTimeSlot> popularTimes, String language);
}

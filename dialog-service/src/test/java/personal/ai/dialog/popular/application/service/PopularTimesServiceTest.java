package personal.ai.dialog.popular.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.dialog.config.DialogPropertiesFixture;
import personal.ai.dialog.popular.application.port.out.BookingHistorySource;
import personal.ai.dialog.popular.application.port.out.PopularTimesCache;
import personal.ai.dialog.popular.domain.exception.PopularTimesUnavailableException;
import personal.ai.dialog.popular.domain.model.BookingRecord;
import personal.ai.dialog.popular.domain.model.BookingStatus;
import personal.ai.dialog.popular.domain.model.PopularTimeSlot;
import personal.ai.dialog.popular.domain.model.PopularTimesOptions;
import personal.ai.dialog.popular.domain.service.PopularTimesCalculator;
import personal.ai.dialog.suggestion.application.port.out.AvailabilitySource;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("PopularTimesService 단위 테스트")
class PopularTimesServiceTest {

    private static final String SALON_ID = "salon-1";
    // 2025-10-24 = Friday
    private static final LocalDate TODAY = LocalDate.of(2025, 10, 24);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-10-24T09:00:00Z"), ZoneOffset.UTC);

    @Mock
    private BookingHistorySource bookingHistorySource;
    @Mock
    private PopularTimesCache popularTimesCache;
    @Mock
    private AvailabilitySource availabilitySource;

    private PopularTimesService service;

    @BeforeEach
    void setUp() {
        service = new PopularTimesService(new PopularTimesCalculator(), bookingHistorySource, popularTimesCache,
                availabilitySource, DialogPropertiesFixture.defaults(), CLOCK);
    }

    private static List<BookingRecord> history() {
        List<BookingRecord> bookings = new ArrayList<>();
        for (int week = 0; week < 4; week++) {
            bookings.add(new BookingRecord("f" + week, "svc-1", "m-1",
                    TODAY.minusWeeks(week).atTime(15, 0), BookingStatus.COMPLETED));
        }
        // 1건뿐인 버킷은 minBookings(3) 필터로 제외된다
        bookings.add(new BookingRecord("x", "svc-1", "m-1", TODAY.minusDays(1).atTime(9, 0),
                BookingStatus.COMPLETED));
        return bookings;
    }

    @Test
    @DisplayName("캐시 미스면 이력으로 계산하고 필터 전 전체 후보를 캐시에 저장한다")
    void computesAndCachesOnMiss() {
        // given
        given(popularTimesCache.find(SALON_ID, null)).willReturn(Optional.empty());
        given(bookingHistorySource.findBookings(SALON_ID, TODAY.minusDays(90))).willReturn(history());

        // when
        List<PopularTimeSlot> result = service.getPopularTimes(SALON_ID, PopularTimesOptions.defaults());

        // then
        assertThat(result).hasSize(1);
        assertThat(result.get(0).dayOfWeek()).isEqualTo(DayOfWeek.FRIDAY);
        assertThat(result.get(0).hour()).isEqualTo(15);
        assertThat(result.get(0).rawCount()).isEqualTo(4);
        verify(popularTimesCache).put(eq(SALON_ID), isNull(),
                argThat(list -> list.size() == 2), eq(Duration.ofSeconds(3600)));
    }

    @Test
    @DisplayName("캐시 히트면 이력을 조회하지 않는다")
    void cacheHitSkipsHistory() {
        // given
        PopularTimeSlot cached = new PopularTimeSlot(DayOfWeek.SATURDAY, 11, 8.0, 4, 0.9, "Saturday 11:00",
                null, null);
        given(popularTimesCache.find(SALON_ID, "svc-1")).willReturn(Optional.of(List.of(cached)));

        // when
        List<PopularTimeSlot> result = service.getPopularTimes(SALON_ID, PopularTimesOptions.forService("svc-1"));

        // then
        assertThat(result).containsExactly(cached);
        verify(bookingHistorySource, never()).findBookings(any(), any());
    }

    @Test
    @DisplayName("담당자 필터가 있으면 캐시를 우회한다")
    void masterFilterBypassesCache() {
        // given
        given(bookingHistorySource.findBookings(SALON_ID, TODAY.minusDays(90))).willReturn(history());
        PopularTimesOptions options = new PopularTimesOptions(null, "m-2", null, null, null, null, false, true);

        // when
        List<PopularTimeSlot> result = service.getPopularTimes(SALON_ID, options);

        // then
        assertThat(result).isEmpty();
        verify(popularTimesCache, never()).find(any(), any());
        verify(popularTimesCache, never()).put(any(), any(), anyList(), any());
    }

    @Test
    @DisplayName("이력 조회 실패는 그대로 전파된다")
    void historyFailurePropagates() {
        // given
        given(popularTimesCache.find(SALON_ID, null)).willReturn(Optional.empty());
        willThrow(new PopularTimesUnavailableException(SALON_ID))
                .given(bookingHistorySource).findBookings(eq(SALON_ID), any());

        // when & then
        assertThatThrownBy(() -> service.getPopularTimes(SALON_ID, PopularTimesOptions.defaults()))
                .isInstanceOf(PopularTimesUnavailableException.class);
    }

    @Test
    @DisplayName("가용성 확인은 다음 해당 요일의 같은 시간대 첫 슬롯을 찾는다")
    void checkAvailabilityFindsNextOccurrence() {
        // given: 토요일 11시는 가능, 금요일 15시는 불가
        LocalDate saturday = TODAY.plusDays(1);
        SlotSuggestion late = new SlotSuggestion("s-2", saturday, LocalTime.of(11, 30), null, null, null,
                "svc-1", null, 60, null);
        SlotSuggestion early = new SlotSuggestion("s-1", saturday, LocalTime.of(11, 0), null, null, null,
                "svc-1", null, 60, null);
        given(availabilitySource.findAvailableSlots(SALON_ID, "svc-1", TODAY, TODAY.plusDays(6)))
                .willReturn(List.of(late, early));
        List<PopularTimeSlot> popular = List.of(
                new PopularTimeSlot(DayOfWeek.SATURDAY, 11, 0, 0, 0.5, "Saturday 11:00", null, null),
                new PopularTimeSlot(DayOfWeek.FRIDAY, 15, 0, 0, 0.5, "Friday 15:00", null, null));

        // when
        List<PopularTimeSlot> checked = service.checkAvailability(SALON_ID, "svc-1", popular, TODAY);

        // then
        assertThat(checked.get(0).available()).isTrue();
        assertThat(checked.get(0).nextAvailableSlot().id()).isEqualTo("s-1");
        assertThat(checked.get(1).available()).isFalse();
        assertThat(checked.get(1).nextAvailableSlot()).isNull();
    }

    @Test
    @DisplayName("서비스 지정 없이 무효화하면 살롱의 모든 캐시를 지운다")
    void invalidateAllForSalon() {
        // given
        given(popularTimesCache.evictAll(SALON_ID)).willReturn(2L);

        // when
        boolean removed = service.invalidateCache(SALON_ID, null);

        // then
        assertThat(removed).isTrue();
        verify(popularTimesCache, never()).evict(any(), any());
    }

    @Test
    @DisplayName("캐시 워밍은 실패한 살롱을 건너뛰고 계속한다")
    void warmCacheSkipsFailures() {
        // given
        given(bookingHistorySource.findBookings(eq("bad"), any()))
                .willThrow(new PopularTimesUnavailableException("bad"));
        given(bookingHistorySource.findBookings(eq(SALON_ID), any())).willReturn(history());

        // when
        int warmed = service.warmCache(List.of("bad", SALON_ID));

        // then
        assertThat(warmed).isEqualTo(1);
        verify(popularTimesCache).put(eq(SALON_ID), isNull(), anyList(), any());
        verify(popularTimesCache, never()).find(any(), any());
    }

    @Test
    @DisplayName("표시 문구를 요청 언어로 만든다")
    void formatForDisplay() {
        List<PopularTimeSlot> popular = List.of(
                new PopularTimeSlot(DayOfWeek.MONDAY, 18, 0, 0, 0.5, "Monday 18:00", null, null));

        assertThat(service.formatForDisplay(popular, "pt")).containsExactly("segunda-feira 18:00");
    }

    @Test
    @DisplayName("기준을 넘는 예약이 없으면 기본 시간대가 아니라 빈 목록을 반환한다")
    void noQualifyingBookingsReturnsEmptyNotDefaults() {
        // given: 취소된 예약과 조회 기간(90일) 밖의 예약만 있다
        PopularTimesCalculator calculator = spy(new PopularTimesCalculator());
        PopularTimesService spiedService = new PopularTimesService(calculator, bookingHistorySource,
                popularTimesCache, availabilitySource, DialogPropertiesFixture.defaults(), CLOCK);
        List<BookingRecord> bookings = new ArrayList<>();
        for (int week = 0; week < 4; week++) {
            bookings.add(new BookingRecord("c" + week, "svc-1", "m-1",
                    TODAY.minusWeeks(week).atTime(15, 0), BookingStatus.CANCELLED));
            bookings.add(new BookingRecord("old" + week, "svc-1", "m-1",
                    TODAY.minusDays(120 + week * 7L).atTime(11, 0), BookingStatus.COMPLETED));
        }
        given(popularTimesCache.find(SALON_ID, null)).willReturn(Optional.empty());
        given(bookingHistorySource.findBookings(SALON_ID, TODAY.minusDays(90))).willReturn(bookings);

        // when
        List<PopularTimeSlot> result = spiedService.getPopularTimes(SALON_ID, PopularTimesOptions.defaults());

        // then
        assertThat(result).isEmpty();
        verify(calculator, never()).getDefaultTimes(any());
    }
}

package personal.ai.dialog.session.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.common.exception.BusinessException;
import personal.ai.dialog.config.DialogPropertiesFixture;
import personal.ai.dialog.session.application.port.out.MessageHistoryReader;
import personal.ai.dialog.session.application.port.out.SessionContextRepository;
import personal.ai.dialog.session.domain.model.BookingContext;
import personal.ai.dialog.session.domain.model.ChoiceRecord;
import personal.ai.dialog.session.domain.model.ConversationState;
import personal.ai.dialog.session.domain.service.ConversationHistoryReplayer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("SessionContextService 단위 테스트")
class SessionContextServiceTest {

    private static final Instant CREATED_AT = Instant.parse("2025-10-24T09:00:00Z");
    private static final String SESSION_ID = "cust-1:salon-1";

    @Mock
    private SessionContextRepository repository;
    @Mock
    private MessageHistoryReader messageHistoryReader;

    private BookingContext context;

    @BeforeEach
    void setUp() {
        context = BookingContext.start("cust-1", "salon-1", "en", "generic", CREATED_AT);
    }

    private SessionContextService serviceAt(Instant now) {
        return new SessionContextService(repository, messageHistoryReader, new ConversationHistoryReplayer(),
                DialogPropertiesFixture.defaults(), Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("저장 시 기본 TTL(1800초)을 적용한다")
    void saveAppliesDefaultTtl() {
        // given
        SessionContextService service = serviceAt(CREATED_AT);

        // when
        boolean saved = service.save(SESSION_ID, context);

        // then
        assertThat(saved).isTrue();
        verify(repository).save(context, Duration.ofSeconds(1800));
    }

    @Test
    @DisplayName("상한(생성 후 3600초)에 가까우면 TTL을 남은 시간으로 줄인다")
    void saveCapsTtlAtHardLimit() {
        // given: 생성 후 3000초
        SessionContextService service = serviceAt(CREATED_AT.plusSeconds(3000));

        // when
        service.save(SESSION_ID, context);

        // then
        verify(repository).save(context, Duration.ofSeconds(600));
    }

    @Test
    @DisplayName("상한을 지난 세션은 저장하지 않고 삭제한다")
    void saveAfterHardLimitDeletes() {
        // given
        SessionContextService service = serviceAt(CREATED_AT.plusSeconds(3600));

        // when
        boolean saved = service.save(SESSION_ID, context);

        // then
        assertThat(saved).isFalse();
        verify(repository).delete(SESSION_ID);
        verify(repository, never()).save(any(), any());
    }

    @Test
    @DisplayName("세션 ID가 다르면 INVALID_INPUT")
    void saveRejectsMismatchedId() {
        SessionContextService service = serviceAt(CREATED_AT);

        assertThatThrownBy(() -> service.save("other:salon", context))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("mismatch");
    }

    @Test
    @DisplayName("t=3000에 1000초 연장해도 만료는 t=3600을 넘지 않는다")
    void extendIsCappedAtHardLimit() {
        // given
        SessionContextService service = serviceAt(CREATED_AT.plusSeconds(3000));
        given(repository.find(SESSION_ID)).willReturn(Optional.of(context));
        given(repository.extend(SESSION_ID, 1000, 600)).willReturn(600L);

        // when
        boolean extended = service.extend(SESSION_ID, 1000);

        // then
        assertThat(extended).isTrue();
        verify(repository).extend(SESSION_ID, 1000, 600);
    }

    @Test
    @DisplayName("t=1700에 연장하면 상한까지 남은 1900초가 cap으로 전달된다")
    void extendEarlyPassesRemainingCap() {
        // given
        SessionContextService service = serviceAt(CREATED_AT.plusSeconds(1700));
        given(repository.find(SESSION_ID)).willReturn(Optional.of(context));
        given(repository.extend(SESSION_ID, 900, 1900)).willReturn(1000L);

        // when
        boolean extended = service.extend(SESSION_ID);

        // then
        assertThat(extended).isTrue();
    }

    @Test
    @DisplayName("없는 세션은 연장되지 않는다")
    void extendMissingSession() {
        // given
        SessionContextService service = serviceAt(CREATED_AT);
        given(repository.find(SESSION_ID)).willReturn(Optional.empty());

        // when & then
        assertThat(service.extend(SESSION_ID, 100)).isFalse();
        verify(repository, never()).extend(any(), anyLong(), anyLong());
    }

    @Test
    @DisplayName("0 이하 연장은 INVALID_INPUT")
    void extendRejectsNonPositive() {
        SessionContextService service = serviceAt(CREATED_AT);

        assertThatThrownBy(() -> service.extend(SESSION_ID, 0))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("상한을 지난 세션은 조회 시 삭제되고 비어 있다")
    void getExpiredSession() {
        // given
        SessionContextService service = serviceAt(CREATED_AT.plusSeconds(3601));
        given(repository.find(SESSION_ID)).willReturn(Optional.of(context));

        // when
        Optional<BookingContext> found = service.get(SESSION_ID);

        // then
        assertThat(found).isEmpty();
        verify(repository).delete(SESSION_ID);
    }

    @Test
    @DisplayName("종료 상태로 바뀌면 세션을 삭제하고 최종 컨텍스트를 반환한다")
    void terminalStateDeletesSession() {
        // given
        SessionContextService service = serviceAt(CREATED_AT.plusSeconds(60));
        given(repository.find(SESSION_ID)).willReturn(Optional.of(context));

        // when
        Optional<BookingContext> updated = service.updateState(SESSION_ID, ConversationState.CONFIRMED);

        // then
        assertThat(updated).get().extracting(BookingContext::state).isEqualTo(ConversationState.CONFIRMED);
        verify(repository).delete(SESSION_ID);
        verify(repository, never()).save(any(), any());
    }

    @Test
    @DisplayName("선택 이력은 최근 10개만 유지한다")
    void addChoiceKeepsLastTen() {
        // given
        SessionContextService service = serviceAt(CREATED_AT.plusSeconds(60));
        BookingContext withChoices = context;
        for (int i = 0; i < 10; i++) {
            withChoices = withChoices.withChoice(new ChoiceRecord("c" + i, CREATED_AT, null), 10, CREATED_AT);
        }
        given(repository.find(SESSION_ID)).willReturn(Optional.of(withChoices));

        // when
        Optional<BookingContext> updated = service.addChoice(SESSION_ID,
                new ChoiceRecord("c10", CREATED_AT.plusSeconds(60), "slots_shown"));

        // then
        ArgumentCaptor<BookingContext> saved = ArgumentCaptor.forClass(BookingContext.class);
        verify(repository).save(saved.capture(), eq(Duration.ofSeconds(1800)));
        assertThat(saved.getValue().choiceHistory()).hasSize(10);
        assertThat(saved.getValue().choiceHistory().get(0).choiceId()).isEqualTo("c1");
        assertThat(saved.getValue().choiceHistory().get(9).choiceId()).isEqualTo("c10");
        assertThat(updated).isPresent();
    }

    @Test
    @DisplayName("정리 작업은 TTL 없는 키와 읽을 수 없는 값만 원자적 조건 삭제로 지운다")
    void cleanupRemovesKeysWithoutTtlOrUnreadable() {
        // given
        SessionContextService service = serviceAt(CREATED_AT);
        given(repository.findAllSessionIds()).willReturn(List.of("a:salon-1", "b:salon-1", "c:salon-1"));
        given(repository.deleteIfNoExpiry("a:salon-1")).willReturn(true);
        given(repository.deleteIfNoExpiry("b:salon-1")).willReturn(false);
        given(repository.deleteIfUnreadable("b:salon-1")).willReturn(false);
        given(repository.deleteIfNoExpiry("c:salon-1")).willReturn(false);
        given(repository.deleteIfUnreadable("c:salon-1")).willReturn(true);

        // when
        int removed = service.cleanup();

        // then
        assertThat(removed).isEqualTo(2);
        verify(repository, never()).delete(any());
    }

    @Test
    @DisplayName("조건 삭제가 실패하면(그 사이 새로 저장됨) 세지 않는다")
    void cleanupSkipsSessionSavedConcurrently() {
        // given
        SessionContextService service = serviceAt(CREATED_AT);
        given(repository.findAllSessionIds()).willReturn(List.of("a:salon-1"));
        given(repository.deleteIfNoExpiry("a:salon-1")).willReturn(false);
        given(repository.deleteIfUnreadable("a:salon-1")).willReturn(false);

        // when
        int removed = service.cleanup();

        // then
        assertThat(removed).isZero();
    }

    @Test
    @DisplayName("활성 세션 수를 살롱별로 센다")
    void activeCountPerSalon() {
        // given
        SessionContextService service = serviceAt(CREATED_AT);
        given(repository.findAllSessionIds()).willReturn(List.of("a:salon-1", "b:salon-2", "c:salon-1"));

        // when & then
        assertThat(service.getActiveCount("salon-1")).isEqualTo(2);
        assertThat(service.getActiveCount(null)).isEqualTo(3);
        assertThat(service.getActiveSalonIds()).containsExactly("salon-1", "salon-2");
    }
}

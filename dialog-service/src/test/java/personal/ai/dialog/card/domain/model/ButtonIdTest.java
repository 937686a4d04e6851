package personal.ai.dialog.card.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import personal.ai.dialog.card.domain.exception.InvalidButtonIdException;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ButtonId 단위 테스트")
class ButtonIdTest {

    @Test
    @DisplayName("슬롯 버튼 ID는 슬롯 ID, 날짜, 시각, 담당자를 담는다")
    void slotButtonCarriesSlotIdentity() {
        // given
        SlotSuggestion slot = new SlotSuggestion("slot-42", LocalDate.of(2026, 10, 23), LocalTime.of(9, 30),
                LocalTime.of(10, 30), "master-7", "Anna", "svc", "Haircut", 60, null);

        // when
        String encoded = ButtonId.slot(slot).encode();

        // then
        assertThat(encoded).isEqualTo("slot|slot-42|2026-10-23|0930|master-7");
        ButtonId parsed = ButtonId.parse(encoded);
        assertThat(parsed.masterId()).isEqualTo("master-7");
        assertThat(parsed.startTime()).isEqualTo(LocalTime.of(9, 30));
    }

    @Test
    @DisplayName("구분자가 포함된 파트는 인코딩되어 보존된다")
    void separatorInsidePartIsEscaped() {
        // when
        String encoded = ButtonId.change("a|b c").encode();

        // then
        assertThat(encoded).isEqualTo("change|a%7Cb+c");
        assertThat(ButtonId.parse(encoded).slotId()).isEqualTo("a|b c");
    }

    @Test
    @DisplayName("담당자가 없으면 masterId는 null")
    void missingMaster() {
        ButtonId parsed = ButtonId.parse("confirm|s1|2026-10-23|1400|");

        assertThat(parsed.action()).isEqualTo(ButtonAction.CONFIRM);
        assertThat(parsed.masterId()).isNull();
    }

    @Test
    @DisplayName("인기 시간대 버튼은 요일과 시를 담는다")
    void popularButton() {
        ButtonId parsed = ButtonId.parse(ButtonId.popular(DayOfWeek.SUNDAY, 18).encode());

        assertThat(parsed.dayOfWeek()).isEqualTo(DayOfWeek.SUNDAY);
        assertThat(parsed.hour()).isEqualTo(18);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "unknown|x",
            "slot|s1|2026-10-23",
            "slot|s1|2026-13-40|1400|",
            "slot||2026-10-23|1400|",
            "popular|8|10",
            "popular|5|24",
            "choice|"
    })
    @DisplayName("형식이 잘못된 버튼 ID는 InvalidButtonIdException")
    void rejectsMalformed(String raw) {
        assertThatThrownBy(() -> ButtonId.parse(raw))
                .isInstanceOf(InvalidButtonIdException.class);
    }

    @Test
    @DisplayName("최대 길이(200자)를 넘으면 거부한다")
    void rejectsTooLong() {
        String raw = "choice|" + "x".repeat(201 - "choice|".length());

        assertThat(raw).hasSize(201);
        assertThatThrownBy(() -> ButtonId.parse(raw))
                .isInstanceOf(InvalidButtonIdException.class);
    }

    @Test
    @DisplayName("정확히 200자인 버튼 ID는 허용한다")
    void acceptsMaximumLength() {
        String raw = "choice|" + "x".repeat(200 - "choice|".length());

        ButtonId id = ButtonId.parse(raw);

        assertThat(raw).hasSize(ButtonId.MAX_LENGTH);
        assertThat(id.choiceId()).hasSize(193);
    }
}

package personal.ai.dialog.acceptance.steps;

import io.cucumber.datatable.DataTable;
import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import lombok.extern.slf4j.Slf4j;
import personal.ai.dialog.acceptance.support.ConversationWorld;
import personal.ai.dialog.card.domain.model.ButtonAction;
import personal.ai.dialog.card.domain.model.ButtonId;
import personal.ai.dialog.card.domain.model.InteractivePayload;
import personal.ai.dialog.card.domain.model.ReplyButton;
import personal.ai.dialog.conversation.domain.model.InboundEvent;
import personal.ai.dialog.popular.domain.model.BookingRecord;
import personal.ai.dialog.popular.domain.model.BookingStatus;
import personal.ai.dialog.session.domain.model.OriginalIntent;
import personal.ai.dialog.suggestion.domain.model.SlotSuggestion;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Conversation Step Definitions
 */
@Slf4j
public class ConversationSteps {

    private static final String SERVICE_ID = "svc-1";

    private final ConversationWorld world;

    public ConversationSteps(ConversationWorld world) {
        this.world = world;
    }

    // ==================== Given ====================

    @Given("the salon has open {string} slots")
    public void the_salon_has_open_slots(String serviceName, DataTable table) {
        for (Map<String, String> row : table.asMaps()) {
            LocalTime start = LocalTime.parse(row.get("time"));
            world.getBookingCore().addOpenSlot(new SlotSuggestion(row.get("id"), LocalDate.parse(row.get("date")),
                    start, start.plusMinutes(60), "m-" + row.get("master"), row.get("master"), SERVICE_ID,
                    serviceName, 60, new BigDecimal("1500")));
        }
    }

    @Given("the salon history has {int} completed bookings on {string} at {int}")
    public void the_salon_history_has_bookings(int count, String day, int hour) {
        LocalDate today = LocalDate.ofInstant(ConversationWorld.START, world.getClock().getZone());
        LocalDate last = today.minusDays(1).with(TemporalAdjusters.previousOrSame(DayOfWeek.valueOf(day)));
        for (int i = 0; i < count; i++) {
            world.getBookingCore().addHistory(new BookingRecord("h" + i, SERVICE_ID, "m-Anna",
                    last.minusWeeks(i).atTime(hour, 0), BookingStatus.COMPLETED));
        }
    }

    @Given("the customer writes in {string}")
    public void the_customer_writes_in(String language) {
        world.useLanguage(language);
    }

    // ==================== When ====================

    @When("the customer asks for {string} on {string} at {string}")
    public void the_customer_asks_for_at(String serviceName, String date, String time) {
        ask(new OriginalIntent(SERVICE_ID, serviceName, LocalDate.parse(date), LocalTime.parse(time), null,
                serviceName + " " + date + " " + time));
    }

    @When("the customer asks for {string} on {string} without a time")
    public void the_customer_asks_for_without_time(String serviceName, String date) {
        ask(new OriginalIntent(SERVICE_ID, serviceName, LocalDate.parse(date), null, null,
                serviceName + " " + date));
    }

    @When("the customer taps the choice {string}")
    public void the_customer_taps_the_choice(String choiceId) {
        tap(ButtonId.choice(choiceId).encode());
    }

    @When("the customer taps the slot {string}")
    public void the_customer_taps_the_slot(String slotId) {
        tap(findOption(ButtonAction.SLOT, slotId));
    }

    @When("the customer confirms the slot {string}")
    public void the_customer_confirms_the_slot(String slotId) {
        tap(findOption(ButtonAction.CONFIRM, slotId));
    }

    @When("the customer taps the popular time {string} at {int}")
    public void the_customer_taps_the_popular_time(String day, int hour) {
        tap(ButtonId.popular(DayOfWeek.valueOf(day), hour).encode());
    }

    @And("{int} seconds pass")
    public void seconds_pass(int seconds) {
        world.getClock().advance(Duration.ofSeconds(seconds));
    }

    // ==================== Then ====================

    @Then("the reply offers the choices {string}")
    public void the_reply_offers_the_choices(String choiceIds) {
        List<String> expected = split(choiceIds).stream()
                .map(id -> ButtonId.choice(id).encode())
                .toList();
        assertThat(lastPayload().optionIds()).containsExactlyElementsOf(expected);
    }

    @Then("the reply shows the buttons {string}")
    public void the_reply_shows_the_buttons(String titles) {
        assertThat(lastPayload().buttons()).extracting(ReplyButton::title)
                .containsExactlyElementsOf(split(titles));
    }

    @Then("the reply text starts with {string}")
    public void the_reply_text_starts_with(String prefix) {
        assertThat(lastPayload().body()).startsWith(prefix);
    }

    @Then("the booking for slot {string} is created")
    public void the_booking_is_created(String slotId) {
        assertThat(world.getBookingCore().booked()).extracting(SlotSuggestion::id).containsExactly(slotId);
    }

    @And("the conversation state is {string}")
    public void the_conversation_state_is(String state) {
        assertThat(world.getLastReply().state().code()).isEqualTo(state);
    }

    @And("the session is closed")
    public void the_session_is_closed() {
        assertThat(world.getSessions().exists(world.sessionId())).isFalse();
    }

    @And("every reply was delivered to the customer")
    public void every_reply_was_delivered() {
        assertThat(world.getChannel().sent()).isNotEmpty();
        assertThat(world.getChannel().sent().get(world.getChannel().sent().size() - 1)).isEqualTo(lastPayload());
    }

    @And("the reply is not degraded")
    public void the_reply_is_not_degraded() {
        assertThat(world.getLastReply().degraded()).isFalse();
    }

    // ==================== Helpers ====================

    private void ask(OriginalIntent intent) {
        world.send(new InboundEvent(world.getCustomerId(), world.getSalonId(), intent.rawText(), null, intent,
                world.getLanguage(), null));
        log.info("Asked: intent={}, reply={}", intent, world.getLastReply().payload().type());
    }

    private void tap(String buttonId) {
        world.send(new InboundEvent(world.getCustomerId(), world.getSalonId(), null, buttonId, null, null, null));
        log.info("Tapped: buttonId={}, reply={}", buttonId, world.getLastReply().payload().type());
    }

    private String findOption(ButtonAction action, String slotId) {
        return lastPayload().optionIds().stream()
                .filter(id -> {
                    ButtonId parsed = ButtonId.parse(id);
                    return parsed.action() == action && parsed.slotId().equals(slotId);
                })
                .findFirst()
                .orElseThrow(() -> new AssertionError("No " + action + " option for slot " + slotId));
    }

    private InteractivePayload lastPayload() {
        return world.getLastReply().payload();
    }

    private List<String> split(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .toList();
    }
}

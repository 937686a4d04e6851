package personal.ai.dialog.acceptance.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import personal.ai.dialog.card.application.service.InteractiveCardBuilder;
import personal.ai.dialog.config.DialogProperties;
import personal.ai.dialog.config.DialogPropertiesFixture;
import personal.ai.dialog.conversation.application.service.BookingOrchestrator;
import personal.ai.dialog.conversation.domain.model.InboundEvent;
import personal.ai.dialog.conversation.domain.model.OutboundMessage;
import personal.ai.dialog.message.adapter.out.template.ClasspathJsonTemplateSource;
import personal.ai.dialog.message.application.service.MessageBuilderService;
import personal.ai.dialog.popular.application.service.PopularTimesService;
import personal.ai.dialog.popular.domain.service.PopularTimesCalculator;
import personal.ai.dialog.session.application.service.SessionContextService;
import personal.ai.dialog.session.domain.service.ConversationHistoryReplayer;
import personal.ai.dialog.suggestion.domain.service.AlternativeSuggester;

import java.time.Instant;
import java.util.List;

/**
 * 시나리오 하나 동안 공유되는 상태
 * 실제 서비스 조립 + 메모리 저장소/예약 코어 대역
 */
@Getter
public class ConversationWorld {

    public static final Instant START = Instant.parse("2026-10-22T09:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final DialogProperties properties = DialogPropertiesFixture.defaults();
    private final FakeBookingCore bookingCore = new FakeBookingCore();
    private final RecordingChannelSender channel = new RecordingChannelSender();
    private final InMemorySessionContextRepository sessionRepository = new InMemorySessionContextRepository(clock);
    private final InMemoryPopularTimesCache popularTimesCache = new InMemoryPopularTimesCache();
    private final SessionContextService sessions;
    private final BookingOrchestrator orchestrator;

    private String customerId = "cust-1";
    private String salonId = "salon-1";
    private String language = "en";
    private OutboundMessage lastReply;

    public ConversationWorld() {
        MessageBuilderService messageBuilder = new MessageBuilderService(
                new ClasspathJsonTemplateSource(new ObjectMapper(), "messages/templates.json"));
        this.sessions = new SessionContextService(sessionRepository,
                (customer, salon, limit) -> List.of(),
                new ConversationHistoryReplayer(), properties, clock);
        PopularTimesService popularTimes = new PopularTimesService(new PopularTimesCalculator(), bookingCore,
                popularTimesCache, bookingCore, properties, clock);
        this.orchestrator = new BookingOrchestrator(sessions, popularTimes, messageBuilder,
                new InteractiveCardBuilder(messageBuilder), new AlternativeSuggester(), bookingCore, bookingCore,
                channel, properties, clock);
    }

    public void useLanguage(String language) {
        this.language = language;
    }

    public OutboundMessage send(InboundEvent event) {
        lastReply = orchestrator.handle(event);
        return lastReply;
    }

    public String sessionId() {
        return customerId + ":" + salonId;
    }
}

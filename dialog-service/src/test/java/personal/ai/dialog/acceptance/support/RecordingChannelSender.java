package personal.ai.dialog.acceptance.support;

import personal.ai.dialog.card.domain.model.InteractivePayload;
import personal.ai.dialog.conversation.application.port.out.ChannelSender;

import java.util.ArrayList;
import java.util.List;

public class RecordingChannelSender implements ChannelSender {

    private final List<InteractivePayload> sent = new ArrayList<>();

    @Override
    public void send(String customerId, InteractivePayload payload) {
        sent.add(payload);
    }

    public List<InteractivePayload> sent() {
        return sent;
    }
}

package personal.ai.dialog.conversation.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.ai.common.dto.ApiResponse;
import personal.ai.dialog.conversation.adapter.in.web.dto.InboundEventRequest;
import personal.ai.dialog.conversation.adapter.in.web.dto.OutboundMessageResponse;
import personal.ai.dialog.conversation.application.port.in.HandleInboundEventUseCase;
import personal.ai.dialog.conversation.domain.model.OutboundMessage;

/**
 * Conversation API Controller
 * POST /api/v1/conversations/events
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final HandleInboundEventUseCase handleInboundEventUseCase;

    @PostMapping("/events")
    public ResponseEntity<ApiResponse<OutboundMessageResponse>> handleEvent(
            @Valid @RequestBody InboundEventRequest request
    ) {
        log.info("Inbound event: customerId={}, salonId={}, tap={}",
                request.customerId(), request.salonId(), request.buttonId() != null);

        OutboundMessage message = handleInboundEventUseCase.handle(request.toEvent());
        OutboundMessageResponse response = OutboundMessageResponse.from(message);

        if (message.degraded()) {
            return ResponseEntity.ok(ApiResponse.success("Event handled in degraded mode", response));
        }
        return ResponseEntity.ok(ApiResponse.success("Event handled", response));
    }
}

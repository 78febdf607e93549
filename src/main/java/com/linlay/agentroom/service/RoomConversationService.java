package com.linlay.agentroom.service;

import com.linlay.agentroom.agent.AgentRouter;
import com.linlay.agentroom.agent.AgentSelection;
import com.linlay.agentroom.config.AgentRoomProperties;
import com.linlay.agentroom.model.ChatMessage;
import com.linlay.agentroom.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A room turn: the operator message is stored once, then every selected agent answers in order,
 * each seeing the replies stored before it.
 */
@Service
public class RoomConversationService {

    private static final Logger log = LoggerFactory.getLogger(RoomConversationService.class);

    private final InputValidator inputValidator;
    private final AgentRouter agentRouter;
    private final AgentTurnService agentTurnService;
    private final MessageStore messageStore;
    private final int historyLimit;

    public RoomConversationService(
            InputValidator inputValidator,
            AgentRouter agentRouter,
            AgentTurnService agentTurnService,
            MessageStore messageStore,
            AgentRoomProperties properties
    ) {
        this.inputValidator = inputValidator;
        this.agentRouter = agentRouter;
        this.agentTurnService = agentTurnService;
        this.messageStore = messageStore;
        this.historyLimit = properties.getContext().getHistoryLimit();
    }

    public Mono<RoomReply> submit(String room, String text, ConfirmationHandler confirmations) {
        return Mono.defer(() -> {
            String roomName = inputValidator.validateRoomName(room);
            String content = inputValidator.validateMessage(text);
            AgentSelection selection = agentRouter.selectAgents(content);
            messageStore.append(roomName, ChatMessage.user(content));
            log.debug("Room '{}' message routed to {}", roomName, selection.agents());

            return Flux.fromIterable(selection.agents())
                    .concatMap(agent -> Mono.defer(() -> agentTurnService.runTurn(
                                    agent, messageStore.history(roomName, historyLimit), confirmations))
                            .doOnNext(result -> messageStore.append(
                                    roomName, ChatMessage.assistant(result.reply(), result.agentName()))))
                    .collectList()
                    .map(turns -> new RoomReply(roomName, selection.agents(), selection.fallback(), turns));
        });
    }

    public List<ChatMessage> history(String room) {
        return messageStore.history(inputValidator.validateRoomName(room), historyLimit);
    }
}

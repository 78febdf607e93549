package com.linlay.agentroom.controller;

import com.linlay.agentroom.model.api.ApiResponse;
import com.linlay.agentroom.model.api.MessageResponse;
import com.linlay.agentroom.model.api.SubmitMessageRequest;
import com.linlay.agentroom.service.ConfirmationHandler;
import com.linlay.agentroom.service.RoomConversationService;
import com.linlay.agentroom.service.RoomReply;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Room conversation over HTTP. There is no operator on the line during a request, so tool calls of
 * untrusted agents come back as {@code PENDING_CONFIRMATION}.
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomController {

    private final RoomConversationService roomConversationService;

    public RoomController(RoomConversationService roomConversationService) {
        this.roomConversationService = roomConversationService;
    }

    @PostMapping("/{room}/messages")
    public Mono<ApiResponse<RoomReply>> submit(
            @PathVariable String room,
            @Valid @RequestBody SubmitMessageRequest request
    ) {
        return roomConversationService.submit(room, request.content(), ConfirmationHandler.DEFER_ALL)
                .map(ApiResponse::success);
    }

    @GetMapping("/{room}/messages")
    public ApiResponse<List<MessageResponse>> messages(@PathVariable String room) {
        return ApiResponse.success(roomConversationService.history(room).stream()
                .map(MessageResponse::from)
                .toList());
    }
}

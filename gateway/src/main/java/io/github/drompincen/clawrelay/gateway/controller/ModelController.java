package io.github.drompincen.clawrelay.gateway.controller;

import io.github.drompincen.clawrelay.protocol.api.ModelInfo;
import io.github.drompincen.clawrelay.runtime.conversation.ConversationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/models")
public class ModelController {

    private final ConversationService conversations;

    public ModelController(ConversationService conversations) {
        this.conversations = conversations;
    }

    @GetMapping
    public List<ModelInfo> list() {
        return conversations.listModels();
    }
}

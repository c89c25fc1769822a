package io.github.drompincen.clawrelay.gateway.controller;

import io.github.drompincen.clawrelay.gateway.notify.WebSocketJobNotifier;
import io.github.drompincen.clawrelay.runtime.auth.AuthEvent;
import io.github.drompincen.clawrelay.runtime.conversation.ConversationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.Disposable;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts an interactive provider login. The call returns at once; the login URL and the final
 * result reach the conversation over the WebSocket.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final ConversationService conversations;
    private final WebSocketJobNotifier notifier;
    private final Map<String, Disposable> activeLogins = new ConcurrentHashMap<>();

    public AuthController(ConversationService conversations, WebSocketJobNotifier notifier) {
        this.conversations = conversations;
        this.notifier = notifier;
    }

    @PostMapping("/login/{provider}")
    public ResponseEntity<?> login(@PathVariable String provider, @RequestParam String conversationKey) {
        String providerKey = provider.toLowerCase(Locale.ROOT);
        // placeholder reserves the slot until the subscription exists
        Disposable placeholder = () -> {};
        if (activeLogins.putIfAbsent(providerKey, placeholder) != null) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "A login for " + providerKey + " is already in progress"));
        }

        log.info("Starting {} login for {}", providerKey, conversationKey);
        Disposable subscription = conversations.login(providerKey)
                .doFinally(signal -> activeLogins.remove(providerKey))
                .subscribe(
                        event -> notifier.onAuthEvent(conversationKey, providerKey, event),
                        error -> {
                            log.error("Login for {} failed", providerKey, error);
                            notifier.onAuthEvent(conversationKey, providerKey, AuthEvent.failed(error.getMessage()));
                        });
        activeLogins.replace(providerKey, placeholder, subscription);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("provider", providerKey, "conversationKey", conversationKey, "status", "STARTED"));
    }

    boolean isLoginActive(String provider) {
        return activeLogins.containsKey(provider.toLowerCase(Locale.ROOT));
    }
}

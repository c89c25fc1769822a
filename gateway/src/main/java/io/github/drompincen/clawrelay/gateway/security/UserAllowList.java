package io.github.drompincen.clawrelay.gateway.security;

import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import org.springframework.stereotype.Component;

import java.util.Set;

/** Optional gate on who may submit prompts. An empty list lets everyone through. */
@Component
public class UserAllowList {

    private final Set<String> allowed;

    public UserAllowList(RelayProperties properties) {
        this.allowed = Set.copyOf(properties.getAllowedUserIds());
    }

    public boolean isAllowed(String userId) {
        if (allowed.isEmpty()) return true;
        return userId != null && allowed.contains(userId);
    }

    public boolean isRestricted() {
        return !allowed.isEmpty();
    }
}

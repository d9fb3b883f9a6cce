package com.libragraph.chatvault.api;

import com.libragraph.chatvault.core.chat.ChatStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Always UP; reports whether an archive was found without decrypting it.
 */
@Readiness
@ApplicationScoped
public class ArchiveHealthCheck implements HealthCheck {

    @Inject
    ChatStore store;

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("chat-archive")
                .up()
                .withData("available", store.isAvailable())
                .withData("open", store.isOpen())
                .build();
    }
}

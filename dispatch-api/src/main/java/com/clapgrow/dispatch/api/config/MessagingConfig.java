package com.clapgrow.dispatch.api.config;

import com.clapgrow.dispatch.api.adapter.MessageAdapterRegistry;
import com.clapgrow.dispatch.common.dispatch.DispatchOrchestrator;
import com.clapgrow.dispatch.common.provider.MessageAdapter;
import com.clapgrow.dispatch.common.provider.NoOpMessageAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the dispatch orchestrator to the adapter selected by {@code messaging.provider}.
 */
@Configuration
@Slf4j
public class MessagingConfig {

    @Bean
    public NoOpMessageAdapter noOpMessageAdapter() {
        return new NoOpMessageAdapter();
    }

    @Bean
    public DispatchOrchestrator dispatchOrchestrator(MessageAdapterRegistry registry, MessagingProperties properties) {
        MessageAdapter initial = registry.resolveOrDefault(properties.getProvider());
        log.info("Dispatch orchestrator bound to {} (available: {})",
            initial.getProviderName().getDisplayName(), registry.availableProviders());
        return new DispatchOrchestrator(initial);
    }
}

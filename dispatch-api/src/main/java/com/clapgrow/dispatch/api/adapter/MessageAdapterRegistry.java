package com.clapgrow.dispatch.api.adapter;

import com.clapgrow.dispatch.common.provider.MessageAdapter;
import com.clapgrow.dispatch.common.provider.ProviderName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of every {@link MessageAdapter} bean, keyed by {@link ProviderName}.
 *
 * Only adapters whose backend is enabled are registered; {@link ProviderName#NOOP} is always present.
 */
@Component
@Slf4j
public class MessageAdapterRegistry {

    private final Map<ProviderName, MessageAdapter> adapters = new EnumMap<>(ProviderName.class);

    public MessageAdapterRegistry(List<MessageAdapter> available) {
        for (MessageAdapter adapter : available) {
            MessageAdapter previous = adapters.put(adapter.getProviderName(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate message adapter for provider " + adapter.getProviderName());
            }
        }
        if (!adapters.containsKey(ProviderName.NOOP)) {
            throw new IllegalStateException("No-op message adapter must be registered");
        }
        log.info("Registered message adapters: {}", adapters.keySet());
    }

    public Optional<MessageAdapter> find(ProviderName providerName) {
        return Optional.ofNullable(adapters.get(providerName));
    }

    /**
     * @throws IllegalArgumentException if the name is unknown or its backend is not enabled
     */
    public MessageAdapter get(String providerName) {
        ProviderName name = ProviderName.fromString(providerName);
        return find(name).orElseThrow(() -> new IllegalArgumentException(
            "Provider " + name.toConfigValue() + " is not enabled. Available: " + availableProviders()));
    }

    /**
     * Startup binding: unknown or disabled providers fall back to the no-op adapter.
     */
    public MessageAdapter resolveOrDefault(String providerName) {
        try {
            return get(providerName);
        } catch (IllegalArgumentException e) {
            log.warn("Falling back to {} provider: {}", ProviderName.NOOP.getDisplayName(), e.getMessage());
            return adapters.get(ProviderName.NOOP);
        }
    }

    public Set<ProviderName> availableProviders() {
        return Collections.unmodifiableSet(adapters.keySet());
    }
}

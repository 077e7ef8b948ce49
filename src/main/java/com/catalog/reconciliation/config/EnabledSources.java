package com.catalog.reconciliation.config;

import com.catalog.reconciliation.core.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses the comma-separated provider list setting, e.g. {@code "ardb, metaforge"}.
 * Unknown ids are ignored; an empty or unusable value yields the default providers.
 */
public final class EnabledSources {
    private static final Logger log = LoggerFactory.getLogger(EnabledSources.class);

    private EnabledSources() {
    }

    public static List<Provider> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ReconciliationConfig.DEFAULT_ENABLED_SOURCES;
        }
        List<Provider> parsed = new ArrayList<>();
        for (String token : raw.split(",")) {
            Optional<Provider> provider = Provider.fromId(token);
            if (provider.isEmpty()) {
                if (!token.isBlank()) {
                    log.warn("config.unknown-provider id='{}'", token.trim());
                }
                continue;
            }
            if (!parsed.contains(provider.get())) {
                parsed.add(provider.get());
            }
        }
        return parsed.isEmpty() ? ReconciliationConfig.DEFAULT_ENABLED_SOURCES : List.copyOf(parsed);
    }
}

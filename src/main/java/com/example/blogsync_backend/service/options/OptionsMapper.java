package com.example.blogsync_backend.service.options;

import com.example.blogsync_backend.config.BlogOptionsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens blog option responses into {@link NormalizedOptions}.
 * <p>
 * The legacy RPC options listing wraps every option in a descriptor such as
 * {@code {"default_category": {"desc": "Default Category", "readonly": false, "value": "5"}}};
 * the settings endpoint already delivers a flat mapping. Malformed entries are skipped, never rejected.
 */
@Component
public class OptionsMapper {
    private static final Logger LOGGER = LoggerFactory.getLogger(OptionsMapper.class);

    private final BlogOptionsProperties properties;

    public OptionsMapper(BlogOptionsProperties properties) {
        this.properties = properties;
    }

    /**
     * Replaces each option descriptor with its value entry.
     *
     * @param response option name to descriptor mapping, may be {@code null}.
     * @return normalized options holding one entry per well-formed descriptor (never {@code null}).
     */
    public NormalizedOptions mapOptions(Map<?, ?> response) {
        if (response == null || response.isEmpty()) {
            return NormalizedOptions.empty();
        }
        String valueKey = properties.getValueKey();
        Map<String, Object> flat = new LinkedHashMap<>();
        int skipped = 0;
        for (Map.Entry<?, ?> entry : response.entrySet()) {
            if (entry.getKey() == null || !(entry.getValue() instanceof Map<?, ?> descriptor)) {
                skipped++;
                continue;
            }
            Object value = descriptor.get(valueKey);
            if (value == null) {
                skipped++;
                continue;
            }
            if (flat.putIfAbsent(entry.getKey().toString(), value) != null) {
                skipped++;
            }
        }
        if (skipped > 0) {
            LOGGER.debug("OptionsMapper skipped malformed or duplicate descriptors count={} mapped={}", skipped, flat.size());
        }
        return NormalizedOptions.of(flat);
    }

    /**
     * Already-normalized options are returned unchanged.
     */
    public NormalizedOptions mapOptions(NormalizedOptions options) {
        return options != null ? options : NormalizedOptions.empty();
    }

    /**
     * Reads the flat option mapping of a settings endpoint body, either nested under the settings key or at the top level.
     *
     * @param body settings endpoint body, may be {@code null}.
     * @return normalized options (never {@code null}).
     */
    public NormalizedOptions fromSettings(Map<?, ?> body) {
        if (body == null || body.isEmpty()) {
            return NormalizedOptions.empty();
        }
        Object nested = body.get(properties.getSettingsKey());
        if (nested instanceof Map<?, ?> settings) {
            return NormalizedOptions.of(settings);
        }
        return NormalizedOptions.of(body);
    }
}

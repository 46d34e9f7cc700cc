package com.example.blogsync_backend.service.options;

import com.example.blogsync_backend.config.BlogOptionsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the default category and default post format, which appear both in the legacy options listing and in the
 * settings endpoint once normalized.
 */
@Component
public class DefaultFieldExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultFieldExtractor.class);

    private final BlogOptionsProperties properties;

    public DefaultFieldExtractor(BlogOptionsProperties properties) {
        this.properties = properties;
    }

    /**
     * @param options normalized options, may be {@code null}.
     * @return the default category identifier, or empty when absent or not an integer.
     */
    public Optional<Long> defaultCategoryId(NormalizedOptions options) {
        if (options == null) {
            return Optional.empty();
        }
        String key = properties.getDefaultCategoryKey();
        Optional<OptionValue> value = options.find(key);
        Optional<Long> id = value.flatMap(OptionValue::asLong);
        if (value.isPresent() && id.isEmpty()) {
            LOGGER.debug("DefaultFieldExtractor ignored key={} kind={} reason=not_integral", key, value.get().kind());
        }
        return id;
    }

    /**
     * @param options normalized options, may be {@code null}.
     * @return the default post format, or empty when absent or blank.
     */
    public Optional<String> defaultPostFormat(NormalizedOptions options) {
        if (options == null) {
            return Optional.empty();
        }
        return options.find(properties.getDefaultPostFormatKey()).flatMap(OptionValue::asText);
    }
}

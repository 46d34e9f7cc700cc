package com.example.blogsync_backend.service.options;

import com.example.blogsync_backend.config.BlogOptionsProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a REST site response onto the legacy options listing shape, so REST and RPC backed blogs share one pipeline.
 */
@Component
public class RestSiteOptionsMapper {
    static final String HOME_URL = "home_url";
    static final String BLOG_PUBLIC = "blog_public";
    static final String JETPACK_CLIENT_ID = "jetpack_client_id";
    static final String POST_THUMBNAIL = "post_thumbnail";

    private final BlogOptionsProperties properties;

    public RestSiteOptionsMapper(BlogOptionsProperties properties) {
        this.properties = properties;
    }

    /**
     * @param site site response, may be {@code null}.
     * @return option name to descriptor mapping (never {@code null}).
     */
    public Map<String, Object> mapSiteResponse(Map<?, ?> site) {
        Map<?, ?> source = site != null ? site : Map.of();
        Map<String, Object> options = new LinkedHashMap<>();
        putIfPresent(options, HOME_URL, source.get("URL"));
        // stored as text to match what the RPC listing returns
        options.put(BLOG_PUBLIC, isTruthy(source.get("is_private")) ? "-1" : "0");
        if (isTruthy(source.get("jetpack"))) {
            putIfPresent(options, JETPACK_CLIENT_ID,
                    OptionValue.of(source.get("ID")).flatMap(OptionValue::asLong).orElse(null));
        }
        if (source.get("options") instanceof Map<?, ?> siteOptions) {
            putIfPresent(options, POST_THUMBNAIL, siteOptions.get("featured_images_enabled"));
            for (String key : properties.getDirectMapKeys()) {
                putIfPresent(options, key, siteOptions.get(key));
            }
        }

        Map<String, Object> descriptors = new LinkedHashMap<>();
        options.forEach((key, value) -> descriptors.put(key, Map.of(properties.getValueKey(), value)));
        return descriptors;
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    static boolean isTruthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof CharSequence text) {
            String normalized = text.toString().trim().toLowerCase(Locale.ROOT);
            return "true".equals(normalized) || "1".equals(normalized);
        }
        return false;
    }
}

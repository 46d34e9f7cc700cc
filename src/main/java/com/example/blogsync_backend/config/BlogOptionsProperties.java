package com.example.blogsync_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Key names used when reading blog options out of remote responses.
 */
@ConfigurationProperties(prefix = "blog.options")
public class BlogOptionsProperties {
    private String valueKey = "value";
    private String settingsKey = "settings";
    private String defaultCategoryKey = "default_category";
    private String defaultPostFormatKey = "default_post_format";
    private List<String> directMapKeys = new ArrayList<>(List.of(
            "active_modules",
            "admin_url",
            "login_url",
            "image_default_link_type",
            "software_version",
            "videopress_enabled",
            "timezone",
            "gmt_offset",
            "allowed_file_types",
            "default_category",
            "default_post_format"
    ));

    public String getValueKey() {
        return valueKey;
    }

    public void setValueKey(String valueKey) {
        this.valueKey = valueKey;
    }

    public String getSettingsKey() {
        return settingsKey;
    }

    public void setSettingsKey(String settingsKey) {
        this.settingsKey = settingsKey;
    }

    public String getDefaultCategoryKey() {
        return defaultCategoryKey;
    }

    public void setDefaultCategoryKey(String defaultCategoryKey) {
        this.defaultCategoryKey = defaultCategoryKey;
    }

    public String getDefaultPostFormatKey() {
        return defaultPostFormatKey;
    }

    public void setDefaultPostFormatKey(String defaultPostFormatKey) {
        this.defaultPostFormatKey = defaultPostFormatKey;
    }

    public List<String> getDirectMapKeys() {
        return directMapKeys;
    }

    public void setDirectMapKeys(List<String> directMapKeys) {
        this.directMapKeys = directMapKeys;
    }
}

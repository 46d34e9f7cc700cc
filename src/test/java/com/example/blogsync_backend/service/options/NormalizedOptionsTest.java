package com.example.blogsync_backend.service.options;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NormalizedOptionsTest {

    @Test
    void nestedValuesAreDetachedFromInput() {
        List<String> fileTypes = new ArrayList<>(List.of("jpg", "png"));
        Map<String, Object> modules = new LinkedHashMap<>();
        modules.put("stats", true);
        Map<String, Object> flat = new LinkedHashMap<>();
        flat.put("allowed_file_types", fileTypes);
        flat.put("active_modules", modules);

        NormalizedOptions options = NormalizedOptions.of(flat);
        fileTypes.add("gif");
        modules.put("sso", true);

        assertThat(options.asMap())
                .containsEntry("allowed_file_types", List.of("jpg", "png"))
                .containsEntry("active_modules", Map.of("stats", true));
    }

    @Test
    void nestedValuesCannotBeModified() {
        NormalizedOptions options = NormalizedOptions.of(Map.of("allowed_file_types", List.of("jpg")));

        @SuppressWarnings("unchecked")
        List<Object> fileTypes = (List<Object>) options.asMap().get("allowed_file_types");

        assertThatThrownBy(() -> fileTypes.add("gif")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> options.asMap().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void keysRenderingToSameNameKeepFirst() {
        Map<Object, Object> flat = new LinkedHashMap<>();
        flat.put(1, "numeric");
        flat.put("1", "text");

        NormalizedOptions options = NormalizedOptions.of(flat);

        assertThat(options.size()).isEqualTo(1);
        assertThat(options.find("1")).map(OptionValue::raw).contains("numeric");
    }
}

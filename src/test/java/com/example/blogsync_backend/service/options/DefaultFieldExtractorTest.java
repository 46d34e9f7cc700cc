package com.example.blogsync_backend.service.options;

import com.example.blogsync_backend.config.BlogOptionsProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultFieldExtractorTest {

    private final DefaultFieldExtractor extractor = new DefaultFieldExtractor(new BlogOptionsProperties());

    @Test
    void defaultCategoryIdParsesStringEncodedNumber() {
        assertThat(extractor.defaultCategoryId(NormalizedOptions.of(Map.of("default_category", "5")))).contains(5L);
        assertThat(extractor.defaultCategoryId(NormalizedOptions.of(Map.of("default_category", " 12 ")))).contains(12L);
    }

    @Test
    void defaultCategoryIdAcceptsNativeNumbers() {
        assertThat(extractor.defaultCategoryId(NormalizedOptions.of(Map.of("default_category", 9)))).contains(9L);
        assertThat(extractor.defaultCategoryId(NormalizedOptions.of(Map.of("default_category", 9000000000L)))).contains(9000000000L);
        assertThat(extractor.defaultCategoryId(NormalizedOptions.of(Map.of("default_category", 4.0)))).contains(4L);
    }

    @Test
    void defaultCategoryIdIsEmptyWhenAbsentOrMalformed() {
        assertThat(extractor.defaultCategoryId(NormalizedOptions.empty())).isEmpty();
        assertThat(extractor.defaultCategoryId(null)).isEmpty();
        assertThat(extractor.defaultCategoryId(NormalizedOptions.of(Map.of("default_category", "uncategorized")))).isEmpty();
        assertThat(extractor.defaultCategoryId(NormalizedOptions.of(Map.of("default_category", "")))).isEmpty();
        assertThat(extractor.defaultCategoryId(NormalizedOptions.of(Map.of("default_category", 2.5)))).isEmpty();
        assertThat(extractor.defaultCategoryId(NormalizedOptions.of(Map.of("default_category", true)))).isEmpty();
        assertThat(extractor.defaultCategoryId(NormalizedOptions.of(Map.of("default_category", List.of(1))))).isEmpty();
    }

    @Test
    void defaultPostFormatReturnsText() {
        assertThat(extractor.defaultPostFormat(NormalizedOptions.of(Map.of("default_post_format", "standard"))))
                .contains("standard");
    }

    @Test
    void defaultPostFormatTreatsEmptyAsUnset() {
        assertThat(extractor.defaultPostFormat(NormalizedOptions.of(Map.of("default_post_format", "")))).isEmpty();
        assertThat(extractor.defaultPostFormat(NormalizedOptions.of(Map.of("default_post_format", "  ")))).isEmpty();
        assertThat(extractor.defaultPostFormat(NormalizedOptions.empty())).isEmpty();
        assertThat(extractor.defaultPostFormat(null)).isEmpty();
    }

    @Test
    void defaultPostFormatRendersNumbersAsText() {
        assertThat(extractor.defaultPostFormat(NormalizedOptions.of(Map.of("default_post_format", 0)))).contains("0");
    }

    @Test
    void extractorUsesConfiguredKeys() {
        BlogOptionsProperties properties = new BlogOptionsProperties();
        properties.setDefaultCategoryKey("category");
        properties.setDefaultPostFormatKey("format");
        DefaultFieldExtractor custom = new DefaultFieldExtractor(properties);
        NormalizedOptions options = NormalizedOptions.of(Map.of(
                "category", "8",
                "format", "link",
                "default_category", "1"
        ));

        assertThat(custom.defaultCategoryId(options)).contains(8L);
        assertThat(custom.defaultPostFormat(options)).contains("link");
    }
}

package com.example.blogsync_backend.service.options;

import java.util.Optional;

public record BlogOptionsResult(
        OptionsSource source,
        NormalizedOptions options,
        Long defaultCategoryId,
        String defaultPostFormat
) {

    public static BlogOptionsResult empty(OptionsSource source) {
        return new BlogOptionsResult(source, NormalizedOptions.empty(), null, null);
    }

    public Optional<Long> findDefaultCategoryId() {
        return Optional.ofNullable(defaultCategoryId);
    }

    public Optional<String> findDefaultPostFormat() {
        return Optional.ofNullable(defaultPostFormat);
    }
}

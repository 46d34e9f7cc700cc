package com.example.blogsync_backend.dto.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlogOptionsResponse(
        String source,
        Map<String, Object> options,
        Long defaultCategoryId,
        String defaultPostFormat
) {
}

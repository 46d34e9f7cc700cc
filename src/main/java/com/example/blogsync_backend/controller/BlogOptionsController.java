package com.example.blogsync_backend.controller;

import com.example.blogsync_backend.dto.web.BlogOptionsResponse;
import com.example.blogsync_backend.service.options.BlogOptionsResult;
import com.example.blogsync_backend.service.options.BlogOptionsService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller normalizing blog option responses that were already fetched from the blogging platform.
 */
@RestController
@RequestMapping("/v1/blog-options")
public class BlogOptionsController {

    private final BlogOptionsService blogOptionsService;

    public BlogOptionsController(BlogOptionsService blogOptionsService) {
        this.blogOptionsService = blogOptionsService;
    }

    /**
     * Normalizes a legacy RPC options listing.
     *
     * @param body option name to descriptor mapping; a missing body counts as empty.
     * @return flattened options and the resolved defaults.
     */
    @PostMapping("/xmlrpc")
    public BlogOptionsResponse fromXmlRpc(@RequestBody(required = false) Map<String, Object> body) {
        return toResponse(blogOptionsService.fromLegacyOptions(body));
    }

    @PostMapping("/settings")
    public BlogOptionsResponse fromSettings(@RequestBody(required = false) Map<String, Object> body) {
        return toResponse(blogOptionsService.fromSettings(body));
    }

    @PostMapping("/rest-site")
    public BlogOptionsResponse fromRestSite(@RequestBody(required = false) Map<String, Object> body) {
        return toResponse(blogOptionsService.fromRestSite(body));
    }

    private BlogOptionsResponse toResponse(BlogOptionsResult result) {
        return new BlogOptionsResponse(
                result.source().id(),
                result.options().asMap(),
                result.defaultCategoryId(),
                result.defaultPostFormat()
        );
    }
}

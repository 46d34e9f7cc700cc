package com.example.blogsync_backend.service.options;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Resolves normalized blog options and their defaults from any of the supported response shapes.
 */
@Service
public class BlogOptionsService {
    private static final Logger LOGGER = LoggerFactory.getLogger(BlogOptionsService.class);

    private final OptionsMapper optionsMapper;
    private final DefaultFieldExtractor defaultFieldExtractor;
    private final RestSiteOptionsMapper restSiteOptionsMapper;

    public BlogOptionsService(OptionsMapper optionsMapper,
                              DefaultFieldExtractor defaultFieldExtractor,
                              RestSiteOptionsMapper restSiteOptionsMapper) {
        this.optionsMapper = optionsMapper;
        this.defaultFieldExtractor = defaultFieldExtractor;
        this.restSiteOptionsMapper = restSiteOptionsMapper;
    }

    public BlogOptionsResult fromLegacyOptions(Map<?, ?> response) {
        return resolve(OptionsSource.XMLRPC, optionsMapper.mapOptions(response));
    }

    public BlogOptionsResult fromSettings(Map<?, ?> body) {
        return resolve(OptionsSource.SETTINGS, optionsMapper.fromSettings(body));
    }

    public BlogOptionsResult fromRestSite(Map<?, ?> site) {
        Map<String, Object> descriptors = restSiteOptionsMapper.mapSiteResponse(site);
        return resolve(OptionsSource.REST, optionsMapper.mapOptions(descriptors));
    }

    private BlogOptionsResult resolve(OptionsSource source, NormalizedOptions options) {
        if (options.isEmpty()) {
            LOGGER.debug("BlogOptionsService resolved source={} options=0", source.id());
            return BlogOptionsResult.empty(source);
        }
        Long categoryId = defaultFieldExtractor.defaultCategoryId(options).orElse(null);
        String postFormat = defaultFieldExtractor.defaultPostFormat(options).orElse(null);
        LOGGER.debug("BlogOptionsService resolved source={} options={} defaultCategory={} defaultPostFormat={}",
                source.id(), options.size(), categoryId, postFormat);
        return new BlogOptionsResult(source, options, categoryId, postFormat);
    }
}

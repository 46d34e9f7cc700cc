package com.example.blogsync_backend.service.options;

/**
 * Response shapes blog options can be read from.
 */
public enum OptionsSource {
    XMLRPC("xmlrpc"),
    SETTINGS("settings"),
    REST("rest");

    private final String id;

    OptionsSource(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}

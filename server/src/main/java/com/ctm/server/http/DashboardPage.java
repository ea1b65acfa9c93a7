package com.ctm.server.http;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Single-page dashboard shell. The client-side router picks up the initial route
 * from the rendered page.
 */
final class DashboardPage {

    private static final String RESOURCE_PATH = "/web/index.html";
    private static final String LOCATION_SLOT = "{{initial_location}}";
    private static final String TEMPLATE = load(RESOURCE_PATH);

    private DashboardPage() {}

    static String render(String initialLocation) {
        return TEMPLATE.replace(LOCATION_SLOT, Html.escape(initialLocation));
    }

    private static String load(String resourcePath) {
        try (InputStream in = DashboardPage.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Missing dashboard resource: " + resourcePath);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load dashboard resource: " + resourcePath, e);
        }
    }
}

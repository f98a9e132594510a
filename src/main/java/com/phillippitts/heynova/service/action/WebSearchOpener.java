package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.config.skills.SkillProperties;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds and opens web-search URLs from {@code skills.search-url}. Shared by the search skill
 * and the web-search fallback.
 */
@Component
public class WebSearchOpener {

    private final SkillProperties props;
    private final BrowserLauncher browser;

    public WebSearchOpener(SkillProperties props, BrowserLauncher browser) {
        this.props = Objects.requireNonNull(props);
        this.browser = Objects.requireNonNull(browser);
    }

    public String searchUrl(String query) {
        return props.getSearchUrl() + URLEncoder.encode(query.trim(), StandardCharsets.UTF_8);
    }

    /**
     * @throws com.phillippitts.heynova.exception.SkillExecutionException if the browser fails
     */
    public void open(String query) {
        browser.open(searchUrl(query));
    }
}

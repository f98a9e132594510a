package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.exception.SkillExecutionException;

/** Opens a URL in the user's default browser. */
public interface BrowserLauncher {

    /**
     * @param url absolute http(s) URL
     * @throws SkillExecutionException if no browser could be started
     */
    void open(String url);
}

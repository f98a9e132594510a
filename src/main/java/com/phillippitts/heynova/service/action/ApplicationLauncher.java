package com.phillippitts.heynova.service.action;

import com.phillippitts.heynova.exception.SkillExecutionException;

import java.util.Set;

/**
 * Launches local applications by their configured spoken name.
 */
public interface ApplicationLauncher {

    /** Spoken names whose configured path exists. */
    Set<String> availableApplications();

    default boolean isAvailable(String name) {
        return availableApplications().contains(name);
    }

    /**
     * @param name spoken application name, as returned by {@link #availableApplications()}
     * @throws SkillExecutionException if the name is unknown or the launch failed
     */
    void launch(String name);
}

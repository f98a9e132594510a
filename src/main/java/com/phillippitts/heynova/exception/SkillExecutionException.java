package com.phillippitts.heynova.exception;

/**
 * Thrown by a skill action or one of its collaborators (browser, application launcher)
 * when the side effect could not be performed. The skill turns it into a spoken apology.
 */
public class SkillExecutionException extends HeyNovaException {

    private final String skillName;

    public SkillExecutionException(String skillName, String message) {
        super(message);
        this.skillName = skillName;
    }

    public SkillExecutionException(String skillName, String message, Throwable cause) {
        super(message, cause);
        this.skillName = skillName;
    }

    public String getSkillName() {
        return skillName;
    }
}

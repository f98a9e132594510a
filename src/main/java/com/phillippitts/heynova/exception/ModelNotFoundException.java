package com.phillippitts.heynova.exception;

/**
 * The configured Vosk model directory is missing or lacks the expected layout.
 * Caught at startup, where it turns the offline backend off.
 */
public class ModelNotFoundException extends HeyNovaException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        this(modelPath, "No Vosk model at");
    }

    public ModelNotFoundException(String modelPath, String problem) {
        super(problem + " " + modelPath);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}

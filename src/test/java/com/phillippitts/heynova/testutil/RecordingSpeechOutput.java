package com.phillippitts.heynova.testutil;

import com.phillippitts.heynova.service.action.SpeechOutput;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * SpeechOutput that records every spoken line instead of running a speech program.
 */
public class RecordingSpeechOutput implements SpeechOutput {

    private final List<String> lines = new CopyOnWriteArrayList<>();

    @Override
    public void speak(String text) {
        lines.add(text);
    }

    public List<String> lines() {
        return List.copyOf(lines);
    }

    public String last() {
        return lines.isEmpty() ? null : lines.get(lines.size() - 1);
    }

    public void clear() {
        lines.clear();
    }
}

package com.phillippitts.heynova.service.audio.capture;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.Control;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.Line;
import javax.sound.sampled.LineListener;
import javax.sound.sampled.TargetDataLine;
import java.util.Arrays;

/**
 * TargetDataLine that delivers a scripted sequence of loud and silent chunks without blocking.
 * Chunks past the end of the script repeat {@code tail}.
 */
final class ScriptedTargetDataLine implements TargetDataLine {

    /** 16-bit sample far above any sensible speech threshold. */
    private static final short LOUD = 10_000;

    private final AudioFormat format;
    private final boolean[] script;
    private final boolean tail;
    private int chunk;
    private boolean open;
    private boolean started;

    ScriptedTargetDataLine(AudioFormat format, boolean tail, boolean... script) {
        this.format = format;
        this.tail = tail;
        this.script = script;
    }

    static boolean[] repeat(boolean loud, int count) {
        boolean[] out = new boolean[count];
        Arrays.fill(out, loud);
        return out;
    }

    static boolean[] concat(boolean[]... parts) {
        int total = 0;
        for (boolean[] p : parts) {
            total += p.length;
        }
        boolean[] out = new boolean[total];
        int pos = 0;
        for (boolean[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }

    @Override
    public int read(byte[] b, int off, int len) {
        if (!open || !started) {
            return -1;
        }
        boolean loud = chunk < script.length ? script[chunk] : tail;
        chunk++;
        for (int i = off; i + 1 < off + len; i += 2) {
            short sample = loud ? LOUD : 0;
            b[i] = (byte) (sample & 0xFF);
            b[i + 1] = (byte) ((sample >> 8) & 0xFF);
        }
        return len;
    }

    @Override public void open(AudioFormat f, int bufferSize) { open = true; }
    @Override public void open(AudioFormat f) { open = true; }
    @Override public void open() { open = true; }
    @Override public void close() { open = false; }
    @Override public boolean isOpen() { return open; }
    @Override public void start() { started = true; }
    @Override public void stop() { started = false; }
    @Override public boolean isActive() { return started; }
    @Override public boolean isRunning() { return started; }
    @Override public AudioFormat getFormat() { return format; }
    @Override public int available() { return 0; }
    @Override public void drain() { }
    @Override public void flush() { }
    @Override public int getBufferSize() { return 0; }
    @Override public int getFramePosition() { return 0; }
    @Override public long getLongFramePosition() { return 0; }
    @Override public long getMicrosecondPosition() { return 0; }
    @Override public float getLevel() { return 0; }
    @Override public Line.Info getLineInfo() { return new DataLine.Info(TargetDataLine.class, format); }
    @Override public Control[] getControls() { return new Control[0]; }
    @Override public boolean isControlSupported(Control.Type control) { return false; }
    @Override public Control getControl(Control.Type control) { throw new IllegalArgumentException(); }
    @Override public void addLineListener(LineListener listener) { }
    @Override public void removeLineListener(LineListener listener) { }
}

package com.example.homemic_backend.util;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.OptionalDouble;

/**
 * Reads the playing time of a WAV payload from its header.
 */
public final class WavDuration {
    private WavDuration() {}

    public static OptionalDouble of(byte[] bytes) {
        if (bytes == null || bytes.length < 44) {
            return OptionalDouble.empty();
        }
        try (var in = new BufferedInputStream(new ByteArrayInputStream(bytes))) {
            AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(in);
            AudioFormat format = fileFormat.getFormat();
            long frames = fileFormat.getFrameLength();
            float rate = format.getFrameRate();
            if (frames == AudioSystem.NOT_SPECIFIED || frames <= 0 || rate <= 0) {
                // Header without a frame count: fall back to byte length.
                int frameSize = format.getFrameSize();
                if (frameSize <= 0 || rate <= 0) {
                    return OptionalDouble.empty();
                }
                frames = (bytes.length - 44L) / frameSize;
            }
            double seconds = frames / (double) rate;
            return seconds > 0 ? OptionalDouble.of(seconds) : OptionalDouble.empty();
        } catch (UnsupportedAudioFileException | IOException e) {
            return OptionalDouble.empty();
        }
    }
}

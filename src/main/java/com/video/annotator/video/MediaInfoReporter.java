package com.video.annotator.video;

import com.video.annotator.exception.StreamUnavailableException;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 视频元数据报告：SHA-512 + 容器/视频/音频信息
 */
public class MediaInfoReporter {

    private static final Logger LOG = LoggerFactory.getLogger(MediaInfoReporter.class);

    static final String HASH_ERROR = "Error reading file to compute hash.";
    private static final int KEY_WIDTH = 25;
    private static final int BUFFER_SIZE = 4096;

    public String describe(Path video) {
        StringBuilder report = new StringBuilder();
        report.append("SHA-512: ").append(sha512(video)).append('\n').append('\n');

        FFmpegFrameGrabber grabber = new FFmpegFrameGrabber(video.toFile());
        try {
            grabber.start();

            Map<String, Object> general = new TreeMap<>();
            general.put("Format", grabber.getFormat());
            general.put("Duration", String.format(Locale.ROOT, "%.3f s", grabber.getLengthInTime() / 1_000_000.0));
            general.put("Overall Bit Rate", grabber.getFormatContext().bit_rate());
            putMetadata(general, grabber.getMetadata());
            appendSection(report, "General", general);

            if (grabber.hasVideo()) {
                Map<String, Object> videoTrack = new TreeMap<>();
                videoTrack.put("Codec", grabber.getVideoCodecName());
                videoTrack.put("Width", grabber.getImageWidth());
                videoTrack.put("Height", grabber.getImageHeight());
                videoTrack.put("Frame Rate", String.format(Locale.ROOT, "%.3f", grabber.getFrameRate()));
                videoTrack.put("Bit Rate", grabber.getVideoBitrate());
                videoTrack.put("Pixel Format", grabber.getPixelFormat());
                putMetadata(videoTrack, grabber.getVideoMetadata());
                appendSection(report, "Video", videoTrack);
            }

            if (grabber.hasAudio()) {
                Map<String, Object> audioTrack = new TreeMap<>();
                audioTrack.put("Codec", grabber.getAudioCodecName());
                audioTrack.put("Sample Rate", grabber.getSampleRate());
                audioTrack.put("Channels", grabber.getAudioChannels());
                audioTrack.put("Bit Rate", grabber.getAudioBitrate());
                putMetadata(audioTrack, grabber.getAudioMetadata());
                appendSection(report, "Audio", audioTrack);
            }
        } catch (Exception e) {
            LOG.error("Error reading media info of {}", video, e);
            throw new StreamUnavailableException("Could not read video metadata: " + video, e);
        } finally {
            try {
                grabber.release();
            } catch (Exception e) {
                LOG.error("Error releasing grabber", e);
            }
        }
        return report.toString();
    }

    static String sha512(Path file) {
        try (InputStream input = Files.newInputStream(file)) {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            byte[] block = new byte[BUFFER_SIZE];
            int read;
            while ((read = input.read(block)) != -1) {
                digest.update(block, 0, read);
            }
            StringBuilder hex = new StringBuilder();
            for (byte b : digest.digest()) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (IOException e) {
            LOG.error("Could not read file to compute hash: {}", file, e);
            return HASH_ERROR;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }

    static String formatLine(String key, Object value) {
        return String.format("%" + KEY_WIDTH + "s: %s", key, value);
    }

    private static void appendSection(StringBuilder report, String title, Map<String, Object> values) {
        report.append("--- ").append(title).append(" ---").append('\n');
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            report.append(formatLine(entry.getKey(), entry.getValue())).append('\n');
        }
        report.append('\n');
    }

    private static void putMetadata(Map<String, Object> target, Map<String, String> metadata) {
        if (metadata == null) {
            return;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            target.put(titleCase(entry.getKey()), entry.getValue());
        }
    }

    static String titleCase(String key) {
        StringBuilder result = new StringBuilder();
        boolean upper = true;
        for (char c : key.replace('_', ' ').toCharArray()) {
            result.append(upper ? Character.toUpperCase(c) : Character.toLowerCase(c));
            upper = c == ' ';
        }
        return result.toString();
    }
}

package com.video.annotator.video;

import com.video.annotator.exception.AnnotatorException;
import com.video.annotator.exception.StreamUnavailableException;
import com.video.annotator.util.ImageUtils;
import org.bytedeco.ffmpeg.avformat.AVFormatContext;
import org.bytedeco.ffmpeg.avformat.AVStream;
import org.bytedeco.ffmpeg.avutil.AVRational;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.Frame;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 基于 JavaCV FFmpegFrameGrabber 的解码实现
 * <p>
 * JavaCV 对外的帧时间戳是微秒，这里换算回视频流原生时间基的 tick，
 * 与 {@link ExactFrameLocator} 的目标 tick 比较。
 * <p>
 * JavaCV 不区分缺失的 pts（AV_NOPTS_VALUE 换算成微秒时溢出），
 * 早于容器起始时间或比上一帧倒退的时间戳按 {@link DecodedFrame#NO_PTS} 处理。
 */
public class FFmpegVideoDecoder implements VideoDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(FFmpegVideoDecoder.class);

    private FFmpegFrameGrabber grabber;
    private VideoStreamInfo streamInfo;
    private long startTimeMicros;
    private long lastTimestampMicros = Long.MIN_VALUE;

    @Override
    public VideoStreamInfo open(Path video) {
        if (grabber != null) {
            throw new IllegalStateException("Decoder already open");
        }
        if (video == null || !Files.isRegularFile(video)) {
            throw new StreamUnavailableException("Video file not found: " + video);
        }

        grabber = new FFmpegFrameGrabber(video.toFile());
        try {
            grabber.start();
        } catch (Exception e) {
            close();
            throw new StreamUnavailableException("Cannot open container: " + video, e);
        }

        if (!grabber.hasVideo()) {
            close();
            throw new StreamUnavailableException("No video stream in container: " + video);
        }

        AVFormatContext oc = grabber.getFormatContext();
        AVStream stream = null;
        int streamIndex = -1;
        for (int i = 0; i < oc.nb_streams(); i++) {
            AVStream candidate = oc.streams(i);
            if (candidate.codecpar().codec_type() == avutil.AVMEDIA_TYPE_VIDEO) {
                stream = candidate;
                streamIndex = i;
                break;
            }
        }
        if (stream == null) {
            close();
            throw new StreamUnavailableException("No video stream in container: " + video);
        }

        AVRational rational = stream.time_base();
        TimeBase timeBase = rational.num() > 0 && rational.den() > 0
                ? new TimeBase(rational.num(), rational.den())
                : TimeBase.MICROSECONDS;

        startTimeMicros = oc.start_time() != avutil.AV_NOPTS_VALUE ? oc.start_time() : 0;

        long durationTicks = VideoStreamInfo.UNKNOWN_DURATION;
        if (stream.duration() != avutil.AV_NOPTS_VALUE && stream.duration() > 0) {
            durationTicks = stream.duration();
        } else if (grabber.getLengthInTime() > 0) {
            durationTicks = timeBase.microsToTicks(grabber.getLengthInTime());
        }

        streamInfo = VideoStreamInfo.builder()
                .streamIndex(streamIndex)
                .timeBase(timeBase)
                .durationTicks(durationTicks)
                .frameRate(grabber.getFrameRate())
                .width(grabber.getImageWidth())
                .height(grabber.getImageHeight())
                .build();

        LOG.debug("Opened video {}: stream={}, timeBase={}/{}, duration={} ticks, fps={}",
                video, streamIndex, timeBase.getNum(), timeBase.getDen(), durationTicks, streamInfo.getFrameRate());
        return streamInfo;
    }

    /**
     * JavaCV 的 setVideoTimestamp 先向后定位到关键帧再向前解码，
     * 调用方仍需逐帧比较 pts，直到第一个不早于目标的帧
     */
    @Override
    public void seek(long tick) {
        ensureOpen();
        long micros = Math.max(0, streamInfo.getTimeBase().ticksToMicros(tick) - startTimeMicros);
        try {
            grabber.setVideoTimestamp(micros);
            lastTimestampMicros = Long.MIN_VALUE;
        } catch (Exception e) {
            throw new AnnotatorException("Seek to tick " + tick + " failed", e);
        }
    }

    @Override
    public DecodedFrame next() {
        ensureOpen();
        Frame frame;
        try {
            frame = grabber.grabImage();
        } catch (Exception e) {
            throw new AnnotatorException("Error decoding video frame", e);
        }
        if (frame == null || frame.image == null) {
            return null;
        }
        if (frame.imageChannels != 3 || frame.imageDepth != Frame.DEPTH_UBYTE) {
            throw new AnnotatorException("Unexpected pixel layout: channels=" + frame.imageChannels
                    + ", depth=" + frame.imageDepth);
        }

        Mat image = ImageUtils.bgrToMat((ByteBuffer) frame.image[0],
                frame.imageWidth, frame.imageHeight, frame.imageStride);
        return new DecodedFrame(toPts(frame.timestamp), image);
    }

    private long toPts(long timestampMicros) {
        if (timestampMicros < startTimeMicros || timestampMicros < lastTimestampMicros) {
            LOG.debug("Frame without usable timestamp ({}us after {}us)", timestampMicros, lastTimestampMicros);
            return DecodedFrame.NO_PTS;
        }
        lastTimestampMicros = timestampMicros;
        return streamInfo.getTimeBase().microsToTicks(timestampMicros);
    }

    @Override
    public void close() {
        if (grabber == null) {
            return;
        }
        try {
            grabber.stop();
            grabber.release();
        } catch (Exception e) {
            LOG.error("Error stopping/releasing grabber", e);
        } finally {
            grabber = null;
            streamInfo = null;
            lastTimestampMicros = Long.MIN_VALUE;
        }
    }

    private void ensureOpen() {
        if (grabber == null || streamInfo == null) {
            throw new IllegalStateException("Decoder is not open");
        }
    }
}

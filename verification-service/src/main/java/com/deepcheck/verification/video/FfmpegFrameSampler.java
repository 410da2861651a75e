package com.deepcheck.verification.video;

import com.deepcheck.common.aggregation.FramePlan;
import com.deepcheck.common.exception.DecodeException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link FrameSampler} backed by the {@code ffprobe} and {@code ffmpeg} executables.
 *
 * <p>{@code ffprobe -print_format json} supplies duration, dimensions and tags; one
 * {@code ffmpeg} invocation per timestamp seeks and writes a single MJPEG frame to stdout.
 * Any non-zero exit, missing stream, empty frame or process running past
 * {@code media.ffmpeg.process-timeout} is a {@link DecodeException}.
 */
@Component
public class FfmpegFrameSampler implements FrameSampler {

    private static final Logger log = LoggerFactory.getLogger(FfmpegFrameSampler.class);

    static final Duration DEFAULT_PROCESS_TIMEOUT = Duration.ofSeconds(60);
    /** Seeking exactly to the end of a stream yields no frame; stay this far inside it. */
    private static final Duration END_MARGIN = Duration.ofMillis(50);

    private final String ffmpegPath;
    private final String ffprobePath;
    private final ObjectMapper objectMapper;
    private final Duration processTimeout;

    @Autowired
    public FfmpegFrameSampler(@Value("${media.ffmpeg.ffmpeg-path:ffmpeg}") String ffmpegPath,
                              @Value("${media.ffmpeg.ffprobe-path:ffprobe}") String ffprobePath,
                              @Value("${media.ffmpeg.process-timeout:60s}") Duration processTimeout,
                              ObjectMapper objectMapper) {
        if (processTimeout.isZero() || processTimeout.isNegative()) {
            throw new IllegalArgumentException("processTimeout must be positive but was " + processTimeout);
        }
        this.ffmpegPath = ffmpegPath;
        this.ffprobePath = ffprobePath;
        this.processTimeout = processTimeout;
        this.objectMapper = objectMapper;
    }

    public FfmpegFrameSampler(String ffmpegPath, String ffprobePath, ObjectMapper objectMapper) {
        this(ffmpegPath, ffprobePath, DEFAULT_PROCESS_TIMEOUT, objectMapper);
    }

    @Override
    public VideoSample sample(Path video, int frameCount) {
        VideoProbe probe = probe(video);
        List<Duration> plan = FramePlan.timestamps(probe.duration(), frameCount);
        List<SampledFrame> frames = new ArrayList<>(plan.size());
        for (int i = 0; i < plan.size(); i++) {
            Duration timestamp = plan.get(i);
            frames.add(new SampledFrame(i, timestamp, extractFrame(video, seekPosition(timestamp, probe.duration()))));
        }
        log.info("Sampled {} frames from {} (duration={})", frames.size(), video.getFileName(), probe.duration());
        return new VideoSample(probe, frames);
    }

    public VideoProbe probe(Path video) {
        byte[] out = run(List.of(ffprobePath, "-v", "error", "-print_format", "json",
                                 "-show_format", "-show_streams", video.toString()), "ffprobe");
        JsonNode root;
        try {
            root = objectMapper.readTree(new String(out, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DecodeException("ffprobe produced unreadable output for " + video.getFileName(), e);
        }
        return parseProbe(root, video);
    }

    VideoProbe parseProbe(JsonNode root, Path video) {
        JsonNode stream = null;
        for (JsonNode s : root.path("streams")) {
            if ("video".equals(s.path("codec_type").asText())) {
                stream = s;
                break;
            }
        }
        if (stream == null) {
            throw new DecodeException("no video stream in " + video.getFileName());
        }

        String rawDuration = root.path("format").path("duration").asText(stream.path("duration").asText(""));
        Duration duration;
        try {
            duration = Duration.ofNanos(Math.round(Double.parseDouble(rawDuration) * 1_000_000_000d));
        } catch (NumberFormatException e) {
            throw new DecodeException("unknown duration for " + video.getFileName());
        }
        if (duration.isNegative()) {
            throw new DecodeException("negative duration for " + video.getFileName());
        }

        Map<String, String> tags = new HashMap<>();
        collectTags(root.path("format").path("tags"), tags);
        collectTags(stream.path("tags"), tags);

        Integer width  = stream.hasNonNull("width") ? stream.get("width").asInt() : null;
        Integer height = stream.hasNonNull("height") ? stream.get("height").asInt() : null;
        return new VideoProbe(duration, width, height, parseInstant(tags.get("creation_time")), tags);
    }

    private byte[] extractFrame(Path video, Duration seek) {
        String position = String.format(Locale.ROOT, "%.3f", seek.toNanos() / 1_000_000_000d);
        byte[] jpeg = run(List.of(ffmpegPath, "-v", "error", "-ss", position, "-i", video.toString(),
                                  "-frames:v", "1", "-f", "image2pipe", "-vcodec", "mjpeg", "-"), "ffmpeg");
        if (jpeg.length == 0) {
            throw new DecodeException("no frame decoded at " + position + "s in " + video.getFileName());
        }
        return jpeg;
    }

    private static Duration seekPosition(Duration timestamp, Duration total) {
        Duration latest = total.minus(END_MARGIN);
        if (latest.isNegative()) return Duration.ZERO;
        return timestamp.compareTo(latest) > 0 ? latest : timestamp;
    }

    /**
     * Runs one tool invocation with stdout redirected to a temp file, so a process that stops
     * producing output still hits the process timeout and is killed.
     */
    private byte[] run(List<String> command, String tool) {
        Path output;
        try {
            output = Files.createTempFile("deepcheck-" + tool + "-", ".out");
        } catch (IOException e) {
            throw new DecodeException(tool + " output file could not be created: " + e.getMessage(), e);
        }
        try {
            ProcessBuilder pb = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .redirectOutput(output.toFile());
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new DecodeException(tool + " could not be started: " + e.getMessage(), e);
            }
            try {
                if (!process.waitFor(processTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    log.warn("{} killed after {}. command={}", tool, processTimeout, command);
                    throw new DecodeException(tool + " did not finish within " + processTimeout.toMillis() + "ms");
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new DecodeException(tool + " was interrupted", e);
            }
            if (process.exitValue() != 0) {
                throw new DecodeException(tool + " exited with status " + process.exitValue());
            }
            try {
                return Files.readAllBytes(output);
            } catch (IOException e) {
                throw new DecodeException(tool + " output could not be read: " + e.getMessage(), e);
            }
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                log.warn("Could not delete {} output file {}", tool, output, e);
            }
        }
    }

    private static void collectTags(JsonNode tagsNode, Map<String, String> into) {
        Iterator<Map.Entry<String, JsonNode>> fields = tagsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            into.putIfAbsent(e.getKey().toLowerCase(Locale.ROOT), e.getValue().asText());
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable creation_time {}", value);
            return null;
        }
    }
}

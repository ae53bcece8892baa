package com.playlistgen.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playlistgen.recommender.ExtractionException;
import com.playlistgen.recommender.FeatureExtractor;
import com.playlistgen.recommender.FeatureVector;
import com.playlistgen.recommender.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Feature extractor that delegates to an external audio-analysis command.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Runs {@code <command> --track <trackId>} and captures its combined output.</li>
 *   <li>Reads the last line that starts with <code>{</code> as a JSON object of feature values keyed by
 *       {@link FeatureVector#DIMENSION_NAMES}; a nested {@code "features"} object is accepted as well.</li>
 *   <li>Classifies failures: output mentioning HTTP 429 or a rate limit is {@code RATE_LIMITED}, any other non-zero
 *       exit or launch failure is {@code SOURCE_UNAVAILABLE}, unparseable or incomplete JSON is {@code INVALID_OUTPUT}.</li>
 * </ul>
 * The command itself has no timeout here; wrap it in {@link TimeLimitedFeatureExtractor}. An interrupted call kills
 * the process and its descendants before returning.
 *
 * @author Playlist Generator Team
 * @since 1.0
 */
public class CommandFeatureExtractor implements FeatureExtractor {
    private static final Logger logger = LoggerFactory.getLogger(CommandFeatureExtractor.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final List<String> command;

    public CommandFeatureExtractor(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Extractor command cannot be empty");
        }
        this.command = List.copyOf(command);
    }

    /**
     * @param commandLine whitespace-separated command, e.g. {@code "python3 extract_features.py"}
     */
    public static CommandFeatureExtractor fromCommandLine(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            throw new IllegalArgumentException("Extractor command cannot be empty");
        }
        return new CommandFeatureExtractor(Arrays.asList(commandLine.trim().split("\\s+")));
    }

    @Override
    public FeatureVector extract(Track track) throws ExtractionException {
        List<String> cmd = new ArrayList<>(command);
        cmd.add("--track");
        cmd.add(track.id());

        Process process;
        try {
            process = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        } catch (IOException e) {
            logger.error("Failed to run feature extractor {}: {}", cmd, e.getMessage());
            throw new ExtractionException(ExtractionException.Kind.SOURCE_UNAVAILABLE,
                "Could not run extractor for " + track.id() + ": " + e.getMessage(), e);
        }

        // an interrupt while waiting kills the process tree in the finally block
        OutputReader reader = new OutputReader(process.getInputStream(), track.id());
        reader.start();
        String output;
        int exitCode;
        boolean finished = false;
        try {
            exitCode = process.waitFor();
            reader.join();
            output = reader.output();
            finished = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException(ExtractionException.Kind.TIMEOUT,
                "Interrupted while extracting " + track.id(), e);
        } finally {
            if (!finished) {
                kill(process, track.id());
            }
        }

        if (exitCode != 0) {
            ExtractionException.Kind kind = isRateLimited(output)
                ? ExtractionException.Kind.RATE_LIMITED
                : ExtractionException.Kind.SOURCE_UNAVAILABLE;
            logger.warn("Feature extractor exited with {} for {} ({})", exitCode, track.id(), kind);
            throw new ExtractionException(kind, "Extractor exited with " + exitCode + " for " + track.id() + ": " + lastLine(output));
        }
        return parseFeatures(output);
    }

    /**
     * Parses extractor output into a feature vector.
     * @param output raw command output, possibly with log lines before the JSON
     * @return FeatureVector
     * @throws ExtractionException of kind {@code INVALID_OUTPUT}
     */
    static FeatureVector parseFeatures(String output) throws ExtractionException {
        String json = null;
        if (output != null) {
            String[] lines = output.split("\\R");
            for (int i = lines.length - 1; i >= 0; i--) {
                if (lines[i].trim().startsWith("{")) {
                    json = lines[i].trim();
                    break;
                }
            }
        }
        if (json == null) {
            throw new ExtractionException(ExtractionException.Kind.INVALID_OUTPUT, "Extractor produced no JSON object");
        }
        try {
            JsonNode root = mapper.readTree(json);
            JsonNode features = root.has("features") ? root.get("features") : root;
            Map<String, Double> values = new LinkedHashMap<>();
            for (String name : FeatureVector.DIMENSION_NAMES) {
                JsonNode value = features.get(name);
                if (value == null || !value.isNumber()) {
                    throw new ExtractionException(ExtractionException.Kind.INVALID_OUTPUT,
                        "Extractor output is missing numeric feature '" + name + "'");
                }
                values.put(name, value.asDouble());
            }
            return FeatureVector.fromMap(values);
        } catch (JsonProcessingException e) {
            throw new ExtractionException(ExtractionException.Kind.INVALID_OUTPUT,
                "Extractor output is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static void kill(Process process, String trackId) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        logger.warn("Killed feature extractor process {} for {}", process.pid(), trackId);
    }

    /**
     * Drains the process output on its own thread.
     */
    private static final class OutputReader extends Thread {
        private final InputStream in;
        private volatile String output = "";

        OutputReader(InputStream in, String trackId) {
            super("extractor-output-" + trackId);
            setDaemon(true);
            this.in = in;
        }

        @Override
        public void run() {
            try (InputStream stream = in) {
                output = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                logger.debug("Extractor output stream closed early: {}", e.getMessage());
            }
        }

        String output() {
            return output;
        }
    }

    static boolean isRateLimited(String output) {
        if (output == null) return false;
        String lower = output.toLowerCase(Locale.ROOT);
        return lower.contains("429") || lower.contains("rate limit") || lower.contains("too many requests");
    }

    private static String lastLine(String output) {
        if (output == null || output.isBlank()) return "";
        String[] lines = output.trim().split("\\R");
        return lines[lines.length - 1];
    }
}

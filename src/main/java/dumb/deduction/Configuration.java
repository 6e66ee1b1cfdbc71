package dumb.deduction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.deduction.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public record Configuration(
        @JsonProperty("timeoutSeconds") double timeoutSeconds,
        @JsonProperty("startingTimeoutSeconds") double startingTimeoutSeconds,
        @JsonProperty("nbTrials") int nbTrials,
        @JsonProperty("maxCapacity") int maxCapacity,
        @JsonProperty("backendCommand") List<String> backendCommand,
        @JsonProperty("checkTypes") boolean checkTypes,
        @JsonProperty("genericGrouping") boolean genericGrouping
) {

    private static final Logger logger = LoggerFactory.getLogger(Configuration.class);

    public static final String RESOURCE = "deduction.json";

    static final double DEFAULT_TIMEOUT = 10;
    static final double DEFAULT_STARTING_TIMEOUT = 20;
    static final int DEFAULT_NB_TRIALS = 2;
    static final int DEFAULT_MAX_CAPACITY = 10;
    static final List<String> DEFAULT_BACKEND_COMMAND = List.of("lean", "--server");

    @JsonCreator
    public Configuration(
            @JsonProperty("timeoutSeconds") Double timeoutSeconds,
            @JsonProperty("startingTimeoutSeconds") Double startingTimeoutSeconds,
            @JsonProperty("nbTrials") Integer nbTrials,
            @JsonProperty("maxCapacity") Integer maxCapacity,
            @JsonProperty("backendCommand") List<String> backendCommand,
            @JsonProperty("checkTypes") Boolean checkTypes,
            @JsonProperty("genericGrouping") Boolean genericGrouping
    ) {
        this(
                timeoutSeconds != null ? timeoutSeconds : DEFAULT_TIMEOUT,
                startingTimeoutSeconds != null ? startingTimeoutSeconds : DEFAULT_STARTING_TIMEOUT,
                nbTrials != null ? nbTrials : DEFAULT_NB_TRIALS,
                maxCapacity != null ? maxCapacity : DEFAULT_MAX_CAPACITY,
                backendCommand != null ? List.copyOf(backendCommand) : DEFAULT_BACKEND_COMMAND,
                checkTypes != null && checkTypes,
                genericGrouping == null || genericGrouping
        );
    }

    public Configuration {
        if (timeoutSeconds <= 0 || startingTimeoutSeconds <= 0)
            throw new IllegalArgumentException("Timeouts must be positive");
        if (nbTrials < 1)
            throw new IllegalArgumentException("nbTrials must be at least 1");
        if (maxCapacity < 1)
            throw new IllegalArgumentException("maxCapacity must be at least 1");
    }

    public Configuration() {
        this(DEFAULT_TIMEOUT, DEFAULT_STARTING_TIMEOUT, DEFAULT_NB_TRIALS, DEFAULT_MAX_CAPACITY,
                DEFAULT_BACKEND_COMMAND, false, true);
    }

    public long timeoutMillis() {
        return Math.round(timeoutSeconds * 1000);
    }

    public long startingTimeoutMillis() {
        return Math.round(startingTimeoutSeconds * 1000);
    }

    /**
     * Reads the given file if present, otherwise the {@value #RESOURCE} classpath resource,
     * otherwise the defaults.
     */
    public static Configuration load(@Nullable Path file) {
        if (file != null) {
            try {
                return Json.obj(Files.readString(file), Configuration.class);
            } catch (IOException e) {
                logger.warn("Could not read configuration {}, using classpath defaults: {}", file, e.getMessage());
            }
        }
        try (InputStream in = Configuration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null)
                return Json.the.readValue(in, Configuration.class);
        } catch (IOException e) {
            logger.warn("Invalid {} on classpath: {}", RESOURCE, e.getMessage());
        }
        return new Configuration();
    }
}

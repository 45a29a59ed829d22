package io.github.flameyossnowy.sift.search;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Compiler-wide settings shared by every compiled filter.
 *
 * @param defaultDelimiter separator used to split range and set strings when a field declares none
 * @param dateFormat       layout for the {@code date} range type
 * @param timeFormat       layout for the {@code time} range type
 * @param dateTimeFormat   layout for the {@code datetime} range type
 * @param logger           sink for definition and runtime warnings
 */
public record SearchOptions(
    String defaultDelimiter,
    DateTimeFormatter dateFormat,
    DateTimeFormatter timeFormat,
    DateTimeFormatter dateTimeFormat,
    Logger logger
) {
    public static final String DEFAULT_DELIMITER = ",";
    public static final String LOGGER_NAME = "io.github.flameyossnowy.sift.search";

    private static final SearchOptions DEFAULTS = builder().build();

    public SearchOptions {
        Objects.requireNonNull(defaultDelimiter, "defaultDelimiter");
        if (defaultDelimiter.isEmpty()) {
            throw new IllegalArgumentException("defaultDelimiter cannot be empty");
        }
        Objects.requireNonNull(dateFormat, "dateFormat");
        Objects.requireNonNull(timeFormat, "timeFormat");
        Objects.requireNonNull(dateTimeFormat, "dateTimeFormat");
        Objects.requireNonNull(logger, "logger");
    }

    public static SearchOptions defaults() {
        return DEFAULTS;
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String defaultDelimiter = DEFAULT_DELIMITER;
        private DateTimeFormatter dateFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd");
        private DateTimeFormatter timeFormat = DateTimeFormatter.ofPattern("HH:mm:ss");
        private DateTimeFormatter dateTimeFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
        private Logger logger;

        Builder() {
        }

        /**
         * Sets the separator used when a field has no {@code delimiter} param.
         * <p>
         * The default value is {@code ","}.
         *
         * @param defaultDelimiter a non-empty separator
         * @return this builder
         */
        public Builder defaultDelimiter(@NotNull String defaultDelimiter) {
            this.defaultDelimiter = defaultDelimiter;
            return this;
        }

        public Builder dateFormat(@NotNull DateTimeFormatter dateFormat) {
            this.dateFormat = dateFormat;
            return this;
        }

        public Builder timeFormat(@NotNull DateTimeFormatter timeFormat) {
            this.timeFormat = timeFormat;
            return this;
        }

        public Builder dateTimeFormat(@NotNull DateTimeFormatter dateTimeFormat) {
            this.dateTimeFormat = dateTimeFormat;
            return this;
        }

        /**
         * Redirects warnings to the given logger. Without one, warnings go to
         * the {@value #LOGGER_NAME} logger.
         *
         * @param logger the logger to use
         * @return this builder
         */
        public Builder logger(@NotNull Logger logger) {
            this.logger = logger;
            return this;
        }

        public SearchOptions build() {
            Logger sink = logger != null ? logger : LoggerFactory.getLogger(LOGGER_NAME);
            return new SearchOptions(defaultDelimiter, dateFormat, timeFormat, dateTimeFormat, sink);
        }
    }
}

package ai.pkgedit;

import ai.pkgedit.manifest.ToolsVersion;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Editor settings. Defaults come from the {@code pkgedit.properties} classpath resource; any key can be overridden
 * with a JVM system property of the same name.
 */
public record EditorConfig(
        String manifestFileName,
        ToolsVersion minimumToolsVersion,
        List<String> defaultBranches,
        Duration gitTimeout,
        String indentUnit) {
    private static final Logger logger = LogManager.getLogger(EditorConfig.class);

    public static final String RESOURCE_NAME = "pkgedit.properties";

    public static final String MANIFEST_FILE_NAME = "pkgedit.manifestFileName";
    public static final String MINIMUM_TOOLS_VERSION = "pkgedit.minimumToolsVersion";
    public static final String DEFAULT_BRANCHES = "pkgedit.defaultBranches";
    public static final String GIT_TIMEOUT_SECONDS = "pkgedit.gitTimeoutSeconds";
    public static final String INDENT_UNIT = "pkgedit.indentUnit";

    private static final int DEFAULT_GIT_TIMEOUT_SECONDS = 60;

    public EditorConfig {
        Objects.requireNonNull(manifestFileName);
        Objects.requireNonNull(minimumToolsVersion);
        defaultBranches = List.copyOf(defaultBranches);
        if (defaultBranches.isEmpty()) {
            throw new IllegalArgumentException("at least one default branch is required");
        }
        Objects.requireNonNull(gitTimeout);
        if (Strings.isNullOrEmpty(indentUnit)) {
            throw new IllegalArgumentException("indent unit must not be empty");
        }
    }

    public static EditorConfig defaults() {
        return new EditorConfig(
                "Package.swift",
                ToolsVersion.parse("5.2"),
                List.of("main", "master"),
                Duration.ofSeconds(DEFAULT_GIT_TIMEOUT_SECONDS),
                "    ");
    }

    /** Classpath defaults plus system property overrides. */
    public static EditorConfig load() {
        return load(loadResource(), System::getProperty);
    }

    static EditorConfig load(Properties defaults, UnaryOperator<@Nullable String> overrides) {
        var fallback = defaults();
        String manifestFileName = value(defaults, overrides, MANIFEST_FILE_NAME);
        String toolsVersion = value(defaults, overrides, MINIMUM_TOOLS_VERSION);
        String branches = value(defaults, overrides, DEFAULT_BRANCHES);
        String indent = value(defaults, overrides, INDENT_UNIT);

        return new EditorConfig(
                manifestFileName == null ? fallback.manifestFileName() : manifestFileName,
                toolsVersion == null ? fallback.minimumToolsVersion() : ToolsVersion.parse(toolsVersion),
                branches == null
                        ? fallback.defaultBranches()
                        : Splitter.on(',').trimResults().omitEmptyStrings().splitToList(branches),
                Duration.ofSeconds(getPositiveInt(defaults, overrides, GIT_TIMEOUT_SECONDS, DEFAULT_GIT_TIMEOUT_SECONDS)),
                indent == null ? fallback.indentUnit() : parseIndentUnit(indent));
    }

    /** A number means that many spaces; {@code tab} means one tab. */
    static String parseIndentUnit(String value) {
        if (value.equalsIgnoreCase("tab")) {
            return "\t";
        }
        if (value.chars().allMatch(Character::isDigit)) {
            int width = Integer.parseInt(value);
            if (width <= 0) {
                throw new IllegalArgumentException(INDENT_UNIT + " must be positive: " + value);
            }
            return " ".repeat(width);
        }
        return value;
    }

    @Nullable
    private static String value(Properties defaults, UnaryOperator<@Nullable String> overrides, String key) {
        String v = overrides.apply(key);
        if (v == null || v.isBlank()) {
            v = defaults.getProperty(key);
        }
        if (v == null || v.isBlank()) {
            return null;
        }
        return v.trim();
    }

    private static int getPositiveInt(
            Properties defaults, UnaryOperator<@Nullable String> overrides, String key, int defVal) {
        String v = value(defaults, overrides, key);
        if (v == null) return defVal;
        int parsed = Integer.parseInt(v);
        return parsed > 0 ? parsed : defVal;
    }

    private static Properties loadResource() {
        var props = new Properties();
        try (InputStream in = EditorConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                logger.debug("No {} on the classpath; using built-in defaults", RESOURCE_NAME);
                return props;
            }
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", RESOURCE_NAME, e.getMessage());
        }
        return props;
    }
}

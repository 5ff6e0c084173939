package com.splitdock.config;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration loaded from environment variables for the docking layout engine.
 * <p>
 * Layout file: SPLITDOCK_LAYOUT_DIR, SPLITDOCK_LAYOUT_FILE. When no directory is configured the
 * default layout path is resolved against the project root, found by walking up from the working
 * directory looking for SPLITDOCK_PROJECT_MARKER (at most SPLITDOCK_PROJECT_SEARCH_LEVELS levels).
 * <p>
 * Panels: SPLITDOCK_MIN_PANEL_SIZE (clamped later by the engine). SPLITDOCK_DEV_MODE turns on tree dumps
 * after every mutation.
 */
public final class DockConfig {

    private static final String ENV_LAYOUT_DIR = "SPLITDOCK_LAYOUT_DIR";
    private static final String ENV_LAYOUT_FILE = "SPLITDOCK_LAYOUT_FILE";
    private static final String ENV_PROJECT_MARKER = "SPLITDOCK_PROJECT_MARKER";
    private static final String ENV_PROJECT_SEARCH_LEVELS = "SPLITDOCK_PROJECT_SEARCH_LEVELS";
    private static final String ENV_MIN_PANEL_SIZE = "SPLITDOCK_MIN_PANEL_SIZE";
    private static final String ENV_DEV_MODE = "SPLITDOCK_DEV_MODE";

    private static final String DEFAULT_LAYOUT_FILE = "layout.json";
    private static final String DEFAULT_PROJECT_MARKER = "pom.xml";
    private static final int DEFAULT_PROJECT_SEARCH_LEVELS = 5;
    private static final double DEFAULT_MIN_PANEL_SIZE = 150.0;

    private final String layoutDir;
    private final String layoutFileName;
    private final String projectMarker;
    private final int projectSearchLevels;
    private final double minPanelSize;
    private final boolean devMode;

    private DockConfig(Builder b) {
        this.layoutDir = b.layoutDir;
        this.layoutFileName = b.layoutFileName;
        this.projectMarker = b.projectMarker;
        this.projectSearchLevels = Math.max(0, b.projectSearchLevels);
        this.minPanelSize = b.minPanelSize;
        this.devMode = b.devMode;
    }

    /** Directory for the default layout file (SPLITDOCK_LAYOUT_DIR); null means "project root". */
    public String getLayoutDir() {
        return layoutDir;
    }

    /** Layout file name. Default {@value #DEFAULT_LAYOUT_FILE}. */
    public String getLayoutFileName() {
        return layoutFileName;
    }

    /** File whose presence marks the project root. Default {@value #DEFAULT_PROJECT_MARKER}. */
    public String getProjectMarker() {
        return projectMarker;
    }

    public int getProjectSearchLevels() {
        return projectSearchLevels;
    }

    /** Initial global minimum panel size; not clamped here. */
    public double getMinPanelSize() {
        return minPanelSize;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public static DockConfig defaults() {
        return builder().build();
    }

    public static DockConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Same as {@link #fromEnvironment()} but reads variables from the given map. */
    public static DockConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return fromEnvironment(env::get);
    }

    private static DockConfig fromEnvironment(Function<String, String> env) {
        return builder()
                .layoutDir(getEnv(env, ENV_LAYOUT_DIR, null))
                .layoutFileName(getEnv(env, ENV_LAYOUT_FILE, DEFAULT_LAYOUT_FILE))
                .projectMarker(getEnv(env, ENV_PROJECT_MARKER, DEFAULT_PROJECT_MARKER))
                .projectSearchLevels(parseInt(env.apply(ENV_PROJECT_SEARCH_LEVELS), DEFAULT_PROJECT_SEARCH_LEVELS))
                .minPanelSize(parseDouble(env.apply(ENV_MIN_PANEL_SIZE), DEFAULT_MIN_PANEL_SIZE))
                .devMode(parseBoolean(env.apply(ENV_DEV_MODE), false))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String layoutDir;
        private String layoutFileName = DEFAULT_LAYOUT_FILE;
        private String projectMarker = DEFAULT_PROJECT_MARKER;
        private int projectSearchLevels = DEFAULT_PROJECT_SEARCH_LEVELS;
        private double minPanelSize = DEFAULT_MIN_PANEL_SIZE;
        private boolean devMode;

        public Builder layoutDir(String layoutDir) {
            this.layoutDir = layoutDir != null && !layoutDir.isBlank() ? layoutDir : null;
            return this;
        }

        public Builder layoutFileName(String layoutFileName) {
            this.layoutFileName = layoutFileName != null && !layoutFileName.isBlank() ? layoutFileName : DEFAULT_LAYOUT_FILE;
            return this;
        }

        public Builder projectMarker(String projectMarker) {
            this.projectMarker = projectMarker != null && !projectMarker.isBlank() ? projectMarker : DEFAULT_PROJECT_MARKER;
            return this;
        }

        public Builder projectSearchLevels(int projectSearchLevels) {
            this.projectSearchLevels = projectSearchLevels;
            return this;
        }

        public Builder minPanelSize(double minPanelSize) {
            this.minPanelSize = minPanelSize;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public DockConfig build() {
            return new DockConfig(this);
        }
    }
}

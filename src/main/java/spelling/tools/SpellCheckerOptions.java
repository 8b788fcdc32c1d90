package spelling.tools;

import spelling.alignment.EditCostEstimator;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Tunables for training and correction.
 * <p>
 * Defaults can be overridden by a {@code spelling.properties} resource on the classpath, and that in turn by JVM system
 * properties with the same keys.
 */
public final class SpellCheckerOptions {

    public static final String RESOURCE = "spelling.properties";

    public static final String SMOOTHING = "spelling.smoothing";
    public static final String MAX_ITERATIONS = "spelling.maxIterations";
    public static final String TOP_K = "spelling.topK";
    public static final String PARALLEL = "spelling.parallel";

    private final double smoothing;
    private final int maxIterations;
    private final int topK;
    private final boolean parallel;

    private SpellCheckerOptions(Builder builder) {
        this.smoothing = builder.smoothing;
        this.maxIterations = builder.maxIterations;
        this.topK = builder.topK;
        this.parallel = builder.parallel;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SpellCheckerOptions defaults() {
        return builder().build();
    }

    /**
     * Defaults, then the classpath resource, then system properties.
     */
    public static SpellCheckerOptions load() {
        Properties properties = new Properties();
        try (InputStream in = SpellCheckerOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
        for (String key : new String[]{SMOOTHING, MAX_ITERATIONS, TOP_K, PARALLEL}) {
            String value = System.getProperty(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        return fromProperties(properties);
    }

    /**
     * Reads whichever of the known keys are present and keeps defaults for the others.
     *
     * @throws IllegalArgumentException if a value does not parse or is out of range
     */
    public static SpellCheckerOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String value = properties.getProperty(SMOOTHING);
        if (value != null) {
            builder.smoothing(parseDouble(SMOOTHING, value));
        }
        value = properties.getProperty(MAX_ITERATIONS);
        if (value != null) {
            builder.maxIterations(parseInt(MAX_ITERATIONS, value));
        }
        value = properties.getProperty(TOP_K);
        if (value != null) {
            builder.topK(parseInt(TOP_K, value));
        }
        value = properties.getProperty(PARALLEL);
        if (value != null) {
            builder.parallel(parseBoolean(PARALLEL, value));
        }
        return builder.build();
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": " + value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) {
            return true;
        } else if (normalized.equals("false")) {
            return false;
        }
        throw new IllegalArgumentException("Invalid " + key + ": " + value);
    }

    public double smoothing() {
        return smoothing;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public int topK() {
        return topK;
    }

    public boolean parallel() {
        return parallel;
    }

    public EditCostEstimator estimator() {
        return new EditCostEstimator(smoothing, maxIterations, parallel);
    }

    @Override
    public String toString() {
        return "SpellCheckerOptions{smoothing=" + smoothing + ", maxIterations=" + maxIterations
                + ", topK=" + topK + ", parallel=" + parallel + "}";
    }

    public static final class Builder {
        private double smoothing = EditCostEstimator.DEFAULT_SMOOTHING;
        private int maxIterations = EditCostEstimator.DEFAULT_MAX_ITERATIONS;
        private int topK = 10;
        private boolean parallel = false;

        private Builder() {
        }

        public Builder smoothing(double smoothing) {
            this.smoothing = smoothing;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public SpellCheckerOptions build() {
            if (smoothing <= 0 || Double.isNaN(smoothing) || Double.isInfinite(smoothing)) {
                throw new IllegalArgumentException(SMOOTHING + " must be a positive number, got " + smoothing);
            }
            if (maxIterations < 1) {
                throw new IllegalArgumentException(MAX_ITERATIONS + " must be at least 1, got " + maxIterations);
            }
            if (topK < 0) {
                throw new IllegalArgumentException(TOP_K + " must not be negative, got " + topK);
            }
            return new SpellCheckerOptions(this);
        }
    }
}

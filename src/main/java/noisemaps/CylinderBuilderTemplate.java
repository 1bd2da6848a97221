package noisemaps;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

/**
 * Configuration template for the cylindrical noise map builder, read from
 * YAML. Every key is optional:
 * <pre>
 * width: 512
 * height: 256
 * lower-angle: -180
 * upper-angle: 180
 * lower-height: -10
 * upper-height: 10
 * parallel: true
 * </pre>
 * The source module, noise map, filter and callback are runtime objects and
 * are attached to the builder returned by {@link #get()}.
 */
public class CylinderBuilderTemplate {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @JsonProperty("width")
    private int width = 256;

    @JsonProperty("height")
    private int height = 256;

    @JsonProperty("lower-angle")
    private float lowerAngle = CylinderNoiseMapBuilder.DEFAULT_LOWER_ANGLE;

    @JsonProperty("upper-angle")
    private float upperAngle = CylinderNoiseMapBuilder.DEFAULT_UPPER_ANGLE;

    @JsonProperty("lower-height")
    private float lowerHeight = CylinderNoiseMapBuilder.DEFAULT_LOWER_HEIGHT;

    @JsonProperty("upper-height")
    private float upperHeight = CylinderNoiseMapBuilder.DEFAULT_UPPER_HEIGHT;

    // ========== Performance Tuning Flags ==========

    /**
     * Build rows on the common fork-join pool.
     * The source module must tolerate concurrent calls.
     */
    @JsonProperty("parallel")
    private boolean parallel = false;

    /**
     * Minimum row count before a parallel build is used.
     */
    @JsonProperty("parallel-threshold")
    private int parallelThreshold = NoiseMapBuilder.DEFAULT_PARALLEL_THRESHOLD;

    /**
     * Log build duration at info level.
     */
    @JsonProperty("debug-timing")
    private boolean debugTiming = false;

    /**
     * Read and validate a template from YAML.
     *
     * @throws IOException if the YAML is malformed or holds unknown keys
     * @throws ConfigValidationException if the values are inconsistent
     */
    public static CylinderBuilderTemplate load(InputStream in) throws IOException, ConfigValidationException {
        CylinderBuilderTemplate template = YAML_MAPPER.readValue(in, CylinderBuilderTemplate.class);
        template.validate();
        return template;
    }

    public static CylinderBuilderTemplate load(Reader reader) throws IOException, ConfigValidationException {
        CylinderBuilderTemplate template = YAML_MAPPER.readValue(reader, CylinderBuilderTemplate.class);
        template.validate();
        return template;
    }

    public boolean validate() throws ConfigValidationException {
        if (width < 0) {
            throw new ConfigValidationException("width must be non-negative, got: " + width);
        }
        if (height < 0) {
            throw new ConfigValidationException("height must be non-negative, got: " + height);
        }
        if (!(lowerAngle < upperAngle)) {
            throw new ConfigValidationException("lower-angle must be below upper-angle, got: " + lowerAngle + " >= " + upperAngle);
        }
        if (!(lowerHeight < upperHeight)) {
            throw new ConfigValidationException("lower-height must be below upper-height, got: " + lowerHeight + " >= " + upperHeight);
        }
        if (parallelThreshold < 1) {
            throw new ConfigValidationException("parallel-threshold must be at least 1, got: " + parallelThreshold);
        }
        return true;
    }

    /**
     * Create a builder carrying this template's size, bounds and flags.
     */
    public CylinderNoiseMapBuilder get() {
        CylinderNoiseMapBuilder builder = new CylinderNoiseMapBuilder();
        builder.setSize(width, height);
        builder.setBounds(lowerAngle, upperAngle, lowerHeight, upperHeight);
        builder.setParallel(parallel);
        builder.setParallelThreshold(parallelThreshold);
        builder.setDebugTiming(debugTiming);
        return builder;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public float getLowerAngle() {
        return lowerAngle;
    }

    public float getUpperAngle() {
        return upperAngle;
    }

    public float getLowerHeight() {
        return lowerHeight;
    }

    public float getUpperHeight() {
        return upperHeight;
    }

    public boolean isParallel() {
        return parallel;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public boolean isDebugTiming() {
        return debugTiming;
    }
}

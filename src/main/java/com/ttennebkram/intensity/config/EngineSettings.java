package com.ttennebkram.intensity.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.intensity.model.TransformParameters;
import com.ttennebkram.intensity.processing.strategies.ParallelRowsLutStrategy;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Engine settings, stored as JSON.
 *
 * Defaults come from the classpath resource {@value #DEFAULTS_RESOURCE}; a user file can
 * override any subset of keys. Missing keys keep their current value.
 *
 * <pre>
 * {
 *   "defaultStrategy": "Own (Parallel Rows)",
 *   "workerThreads": 0,
 *   "scale": 1.0,
 *   "offset": 0.0,
 *   "contrastRange":   { "min": 0.0,    "max": 2.0,   "step": 0.01 },
 *   "brightnessRange": { "min": -100.0, "max": 100.0, "step": 1.0 }
 * }
 * </pre>
 */
public class EngineSettings {

    public static final String DEFAULTS_RESOURCE = "/intensity-transform.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private String defaultStrategy = ParallelRowsLutStrategy.NAME;
    private int workerThreads = 0;
    private TransformParameters parameters = TransformParameters.IDENTITY;
    private ParameterRange contrastRange = new ParameterRange(0.0, 2.0, 0.01);
    private ParameterRange brightnessRange = new ParameterRange(-100.0, 100.0, 1.0);

    /**
     * Slider range for one parameter. Used by selection controls only; the engine
     * itself accepts any finite value.
     */
    public static class ParameterRange {
        public final double min;
        public final double max;
        public final double step;

        public ParameterRange(double min, double max, double step) {
            if (!(min <= max)) {
                throw new IllegalArgumentException("Range min " + min + " exceeds max " + max);
            }
            this.min = min;
            this.max = max;
            this.step = step;
        }

        public boolean contains(double value) {
            return value >= min && value <= max;
        }

        JsonObject toJson() {
            JsonObject json = new JsonObject();
            json.addProperty("min", min);
            json.addProperty("max", max);
            json.addProperty("step", step);
            return json;
        }

        static ParameterRange fromJson(JsonObject json, ParameterRange defaults) {
            double min = json.has("min") ? json.get("min").getAsDouble() : defaults.min;
            double max = json.has("max") ? json.get("max").getAsDouble() : defaults.max;
            double step = json.has("step") ? json.get("step").getAsDouble() : defaults.step;
            return new ParameterRange(min, max, step);
        }

        @Override
        public String toString() {
            return "[" + min + ", " + max + "] step " + step;
        }
    }

    /**
     * Settings from the bundled defaults resource, or built-in values if it is missing.
     */
    public static EngineSettings loadDefaults() {
        EngineSettings settings = new EngineSettings();
        try (InputStream in = EngineSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                System.err.println("[EngineSettings] " + DEFAULTS_RESOURCE + " not on classpath, using built-in defaults");
                return settings;
            }
            settings.merge(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        return settings;
    }

    /**
     * Bundled defaults overridden by the keys present in {@code path}.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the file is not valid settings JSON
     */
    public static EngineSettings load(Path path) throws IOException {
        EngineSettings settings = loadDefaults();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            settings.merge(reader, path.toString());
        }
        return settings;
    }

    /**
     * Apply the keys found in a JSON document on top of the current values.
     */
    public void merge(Reader reader, String sourceName) {
        try {
            JsonObject root = JsonParser.parseReader(reader).getAsJsonObject();
            deserialize(root);
        } catch (JsonParseException | IllegalStateException | ClassCastException
                 | UnsupportedOperationException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid settings in " + sourceName + ": " + e.getMessage(), e);
        }
    }

    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(serialize(), writer);
        }
    }

    public JsonObject serialize() {
        JsonObject json = new JsonObject();
        json.addProperty("defaultStrategy", defaultStrategy);
        json.addProperty("workerThreads", workerThreads);
        parameters.serialize(json);
        json.add("contrastRange", contrastRange.toJson());
        json.add("brightnessRange", brightnessRange.toJson());
        return json;
    }

    public void deserialize(JsonObject json) {
        if (json.has("defaultStrategy")) {
            defaultStrategy = json.get("defaultStrategy").getAsString();
        }
        if (json.has("workerThreads")) {
            workerThreads = json.get("workerThreads").getAsInt();
        }
        parameters = TransformParameters.deserialize(json, parameters);
        if (json.has("contrastRange")) {
            contrastRange = ParameterRange.fromJson(json.getAsJsonObject("contrastRange"), contrastRange);
        }
        if (json.has("brightnessRange")) {
            brightnessRange = ParameterRange.fromJson(json.getAsJsonObject("brightnessRange"), brightnessRange);
        }
    }

    public String getDefaultStrategy() {
        return defaultStrategy;
    }

    public void setDefaultStrategy(String defaultStrategy) {
        this.defaultStrategy = defaultStrategy;
    }

    /** Worker thread count; 0 means one per available processor. */
    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public TransformParameters getParameters() {
        return parameters;
    }

    public void setParameters(TransformParameters parameters) {
        this.parameters = parameters;
    }

    public ParameterRange getContrastRange() {
        return contrastRange;
    }

    public ParameterRange getBrightnessRange() {
        return brightnessRange;
    }
}

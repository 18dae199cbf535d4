package io.daqflow.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CompilerSettings} from a YAML file with an environment variable overlay.
 *
 * <pre>{@code
 * output:
 *   indent-width: 4
 *   idle-sleep-seconds: 0.1
 *   engine-module: daq_core.engine
 *   engine-class: DAQEngine
 *   components-module: daq_core.components
 *   component-defaults: false
 * classes:
 *   widget_gizmo: GizmoWidget
 * logging:
 *   format: text
 *   level: INFO
 * }</pre>
 *
 * <p>Every scalar key can be overridden by a {@code DAQFLOW_*} environment variable, which takes
 * precedence over the YAML value. A variable counts as set only if it is defined and its trimmed
 * value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Looked up in the working directory when {@code --config} is not given. */
    public static final String DEFAULT_CONFIG_FILE = "daqflow.yaml";

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("output", "classes", "logging");

    private ConfigLoader() {
        // utility class
    }

    /** Loads settings from {@code configPath}, applying overrides from {@link System#getenv}. */
    public static CompilerSettings load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads settings from {@code configPath}, applying overrides from {@code envLookup}.
     *
     * @param envLookup maps a variable name to its value, or {@code null} when undefined
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid values
     */
    public static CompilerSettings load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToSettings(
                    root == null || root.isMissingNode() ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /** Defaults plus environment overrides, for runs without a configuration file. */
    public static CompilerSettings fromEnvironment(Function<String, String> envLookup) {
        CompilerSettings.Builder builder = CompilerSettings.builder();
        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static CompilerSettings mapToSettings(JsonNode root, Function<String, String> envLookup) {
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping");
        }
        root.fieldNames().forEachRemaining(key -> {
            if (!KNOWN_ROOT_KEYS.contains(key)) {
                throw new ConfigLoadException("Unknown configuration key '" + key + "', recognized keys are: "
                        + KNOWN_ROOT_KEYS);
            }
        });
        CompilerSettings.Builder builder = CompilerSettings.builder();

        JsonNode output = root.path("output");
        if (output.has("indent-width")) builder.indentWidth(requireInt(output, "indent-width"));
        if (output.has("idle-sleep-seconds"))
            builder.idleSleepSeconds(requireNumber(output, "idle-sleep-seconds"));
        if (output.has("engine-module")) builder.engineModule(output.get("engine-module").asText());
        if (output.has("engine-class")) builder.engineClass(output.get("engine-class").asText());
        if (output.has("components-module"))
            builder.componentsModule(output.get("components-module").asText());
        if (output.has("component-defaults"))
            builder.componentDefaults(requireBoolean(output, "component-defaults"));

        JsonNode classes = root.path("classes");
        if (classes.isObject()) {
            for (Map.Entry<String, JsonNode> entry : classes.properties()) {
                builder.classOverride(entry.getKey(), entry.getValue().asText());
            }
        }

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(CompilerSettings.Builder builder, Function<String, String> envLookup) {
        envInt(envLookup, "DAQFLOW_INDENT_WIDTH", builder::indentWidth);
        envDouble(envLookup, "DAQFLOW_IDLE_SLEEP_SECONDS", builder::idleSleepSeconds);
        envString(envLookup, "DAQFLOW_ENGINE_MODULE", builder::engineModule);
        envString(envLookup, "DAQFLOW_ENGINE_CLASS", builder::engineClass);
        envString(envLookup, "DAQFLOW_COMPONENTS_MODULE", builder::componentsModule);
        envBoolean(envLookup, "DAQFLOW_COMPONENT_DEFAULTS", builder::componentDefaults);
        envString(envLookup, "DAQFLOW_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "DAQFLOW_LOG_LEVEL", builder::loggingLevel);
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envDouble(Function<String, String> envLookup, String envVar, DoubleConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Double.parseDouble(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be a number, got '" + value + "'", e);
            }
        }
    }

    private static void envBoolean(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            if ("true".equalsIgnoreCase(value)) {
                setter.accept(true);
            } else if ("false".equalsIgnoreCase(value)) {
                setter.accept(false);
            } else {
                throw new ConfigLoadException(envVar + " must be true or false, got '" + value + "'");
            }
        }
    }

    // --- YAML helpers ---

    private static int requireInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException("output." + field + " must be an integer, got '" + value.asText() + "'");
        }
        return value.asInt();
    }

    private static double requireNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.isNumber()) {
            throw new ConfigLoadException("output." + field + " must be a number, got '" + value.asText() + "'");
        }
        return value.asDouble();
    }

    private static boolean requireBoolean(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.isBoolean()) {
            throw new ConfigLoadException("output." + field + " must be true or false, got '" + value.asText() + "'");
        }
        return value.booleanValue();
    }
}

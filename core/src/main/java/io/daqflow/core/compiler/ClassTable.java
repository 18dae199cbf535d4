package io.daqflow.core.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps component type tags to the runtime class that implements them. Types without an entry
 * resolve through a deterministic fallback: the tag is split on every character outside
 * {@code [A-Za-z0-9]}, each segment is capitalized, and {@code Component} is appended
 * ({@code widget_gizmo} becomes {@code WidgetGizmoComponent}).
 *
 * <p>A type may also carry configuration defaults: keys filled into a node's properties when the
 * project leaves them out. The bundled class table has none; {@link #withConfigDefaults()} adds
 * the runtime's defaults from {@link #CONFIG_DEFAULTS_RESOURCE}.
 *
 * <p>Thread-safe.
 */
public final class ClassTable {

    private static final Logger LOG = LoggerFactory.getLogger(ClassTable.class);

    /** Classpath resource holding the built-in type table. */
    public static final String DEFAULT_RESOURCE = "daqflow/component-classes.yaml";

    /** Classpath resource holding the runtime's configuration defaults per component type. */
    public static final String CONFIG_DEFAULTS_RESOURCE = "daqflow/component-defaults.yaml";

    private static final Pattern CLASS_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern SEPARATOR = Pattern.compile("[^A-Za-z0-9]+");

    private final Map<String, String> classes = new ConcurrentHashMap<>();
    private final Map<String, ObjectNode> configDefaults = new ConcurrentHashMap<>();

    /** An empty table: every type resolves through the fallback. */
    public ClassTable() {}

    /** A table pre-populated from {@link #DEFAULT_RESOURCE}. */
    public static ClassTable withDefaults() {
        return new ClassTable().loadResource(DEFAULT_RESOURCE);
    }

    /** Adds the configuration defaults from {@link #CONFIG_DEFAULTS_RESOURCE}. */
    public ClassTable withConfigDefaults() {
        return loadResource(CONFIG_DEFAULTS_RESOURCE);
    }

    private ClassTable loadResource(String resource) {
        try (InputStream in = ClassTable.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + resource);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    /**
     * Registers every entry of a YAML document of the form
     * {@code classes: {type: ClassName}} and {@code defaults: {type: {key: value}}}. Either section
     * may be left out, but not both.
     *
     * @throws IOException              if the stream cannot be read or is not valid YAML
     * @throws IllegalArgumentException if an entry is not a valid class identifier or defaults mapping
     */
    public ClassTable load(InputStream yaml) throws IOException {
        JsonNode root = new ObjectMapper(new YAMLFactory()).readTree(yaml);
        JsonNode entries = root == null ? null : root.get("classes");
        JsonNode defaults = root == null ? null : root.get("defaults");
        if ((entries == null || !entries.isObject()) && (defaults == null || !defaults.isObject())) {
            throw new IllegalArgumentException("class table document must have a 'classes' or 'defaults' mapping");
        }
        if (entries != null && entries.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = entries.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                register(entry.getKey(), entry.getValue().asText());
            }
        }
        if (defaults != null && defaults.isObject()) {
            for (Map.Entry<String, JsonNode> entry : defaults.properties()) {
                if (!entry.getValue().isObject()) {
                    throw new IllegalArgumentException(
                            "Configuration defaults for '" + entry.getKey() + "' must be a mapping");
                }
                registerConfigDefaults(entry.getKey(), (ObjectNode) entry.getValue());
            }
        }
        LOG.debug("Loaded {} component class entries, {} with configuration defaults",
                classes.size(), configDefaults.size());
        return this;
    }

    /**
     * Registers (or replaces) the class for a component type.
     *
     * @throws IllegalArgumentException if the type is empty or the class name is not an identifier
     */
    public ClassTable register(String componentType, String className) {
        if (componentType == null || componentType.isEmpty()) {
            throw new IllegalArgumentException("component type must not be null or empty");
        }
        if (className == null || !CLASS_NAME.matcher(className).matches()) {
            throw new IllegalArgumentException(
                    "Invalid class name '" + className + "' for component type '" + componentType + "'");
        }
        classes.put(componentType, className);
        return this;
    }

    /**
     * Registers (or replaces) the configuration defaults for a component type.
     *
     * @throws IllegalArgumentException if the type is empty
     */
    public ClassTable registerConfigDefaults(String componentType, ObjectNode defaults) {
        if (componentType == null || componentType.isEmpty()) {
            throw new IllegalArgumentException("component type must not be null or empty");
        }
        Objects.requireNonNull(defaults, "defaults must not be null");
        configDefaults.put(componentType, defaults.deepCopy());
        return this;
    }

    /**
     * The node properties with the type's configuration defaults added for every key they lack;
     * added keys follow the existing ones. Properties that are not an object, or types without
     * defaults, are returned unchanged.
     */
    public JsonNode applyConfigDefaults(String componentType, JsonNode properties) {
        ObjectNode defaults = configDefaults.get(componentType);
        if (defaults == null || properties == null || !properties.isObject()) {
            return properties;
        }
        ObjectNode merged = ((ObjectNode) properties).deepCopy();
        for (Map.Entry<String, JsonNode> entry : defaults.properties()) {
            if (!merged.has(entry.getKey())) {
                merged.set(entry.getKey(), entry.getValue().deepCopy());
            }
        }
        return merged;
    }

    /** The registered class, if any. */
    public Optional<String> lookup(String componentType) {
        return Optional.ofNullable(classes.get(componentType));
    }

    /** The registered class, or the fallback name when the type is not registered. */
    public String resolve(String componentType) {
        String registered = classes.get(componentType);
        return registered != null ? registered : fallbackClassName(componentType);
    }

    public boolean isRegistered(String componentType) {
        return classes.containsKey(componentType);
    }

    public int size() {
        return classes.size();
    }

    /** The fallback class name for a type tag. */
    public static String fallbackClassName(String componentType) {
        StringBuilder out = new StringBuilder();
        for (String segment : SEPARATOR.split(componentType == null ? "" : componentType)) {
            if (!segment.isEmpty()) {
                out.append(Character.toUpperCase(segment.charAt(0))).append(segment.substring(1));
            }
        }
        if (out.length() == 0 || Character.isDigit(out.charAt(0))) {
            out.insert(0, "Unnamed");
        }
        return out.append("Component").toString();
    }
}

package io.daqflow.standalone.config;

import io.daqflow.core.compiler.OutputOptions;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of the standalone compiler. All fields have defaults; use {@link #builder()} to
 * construct instances.
 *
 * @param indentWidth      spaces per indentation level in generated code
 * @param idleSleepSeconds main-loop sleep interval of the generated program
 * @param engineModule     Python module providing the engine class
 * @param engineClass      engine class name
 * @param componentsModule Python module providing the component classes
 * @param classOverrides   extra or replacement entries for the component class table
 * @param componentDefaults whether node properties get the runtime's per-type configuration defaults
 * @param loggingFormat    json or text
 * @param loggingLevel     root log level
 */
public record CompilerSettings(
        int indentWidth,
        double idleSleepSeconds,
        String engineModule,
        String engineClass,
        String componentsModule,
        Map<String, String> classOverrides,
        boolean componentDefaults,
        String loggingFormat,
        String loggingLevel) {

    public CompilerSettings {
        classOverrides = Map.copyOf(classOverrides);
    }

    /** Output options for the core compilers. */
    public OutputOptions toOutputOptions() {
        return new OutputOptions(" ".repeat(indentWidth), idleSleepSeconds, engineModule, engineClass, componentsModule);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder with documented defaults. */
    public static final class Builder {

        private int indentWidth = 4;
        private double idleSleepSeconds = OutputOptions.DEFAULT_IDLE_SLEEP_SECONDS;
        private String engineModule = OutputOptions.DEFAULT_ENGINE_MODULE;
        private String engineClass = OutputOptions.DEFAULT_ENGINE_CLASS;
        private String componentsModule = OutputOptions.DEFAULT_COMPONENTS_MODULE;
        private final Map<String, String> classOverrides = new LinkedHashMap<>();
        private boolean componentDefaults;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder idleSleepSeconds(double idleSleepSeconds) {
            this.idleSleepSeconds = idleSleepSeconds;
            return this;
        }

        public Builder engineModule(String engineModule) {
            this.engineModule = engineModule;
            return this;
        }

        public Builder engineClass(String engineClass) {
            this.engineClass = engineClass;
            return this;
        }

        public Builder componentsModule(String componentsModule) {
            this.componentsModule = componentsModule;
            return this;
        }

        public Builder classOverride(String componentType, String className) {
            this.classOverrides.put(componentType, className);
            return this;
        }

        public Builder componentDefaults(boolean componentDefaults) {
            this.componentDefaults = componentDefaults;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the settings.
         *
         * @throws ConfigLoadException if a value is out of range
         */
        public CompilerSettings build() {
            if (indentWidth < 1 || indentWidth > 16) {
                throw new ConfigLoadException("output.indent-width must be between 1 and 16, got " + indentWidth);
            }
            if (!(idleSleepSeconds > 0) || Double.isInfinite(idleSleepSeconds)) {
                throw new ConfigLoadException(
                        "output.idle-sleep-seconds must be a positive number, got " + idleSleepSeconds);
            }
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException("logging.format must be 'json' or 'text', got '" + loggingFormat + "'");
            }
            return new CompilerSettings(
                    indentWidth,
                    idleSleepSeconds,
                    engineModule,
                    engineClass,
                    componentsModule,
                    classOverrides,
                    componentDefaults,
                    loggingFormat,
                    loggingLevel);
        }
    }
}

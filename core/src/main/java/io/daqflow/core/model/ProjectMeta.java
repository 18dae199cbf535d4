package io.daqflow.core.model;

/**
 * Descriptive project metadata carried into the generated program header.
 *
 * @param name          project name
 * @param version       project version
 * @param schemaVersion version of the project document format
 * @param description   free-form description, may be empty
 */
public record ProjectMeta(String name, String version, String schemaVersion, String description) {

    public static final String DEFAULT_NAME = "Untitled";
    public static final String DEFAULT_VERSION = "1.0.0";
    public static final String DEFAULT_SCHEMA_VERSION = "0.1.0";

    public ProjectMeta {
        name = name == null || name.isBlank() ? DEFAULT_NAME : name;
        version = version == null || version.isBlank() ? DEFAULT_VERSION : version;
        schemaVersion = schemaVersion == null || schemaVersion.isBlank() ? DEFAULT_SCHEMA_VERSION : schemaVersion;
        description = description == null ? "" : description;
    }

    /** Metadata with every field at its default. */
    public static ProjectMeta untitled() {
        return new ProjectMeta(null, null, null, null);
    }
}

package io.daqflow.core.document;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.yaml.snakeyaml.LoaderOptions;

/**
 * Object mappers for project and workspace documents.
 *
 * <p>Every {@code next} link of a statement chain adds two nesting levels to a workspace document
 * ({@code "next": {"block": {...}}}), so the stock limit of 1000 levels caps chains at a few hundred
 * blocks. These mappers read and write up to {@link #MAX_NESTING_DEPTH} levels, which holds chains
 * of roughly 5000 blocks.
 */
final class DocumentMappers {

    /** Maximum nesting depth accepted when reading and writing documents. */
    static final int MAX_NESTING_DEPTH = 10_000;

    /** Maximum size of a YAML document in code points. */
    static final int MAX_YAML_CODE_POINTS = 64 * 1024 * 1024;

    private DocumentMappers() {
        // utility class
    }

    static ObjectMapper json() {
        return new ObjectMapper(JsonFactory.builder()
                .streamReadConstraints(readConstraints())
                .streamWriteConstraints(writeConstraints())
                .build());
    }

    static ObjectMapper yaml() {
        LoaderOptions loaderOptions = new LoaderOptions();
        loaderOptions.setNestingDepthLimit(MAX_NESTING_DEPTH);
        loaderOptions.setCodePointLimit(MAX_YAML_CODE_POINTS);
        return new ObjectMapper(YAMLFactory.builder()
                .loaderOptions(loaderOptions)
                .streamReadConstraints(readConstraints())
                .streamWriteConstraints(writeConstraints())
                .build());
    }

    private static StreamReadConstraints readConstraints() {
        return StreamReadConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build();
    }

    private static StreamWriteConstraints writeConstraints() {
        return StreamWriteConstraints.builder().maxNestingDepth(MAX_NESTING_DEPTH).build();
    }
}

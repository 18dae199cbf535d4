package io.daqflow.core.compiler;

import io.daqflow.core.model.BlockDefinition;
import java.util.Optional;

/**
 * Output of the schema meta-compiler.
 *
 * @param blockType         block type tag derived from the factory's {@code NAME}
 * @param schemaText        the JSON block definition, pretty-printed; a comment when there is no root
 * @param generatorStubText a Java rule skeleton for the block; a comment when there is no root
 * @param definition        the definition to register, or {@code null} when there is no root
 */
public record SchemaCompilation(
        String blockType, String schemaText, String generatorStubText, BlockDefinition definition) {

    public Optional<BlockDefinition> blockDefinition() {
        return Optional.ofNullable(definition);
    }

    /** True when no {@code factory_base} root was found and both texts are placeholders. */
    public boolean isPlaceholder() {
        return definition == null;
    }
}

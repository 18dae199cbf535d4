package io.daqflow.core.compiler;

import java.util.List;

/**
 * Result of compiling a whole workspace.
 *
 * @param text        the complete text: diagnostic header, imports, then the compiled chains
 * @param body        the compiled chains alone
 * @param imports     import lines requested by rules, in first-request order
 * @param diagnostics everything that fell back, in compilation order
 */
public record WorkspaceCompilation(String text, String body, List<String> imports, List<Diagnostic> diagnostics) {

    public WorkspaceCompilation {
        imports = List.copyOf(imports);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}

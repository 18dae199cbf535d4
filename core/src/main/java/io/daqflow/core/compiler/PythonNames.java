package io.daqflow.core.compiler;

import java.util.Set;

/** Python reserved words and the helper that keeps generated names clear of them. */
public final class PythonNames {

    /** Python 3 keywords, the soft keywords {@code match} and {@code case}, and the runtime helpers generated code calls. */
    public static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with",
            "yield", "match", "case", "print", "get_input", "set_output");

    private PythonNames() {}

    /** True if {@code name} is a keyword or a name the generated code relies on. */
    public static boolean isReserved(String name) {
        return KEYWORDS.contains(name);
    }

    /** Appends {@code _} to a reserved name; other names are returned unchanged. */
    public static String avoidReserved(String name) {
        return isReserved(name) ? name + "_" : name;
    }
}

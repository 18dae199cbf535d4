package io.daqflow.standalone.cli;

import java.nio.file.Path;

/**
 * A parsed command line.
 *
 * <pre>
 * compile --project &lt;file&gt; [--out &lt;file&gt;] [--config &lt;yaml&gt;]
 * schema  --workspace &lt;file&gt; [--config &lt;yaml&gt;]
 * </pre>
 *
 * @param name      {@code compile} or {@code schema}
 * @param project   project document to compile ({@code compile})
 * @param workspace block-factory workspace state ({@code schema})
 * @param out       output file, or {@code null} for stdout
 * @param config    configuration file, or {@code null} when not given
 */
public record CliCommand(String name, Path project, Path workspace, Path out, Path config) {

    public static final String COMPILE = "compile";
    public static final String SCHEMA = "schema";

    static final String USAGE = "usage: daqflow compile --project <file> [--out <file>] [--config <yaml>]\n"
            + "       daqflow schema --workspace <file> [--out <file>] [--config <yaml>]";

    /**
     * Parses command-line arguments.
     *
     * @throws IllegalArgumentException if the command or an option is unknown, an option lacks its
     *     value, or a required option is missing
     */
    public static CliCommand parse(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("missing command\n" + USAGE);
        }
        String name = args[0];
        if (!COMPILE.equals(name) && !SCHEMA.equals(name)) {
            throw new IllegalArgumentException("unknown command '" + name + "'\n" + USAGE);
        }
        Path project = null;
        Path workspace = null;
        Path out = null;
        Path config = null;
        for (int i = 1; i < args.length; i++) {
            String option = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException(option + " requires a value\n" + USAGE);
            }
            Path value = Path.of(args[++i]);
            switch (option) {
                case "--project" -> project = value;
                case "--workspace" -> workspace = value;
                case "--out" -> out = value;
                case "--config" -> config = value;
                default -> throw new IllegalArgumentException("unknown option '" + option + "'\n" + USAGE);
            }
        }
        if (COMPILE.equals(name) && project == null) {
            throw new IllegalArgumentException("compile requires --project\n" + USAGE);
        }
        if (SCHEMA.equals(name) && workspace == null) {
            throw new IllegalArgumentException("schema requires --workspace\n" + USAGE);
        }
        return new CliCommand(name, project, workspace, out, config);
    }
}

package io.daqflow.standalone.cli;

import io.daqflow.core.compiler.ClassTable;
import io.daqflow.core.compiler.CompilerConfig;
import io.daqflow.core.compiler.GraphCompiler;
import io.daqflow.core.compiler.RuleRegistry;
import io.daqflow.core.compiler.SchemaCompilation;
import io.daqflow.core.compiler.SchemaCompiler;
import io.daqflow.core.document.DaqProject;
import io.daqflow.core.document.ProjectParser;
import io.daqflow.core.document.WorkspaceSerializer;
import io.daqflow.core.error.DocumentParseException;
import io.daqflow.core.model.Workspace;
import io.daqflow.core.rules.BuiltinRules;
import io.daqflow.standalone.config.CompilerSettings;
import io.daqflow.standalone.config.ConfigLoader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs one {@link CliCommand} against files on disk. */
public final class CompilerApp {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerApp.class);

    private final CompilerConfig config;

    public CompilerApp(CompilerSettings settings) {
        this.config = buildConfig(settings);
    }

    /**
     * Loads settings for a command: the {@code --config} file when given, else
     * {@value ConfigLoader#DEFAULT_CONFIG_FILE} when present, else defaults; environment overrides
     * apply in every case.
     */
    public static CompilerSettings loadSettings(CliCommand command, Function<String, String> envLookup) {
        if (command.config() != null) {
            return ConfigLoader.load(command.config(), envLookup);
        }
        Path defaultPath = Path.of(ConfigLoader.DEFAULT_CONFIG_FILE);
        if (Files.exists(defaultPath)) {
            return ConfigLoader.load(defaultPath, envLookup);
        }
        return ConfigLoader.fromEnvironment(envLookup);
    }

    /** The compiler configuration derived from the settings. */
    public CompilerConfig config() {
        return config;
    }

    /**
     * Executes the command, writing the result to {@code command.out()} or to {@code stdout}.
     *
     * @throws IOException if an input cannot be read or the output cannot be written
     */
    public void run(CliCommand command, PrintStream stdout) throws IOException {
        String text = switch (command.name()) {
            case CliCommand.COMPILE -> compileProject(command.project());
            case CliCommand.SCHEMA -> compileSchema(command.workspace());
            default -> throw new IllegalArgumentException("unknown command '" + command.name() + "'");
        };
        if (command.out() == null) {
            stdout.print(text);
            stdout.flush();
        } else {
            Path parent = command.out().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(command.out(), text, StandardCharsets.UTF_8);
            LOG.info("Wrote {} ({} bytes)", command.out(), text.getBytes(StandardCharsets.UTF_8).length);
        }
    }

    String compileProject(Path project) {
        DaqProject loaded = new ProjectParser().parse(project);
        return new GraphCompiler(config).compileProgram(loaded.graph(), loaded.meta());
    }

    String compileSchema(Path workspaceFile) throws IOException {
        if (!Files.exists(workspaceFile)) {
            throw new DocumentParseException("Workspace file not found", null, workspaceFile.toString());
        }
        String json = Files.readString(workspaceFile, StandardCharsets.UTF_8);
        Workspace workspace = new WorkspaceSerializer().fromJsonString(json, workspaceFile.toString());
        SchemaCompilation compilation = new SchemaCompiler(config).compileSchema(workspace);
        if (compilation.isPlaceholder()) {
            LOG.warn("No {} block found in {}", SchemaCompiler.ROOT_TYPE, workspaceFile);
        }
        return compilation.schemaText() + "\n\n" + compilation.generatorStubText();
    }

    private static CompilerConfig buildConfig(CompilerSettings settings) {
        RuleRegistry rules = BuiltinRules.registerAll(new RuleRegistry());
        ClassTable classes = ClassTable.withDefaults();
        if (settings.componentDefaults()) {
            classes.withConfigDefaults();
        }
        settings.classOverrides().forEach(classes::register);
        return new CompilerConfig(rules, classes, settings.toOutputOptions(), List.of());
    }
}

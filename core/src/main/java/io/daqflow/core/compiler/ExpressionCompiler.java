package io.daqflow.core.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import io.daqflow.core.model.Block;
import io.daqflow.core.model.Expr;
import io.daqflow.core.model.Order;
import io.daqflow.core.model.Workspace;
import io.daqflow.core.spi.BlockContext;
import io.daqflow.core.spi.BlockRule;
import io.daqflow.core.spi.CompileListener.DegradeKind;
import io.daqflow.core.spi.CompileListener.DegradedEvent;
import io.daqflow.core.spi.StatementRule;
import io.daqflow.core.spi.ValueRule;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles block trees into Python source by dispatching each block to the {@link BlockRule}
 * registered for its type.
 *
 * <p>Value blocks compile to an {@link Expr}; the caller's position decides whether it needs
 * parentheses. Statement chains compile to lines, nested bodies indented one level per depth.
 * Compilation is pure: the same tree always yields the same text, and nothing is thrown for
 * unknown types, unconnected sockets or failing rules. Those fall back to {@code None} in value
 * position and to a comment line in statement position, and are reported as {@link Diagnostic}s.
 *
 * <p>Thread-safe; each call uses its own compilation state.
 */
public final class ExpressionCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionCompiler.class);

    static final Expr DEGRADED_VALUE = Expr.atomic("None");

    private final CompilerConfig config;
    private final LiteralSerializer literals;
    private final ListenerNotifier notifier;

    public ExpressionCompiler(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.literals = new LiteralSerializer(config.output().indentUnit());
        this.notifier = new ListenerNotifier(config.listeners());
    }

    /**
     * Compiles a value block for a position that requires {@code required}. The returned text is
     * parenthesized iff the block's own order is strictly looser; a parenthesized result is
     * {@link Order#ATOMIC}.
     */
    public Expr compileValue(Block block, Order required) {
        Objects.requireNonNull(block, "block must not be null");
        Objects.requireNonNull(required, "required must not be null");
        Expr expr = new Session().value(block);
        return expr.needsParensAt(required) ? Expr.atomic(expr.textAt(required)) : expr;
    }

    /** Compiles a value block with its own order, unparenthesized. */
    public Expr compileValue(Block block) {
        return compileValue(block, Order.NONE);
    }

    /**
     * Compiles a statement chain: the head's lines, then each follower's, in chain order. A
     * {@code null} head yields the empty string. Imports requested by rules are dropped; use
     * {@link #compile(Workspace)} to collect them.
     */
    public String compileStatementChain(Block head) {
        return head == null ? "" : new Session().chain(head);
    }

    /** Compiles every top-level chain of a workspace and returns the assembled text. */
    public String compileWorkspace(Workspace workspace) {
        return compile(workspace).text();
    }

    /**
     * Compiles every top-level chain of a workspace. A top-level value block becomes an
     * expression statement. Chains are separated by one blank line; rule imports precede them,
     * and diagnostics not already visible inline lead the text as comments.
     */
    public WorkspaceCompilation compile(Workspace workspace) {
        Objects.requireNonNull(workspace, "workspace must not be null");
        long start = System.nanoTime();
        Session session = new Session();
        List<String> chains = new ArrayList<>();
        for (Block top : workspace.topBlocks()) {
            String code = session.chain(top);
            if (!code.isEmpty()) {
                chains.add(code);
            }
        }
        String body = String.join("\n", chains);

        StringBuilder text = new StringBuilder();
        for (Diagnostic d : session.diagnostics) {
            if (!d.inline()) {
                text.append(d.asComment()).append('\n');
            }
        }
        for (String importLine : session.imports) {
            text.append(importLine).append('\n');
        }
        if (!session.imports.isEmpty() && !body.isEmpty()) {
            text.append('\n');
        }
        text.append(body);

        LOG.debug(
                "Compiled workspace: topBlocks={}, imports={}, diagnostics={}, durationMs={}",
                workspace.topBlocks().size(),
                session.imports.size(),
                session.diagnostics.size(),
                (System.nanoTime() - start) / 1_000_000);
        return new WorkspaceCompilation(
                text.toString(), body, new ArrayList<>(session.imports), session.diagnostics);
    }

    /** Prefixes every non-empty line with one indent unit. */
    String indent(String code) {
        if (code.isEmpty()) {
            return code;
        }
        String unit = config.output().indentUnit();
        StringBuilder out = new StringBuilder(code.length() + 16);
        int lineStart = 0;
        while (lineStart < code.length()) {
            int nl = code.indexOf('\n', lineStart);
            int lineEnd = nl < 0 ? code.length() : nl + 1;
            if (lineEnd - lineStart > 1 || nl < 0) {
                out.append(unit);
            }
            out.append(code, lineStart, lineEnd);
            lineStart = lineEnd;
        }
        return out.toString();
    }

    /** Per-call state: imports and diagnostics of one compilation. */
    private final class Session {

        final Set<String> imports = new LinkedHashSet<>();
        final List<Diagnostic> diagnostics = new ArrayList<>();

        Expr value(Block block) {
            Optional<BlockRule> rule = config.rules().rule(block.type());
            if (rule.isEmpty()) {
                degrade(block, DegradeKind.UNKNOWN_BLOCK_TYPE, unresolvedMessage(block), false);
                return DEGRADED_VALUE;
            }
            if (!(rule.get() instanceof ValueRule valueRule)) {
                degrade(block, DegradeKind.MISPLACED_BLOCK,
                        "statement block '" + block.type() + "' used as a value", false);
                return DEGRADED_VALUE;
            }
            try {
                return Objects.requireNonNull(valueRule.compileValue(new Context(block)), "rule returned null");
            } catch (RuntimeException e) {
                LOG.warn("Value rule for block type '{}' failed on block '{}'", block.type(), block.id(), e);
                degrade(block, DegradeKind.RULE_FAILURE,
                        "generator for block type '" + block.type() + "' failed: " + e.getMessage(), false);
                return DEGRADED_VALUE;
            }
        }

        String chain(Block head) {
            StringBuilder out = new StringBuilder();
            for (Block b = head; b != null; b = b.next()) {
                out.append(statement(b));
            }
            return out.toString();
        }

        String statement(Block block) {
            Optional<BlockRule> rule = config.rules().rule(block.type());
            if (rule.isEmpty()) {
                String message = unresolvedMessage(block);
                degrade(block, DegradeKind.UNKNOWN_BLOCK_TYPE, message, true);
                return "# " + message + "\n";
            }
            if (rule.get() instanceof StatementRule statementRule) {
                try {
                    String code = statementRule.compileStatement(new Context(block));
                    if (code == null || code.isEmpty()) {
                        return "";
                    }
                    return code.endsWith("\n") ? code : code + "\n";
                } catch (RuntimeException e) {
                    LOG.warn("Statement rule for block type '{}' failed on block '{}'", block.type(), block.id(), e);
                    String message = "generator for block type '" + block.type() + "' failed";
                    degrade(block, DegradeKind.RULE_FAILURE, message + ": " + e.getMessage(), true);
                    return "# " + message + "\n";
                }
            }
            // A naked value block becomes an expression statement.
            return value(block).text() + "\n";
        }

        private String unresolvedMessage(Block block) {
            if (config.rules().definition(block.type()).isPresent()) {
                return "no generator registered for block type: '" + block.type() + "'";
            }
            return "unknown block type: '" + block.type() + "'";
        }

        private void degrade(Block block, DegradeKind kind, String message, boolean inline) {
            diagnostics.add(new Diagnostic(block.id(), block.type(), message, inline));
            LOG.debug("Block '{}' degraded ({}): {}", block.id(), kind, message);
            notifier.degraded(new DegradedEvent(kind, block.id(), block.type(), message));
        }

        /** The {@link BlockContext} handed to one rule invocation. */
        private final class Context implements BlockContext {

            private final Block block;

            Context(Block block) {
                this.block = block;
            }

            @Override
            public Block block() {
                return block;
            }

            @Override
            public String field(String name, String defaultValue) {
                return block.fieldText(name, defaultValue);
            }

            @Override
            public JsonNode fieldValue(String name) {
                return block.field(name);
            }

            @Override
            public Expr value(String socket, Expr fallback) {
                Objects.requireNonNull(fallback, "fallback must not be null");
                Block child = block.valueInput(socket);
                return child == null ? fallback : Session.this.value(child);
            }

            @Override
            public String statements(String socket) {
                Block head = block.statementInput(socket);
                return head == null ? "" : indent(chain(head));
            }

            @Override
            public String body(String socket) {
                String code = statements(socket);
                return code.isEmpty() ? config.output().indentUnit() + "pass\n" : code;
            }

            @Override
            public String literal(JsonNode value) {
                return literals.toLiteral(value, 0);
            }

            @Override
            public String stringLiteral(String value) {
                return LiteralSerializer.quote(value == null ? "" : value);
            }

            @Override
            public String identifier(String name) {
                return PythonNames.avoidReserved(IdentifierSanitizer.sanitize(name));
            }

            @Override
            public void requireImport(String importLine) {
                imports.add(importLine);
            }

            @Override
            public void diagnostic(String message) {
                diagnostics.add(new Diagnostic(block.id(), block.type(), message, false));
            }
        }
    }
}

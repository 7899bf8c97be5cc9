package io.github.manjago.esdl.lang.ast;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Parsed pipeline: top-level statements in source order, blocks included.
 */
public record Program(List<Statement> statements) {

    /** Block executed once per generation. */
    public static final String GENERATION_BLOCK = "generation";

    public Program {
        statements = List.copyOf(statements);
    }

    /**
     * Statements outside any block, executed once while initializing.
     */
    public List<Statement> initStatements() {
        return statements.stream()
                .filter(s -> !(s instanceof BlockStatement))
                .toList();
    }

    public List<BlockStatement> blocks() {
        return statements.stream()
                .filter(BlockStatement.class::isInstance)
                .map(BlockStatement.class::cast)
                .toList();
    }

    public @Nullable BlockStatement block(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        for (BlockStatement block : blocks()) {
            if (block.name().equals(key)) {
                return block;
            }
        }
        return null;
    }
}

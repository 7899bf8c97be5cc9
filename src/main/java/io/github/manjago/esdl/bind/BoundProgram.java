package io.github.manjago.esdl.bind;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Program after binding.
 *
 * @param init statements executed once while initializing
 * @param generation body of the generation block, or null for a single-shot program
 * @param populations every population name the program declares
 * @param variables every run variable the program assigns
 */
public record BoundProgram(List<BoundStatement> init, @Nullable List<BoundStatement> generation,
                           Set<String> populations, Set<String> variables) {

    public BoundProgram {
        init = List.copyOf(init);
        generation = generation == null ? null : List.copyOf(generation);
        populations = Set.copyOf(populations);
        variables = Set.copyOf(variables);
    }

    public boolean isSingleShot() {
        return generation == null;
    }

    /**
     * Indented listing of the bound statements.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        append(sb, init, "");
        if (generation != null) {
            sb.append("BEGIN generation\n");
            append(sb, generation, "    ");
            sb.append("END generation\n");
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, List<BoundStatement> statements, String indent) {
        for (BoundStatement statement : statements) {
            sb.append(indent).append(statement).append('\n');
            if (statement instanceof BoundStatement.Repeat repeat) {
                append(sb, repeat.body(), indent + "    ");
                sb.append(indent).append("END REPEAT\n");
            }
        }
    }
}

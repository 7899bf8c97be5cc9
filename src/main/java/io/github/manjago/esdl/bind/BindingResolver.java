package io.github.manjago.esdl.bind;

import io.github.manjago.esdl.config.ConfigContext;
import io.github.manjago.esdl.lang.EvaluationException;
import io.github.manjago.esdl.lang.ExpressionEvaluator;
import io.github.manjago.esdl.lang.SourceLocation;
import io.github.manjago.esdl.lang.VariableScope;
import io.github.manjago.esdl.lang.ast.*;
import io.github.manjago.esdl.ops.Cardinality;
import io.github.manjago.esdl.ops.OperatorDescriptor;
import io.github.manjago.esdl.ops.OperatorRegistry;
import io.github.manjago.esdl.ops.ParamSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a parsed program against an operator registry and a configuration context.
 *
 * <h2>Name resolution inside expressions:</h2>
 * <ol>
 *   <li>run variables assigned earlier in the program (kept as references, evaluated at run time)</li>
 *   <li>configuration values (substituted as literals; see {@link ConfigContext} for layer order)</li>
 * </ol>
 * Missing operator parameters come from {@code operators.<operator>.<param>} in the
 * configuration, then from the operator's declared default.
 * <p>
 * Statements are resolved in execution order (initialization, then the generation
 * block), so a population or variable must be introduced before it is used.
 */
public class BindingResolver {

    private static final Logger log = LoggerFactory.getLogger(BindingResolver.class);

    private final OperatorRegistry registry;
    private final ConfigContext context;
    private final Set<String> predeclared = new LinkedHashSet<>();

    // Per-bind state
    private Set<String> populations;
    private Set<String> variables;

    public BindingResolver(OperatorRegistry registry, ConfigContext context) {
        this.registry = registry;
        this.context = context;
    }

    /**
     * Treat a population as existing before the program starts (supplied by the host).
     */
    public BindingResolver declarePopulation(String name) {
        predeclared.add(name);
        return this;
    }

    /**
     * Bind a whole program.
     *
     * @throws UnresolvedOperatorException unknown operator name
     * @throws UnresolvedVariableException unknown variable, population or parameter
     * @throws BindingException any other inconsistency (wrong operator role, bad argument type)
     */
    public BoundProgram bind(Program program) throws BindingException {
        populations = new LinkedHashSet<>(predeclared);
        variables = new LinkedHashSet<>();

        List<BoundStatement> init = bindAll(program.initStatements());

        List<BoundStatement> generation = null;
        for (BlockStatement block : program.blocks()) {
            if (block.name().equals(Program.GENERATION_BLOCK)) {
                generation = bindAll(block.body());
                if (!containsYield(generation)) {
                    log.warn("Generation block at {} has no YIELD; nothing will be published", block.location());
                }
            } else {
                log.warn("Block '{}' at {} is not executed by the interpreter", block.name(), block.location());
            }
        }

        BoundProgram bound = new BoundProgram(init, generation, populations, variables);
        log.info("Bound program: {} init statements, {}, populations {}",
                init.size(),
                generation == null ? "single-shot" : generation.size() + " per generation",
                populations);
        return bound;
    }

    // ========== Statements ==========

    private List<BoundStatement> bindAll(List<Statement> statements) throws BindingException {
        List<BoundStatement> bound = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            bound.add(bindStatement(statement));
        }
        return bound;
    }

    private BoundStatement bindStatement(Statement statement) throws BindingException {
        if (statement instanceof FromStatement from) {
            return bindFrom(from);
        }
        if (statement instanceof YieldStatement yield) {
            requirePopulations(yield.names(), yield.location());
            return new BoundStatement.Yield(yield.names(), yield.location());
        }
        if (statement instanceof EvalStatement eval) {
            requirePopulations(eval.names(), eval.location());
            return new BoundStatement.Eval(eval.names(), eval.location());
        }
        if (statement instanceof AssignStatement assign) {
            return bindAssign(assign);
        }
        if (statement instanceof RepeatStatement repeat) {
            Expression count = resolve(repeat.count());
            return new BoundStatement.Repeat(count, bindAll(repeat.body()), repeat.location());
        }
        if (statement instanceof BlockStatement block) {
            throw new BindingException("Blocks cannot be nested ('" + block.name() + "')", block.location());
        }
        throw new IllegalArgumentException("Unsupported statement: " + statement.getClass().getSimpleName());
    }

    private BoundStatement bindFrom(FromStatement from) throws BindingException {
        List<BoundStatement.Source> sources = new ArrayList<>();
        Cardinality cardinality = null;

        for (OperatorCall call : from.sources()) {
            BoundStatement.Source source;
            Cardinality sourceCardinality;
            if (!call.parenthesized() && populations.contains(call.name())) {
                source = BoundStatement.Source.population(call.name());
                sourceCardinality = Cardinality.EXACT;
            } else {
                OperatorDescriptor descriptor = registry.lookup(call.name());
                if (descriptor == null) {
                    if (call.parenthesized()) {
                        throw new UnresolvedOperatorException(call.name(), call.location());
                    }
                    throw new UnresolvedVariableException(
                            "Unknown population or generator '" + call.name() + "'", call.name(), call.location());
                }
                if (!descriptor.isGenerator()) {
                    throw new BindingException("'" + call.name() + "' is not a generator and cannot appear after FROM",
                            call.location());
                }
                source = BoundStatement.Source.generator(bindOperator(call, descriptor));
                sourceCardinality = descriptor.cardinality();
            }
            sources.add(source);
            cardinality = cardinality == null ? sourceCardinality : cardinality.then(sourceCardinality);
        }

        List<BoundOperator> chain = new ArrayList<>();
        for (OperatorCall call : from.chain()) {
            OperatorDescriptor descriptor = registry.lookup(call.name());
            if (descriptor == null) {
                throw new UnresolvedOperatorException(call.name(), call.location());
            }
            if (descriptor.isGenerator()) {
                throw new BindingException("Generator '" + call.name() + "' cannot appear after USING",
                        call.location());
            }
            chain.add(bindOperator(call, descriptor));
            cardinality = cardinality.then(descriptor.cardinality());
        }

        List<BoundStatement.Target> targets = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Destination destination : from.destinations()) {
            if (!seen.add(destination.name())) {
                throw new BindingException("Population '" + destination.name() + "' selected twice",
                        destination.location());
            }
            if (variables.contains(destination.name())) {
                throw new BindingException("'" + destination.name() + "' is a variable, not a population",
                        destination.location());
            }
            Expression count = destination.count() == null ? null : resolve(destination.count());
            targets.add(new BoundStatement.Target(destination.name(), count, destination.location()));
        }
        // Declared only after the whole statement: FROM x SELECT x needs an earlier x
        seen.forEach(populations::add);

        return new BoundStatement.From(sources, targets, chain, cardinality, from.location());
    }

    private BoundStatement bindAssign(AssignStatement assign) throws BindingException {
        String name = assign.name();
        if (assign.value() instanceof NameRef ref
                && populations.contains(ref.name())
                && !variables.contains(ref.name())) {
            if (variables.contains(name)) {
                throw new BindingException("'" + name + "' is a variable and cannot alias a population",
                        assign.location());
            }
            populations.add(name);
            return new BoundStatement.Assign(name, null, ref.name(), assign.location());
        }
        if (populations.contains(name)) {
            throw new BindingException("'" + name + "' is a population and cannot hold a value", assign.location());
        }
        Expression value = resolve(assign.value());
        variables.add(name);
        return new BoundStatement.Assign(name, value, null, assign.location());
    }

    private void requirePopulations(List<String> names, SourceLocation location) throws BindingException {
        for (String name : names) {
            if (!populations.contains(name)) {
                throw new UnresolvedVariableException("Population '" + name + "' is not declared", name, location);
            }
        }
    }

    private static boolean containsYield(List<BoundStatement> statements) {
        for (BoundStatement statement : statements) {
            if (statement instanceof BoundStatement.Yield) {
                return true;
            }
            if (statement instanceof BoundStatement.Repeat repeat && containsYield(repeat.body())) {
                return true;
            }
        }
        return false;
    }

    // ========== Operators ==========

    private BoundOperator bindOperator(OperatorCall call, OperatorDescriptor descriptor) throws BindingException {
        Map<String, Expression> arguments = new LinkedHashMap<>();

        for (Argument argument : call.arguments()) {
            ParamSpec spec = descriptor.param(argument.name())
                    .orElseThrow(() -> new UnresolvedVariableException(
                            "Operator '" + descriptor.name() + "' has no parameter '" + argument.name() + "'",
                            argument.name(), argument.location()));
            arguments.put(spec.name(), coerce(spec, resolve(argument.value()), descriptor));
        }

        for (ParamSpec spec : descriptor.params()) {
            if (arguments.containsKey(spec.name())) {
                continue;
            }
            String key = "operators." + descriptor.name() + "." + spec.name();
            Optional<Object> configured = context.lookup(key);
            Object value = configured.isPresent() ? configured.get() : spec.defaultValue();
            arguments.put(spec.name(), coerce(spec, new Literal(value, call.location()), descriptor));
        }

        return new BoundOperator(descriptor, arguments, call.location());
    }

    private static Expression coerce(ParamSpec spec, Expression value, OperatorDescriptor descriptor)
            throws BindingException {
        if (!(value instanceof Literal literal)) {
            return value;
        }
        try {
            return new Literal(spec.type().coerce(literal.value()), literal.location());
        } catch (IllegalArgumentException e) {
            throw new BindingException("Parameter '" + spec.name() + "' of '" + descriptor.name() + "': "
                    + e.getMessage(), literal.location(), e);
        }
    }

    // ========== Expressions ==========

    /**
     * Substitute configuration references and fold the expression if nothing run-time remains.
     */
    Expression resolve(Expression expression) throws BindingException {
        Expression substituted = substitute(expression);
        if (substituted instanceof Literal || !isConstant(substituted)) {
            return substituted;
        }
        try {
            Object value = ExpressionEvaluator.evaluate(substituted, VariableScope.EMPTY);
            return new Literal(value, expression.location());
        } catch (EvaluationException e) {
            throw new BindingException(e.getDetail(), e.getLocation(), e);
        }
    }

    private Expression substitute(Expression expression) throws BindingException {
        if (expression instanceof NameRef ref) {
            if (variables.contains(ref.name())) {
                return ref;
            }
            if (populations.contains(ref.name())) {
                throw new BindingException("Population '" + ref.name() + "' cannot be used as a value",
                        ref.location());
            }
            Optional<Object> value = context.lookup(ref.name());
            if (value.isEmpty()) {
                throw new UnresolvedVariableException("Unknown variable '" + ref.name() + "'", ref.name(),
                        ref.location());
            }
            return new Literal(value.get(), ref.location());
        }
        if (expression instanceof UnaryExpression unary) {
            return new UnaryExpression(unary.operator(), substitute(unary.operand()), unary.location());
        }
        if (expression instanceof BinaryExpression binary) {
            return new BinaryExpression(binary.operator(), substitute(binary.left()), substitute(binary.right()),
                    binary.location());
        }
        return expression;
    }

    private static boolean isConstant(Expression expression) {
        if (expression instanceof NameRef) {
            return false;
        }
        if (expression instanceof UnaryExpression unary) {
            return isConstant(unary.operand());
        }
        if (expression instanceof BinaryExpression binary) {
            return isConstant(binary.left()) && isConstant(binary.right());
        }
        return true;
    }
}

package io.github.manjago.esdl.run;

import io.github.manjago.esdl.bind.BoundOperator;
import io.github.manjago.esdl.bind.BoundProgram;
import io.github.manjago.esdl.bind.BoundStatement;
import io.github.manjago.esdl.config.ExperimentConfig;
import io.github.manjago.esdl.core.Individual;
import io.github.manjago.esdl.core.Population;
import io.github.manjago.esdl.core.RandomStreams;
import io.github.manjago.esdl.landscape.Landscape;
import io.github.manjago.esdl.lang.EsdlException;
import io.github.manjago.esdl.lang.EvaluationException;
import io.github.manjago.esdl.lang.ExpressionEvaluator;
import io.github.manjago.esdl.lang.SourceLocation;
import io.github.manjago.esdl.lang.VariableScope;
import io.github.manjago.esdl.lang.ast.Expression;
import io.github.manjago.esdl.ops.Cardinality;
import io.github.manjago.esdl.ops.OperatorArgs;
import io.github.manjago.esdl.ops.OperatorContext;
import io.github.manjago.esdl.ops.ParamSpec;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes a bound program generation by generation.
 *
 * <h2>Lifecycle:</h2>
 * <pre>
 * CREATED -> INITIALIZING -> RUNNING_GENERATION (repeated) -> TERMINATED
 * </pre>
 * Initialization runs every statement outside a block once. Each generation then runs
 * the generation block once, in source order, and advances the generation counter.
 * A program without a generation block terminates right after initialization.
 * <p>
 * Single-threaded: statements, operators and listener callbacks all run on the caller's
 * thread. {@link #stop()} may be called from any thread and takes effect at the next
 * generation boundary; an operator that is already running always completes.
 * <p>
 * Any failure ends the run. A half-executed generation is not rolled back; rerunning
 * with the same seeds reproduces it.
 */
public class PipelineInterpreter {

    private static final Logger log = LoggerFactory.getLogger(PipelineInterpreter.class);

    private final BoundProgram program;
    private final ExperimentConfig config;
    private final OperatorContext context;

    // Named populations; aliases map several names to one instance
    private final Map<String, Population> populations = new LinkedHashMap<>();

    // Run variables assigned by "name = expression"
    private final Map<String, Object> variables = new LinkedHashMap<>();
    private final VariableScope scope = name -> Optional.ofNullable(variables.get(name));

    // Arguments of operators without run-variable references, evaluated once
    private final Map<BoundOperator, OperatorArgs> constantArgs = new IdentityHashMap<>();

    // Progress
    private volatile RunState state = RunState.CREATED;
    private long generation = 0;
    private double bestFitness = Double.NaN;
    private long lastImprovement = 0;
    private long startTime;

    // Control
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    // Event listeners
    private final List<PipelineListener> listeners = new CopyOnWriteArrayList<>();

    public PipelineInterpreter(BoundProgram program, ExperimentConfig config, RandomStreams streams,
                               @Nullable Landscape landscape) {
        this.program = program;
        this.config = config;
        this.context = new OperatorContext(streams, landscape);

        log.info("Interpreter created (breeding seed: {}, landscape seed: {}, landscape: {})",
                streams.breedingSeed(), streams.landscapeSeed(),
                landscape == null ? "none" : landscape.getName());
    }

    /**
     * Add an event listener.
     */
    public void addListener(PipelineListener listener) {
        listeners.add(listener != null ? listener : PipelineListener.NOOP);
    }

    /**
     * Supply a population before the run starts (it must have been declared to the binder).
     */
    public void putPopulation(String name, Population population) {
        if (state != RunState.CREATED) {
            throw new IllegalStateException("Populations can only be supplied before the run starts");
        }
        populations.put(name, population);
    }

    /**
     * Run until a termination condition holds.
     * <p>
     * The generation counter advances after each complete pass of the generation block.
     * A block without YIELD still advances it, so the generation limit bounds such a run;
     * the binder warns about the missing YIELD.
     *
     * @return final statistics
     * @throws EsdlException the first failure, with the location of the failing statement
     */
    public RunStats run() throws EsdlException {
        if (running.getAndSet(true)) {
            throw new IllegalStateException("Interpreter already running");
        }
        if (state != RunState.CREATED) {
            running.set(false);
            throw new IllegalStateException("Interpreter can only run once");
        }

        startTime = System.currentTimeMillis();
        TerminationReason reason;
        try {
            state = RunState.INITIALIZING;
            log.info("Initializing ({} statements)", program.init().size());
            execute(program.init());
            RunStats initStats = getStats();
            listeners.forEach(l -> l.onInitialized(initStats));

            if (program.isSingleShot()) {
                reason = TerminationReason.SINGLE_SHOT;
            } else {
                log.info("Starting generations{}", config.maxGenerations() == 0
                        ? " (unbounded)" : String.format(" (limit %,d)", config.maxGenerations()));
                while ((reason = checkTermination()) == null) {
                    state = RunState.RUNNING_GENERATION;
                    execute(program.generation());
                    generation++;

                    RunStats stats = getStats();
                    listeners.forEach(l -> l.onGeneration(stats));
                    if (config.reportInterval() > 0 && generation % config.reportInterval() == 0) {
                        reportProgress();
                    }
                }
            }
        } finally {
            state = RunState.TERMINATED;
            running.set(false);
        }

        RunStats stats = getStats();
        TerminationReason finalReason = reason;
        listeners.forEach(l -> l.onTerminated(finalReason, stats));
        log.info("Run terminated: {} after {} generations ({} ms, best fitness {})",
                reason, generation, stats.elapsedMillis(), stats.hasBestFitness() ? bestFitness : "n/a");
        return stats;
    }

    /**
     * Request a stop at the next generation boundary.
     */
    public void stop() {
        log.info("Stop requested");
        stopRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    private @Nullable TerminationReason checkTermination() {
        if (stopRequested.get()) {
            return TerminationReason.CANCELLED;
        }
        if (config.maxGenerations() > 0 && generation >= config.maxGenerations()) {
            return TerminationReason.GENERATION_LIMIT;
        }
        if (config.hasFitnessTarget() && !Double.isNaN(bestFitness) && bestFitness >= config.fitnessTarget()) {
            return TerminationReason.FITNESS_TARGET;
        }
        if (config.stableGenerations() > 0 && generation - lastImprovement >= config.stableGenerations()) {
            return TerminationReason.STABLE;
        }
        return null;
    }

    private void reportProgress() {
        log.info("Generation {}: best fitness {}, births {}, evaluations {}",
                generation, Double.isNaN(bestFitness) ? "n/a" : bestFitness,
                context.getBirths(), context.getEvaluations());
    }

    // ========== Statements ==========

    private void execute(List<BoundStatement> statements) throws EsdlException {
        for (BoundStatement statement : statements) {
            log.debug("Generation {}: {}", generation, statement);
            if (statement instanceof BoundStatement.From from) {
                executeFrom(from);
            } else if (statement instanceof BoundStatement.Yield yield) {
                executeYield(yield);
            } else if (statement instanceof BoundStatement.Eval eval) {
                executeEval(eval);
            } else if (statement instanceof BoundStatement.Assign assign) {
                executeAssign(assign);
            } else if (statement instanceof BoundStatement.Repeat repeat) {
                long times = ExpressionEvaluator.evaluateLong(repeat.count(), scope);
                if (times < 0) {
                    throw new EvaluationException("REPEAT count must not be negative: " + times, repeat.location());
                }
                for (long i = 0; i < times; i++) {
                    execute(repeat.body());
                }
            } else {
                throw new IllegalStateException("Unsupported statement: " + statement);
            }
        }
    }

    private void executeFrom(BoundStatement.From from) throws EsdlException {
        Map<String, Population> filled = new LinkedHashMap<>();
        try {
            Iterator<Individual> stream = openSources(from);
            for (BoundOperator operator : from.chain()) {
                stream = operator.descriptor().filter().apply(stream, argsFor(operator), context);
            }

            for (BoundStatement.Target target : from.destinations()) {
                Population destination = new Population(target.name());
                if (target.isSized()) {
                    long count = evaluateCount(target);
                    for (long i = 0; i < count; i++) {
                        if (!stream.hasNext()) {
                            throw new PopulationSizeException(String.format(
                                    "Expected %d individuals for '%s' but the stream ended after %d",
                                    count, target.name(), i), target.name(), count, i, target.location());
                        }
                        destination.add(stream.next());
                    }
                } else {
                    if (from.cardinality() == Cardinality.UNBOUNDED) {
                        throw new PopulationSizeException("Unbounded stream into '" + target.name()
                                + "' needs a count", target.name(), -1, 0, target.location());
                    }
                    while (stream.hasNext()) {
                        destination.add(stream.next());
                    }
                }
                filled.put(target.name(), destination);
            }

            BoundStatement.Target last = from.destinations().get(from.destinations().size() - 1);
            if (last.isSized() && !from.cardinality().isTruncatable() && stream.hasNext()) {
                throw new PopulationSizeException(String.format(
                        "Stream produced more than the %d individuals selected into '%s'",
                        filled.get(last.name()).size(), last.name()),
                        last.name(), filled.get(last.name()).size(), filled.get(last.name()).size() + 1,
                        from.location());
            }
        } catch (RuntimeException e) {
            filled.values().forEach(Population::release);
            throw new OperatorExecutionException("Operator failed: " + describe(e), from.location(), e);
        } catch (EsdlException e) {
            filled.values().forEach(Population::release);
            throw e;
        }

        for (Population destination : filled.values()) {
            replace(destination.getName(), destination);
        }
    }

    private Iterator<Individual> openSources(BoundStatement.From from) throws EsdlException {
        List<Iterator<Individual>> parts = new ArrayList<>();
        for (BoundStatement.Source source : from.sources()) {
            if (source.isPopulation()) {
                Population population = requirePopulation(source.population(), from.location());
                // Copy of the member list: destinations may replace the source afterwards
                parts.add(new ArrayList<>(population.members()).iterator());
            } else {
                BoundOperator generator = source.generator();
                parts.add(generator.descriptor().generator().generate(argsFor(generator), context));
            }
        }
        return parts.size() == 1 ? parts.get(0) : concat(parts);
    }

    private void executeYield(BoundStatement.Yield yield) throws EsdlException {
        for (String name : yield.names()) {
            Population population = requirePopulation(name, yield.location());
            if (context.getLandscape() != null) {
                try {
                    population.forEach(context::fitness);
                } catch (RuntimeException e) {
                    throw new OperatorExecutionException("Fitness evaluation failed: " + describe(e),
                            yield.location(), e);
                }
            }
            OptionalDouble best = population.bestFitness();
            if (best.isPresent() && (Double.isNaN(bestFitness) || best.getAsDouble() > bestFitness)) {
                bestFitness = best.getAsDouble();
                lastImprovement = generation;
            }
            listeners.forEach(l -> l.onYield(name, population, generation));
        }
    }

    private void executeEval(BoundStatement.Eval eval) throws EsdlException {
        for (String name : eval.names()) {
            Population population = requirePopulation(name, eval.location());
            try {
                for (Individual individual : population) {
                    individual.invalidateFitness();
                    context.evaluate(individual);
                }
            } catch (RuntimeException e) {
                throw new OperatorExecutionException("Fitness evaluation failed: " + describe(e),
                        eval.location(), e);
            }
        }
    }

    private void executeAssign(BoundStatement.Assign assign) throws EsdlException {
        if (assign.isAlias()) {
            replace(assign.name(), requirePopulation(assign.aliasOf(), assign.location()));
        } else {
            variables.put(assign.name(), ExpressionEvaluator.evaluate(assign.value(), scope));
        }
    }

    /**
     * Bind a name to a population and release the previous one if no other name refers to it.
     */
    private void replace(String name, Population population) {
        Population previous = populations.put(name, population);
        if (previous != null && previous != population && !populations.containsValue(previous)) {
            previous.release();
        }
    }

    private Population requirePopulation(String name, SourceLocation location) throws EvaluationException {
        Population population = populations.get(name);
        if (population == null) {
            // Declared by the binder but never filled, e.g. selected only inside a block not yet run
            throw new EvaluationException("Population '" + name + "' has not been created yet", location);
        }
        return population;
    }

    // ========== Arguments ==========

    private OperatorArgs argsFor(BoundOperator operator) throws EsdlException {
        OperatorArgs cached = constantArgs.get(operator);
        if (cached != null) {
            return cached;
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Expression> entry : operator.arguments().entrySet()) {
            Object value = ExpressionEvaluator.evaluate(entry.getValue(), scope);
            ParamSpec spec = operator.descriptor().param(entry.getKey()).orElseThrow();
            try {
                values.put(entry.getKey(), spec.type().coerce(value));
            } catch (IllegalArgumentException e) {
                throw new OperatorExecutionException("Argument '" + entry.getKey() + "' of '" + operator.name()
                        + "': " + e.getMessage(), entry.getValue().location(), e);
            }
        }
        OperatorArgs args = new OperatorArgs(values);
        if (operator.isConstant()) {
            constantArgs.put(operator, args);
        }
        return args;
    }

    private long evaluateCount(BoundStatement.Target target) throws EsdlException {
        long count = ExpressionEvaluator.evaluateLong(target.count(), scope);
        if (count < 0) {
            throw new PopulationSizeException("Negative count " + count + " for '" + target.name() + "'",
                    target.name(), count, 0, target.location());
        }
        return count;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static Iterator<Individual> concat(List<Iterator<Individual>> parts) {
        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                while (index < parts.size()) {
                    if (parts.get(index).hasNext()) {
                        return true;
                    }
                    index++;
                }
                return false;
            }

            @Override
            public Individual next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return parts.get(index).next();
            }
        };
    }

    // ========== Getters ==========

    public RunState getState() {
        return state;
    }

    public long getGeneration() {
        return generation;
    }

    public @Nullable Population getPopulation(String name) {
        return populations.get(name);
    }

    public Map<String, Population> getPopulations() {
        return Collections.unmodifiableMap(populations);
    }

    public @Nullable Object getVariable(String name) {
        return variables.get(name);
    }

    public OperatorContext getContext() {
        return context;
    }

    public RunStats getStats() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        populations.forEach((name, population) -> sizes.put(name, population.size()));
        return new RunStats(
            generation,
            context.getBirths(),
            context.getEvaluations(),
            bestFitness,
            lastImprovement,
            sizes,
            startTime == 0 ? 0 : System.currentTimeMillis() - startTime
        );
    }
}

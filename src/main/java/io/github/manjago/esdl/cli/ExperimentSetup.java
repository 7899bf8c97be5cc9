package io.github.manjago.esdl.cli;

import io.github.manjago.esdl.bind.BindingResolver;
import io.github.manjago.esdl.bind.BoundProgram;
import io.github.manjago.esdl.config.ConfigContext;
import io.github.manjago.esdl.lang.EsdlException;
import io.github.manjago.esdl.lang.EvaluationException;
import io.github.manjago.esdl.lang.ExpressionEvaluator;
import io.github.manjago.esdl.lang.Parser;
import io.github.manjago.esdl.lang.ast.Expression;
import io.github.manjago.esdl.lang.ast.NameRef;
import io.github.manjago.esdl.lang.ast.Program;
import io.github.manjago.esdl.ops.OperatorRegistry;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Steps shared by the commands that load a pipeline: configuration layering,
 * {@code --set} overrides and binding.
 */
final class ExperimentSetup {

    private static final Logger log = LoggerFactory.getLogger(ExperimentSetup.class);

    private ExperimentSetup() {
    }

    /**
     * Compose the configuration context: settings over the experiment file over the defaults.
     *
     * @param configFile experiment file, or null for defaults only
     * @param settings {@code key=expression} strings, applied in order
     */
    static ConfigContext context(@Nullable Path configFile, List<String> settings)
            throws EsdlException {
        ConfigContext.Builder builder = ConfigContext.builder();
        if (configFile != null) {
            builder.namedFile(configFile);
        }
        ConfigContext base = builder.build();
        return base.withOverrides(evaluateSettings(settings, base));
    }

    /**
     * Evaluate {@code key=expression} settings with the restricted evaluator.
     * <p>
     * Names in an expression refer to the context and to settings given earlier.
     * A bare name that refers to nothing is taken as a string, so
     * {@code esdl.landscape=sphere} needs no quotes.
     */
    static Map<String, Object> evaluateSettings(List<String> settings, ConfigContext base) throws EsdlException {
        Map<String, Object> values = new LinkedHashMap<>();
        Parser parser = new Parser();
        for (String setting : settings) {
            int eq = setting.indexOf('=');
            if (eq <= 0) {
                throw new EvaluationException("Setting must look like key=expression: '" + setting + "'", null);
            }
            String key = setting.substring(0, eq).trim();
            Expression expression = parser.parseExpression(setting.substring(eq + 1));

            Object value;
            if (expression instanceof NameRef ref && !values.containsKey(ref.name()) && !base.contains(ref.name())) {
                value = ref.name();
            } else {
                value = ExpressionEvaluator.evaluate(expression, name -> values.containsKey(name)
                        ? Optional.of(values.get(name))
                        : base.lookup(name));
            }
            log.debug("Setting {} = {}", key, value);
            values.put(key, value);
        }
        return values;
    }

    static BoundProgram bind(Program program, ConfigContext context) throws EsdlException {
        return new BindingResolver(OperatorRegistry.withBuiltins(), context).bind(program);
    }

    /**
     * One-line description of a failure for the console.
     */
    static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

package io.github.manjago.esdl.landscape;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.esdl.grammar.ExpansionOptions;
import io.github.manjago.esdl.grammar.Grammar;
import io.github.manjago.esdl.grammar.GrammarExpander;
import io.github.manjago.esdl.grammar.GrammarException;
import io.github.manjago.esdl.lang.EsdlException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Builds the shipped landscapes by name from the {@code landscapes.<name>} configuration section.
 */
public final class Landscapes {

    private static final Logger log = LoggerFactory.getLogger(Landscapes.class);

    /** Landscape name meaning "no evaluator". */
    public static final String NONE = "none";

    public static final List<String> NAMES = List.of(OneMax.NAME, Sphere.NAME, SymbolicRegression.NAME);

    private Landscapes() {
    }

    /**
     * Create a landscape.
     *
     * @param name landscape name, or {@value #NONE}
     * @param config full configuration (reads {@code landscapes.<name>})
     * @param expansion options used when the landscape maps GE genomes
     * @return the landscape, or null for {@value #NONE}
     * @throws GrammarException if the regression grammar is invalid
     * @throws EsdlException if the regression target does not parse or evaluate
     */
    public static @Nullable Landscape create(String name, Config config, ExpansionOptions expansion)
            throws GrammarException, EsdlException {
        String key = name.toLowerCase(Locale.ROOT);
        if (key.equals(NONE)) {
            return null;
        }
        Config section = config.hasPath("landscapes." + key)
                ? config.getConfig("landscapes." + key)
                : ConfigFactory.empty();

        Landscape landscape = switch (key) {
            case OneMax.NAME -> new OneMax();
            case Sphere.NAME -> new Sphere(
                    section.hasPath("center") ? section.getDouble("center") : 0.0,
                    section.hasPath("noise") ? section.getDouble("noise") : 0.0);
            case SymbolicRegression.NAME -> {
                Grammar grammar = Grammar.fromConfig(section.getConfig("grammar"));
                yield new SymbolicRegression(
                        new GrammarExpander(grammar, expansion),
                        section.getString("target"),
                        section.getDouble("lowest"),
                        section.getDouble("highest"),
                        section.getInt("samples"));
            }
            default -> throw new IllegalArgumentException(
                    "Unknown landscape '" + name + "', expected one of " + NAMES + " or " + NONE);
        };
        log.info("Landscape: {} ({} genomes)", landscape.getName(), landscape.getKind().getShortName());
        return landscape;
    }
}

package io.github.manjago.esdl.grammar;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, validated production grammar for Grammatical Evolution.
 *
 * <h2>Definition format:</h2>
 * A mapping from rule name to an ordered list of production strings. A production
 * string is a space-delimited sequence of double-quoted literals and bare rule names.
 * The start rule is {@code *}.
 * <pre>
 * {
 *   "*"  : [ "\"A\" X" ],
 *   "X"  : [ "\"1\"", "\"2\"", "\"3\"" ]
 * }
 * </pre>
 * The rules {@code TERMINAL}, {@code INDENT}, {@code INC_INDENT}, {@code DEC_INDENT}
 * and {@code NEWLINE} are always available (see {@link BuiltinRule}).
 */
public final class Grammar {

    private static final Logger log = LoggerFactory.getLogger(Grammar.class);

    /** Name of the start rule. */
    public static final String START = "*";

    private final Map<String, List<Production>> rules;

    private Grammar(Map<String, List<Production>> rules) {
        this.rules = rules;
    }

    /**
     * Build and validate a grammar.
     *
     * @param definition rule name to production strings, in declaration order
     * @throws GrammarDefinitionException listing every problem found
     */
    public static Grammar of(Map<String, List<String>> definition) throws GrammarDefinitionException {
        List<String> violations = new ArrayList<>();
        Map<String, List<Production>> rules = new LinkedHashMap<>();

        if (!definition.containsKey(START)) {
            violations.add("Missing start rule '" + START + "'");
        }

        for (Map.Entry<String, List<String>> entry : definition.entrySet()) {
            String name = entry.getKey();
            checkRuleName(name, violations);

            List<String> alternatives = entry.getValue() != null ? entry.getValue() : List.of();
            if (alternatives.isEmpty()) {
                violations.add("Rule '" + name + "' has no productions");
            }

            List<Production> productions = new ArrayList<>(alternatives.size());
            for (int i = 0; i < alternatives.size(); i++) {
                productions.add(parseProduction(name, i, alternatives.get(i), violations));
            }
            rules.put(name, List.copyOf(productions));
        }

        // Dangling references, checked after all rules are known
        for (Map.Entry<String, List<Production>> entry : rules.entrySet()) {
            List<Production> productions = entry.getValue();
            for (int i = 0; i < productions.size(); i++) {
                for (Symbol symbol : productions.get(i).symbols()) {
                    if (symbol.isRule()
                            && !rules.containsKey(symbol.value())
                            && !BuiltinRule.isBuiltin(symbol.value())) {
                        violations.add("Rule '" + entry.getKey() + "' production " + i
                                + " references undefined rule '" + symbol.value() + "'");
                    }
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new GrammarDefinitionException(violations);
        }

        log.debug("Grammar with {} rules validated", rules.size());
        return new Grammar(Collections.unmodifiableMap(rules));
    }

    /**
     * Build a grammar from a HOCON object whose keys are rule names and whose values are
     * lists of production strings (a single string is accepted as a one-element list).
     */
    public static Grammar fromConfig(Config config) throws GrammarDefinitionException {
        Map<String, List<String>> definition = new LinkedHashMap<>();
        List<String> violations = new ArrayList<>();
        ConfigObject root = config.root();

        for (String key : root.keySet()) {
            ConfigValue value = root.get(key);
            List<String> productions = new ArrayList<>();
            if (value.valueType() == ConfigValueType.STRING) {
                productions.add((String) value.unwrapped());
            } else if (value.valueType() == ConfigValueType.LIST) {
                for (Object item : (List<?>) value.unwrapped()) {
                    if (item instanceof String s) {
                        productions.add(s);
                    } else {
                        violations.add("Rule '" + key + "' has a non-string production: " + item);
                    }
                }
            } else {
                violations.add("Rule '" + key + "' must be a list of production strings");
            }
            definition.put(key, productions);
        }

        if (!violations.isEmpty()) {
            // Report structural problems together with whatever validation finds
            try {
                of(definition);
            } catch (GrammarDefinitionException e) {
                violations.addAll(e.getViolations());
            }
            throw new GrammarDefinitionException(violations);
        }
        return of(definition);
    }

    private static void checkRuleName(String name, List<String> violations) {
        if (name == null || name.isEmpty()) {
            violations.add("Empty rule name");
            return;
        }
        for (char c : name.toCharArray()) {
            if (Character.isWhitespace(c) || c == '"' || c == '\'') {
                violations.add("Rule name '" + name + "' contains whitespace or quote characters");
                break;
            }
        }
        if (BuiltinRule.isBuiltin(name)) {
            violations.add("Rule '" + name + "' redefines a built-in rule");
        }
    }

    /**
     * Split a production string into literals and rule references.
     */
    private static Production parseProduction(String rule, int index, String text, List<String> violations) {
        List<Symbol> symbols = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        boolean literal = false;

        for (char c : (text != null ? text : "").toCharArray()) {
            if (literal) {
                if (c == '"') {
                    symbols.add(Symbol.literal(word.toString()));
                    word.setLength(0);
                    literal = false;
                } else {
                    word.append(c);
                }
            } else if (c == '"') {
                if (!word.isEmpty()) {
                    symbols.add(Symbol.rule(word.toString()));
                    word.setLength(0);
                }
                literal = true;
            } else if (Character.isWhitespace(c)) {
                if (!word.isEmpty()) {
                    symbols.add(Symbol.rule(word.toString()));
                    word.setLength(0);
                }
            } else {
                word.append(c);
            }
        }

        if (literal) {
            violations.add("Rule '" + rule + "' production " + index + " has an unterminated literal");
        } else if (!word.isEmpty()) {
            symbols.add(Symbol.rule(word.toString()));
        }
        return new Production(symbols);
    }

    // ========== Queries ==========

    public List<Production> productions(String rule) {
        List<Production> productions = rules.get(rule);
        if (productions == null) {
            throw new IllegalArgumentException("Unknown rule: " + rule);
        }
        return productions;
    }

    public boolean hasRule(String name) {
        return rules.containsKey(name);
    }

    public Set<String> ruleNames() {
        return rules.keySet();
    }

    /**
     * BNF-like listing, one rule per paragraph.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<Production>> entry : rules.entrySet()) {
            sb.append(entry.getKey()).append('\n');
            List<Production> productions = entry.getValue();
            for (int i = 0; i < productions.size(); i++) {
                sb.append(i == 0 ? "    : " : "    | ").append(productions.get(i)).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}

package io.github.manjago.esdl.lang;

import io.github.manjago.esdl.lang.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parser for pipeline definitions.
 *
 * Single forward pass with one token of lookahead; statements are selected by
 * their leading keyword, so no backtracking is needed.
 *
 * <h2>Syntax:</h2>
 * <pre>
 * FROM source, ... SELECT [count] dest, ... [USING op(key=value, ...), ...]
 * YIELD name, ...
 * EVAL name, ...
 * name = expression
 * REPEAT count
 *     statements
 * END [REPEAT]
 * BEGIN name
 *     statements
 * END [name]
 * </pre>
 * Statements end at a newline or semicolon. A count is an integer literal or a
 * parenthesised expression, e.g. {@code SELECT (size) population}.
 *
 * <h2>Example:</h2>
 * <pre>
 * FROM random_int(length=8, lowest=0, highest=9) SELECT (size) population
 * YIELD population
 *
 * BEGIN generation
 *     FROM population SELECT (size) offspring USING tournament(k=3), crossover_one, mutate_random
 *     FROM offspring SELECT population
 *     YIELD population
 * END generation
 * </pre>
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private List<Token> tokens;
    private int current;

    /**
     * Parse source text.
     *
     * @param source pipeline definition
     * @return the syntax tree
     * @throws SyntaxException at the first malformed construct
     */
    public Program parse(String source) throws SyntaxException {
        this.tokens = new Lexer(source).scanTokens();
        this.current = 0;

        List<Statement> statements = new ArrayList<>();
        Set<String> blockNames = new HashSet<>();

        skipTerminators();
        while (!check(TokenType.END_OF_FILE)) {
            Statement statement;
            if (check(TokenType.BEGIN)) {
                BlockStatement block = block();
                if (!blockNames.add(block.name())) {
                    throw new SyntaxException("Duplicate block '" + block.name() + "'", block.location(), block.name());
                }
                statement = block;
            } else {
                statement = statement();
            }
            statements.add(statement);
            skipTerminators();
        }

        Program program = new Program(statements);
        log.debug("Parsed {} top-level statements, {} blocks", statements.size(), program.blocks().size());
        return program;
    }

    /**
     * Parse a UTF-8 source file.
     */
    public Program parseFile(Path path) throws SyntaxException, IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Parse a single standalone expression (used for settings overrides).
     */
    public Expression parseExpression(String source) throws SyntaxException {
        this.tokens = new Lexer(source).scanTokens();
        this.current = 0;
        skipTerminators();
        Expression expression = expression();
        skipTerminators();
        if (!check(TokenType.END_OF_FILE)) {
            throw new SyntaxException("Unexpected input after expression", peek());
        }
        return expression;
    }

    // ========== Statements ==========

    private BlockStatement block() throws SyntaxException {
        Token begin = advance();
        Token nameToken = consume(TokenType.IDENTIFIER, "Block name expected after BEGIN");
        String name = nameToken.text().toLowerCase(Locale.ROOT);
        requireTerminator();

        List<Statement> body = new ArrayList<>();
        skipTerminators();
        while (!check(TokenType.END)) {
            if (check(TokenType.END_OF_FILE)) {
                throw new SyntaxException("Missing END for block '" + name + "'", peek());
            }
            if (check(TokenType.BEGIN)) {
                throw new SyntaxException("Blocks cannot be nested", peek());
            }
            body.add(statement());
            skipTerminators();
        }
        advance(); // END
        if (check(TokenType.IDENTIFIER)) {
            Token endName = advance();
            if (!endName.text().equalsIgnoreCase(name)) {
                throw new SyntaxException("END name does not match BEGIN " + name, endName);
            }
        }
        requireTerminator();
        return new BlockStatement(name, body, begin.location());
    }

    private Statement statement() throws SyntaxException {
        Token token = peek();
        Statement statement = switch (token.type()) {
            case FROM -> fromStatement();
            case YIELD -> new YieldStatement(nameList(advance()), token.location());
            case EVAL -> new EvalStatement(nameList(advance()), token.location());
            case REPEAT -> repeatStatement();
            case IDENTIFIER -> assignment();
            case END -> throw new SyntaxException("END without a matching BEGIN or REPEAT", token);
            case SELECT, USING -> throw new SyntaxException(token.text().toUpperCase(Locale.ROOT)
                    + " cannot be specified here", token);
            default -> throw new SyntaxException("Expected a statement", token);
        };
        if (!(statement instanceof RepeatStatement)) {
            requireTerminator();
        }
        return statement;
    }

    private FromStatement fromStatement() throws SyntaxException {
        Token from = advance();

        List<OperatorCall> sources = new ArrayList<>();
        do {
            sources.add(operatorCall("Expected source population or generator after FROM"));
        } while (match(TokenType.COMMA));

        consume(TokenType.SELECT, "Expected SELECT");

        List<Destination> destinations = new ArrayList<>();
        do {
            destinations.add(destination());
        } while (match(TokenType.COMMA));
        for (int i = 0; i < destinations.size() - 1; i++) {
            Destination d = destinations.get(i);
            if (!d.isSized()) {
                throw new SyntaxException("Only the last destination may omit its size",
                        d.location(), d.name());
            }
        }

        List<OperatorCall> chain = new ArrayList<>();
        if (match(TokenType.USING)) {
            do {
                chain.add(operatorCall("Expected operator after USING"));
            } while (match(TokenType.COMMA));
        }

        return new FromStatement(sources, destinations, chain, from.location());
    }

    private Destination destination() throws SyntaxException {
        Token start = peek();
        Expression count = null;
        if (check(TokenType.NUMBER)) {
            Token number = advance();
            if (!(number.literal() instanceof Long)) {
                throw new SyntaxException("Size must be an integer", number);
            }
            count = new Literal(number.literal(), number.location());
        } else if (match(TokenType.LEFT_PAREN)) {
            count = expression();
            consume(TokenType.RIGHT_PAREN, "Matching ')' not found");
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected destination name");
        return new Destination(name.text(), count, start.location());
    }

    private OperatorCall operatorCall(String message) throws SyntaxException {
        // "repeat" is also the name of a selector
        Token name = check(TokenType.REPEAT) ? advance() : consume(TokenType.IDENTIFIER, message);
        if (!match(TokenType.LEFT_PAREN)) {
            return new OperatorCall(name.text(), List.of(), false, name.location());
        }

        List<Argument> arguments = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                Token key = consume(TokenType.IDENTIFIER, "Expected parameter=value pair");
                consume(TokenType.ASSIGN, "Expected parameter=value pair");
                if (!seen.add(key.text())) {
                    throw new SyntaxException("Parameter '" + key.text() + "' given twice", key);
                }
                arguments.add(new Argument(key.text(), expression(), key.location()));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Matching ')' not found");
        return new OperatorCall(name.text(), arguments, true, name.location());
    }

    private List<String> nameList(Token keyword) throws SyntaxException {
        List<String> names = new ArrayList<>();
        do {
            names.add(consume(TokenType.IDENTIFIER, "Expected population name after " + keyword.text()).text());
        } while (match(TokenType.COMMA));
        return names;
    }

    private AssignStatement assignment() throws SyntaxException {
        Token name = advance();
        if (!check(TokenType.ASSIGN)) {
            throw new SyntaxException("Expected a statement", name);
        }
        advance();
        return new AssignStatement(name.text(), expression(), name.location());
    }

    private RepeatStatement repeatStatement() throws SyntaxException {
        Token repeat = advance();
        Expression count = expression();
        requireTerminator();

        List<Statement> body = new ArrayList<>();
        skipTerminators();
        while (!check(TokenType.END)) {
            if (check(TokenType.END_OF_FILE)) {
                throw new SyntaxException("Missing END for REPEAT", peek());
            }
            if (check(TokenType.BEGIN)) {
                throw new SyntaxException("Blocks cannot be nested", peek());
            }
            body.add(statement());
            skipTerminators();
        }
        advance(); // END
        if (check(TokenType.IDENTIFIER)) {
            throw new SyntaxException("END name does not match REPEAT", peek());
        }
        match(TokenType.REPEAT);
        requireTerminator();
        return new RepeatStatement(count, body, repeat.location());
    }

    // ========== Expressions ==========

    private Expression expression() throws SyntaxException {
        return or();
    }

    private Expression or() throws SyntaxException {
        Expression left = and();
        while (check(TokenType.OR)) {
            Token op = advance();
            left = new BinaryExpression(BinaryExpression.Operator.OR, left, and(), op.location());
        }
        return left;
    }

    private Expression and() throws SyntaxException {
        Expression left = not();
        while (check(TokenType.AND)) {
            Token op = advance();
            left = new BinaryExpression(BinaryExpression.Operator.AND, left, not(), op.location());
        }
        return left;
    }

    private Expression not() throws SyntaxException {
        if (check(TokenType.NOT)) {
            Token op = advance();
            return new UnaryExpression(UnaryExpression.Operator.NOT, not(), op.location());
        }
        return comparison();
    }

    private Expression comparison() throws SyntaxException {
        Expression left = additive();
        while (true) {
            BinaryExpression.Operator operator = switch (peek().type()) {
                case EQUAL_EQUAL -> BinaryExpression.Operator.EQUAL;
                case BANG_EQUAL -> BinaryExpression.Operator.NOT_EQUAL;
                case LESS -> BinaryExpression.Operator.LESS;
                case LESS_EQUAL -> BinaryExpression.Operator.LESS_EQUAL;
                case GREATER -> BinaryExpression.Operator.GREATER;
                case GREATER_EQUAL -> BinaryExpression.Operator.GREATER_EQUAL;
                default -> null;
            };
            if (operator == null) {
                return left;
            }
            Token op = advance();
            left = new BinaryExpression(operator, left, additive(), op.location());
        }
    }

    private Expression additive() throws SyntaxException {
        Expression left = multiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token op = advance();
            BinaryExpression.Operator operator = op.type() == TokenType.PLUS
                    ? BinaryExpression.Operator.ADD
                    : BinaryExpression.Operator.SUBTRACT;
            left = new BinaryExpression(operator, left, multiplicative(), op.location());
        }
        return left;
    }

    private Expression multiplicative() throws SyntaxException {
        Expression left = unary();
        while (true) {
            BinaryExpression.Operator operator = switch (peek().type()) {
                case STAR -> BinaryExpression.Operator.MULTIPLY;
                case SLASH -> BinaryExpression.Operator.DIVIDE;
                case PERCENT -> BinaryExpression.Operator.MODULO;
                default -> null;
            };
            if (operator == null) {
                return left;
            }
            Token op = advance();
            left = new BinaryExpression(operator, left, unary(), op.location());
        }
    }

    private Expression unary() throws SyntaxException {
        if (check(TokenType.MINUS)) {
            Token op = advance();
            return new UnaryExpression(UnaryExpression.Operator.NEGATE, unary(), op.location());
        }
        if (match(TokenType.PLUS)) {
            return unary();
        }
        return power();
    }

    private Expression power() throws SyntaxException {
        Expression base = primary();
        if (check(TokenType.CARET)) {
            Token op = advance();
            // right associative: 2^3^2 == 2^(3^2)
            return new BinaryExpression(BinaryExpression.Operator.POWER, base, unary(), op.location());
        }
        return base;
    }

    private Expression primary() throws SyntaxException {
        Token token = peek();
        switch (token.type()) {
            case NUMBER, STRING -> {
                advance();
                return new Literal(token.literal(), token.location());
            }
            case TRUE -> {
                advance();
                return new Literal(Boolean.TRUE, token.location());
            }
            case FALSE -> {
                advance();
                return new Literal(Boolean.FALSE, token.location());
            }
            case IDENTIFIER -> {
                advance();
                if (check(TokenType.LEFT_PAREN)) {
                    throw new SyntaxException("Function calls are not allowed in expressions", token);
                }
                return new NameRef(token.text(), token.location());
            }
            case LEFT_PAREN -> {
                advance();
                Expression inner = expression();
                consume(TokenType.RIGHT_PAREN, "Matching ')' not found");
                return inner;
            }
            default -> throw new SyntaxException("Expected a value", token);
        }
    }

    // ========== Token helpers ==========

    private void requireTerminator() throws SyntaxException {
        if (!peek().type().isTerminator()) {
            throw new SyntaxException("Expected end of statement", peek());
        }
        if (!check(TokenType.END_OF_FILE)) {
            advance();
        }
    }

    private void skipTerminators() {
        while (check(TokenType.NEWLINE) || check(TokenType.SEMICOLON)) {
            advance();
        }
    }

    private Token consume(TokenType type, String message) throws SyntaxException {
        if (check(type)) {
            return advance();
        }
        throw new SyntaxException(message, peek());
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.END_OF_FILE) {
            current++;
        }
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }
}

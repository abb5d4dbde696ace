package com.reasoning.kgml.dsl;

import com.reasoning.kgml.api.ArgumentBundle;
import com.reasoning.kgml.api.Instructions;
import com.reasoning.kgml.api.RawText;
import com.reasoning.kgml.error.KgmlSyntaxException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser with one token of lookahead.
 *
 * <pre>
 * document     := KG► statement* ◄ EOF
 * statement    := command | conditional | loop
 * conditional  := IF► evaluate block (ELIF► evaluate block)* [ELSE► block] ◄
 * loop         := LOOP► evaluate block ◄
 * block        := statement*
 * evaluate     := E► ident [':' instructions]
 * command      := KGNODE► ident ':' proplist
 *               | KGLINK► ident ':' 'relation' '=' value (',' prop)*
 *               | (C► | U► | N►) ident ':' proplist
 *               | D► ident [':' proplist]
 *               | E► ident [':' instructions]
 * proplist     := [prop (',' prop)*]
 * prop         := ident '=' value
 * value        := STRING | NUMBER | true | false | null
 * instructions := '{' [arg (',' arg)*] '}' | STRING | arg (',' arg)*
 * arg          := prop | value
 * </pre>
 *
 * The first token that does not fit raises a {@link KgmlSyntaxException};
 * there is no recovery. Nothing semantic is checked here.
 */
public final class Parser {
    private final List<Token> tokens;
    private int pos;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF)
            throw new IllegalArgumentException("Token list must end with EOF");
        this.tokens = tokens;
    }

    public Program parse() {
        expect(TokenType.GRAPH_OPEN);
        List<Statement> statements = parseBlock();
        expect(TokenType.GRAPH_CLOSE, "a command marker or ◄");
        expect(TokenType.EOF);
        return new Program(statements);
    }

    private List<Statement> parseBlock() {
        List<Statement> statements = new ArrayList<>();
        while (true) {
            TokenType type = peek().type();
            if (type.isCommand())
                statements.add(parseCommand());
            else if (type == TokenType.IF)
                statements.add(parseConditional());
            else if (type == TokenType.LOOP)
                statements.add(parseLoop());
            else
                return statements;
        }
    }

    private Conditional parseConditional() {
        expect(TokenType.IF);
        List<Conditional.Branch> branches = new ArrayList<>();
        branches.add(new Conditional.Branch(parseCondition(), parseBlock()));
        while (accept(TokenType.ELIF))
            branches.add(new Conditional.Branch(parseCondition(), parseBlock()));
        List<Statement> otherwise = List.of();
        if (accept(TokenType.ELSE))
            otherwise = parseBlock();
        expect(TokenType.GRAPH_CLOSE, "a command marker, ELIF►, ELSE► or ◄");
        return new Conditional(branches, otherwise);
    }

    private Loop parseLoop() {
        expect(TokenType.LOOP);
        Command condition = parseCondition();
        List<Statement> body = parseBlock();
        expect(TokenType.GRAPH_CLOSE, "a command marker or ◄");
        return new Loop(condition, body);
    }

    private Command parseCondition() {
        if (peek().type() != TokenType.EVALUATE)
            throw error("E►", peek());
        return parseCommand();
    }

    private Command parseCommand() {
        Token marker = next();
        Verb verb = Verb.of(marker.type());
        String target = (String) expect(TokenType.IDENT).value();
        return switch (verb) {
            case NODE_DECL, CREATE, UPDATE, NODE -> {
                expect(TokenType.COLON);
                yield new Command(verb, target, parsePropList(), Instructions.none(), marker.position());
            }
            case LINK_DECL -> {
                expect(TokenType.COLON);
                yield new Command(verb, target, parseLinkProps(), Instructions.none(), marker.position());
            }
            case DELETE -> {
                Map<String, Object> props = Map.of();
                if (accept(TokenType.COLON))
                    props = parsePropList();
                yield new Command(verb, target, props, Instructions.none(), marker.position());
            }
            case EVALUATE -> {
                Instructions instructions = Instructions.none();
                if (accept(TokenType.COLON))
                    instructions = parseInstructions();
                yield new Command(verb, target, Map.of(), instructions, marker.position());
            }
        };
    }

    private Map<String, Object> parsePropList() {
        Map<String, Object> props = new LinkedHashMap<>();
        if (peek().type() != TokenType.IDENT)
            return props;
        do {
            parseProp(props);
        } while (accept(TokenType.COMMA));
        return props;
    }

    private Map<String, Object> parseLinkProps() {
        Token key = peek();
        if (key.type() != TokenType.IDENT || !Command.RELATION_KEY.equals(key.value()))
            throw error("'relation'", key);
        Map<String, Object> props = new LinkedHashMap<>();
        parseProp(props);
        while (accept(TokenType.COMMA))
            parseProp(props);
        return props;
    }

    private void parseProp(Map<String, Object> into) {
        String key = (String) expect(TokenType.IDENT).value();
        expect(TokenType.EQUALS);
        into.put(key, parseValue());
    }

    private Object parseValue() {
        Token t = next();
        return switch (t.type()) {
            case STRING, NUMBER -> t.value();
            case IDENT -> keyword(t, "a value");
            default -> throw error("a value", t);
        };
    }

    private Object keyword(Token t, String expected) {
        return switch (t.text()) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            case "null" -> null;
            default -> throw error(expected, t);
        };
    }

    private Instructions parseInstructions() {
        if (accept(TokenType.LBRACE)) {
            Bundle bundle = new Bundle();
            if (!accept(TokenType.RBRACE)) {
                do {
                    parseArg(bundle);
                } while (accept(TokenType.COMMA));
                expect(TokenType.RBRACE, "',' or '}'");
            }
            return bundle.build();
        }
        Token first = peek();
        if (first.type() == TokenType.GRAPH_CLOSE || first.type().isCommand() || first.type().isControl())
            return Instructions.none();
        if (first.type() == TokenType.STRING) {
            next();
            if (peek().type() != TokenType.COMMA)
                return new RawText((String) first.value());
            Bundle bundle = new Bundle();
            bundle.positional.add(first.value());
            while (accept(TokenType.COMMA))
                parseArg(bundle);
            return bundle.build();
        }
        Bundle bundle = new Bundle();
        do {
            parseArg(bundle);
        } while (accept(TokenType.COMMA));
        return bundle.build();
    }

    // An identifier is a named argument when '=' follows, otherwise a literal keyword.
    private void parseArg(Bundle bundle) {
        Token t = peek();
        if (t.type() != TokenType.IDENT) {
            bundle.positional.add(parseValue());
            return;
        }
        next();
        if (accept(TokenType.EQUALS)) {
            bundle.named.put((String) t.value(), parseValue());
            return;
        }
        bundle.positional.add(keyword(t, "'=' or a value"));
    }

    private static final class Bundle {
        final List<Object> positional = new ArrayList<>();
        final Map<String, Object> named = new LinkedHashMap<>();

        ArgumentBundle build() {
            return new ArgumentBundle(positional, named);
        }
    }

    // ---------------------------------------------------------------------
    // Token stream
    // ---------------------------------------------------------------------

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != TokenType.EOF)
            pos++;
        return t;
    }

    private boolean accept(TokenType type) {
        if (peek().type() == type) {
            next();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type) {
        return expect(type, type.description());
    }

    private Token expect(TokenType type, String expected) {
        Token t = peek();
        if (t.type() != type)
            throw error(expected, t);
        return next();
    }

    private static KgmlSyntaxException error(String expected, Token actual) {
        return new KgmlSyntaxException(expected, actual.describe(), actual.position());
    }
}

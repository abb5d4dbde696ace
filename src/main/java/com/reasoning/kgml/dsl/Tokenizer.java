package com.reasoning.kgml.dsl;

import com.reasoning.kgml.error.LexicalException;
import com.reasoning.kgml.error.SourcePosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits KGML text into tokens in a single forward scan.
 *
 * <p>
 * Markers are a run of capital letters immediately followed by {@code ►};
 * only the twelve known markers are accepted. Whitespace outside string
 * literals is skipped. The result always ends with an {@link TokenType#EOF}
 * token. Instances are single-use; {@link #tokenize(String)} is the entry
 * point.
 */
public final class Tokenizer {
    static final char OPEN_GLYPH = '►';
    static final char CLOSE_GLYPH = '◄';

    private static final Map<String, TokenType> MARKERS = Map.ofEntries(
            Map.entry("KG", TokenType.GRAPH_OPEN),
            Map.entry("KGNODE", TokenType.NODE_DECL),
            Map.entry("KGLINK", TokenType.LINK_DECL),
            Map.entry("C", TokenType.CREATE),
            Map.entry("U", TokenType.UPDATE),
            Map.entry("D", TokenType.DELETE),
            Map.entry("E", TokenType.EVALUATE),
            Map.entry("N", TokenType.NODE),
            Map.entry("IF", TokenType.IF),
            Map.entry("ELIF", TokenType.ELIF),
            Map.entry("ELSE", TokenType.ELSE),
            Map.entry("LOOP", TokenType.LOOP));

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int line = 1;
    private int lineStart;

    private Tokenizer(String input) {
        this.input = input;
    }

    /**
     * @throws LexicalException on the first character sequence that is not a token
     */
    public static List<Token> tokenize(String input) {
        if (input == null)
            throw new IllegalArgumentException("input must not be null");
        return new Tokenizer(input).run();
    }

    private List<Token> run() {
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", null, position()));
                return tokens;
            }
            SourcePosition start = position();
            char c = input.charAt(pos);
            switch (c) {
                case ':' -> single(TokenType.COLON, start);
                case ',' -> single(TokenType.COMMA, start);
                case '=' -> single(TokenType.EQUALS, start);
                case '{' -> single(TokenType.LBRACE, start);
                case '}' -> single(TokenType.RBRACE, start);
                case CLOSE_GLYPH -> single(TokenType.GRAPH_CLOSE, start);
                case OPEN_GLYPH -> throw new LexicalException("Marker glyph '►' without a marker name", start);
                case '"' -> readString(start);
                default -> {
                    if (c == '-' || isDigit(c))
                        readNumber(start);
                    else if (isIdentStart(c))
                        readWord(start);
                    else
                        throw new LexicalException("Unexpected character '" + c + "'", start);
                }
            }
        }
    }

    private void single(TokenType type, SourcePosition start) {
        tokens.add(new Token(type, String.valueOf(input.charAt(pos)), null, start));
        pos++;
    }

    private void readWord(SourcePosition start) {
        int s = pos;
        while (pos < input.length() && isIdentPart(input.charAt(pos)))
            pos++;
        String word = input.substring(s, pos);
        if (pos < input.length() && input.charAt(pos) == OPEN_GLYPH) {
            TokenType marker = MARKERS.get(word);
            if (marker == null)
                throw new LexicalException("Unknown marker '" + word + OPEN_GLYPH + "'", start);
            pos++;
            tokens.add(new Token(marker, word + OPEN_GLYPH, null, start));
            return;
        }
        tokens.add(new Token(TokenType.IDENT, word, word, start));
    }

    private void readString(SourcePosition start) {
        int s = pos;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == '"') {
                tokens.add(new Token(TokenType.STRING, input.substring(s, pos), sb.toString(), start));
                return;
            }
            if (c == '\n')
                newLine();
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (pos >= input.length())
                break;
            SourcePosition escapeAt = position(pos - 1);
            char e = input.charAt(pos++);
            switch (e) {
                case '"', '\\', '/' -> sb.append(e);
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'u' -> {
                    if (pos + 4 > input.length())
                        throw new LexicalException("Truncated unicode escape", escapeAt);
                    String hex = input.substring(pos, pos + 4);
                    try {
                        sb.append((char) Integer.parseInt(hex, 16));
                    } catch (NumberFormatException ex) {
                        throw new LexicalException("Bad unicode escape '\\u" + hex + "'", escapeAt);
                    }
                    pos += 4;
                }
                default -> throw new LexicalException("Bad escape '\\" + e + "'", escapeAt);
            }
        }
        throw new LexicalException("Unterminated string literal", start);
    }

    private void readNumber(SourcePosition start) {
        int s = pos;
        if (input.charAt(pos) == '-')
            pos++;
        if (digits() == 0)
            throw new LexicalException("Malformed number '" + input.substring(s, Math.min(pos + 1, input.length())) + "'",
                    start);
        boolean fp = false;
        if (pos < input.length() && input.charAt(pos) == '.') {
            fp = true;
            pos++;
            if (digits() == 0)
                throw malformed(s, start);
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            fp = true;
            pos++;
            if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-'))
                pos++;
            if (digits() == 0)
                throw malformed(s, start);
        }
        if (pos < input.length() && (isIdentPart(input.charAt(pos)) || input.charAt(pos) == '.'))
            throw malformed(s, start);
        String text = input.substring(s, pos);
        Number value;
        if (fp) {
            value = Double.parseDouble(text);
        } else {
            try {
                value = Long.parseLong(text);
            } catch (NumberFormatException e) {
                value = Double.parseDouble(text);
            }
        }
        tokens.add(new Token(TokenType.NUMBER, text, value, start));
    }

    private LexicalException malformed(int s, SourcePosition start) {
        int end = pos;
        while (end < input.length() && (isIdentPart(input.charAt(end)) || input.charAt(end) == '.'))
            end++;
        return new LexicalException("Malformed number '" + input.substring(s, end) + "'", start);
    }

    private int digits() {
        int s = pos;
        while (pos < input.length() && isDigit(input.charAt(pos)))
            pos++;
        return pos - s;
    }

    private void skipWhitespace() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\n') {
                pos++;
                newLine();
            } else if (Character.isWhitespace(c) || c == '\uFEFF') {
                pos++;
            } else {
                return;
            }
        }
    }

    private void newLine() {
        line++;
        lineStart = pos;
    }

    private SourcePosition position() {
        return position(pos);
    }

    private SourcePosition position(int offset) {
        return new SourcePosition(offset, line, offset - lineStart + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}

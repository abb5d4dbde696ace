package com.reasoning.kgml.dsl;

import com.reasoning.kgml.error.LexicalException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TokenizerTest {

    private static void assertTypes(List<Token> tokens, TokenType... expected) {
        assertEquals("token count", expected.length, tokens.size());
        for (int i = 0; i < expected.length; i++)
            assertEquals("token " + i, expected[i], tokens.get(i).type());
    }

    @Test
    public void testMarkersAndPunctuation() {
        List<Token> tokens = Tokenizer.tokenize("KG► KGNODE► KGLINK► C► U► D► E► N► : , = { } ◄");
        assertTypes(tokens, TokenType.GRAPH_OPEN, TokenType.NODE_DECL, TokenType.LINK_DECL, TokenType.CREATE,
                TokenType.UPDATE, TokenType.DELETE, TokenType.EVALUATE, TokenType.NODE, TokenType.COLON,
                TokenType.COMMA, TokenType.EQUALS, TokenType.LBRACE, TokenType.RBRACE, TokenType.GRAPH_CLOSE,
                TokenType.EOF);
    }

    @Test
    public void testControlMarkers() {
        List<Token> tokens = Tokenizer.tokenize("IF► ELIF► ELSE► LOOP►");
        assertTypes(tokens, TokenType.IF, TokenType.ELIF, TokenType.ELSE, TokenType.LOOP, TokenType.EOF);
        assertTrue(TokenType.ELIF.isControl());
        assertFalse(TokenType.ELIF.isCommand());
        assertEquals("LOOP►", tokens.get(3).text());
    }

    @Test
    public void testIdentifiersStringsAndNumbers() {
        List<Token> tokens = Tokenizer.tokenize("Sensor_01 status=\"in active\" n=-12 x=3.5e2");
        assertTypes(tokens, TokenType.IDENT, TokenType.IDENT, TokenType.EQUALS, TokenType.STRING,
                TokenType.IDENT, TokenType.EQUALS, TokenType.NUMBER, TokenType.IDENT, TokenType.EQUALS,
                TokenType.NUMBER, TokenType.EOF);
        assertEquals("Sensor_01", tokens.get(0).value());
        assertEquals("in active", tokens.get(3).value());
        assertEquals("\"in active\"", tokens.get(3).text());
        assertEquals(-12L, tokens.get(6).value());
        assertEquals(350.0, tokens.get(9).value());
    }

    @Test
    public void testStringEscapes() {
        List<Token> tokens = Tokenizer.tokenize("\"a\\\"b\\\\c\\nd\\te\\/f\\u0041\"");
        assertEquals("a\"b\\c\nd\te/fA", tokens.get(0).value());
    }

    @Test
    public void testPositionsTrackLinesAndColumns() {
        List<Token> tokens = Tokenizer.tokenize("KG►\n  C► X\n◄");
        Token create = tokens.get(1);
        assertEquals(TokenType.CREATE, create.type());
        assertEquals(2, create.position().line());
        assertEquals(3, create.position().column());
        assertEquals(6, create.position().offset());
        Token close = tokens.get(3);
        assertEquals(3, close.position().line());
        assertEquals(1, close.position().column());
    }

    @Test
    public void testWhitespaceIsInsignificant() {
        List<Token> compact = Tokenizer.tokenize("KG►C►X:type=\"A\"◄");
        List<Token> spaced = Tokenizer.tokenize("KG►\n\tC►  X :  type = \"A\"\n◄\n");
        assertEquals(compact.size(), spaced.size());
        for (int i = 0; i < compact.size(); i++) {
            assertEquals(compact.get(i).type(), spaced.get(i).type());
            assertEquals(compact.get(i).value(), spaced.get(i).value());
        }
    }

    @Test
    public void testTokenizingIsRepeatable() {
        String text = "KG► E► A : 1, \"x\" ◄";
        assertEquals(Tokenizer.tokenize(text), Tokenizer.tokenize(text));
    }

    @Test
    public void testUnterminatedString() {
        try {
            Tokenizer.tokenize("KG► C► X : type=\"abc");
            fail("Expected LexicalException");
        } catch (LexicalException e) {
            assertTrue(e.getMessage().contains("Unterminated"));
            assertEquals(16, e.position().offset());
            assertEquals(1, e.position().line());
        }
    }

    @Test
    public void testUnknownMarker() {
        try {
            Tokenizer.tokenize("KG►\nXYZ► foo ◄");
            fail("Expected LexicalException");
        } catch (LexicalException e) {
            assertTrue(e.getMessage().contains("XYZ►"));
            assertEquals(2, e.position().line());
            assertEquals(1, e.position().column());
        }
    }

    @Test
    public void testStrayMarkerGlyph() {
        try {
            Tokenizer.tokenize("KG► ► ◄");
            fail("Expected LexicalException");
        } catch (LexicalException e) {
            assertEquals(4, e.position().offset());
        }
    }

    @Test
    public void testMalformedNumbers() {
        for (String bad : new String[] { "x=12.", "x=1e", "x=12abc", "x=-", "x=1.2.3" }) {
            try {
                Tokenizer.tokenize(bad);
                fail("Expected LexicalException for " + bad);
            } catch (LexicalException e) {
                assertEquals(bad, 2, e.position().offset());
            }
        }
    }

    @Test
    public void testBadEscape() {
        try {
            Tokenizer.tokenize("\"a\\qb\"");
            fail("Expected LexicalException");
        } catch (LexicalException e) {
            assertTrue(e.getMessage().contains("escape"));
        }
    }

    @Test
    public void testLargeIntegerFallsBackToDouble() {
        Token t = Tokenizer.tokenize("99999999999999999999").get(0);
        assertTrue(t.value() instanceof Double);
    }
}

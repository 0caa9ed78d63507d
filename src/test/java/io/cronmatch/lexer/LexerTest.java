package io.cronmatch.lexer;

import static org.junit.jupiter.api.Assertions.*;

import io.cronmatch.CronException;
import io.cronmatch.ErrorKind;
import io.cronmatch.Span;
import java.util.List;
import org.junit.jupiter.api.Test;

class LexerTest {

  private static Token classify(String text) throws CronException {
    return Lexer.classify(text, new Span(0, text.length()), text);
  }

  @Test
  void splitsOnWhitespaceRunsWithSpans() throws CronException {
    List<Token> tokens = Lexer.tokenize("  1   2\t* *\n*/5 ");
    assertEquals(5, tokens.size());
    assertEquals("1", tokens.get(0).text());
    assertEquals(new Span(2, 3), tokens.get(0).span());
    assertEquals(new Span(6, 7), tokens.get(1).span());
    assertEquals("*/5", tokens.get(4).text());
    assertEquals(new Span(12, 15), tokens.get(4).span());
  }

  @Test
  void blankInputIsOneEmptyToken() throws CronException {
    List<Token> tokens = Lexer.tokenize(" \t ");
    assertEquals(1, tokens.size());
    assertEquals(TokenKind.WILDCARD, tokens.get(0).kind());
    assertEquals("", tokens.get(0).text());
  }

  @Test
  void classifiesEachShape() throws CronException {
    assertEquals(TokenKind.WILDCARD, classify("").kind());
    assertEquals(TokenKind.WILDCARD, classify("*").kind());
    assertEquals(TokenKind.PERIOD, classify("*/10").kind());
    assertEquals(TokenKind.RANGE, classify("3-7").kind());
    assertEquals(TokenKind.VALUE, classify("42").kind());
    assertEquals(TokenKind.LIST, classify("1,2,3").kind());
  }

  @Test
  void tokensCarryTheirNumbers() throws CronException {
    assertEquals(List.of(10), classify("*/10").numbers());
    assertEquals(List.of(3, 7), classify("3-7").numbers());
    assertEquals(List.of(42), classify("042").numbers());
    assertEquals(List.of(1, 2, 3), classify("1,2,3").numbers());
    assertEquals(List.of(), classify("*").numbers());
  }

  @Test
  void hugeNumbersSaturate() throws CronException {
    assertEquals(List.of(Integer.MAX_VALUE), classify("123456789012345").numbers());
  }

  @Test
  void rejectsUnknownShapes() {
    for (String bad :
        List.of("a", "1-", "-1", "1-2-3", "*/", "*/x", "1,", ",1", "1,,2", "1-3/2", "**", "?", "L")) {
      CronException e = assertThrows(CronException.class, () -> classify(bad), bad);
      assertEquals(ErrorKind.UNKNOWN_TOKEN, e.kind());
      assertEquals("syntax error: unknown token: " + bad, e.getMessage());
    }
  }

  @Test
  void unknownTokenCarriesSpanAndInput() {
    CronException e =
        assertThrows(CronException.class, () -> Lexer.tokenize("1 2 5x * *"));
    assertEquals(new Span(4, 6), e.span().orElseThrow());
    assertEquals("1 2 5x * *", e.input().orElseThrow());
  }
}

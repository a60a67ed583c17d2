/**
 * Copyright (c) 2011, University of Konstanz, Distributed Systems Group All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met: * Redistributions of source code must retain the
 * above copyright notice, this list of conditions and the following disclaimer. * Redistributions
 * in binary form must reproduce the above copyright notice, this list of conditions and the
 * following disclaimer in the documentation and/or other materials provided with the distribution.
 * * Neither the name of the University of Konstanz nor the names of its contributors may be used to
 * endorse or promote products derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
 * BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS;
 * OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT,
 * STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.treepath.xpath.parser;

import io.treepath.exception.XPathSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.treepath.xpath.parser.TokenType.AND;
import static io.treepath.xpath.parser.TokenType.AT;
import static io.treepath.xpath.parser.TokenType.AXIS;
import static io.treepath.xpath.parser.TokenType.DIV;
import static io.treepath.xpath.parser.TokenType.DOLLAR;
import static io.treepath.xpath.parser.TokenType.DOUBLE_COLON;
import static io.treepath.xpath.parser.TokenType.DOUBLE_DOT;
import static io.treepath.xpath.parser.TokenType.DOUBLE_SLASH;
import static io.treepath.xpath.parser.TokenType.END;
import static io.treepath.xpath.parser.TokenType.EQ;
import static io.treepath.xpath.parser.TokenType.GTE;
import static io.treepath.xpath.parser.TokenType.LBRACKET;
import static io.treepath.xpath.parser.TokenType.LPAREN;
import static io.treepath.xpath.parser.TokenType.LTE;
import static io.treepath.xpath.parser.TokenType.MINUS;
import static io.treepath.xpath.parser.TokenType.NAME;
import static io.treepath.xpath.parser.TokenType.NEQ;
import static io.treepath.xpath.parser.TokenType.NODE_TYPE;
import static io.treepath.xpath.parser.TokenType.NUMBER;
import static io.treepath.xpath.parser.TokenType.OR;
import static io.treepath.xpath.parser.TokenType.PIPE;
import static io.treepath.xpath.parser.TokenType.RBRACKET;
import static io.treepath.xpath.parser.TokenType.RPAREN;
import static io.treepath.xpath.parser.TokenType.SLASH;
import static io.treepath.xpath.parser.TokenType.STAR;
import static io.treepath.xpath.parser.TokenType.STRING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class XPathScannerTest {

  private static List<TokenType> types(final String query) throws XPathSyntaxException {
    final List<TokenType> types = new ArrayList<>();
    for (final XPathToken token : XPathScanner.tokenize(query)) {
      types.add(token.getType());
    }
    return types;
  }

  @Test
  public void testPath() throws XPathSyntaxException {
    assertEquals(List.of(DOUBLE_SLASH, NAME, LBRACKET, AT, NAME, EQ, STRING, RBRACKET, END),
        types("//book[@id='b1']"));
    assertEquals(List.of(SLASH, NAME, SLASH, DOUBLE_DOT, SLASH, STAR, END), types("/a/../*"));
  }

  @Test
  public void testAxisNeedsDoubleColon() throws XPathSyntaxException {
    assertEquals(List.of(AXIS, DOUBLE_COLON, NAME, END), types("child::a"));
    assertEquals(List.of(AXIS, DOUBLE_COLON, NAME, END), types("following-sibling::b"));
    assertEquals(List.of(NAME, END), types("child"));
    assertEquals(List.of(NAME, SLASH, NAME, END), types("parent/self"));
  }

  @Test
  public void testKeywords() throws XPathSyntaxException {
    assertEquals(List.of(NAME, AND, NAME, OR, NUMBER, DIV, NUMBER, END),
        types("a and b or 4 div 2"));
  }

  @Test
  public void testNodeTypeNeedsParenthesis() throws XPathSyntaxException {
    assertEquals(List.of(NODE_TYPE, LPAREN, RPAREN, END), types("text()"));
    assertEquals(List.of(NODE_TYPE, LPAREN, RPAREN, END), types("node ( )"));
    assertEquals(List.of(NAME, END), types("comment"));
  }

  @Test
  public void testOperators() throws XPathSyntaxException {
    assertEquals(List.of(NAME, NEQ, NAME, PIPE, NAME, LTE, NAME, GTE, NAME, END),
        types("a != b | c <= d >= e"));
    assertEquals(List.of(NUMBER, MINUS, NUMBER, END), types("1 - 2"));
    assertEquals(List.of(NAME, END), types("a-b"));
    assertEquals(List.of(DOLLAR, NAME, END), types("$var"));
  }

  @Test
  public void testNumbers() throws XPathSyntaxException {
    final List<XPathToken> tokens = XPathScanner.tokenize("12 .5 3.25");
    assertEquals("12", tokens.get(0).getContent());
    assertEquals(".5", tokens.get(1).getContent());
    assertEquals(NUMBER, tokens.get(1).getType());
    assertEquals("3.25", tokens.get(2).getContent());
  }

  @Test
  public void testStringLiterals() throws XPathSyntaxException {
    final List<XPathToken> tokens = XPathScanner.tokenize("'it\\'s' \"say \\\"hi\\\"\" 'a\\tb'");
    assertEquals("it's", tokens.get(0).getContent());
    assertEquals("say \"hi\"", tokens.get(1).getContent());
    assertEquals("a\tb", tokens.get(2).getContent());
    assertEquals(STRING, tokens.get(2).getType());
  }

  @Test
  public void testOffsets() throws XPathSyntaxException {
    final List<XPathToken> tokens = XPathScanner.tokenize("a | b");
    assertEquals(0, tokens.get(0).getOffset());
    assertEquals(2, tokens.get(1).getOffset());
    assertEquals(4, tokens.get(2).getOffset());
    assertEquals(5, tokens.get(3).getOffset());
    assertEquals(END, tokens.get(3).getType());
  }

  @Test
  public void testEmptyQuery() throws XPathSyntaxException {
    assertEquals(List.of(END), types("   "));
  }

  @Test
  public void testLoneExclamationMark() {
    final XPathSyntaxException e =
        assertThrows(XPathSyntaxException.class, () -> XPathScanner.tokenize("a ! b"));
    assertEquals(2, e.getPosition());
    assertEquals("!", e.getToken());
    assertTrue(e.getMessage().contains("Expression: a ! b"));
  }

  @Test
  public void testUnterminatedString() {
    final XPathSyntaxException e =
        assertThrows(XPathSyntaxException.class, () -> XPathScanner.tokenize("'open"));
    assertNull(e.getToken());
    assertTrue(e.getReason().startsWith("Unterminated string"));
  }

  @Test
  public void testUnexpectedCharacter() {
    final XPathSyntaxException e =
        assertThrows(XPathSyntaxException.class, () -> XPathScanner.tokenize("a # b"));
    assertEquals("#", e.getToken());
    assertEquals(2, e.getPosition());
  }
}

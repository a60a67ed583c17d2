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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.treepath.exception.XPathSyntaxException;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <h1>XPathScanner</h1>
 * <p>
 * Lexical scanner to extract tokens from the query.
 * </p>
 * <p>
 * The query is read char by char in a single pass. Two-character operators are recognized with
 * one character of lookahead. A name becomes an {@link TokenType#AXIS} token if it names an axis
 * and is immediately followed by {@code ::}, and a {@link TokenType#NODE_TYPE} token if it names a
 * node type and the next non-blank character is {@code (}. The scanner always appends a
 * {@link TokenType#END} token.
 * </p>
 */
public final class XPathScanner {

  /** Axis names. */
  static final ImmutableSet<String> AXIS_NAMES = ImmutableSet.of("ancestor", "ancestor-or-self",
      "attribute", "child", "descendant", "descendant-or-self", "following", "following-sibling",
      "namespace", "parent", "preceding", "preceding-sibling", "self");

  /** Node type test names. */
  static final ImmutableSet<String> NODE_TYPES =
      ImmutableSet.of("comment", "text", "processing-instruction", "node");

  /** The XPath query to scan. */
  private final String query;

  /** The current position of the cursor to the query string. */
  private int pos;

  /** Collected tokens. */
  private final ImmutableList.Builder<XPathToken> tokens = ImmutableList.builder();

  private XPathScanner(final String query) {
    this.query = query;
  }

  /**
   * Split a query into tokens.
   *
   * @param query the query to scan
   * @return the tokens, the last one of type {@link TokenType#END}
   * @throws XPathSyntaxException for characters that cannot start a token, a lone {@code !} or an
   *         unterminated string literal
   */
  public static List<XPathToken> tokenize(final String query) throws XPathSyntaxException {
    return new XPathScanner(checkNotNull(query)).scan();
  }

  private List<XPathToken> scan() throws XPathSyntaxException {
    final int length = query.length();
    while (true) {
      skipWhitespace();
      if (pos >= length) {
        break;
      }
      final int start = pos;
      final char input = query.charAt(pos);
      switch (input) {
        case '/':
          if (peek() == '/') {
            emit(TokenType.DOUBLE_SLASH, start, 2);
          } else {
            emit(TokenType.SLASH, start, 1);
          }
          break;
        case '|':
          emit(TokenType.PIPE, start, 1);
          break;
        case '+':
          emit(TokenType.PLUS, start, 1);
          break;
        case '-':
          emit(TokenType.MINUS, start, 1);
          break;
        case '*':
          emit(TokenType.STAR, start, 1);
          break;
        case '=':
          emit(TokenType.EQ, start, 1);
          break;
        case '!':
          if (peek() != '=') {
            throw error("Unexpected '!' at position " + pos, "!");
          }
          emit(TokenType.NEQ, start, 2);
          break;
        case '<':
          if (peek() == '=') {
            emit(TokenType.LTE, start, 2);
          } else {
            emit(TokenType.LT, start, 1);
          }
          break;
        case '>':
          if (peek() == '=') {
            emit(TokenType.GTE, start, 2);
          } else {
            emit(TokenType.GT, start, 1);
          }
          break;
        case '(':
          emit(TokenType.LPAREN, start, 1);
          break;
        case ')':
          emit(TokenType.RPAREN, start, 1);
          break;
        case '[':
          emit(TokenType.LBRACKET, start, 1);
          break;
        case ']':
          emit(TokenType.RBRACKET, start, 1);
          break;
        case ',':
          emit(TokenType.COMMA, start, 1);
          break;
        case '@':
          emit(TokenType.AT, start, 1);
          break;
        case '$':
          emit(TokenType.DOLLAR, start, 1);
          break;
        case ':':
          if (peek() == ':') {
            emit(TokenType.DOUBLE_COLON, start, 2);
          } else {
            emit(TokenType.COLON, start, 1);
          }
          break;
        case '.':
          if (peek() == '.') {
            emit(TokenType.DOUBLE_DOT, start, 2);
          } else if (isDigit(peek())) {
            scanNumber(start);
          } else {
            emit(TokenType.DOT, start, 1);
          }
          break;
        case '"':
        case '\'':
          scanString(start);
          break;
        default:
          if (isDigit(input)) {
            scanNumber(start);
          } else if (isFirstLetter(input)) {
            scanName(start);
          } else {
            throw error("Unexpected character '" + input + "' at position " + pos,
                String.valueOf(input));
          }
      }
    }
    tokens.add(new XPathToken(TokenType.END, "", length));
    return tokens.build();
  }

  private void emit(final TokenType type, final int start, final int width) {
    tokens.add(new XPathToken(type, query.substring(start, start + width), start));
    pos = start + width;
  }

  /**
   * Scans a string literal. Backslash escapes the quote characters, the backslash itself and
   * {@code t}, {@code n}, {@code r}; any other escaped character stands for itself.
   */
  private void scanString(final int start) throws XPathSyntaxException {
    final char quote = query.charAt(pos++);
    final StringBuilder value = new StringBuilder();
    while (pos < query.length() && query.charAt(pos) != quote) {
      char current = query.charAt(pos);
      if (current == '\\') {
        pos++;
        if (pos >= query.length()) {
          break;
        }
        current = unescape(query.charAt(pos));
      }
      value.append(current);
      pos++;
    }
    if (pos >= query.length()) {
      throw error("Unterminated string starting at position " + start, null);
    }
    // closing quote
    pos++;
    tokens.add(new XPathToken(TokenType.STRING, value.toString(), start));
  }

  private static char unescape(final char escaped) {
    switch (escaped) {
      case 't':
        return '\t';
      case 'n':
        return '\n';
      case 'r':
        return '\r';
      default:
        return escaped;
    }
  }

  private void scanNumber(final int start) {
    while (pos < query.length() && isDigit(query.charAt(pos))) {
      pos++;
    }
    if (pos < query.length() && query.charAt(pos) == '.') {
      pos++;
      while (pos < query.length() && isDigit(query.charAt(pos))) {
        pos++;
      }
    }
    tokens.add(new XPathToken(TokenType.NUMBER, query.substring(start, pos), start));
  }

  private void scanName(final int start) {
    while (pos < query.length() && isLetter(query.charAt(pos))) {
      pos++;
    }
    final String name = query.substring(start, pos);
    final TokenType type;
    if (AXIS_NAMES.contains(name) && query.startsWith("::", pos)) {
      type = TokenType.AXIS;
    } else if ("and".equals(name)) {
      type = TokenType.AND;
    } else if ("or".equals(name)) {
      type = TokenType.OR;
    } else if ("mod".equals(name)) {
      type = TokenType.MOD;
    } else if ("div".equals(name)) {
      type = TokenType.DIV;
    } else if (NODE_TYPES.contains(name) && nextNonBlank() == '(') {
      type = TokenType.NODE_TYPE;
    } else {
      type = TokenType.NAME;
    }
    tokens.add(new XPathToken(type, name, start));
  }

  private void skipWhitespace() {
    while (pos < query.length() && Character.isWhitespace(query.charAt(pos))) {
      pos++;
    }
  }

  /** Returns the character after the current one, or {@code 0} at the end. */
  private char peek() {
    return pos + 1 < query.length() ? query.charAt(pos + 1) : 0;
  }

  private char nextNonBlank() {
    int index = pos;
    while (index < query.length() && Character.isWhitespace(query.charAt(index))) {
      index++;
    }
    return index < query.length() ? query.charAt(index) : 0;
  }

  private XPathSyntaxException error(final String message, final String token) {
    return new XPathSyntaxException(message, query, pos, token);
  }

  private static boolean isDigit(final char input) {
    return input >= '0' && input <= '9';
  }

  /**
   * Checks if the given character is a valid first letter of a name.
   */
  private static boolean isFirstLetter(final char input) {
    return (input >= 'a' && input <= 'z') || (input >= 'A' && input <= 'Z') || input == '_';
  }

  /**
   * Checks if the given character is a letter that may occur after the first one.
   */
  private static boolean isLetter(final char input) {
    return isFirstLetter(input) || isDigit(input) || input == '-' || input == '.';
  }
}

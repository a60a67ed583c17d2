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

/**
 * <h1>TokenType</h1>
 * <p>
 * Types of tokens produced by the {@link XPathScanner}.
 * </p>
 */
public enum TokenType {

  /** Slash, {@code /}. */
  SLASH("/"),
  /** Descendant-or-self abbreviation, {@code //}. */
  DOUBLE_SLASH("//"),
  /** Union operator, {@code |}. */
  PIPE("|"),
  /** Plus. */
  PLUS("+"),
  /** Minus, binary or unary. */
  MINUS("-"),
  /** Star, wildcard or multiplication. */
  STAR("*"),
  /** Equals. */
  EQ("="),
  /** Not equals. */
  NEQ("!="),
  /** Less than. */
  LT("<"),
  /** Greater than. */
  GT(">"),
  /** Less than or equal. */
  LTE("<="),
  /** Greater than or equal. */
  GTE(">="),
  /** Opening parenthesis. */
  LPAREN("("),
  /** Closing parenthesis. */
  RPAREN(")"),
  /** Opening bracket of a predicate. */
  LBRACKET("["),
  /** Closing bracket of a predicate. */
  RBRACKET("]"),
  /** Argument separator. */
  COMMA(","),
  /** Attribute axis abbreviation. */
  AT("@"),
  /** Variable reference marker. */
  DOLLAR("$"),
  /** Context node abbreviation. */
  DOT("."),
  /** Parent abbreviation. */
  DOUBLE_DOT(".."),
  /** Prefix separator. */
  COLON(":"),
  /** Axis separator. */
  DOUBLE_COLON("::"),
  /** String literal, content without quotes. */
  STRING(null),
  /** Numeric literal. */
  NUMBER(null),
  /** Name. */
  NAME(null),
  /** Axis name, followed by {@code ::}. */
  AXIS(null),
  /** Node type name, followed by {@code (}. */
  NODE_TYPE(null),
  /** Keyword {@code and}. */
  AND("and"),
  /** Keyword {@code or}. */
  OR("or"),
  /** Keyword {@code mod}. */
  MOD("mod"),
  /** Keyword {@code div}. */
  DIV("div"),
  /** End of the query. */
  END(null);

  /** Fixed spelling, {@code null} for tokens with variable content. */
  private final String symbol;

  TokenType(final String symbol) {
    this.symbol = symbol;
  }

  /**
   * Get the fixed spelling of the token, or a description for tokens with variable content.
   *
   * @return a human readable representation
   */
  public String describe() {
    return symbol == null ? name().toLowerCase(java.util.Locale.ROOT) : "'" + symbol + "'";
  }

  /**
   * Determines if this is one of the keywords {@code and}, {@code or}, {@code mod} or
   * {@code div}, which are admitted as names in a node test.
   *
   * @return {@code true} for keyword tokens
   */
  public boolean isKeyword() {
    return this == AND || this == OR || this == MOD || this == DIV;
  }
}

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
import io.treepath.xpath.ast.AstNode;
import io.treepath.xpath.ast.AstType;
import io.treepath.xpath.ast.NameTest;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <h1>XPathParser</h1>
 * <p>
 * Recursive descent parser turning the tokens of an XPath 1.0 expression into an {@link AstNode}
 * tree. Abbreviations are expanded while parsing: {@code .} becomes {@code self::node()},
 * {@code ..} becomes {@code parent::node()}, {@code @} selects the attribute axis and {@code //}
 * inserts a {@code descendant-or-self::node()} step.
 * </p>
 * <p>
 * Operator precedence, from lowest to highest: {@code or}, {@code and}, equality, relational,
 * additive, multiplicative, unary minus, union, path.
 * </p>
 */
public final class XPathParser {

  /** The query, for error messages. */
  private final String query;

  /** Tokens of the query, ending with {@link TokenType#END}. */
  private final List<XPathToken> tokens;

  /** Index of the current token. */
  private int index;

  /** Represents the current read token. */
  private XPathToken token;

  private XPathParser(final String query, final List<XPathToken> tokens) {
    this.query = query;
    this.tokens = tokens;
    token = tokens.get(0);
  }

  /**
   * Parse a query.
   *
   * @param query the query
   * @return the syntax tree, an {@link AstType#EMPTY} node for a blank query
   * @throws XPathSyntaxException if the query is malformed
   */
  public static AstNode parse(final String query) throws XPathSyntaxException {
    checkNotNull(query);
    return new XPathParser(query, XPathScanner.tokenize(query)).parseQuery();
  }

  private AstNode parseQuery() throws XPathSyntaxException {
    if (is(TokenType.END)) {
      return AstNode.of(AstType.EMPTY);
    }
    final AstNode expression = parseOrExpr();
    // after the parsing of the expression no token must be left
    if (!is(TokenType.END)) {
      throw error("Unexpected token " + describe(token));
    }
    return expression;
  }

  /**
   * [21] OrExpr ::= AndExpr | OrExpr 'or' AndExpr.
   */
  private AstNode parseOrExpr() throws XPathSyntaxException {
    AstNode left = parseAndExpr();
    while (consumeIf(TokenType.OR)) {
      left = AstNode.of(AstType.OR, left, parseAndExpr());
    }
    return left;
  }

  /**
   * [22] AndExpr ::= EqualityExpr | AndExpr 'and' EqualityExpr.
   */
  private AstNode parseAndExpr() throws XPathSyntaxException {
    AstNode left = parseEqualityExpr();
    while (consumeIf(TokenType.AND)) {
      left = AstNode.of(AstType.AND, left, parseEqualityExpr());
    }
    return left;
  }

  /**
   * [23] EqualityExpr ::= RelationalExpr | EqualityExpr ('=' | '!=') RelationalExpr.
   */
  private AstNode parseEqualityExpr() throws XPathSyntaxException {
    AstNode left = parseRelationalExpr();
    while (true) {
      if (consumeIf(TokenType.EQ)) {
        left = AstNode.of(AstType.EQ, left, parseRelationalExpr());
      } else if (consumeIf(TokenType.NEQ)) {
        left = AstNode.of(AstType.NEQ, left, parseRelationalExpr());
      } else {
        return left;
      }
    }
  }

  /**
   * [24] RelationalExpr ::= AdditiveExpr | RelationalExpr ('<' | '>' | '<=' | '>=')
   * AdditiveExpr.
   */
  private AstNode parseRelationalExpr() throws XPathSyntaxException {
    AstNode left = parseAdditiveExpr();
    while (true) {
      final AstType type;
      switch (token.getType()) {
        case LT:
          type = AstType.LT;
          break;
        case GT:
          type = AstType.GT;
          break;
        case LTE:
          type = AstType.LTE;
          break;
        case GTE:
          type = AstType.GTE;
          break;
        default:
          return left;
      }
      next();
      left = AstNode.of(type, left, parseAdditiveExpr());
    }
  }

  /**
   * [25] AdditiveExpr ::= MultiplicativeExpr | AdditiveExpr ('+' | '-') MultiplicativeExpr.
   */
  private AstNode parseAdditiveExpr() throws XPathSyntaxException {
    AstNode left = parseMultiplicativeExpr();
    while (true) {
      if (consumeIf(TokenType.PLUS)) {
        left = AstNode.of(AstType.PLUS, left, parseMultiplicativeExpr());
      } else if (consumeIf(TokenType.MINUS)) {
        left = AstNode.of(AstType.MINUS, left, parseMultiplicativeExpr());
      } else {
        return left;
      }
    }
  }

  /**
   * [26] MultiplicativeExpr ::= UnaryExpr | MultiplicativeExpr ('*' | 'div' | 'mod') UnaryExpr.
   * A star following a complete operand is always the multiplication operator.
   */
  private AstNode parseMultiplicativeExpr() throws XPathSyntaxException {
    AstNode left = parseUnaryExpr();
    while (true) {
      if (consumeIf(TokenType.STAR)) {
        left = AstNode.of(AstType.STAR, left, parseUnaryExpr());
      } else if (consumeIf(TokenType.DIV)) {
        left = AstNode.of(AstType.DIV, left, parseUnaryExpr());
      } else if (consumeIf(TokenType.MOD)) {
        left = AstNode.of(AstType.MOD, left, parseUnaryExpr());
      } else {
        return left;
      }
    }
  }

  /**
   * [27] UnaryExpr ::= UnionExpr | '-' UnaryExpr.
   */
  private AstNode parseUnaryExpr() throws XPathSyntaxException {
    if (consumeIf(TokenType.MINUS)) {
      return AstNode.of(AstType.NEGATE, parseUnaryExpr());
    }
    return parseUnionExpr();
  }

  /**
   * [18] UnionExpr ::= PathExpr | UnionExpr '|' PathExpr.
   */
  private AstNode parseUnionExpr() throws XPathSyntaxException {
    AstNode left = parsePathExpr();
    while (consumeIf(TokenType.PIPE)) {
      left = AstNode.of(AstType.UNION, left, parsePathExpr());
    }
    return left;
  }

  /**
   * [19] PathExpr ::= LocationPath | FilterExpr | FilterExpr '/' RelativeLocationPath | FilterExpr
   * '//' RelativeLocationPath.
   */
  private AstNode parsePathExpr() throws XPathSyntaxException {
    if (consumeIf(TokenType.SLASH)) {
      final List<AstNode> steps = new ArrayList<>();
      if (isStepStart()) {
        parseRelativeLocationPath(steps);
      }
      return AstNode.of(AstType.ABSOLUTE_PATH, steps);
    }
    if (consumeIf(TokenType.DOUBLE_SLASH)) {
      final List<AstNode> steps = new ArrayList<>();
      steps.add(descendantOrSelf());
      parseRelativeLocationPath(steps);
      return AstNode.of(AstType.ABSOLUTE_PATH, steps);
    }
    if (isPrimaryStart()) {
      final AstNode filter = parseFilterExpr();
      final List<AstNode> steps = new ArrayList<>();
      if (consumeIf(TokenType.SLASH)) {
        parseRelativeLocationPath(steps);
      } else if (consumeIf(TokenType.DOUBLE_SLASH)) {
        steps.add(descendantOrSelf());
        parseRelativeLocationPath(steps);
      } else {
        return filter;
      }
      return AstNode.of(AstType.PATH, filter, AstNode.of(AstType.RELATIVE_PATH, steps));
    }
    final List<AstNode> steps = new ArrayList<>();
    parseRelativeLocationPath(steps);
    return AstNode.of(AstType.RELATIVE_PATH, steps);
  }

  /**
   * [3] RelativeLocationPath ::= Step | RelativeLocationPath '/' Step | RelativeLocationPath '//'
   * Step.
   */
  private void parseRelativeLocationPath(final List<AstNode> steps) throws XPathSyntaxException {
    steps.add(parseStep());
    while (true) {
      if (consumeIf(TokenType.SLASH)) {
        steps.add(parseStep());
      } else if (consumeIf(TokenType.DOUBLE_SLASH)) {
        steps.add(descendantOrSelf());
        steps.add(parseStep());
      } else {
        return;
      }
    }
  }

  /**
   * [4] Step ::= AxisSpecifier NodeTest Predicate* | '.' | '..'.
   */
  private AstNode parseStep() throws XPathSyntaxException {
    if (consumeIf(TokenType.DOT)) {
      return step("self", nodeTypeTest("node"), new ArrayList<>());
    }
    if (consumeIf(TokenType.DOUBLE_DOT)) {
      return step("parent", nodeTypeTest("node"), new ArrayList<>());
    }

    final String axis;
    if (consumeIf(TokenType.AT)) {
      axis = "attribute";
    } else if (is(TokenType.AXIS)) {
      axis = token.getContent();
      next();
      consume(TokenType.DOUBLE_COLON);
    } else if (is(TokenType.NAME) && peek().getType() == TokenType.DOUBLE_COLON) {
      throw error("Unknown axis '" + token.getContent() + "'");
    } else {
      axis = "child";
    }

    final AstNode test = parseNodeTest();
    final List<AstNode> predicates = new ArrayList<>();
    parsePredicates(predicates);
    return step(axis, test, predicates);
  }

  /**
   * [7] NodeTest ::= NameTest | NodeType '(' ')' | 'processing-instruction' '(' Literal ')'.
   */
  private AstNode parseNodeTest() throws XPathSyntaxException {
    if (consumeIf(TokenType.STAR)) {
      return AstNode.leaf(AstType.WILDCARD, null);
    }
    if (is(TokenType.NODE_TYPE)) {
      final String type = token.getContent();
      next();
      consume(TokenType.LPAREN);
      final List<AstNode> literal = new ArrayList<>();
      if ("processing-instruction".equals(type) && is(TokenType.STRING)) {
        literal.add(AstNode.leaf(AstType.STRING, token.getContent()));
        next();
      }
      consume(TokenType.RPAREN);
      return AstNode.withValue(AstType.NODE_TYPE, type, literal);
    }
    if (isName()) {
      final String name = token.getContent();
      next();
      if (consumeIf(TokenType.COLON)) {
        if (consumeIf(TokenType.STAR)) {
          return AstNode.leaf(AstType.WILDCARD, name);
        }
        if (!isName()) {
          throw error("Expected local name after '" + name + ":' but found " + describe(token));
        }
        final String localName = token.getContent();
        next();
        return AstNode.leaf(AstType.TEST, new NameTest(name, localName));
      }
      return AstNode.leaf(AstType.TEST, new NameTest(null, name));
    }
    throw error("Expected node test but found " + describe(token));
  }

  /**
   * [8] Predicate ::= '[' PredicateExpr ']'.
   */
  private void parsePredicates(final List<AstNode> predicates) throws XPathSyntaxException {
    while (consumeIf(TokenType.LBRACKET)) {
      predicates.add(AstNode.of(AstType.PREDICATE, parseOrExpr()));
      consume(TokenType.RBRACKET);
    }
  }

  /**
   * [20] FilterExpr ::= PrimaryExpr | FilterExpr Predicate.
   */
  private AstNode parseFilterExpr() throws XPathSyntaxException {
    final AstNode primary = parsePrimaryExpr();
    final List<AstNode> children = new ArrayList<>();
    parsePredicates(children);
    if (children.isEmpty()) {
      return primary;
    }
    children.add(0, primary);
    return AstNode.of(AstType.FILTER, children);
  }

  /**
   * [15] PrimaryExpr ::= VariableReference | '(' Expr ')' | Literal | Number | FunctionCall.
   */
  private AstNode parsePrimaryExpr() throws XPathSyntaxException {
    switch (token.getType()) {
      case STRING: {
        final AstNode literal = AstNode.leaf(AstType.STRING, token.getContent());
        next();
        return literal;
      }
      case NUMBER: {
        final AstNode number =
            AstNode.leaf(AstType.NUMBER, Double.valueOf(Double.parseDouble(token.getContent())));
        next();
        return number;
      }
      case DOLLAR: {
        next();
        return AstNode.leaf(AstType.VARIABLE, parseQName("variable name"));
      }
      case LPAREN: {
        next();
        final AstNode expression = parseOrExpr();
        consume(TokenType.RPAREN);
        return expression;
      }
      default:
        return parseFunctionCall();
    }
  }

  /**
   * [16] FunctionCall ::= FunctionName '(' ( Argument ( ',' Argument )* )? ')'.
   */
  private AstNode parseFunctionCall() throws XPathSyntaxException {
    final String name = parseQName("function name");
    consume(TokenType.LPAREN);
    final List<AstNode> arguments = new ArrayList<>();
    if (!is(TokenType.RPAREN)) {
      do {
        arguments.add(parseOrExpr());
      } while (consumeIf(TokenType.COMMA));
    }
    consume(TokenType.RPAREN);
    return AstNode.withValue(AstType.FUNCTION, name, arguments);
  }

  private String parseQName(final String what) throws XPathSyntaxException {
    if (!isName()) {
      throw error("Expected " + what + " but found " + describe(token));
    }
    final String name = token.getContent();
    next();
    if (is(TokenType.COLON) && isName(peek())) {
      next();
      final String localName = token.getContent();
      next();
      return name + ':' + localName;
    }
    return name;
  }

  private static AstNode step(final String axis, final AstNode test,
      final List<AstNode> predicates) {
    final List<AstNode> children = new ArrayList<>(predicates.size() + 1);
    children.add(test);
    children.addAll(predicates);
    return AstNode.withValue(AstType.AXIS, axis, children);
  }

  private static AstNode descendantOrSelf() {
    return step("descendant-or-self", nodeTypeTest("node"), new ArrayList<>());
  }

  private static AstNode nodeTypeTest(final String type) {
    return AstNode.leaf(AstType.NODE_TYPE, type);
  }

  /**
   * A primary expression starts with a literal, a variable, a parenthesis or a function name, that
   * is a name directly followed by {@code (} or a prefixed name followed by {@code (}.
   */
  private boolean isPrimaryStart() {
    switch (token.getType()) {
      case STRING:
      case NUMBER:
      case DOLLAR:
      case LPAREN:
        return true;
      case NAME:
        final TokenType following = peek().getType();
        if (following == TokenType.LPAREN) {
          return true;
        }
        return following == TokenType.COLON && isName(peek(2))
            && peek(3).getType() == TokenType.LPAREN;
      default:
        return false;
    }
  }

  /**
   * After {@code /} an operator name is a name test, so keywords start a step as well.
   */
  private boolean isStepStart() {
    if (token.getType().isKeyword()) {
      return true;
    }
    switch (token.getType()) {
      case NAME:
      case STAR:
      case AXIS:
      case AT:
      case DOT:
      case DOUBLE_DOT:
      case NODE_TYPE:
        return true;
      default:
        return false;
    }
  }

  private boolean isName() {
    return isName(token);
  }

  private static boolean isName(final XPathToken candidate) {
    return candidate.getType() == TokenType.NAME || candidate.getType().isKeyword()
        || candidate.getType() == TokenType.NODE_TYPE;
  }

  private boolean is(final TokenType type) {
    return token.getType() == type;
  }

  private boolean consumeIf(final TokenType type) {
    if (token.getType() == type) {
      next();
      return true;
    }
    return false;
  }

  private void consume(final TokenType type) throws XPathSyntaxException {
    if (token.getType() != type) {
      throw error("Expected " + type.describe() + " but found " + describe(token));
    }
    next();
  }

  private void next() {
    if (index < tokens.size() - 1) {
      index++;
    }
    token = tokens.get(index);
  }

  private XPathToken peek() {
    return peek(1);
  }

  private XPathToken peek(final int distance) {
    return tokens.get(Math.min(index + distance, tokens.size() - 1));
  }

  private static String describe(final XPathToken candidate) {
    return candidate.getType() == TokenType.END ? "end of expression"
        : "'" + candidate.getContent() + "'";
  }

  private XPathSyntaxException error(final String message) {
    return new XPathSyntaxException(message, query, token.getOffset(),
        token.getType() == TokenType.END ? null : token.getContent());
  }
}

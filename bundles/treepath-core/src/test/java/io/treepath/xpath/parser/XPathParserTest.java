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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class XPathParserTest {

  private static String tree(final String query) throws XPathSyntaxException {
    return XPathParser.parse(query).toString();
  }

  @Test
  public void testLocationPaths() throws XPathSyntaxException {
    assertEquals("(relative-path (axis child (test a)))", tree("a"));
    assertEquals("(absolute-path (axis child (test a)) (axis child (test b)))", tree("/a/b"));
    assertEquals("(absolute-path)", tree("/"));
    assertEquals("(relative-path (axis child (test a)) (axis child (test b))"
        + " (axis descendant-or-self (node-type node)) (axis child (test c)))", tree("a/b//c"));
    assertEquals("(relative-path (axis child (node-type text)))", tree("child::text()"));
  }

  @Test
  public void testAbbreviations() throws XPathSyntaxException {
    assertEquals("(absolute-path (axis descendant-or-self (node-type node))"
        + " (axis child (test a)))", tree("//a"));
    assertEquals("(relative-path (axis attribute (test id)))", tree("@id"));
    assertEquals("(relative-path (axis self (node-type node)))", tree("."));
    assertEquals("(relative-path (axis parent (node-type node)))", tree(".."));
    assertEquals(XPathParser.parse("child::a/attribute::b"), XPathParser.parse("a/@b"));
  }

  @Test
  public void testNodeTests() throws XPathSyntaxException {
    assertEquals("(relative-path (axis child (wildcard)))", tree("*"));
    assertEquals("(relative-path (axis child (wildcard x)))", tree("x:*"));
    assertEquals("(relative-path (axis child (test x:y)))", tree("x:y"));
    assertEquals("(relative-path (axis child (node-type processing-instruction (string \"p\"))))",
        tree("processing-instruction('p')"));
    assertEquals("(absolute-path (axis child (test and)))", tree("/and"));

    final AstNode test = XPathParser.parse("x:y").getChild(0).getChild(0);
    assertEquals(AstType.TEST, test.getType());
    assertEquals(new NameTest("x", "y"), test.getValue());
  }

  @Test
  public void testPredicates() throws XPathSyntaxException {
    assertEquals("(relative-path (axis child (test a) (predicate (number 1.0))))", tree("a[1]"));
    assertEquals("(relative-path (axis child (test a) (predicate (relative-path"
        + " (axis attribute (test id)))) (predicate (function last))))", tree("a[@id][last()]"));
  }

  @Test
  public void testFilterAndPath() throws XPathSyntaxException {
    assertEquals("(filter (absolute-path (axis descendant-or-self (node-type node))"
        + " (axis child (test a))) (predicate (number 2.0)))", tree("(//a)[2]"));
    assertEquals("(path (relative-path (axis child (test a)))"
        + " (relative-path (axis child (test b))))", tree("(a)/b"));
    assertEquals("(path (function id (string \"b1\")) (relative-path"
        + " (axis descendant-or-self (node-type node)) (axis child (test title))))",
        tree("id('b1')//title"));
  }

  @Test
  public void testOperatorPrecedence() throws XPathSyntaxException {
    assertEquals("(plus (number 1.0) (star (number 2.0) (number 3.0)))", tree("1 + 2 * 3"));
    assertEquals("(minus (minus (number 5.0) (number 2.0)) (number 1.0))", tree("5 - 2 - 1"));
    assertEquals("(or (relative-path (axis child (test a))) (and (relative-path"
        + " (axis child (test b))) (relative-path (axis child (test c)))))", tree("a or b and c"));
    assertEquals("(eq (lt (number 1.0) (number 2.0)) (function true))", tree("1 < 2 = true()"));
    assertEquals("(mod (number 7.0) (number 3.0))", tree("7 mod 3"));
    assertEquals("(negate (relative-path (axis child (test a))))", tree("-a"));
    assertEquals("(union (relative-path (axis child (test a)))"
        + " (relative-path (axis child (test b))))", tree("a | b"));
  }

  @Test
  public void testPrimaryExpressions() throws XPathSyntaxException {
    assertEquals("(string \"s\")", tree("'s'"));
    assertEquals("(number 0.5)", tree(".5"));
    assertEquals("(variable x)", tree("$x"));
    assertEquals("(variable p:x)", tree("$p:x"));
    assertEquals("(function concat (string \"a\") (number 1.0))", tree("concat('a', 1)"));
    assertEquals("(function ns:f (number 1.0))", tree("ns:f(1)"));
    assertEquals("(function unknown)", tree("unknown()"));
  }

  @Test
  public void testEmptyQuery() throws XPathSyntaxException {
    assertEquals(AstType.EMPTY, XPathParser.parse("").getType());
    assertEquals("(empty)", tree("  "));
    assertTrue(AstType.EMPTY.returnsNodeSet());
    assertFalse(AstType.STRING.returnsNodeSet());
  }

  @Test
  public void testStructuralEquality() throws XPathSyntaxException {
    final AstNode first = XPathParser.parse("//a[@x = 1]");
    final AstNode second = XPathParser.parse(" // a [ @x=1 ] ");
    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertNotEquals(first, XPathParser.parse("//a[@x = 2]"));
  }

  @Test
  public void testUnknownAxis() {
    final XPathSyntaxException e =
        assertThrows(XPathSyntaxException.class, () -> XPathParser.parse("foo::a"));
    assertEquals("Unknown axis 'foo'", e.getReason());
    assertEquals(0, e.getPosition());
  }

  @Test
  public void testTrailingTokens() {
    final XPathSyntaxException e =
        assertThrows(XPathSyntaxException.class, () -> XPathParser.parse("a b"));
    assertEquals("b", e.getToken());
    assertEquals(2, e.getPosition());
    assertEquals("a b", e.getExpression());
  }

  @Test
  public void testIncompleteExpressions() {
    assertThrows(XPathSyntaxException.class, () -> XPathParser.parse("a["));
    assertThrows(XPathSyntaxException.class, () -> XPathParser.parse("a[1"));
    assertThrows(XPathSyntaxException.class, () -> XPathParser.parse("count(a"));
    assertThrows(XPathSyntaxException.class, () -> XPathParser.parse("1 +"));
    assertThrows(XPathSyntaxException.class, () -> XPathParser.parse("//"));
    assertThrows(XPathSyntaxException.class, () -> XPathParser.parse("x:"));
    final XPathSyntaxException e =
        assertThrows(XPathSyntaxException.class, () -> XPathParser.parse("a/"));
    assertEquals("Expected node test but found end of expression", e.getReason());
  }
}

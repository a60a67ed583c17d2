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

package io.treepath.xpath.runtime;

import com.google.common.collect.ImmutableMap;
import io.treepath.XmlTestHelper;
import io.treepath.api.NodeSet;
import io.treepath.api.XmlNode;
import io.treepath.exception.TreepathException;
import io.treepath.exception.XPathEvaluationException;
import io.treepath.exception.XPathException;
import io.treepath.exception.XPathFunctionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FunctionsTest {

  private XmlNode library;

  private EvaluationContext context;

  @BeforeEach
  public void setUp() throws TreepathException {
    library = XmlTestHelper.documentElement(XmlTestHelper.parse(XmlTestHelper.LIBRARY));
    context = EvaluationContext.of(library, ImmutableMap.of());
  }

  private Object call(final FuncDef function, final Object... args) throws XPathException {
    return Functions.call(function, context, args);
  }

  @Test
  public void testResolve() throws XPathFunctionException {
    assertSame(FuncDef.SUBSTRING, FuncDef.resolve("substring", 2));
    assertSame(FuncDef.CONCAT, FuncDef.resolve("concat", 5));
    assertNull(FuncDef.fromName("upper-case"));

    final XPathFunctionException unknown =
        assertThrows(XPathFunctionException.class, () -> FuncDef.resolve("upper-case", 1));
    assertEquals("Unknown function: upper-case()", unknown.getReason());
    assertEquals("upper-case", unknown.getFunctionName());

    final XPathFunctionException arity =
        assertThrows(XPathFunctionException.class, () -> FuncDef.resolve("substring", 1));
    assertEquals("substring() expects 2 to 3 arguments but got 1", arity.getReason());
    assertEquals(1, arity.getArgumentCount());

    assertEquals("concat() expects at least 2 arguments but got 1",
        assertThrows(XPathFunctionException.class, () -> FuncDef.resolve("concat", 1))
            .getReason());
    assertEquals("true() expects 0 arguments but got 1",
        assertThrows(XPathFunctionException.class, () -> FuncDef.resolve("true", 1))
            .getReason());
  }

  @Test
  public void testStringFunctions() throws XPathException {
    assertEquals("ab1", call(FuncDef.CONCAT, "a", "b", 1d));
    assertEquals(true, call(FuncDef.STARTS_WITH, "treepath", "tree"));
    assertEquals(false, call(FuncDef.CONTAINS, "treepath", "xml"));
    assertEquals("1999", call(FuncDef.SUBSTRING_BEFORE, "1999/04/01", "/"));
    assertEquals("04/01", call(FuncDef.SUBSTRING_AFTER, "1999/04/01", "/"));
    assertEquals("", call(FuncDef.SUBSTRING_AFTER, "1999", "-"));
    assertEquals("BAr", call(FuncDef.TRANSLATE, "bar", "ab", "AB"));
    assertEquals("AAA", call(FuncDef.TRANSLATE, "--aaa--", "abc-", "ABC"));
    assertEquals("a b c", call(FuncDef.NORMALIZE_SPACE, "  a \t b\n c "));
    assertEquals(4d, call(FuncDef.STRING_LENGTH, "four"));
    assertEquals(21d, call(FuncDef.STRING_LENGTH));
  }

  @Test
  public void testSubstring() {
    assertEquals("234", Functions.substring("12345", 1.5d, 2.6d));
    assertEquals("12", Functions.substring("12345", 0d, 3d));
    assertEquals("", Functions.substring("12345", Double.NaN, 3d));
    assertEquals("", Functions.substring("12345", 1d, Double.NaN));
    assertEquals("12345", Functions.substring("12345", -42d, Double.POSITIVE_INFINITY));
    assertEquals("", Functions.substring("12345", Double.NEGATIVE_INFINITY,
        Double.POSITIVE_INFINITY));
    assertEquals("345", Functions.substring("12345", 3d, Double.POSITIVE_INFINITY));
  }

  @Test
  public void testRound() {
    assertEquals(3d, Functions.round(2.5d));
    assertEquals(-2d, Functions.round(-2.5d));
    assertEquals(Double.doubleToLongBits(-0d), Double.doubleToLongBits(Functions.round(-0.4d)));
    assertTrue(Double.isNaN(Functions.round(Double.NaN)));
    assertEquals(Double.POSITIVE_INFINITY, Functions.round(Double.POSITIVE_INFINITY));
  }

  @Test
  public void testNumberFunctions() throws XPathException {
    assertEquals(2d, call(FuncDef.FLOOR, 2.7d));
    assertEquals(3d, call(FuncDef.CEILING, 2.1d));
    assertEquals(12d, call(FuncDef.NUMBER, " 12 "));
    assertTrue(Double.isNaN((Double) call(FuncDef.NUMBER)));
  }

  @Test
  public void testBooleanFunctions() throws XPathException {
    assertEquals(true, call(FuncDef.TRUE));
    assertEquals(false, call(FuncDef.FALSE));
    assertEquals(false, call(FuncDef.NOT, "x"));
    assertEquals(false, call(FuncDef.BOOLEAN, NodeSet.empty()));
    assertEquals(true, call(FuncDef.BOOLEAN, 0.1d));
  }

  @Test
  public void testNodeSetFunctions() throws XPathException {
    final NodeSet books = NodeSet.copyOf(library.getChildren());
    assertEquals(3d, call(FuncDef.COUNT, books));
    assertEquals("library", call(FuncDef.NAME));
    assertEquals("book", call(FuncDef.LOCAL_NAME, books));
    assertEquals("", call(FuncDef.NAME, NodeSet.empty()));
    assertEquals("", call(FuncDef.NAMESPACE_URI));
  }

  @Test
  public void testSum() throws XPathException {
    final NodeSet prices = NodeSet.copyOf(List.of(
        library.getChildren().get(0).getChildren().get(1),
        library.getChildren().get(1).getChildren().get(1),
        library.getChildren().get(2).getChildren().get(1)));
    assertEquals(40d, call(FuncDef.SUM, prices));
    assertTrue(Double.isNaN((Double) call(FuncDef.SUM, NodeSet.copyOf(library.getChildren()))));
  }

  @Test
  public void testId() throws XPathException {
    final NodeSet selected = (NodeSet) call(FuncDef.ID, "b3 missing  b1");
    assertEquals(2, selected.size());
    assertEquals("b1", selected.item(1).getAttributeValue("id"));
    assertEquals("b3", selected.item(2).getAttributeValue("id"));
    assertTrue(((NodeSet) call(FuncDef.ID, "  ")).isEmpty());
  }

  @Test
  public void testContextFunctionsNeedPredicate() {
    final XPathEvaluationException e =
        assertThrows(XPathEvaluationException.class, () -> call(FuncDef.POSITION));
    assertEquals("position() can only be used in a predicate", e.getReason());
    assertThrows(XPathEvaluationException.class, () -> call(FuncDef.LAST));
  }

  @Test
  public void testContextFunctionsInPredicate() throws XPathException {
    final EvaluationContext predicate = context.forPredicate(library, 2, 5);
    assertEquals(2d, Functions.call(FuncDef.POSITION, predicate, new Object[0]));
    assertEquals(5d, Functions.call(FuncDef.LAST, predicate, new Object[0]));
  }

  @Test
  public void testLang() throws TreepathException, XPathException {
    final XmlNode doc = XmlTestHelper.documentElement(XmlTestHelper.parse(XmlTestHelper.MIXED));
    final EvaluationContext paragraph =
        EvaluationContext.of(doc.getChildren().get(0), ImmutableMap.of());
    assertEquals(true, Functions.call(FuncDef.LANG, paragraph, new Object[] { "en" }));
    assertEquals(true, Functions.call(FuncDef.LANG, paragraph, new Object[] { "EN-gb" }));
    assertEquals(false, Functions.call(FuncDef.LANG, paragraph, new Object[] { "de" }));
    assertFalse((Boolean) Functions.call(FuncDef.LANG, context, new Object[] { "en" }));
  }
}

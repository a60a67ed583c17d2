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

package io.treepath.xpath.codegen;

import com.google.common.collect.ImmutableMap;
import io.treepath.exception.XPathEvaluationException;
import io.treepath.exception.XPathException;
import io.treepath.exception.XPathFunctionException;
import io.treepath.xpath.compiler.CompilationContext;
import io.treepath.xpath.parser.XPathParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.treepath.xpath.codegen.CodeNode.literal;
import static io.treepath.xpath.codegen.CodeNode.returns;
import static io.treepath.xpath.codegen.CodeNode.sequence;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QueryLoweringTest {

  private final JavaSourceGenerator generator = new JavaSourceGenerator();

  private static LoweredQuery lower(final String query) throws XPathException {
    return lower(query, ImmutableMap.of());
  }

  private static LoweredQuery lower(final String query, final Map<String, String> namespaces)
      throws XPathException {
    return QueryLowering.lower(XPathParser.parse(query), new CompilationContext(namespaces, query));
  }

  @Test
  public void testLiteral() throws XPathException {
    final LoweredQuery lowered = lower("1");
    assertTrue(lowered.fields().isEmpty());
    assertEquals(sequence(returns(literal(1d))), lowered.body());
  }

  @Test
  public void testStepsBecomeLoops() throws XPathException {
    final LoweredQuery lowered = lower("/a");
    assertEquals(1, lowered.fields().size());
    final String body = generator.render(lowered.body());
    assertTrue(body.contains("= Steps.rootNode(context);"), body);
    assertTrue(body.contains(": Axes.select(Axis.CHILD, node"), body);
    assertTrue(body.contains(".matches(candidate"), body);
    assertTrue(body.contains("= NodeSet.sorted(selected"), body);
  }

  @Test
  public void testHoistedConstantsAreDeclaredBeforeUse() throws XPathException {
    final LoweredQuery lowered = lower("//a[b][1]");
    final List<CodeNode> fields = lowered.fields();
    // descendant-or-self test, a test, b test, predicate [b], predicate [1]
    assertEquals(5, fields.size());
    assertEquals(CodeType.CALL, fields.get(0).getChild(1).getType());
    assertTrue(fields.get(1).getName().startsWith("TEST_"));
    assertTrue(fields.get(2).getName().startsWith("TEST_"));
    assertTrue(fields.get(3).getName().startsWith("PREDICATE_"));
    assertEquals(CodeType.LAMBDA, fields.get(3).getChild(1).getType());
    assertTrue(fields.get(4).getName().startsWith("PREDICATE_"));

    // the predicate [b] refers to the test hoisted before it
    final String predicate = generator.renderExpression(fields.get(3).getChild(1));
    assertTrue(predicate.contains(fields.get(2).getName() + ".matches("), predicate);
    assertTrue(generator.render(lowered.body()).contains("Steps.predicateMatches("));
  }

  @Test
  public void testNameTestCarriesNamespace() throws XPathException {
    final LoweredQuery lowered = lower("x:e/@id", ImmutableMap.of("x", "urn:x"));
    assertEquals("NodeTest.name(NodeKind.ELEMENT, \"x\", \"urn:x\", \"e\")",
        generator.renderExpression(lowered.fields().get(0).getChild(1)));
    assertEquals("NodeTest.name(NodeKind.ATTRIBUTE, null, null, \"id\")",
        generator.renderExpression(lowered.fields().get(1).getChild(1)));
  }

  @Test
  public void testFunctionsAndOperators() throws XPathException {
    final String body = generator.render(lower("count(a) + 1 > 2 or true()").body());
    assertTrue(body.contains("Functions.call(FuncDef.COUNT, context, new Object[] {"), body);
    assertTrue(body.contains("Operators.plus("), body);
    assertTrue(body.contains("Operators.greaterThan("), body);
    assertTrue(body.contains("if (!Conversion.toBoolean("), body);
    assertTrue(body.contains("Functions.call(FuncDef.TRUE, context, new Object[] {})"), body);
  }

  @Test
  public void testStaticErrors() {
    final XPathFunctionException e =
        assertThrows(XPathFunctionException.class, () -> lower("nope(1)"));
    assertEquals("nope(1)", e.getExpression());
    assertThrows(XPathEvaluationException.class, () -> lower("namespace::x"));
  }
}

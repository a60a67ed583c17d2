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

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.treepath.xpath.codegen.CodeNode.array;
import static io.treepath.xpath.codegen.CodeNode.assign;
import static io.treepath.xpath.codegen.CodeNode.call;
import static io.treepath.xpath.codegen.CodeNode.constant;
import static io.treepath.xpath.codegen.CodeNode.count;
import static io.treepath.xpath.codegen.CodeNode.declare;
import static io.treepath.xpath.codegen.CodeNode.each;
import static io.treepath.xpath.codegen.CodeNode.ifThen;
import static io.treepath.xpath.codegen.CodeNode.ifThenElse;
import static io.treepath.xpath.codegen.CodeNode.lambda;
import static io.treepath.xpath.codegen.CodeNode.literal;
import static io.treepath.xpath.codegen.CodeNode.newInstance;
import static io.treepath.xpath.codegen.CodeNode.returns;
import static io.treepath.xpath.codegen.CodeNode.sequence;
import static io.treepath.xpath.codegen.CodeNode.var;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JavaSourceGeneratorTest {

  private final JavaSourceGenerator generator = new JavaSourceGenerator();

  @Test
  public void testLiterals() {
    assertEquals("\"a\\\"b\\n\"", generator.renderExpression(literal("a\"b\n")));
    assertEquals("\"\\u00e9\"", generator.renderExpression(literal("\u00e9")));
    assertEquals("1.0d", generator.renderExpression(literal(1d)));
    assertEquals("Double.NaN", generator.renderExpression(literal(Double.NaN)));
    assertEquals("Double.NEGATIVE_INFINITY",
        generator.renderExpression(literal(Double.NEGATIVE_INFINITY)));
    assertEquals("null", generator.renderExpression(literal(null)));
    assertEquals("true", generator.renderExpression(literal(true)));
  }

  @Test
  public void testExpressions() {
    assertEquals("Steps.rootNode(context)",
        generator.renderExpression(call(constant("Steps"), "rootNode", var("context"))));
    assertEquals("new ArrayList<>()", generator.renderExpression(newInstance("ArrayList<>")));
    assertEquals("new Object[] {}", generator.renderExpression(array("Object", List.of())));
    assertEquals("new Object[] { a, 2.0d }",
        generator.renderExpression(array("Object", List.of(var("a"), literal(2d)))));
    assertEquals("ctx -> {\n  return true;\n}",
        generator.renderExpression(lambda("ctx", sequence(returns(literal(true))))));
  }

  @Test
  public void testStatements() {
    assertEquals("NodeSet nodes = NodeSet.empty();\n",
        generator.render(declare("NodeSet", "nodes", call(constant("NodeSet"), "empty"))));
    assertEquals("x = 1.0d;\n", generator.render(assign("x", literal(1d))));
    assertEquals("list.clear();\n", generator.render(call(var("list"), "clear")));
    assertEquals("for (final XmlNode x : nodes) {\n  list.add(x);\n}\n",
        generator.render(each("XmlNode", "x", var("nodes"),
            sequence(call(var("list"), "add", var("x"))))));
    assertEquals("for (int i = 1; i <= n.size(); i++) {\n  s.item(i);\n}\n",
        generator.render(count("i", call(var("n"), "size"),
            sequence(call(var("s"), "item", var("i"))))));
  }

  @Test
  public void testConditionals() {
    assertEquals("if (c) {\n  x = 1.0d;\n}\n",
        generator.render(ifThen(var("c"), sequence(assign("x", literal(1d))))));
    assertEquals("if (c) {\n  x = 1.0d;\n} else {\n  x = 2.0d;\n}\n",
        generator.render(ifThenElse(var("c"), sequence(assign("x", literal(1d))),
            sequence(assign("x", literal(2d))))));
    assertEquals("if (!c) {\n  x = 2.0d;\n}\n",
        generator.render(ifThenElse(var("c"), sequence(), sequence(assign("x", literal(2d))))));
  }

  @Test
  public void testNestedBlocksAreIndented() {
    final CodeNode loop = each("XmlNode", "n", var("nodes"),
        sequence(ifThen(var("c"), sequence(returns(var("n"))))));
    assertEquals("x = 1.0d;\nfor (final XmlNode n : nodes) {\n  if (c) {\n    return n;\n  }\n}\n",
        generator.render(sequence(assign("x", literal(1d)), loop)));
  }

  @Test
  public void testMisplacedNodes() {
    assertThrows(IllegalStateException.class, () -> generator.render(var("x")));
    assertThrows(IllegalStateException.class,
        () -> generator.renderExpression(returns(literal(1d))));
    assertThrows(IllegalStateException.class,
        () -> generator.renderExpression(literal(new Object())));
  }

  @Test
  public void testRenderClass() {
    final LoweredQuery query = new LoweredQuery(
        List.of(declare("NodeTest", "TEST_1", call(constant("NodeTest"), "anyNode"))),
        sequence(returns(literal(1d))));
    final String source = generator.renderClass("Example", query);
    assertTrue(source.startsWith("package io.treepath.generated;\n"));
    assertTrue(source.contains("import io.treepath.xpath.runtime.Evaluator;\n"));
    assertTrue(source.contains("public final class Example implements Evaluator {\n"));
    assertTrue(source.contains("  private static final NodeTest TEST_1 = NodeTest.anyNode();\n"));
    assertTrue(source.contains(
        "  public Object evaluate(final EvaluationContext context) throws XPathException {\n"
            + "    return 1.0d;\n  }\n}\n"));
  }
}

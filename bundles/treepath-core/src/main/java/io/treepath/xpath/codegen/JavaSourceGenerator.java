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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Renders a generated-code tree as Java source. Rendering is purely syntactic; there is one rule
 * per {@link CodeType}, split into statement and expression positions.
 */
public final class JavaSourceGenerator {

  /** Package of generated classes. */
  public static final String PACKAGE = "io.treepath.generated";

  /** Imports of every generated compilation unit. */
  private static final ImmutableList<String> IMPORTS = ImmutableList.of("io.treepath.api.NodeKind",
      "io.treepath.api.NodeSet", "io.treepath.api.XmlNode",
      "io.treepath.exception.XPathException", "io.treepath.xpath.runtime.Axes",
      "io.treepath.xpath.runtime.Axis", "io.treepath.xpath.runtime.Conversion",
      "io.treepath.xpath.runtime.EvaluationContext", "io.treepath.xpath.runtime.Evaluator",
      "io.treepath.xpath.runtime.FuncDef", "io.treepath.xpath.runtime.Functions",
      "io.treepath.xpath.runtime.NodeTest", "io.treepath.xpath.runtime.Operators",
      "io.treepath.xpath.runtime.Steps", "java.util.ArrayList", "java.util.List");

  private static final String INDENT = "  ";

  /**
   * Render a compilation unit with a class implementing
   * {@link io.treepath.xpath.runtime.Evaluator}.
   *
   * @param simpleName the simple class name
   * @param query the lowered query
   * @return the source of the compilation unit
   */
  public String renderClass(final String simpleName, final LoweredQuery query) {
    final StringBuilder out = new StringBuilder();
    out.append("package ").append(PACKAGE).append(";\n\n");
    for (final String anImport : IMPORTS) {
      out.append("import ").append(anImport).append(";\n");
    }
    out.append("\npublic final class ").append(simpleName).append(" implements Evaluator {\n");
    for (final CodeNode field : query.fields()) {
      checkArgument(field.getType() == CodeType.DECLARE, "Not a declaration: %s", field);
      out.append('\n').append(INDENT).append("private static final ");
      statement(field, 1, out, false);
    }
    out.append('\n').append(INDENT).append("@Override\n");
    out.append(INDENT)
       .append("public Object evaluate(final EvaluationContext ")
       .append(QueryLowering.CONTEXT)
       .append(") throws XPathException {\n");
    block(query.body(), 2, out);
    out.append(INDENT).append("}\n}\n");
    return out.toString();
  }

  /**
   * Render a statement or a block.
   *
   * @param node the node
   * @return the source, statements end with a newline
   */
  public String render(final CodeNode node) {
    final StringBuilder out = new StringBuilder();
    if (node.getType() == CodeType.SEQUENCE) {
      block(node, 0, out);
    } else {
      statement(node, 0, out, true);
    }
    return out.toString();
  }

  /**
   * Render an expression.
   *
   * @param node the node
   * @return the source
   * @throws IllegalStateException if the node is a statement
   */
  public String renderExpression(final CodeNode node) {
    final StringBuilder out = new StringBuilder();
    expression(node, 0, out);
    return out.toString();
  }

  private void block(final CodeNode sequence, final int depth, final StringBuilder out) {
    checkArgument(sequence.getType() == CodeType.SEQUENCE, "Not a block: %s", sequence);
    for (final CodeNode statement : sequence.getChildren()) {
      statement(statement, depth, out, true);
    }
  }

  private void statement(final CodeNode node, final int depth, final StringBuilder out,
      final boolean indent) {
    if (indent) {
      out.append(Strings.repeat(INDENT, depth));
    }
    switch (node.getType()) {
      case DECLARE -> {
        out.append(node.getChild(0).getName()).append(' ').append(node.getName()).append(" = ");
        expression(node.getChild(1), depth, out);
        out.append(";\n");
      }
      case ASSIGN -> {
        out.append(node.getName()).append(" = ");
        expression(node.getChild(0), depth, out);
        out.append(";\n");
      }
      case RETURN -> {
        out.append("return ");
        expression(node.getChild(0), depth, out);
        out.append(";\n");
      }
      case CALL, NEW -> {
        expression(node, depth, out);
        out.append(";\n");
      }
      case IF -> ifStatement(node, depth, out);
      case EACH -> {
        out.append("for (final ").append(node.getChild(0).getName()).append(' ')
           .append(node.getName()).append(" : ");
        expression(node.getChild(1), depth, out);
        out.append(") {\n");
        block(node.getChild(2), depth + 1, out);
        out.append(Strings.repeat(INDENT, depth)).append("}\n");
      }
      case COUNT -> {
        final String counter = node.getName();
        out.append("for (int ").append(counter).append(" = 1; ").append(counter).append(" <= ");
        expression(node.getChild(0), depth, out);
        out.append("; ").append(counter).append("++) {\n");
        block(node.getChild(1), depth + 1, out);
        out.append(Strings.repeat(INDENT, depth)).append("}\n");
      }
      case SEQUENCE -> {
        out.append("{\n");
        block(node, depth + 1, out);
        out.append(Strings.repeat(INDENT, depth)).append("}\n");
      }
      case LITERAL, VAR, CONST, ARRAY, LAMBDA ->
          throw new IllegalStateException("Not a statement: " + node.getType());
    }
  }

  private void ifStatement(final CodeNode node, final int depth, final StringBuilder out) {
    final List<CodeNode> children = node.getChildren();
    final boolean emptyThen = children.get(1).getChildren().isEmpty();
    if (emptyThen && children.size() == 3) {
      // if (!cond) { else }
      out.append("if (!");
      expression(children.get(0), depth, out);
      out.append(") {\n");
      block(children.get(2), depth + 1, out);
      out.append(Strings.repeat(INDENT, depth)).append("}\n");
      return;
    }
    out.append("if (");
    expression(children.get(0), depth, out);
    out.append(") {\n");
    block(children.get(1), depth + 1, out);
    out.append(Strings.repeat(INDENT, depth)).append('}');
    if (children.size() == 3 && !children.get(2).getChildren().isEmpty()) {
      out.append(" else {\n");
      block(children.get(2), depth + 1, out);
      out.append(Strings.repeat(INDENT, depth)).append('}');
    }
    out.append('\n');
  }

  private void expression(final CodeNode node, final int depth, final StringBuilder out) {
    switch (node.getType()) {
      case LITERAL -> literal(node.getValue(), out);
      case VAR, CONST -> out.append(node.getName());
      case CALL -> {
        expression(node.getChild(0), depth, out);
        out.append('.').append(node.getName());
        arguments(node.getChildren().subList(1, node.getChildren().size()), depth, out);
      }
      case NEW -> {
        out.append("new ").append(node.getName());
        arguments(node.getChildren(), depth, out);
      }
      case ARRAY -> {
        out.append("new ").append(node.getName()).append("[] {");
        final List<CodeNode> elements = node.getChildren();
        for (int i = 0; i < elements.size(); i++) {
          out.append(i == 0 ? " " : ", ");
          expression(elements.get(i), depth, out);
        }
        out.append(elements.isEmpty() ? "}" : " }");
      }
      case LAMBDA -> {
        out.append(node.getName()).append(" -> {\n");
        block(node.getChild(0), depth + 1, out);
        out.append(Strings.repeat(INDENT, depth)).append('}');
      }
      case DECLARE, ASSIGN, SEQUENCE, IF, EACH, COUNT, RETURN ->
          throw new IllegalStateException("Not an expression: " + node.getType());
    }
  }

  private void arguments(final List<CodeNode> arguments, final int depth,
      final StringBuilder out) {
    out.append('(');
    for (int i = 0; i < arguments.size(); i++) {
      if (i > 0) {
        out.append(", ");
      }
      expression(arguments.get(i), depth, out);
    }
    out.append(')');
  }

  private static void literal(final Object value, final StringBuilder out) {
    if (value == null) {
      out.append("null");
    } else if (value instanceof String string) {
      quote(string, out);
    } else if (value instanceof Double number) {
      if (number.isNaN()) {
        out.append("Double.NaN");
      } else if (number.isInfinite()) {
        out.append(number > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY");
      } else {
        out.append(number.doubleValue()).append('d');
      }
    } else if (value instanceof Boolean || value instanceof Integer) {
      out.append(value);
    } else {
      throw new IllegalStateException("Unsupported literal: " + value.getClass().getName());
    }
  }

  private static void quote(final String value, final StringBuilder out) {
    out.append('"');
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      switch (c) {
        case '"' -> out.append("\\\"");
        case '\\' -> out.append("\\\\");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        default -> {
          if (c < 0x20 || c > 0x7e) {
            out.append(String.format("\\u%04x", (int) c));
          } else {
            out.append(c);
          }
        }
      }
    }
    out.append('"');
  }
}

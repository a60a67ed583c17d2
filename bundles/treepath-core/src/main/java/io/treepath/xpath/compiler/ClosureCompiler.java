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

package io.treepath.xpath.compiler;

import io.treepath.api.NodeSet;
import io.treepath.exception.XPathException;
import io.treepath.xpath.ast.AstNode;
import io.treepath.xpath.ast.AstType;
import io.treepath.xpath.ast.NameTest;
import io.treepath.xpath.runtime.Axis;
import io.treepath.xpath.runtime.Conversion;
import io.treepath.xpath.runtime.EvaluationContext;
import io.treepath.xpath.runtime.Evaluator;
import io.treepath.xpath.runtime.FuncDef;
import io.treepath.xpath.runtime.Functions;
import io.treepath.xpath.runtime.NodeTest;
import io.treepath.xpath.runtime.Operators;
import io.treepath.xpath.runtime.Steps;

import java.util.List;

/**
 * Compiles a syntax tree into nested {@link Evaluator} closures. Every node type has one rule;
 * the closure of a node captures the closures of its children. Static errors such as unknown
 * functions or the namespace axis are reported while compiling.
 */
public final class ClosureCompiler {

  /**
   * Compile an expression.
   *
   * @param ast the syntax tree
   * @param context the compilation context
   * @return the evaluator
   * @throws XPathException for static errors
   * @throws IllegalStateException if a node appears where it has no meaning on its own
   */
  public Evaluator compile(final AstNode ast, final CompilationContext context)
      throws XPathException {
    return switch (ast.getType()) {
      case ABSOLUTE_PATH -> path(Steps::rootNode, ast.getChildren(), context);
      case RELATIVE_PATH -> path(Steps::contextNode, ast.getChildren(), context);
      case AXIS -> path(Steps::contextNode, List.of(ast), context);
      case PATH -> onPath(ast, context);
      case FILTER -> onFilter(ast, context);
      case STRING -> constant(ast.getStringValue());
      case NUMBER -> constant(ast.getValue());
      case VARIABLE -> onVariable(ast.getStringValue());
      case FUNCTION -> onFunction(ast, context);
      case UNION -> binary(ast, context, Operators::union);
      case AND -> onAnd(ast, context);
      case OR -> onOr(ast, context);
      case EQ -> binary(ast, context, Operators::equal);
      case NEQ -> binary(ast, context, Operators::notEqual);
      case LT -> binary(ast, context, Operators::lessThan);
      case GT -> binary(ast, context, Operators::greaterThan);
      case LTE -> binary(ast, context, Operators::lessThanOrEqual);
      case GTE -> binary(ast, context, Operators::greaterThanOrEqual);
      case PLUS -> binary(ast, context, Operators::plus);
      case MINUS -> binary(ast, context, Operators::minus);
      case STAR -> binary(ast, context, Operators::multiply);
      case DIV -> binary(ast, context, Operators::divide);
      case MOD -> binary(ast, context, Operators::modulo);
      case NEGATE -> onNegate(ast, context);
      case EMPTY -> constant(NodeSet.empty());
      case TEST, WILDCARD, NODE_TYPE, PREDICATE ->
          throw new IllegalStateException("No compilation rule for a standalone " + ast.getType()
              + " node: " + ast);
    };
  }

  /** Evaluates a binary operator on the values of both operands. */
  @FunctionalInterface
  private interface BinaryOperation {
    Object apply(Object left, Object right) throws XPathException;
  }

  /** Produces the node-set a path starts with. */
  @FunctionalInterface
  private interface PathStart {
    NodeSet start(EvaluationContext context) throws XPathException;
  }

  private Evaluator binary(final AstNode ast, final CompilationContext context,
      final BinaryOperation operation) throws XPathException {
    final Evaluator left = compile(ast.getChild(0), context);
    final Evaluator right = compile(ast.getChild(1), context);
    return ctx -> operation.apply(left.evaluate(ctx), right.evaluate(ctx));
  }

  private static Evaluator constant(final Object value) {
    return ctx -> value;
  }

  private Evaluator path(final PathStart start, final List<AstNode> steps,
      final CompilationContext context) throws XPathException {
    final CompiledStep[] compiled = new CompiledStep[steps.size()];
    for (int i = 0; i < compiled.length; i++) {
      compiled[i] = onStep(steps.get(i), context);
    }
    return ctx -> {
      NodeSet nodes = start.start(ctx);
      for (final CompiledStep step : compiled) {
        nodes = Steps.step(nodes, step.axis(), step.test(), step.predicates(), ctx);
      }
      return nodes;
    };
  }

  private Evaluator onPath(final AstNode ast, final CompilationContext context)
      throws XPathException {
    final Evaluator filter = compile(ast.getChild(0), context);
    return path(ctx -> Steps.pathStart(filter.evaluate(ctx)),
        ast.getChild(1).getChildren(), context);
  }

  private Evaluator onFilter(final AstNode ast, final CompilationContext context)
      throws XPathException {
    final Evaluator primary = compile(ast.getChild(0), context);
    final Evaluator[] predicates =
        predicates(ast.getChildren().subList(1, ast.getChildren().size()), context);
    return ctx -> Steps.filter(primary.evaluate(ctx), predicates, ctx);
  }

  private CompiledStep onStep(final AstNode step, final CompilationContext context)
      throws XPathException {
    if (step.getType() != AstType.AXIS) {
      throw new IllegalStateException("Not a step: " + step);
    }
    final Axis axis = context.resolveAxis(step);
    final NodeTest test = nodeTest(step.getChild(0), axis, context);
    final Evaluator[] predicates =
        predicates(step.getChildren().subList(1, step.getChildren().size()), context);
    return new CompiledStep(axis, test, predicates);
  }

  private Evaluator[] predicates(final List<AstNode> predicates,
      final CompilationContext context) throws XPathException {
    final Evaluator[] compiled = new Evaluator[predicates.size()];
    for (int i = 0; i < compiled.length; i++) {
      final AstNode predicate = predicates.get(i);
      if (predicate.getType() != AstType.PREDICATE) {
        throw new IllegalStateException("Not a predicate: " + predicate);
      }
      compiled[i] = compile(predicate.getChild(0), context);
    }
    return compiled;
  }

  static NodeTest nodeTest(final AstNode test, final Axis axis,
      final CompilationContext context) {
    switch (test.getType()) {
      case TEST: {
        final NameTest name = (NameTest) test.getValue();
        return NodeTest.name(axis.getPrincipalKind(), name.getPrefix(),
            context.namespaceUri(name.getPrefix()), name.getLocalName());
      }
      case WILDCARD: {
        final String prefix = (String) test.getValue();
        return NodeTest.wildcard(axis.getPrincipalKind(), prefix, context.namespaceUri(prefix));
      }
      case NODE_TYPE:
        return switch (test.getStringValue()) {
          case "node" -> NodeTest.anyNode();
          case "text" -> NodeTest.text();
          case "comment" -> NodeTest.comment();
          case "processing-instruction" -> NodeTest.processingInstruction(
              test.getChildren().isEmpty() ? null : test.getChild(0).getStringValue());
          default -> throw new IllegalStateException("Unknown node type: " + test);
        };
      default:
        throw new IllegalStateException("Not a node test: " + test);
    }
  }

  private Evaluator onVariable(final String name) {
    return ctx -> ctx.getVariable(name);
  }

  private Evaluator onFunction(final AstNode ast, final CompilationContext context)
      throws XPathException {
    final FuncDef function;
    try {
      function = FuncDef.resolve(ast.getStringValue(), ast.getChildren().size());
    } catch (final XPathException e) {
      throw withExpression(e, context);
    }
    final Evaluator[] arguments = new Evaluator[ast.getChildren().size()];
    for (int i = 0; i < arguments.length; i++) {
      arguments[i] = compile(ast.getChild(i), context);
    }
    return ctx -> {
      final Object[] values = new Object[arguments.length];
      for (int i = 0; i < values.length; i++) {
        values[i] = arguments[i].evaluate(ctx);
      }
      return Functions.call(function, ctx, values);
    };
  }

  private Evaluator onAnd(final AstNode ast, final CompilationContext context)
      throws XPathException {
    final Evaluator left = compile(ast.getChild(0), context);
    final Evaluator right = compile(ast.getChild(1), context);
    return ctx -> Conversion.toBoolean(left.evaluate(ctx))
        && Conversion.toBoolean(right.evaluate(ctx));
  }

  private Evaluator onOr(final AstNode ast, final CompilationContext context)
      throws XPathException {
    final Evaluator left = compile(ast.getChild(0), context);
    final Evaluator right = compile(ast.getChild(1), context);
    return ctx -> Conversion.toBoolean(left.evaluate(ctx))
        || Conversion.toBoolean(right.evaluate(ctx));
  }

  private Evaluator onNegate(final AstNode ast, final CompilationContext context)
      throws XPathException {
    final Evaluator operand = compile(ast.getChild(0), context);
    return ctx -> Operators.negate(operand.evaluate(ctx));
  }

  private static XPathException withExpression(final XPathException e,
      final CompilationContext context) {
    final String expression = context.getExpression();
    return expression == null ? e : e.initExpression(expression);
  }

  /** A compiled location step. */
  private record CompiledStep(Axis axis, NodeTest test, Evaluator[] predicates) {
  }
}

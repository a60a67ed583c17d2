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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.treepath.exception.XPathException;
import io.treepath.xpath.ast.AstNode;
import io.treepath.xpath.ast.AstType;
import io.treepath.xpath.ast.NameTest;
import io.treepath.xpath.compiler.CompilationContext;
import io.treepath.xpath.runtime.Axis;
import io.treepath.xpath.runtime.FuncDef;

import java.util.ArrayList;
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

/**
 * Lowers a query syntax tree into a generated-code tree. Every expression is lowered into
 * statements appended to the enclosing block plus an expression holding its value. Location steps
 * become explicit loops over the axis; node tests and predicates are hoisted into constants.
 * <p>
 * A lowering is single-use: identifiers come from the {@link CompilationContext}, hoisted
 * constants are collected in the instance.
 * </p>
 */
public final class QueryLowering {

  /** Name of the context parameter of the generated method. */
  public static final String CONTEXT = "context";

  /** Operator nodes and the {@code Operators} methods implementing them. */
  private static final ImmutableMap<AstType, String> OPERATORS =
      ImmutableMap.<AstType, String>builder()
                  .put(AstType.UNION, "union")
                  .put(AstType.EQ, "equal")
                  .put(AstType.NEQ, "notEqual")
                  .put(AstType.LT, "lessThan")
                  .put(AstType.GT, "greaterThan")
                  .put(AstType.LTE, "lessThanOrEqual")
                  .put(AstType.GTE, "greaterThanOrEqual")
                  .put(AstType.PLUS, "plus")
                  .put(AstType.MINUS, "minus")
                  .put(AstType.STAR, "multiply")
                  .put(AstType.DIV, "divide")
                  .put(AstType.MOD, "modulo")
                  .build();

  private final CompilationContext context;

  /** Hoisted constants. */
  private final List<CodeNode> fields = new ArrayList<>();

  private QueryLowering(final CompilationContext context) {
    this.context = context;
  }

  /**
   * Lower a query.
   *
   * @param ast the syntax tree
   * @param context the compilation context
   * @return the lowered query
   * @throws XPathException for static errors, e.g. unknown functions
   * @throws IllegalStateException if a node appears where it has no meaning on its own
   */
  public static LoweredQuery lower(final AstNode ast, final CompilationContext context)
      throws XPathException {
    final QueryLowering lowering = new QueryLowering(context);
    final List<CodeNode> body = new ArrayList<>();
    final CodeNode result = lowering.expression(ast, CONTEXT, body);
    body.add(returns(result));
    return new LoweredQuery(ImmutableList.copyOf(lowering.fields), sequence(body));
  }

  private CodeNode expression(final AstNode ast, final String ctx, final List<CodeNode> block)
      throws XPathException {
    return switch (ast.getType()) {
      case ABSOLUTE_PATH ->
          steps(call(constant("Steps"), "rootNode", var(ctx)), ast.getChildren(), ctx, block);
      case RELATIVE_PATH ->
          steps(call(constant("Steps"), "contextNode", var(ctx)), ast.getChildren(), ctx, block);
      case AXIS -> steps(call(constant("Steps"), "contextNode", var(ctx)), List.of(ast), ctx,
          block);
      case PATH -> {
        final CodeNode start = expression(ast.getChild(0), ctx, block);
        yield steps(call(constant("Steps"), "pathStart", start), ast.getChild(1).getChildren(),
            ctx, block);
      }
      case FILTER -> onFilter(ast, ctx, block);
      case STRING -> literal(ast.getStringValue());
      case NUMBER -> literal(ast.getValue());
      case VARIABLE ->
          temporary("Object", call(var(ctx), "getVariable", literal(ast.getStringValue())), block);
      case FUNCTION -> onFunction(ast, ctx, block);
      case AND -> onAnd(ast, ctx, block);
      case OR -> onOr(ast, ctx, block);
      case UNION, EQ, NEQ, LT, GT, LTE, GTE, PLUS, MINUS, STAR, DIV, MOD -> {
        final CodeNode left = expression(ast.getChild(0), ctx, block);
        final CodeNode right = expression(ast.getChild(1), ctx, block);
        yield temporary("Object",
            call(constant("Operators"), OPERATORS.get(ast.getType()), left, right), block);
      }
      case NEGATE -> temporary("Object",
          call(constant("Operators"), "negate", expression(ast.getChild(0), ctx, block)), block);
      case EMPTY -> call(constant("NodeSet"), "empty");
      case TEST, WILDCARD, NODE_TYPE, PREDICATE ->
          throw new IllegalStateException("No lowering rule for a standalone " + ast.getType()
              + " node: " + ast);
    };
  }

  private CodeNode temporary(final String type, final CodeNode init,
      final List<CodeNode> block) {
    final String name = context.nextIdentifier("value");
    block.add(declare(type, name, init));
    return var(name);
  }

  /**
   * Lowers a sequence of location steps applied to a start node-set.
   */
  private CodeNode steps(final CodeNode start, final List<AstNode> steps, final String ctx,
      final List<CodeNode> block) throws XPathException {
    final String nodes = context.nextIdentifier("nodes");
    block.add(declare("NodeSet", nodes, start));
    for (final AstNode step : steps) {
      step(nodes, step, ctx, block);
    }
    return var(nodes);
  }

  /**
   * Lowers one step into a loop over the context nodes, an inner loop over the axis and a counting
   * loop per predicate.
   */
  private void step(final String nodes, final AstNode step, final String ctx,
      final List<CodeNode> block) throws XPathException {
    if (step.getType() != AstType.AXIS) {
      throw new IllegalStateException("Not a step: " + step);
    }
    final Axis axis = context.resolveAxis(step);
    final String test = hoistNodeTest(step.getChild(0), axis);

    final String selected = context.nextIdentifier("selected");
    final String node = context.nextIdentifier("node");
    final String candidates = context.nextIdentifier("candidates");
    final String candidate = context.nextIdentifier("candidate");

    final List<CodeNode> perNode = new ArrayList<>();
    perNode.add(declare("List<XmlNode>", candidates, newInstance("ArrayList<>")));
    perNode.add(each("XmlNode", candidate,
        call(constant("Axes"), "select", constant("Axis." + axis.name()), var(node)),
        sequence(ifThen(call(var(test), "matches", var(candidate)),
            sequence(call(var(candidates), "add", var(candidate)))))));
    for (final AstNode predicate : step.getChildren().subList(1, step.getChildren().size())) {
      final String evaluator = hoistPredicate(predicate);
      perNode.addAll(predicateLoop(candidates, evaluator, ctx));
    }
    perNode.add(call(var(selected), "addAll", var(candidates)));

    block.add(declare("List<XmlNode>", selected, newInstance("ArrayList<>")));
    block.add(each("XmlNode", node, var(nodes), sequence(perNode)));
    block.add(assign(nodes, call(constant("NodeSet"), "sorted", var(selected))));
  }

  /**
   * Keeps the candidates passing a predicate, counting proximity positions from 1 in axis order.
   */
  private List<CodeNode> predicateLoop(final String candidates, final String evaluator,
      final String ctx) {
    final String ordered = context.nextIdentifier("ordered");
    final String kept = context.nextIdentifier("kept");
    final String position = context.nextIdentifier("position");
    final String candidate = context.nextIdentifier("candidate");
    final CodeNode size = call(var(ordered), "size");
    final CodeNode value = call(var(evaluator), "evaluate",
        call(var(ctx), "forPredicate", var(candidate), var(position), size));
    return List.of(
        declare("NodeSet", ordered, call(constant("NodeSet"), "copyOf", var(candidates))),
        declare("List<XmlNode>", kept, newInstance("ArrayList<>")),
        count(position, size, sequence(
            declare("XmlNode", candidate, call(var(ordered), "item", var(position))),
            ifThen(call(constant("Steps"), "predicateMatches", value, var(position)),
                sequence(call(var(kept), "add", var(candidate)))))),
        assign(candidates, var(kept)));
  }

  private CodeNode onFilter(final AstNode ast, final String ctx, final List<CodeNode> block)
      throws XPathException {
    final CodeNode primary = expression(ast.getChild(0), ctx, block);
    final List<CodeNode> predicates = new ArrayList<>();
    for (final AstNode predicate : ast.getChildren().subList(1, ast.getChildren().size())) {
      predicates.add(var(hoistPredicate(predicate)));
    }
    return temporary("NodeSet",
        call(constant("Steps"), "filter", primary, array("Evaluator", predicates), var(ctx)),
        block);
  }

  private CodeNode onFunction(final AstNode ast, final String ctx, final List<CodeNode> block)
      throws XPathException {
    final FuncDef function;
    try {
      function = FuncDef.resolve(ast.getStringValue(), ast.getChildren().size());
    } catch (final XPathException e) {
      final String expression = context.getExpression();
      throw expression == null ? e : e.initExpression(expression);
    }
    final List<CodeNode> arguments = new ArrayList<>();
    for (final AstNode argument : ast.getChildren()) {
      arguments.add(expression(argument, ctx, block));
    }
    return temporary("Object", call(constant("Functions"), "call",
        constant("FuncDef." + function.name()), var(ctx), array("Object", arguments)), block);
  }

  private CodeNode onAnd(final AstNode ast, final String ctx, final List<CodeNode> block)
      throws XPathException {
    final CodeNode left = expression(ast.getChild(0), ctx, block);
    final String result = context.nextIdentifier("and");
    block.add(declare("Object", result, constant("Boolean.FALSE")));
    final List<CodeNode> whenTrue = new ArrayList<>();
    final CodeNode right = expression(ast.getChild(1), ctx, whenTrue);
    whenTrue.add(assign(result, call(constant("Conversion"), "toBoolean", right)));
    block.add(ifThen(call(constant("Conversion"), "toBoolean", left), sequence(whenTrue)));
    return var(result);
  }

  private CodeNode onOr(final AstNode ast, final String ctx, final List<CodeNode> block)
      throws XPathException {
    final CodeNode left = expression(ast.getChild(0), ctx, block);
    final String result = context.nextIdentifier("or");
    block.add(declare("Object", result, constant("Boolean.TRUE")));
    final List<CodeNode> whenFalse = new ArrayList<>();
    final CodeNode right = expression(ast.getChild(1), ctx, whenFalse);
    whenFalse.add(assign(result, call(constant("Conversion"), "toBoolean", right)));
    block.add(ifThenElse(call(constant("Conversion"), "toBoolean", left), sequence(),
        sequence(whenFalse)));
    return var(result);
  }

  /**
   * Hoists a predicate into an evaluator constant and returns the constant's name. Everything the
   * predicate hoists itself is declared before it.
   */
  private String hoistPredicate(final AstNode predicate) throws XPathException {
    if (predicate.getType() != AstType.PREDICATE) {
      throw new IllegalStateException("Not a predicate: " + predicate);
    }
    final String parameter = context.nextIdentifier("context");
    final List<CodeNode> body = new ArrayList<>();
    final CodeNode result = expression(predicate.getChild(0), parameter, body);
    body.add(returns(result));
    final String name = context.nextIdentifier("PREDICATE_");
    fields.add(declare("Evaluator", name, lambda(parameter, sequence(body))));
    return name;
  }

  private String hoistNodeTest(final AstNode test, final Axis axis) {
    final CodeNode kind = constant("NodeKind." + axis.getPrincipalKind().name());
    final CodeNode init = switch (test.getType()) {
      case TEST -> {
        final NameTest name = (NameTest) test.getValue();
        yield call(constant("NodeTest"), "name", kind, literal(name.getPrefix()),
            literal(context.namespaceUri(name.getPrefix())), literal(name.getLocalName()));
      }
      case WILDCARD -> {
        final String prefix = (String) test.getValue();
        yield call(constant("NodeTest"), "wildcard", kind, literal(prefix),
            literal(context.namespaceUri(prefix)));
      }
      case NODE_TYPE -> switch (test.getStringValue()) {
        case "node" -> call(constant("NodeTest"), "anyNode");
        case "text" -> call(constant("NodeTest"), "text");
        case "comment" -> call(constant("NodeTest"), "comment");
        case "processing-instruction" -> call(constant("NodeTest"), "processingInstruction",
            literal(test.getChildren().isEmpty() ? null : test.getChild(0).getStringValue()));
        default -> throw new IllegalStateException("Unknown node type: " + test);
      };
      default -> throw new IllegalStateException("Not a node test: " + test);
    };
    final String name = context.nextIdentifier("TEST_");
    fields.add(declare("NodeTest", name, init));
    return name;
  }
}

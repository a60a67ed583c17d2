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

import io.treepath.api.NodeSet;
import io.treepath.api.XmlNode;
import io.treepath.exception.XPathException;
import io.treepath.exception.XPathNodeTypeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Location step evaluation shared by the compiler backends.
 */
public final class Steps {

  private static final Evaluator[] NO_PREDICATES = new Evaluator[0];

  private Steps() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Get the root of the tree a node belongs to: the document node, or the topmost ancestor if the
   * tree has no document node.
   *
   * @param node the node
   * @return the root
   */
  public static XmlNode root(final XmlNode node) {
    XmlNode current = node;
    for (XmlNode parent = node.getParent(); parent != null; parent = parent.getParent()) {
      current = parent;
    }
    return current;
  }

  /**
   * The node-set a relative path starts with.
   *
   * @param context the dynamic context
   * @return the context node as node-set
   */
  public static NodeSet contextNode(final EvaluationContext context) {
    return NodeSet.of(context.getNode());
  }

  /**
   * The node-set an absolute path starts with.
   *
   * @param context the dynamic context
   * @return the root as node-set
   */
  public static NodeSet rootNode(final EvaluationContext context) {
    return NodeSet.of(root(context.getNode()));
  }

  /**
   * Evaluate a location step for every node of the input and return the union of the selections.
   *
   * @param input the context nodes
   * @param axis the axis
   * @param test the node test
   * @param predicates the predicates, applied one after the other
   * @param context the dynamic context, providing the variables
   * @return the selected nodes in document order
   * @throws XPathException if a predicate fails
   */
  public static NodeSet step(final NodeSet input, final Axis axis, final NodeTest test,
      final Evaluator[] predicates, final EvaluationContext context) throws XPathException {
    if (input.size() == 1) {
      final List<XmlNode> selected = select(axis, test, input.first(), predicates, context);
      if (axis.isReverse()) {
        Collections.reverse(selected);
      }
      return NodeSet.copyOf(selected);
    }
    final List<XmlNode> result = new ArrayList<>();
    for (final XmlNode node : input) {
      result.addAll(select(axis, test, node, predicates, context));
    }
    return NodeSet.sorted(result);
  }

  /**
   * Evaluate a location step without predicates.
   *
   * @param input the context nodes
   * @param axis the axis
   * @param test the node test
   * @param context the dynamic context
   * @return the selected nodes in document order
   * @throws XPathException never for steps without predicates, declared for symmetry
   */
  public static NodeSet step(final NodeSet input, final Axis axis, final NodeTest test,
      final EvaluationContext context) throws XPathException {
    return step(input, axis, test, NO_PREDICATES, context);
  }

  /**
   * Apply the predicates of a filter expression. Positions count in document order.
   *
   * @param value the value of the primary expression
   * @param predicates the predicates
   * @param context the dynamic context
   * @return the nodes passing all predicates
   * @throws XPathException if the value is no node-set or a predicate fails
   */
  public static NodeSet filter(final Object value, final Evaluator[] predicates,
      final EvaluationContext context) throws XPathException {
    List<XmlNode> nodes = Conversion.toNodeSet(value, "predicate").inDocumentOrder().asList();
    for (final Evaluator predicate : predicates) {
      nodes = applyPredicate(nodes, predicate, context);
    }
    return NodeSet.copyOf(nodes);
  }

  /**
   * Ensure the value of the expression a path starts with is a node-set.
   *
   * @param value the value
   * @return the node-set
   * @throws XPathNodeTypeException if the value is no node-set
   */
  public static NodeSet pathStart(final Object value) throws XPathNodeTypeException {
    return Conversion.toNodeSet(value, "path step");
  }

  /**
   * Determines if a predicate result selects the candidate at a position: numbers select the
   * candidate at that position, other values are converted to booleans.
   *
   * @param value the predicate result
   * @param position the proximity position of the candidate
   * @return {@code true} if the candidate passes
   */
  public static boolean predicateMatches(final Object value, final int position) {
    if (value instanceof Double number) {
      return number == position;
    }
    return Conversion.toBoolean(value);
  }

  private static List<XmlNode> select(final Axis axis, final NodeTest test, final XmlNode node,
      final Evaluator[] predicates, final EvaluationContext context) throws XPathException {
    final List<XmlNode> candidates = new ArrayList<>();
    for (final XmlNode candidate : Axes.select(axis, node)) {
      if (test.matches(candidate)) {
        candidates.add(candidate);
      }
    }
    List<XmlNode> selected = candidates;
    for (final Evaluator predicate : predicates) {
      selected = applyPredicate(selected, predicate, context);
    }
    return selected;
  }

  private static List<XmlNode> applyPredicate(final List<XmlNode> candidates,
      final Evaluator predicate, final EvaluationContext context) throws XPathException {
    final List<XmlNode> passed = new ArrayList<>(candidates.size());
    final int size = candidates.size();
    for (int i = 0; i < size; i++) {
      final XmlNode candidate = candidates.get(i);
      final Object value = predicate.evaluate(context.forPredicate(candidate, i + 1, size));
      if (predicateMatches(value, i + 1)) {
        passed.add(candidate);
      }
    }
    return passed;
  }
}

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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import io.treepath.api.XmlNode;
import io.treepath.exception.XPathEvaluationException;
import org.checkerframework.checker.index.qual.Positive;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The dynamic context of an evaluation: context node, proximity position and size, and the
 * variable bindings. Contexts are immutable, nested evaluations derive new ones.
 */
public final class EvaluationContext {

  private final XmlNode node;

  private final int position;

  private final int size;

  /** Whether {@code position()} and {@code last()} are available. */
  private final boolean inPredicate;

  private final ImmutableMap<String, Object> variables;

  private EvaluationContext(final XmlNode node, final int position, final int size,
      final boolean inPredicate, final ImmutableMap<String, Object> variables) {
    this.node = checkNotNull(node);
    this.position = position;
    this.size = size;
    this.inPredicate = inPredicate;
    this.variables = variables;
  }

  /**
   * Create the context of a top-level evaluation.
   *
   * @param node the context node
   * @param variables the variable bindings, values are converted by
   *        {@link Conversion#normalize(Object)}
   * @return the context
   */
  public static EvaluationContext of(final XmlNode node, final Map<String, ?> variables) {
    final ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
    for (final Map.Entry<String, ?> entry : variables.entrySet()) {
      builder.put(entry.getKey(), Conversion.normalize(entry.getValue()));
    }
    return new EvaluationContext(node, 1, 1, false, builder.build());
  }

  /**
   * Derive a context for evaluating a sub-expression on another node.
   *
   * @param newNode the context node
   * @return the context
   */
  public EvaluationContext withNode(final XmlNode newNode) {
    return new EvaluationContext(newNode, 1, 1, false, variables);
  }

  /**
   * Derive a context for evaluating a predicate.
   *
   * @param newNode the candidate node
   * @param newPosition its proximity position
   * @param newSize the number of candidates
   * @return the context
   */
  public EvaluationContext forPredicate(final XmlNode newNode, final @Positive int newPosition,
      final @Positive int newSize) {
    return new EvaluationContext(newNode, newPosition, newSize, true, variables);
  }

  public XmlNode getNode() {
    return node;
  }

  public int getPosition() {
    return position;
  }

  public int getSize() {
    return size;
  }

  public boolean isInPredicate() {
    return inPredicate;
  }

  /**
   * Get the value of a variable.
   *
   * @param name the name
   * @return the value
   * @throws XPathEvaluationException if the variable is not bound
   */
  public Object getVariable(final String name) throws XPathEvaluationException {
    final Object value = variables.get(name);
    if (value == null) {
      throw new XPathEvaluationException("Undefined variable: $" + name, null, "$" + name, null);
    }
    return value;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("node", node)
                      .add("position", position)
                      .add("size", size)
                      .add("inPredicate", inPredicate)
                      .toString();
  }
}

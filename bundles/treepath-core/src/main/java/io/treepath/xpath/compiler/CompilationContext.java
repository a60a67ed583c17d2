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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import io.treepath.exception.XPathEvaluationException;
import io.treepath.xpath.ast.AstNode;
import io.treepath.xpath.runtime.Axis;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * State of a single compilation: the namespace bindings and a counter for identifiers that must be
 * unique within the compiled query. A context is created by the caller for every compilation and
 * never shared.
 */
public final class CompilationContext {

  private final ImmutableMap<String, String> namespaces;

  /** Source text, for error messages. */
  private final @Nullable String expression;

  private int counter;

  /**
   * Constructor.
   *
   * @param namespaces prefix to URI bindings
   * @param expression the source text of the query, or {@code null}
   */
  public CompilationContext(final Map<String, String> namespaces,
      final @Nullable String expression) {
    this.namespaces = ImmutableMap.copyOf(checkNotNull(namespaces));
    this.expression = expression;
  }

  public ImmutableMap<String, String> getNamespaces() {
    return namespaces;
  }

  public @Nullable String getExpression() {
    return expression;
  }

  /**
   * Get the URI bound to a prefix.
   *
   * @param prefix the prefix, may be {@code null}
   * @return the URI, or {@code null} if there is no prefix or it is not bound
   */
  public @Nullable String namespaceUri(final @Nullable String prefix) {
    return prefix == null ? null : namespaces.get(prefix);
  }

  /**
   * Get a fresh identifier.
   *
   * @param base the identifier's stem
   * @return {@code base} followed by a number not handed out before in this compilation
   */
  public String nextIdentifier(final String base) {
    return base + ++counter;
  }

  /**
   * Resolve the axis of a step.
   *
   * @param step an {@link io.treepath.xpath.ast.AstType#AXIS} node
   * @return the axis
   * @throws XPathEvaluationException for the unsupported namespace axis
   */
  public Axis resolveAxis(final AstNode step) throws XPathEvaluationException {
    final Axis axis = Axis.fromName(step.getStringValue());
    if (axis == null) {
      throw new XPathEvaluationException("Unknown axis: " + step.getStringValue(), expression,
          step.toString(), null);
    }
    if (axis == Axis.NAMESPACE) {
      throw new XPathEvaluationException("The namespace axis is not supported", expression,
          step.toString(), null);
    }
    return axis;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("namespaces", namespaces)
                      .add("expression", expression)
                      .toString();
  }
}

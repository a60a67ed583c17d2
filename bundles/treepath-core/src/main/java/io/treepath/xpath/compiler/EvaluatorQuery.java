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
import io.treepath.api.XmlNode;
import io.treepath.exception.XPathException;
import io.treepath.settings.CompilerBackend;
import io.treepath.xpath.CompiledQuery;
import io.treepath.xpath.ast.AstNode;
import io.treepath.xpath.runtime.EvaluationContext;
import io.treepath.xpath.runtime.Evaluator;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A {@link CompiledQuery} backed by an {@link Evaluator}, as produced by both backends.
 */
final class EvaluatorQuery implements CompiledQuery {

  private final Evaluator evaluator;

  private final AstNode ast;

  private final CompilerBackend backend;

  /** Text used in error messages. */
  private final String expression;

  EvaluatorQuery(final Evaluator evaluator, final AstNode ast, final CompilerBackend backend,
      final String expression) {
    this.evaluator = checkNotNull(evaluator);
    this.ast = checkNotNull(ast);
    this.backend = checkNotNull(backend);
    this.expression = checkNotNull(expression);
  }

  @Override
  public Object evaluate(final XmlNode node) throws XPathException {
    return evaluate(node, ImmutableMap.of());
  }

  @Override
  public Object evaluate(final XmlNode node, final Map<String, ?> variables)
      throws XPathException {
    checkNotNull(node);
    checkNotNull(variables);
    try {
      return evaluator.evaluate(EvaluationContext.of(node, variables));
    } catch (final XPathException e) {
      throw e.initExpression(expression);
    }
  }

  @Override
  public AstNode getAst() {
    return ast;
  }

  @Override
  public CompilerBackend getBackend() {
    return backend;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("expression", expression)
                      .add("backend", backend)
                      .toString();
  }
}

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

package io.treepath.exception;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when a well-formed expression cannot be compiled or evaluated, for instance for an
 * unsupported axis or an unbound variable.
 */
public final class XPathEvaluationException extends XPathException {

  private static final long serialVersionUID = 1L;

  /** The step or construct that failed. */
  private final @Nullable String step;

  /** Name of the context node, if known. */
  private final @Nullable String contextNode;

  public XPathEvaluationException(final String message) {
    this(message, null, null, null);
  }

  /**
   * Constructor.
   *
   * @param message the failure
   * @param expression the expression, or {@code null}
   * @param step the failing step, or {@code null}
   * @param contextNode name of the context node, or {@code null}
   */
  public XPathEvaluationException(final String message, final @Nullable String expression,
      final @Nullable String step, final @Nullable String contextNode) {
    super(message, expression);
    this.step = step;
    this.contextNode = contextNode;
  }

  /**
   * Constructor for failures caused by another exception.
   *
   * @param message the failure
   * @param step the failing step, or {@code null}
   * @param cause the cause
   */
  public XPathEvaluationException(final String message, final @Nullable String step,
      final Throwable cause) {
    super(message, null, cause);
    this.step = step;
    this.contextNode = null;
  }

  public @Nullable String getStep() {
    return step;
  }

  public @Nullable String getContextNode() {
    return contextNode;
  }

  @Override
  protected void appendDetails(final StringBuilder builder) {
    if (contextNode != null) {
      builder.append("\n  Context node: <").append(contextNode).append('>');
    }
    if (step != null) {
      builder.append("\n  Step: ").append(step);
    }
  }
}

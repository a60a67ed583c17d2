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
 * Base class of all failures raised while parsing, compiling or evaluating an XPath expression.
 * The message returned by {@link #getMessage()} carries the expression and, in subclasses, the
 * details of the failure, one per line.
 */
public class XPathException extends TreepathException {

  private static final long serialVersionUID = 1L;

  /** The expression that failed, may be attached after construction. */
  private @Nullable String expression;

  /**
   * Constructor.
   *
   * @param message the failure
   * @param expression the expression, or {@code null} if not known yet
   */
  public XPathException(final String message, final @Nullable String expression) {
    super(message);
    this.expression = expression;
  }

  /**
   * Constructor.
   *
   * @param message the failure
   * @param expression the expression, or {@code null} if not known yet
   * @param cause the cause
   */
  public XPathException(final String message, final @Nullable String expression,
      final Throwable cause) {
    super(message, cause);
    this.expression = expression;
  }

  /**
   * Attach the expression to an exception raised by code that did not know it. An expression
   * already present is kept.
   *
   * @param expression the expression
   * @return this exception
   */
  public XPathException initExpression(final String expression) {
    if (this.expression == null) {
      this.expression = expression;
    }
    return this;
  }

  public @Nullable String getExpression() {
    return expression;
  }

  /**
   * Get the message without any details.
   *
   * @return the plain message
   */
  public String getReason() {
    return super.getMessage();
  }

  @Override
  public String getMessage() {
    final StringBuilder builder = new StringBuilder(String.valueOf(super.getMessage()));
    if (expression != null) {
      builder.append("\n  Expression: ").append(expression);
    }
    appendDetails(builder);
    return builder.toString();
  }

  /**
   * Hook for subclasses to append their details to the message.
   *
   * @param builder the message so far
   */
  protected void appendDetails(final StringBuilder builder) {
  }
}

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

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown by the scanner and the parser for malformed expressions.
 */
public final class XPathSyntaxException extends XPathException {

  private static final long serialVersionUID = 1L;

  /** Offset of the offending input. */
  private final int position;

  /** The offending token text, if any. */
  private final @Nullable String token;

  /**
   * Constructor.
   *
   * @param message the failure
   * @param expression the expression
   * @param position zero-based offset into the expression
   * @param token the offending token, or {@code null} at the end of input
   */
  public XPathSyntaxException(final String message, final String expression,
      final @NonNegative int position, final @Nullable String token) {
    super(message, expression);
    this.position = position;
    this.token = token;
  }

  public int getPosition() {
    return position;
  }

  public @Nullable String getToken() {
    return token;
  }

  @Override
  protected void appendDetails(final StringBuilder builder) {
    builder.append("\n  Position: ").append(position);
    if (token != null) {
      builder.append("\n  Unexpected token: \"").append(token).append('"');
    }
  }
}

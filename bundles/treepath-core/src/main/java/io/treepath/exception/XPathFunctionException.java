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
 * Thrown for calls of unknown functions or calls with a wrong number of arguments.
 */
public final class XPathFunctionException extends XPathException {

  private static final long serialVersionUID = 1L;

  private final String functionName;

  private final int argumentCount;

  /**
   * Constructor.
   *
   * @param message the failure
   * @param expression the expression, or {@code null}
   * @param functionName name of the called function
   * @param argumentCount number of arguments of the call
   */
  public XPathFunctionException(final String message, final @Nullable String expression,
      final String functionName, final int argumentCount) {
    super(message, expression);
    this.functionName = functionName;
    this.argumentCount = argumentCount;
  }

  public String getFunctionName() {
    return functionName;
  }

  public int getArgumentCount() {
    return argumentCount;
  }

  @Override
  protected void appendDetails(final StringBuilder builder) {
    builder.append("\n  Function: ").append(functionName);
    builder.append("\n  Arguments: ").append(argumentCount);
  }
}

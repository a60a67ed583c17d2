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
 * Thrown when an operation receives a value of the wrong type, e.g. a union of a number.
 */
public final class XPathNodeTypeException extends XPathException {

  private static final long serialVersionUID = 1L;

  private final String nodeType;

  private final String operation;

  /**
   * Constructor.
   *
   * @param message the failure
   * @param expression the expression, or {@code null}
   * @param nodeType the type of the offending value
   * @param operation the operation that rejected it
   */
  public XPathNodeTypeException(final String message, final @Nullable String expression,
      final String nodeType, final String operation) {
    super(message, expression);
    this.nodeType = nodeType;
    this.operation = operation;
  }

  public String getNodeType() {
    return nodeType;
  }

  public String getOperation() {
    return operation;
  }

  @Override
  protected void appendDetails(final StringBuilder builder) {
    builder.append("\n  Node type: ").append(nodeType);
    builder.append("\n  Operation: ").append(operation);
  }
}

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
import io.treepath.exception.XPathNodeTypeException;

/**
 * Comparison, arithmetic and union operators.
 */
public final class Operators {

  private Operators() {
    throw new AssertionError("May never be instantiated!");
  }

  public static boolean equal(final Object left, final Object right) {
    final Object[] operands = Conversion.toCompatibleTypes(left, right);
    if (operands[0] instanceof Double first) {
      return first.doubleValue() == ((Double) operands[1]).doubleValue();
    }
    return operands[0].equals(operands[1]);
  }

  public static boolean notEqual(final Object left, final Object right) {
    return !equal(left, right);
  }

  public static boolean lessThan(final Object left, final Object right) {
    return Conversion.toNumber(left) < Conversion.toNumber(right);
  }

  public static boolean lessThanOrEqual(final Object left, final Object right) {
    return Conversion.toNumber(left) <= Conversion.toNumber(right);
  }

  public static boolean greaterThan(final Object left, final Object right) {
    return Conversion.toNumber(left) > Conversion.toNumber(right);
  }

  public static boolean greaterThanOrEqual(final Object left, final Object right) {
    return Conversion.toNumber(left) >= Conversion.toNumber(right);
  }

  public static double plus(final Object left, final Object right) {
    return Conversion.toNumber(left) + Conversion.toNumber(right);
  }

  public static double minus(final Object left, final Object right) {
    return Conversion.toNumber(left) - Conversion.toNumber(right);
  }

  public static double multiply(final Object left, final Object right) {
    return Conversion.toNumber(left) * Conversion.toNumber(right);
  }

  public static double divide(final Object left, final Object right) {
    return Conversion.toNumber(left) / Conversion.toNumber(right);
  }

  /**
   * The {@code mod} operator, the remainder of a truncating division.
   */
  public static double modulo(final Object left, final Object right) {
    return Conversion.toNumber(left) % Conversion.toNumber(right);
  }

  public static double negate(final Object operand) {
    return -Conversion.toNumber(operand);
  }

  /**
   * The {@code |} operator.
   *
   * @param left the left operand
   * @param right the right operand
   * @return the union in document order
   * @throws XPathNodeTypeException if an operand is not a node-set
   */
  public static NodeSet union(final Object left, final Object right)
      throws XPathNodeTypeException {
    return Conversion.toNodeSet(left, "union").union(Conversion.toNodeSet(right, "union"));
  }
}

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

import com.google.common.base.CharMatcher;
import io.treepath.api.DocumentOrder;
import io.treepath.api.NodeSet;
import io.treepath.api.XmlNode;
import io.treepath.exception.XPathNodeTypeException;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Conversions between the XPath value types. Values are {@link NodeSet}s, {@link String}s,
 * {@link Double}s and {@link Boolean}s; a single {@link XmlNode} is accepted wherever a node-set
 * is.
 */
public final class Conversion {

  /** XML whitespace. */
  static final CharMatcher WHITESPACE = CharMatcher.anyOf(" \t\r\n");

  /** Lexical form of an XPath number. */
  private static final Pattern NUMBER = Pattern.compile("-?(\\d+(\\.\\d*)?|\\.\\d+)");

  private Conversion() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Convert a value to a string: the string-value of the first node in document order for
   * node-sets, {@code ""} for empty ones.
   *
   * @param value the value
   * @return the string
   */
  public static String toString(final Object value) {
    if (value instanceof String string) {
      return string;
    }
    if (value instanceof Double number) {
      return formatNumber(number);
    }
    if (value instanceof Boolean bool) {
      return bool ? "true" : "false";
    }
    if (value instanceof NodeSet nodes) {
      final XmlNode first = firstInDocumentOrder(nodes);
      return first == null ? "" : first.getText();
    }
    if (value instanceof XmlNode node) {
      return node.getText();
    }
    if (value instanceof Number number) {
      return formatNumber(number.doubleValue());
    }
    return String.valueOf(value);
  }

  /**
   * Convert a value to a number. Strings not in XPath number syntax yield {@code NaN}.
   *
   * @param value the value
   * @return the number
   */
  public static double toNumber(final Object value) {
    if (value instanceof Double number) {
      return number;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof Boolean bool) {
      return bool ? 1d : 0d;
    }
    return parseNumber(toString(value));
  }

  /**
   * Convert a value to a boolean: non-zero numbers other than {@code NaN}, non-empty strings and
   * non-empty node-sets are {@code true}.
   *
   * @param value the value
   * @return the boolean
   */
  public static boolean toBoolean(final Object value) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof Double number) {
      return number != 0d && !number.isNaN();
    }
    if (value instanceof String string) {
      return !string.isEmpty();
    }
    if (value instanceof NodeSet nodes) {
      return !nodes.isEmpty();
    }
    if (value instanceof Number number) {
      final double doubleValue = number.doubleValue();
      return doubleValue != 0d && !Double.isNaN(doubleValue);
    }
    return value instanceof XmlNode;
  }

  /**
   * Bring two operands of a comparison to a common type. Node-sets are first reduced to the
   * string-value of their first node. Then both become numbers if either is one, else strings if
   * either is one, else booleans.
   *
   * @param left the left operand
   * @param right the right operand
   * @return a two element array with the converted operands
   */
  public static Object[] toCompatibleTypes(final Object left, final Object right) {
    final Object first = reduceNodes(left);
    final Object second = reduceNodes(right);
    if (first instanceof Double || second instanceof Double) {
      return new Object[] { toNumber(first), toNumber(second) };
    }
    if (first instanceof String || second instanceof String) {
      return new Object[] { toString(first), toString(second) };
    }
    return new Object[] { toBoolean(first), toBoolean(second) };
  }

  /**
   * Parse a string in XPath number syntax, surrounding whitespace allowed.
   *
   * @param text the text
   * @return the number, {@code NaN} if the text is no number
   */
  public static double parseNumber(final String text) {
    final String trimmed = WHITESPACE.trimFrom(text);
    if (!NUMBER.matcher(trimmed).matches()) {
      return Double.NaN;
    }
    return Double.parseDouble(trimmed);
  }

  /**
   * Format a number: integral values without fraction, no exponent, {@code NaN},
   * {@code Infinity} and {@code -Infinity} for the special values.
   *
   * @param number the number
   * @return the string
   */
  public static String formatNumber(final double number) {
    if (Double.isNaN(number)) {
      return "NaN";
    }
    if (Double.isInfinite(number)) {
      return number > 0 ? "Infinity" : "-Infinity";
    }
    if (number == 0d) {
      return "0";
    }
    return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
  }

  /**
   * Bring a value from the caller's world into the XPath value space: other numbers become
   * doubles, a node or a collection of nodes becomes a node-set.
   *
   * @param value the value
   * @return the converted value
   * @throws IllegalArgumentException if the value has no XPath counterpart
   */
  public static Object normalize(final @Nullable Object value) {
    if (value instanceof String || value instanceof Double || value instanceof Boolean
        || value instanceof NodeSet) {
      return value;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof XmlNode node) {
      return NodeSet.of(node);
    }
    if (value instanceof Collection<?> collection) {
      final List<XmlNode> nodes = new ArrayList<>(collection.size());
      for (final Object element : collection) {
        if (!(element instanceof XmlNode node)) {
          throw new IllegalArgumentException("Not a node: " + element);
        }
        nodes.add(node);
      }
      return NodeSet.sorted(nodes);
    }
    throw new IllegalArgumentException("Unsupported variable value: " + value);
  }

  /**
   * Ensure a value is a node-set.
   *
   * @param value the value
   * @param operation the operation requiring a node-set, for the error message
   * @return the node-set
   * @throws XPathNodeTypeException if the value is no node-set
   */
  public static NodeSet toNodeSet(final Object value, final String operation)
      throws XPathNodeTypeException {
    if (value instanceof NodeSet nodes) {
      return nodes;
    }
    if (value instanceof XmlNode node) {
      return NodeSet.of(node);
    }
    throw new XPathNodeTypeException(operation + " requires a node-set", null, typeName(value),
        operation);
  }

  /**
   * Get the XPath type name of a value.
   *
   * @param value the value
   * @return {@code node-set}, {@code string}, {@code number} or {@code boolean}
   */
  public static String typeName(final Object value) {
    if (value instanceof NodeSet || value instanceof XmlNode) {
      return "node-set";
    }
    if (value instanceof Boolean) {
      return "boolean";
    }
    if (value instanceof Number) {
      return "number";
    }
    return "string";
  }

  static @Nullable XmlNode firstInDocumentOrder(final NodeSet nodes) {
    if (nodes.size() < 2) {
      return nodes.first();
    }
    return Collections.min(nodes.asList(), DocumentOrder.INSTANCE);
  }

  private static Object reduceNodes(final Object value) {
    if (value instanceof NodeSet || value instanceof XmlNode) {
      return toString(value);
    }
    return value;
  }
}

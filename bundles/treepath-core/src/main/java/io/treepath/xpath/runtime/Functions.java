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

import com.google.common.base.Splitter;
import io.treepath.api.NodeKind;
import io.treepath.api.NodeSet;
import io.treepath.api.XmlNode;
import io.treepath.exception.XPathEvaluationException;
import io.treepath.exception.XPathException;
import io.treepath.exception.XPathNodeTypeException;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Implementation of the core function library. Arguments are evaluated by the caller; arity has
 * been checked when the call was compiled.
 */
public final class Functions {

  private static final Splitter TOKENS = Splitter.on(Conversion.WHITESPACE).omitEmptyStrings();

  private Functions() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Call a function.
   *
   * @param function the function
   * @param context the dynamic context of the call
   * @param args the evaluated arguments
   * @return the result
   * @throws XPathException if the function fails, e.g. {@code position()} outside of a predicate
   */
  public static Object call(final FuncDef function, final EvaluationContext context,
      final Object[] args) throws XPathException {
    return switch (function) {
      case LAST -> (double) requirePredicate(context, "last").getSize();
      case POSITION -> (double) requirePredicate(context, "position").getPosition();
      case COUNT -> (double) Conversion.toNodeSet(args[0], "count()").size();
      case ID -> id(context, args[0]);
      case LOCAL_NAME -> {
        final XmlNode node = nodeArgument(context, args, "local-name()");
        yield node == null ? "" : node.getLocalName();
      }
      case NAMESPACE_URI -> {
        final XmlNode node = nodeArgument(context, args, "namespace-uri()");
        final String uri = node == null ? null : node.getNamespaceUri();
        yield uri == null ? "" : uri;
      }
      case NAME -> {
        final XmlNode node = nodeArgument(context, args, "name()");
        yield node == null ? "" : node.getName();
      }
      case STRING -> Conversion.toString(contextArgument(context, args));
      case CONCAT -> concat(args);
      case STARTS_WITH -> string(args, 0).startsWith(string(args, 1));
      case CONTAINS -> string(args, 0).contains(string(args, 1));
      case SUBSTRING_BEFORE -> substringBefore(string(args, 0), string(args, 1));
      case SUBSTRING_AFTER -> substringAfter(string(args, 0), string(args, 1));
      case SUBSTRING -> substring(string(args, 0), Conversion.toNumber(args[1]),
          args.length > 2 ? Conversion.toNumber(args[2]) : Double.POSITIVE_INFINITY);
      case STRING_LENGTH -> (double) Conversion.toString(contextArgument(context, args)).length();
      case NORMALIZE_SPACE -> Conversion.WHITESPACE.trimAndCollapseFrom(
          Conversion.toString(contextArgument(context, args)), ' ');
      case TRANSLATE -> translate(string(args, 0), string(args, 1), string(args, 2));
      case BOOLEAN -> Conversion.toBoolean(args[0]);
      case NOT -> !Conversion.toBoolean(args[0]);
      case TRUE -> Boolean.TRUE;
      case FALSE -> Boolean.FALSE;
      case LANG -> lang(context.getNode(), string(args, 0));
      case NUMBER -> Conversion.toNumber(contextArgument(context, args));
      case SUM -> sum(Conversion.toNodeSet(args[0], "sum()"));
      case FLOOR -> Math.floor(Conversion.toNumber(args[0]));
      case CEILING -> Math.ceil(Conversion.toNumber(args[0]));
      case ROUND -> round(Conversion.toNumber(args[0]));
    };
  }

  private static EvaluationContext requirePredicate(final EvaluationContext context,
      final String function) throws XPathEvaluationException {
    if (!context.isInPredicate()) {
      throw new XPathEvaluationException(function + "() can only be used in a predicate", null,
          function + "()", context.getNode().getName());
    }
    return context;
  }

  private static String string(final Object[] args, final int index) {
    return Conversion.toString(args[index]);
  }

  /** The single argument, or a node-set of the context node if there is none. */
  private static Object contextArgument(final EvaluationContext context, final Object[] args) {
    return args.length == 0 ? NodeSet.of(context.getNode()) : args[0];
  }

  private static @Nullable XmlNode nodeArgument(final EvaluationContext context,
      final Object[] args, final String function) throws XPathNodeTypeException {
    if (args.length == 0) {
      return context.getNode();
    }
    return Conversion.firstInDocumentOrder(Conversion.toNodeSet(args[0], function));
  }

  private static NodeSet id(final EvaluationContext context, final Object argument) {
    final Set<String> ids = new HashSet<>();
    if (argument instanceof NodeSet nodes) {
      for (final XmlNode node : nodes) {
        TOKENS.split(node.getText()).forEach(ids::add);
      }
    } else {
      TOKENS.split(Conversion.toString(argument)).forEach(ids::add);
    }
    if (ids.isEmpty()) {
      return NodeSet.empty();
    }
    final List<XmlNode> result = new ArrayList<>();
    for (final XmlNode node : Axes.select(Axis.DESCENDANT, Steps.root(context.getNode()))) {
      if (node.getKind() == NodeKind.ELEMENT) {
        final String id = node.getAttributeValue("id");
        if (id != null && ids.contains(id)) {
          result.add(node);
        }
      }
    }
    return NodeSet.copyOf(result);
  }

  private static String concat(final Object[] args) {
    final StringBuilder builder = new StringBuilder();
    for (final Object arg : args) {
      builder.append(Conversion.toString(arg));
    }
    return builder.toString();
  }

  private static String substringBefore(final String value, final String separator) {
    final int index = value.indexOf(separator);
    return index < 0 ? "" : value.substring(0, index);
  }

  private static String substringAfter(final String value, final String separator) {
    final int index = value.indexOf(separator);
    return index < 0 ? "" : value.substring(index + separator.length());
  }

  /**
   * Characters at one-based position p are kept if {@code round(start) <= p < round(start) +
   * round(length)}; comparisons with {@code NaN} fail.
   */
  static String substring(final String value, final double start, final double length) {
    final double first = round(start);
    final double end = first + round(length);
    final StringBuilder builder = new StringBuilder();
    for (int i = 0; i < value.length(); i++) {
      final int position = i + 1;
      if (position >= first && position < end) {
        builder.append(value.charAt(i));
      }
    }
    return builder.toString();
  }

  private static String translate(final String value, final String from, final String to) {
    final StringBuilder builder = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      final char current = value.charAt(i);
      final int index = from.indexOf(current);
      if (index < 0) {
        builder.append(current);
      } else if (index < to.length()) {
        builder.append(to.charAt(index));
      }
    }
    return builder.toString();
  }

  private static boolean lang(final XmlNode node, final String language) {
    for (XmlNode current = node; current != null; current = current.getParent()) {
      final String value = current.getAttributeValue("xml:lang");
      if (value != null) {
        final String actual = value.toLowerCase(Locale.ROOT);
        final String expected = language.toLowerCase(Locale.ROOT);
        return actual.equals(expected) || actual.startsWith(expected + '-');
      }
    }
    return false;
  }

  private static double sum(final NodeSet nodes) {
    double sum = 0d;
    for (final XmlNode node : nodes) {
      sum += Conversion.parseNumber(node.getText());
    }
    return sum;
  }

  /**
   * XPath rounding: halves round towards positive infinity, special values are kept.
   */
  static double round(final double number) {
    if (Double.isNaN(number) || Double.isInfinite(number)) {
      return number;
    }
    if (number < 0d && number >= -0.5d) {
      return -0d;
    }
    return Math.floor(number + 0.5d);
  }
}

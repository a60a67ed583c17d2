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

import com.google.common.collect.ImmutableMap;
import io.treepath.exception.XPathFunctionException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * <h1>FuncDef</h1>
 * <p>
 * The core function library of <a href="https://www.w3.org/TR/1999/REC-xpath-19991116/#corelib">
 * XPath 1.0</a> with the number of arguments every function accepts.
 * </p>
 */
public enum FuncDef {

  // ////////////////////////
  // NODE SET FUNCTIONS
  // ////////////////////////

  /** number last(). */
  LAST("last", 0, 0),
  /** number position(). */
  POSITION("position", 0, 0),
  /** number count(node-set). */
  COUNT("count", 1, 1),
  /** node-set id(object), elements by their {@code id} attribute. */
  ID("id", 1, 1),
  /** string local-name(node-set?). */
  LOCAL_NAME("local-name", 0, 1),
  /** string namespace-uri(node-set?). */
  NAMESPACE_URI("namespace-uri", 0, 1),
  /** string name(node-set?). */
  NAME("name", 0, 1),

  // ////////////////////////
  // STRING FUNCTIONS
  // ////////////////////////

  /** string string(object?). */
  STRING("string", 0, 1),
  /** string concat(string, string, string*). */
  CONCAT("concat", 2, Integer.MAX_VALUE),
  /** boolean starts-with(string, string). */
  STARTS_WITH("starts-with", 2, 2),
  /** boolean contains(string, string). */
  CONTAINS("contains", 2, 2),
  /** string substring-before(string, string). */
  SUBSTRING_BEFORE("substring-before", 2, 2),
  /** string substring-after(string, string). */
  SUBSTRING_AFTER("substring-after", 2, 2),
  /** string substring(string, number, number?). */
  SUBSTRING("substring", 2, 3),
  /** number string-length(string?). */
  STRING_LENGTH("string-length", 0, 1),
  /** string normalize-space(string?). */
  NORMALIZE_SPACE("normalize-space", 0, 1),
  /** string translate(string, string, string). */
  TRANSLATE("translate", 3, 3),

  // ////////////////////////
  // BOOLEAN FUNCTIONS
  // ////////////////////////

  /** boolean boolean(object). */
  BOOLEAN("boolean", 1, 1),
  /** boolean not(boolean). */
  NOT("not", 1, 1),
  /** boolean true(). */
  TRUE("true", 0, 0),
  /** boolean false(). */
  FALSE("false", 0, 0),
  /** boolean lang(string). */
  LANG("lang", 1, 1),

  // ////////////////////////
  // NUMBER FUNCTIONS
  // ////////////////////////

  /** number number(object?). */
  NUMBER("number", 0, 1),
  /** number sum(node-set). */
  SUM("sum", 1, 1),
  /** number floor(number). */
  FLOOR("floor", 1, 1),
  /** number ceiling(number). */
  CEILING("ceiling", 1, 1),
  /** number round(number). */
  ROUND("round", 1, 1);

  /** Functions by name. */
  private static final ImmutableMap<String, FuncDef> BY_NAME;

  static {
    final ImmutableMap.Builder<String, FuncDef> builder = ImmutableMap.builder();
    for (final FuncDef def : values()) {
      builder.put(def.functionName, def);
    }
    BY_NAME = builder.build();
  }

  private final String functionName;

  private final int minArgs;

  private final int maxArgs;

  FuncDef(final String functionName, final int minArgs, final int maxArgs) {
    this.functionName = functionName;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
  }

  /**
   * Get a function by name.
   *
   * @param name the name
   * @return the function, or {@code null} if there is no such function
   */
  public static @Nullable FuncDef fromName(final String name) {
    return BY_NAME.get(name);
  }

  /**
   * Resolve a function call.
   *
   * @param name the called name
   * @param argumentCount number of arguments of the call
   * @return the function
   * @throws XPathFunctionException if the function is unknown or does not accept that number of
   *         arguments
   */
  public static FuncDef resolve(final String name, final int argumentCount)
      throws XPathFunctionException {
    final FuncDef def = fromName(name);
    if (def == null) {
      throw new XPathFunctionException("Unknown function: " + name + "()", null, name,
          argumentCount);
    }
    if (argumentCount < def.minArgs || argumentCount > def.maxArgs) {
      throw new XPathFunctionException(String.format("%s() expects %s arguments but got %d",
          name, def.describeArity(), argumentCount), null, name, argumentCount);
    }
    return def;
  }

  public String getFunctionName() {
    return functionName;
  }

  public int getMinArgs() {
    return minArgs;
  }

  public int getMaxArgs() {
    return maxArgs;
  }

  private String describeArity() {
    if (minArgs == maxArgs) {
      return String.valueOf(minArgs);
    }
    if (maxArgs == Integer.MAX_VALUE) {
      return "at least " + minArgs;
    }
    return minArgs + " to " + maxArgs;
  }
}

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

package io.treepath.xpath.codegen;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable node of the generated-code tree, the intermediate form between a query syntax tree and
 * Java source.
 */
public final class CodeNode {

  private final CodeType type;

  private final @Nullable Object value;

  private final ImmutableList<CodeNode> children;

  private CodeNode(final CodeType type, final @Nullable Object value,
      final List<CodeNode> children) {
    this.type = checkNotNull(type);
    this.value = value;
    this.children = ImmutableList.copyOf(children);
  }

  public static CodeNode literal(final @Nullable Object value) {
    return new CodeNode(CodeType.LITERAL, value, ImmutableList.of());
  }

  public static CodeNode var(final String name) {
    return new CodeNode(CodeType.VAR, checkNotNull(name), ImmutableList.of());
  }

  public static CodeNode constant(final String reference) {
    return new CodeNode(CodeType.CONST, checkNotNull(reference), ImmutableList.of());
  }

  public static CodeNode declare(final String type, final String name, final CodeNode init) {
    return new CodeNode(CodeType.DECLARE, checkNotNull(name),
        ImmutableList.of(constant(type), init));
  }

  public static CodeNode assign(final String name, final CodeNode value) {
    return new CodeNode(CodeType.ASSIGN, checkNotNull(name), ImmutableList.of(value));
  }

  public static CodeNode sequence(final List<CodeNode> statements) {
    return new CodeNode(CodeType.SEQUENCE, null, statements);
  }

  public static CodeNode sequence(final CodeNode... statements) {
    return new CodeNode(CodeType.SEQUENCE, null, ImmutableList.copyOf(statements));
  }

  public static CodeNode ifThen(final CodeNode condition, final CodeNode then) {
    return new CodeNode(CodeType.IF, null, ImmutableList.of(condition, then));
  }

  public static CodeNode ifThenElse(final CodeNode condition, final CodeNode then,
      final CodeNode otherwise) {
    return new CodeNode(CodeType.IF, null, ImmutableList.of(condition, then, otherwise));
  }

  public static CodeNode each(final String type, final String variable, final CodeNode iterable,
      final CodeNode body) {
    return new CodeNode(CodeType.EACH, checkNotNull(variable),
        ImmutableList.of(constant(type), iterable, body));
  }

  public static CodeNode count(final String counter, final CodeNode limit, final CodeNode body) {
    return new CodeNode(CodeType.COUNT, checkNotNull(counter), ImmutableList.of(limit, body));
  }

  /**
   * Create a method call.
   *
   * @param receiver the receiver, an object or a class given as {@link CodeType#CONST}
   * @param method the method name
   * @param arguments the arguments
   * @return the call
   */
  public static CodeNode call(final CodeNode receiver, final String method,
      final CodeNode... arguments) {
    final ImmutableList.Builder<CodeNode> children = ImmutableList.builder();
    children.add(receiver).add(arguments);
    return new CodeNode(CodeType.CALL, checkNotNull(method), children.build());
  }

  public static CodeNode newInstance(final String className, final CodeNode... arguments) {
    return new CodeNode(CodeType.NEW, checkNotNull(className), ImmutableList.copyOf(arguments));
  }

  public static CodeNode array(final String elementType, final List<CodeNode> elements) {
    return new CodeNode(CodeType.ARRAY, checkNotNull(elementType), elements);
  }

  public static CodeNode lambda(final String parameter, final CodeNode body) {
    return new CodeNode(CodeType.LAMBDA, checkNotNull(parameter), ImmutableList.of(body));
  }

  public static CodeNode returns(final CodeNode value) {
    return new CodeNode(CodeType.RETURN, null, ImmutableList.of(value));
  }

  public CodeType getType() {
    return type;
  }

  public @Nullable Object getValue() {
    return value;
  }

  /**
   * Get the value as a name.
   *
   * @return the value
   */
  public String getName() {
    return String.valueOf(value);
  }

  public ImmutableList<CodeNode> getChildren() {
    return children;
  }

  public CodeNode getChild(final int index) {
    return children.get(index);
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof CodeNode)) {
      return false;
    }
    final CodeNode other = (CodeNode) obj;
    return type == other.type && Objects.equals(value, other.value)
        && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value, children);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("type", type)
                      .add("value", value)
                      .add("children", children)
                      .toString();
  }
}

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

package io.treepath.xpath.ast;

import java.util.Locale;

/**
 * Node types of the query syntax tree.
 */
public enum AstType {
  /** Path from the root; children are the steps, none for {@code /} alone. */
  ABSOLUTE_PATH(true),
  /** Path from the context node; children are the steps. */
  RELATIVE_PATH(true),
  /** Filter or primary expression followed by a {@link #RELATIVE_PATH}. */
  PATH(true),
  /** A step; value is the axis name, children are the node test and the predicates. */
  AXIS(true),
  /** Name test; value is a {@link NameTest}. */
  TEST(false),
  /** Wildcard test; value is the prefix of {@code prefix:*} or {@code null}. */
  WILDCARD(false),
  /** Node type test; value is the type name, optional literal child for processing instructions. */
  NODE_TYPE(false),
  /** Predicate; single child is the predicate expression. */
  PREDICATE(true),
  /** Primary expression followed by predicates. */
  FILTER(true),
  /** String literal. */
  STRING(false),
  /** Number literal, value is a {@link Double}. */
  NUMBER(false),
  /** Variable reference; value is the name. */
  VARIABLE(false),
  /** Function call; value is the name, children are the arguments. */
  FUNCTION(false),
  /** Union of two node-sets. */
  UNION(true),
  AND(false),
  OR(false),
  EQ(false),
  NEQ(false),
  LT(false),
  GT(false),
  LTE(false),
  GTE(false),
  PLUS(false),
  MINUS(false),
  STAR(false),
  DIV(false),
  MOD(false),
  /** Unary minus. */
  NEGATE(false),
  /** The empty expression. */
  EMPTY(true);

  /** Whether evaluating a node of this type yields a node-set. */
  private final boolean returnsNodeSet;

  AstType(final boolean returnsNodeSet) {
    this.returnsNodeSet = returnsNodeSet;
  }

  /**
   * Determines if expressions of this type evaluate to a node-set.
   *
   * @return {@code true} for paths, steps, predicates, filters and unions
   */
  public boolean returnsNodeSet() {
    return returnsNodeSet;
  }

  /**
   * Get the name used in the textual form of the tree.
   *
   * @return lower case name with dashes
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}

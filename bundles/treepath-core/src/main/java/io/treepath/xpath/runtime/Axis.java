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

import io.treepath.api.NodeKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The XPath 1.0 axes.
 */
public enum Axis {
  CHILD("child", false),
  DESCENDANT("descendant", false),
  DESCENDANT_OR_SELF("descendant-or-self", false),
  PARENT("parent", true),
  ANCESTOR("ancestor", true),
  ANCESTOR_OR_SELF("ancestor-or-self", true),
  FOLLOWING_SIBLING("following-sibling", false),
  PRECEDING_SIBLING("preceding-sibling", true),
  FOLLOWING("following", false),
  PRECEDING("preceding", true),
  ATTRIBUTE("attribute", false),
  SELF("self", false),
  /** Not supported, rejected when a query is compiled. */
  NAMESPACE("namespace", false);

  /** Name as written in queries. */
  private final String axisName;

  /** Whether positions count against document order. */
  private final boolean reverse;

  Axis(final String axisName, final boolean reverse) {
    this.axisName = axisName;
    this.reverse = reverse;
  }

  /**
   * Get an axis by its name.
   *
   * @param name the name, e.g. {@code following-sibling}
   * @return the axis or {@code null} for an unknown name
   */
  public static @Nullable Axis fromName(final String name) {
    for (final Axis axis : values()) {
      if (axis.axisName.equals(name)) {
        return axis;
      }
    }
    return null;
  }

  public String getAxisName() {
    return axisName;
  }

  /**
   * Determines if this is a reverse axis. Reverse axes deliver nodes nearest first, so proximity
   * positions in predicates count backwards in document order.
   *
   * @return {@code true} for reverse axes
   */
  public boolean isReverse() {
    return reverse;
  }

  /**
   * Get the principal node kind, the kind selected by a {@code *} or name test.
   *
   * @return the principal node kind
   */
  public NodeKind getPrincipalKind() {
    return switch (this) {
      case ATTRIBUTE -> NodeKind.ATTRIBUTE;
      case NAMESPACE -> NodeKind.NAMESPACE;
      default -> NodeKind.ELEMENT;
    };
  }

  @Override
  public String toString() {
    return axisName;
  }
}

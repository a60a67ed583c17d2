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

package io.treepath.xpath.parser;

import com.google.common.base.MoreObjects;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <h1>XPathToken</h1>
 * <p>
 * A token of the query: its type, its content (unescaped for string literals) and its offset in
 * the query string.
 * </p>
 */
public final class XPathToken {

  private final TokenType type;

  private final String content;

  private final int offset;

  /**
   * Constructor.
   *
   * @param type type of the token
   * @param content the content
   * @param offset zero-based offset of the first character
   */
  public XPathToken(final TokenType type, final String content, final @NonNegative int offset) {
    this.type = checkNotNull(type);
    this.content = checkNotNull(content);
    this.offset = offset;
  }

  public TokenType getType() {
    return type;
  }

  public String getContent() {
    return content;
  }

  public int getOffset() {
    return offset;
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof XPathToken)) {
      return false;
    }
    final XPathToken other = (XPathToken) obj;
    return type == other.type && content.equals(other.content) && offset == other.offset;
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, content, offset);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("type", type)
                      .add("content", content)
                      .add("offset", offset)
                      .toString();
  }
}

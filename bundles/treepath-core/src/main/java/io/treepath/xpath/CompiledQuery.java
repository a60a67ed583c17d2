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

package io.treepath.xpath;

import io.treepath.api.XmlNode;
import io.treepath.exception.XPathException;
import io.treepath.settings.CompilerBackend;
import io.treepath.xpath.ast.AstNode;

import java.util.Map;

/**
 * An executable query. Compiled queries are immutable and may be evaluated concurrently.
 * <p>
 * The result of an evaluation is a {@link io.treepath.api.NodeSet} (for paths, filters and
 * unions), a {@link String}, a {@link Double} or a {@link Boolean}.
 * </p>
 */
public interface CompiledQuery {

  /**
   * Evaluate the query without variables.
   *
   * @param node the context node
   * @return the result
   * @throws XPathException if evaluation fails
   */
  Object evaluate(XmlNode node) throws XPathException;

  /**
   * Evaluate the query.
   *
   * @param node the context node
   * @param variables variable bindings, numbers are widened to {@link Double} and nodes become
   *        node-sets
   * @return the result
   * @throws XPathException if evaluation fails
   */
  Object evaluate(XmlNode node, Map<String, ?> variables) throws XPathException;

  /**
   * Get the syntax tree the query was compiled from.
   *
   * @return the syntax tree
   */
  AstNode getAst();

  /**
   * Get the backend that compiled the query.
   *
   * @return the backend
   */
  CompilerBackend getBackend();
}

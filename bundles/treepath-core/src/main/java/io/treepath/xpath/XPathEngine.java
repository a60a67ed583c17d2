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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import io.treepath.api.NodeSet;
import io.treepath.api.XmlNode;
import io.treepath.cache.LRUCache;
import io.treepath.exception.XPathException;
import io.treepath.exception.XPathNodeTypeException;
import io.treepath.exception.XPathSyntaxException;
import io.treepath.settings.CompilerBackend;
import io.treepath.settings.EngineConfiguration;
import io.treepath.xpath.ast.AstNode;
import io.treepath.xpath.codegen.InMemoryJavaCompiler;
import io.treepath.xpath.compiler.CompilationContext;
import io.treepath.xpath.compiler.QueryCompiler;
import io.treepath.xpath.parser.XPathParser;
import io.treepath.xpath.runtime.Conversion;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry point for parsing, compiling and evaluating XPath expressions.
 * <p>
 * Parsed syntax trees are cached by expression text. Compiled queries are cached by syntax
 * tree, namespace bindings and backend, so equivalent spellings of an expression share one
 * compiled query. An engine is safe for concurrent use.
 * </p>
 */
public final class XPathEngine {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(XPathEngine.class);

  private final EngineConfiguration configuration;

  private final LRUCache<String, AstNode> parseCache;

  private final LRUCache<CompileKey, CompiledQuery> compileCache;

  private final QueryCompiler compiler;

  /** Key of the compile cache. */
  private record CompileKey(AstNode ast, ImmutableMap<String, String> namespaces,
      CompilerBackend backend) {
  }

  /**
   * Constructor.
   *
   * @param configuration engine settings
   */
  public XPathEngine(final EngineConfiguration configuration) {
    this.configuration = checkNotNull(configuration);
    parseCache = new LRUCache<>(configuration.getParseCacheSize());
    compileCache = new LRUCache<>(configuration.getCompileCacheSize());
    compiler = new QueryCompiler(new InMemoryJavaCompiler(XPathEngine.class.getClassLoader()),
        configuration.isLogGeneratedSource());
  }

  /**
   * Constructor using {@link EngineConfiguration#defaults()}.
   */
  public XPathEngine() {
    this(EngineConfiguration.defaults());
  }

  public EngineConfiguration getConfiguration() {
    return configuration;
  }

  /**
   * Parse an expression, consulting the parse cache first.
   *
   * @param expression the expression
   * @return the syntax tree, the same instance for repeated calls while it stays cached
   * @throws XPathSyntaxException if the expression is malformed
   */
  public AstNode parse(final String expression) throws XPathSyntaxException {
    checkNotNull(expression);
    return parseCache.getOrSet(expression, () -> {
      LOGGER.debug("Parse cache miss: {}", expression);
      return XPathParser.parse(expression);
    });
  }

  /**
   * Compile an expression without namespace bindings.
   *
   * @param expression the expression
   * @return the compiled query
   * @throws XPathException if the expression is malformed or cannot be compiled
   */
  public CompiledQuery compile(final String expression) throws XPathException {
    return compile(expression, ImmutableMap.of());
  }

  /**
   * Compile an expression with the configured backend.
   *
   * @param expression the expression
   * @param namespaces prefix to URI bindings
   * @return the compiled query
   * @throws XPathException if the expression is malformed or cannot be compiled
   */
  public CompiledQuery compile(final String expression, final Map<String, String> namespaces)
      throws XPathException {
    return compile(expression, namespaces, configuration.getBackend());
  }

  /**
   * Compile an expression.
   *
   * @param expression the expression
   * @param namespaces prefix to URI bindings
   * @param backend the backend to compile with
   * @return the compiled query
   * @throws XPathException if the expression is malformed or cannot be compiled
   */
  public CompiledQuery compile(final String expression, final Map<String, String> namespaces,
      final CompilerBackend backend) throws XPathException {
    checkNotNull(namespaces);
    checkNotNull(backend);
    final AstNode ast = parse(expression);
    final CompileKey key = new CompileKey(ast, ImmutableMap.copyOf(namespaces), backend);
    return compileCache.getOrSet(key, () -> {
      LOGGER.debug("Compiling {} with {}", expression, backend);
      return compiler.compile(ast, new CompilationContext(key.namespaces(), expression),
          backend);
    });
  }

  /**
   * Evaluate an expression against a node.
   *
   * @param expression the expression
   * @param node the context node
   * @return a {@link NodeSet}, {@link String}, {@link Double} or {@link Boolean}
   * @throws XPathException if compilation or evaluation fails
   */
  public Object evaluate(final String expression, final XmlNode node) throws XPathException {
    return evaluate(expression, node, ImmutableMap.of(), ImmutableMap.of());
  }

  public Object evaluate(final String expression, final XmlNode node,
      final Map<String, String> namespaces) throws XPathException {
    return evaluate(expression, node, namespaces, ImmutableMap.of());
  }

  /**
   * Evaluate an expression against a node.
   *
   * @param expression the expression
   * @param node the context node
   * @param namespaces prefix to URI bindings
   * @param variables variable bindings
   * @return a {@link NodeSet}, {@link String}, {@link Double} or {@link Boolean}
   * @throws XPathException if compilation or evaluation fails
   */
  public Object evaluate(final String expression, final XmlNode node,
      final Map<String, String> namespaces, final Map<String, ?> variables)
      throws XPathException {
    checkNotNull(node);
    return compile(expression, namespaces).evaluate(node, variables);
  }

  /**
   * Select the nodes an expression yields.
   *
   * @param expression the expression
   * @param node the context node
   * @return the nodes in document order
   * @throws XPathNodeTypeException if the expression does not yield a node-set
   * @throws XPathException if compilation or evaluation fails
   */
  public NodeSet selectNodes(final String expression, final XmlNode node) throws XPathException {
    return selectNodes(expression, node, ImmutableMap.of());
  }

  public NodeSet selectNodes(final String expression, final XmlNode node,
      final Map<String, String> namespaces) throws XPathException {
    final Object result = evaluate(expression, node, namespaces);
    try {
      return Conversion.toNodeSet(result, "selectNodes");
    } catch (final XPathNodeTypeException e) {
      throw e.initExpression(expression);
    }
  }

  /**
   * Select the first node in document order an expression yields.
   *
   * @param expression the expression
   * @param node the context node
   * @return the first node or {@code null} if the node-set is empty
   * @throws XPathException if compilation or evaluation fails, or the result is no node-set
   */
  public @Nullable XmlNode selectFirst(final String expression, final XmlNode node)
      throws XPathException {
    return selectNodes(expression, node).first();
  }

  public String evaluateString(final String expression, final XmlNode node)
      throws XPathException {
    return Conversion.toString(evaluate(expression, node));
  }

  public double evaluateNumber(final String expression, final XmlNode node)
      throws XPathException {
    return Conversion.toNumber(evaluate(expression, node));
  }

  public boolean evaluateBoolean(final String expression, final XmlNode node)
      throws XPathException {
    return Conversion.toBoolean(evaluate(expression, node));
  }

  /**
   * Check whether an expression is syntactically valid.
   *
   * @param expression the expression
   * @return {@code true} unless parsing fails
   */
  public boolean isValid(final String expression) {
    try {
      parse(expression);
      return true;
    } catch (final XPathSyntaxException e) {
      LOGGER.debug("Invalid expression {}: {}", expression, e.getReason());
      return false;
    }
  }

  /**
   * Render the Java source the generated-source backend would compile for an expression.
   *
   * @param expression the expression
   * @param namespaces prefix to URI bindings
   * @return the compilation unit
   * @throws XPathException if the expression is malformed or cannot be lowered
   */
  public String generateSource(final String expression, final Map<String, String> namespaces)
      throws XPathException {
    final AstNode ast = parse(expression);
    return compiler.generateSource(ast, new CompilationContext(namespaces, expression));
  }

  /**
   * Empty both caches.
   */
  public void clearCaches() {
    parseCache.clear();
    compileCache.clear();
    LOGGER.debug("Caches cleared");
  }

  public int parseCacheSize() {
    return parseCache.size();
  }

  public int compileCacheSize() {
    return compileCache.size();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("configuration", configuration)
                      .add("parseCache", parseCache.size())
                      .add("compileCache", compileCache.size())
                      .toString();
  }
}

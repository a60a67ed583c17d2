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

package io.treepath.xpath.compiler;

import io.treepath.exception.XPathException;
import io.treepath.settings.CompilerBackend;
import io.treepath.xpath.CompiledQuery;
import io.treepath.xpath.ast.AstNode;
import io.treepath.xpath.codegen.InMemoryJavaCompiler;
import io.treepath.xpath.codegen.JavaSourceGenerator;
import io.treepath.xpath.codegen.LoweredQuery;
import io.treepath.xpath.codegen.QueryLowering;
import io.treepath.xpath.runtime.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Turns syntax trees into {@link CompiledQuery} instances with either backend.
 */
public final class QueryCompiler {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(QueryCompiler.class);

  /** Prefix of generated class names. */
  private static final String CLASS_PREFIX = "TreepathQuery";

  private final ClosureCompiler closureCompiler = new ClosureCompiler();

  private final JavaSourceGenerator sourceGenerator = new JavaSourceGenerator();

  private final InMemoryJavaCompiler javaCompiler;

  /** Numbers generated classes, for readable logs and stack traces. */
  private final AtomicLong classCounter = new AtomicLong();

  private final boolean logGeneratedSource;

  /**
   * Constructor.
   *
   * @param javaCompiler compiles generated source
   * @param logGeneratedSource whether to log generated source at DEBUG level
   */
  public QueryCompiler(final InMemoryJavaCompiler javaCompiler,
      final boolean logGeneratedSource) {
    this.javaCompiler = checkNotNull(javaCompiler);
    this.logGeneratedSource = logGeneratedSource;
  }

  public QueryCompiler() {
    this(new InMemoryJavaCompiler(), false);
  }

  /**
   * Compile a syntax tree.
   *
   * @param ast the syntax tree
   * @param context the compilation context, used for this compilation only
   * @param backend the backend
   * @return the compiled query
   * @throws XPathException for static errors or if generated source fails to compile
   */
  public CompiledQuery compile(final AstNode ast, final CompilationContext context,
      final CompilerBackend backend) throws XPathException {
    checkNotNull(ast);
    checkNotNull(context);
    final Evaluator evaluator = switch (backend) {
      case CLOSURES -> closureCompiler.compile(ast, context);
      case GENERATED_SOURCE -> compileGenerated(ast, context);
    };
    final String expression = context.getExpression();
    return new EvaluatorQuery(evaluator, ast, backend,
        expression == null ? ast.toString() : expression);
  }

  /**
   * Render the Java source the {@link CompilerBackend#GENERATED_SOURCE} backend compiles for a
   * syntax tree.
   *
   * @param ast the syntax tree
   * @param context the compilation context
   * @return the compilation unit
   * @throws XPathException for static errors
   */
  public String generateSource(final AstNode ast, final CompilationContext context)
      throws XPathException {
    return generateSource(ast, context, CLASS_PREFIX);
  }

  private String generateSource(final AstNode ast, final CompilationContext context,
      final String simpleName) throws XPathException {
    final LoweredQuery lowered = QueryLowering.lower(ast, context);
    return sourceGenerator.renderClass(simpleName, lowered);
  }

  private Evaluator compileGenerated(final AstNode ast, final CompilationContext context)
      throws XPathException {
    final String simpleName = CLASS_PREFIX + classCounter.incrementAndGet();
    final String source = generateSource(ast, context, simpleName);
    if (logGeneratedSource) {
      LOGGER.debug("Generated source for {}:\n{}", context.getExpression(), source);
    }
    try {
      return javaCompiler.compile(JavaSourceGenerator.PACKAGE + '.' + simpleName, source);
    } catch (final XPathException e) {
      final String expression = context.getExpression();
      throw expression == null ? e : e.initExpression(expression);
    }
  }
}

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

import io.treepath.exception.XPathEvaluationException;
import io.treepath.xpath.runtime.Evaluator;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Compiles generated Java source into an {@link Evaluator} without touching the file system. Every
 * compilation defines its classes in a class loader of its own, so generated classes of different
 * queries never see each other.
 */
public final class InMemoryJavaCompiler {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryJavaCompiler.class);

  private final ClassLoader parentLoader;

  /**
   * Constructor.
   *
   * @param parentLoader the loader the generated classes resolve the runtime classes with
   */
  public InMemoryJavaCompiler(final ClassLoader parentLoader) {
    this.parentLoader = checkNotNull(parentLoader);
  }

  /**
   * Constructor using the loader of the engine's own classes.
   */
  public InMemoryJavaCompiler() {
    this(InMemoryJavaCompiler.class.getClassLoader());
  }

  /**
   * Compile a compilation unit and instantiate the evaluator it declares.
   *
   * @param className fully qualified name of the class implementing {@link Evaluator}
   * @param sourceCode the compilation unit
   * @return a new instance of the class
   * @throws XPathEvaluationException if no compiler is available, the source does not compile or
   *         the class cannot be instantiated
   */
  public Evaluator compile(final String className, final String sourceCode)
      throws XPathEvaluationException {
    checkNotNull(className);
    checkNotNull(sourceCode);
    final JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    if (compiler == null) {
      throw new XPathEvaluationException("No Java compiler available. Run with a JDK, not a JRE.");
    }

    final StringWriter diagnostics = new StringWriter();
    try (InMemoryFileManager fileManager =
        new InMemoryFileManager(compiler.getStandardFileManager(null, null, null))) {
      final JavaCompiler.CompilationTask task = compiler.getTask(diagnostics, fileManager, null,
          options(), null, List.of(new StringJavaFileObject(className, sourceCode)));
      if (!task.call()) {
        LOGGER.warn("Compilation of generated class {} failed:\n{}", className, diagnostics);
        throw new XPathEvaluationException("Compilation of generated query failed: "
            + diagnostics, null, className, null);
      }

      final InMemoryClassLoader classLoader = new InMemoryClassLoader(fileManager, parentLoader);
      final Class<?> evaluatorClass = classLoader.loadClass(className);
      return (Evaluator) evaluatorClass.getDeclaredConstructor().newInstance();
    } catch (final ReflectiveOperationException | ClassCastException e) {
      throw new XPathEvaluationException("Cannot instantiate generated query " + className,
          className, e);
    } catch (final IOException e) {
      throw new XPathEvaluationException("Cannot release the compiler's file manager", className,
          e);
    }
  }

  private List<String> options() {
    final List<String> options = new ArrayList<>(List.of("-proc:none", "-g:none"));
    final Set<String> classPath = classPath(parentLoader);
    if (!classPath.isEmpty()) {
      options.add("-classpath");
      options.add(String.join(File.pathSeparator, classPath));
    }
    return options;
  }

  /**
   * Collect the class path generated sources compile against: the location of the runtime
   * classes, the file URLs of every {@link URLClassLoader} from the given loader up to the
   * bootstrap loader, and {@code java.class.path}. Entries nested in other archives are not
   * supported by the JDK compiler and are skipped.
   *
   * @param loader the loader generated classes are defined under
   * @return class path entries in lookup order, without duplicates
   */
  static Set<String> classPath(final ClassLoader loader) {
    final Set<String> entries = new LinkedHashSet<>();
    final CodeSource runtime = Evaluator.class.getProtectionDomain().getCodeSource();
    if (runtime != null && runtime.getLocation() != null) {
      addLocation(entries, runtime.getLocation());
    }
    for (ClassLoader current = loader; current != null; current = current.getParent()) {
      if (current instanceof URLClassLoader urlClassLoader) {
        for (final URL url : urlClassLoader.getURLs()) {
          addLocation(entries, url);
        }
      }
    }
    final String systemClassPath = System.getProperty("java.class.path");
    if (systemClassPath != null && !systemClassPath.isEmpty()) {
      for (final String entry : systemClassPath.split(File.pathSeparator)) {
        if (!entry.isEmpty()) {
          entries.add(entry);
        }
      }
    }
    return entries;
  }

  private static void addLocation(final Set<String> entries, final URL location) {
    if (!"file".equals(location.getProtocol())) {
      LOGGER.debug("Skipping class path entry {}", location);
      return;
    }
    try {
      entries.add(Paths.get(location.toURI()).toString());
    } catch (final URISyntaxException | IllegalArgumentException e) {
      LOGGER.debug("Skipping class path entry {}: {}", location, e.getMessage());
    }
  }

  /** Source held in a string. */
  private static final class StringJavaFileObject extends SimpleJavaFileObject {
    private final String code;

    StringJavaFileObject(final String className, final String code) {
      super(URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension),
          Kind.SOURCE);
      this.code = code;
    }

    @Override
    public CharSequence getCharContent(final boolean ignoreEncodingErrors) {
      return code;
    }
  }

  /** Class file held in a byte array. */
  private static final class ByteArrayJavaFileObject extends SimpleJavaFileObject {
    private byte @Nullable [] bytes;

    ByteArrayJavaFileObject(final String className) {
      super(URI.create("bytes:///" + className.replace('.', '/') + Kind.CLASS.extension),
          Kind.CLASS);
    }

    @Override
    public OutputStream openOutputStream() {
      return new ByteArrayOutputStream() {
        @Override
        public void close() {
          bytes = toByteArray();
        }
      };
    }

    byte @Nullable [] getBytes() {
      return bytes;
    }
  }

  /** Keeps class files in memory. */
  private static final class InMemoryFileManager
      extends ForwardingJavaFileManager<StandardJavaFileManager> {
    private final Map<String, ByteArrayJavaFileObject> classFiles = new HashMap<>();

    InMemoryFileManager(final StandardJavaFileManager delegate) {
      super(delegate);
    }

    @Override
    public JavaFileObject getJavaFileForOutput(final Location location, final String className,
        final JavaFileObject.Kind kind, final FileObject sibling) {
      final ByteArrayJavaFileObject fileObject = new ByteArrayJavaFileObject(className);
      classFiles.put(className, fileObject);
      return fileObject;
    }

    byte @Nullable [] getClassBytes(final String className) {
      final ByteArrayJavaFileObject file = classFiles.get(className);
      return file != null ? file.getBytes() : null;
    }
  }

  /** Defines the classes of one compilation. */
  private static final class InMemoryClassLoader extends ClassLoader {
    private final InMemoryFileManager fileManager;

    InMemoryClassLoader(final InMemoryFileManager fileManager, final ClassLoader parent) {
      super(parent);
      this.fileManager = fileManager;
    }

    @Override
    protected Class<?> findClass(final String name) throws ClassNotFoundException {
      final byte[] bytes = fileManager.getClassBytes(name);
      if (bytes == null) {
        throw new ClassNotFoundException(name);
      }
      return defineClass(name, bytes, 0, bytes.length);
    }
  }
}

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

/**
 * Node types of the generated-code tree.
 */
public enum CodeType {
  /** Literal value: string, number, boolean or {@code null}. */
  LITERAL,
  /** Reference to a local variable, parameter or field. */
  VAR,
  /** Verbatim reference to a constant, e.g. {@code Axis.CHILD}. */
  CONST,
  /** Variable declaration; value is the name, children are the type and the initializer. */
  DECLARE,
  /** Assignment; value is the variable name, single child is the new value. */
  ASSIGN,
  /** Block of statements. */
  SEQUENCE,
  /** Conditional; children are the condition, the then block and an optional else block. */
  IF,
  /** Loop over an iterable; value is the loop variable, children are type, iterable and body. */
  EACH,
  /** Counting loop from 1 to a limit; value is the counter, children are limit and body. */
  COUNT,
  /** Method call; value is the method name, children are the receiver and the arguments. */
  CALL,
  /** Instance creation; value is the class name, children are the arguments. */
  NEW,
  /** Array creation; value is the element type, children are the elements. */
  ARRAY,
  /** Lambda; value is the parameter name, single child is the body. */
  LAMBDA,
  /** Return statement. */
  RETURN
}

/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.grapl.parse;

import static net.hydromatic.grapl.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.grapl.ast.Ast;
import net.hydromatic.grapl.ast.Pos;
import net.hydromatic.grapl.ast.Shuttle;
import net.hydromatic.grapl.compile.Prop;
import net.hydromatic.grapl.util.GraplException;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /** Parses an expression. */
  public static Ast.Exp parseExpression(String text) {
    return parseExpression(text, ImmutableMap.of());
  }

  /** Parses an expression, with properties that set limits. */
  public static Ast.Exp parseExpression(
      String text, Map<Prop, Object> propMap) {
    return parse(text, propMap, GraplParser::expressionEof);
  }

  /** Parses a program. */
  public static Ast.Program parseProgram(String text) {
    return parseProgram(text, ImmutableMap.of());
  }

  /** Parses a program, with properties that set limits. */
  public static Ast.Program parseProgram(
      String text, Map<Prop, Object> propMap) {
    return parse(text, propMap, GraplParser::programEof);
  }

  /**
   * Parses a program from UTF-8 bytes.
   *
   * <p>A malformed byte sequence is a {@link GraplParseException} at the
   * position of the first bad byte.
   */
  public static Ast.Program parseProgram(
      byte[] bytes, Map<Prop, Object> propMap) {
    return parseProgram(decode(bytes), propMap);
  }

  /** Decodes UTF-8 bytes, failing on malformed or unmappable input. */
  static String decode(byte[] bytes) {
    final CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    final ByteBuffer in = ByteBuffer.wrap(bytes);
    final CharBuffer out =
        CharBuffer.allocate(
            (int) (bytes.length * decoder.maxCharsPerByte()) + 1);
    CoderResult result = decoder.decode(in, out, true);
    if (!result.isError()) {
      result = decoder.flush(out);
    }
    out.flip();
    final String text = out.toString();
    if (result.isError()) {
      throw new GraplParseException(
          "invalid UTF-8 at byte offset " + in.position(),
          pointPos(text, text.length()),
          ImmutableList.of(),
          null);
    }
    return text;
  }

  private static <T> T parse(
      String text, Map<Prop, Object> propMap, ParseFunction<T> fn) {
    final GraplParserImpl parser =
        new GraplParserImpl(new StringReader(text));
    parser.zero("");
    parser.setMaxDepth(Prop.MAX_DEPTH.intValue(propMap));
    try {
      return fn.apply(parser);
    } catch (ParseException e) {
      throw toGraplParseException(text, parser, e);
    } catch (TokenMgrError e) {
      throw new GraplParseException(
          e.getMessage(), parser.pos(), ImmutableList.of(), e);
    } catch (StackOverflowError e) {
      throw new GraplParseException(
          "expression is too deeply nested", parser.pos(), ImmutableList.of(),
          e);
    } catch (RuntimeException e) {
      if (e instanceof GraplException) {
        throw e;
      }
      throw new GraplParseException(
          String.valueOf(e.getMessage()), parser.pos(), ImmutableList.of(), e);
    }
  }

  /** Converts a JavaCC exception into one with a position and the list of
   * expected tokens. */
  static GraplParseException toGraplParseException(
      String text, GraplParserImpl parser, ParseException e) {
    if (e.currentToken == null || e.currentToken.next == null) {
      return new GraplParseException(
          String.valueOf(e.getMessage()), parser.pos(), ImmutableList.of(), e);
    }
    final Token token = e.currentToken.next;
    final Set<String> expected = new TreeSet<>();
    if (e.expectedTokenSequences != null) {
      for (int[] sequence : e.expectedTokenSequences) {
        if (sequence.length > 0) {
          expected.add(e.tokenImage[sequence[0]]);
        }
      }
    }
    final Pos pos;
    final String found;
    if (token.kind == GraplParserImplConstants.EOF) {
      pos = pointPos(text, text.length());
      found = "end of input";
    } else {
      pos = parser.pos(token);
      found = "\"" + token.image + "\"";
    }
    final StringBuilder b = new StringBuilder("unexpected ").append(found);
    if (!expected.isEmpty()) {
      b.append("; expected ").append(String.join(" or ", expected));
    }
    return new GraplParseException(
        b.toString(), pos, ImmutableList.copyOf(expected), e);
  }

  /** Returns the one-character position at an offset into some text. */
  private static Pos pointPos(String text, int offset) {
    final Pos p = Pos.of(text, "", offset, offset);
    return new Pos(
        p.file, p.startLine, p.startColumn, p.startLine, p.startColumn + 1);
  }

  /**
   * Converts each vertex whose name is defined in a program into a reference
   * to that definition.
   */
  public static Ast.Program bindVariables(Ast.Program program) {
    final Set<String> names =
        program.definitions.stream()
            .map(d -> d.name)
            .collect(ImmutableSet.toImmutableSet());
    if (names.isEmpty()) {
      return program;
    }
    return program.accept(
        new Shuttle() {
          @Override
          protected Ast.Exp visit(Ast.Vertex vertex) {
            return names.contains(vertex.name)
                ? ast.varRef(vertex.pos, vertex.name)
                : vertex;
          }
        });
  }

  /** Parse action that may throw a JavaCC exception.
   *
   * @param <T> Result type */
  @FunctionalInterface
  private interface ParseFunction<T> {
    T apply(GraplParser parser) throws ParseException;
  }
}

// End Parsers.java

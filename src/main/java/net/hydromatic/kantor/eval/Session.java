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
package net.hydromatic.kantor.eval;

import net.hydromatic.kantor.ast.Ast;
import net.hydromatic.kantor.parse.KantorParseException;
import net.hydromatic.kantor.parse.KantorParser;
import net.hydromatic.kantor.parse.Lexer;
import net.hydromatic.kantor.type.Binding;
import net.hydromatic.kantor.util.KantorException;
import net.hydromatic.kantor.util.Outcome;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/** Session environment.
 *
 * <p>Bindings made by one call to {@link #execute} are visible to the
 * next. */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;
  /** Values and types bound so far. */
  public final Environment env = new Environment();
  private final Evaluator evaluator;
  private final Tracer tracer;

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as is,
   * not copied. It should probably be a {@link LinkedHashMap} to provide
   * deterministic iteration order.
   *
   * @param map Map that contains property values
   * @param tracer Receives parse results, bindings and errors */
  public Session(Map<Prop, Object> map, Tracer tracer) {
    this.map = requireNonNull(map, "map");
    this.tracer = requireNonNull(tracer, "tracer");
    this.evaluator = new Evaluator(env, tracer);
  }

  /** Creates a Session with default properties. */
  public Session() {
    this(new LinkedHashMap<>(), Tracers.empty());
  }

  /** Returns a printer configured by this session's properties. */
  public Pretty pretty() {
    return new Pretty(env::getType, Prop.PRINT_LENGTH.intValue(map),
        Prop.STRING_DEPTH.intValue(map));
  }

  /** Parses and evaluates a program read from standard input. Returns
   * whether every declaration succeeded. */
  public boolean execute(String source, Consumer<String> outLines) {
    return execute(Lexer.STDIN, source, outLines);
  }

  /** Parses and evaluates a program, writing one line per declaration to
   * {@code outLines}.
   *
   * <p>If the program has a syntax error, writes the error and evaluates
   * nothing. If a declaration fails, writes the error and continues with
   * the next declaration, unless {@link Prop#CONTINUE_ON_ERROR} is false.
   *
   * @param file Name of the file, used in error positions
   * @param source Program text
   * @param outLines Receives output lines
   * @return Whether every declaration succeeded
   */
  public boolean execute(String file, String source,
      Consumer<String> outLines) {
    final Ast.Program program;
    try {
      program = KantorParser.parse(new Lexer(file, source).tokenize());
    } catch (KantorParseException e) {
      handle(e, outLines);
      return false;
    }
    tracer.onParse(program);

    final boolean echo = Prop.ECHO.booleanValue(map);
    final boolean continueOnError = Prop.CONTINUE_ON_ERROR.booleanValue(map);
    final Pretty pretty = pretty();
    boolean ok = true;
    for (Ast.Decl decl : program.decls) {
      if (echo) {
        outLines.accept(decl.toString());
      }
      final Outcome<Binding> outcome = evaluator.tryEvaluate(decl);
      if (outcome.isOk()) {
        outLines.accept(pretty.format(outcome.get()));
      } else {
        ok = false;
        handle(outcome.error(), outLines);
        if (!continueOnError) {
          break;
        }
      }
    }

    if (Prop.SUMMARY.booleanValue(map)) {
      summarize(pretty, outLines);
    }
    return ok;
  }

  /** Writes an exception to the output, and passes it to the tracer. */
  private void handle(KantorException e, Consumer<String> outLines) {
    outLines.accept(e.describeTo(new StringBuilder()).toString());
    tracer.onException(e);
  }

  /** Writes every bound set and defined type, each in the order it was
   * first defined. */
  public void summarize(Pretty pretty, Consumer<String> outLines) {
    final List<Binding> bindings = env.bindings();
    outLines.accept("Sets:");
    if (bindings.stream().allMatch(Binding::isType)) {
      outLines.accept("  (none)");
    }
    for (Binding binding : bindings) {
      if (!binding.isType()) {
        final StringBuilder buf =
            new StringBuilder("  ").append(binding.name);
        if (binding.typeName != null) {
          buf.append(" : ").append(binding.typeName);
        }
        buf.append(" = ");
        outLines.accept(
            pretty.pretty(buf, requireNonNull(binding.value),
                binding.typeName).toString());
      }
    }
    outLines.accept("Types:");
    if (bindings.stream().noneMatch(Binding::isType)) {
      outLines.accept("  (none)");
    }
    for (Binding binding : bindings) {
      if (binding.isType()) {
        outLines.accept("  " + binding.name + " = "
            + requireNonNull(binding.shape).moniker());
      }
    }
  }
}

// End Session.java

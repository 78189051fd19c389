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
package net.hydromatic.kantor;

import net.hydromatic.kantor.eval.Prop;
import net.hydromatic.kantor.eval.Session;
import net.hydromatic.kantor.eval.Tracers;
import net.hydromatic.kantor.parse.Lexer;

import com.google.common.collect.ImmutableList;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/** Command-line driver that evaluates Kantor programs.
 *
 * <p>Arguments that start with "--" are options; the others are names of
 * files to evaluate, in order, in a single session. If there are no file
 * names, reads a program from standard input.
 *
 * <p>Options:
 * <ul>
 *   <li>{@code --echo} prints each declaration before its result;
 *   <li>{@code --summary} lists all sets and types at the end;
 *   <li>{@code --name=value} sets the property {@code name}, for example
 *   {@code --printLength=10} or {@code --continueOnError=false}.
 * </ul>
 */
public class Main {
  private final BufferedReader in;
  private final PrintWriter out;
  private final List<String> files;
  final Session session;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final Main main;
    try {
      main = new Main(argList, System.in, System.out, propMap);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.exit(2);
      return;
    }
    try {
      if (!main.run()) {
        System.exit(1);
      }
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(List<String> args, InputStream in, PrintStream out,
      Map<Prop, Object> propMap) {
    this(args,
        new InputStreamReader(in, StandardCharsets.UTF_8),
        new OutputStreamWriter(out, StandardCharsets.UTF_8),
        propMap);
  }

  /** Creates a Main.
   *
   * @throws IllegalArgumentException if an option is not valid */
  public Main(List<String> argList, Reader in, Writer out,
      Map<Prop, Object> propMap) {
    this.in = buffer(in);
    this.out = buffer(out);
    this.files = new ArrayList<>();
    for (String arg : argList) {
      if (arg.startsWith("--")) {
        option(arg.substring("--".length()), propMap);
      } else {
        files.add(arg);
      }
    }
    this.session = new Session(propMap, Tracers.empty());
  }

  /** Applies an option such as "echo" or "printLength=10". An option with
   * no value sets a boolean property to true. */
  private static void option(String option, Map<Prop, Object> propMap) {
    final int i = option.indexOf('=');
    if (i < 0) {
      Prop.lookup(option).setLenient(propMap, "true");
    } else {
      Prop.lookup(option.substring(0, i))
          .setLenient(propMap, option.substring(i + 1));
    }
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  private static BufferedReader buffer(Reader in) {
    if (in instanceof BufferedReader) {
      return (BufferedReader) in;
    } else {
      return new BufferedReader(in);
    }
  }

  private static String readAll(Reader r) {
    final StringBuilder b = new StringBuilder();
    final char[] chars = new char[1024];
    try {
      for (;;) {
        final int read = r.read(chars);
        if (read < 0) {
          return b.toString();
        }
        b.append(chars, 0, read);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Evaluates the input and writes results to the output. Returns whether
   * every declaration succeeded. */
  public boolean run() {
    final Consumer<String> outLines = out::println;
    boolean ok = true;
    try {
      if (files.isEmpty()) {
        ok = session.execute(Lexer.STDIN, readAll(in), outLines);
      } else {
        final boolean continueOnError =
            Prop.CONTINUE_ON_ERROR.booleanValue(session.map);
        for (String file : files) {
          final String source;
          try {
            source = new String(Files.readAllBytes(Paths.get(file)),
                StandardCharsets.UTF_8);
          } catch (IOException e) {
            outLines.accept("Cannot read file " + file + ": " + e);
            ok = false;
            if (!continueOnError) {
              break;
            }
            continue;
          }
          if (!session.execute(file, source, outLines)) {
            ok = false;
            if (!continueOnError) {
              break;
            }
          }
        }
      }
    } finally {
      out.flush();
    }
    return ok;
  }
}

// End Main.java

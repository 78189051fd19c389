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
import net.hydromatic.kantor.parse.KantorParseException;
import net.hydromatic.kantor.parse.KantorParser;
import net.hydromatic.kantor.parse.Lexer;
import net.hydromatic.kantor.parse.TokenType;
import net.hydromatic.kantor.util.Outcome;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Runnables;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.MaskingCallback;
import org.jline.reader.ParsedLine;
import org.jline.reader.Parser;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/** Command shell for Kantor, powered by JLine3.
 *
 * <p>Reads declarations line by line. A declaration may span several lines;
 * the shell keeps reading while braces or parentheses are open, or while
 * the text so far ends in the middle of a declaration. Bindings persist
 * from one declaration to the next.
 *
 * <p>With a dumb terminal, lines are read directly from the input stream,
 * and the terminal is used only for output. */
public class Shell {
  private final ConfigImpl config;
  private final Terminal terminal;
  /** Source of lines if the terminal is dumb; null to read via JLine. */
  private final @Nullable BufferedReader reader;

  /** Command-line entry point.
   *
   * @param args Command-line arguments */
  public static void main(String[] args) {
    try {
      final Shell main = create(ImmutableList.copyOf(args), System.in,
          System.out);
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Shell. */
  public static Shell create(List<String> args, InputStream in,
      OutputStream out) throws IOException {
    final Config config = parse(ConfigImpl.DEFAULT, args);
    return create(config, in, out);
  }

  /** Creates a Shell. */
  public static Shell create(Config config, InputStream in,
      OutputStream out) throws IOException {
    final TerminalBuilder builder = TerminalBuilder.builder();
    final ConfigImpl configImpl = (ConfigImpl) config;
    final BufferedReader reader;
    if (configImpl.dumb) {
      // The terminal gets an empty input, so that it does not compete with
      // the reader for bytes.
      builder.streams(new ByteArrayInputStream(new byte[0]), out);
      builder.type("dumb");
      reader = new BufferedReader(new InputStreamReader(in, UTF_8));
    } else {
      builder.streams(in, out);
      reader = null;
    }
    builder.system(configImpl.system);
    builder.dumb(configImpl.dumb);
    final Terminal terminal = builder.build();
    return new Shell(config, terminal, reader);
  }

  /** Creates a Shell that reads lines from a terminal. */
  public Shell(Config config, Terminal terminal) {
    this(config, terminal, null);
  }

  private Shell(Config config, Terminal terminal,
      @Nullable BufferedReader reader) {
    this.config = (ConfigImpl) config;
    this.terminal = terminal;
    this.reader = reader;
  }

  /** Parses an argument list to an equivalent Config. */
  public static Config parse(Config config, List<String> argList) {
    ConfigImpl c = (ConfigImpl) config;
    for (String arg : argList) {
      if (arg.equals("--banner=false")) {
        c = c.withBanner(false);
      } else if (arg.equals("--terminal=dumb")) {
        c = c.withDumb(true);
      } else if (arg.equals("--echo")) {
        c = c.withEcho(true);
      } else if (arg.equals("--help")) {
        c = c.withHelp(true);
      } else if (arg.equals("--system=false")) {
        c = c.withSystem(false);
      } else if (arg.startsWith("--printLength=")) {
        c = c.withPrintLength(
            Integer.parseInt(arg.substring("--printLength=".length())));
      }
    }
    return c;
  }

  static void usage(Consumer<String> outLines) {
    String[] usageLines = {
        "Usage: java " + Shell.class.getName()
            + " [--banner=false] [--terminal=dumb] [--echo]"
            + " [--printLength=N] [--help]",
    };
    Arrays.asList(usageLines).forEach(outLines);
  }

  static void help(Consumer<String> outLines) {
    String[] helpLines = {
        "List of available commands:",
        "    help   Print this help",
        "    quit   Quit shell",
    };
    Arrays.asList(helpLines).forEach(outLines);
  }

  /** Pauses after creating the terminal.
   *
   * <p>Calls the value set by {@link Config#withPauseFn(Runnable)} which,
   * for the default config, does nothing;
   * the instance used in testing pauses for a few milliseconds,
   * which gives classes time to load and makes test deterministic. */
  protected final void pause() {
    config.pauseFn.run();
  }

  /** Returns whether we can ignore a line. We can ignore a line if it consists
   * only of a comment and spaces, and if we are not on a continuation
   * line. */
  private static boolean canIgnoreLine(StringBuilder buf, String line) {
    final String trimmedLine = line.replaceAll("//.*$", "").trim();
    return buf.length() == 0 && trimmedLine.isEmpty();
  }

  /** Categorizes a line that has been read. Commands such as "quit" are
   * recognized only at the start of a piece of code. */
  static Line classify(StringBuilder buf, String line) {
    if (canIgnoreLine(buf, line)) {
      return Line.IGNORE;
    }
    if (buf.length() == 0
        && (line.trim().equalsIgnoreCase("quit")
            || line.trim().equalsIgnoreCase("exit"))) {
      return Line.QUIT;
    }
    if (buf.length() == 0
        && (line.trim().equals("help") || line.trim().equals("?"))) {
      return Line.HELP;
    }
    return new Line(LineType.REGULAR, line);
  }

  /** Returns whether a piece of code is incomplete: it fails to parse only
   * because input ended too soon. */
  static boolean isIncomplete(String code) {
    final Outcome<?> outcome = KantorParser.tryParse(Lexer.tokenize(code));
    if (outcome.isOk()) {
      return false;
    }
    return outcome.error() instanceof KantorParseException
        && ((KantorParseException) outcome.error()).token.type
            == TokenType.EOF;
  }

  /** Generates a banner to be shown on startup. */
  private String banner() {
    return "kantor version 0.1.0"
        + " (java version \"" + System.getProperty("java.version")
        + "\", JRE " + System.getProperty("java.vendor.version")
        + " (build " + System.getProperty("java.vm.version")
        + "), " + terminal.getName()
        + ", " + terminal.getType() + ")";
  }

  public void run() {
    if (config.help) {
      usage(terminal.writer()::println);
      terminal.writer().flush();
      return;
    }

    final Parser parser = new DefaultParser() {
      {
        setEofOnUnclosedBracket(DefaultParser.Bracket.CURLY,
            DefaultParser.Bracket.ROUND);
      }

      @Override public ParsedLine parse(String line, int cursor,
          ParseContext context) {
        // Remove from "//" to end of line, if present
        if (line.contains("//")) {
          line = line.replaceAll("//.*$", "");
        }
        return super.parse(line, cursor, context);
      }
    };

    final String equalsPrompt = new AttributedStringBuilder()
        .style(AttributedStyle.DEFAULT.bold()).append("=")
        .style(AttributedStyle.DEFAULT).append(" ")
        .toAnsi(terminal);
    final String minusPrompt = new AttributedStringBuilder()
        .style(AttributedStyle.DEFAULT.bold()).append("-")
        .style(AttributedStyle.DEFAULT).append(" ")
        .toAnsi(terminal);

    if (config.banner) {
      terminal.writer().println(banner());
    }
    LineReader lineReader = LineReaderBuilder.builder()
        .appName("kantor")
        .terminal(terminal)
        .parser(parser)
        .variable(LineReader.SECONDARY_PROMPT_PATTERN, equalsPrompt)
        .build();

    pause();
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    Prop.ECHO.set(propMap, config.echo);
    if (config.printLength >= 0) {
      Prop.PRINT_LENGTH.set(propMap, config.printLength);
    }
    final Session session = new Session(propMap, Tracers.empty());
    final LineFn lineFn = reader != null
        ? new ReaderLineFn(minusPrompt, equalsPrompt, reader,
            terminal.writer())
        : new TerminalLineFn(minusPrompt, equalsPrompt, lineReader);
    loop(lineFn, session, terminal.writer()::println);
    terminal.writer().flush();
  }

  /** Reads lines until end of input or "quit", evaluating each complete
   * piece of code in the session. */
  static void loop(LineFn lineFn, Session session,
      Consumer<String> outLines) {
    final StringBuilder buf = new StringBuilder();
    for (;;) {
      final Line line = lineFn.read(buf);
      switch (line.type) {
      case EOF:
      case QUIT:
        return;

      case INTERRUPT:
        buf.setLength(0);
        continue;

      case IGNORE:
        continue;

      case HELP:
        help(outLines);
        break;

      case REGULAR:
        buf.append(line.text);
        final String code = buf.toString();
        if (isIncomplete(code)) {
          buf.append("\n");
          break;
        }
        buf.setLength(0);
        session.execute(Lexer.STDIN, code, outLines);
        break;

      default:
        throw new AssertionError(line.type);
      }
    }
  }

  /** Shell configuration. */
  @SuppressWarnings("unused")
  public interface Config {
    @SuppressWarnings("UnstableApiUsage")
    Config DEFAULT =
        new ConfigImpl(true, false, true, false, false, -1,
            Runnables.doNothing());

    Config withBanner(boolean banner);
    Config withDumb(boolean dumb);
    Config withSystem(boolean system);
    Config withEcho(boolean echo);
    Config withHelp(boolean help);
    Config withPrintLength(int printLength);
    Config withPauseFn(Runnable runnable);
  }

  /** Implementation of {@link Config}. */
  private static class ConfigImpl implements Config {
    private final boolean banner;
    private final boolean dumb;
    private final boolean echo;
    private final boolean help;
    private final boolean system;
    private final int printLength;
    private final Runnable pauseFn;

    private ConfigImpl(boolean banner, boolean dumb, boolean system,
        boolean echo, boolean help, int printLength, Runnable pauseFn) {
      this.banner = banner;
      this.dumb = dumb;
      this.system = system;
      this.echo = echo;
      this.help = help;
      this.printLength = printLength;
      this.pauseFn = requireNonNull(pauseFn, "pauseFn");
    }

    @Override public ConfigImpl withBanner(boolean banner) {
      if (this.banner == banner) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, printLength,
          pauseFn);
    }

    @Override public ConfigImpl withDumb(boolean dumb) {
      if (this.dumb == dumb) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, printLength,
          pauseFn);
    }

    @Override public ConfigImpl withSystem(boolean system) {
      if (this.system == system) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, printLength,
          pauseFn);
    }

    @Override public ConfigImpl withEcho(boolean echo) {
      if (this.echo == echo) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, printLength,
          pauseFn);
    }

    @Override public ConfigImpl withHelp(boolean help) {
      if (this.help == help) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, printLength,
          pauseFn);
    }

    @Override public ConfigImpl withPrintLength(int printLength) {
      if (this.printLength == printLength) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, printLength,
          pauseFn);
    }

    @Override public ConfigImpl withPauseFn(Runnable pauseFn) {
      if (this.pauseFn.equals(pauseFn)) {
        return this;
      }
      return new ConfigImpl(banner, dumb, system, echo, help, printLength,
          pauseFn);
    }
  }

  /** Abstraction of a terminal's line reader. Can read lines from an input
   * (terminal or file) and categorize the lines. */
  interface LineFn {
    Line read(StringBuilder buf);
  }

  /** Type of line from {@link LineFn}. */
  enum LineType {
    QUIT,
    EOF,
    INTERRUPT,
    IGNORE,
    HELP,
    REGULAR
  }

  /** A line read by a {@link LineFn}, and its type. */
  static final class Line {
    static final Line EOF = new Line(LineType.EOF, "");
    static final Line QUIT = new Line(LineType.QUIT, "");
    static final Line INTERRUPT = new Line(LineType.INTERRUPT, "");
    static final Line IGNORE = new Line(LineType.IGNORE, "");
    static final Line HELP = new Line(LineType.HELP, "");

    final LineType type;
    final String text;

    Line(LineType type, String text) {
      this.type = requireNonNull(type);
      this.text = requireNonNull(text);
    }
  }

  /** Implementation of {@link LineFn} that reads from JLine's terminal.
   * It is used for interactive sessions. */
  private static class TerminalLineFn implements LineFn {
    private final String minusPrompt;
    private final String equalsPrompt;
    private final LineReader lineReader;

    TerminalLineFn(String minusPrompt, String equalsPrompt,
        LineReader lineReader) {
      this.minusPrompt = minusPrompt;
      this.equalsPrompt = equalsPrompt;
      this.lineReader = lineReader;
    }

    @Override public Line read(StringBuilder buf) {
      final String line;
      try {
        final String prompt = buf.length() == 0 ? minusPrompt : equalsPrompt;
        final String rightPrompt = null;
        line = lineReader.readLine(prompt, rightPrompt, (MaskingCallback) null,
            null);
      } catch (UserInterruptException e) {
        return Line.INTERRUPT;
      } catch (EndOfFileException e) {
        return Line.EOF;
      }

      return classify(buf, line);
    }
  }

  /** Implementation of {@link LineFn} that reads from a character stream,
   * writing each prompt and line to the output as if typed. It is used
   * when the terminal is dumb, such as when input is piped. */
  private static class ReaderLineFn implements LineFn {
    private final String minusPrompt;
    private final String equalsPrompt;
    private final BufferedReader reader;
    private final PrintWriter writer;

    ReaderLineFn(String minusPrompt, String equalsPrompt,
        BufferedReader reader, PrintWriter writer) {
      this.minusPrompt = minusPrompt;
      this.equalsPrompt = equalsPrompt;
      this.reader = reader;
      this.writer = writer;
    }

    @Override public Line read(StringBuilder buf) {
      final String line;
      try {
        line = reader.readLine();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
      if (line == null) {
        return Line.EOF;
      }
      writer.print(buf.length() == 0 ? minusPrompt : equalsPrompt);
      writer.println(line);
      return classify(buf, line);
    }
  }
}

// End Shell.java

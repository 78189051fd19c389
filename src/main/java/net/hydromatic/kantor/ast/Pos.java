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
package net.hydromatic.kantor.ast;

import com.google.common.collect.ImmutableList;

import java.util.Objects;

/** Position of a token or parse-tree node.
 *
 * <p>Lines and columns are 1-based. The end column is exclusive, so a
 * one-character token at line 1, column 5 has {@code endColumn} 6. */
public class Pos {
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(String file, int startLine, int startColumn,
      int endLine, int endColumn) {
    this.file = Objects.requireNonNull(file);
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  @Override public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
        && this.startLine == ((Pos) o).startLine
        && this.startColumn == ((Pos) o).startColumn
        && this.endLine == ((Pos) o).endLine
        && this.endColumn == ((Pos) o).endColumn;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes this position to a buffer, in the form "file:1.5-1.9". */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-')
          .append(endLine)
          .append('.')
          .append(endColumn);
    }
    return buf;
  }

  /** Returns a position that spans this position and another. */
  public Pos plus(Pos pos) {
    return plusAll(ImmutableList.of(pos));
  }

  /** Returns a position that spans this position and several others.
   * Ignores {@link #ZERO}. */
  public Pos plusAll(Iterable<Pos> poses) {
    int line = startLine;
    int column = startColumn;
    int endLine = this.endLine;
    int endColumn = this.endColumn;
    String file = this.file;
    for (Pos pos : poses) {
      if (pos == null || pos.equals(ZERO)) {
        continue;
      }
      if (file.isEmpty()) {
        file = pos.file;
      }
      if (pos.startLine < line
          || pos.startLine == line && pos.startColumn < column) {
        line = pos.startLine;
        column = pos.startColumn;
      }
      if (pos.endLine > endLine
          || pos.endLine == endLine && pos.endColumn > endColumn) {
        endLine = pos.endLine;
        endColumn = pos.endColumn;
      }
    }
    return new Pos(file, line, column, endLine, endColumn);
  }
}

// End Pos.java

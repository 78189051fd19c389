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

import com.google.common.collect.ImmutableList;
import com.google.common.io.PatternFilenameFilter;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.File;
import java.io.FilenameFilter;
import java.io.Reader;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Stream;

import static net.hydromatic.kantor.TestUtils.resourceFile;
import static net.hydromatic.kantor.TestUtils.u2n;

import static org.junit.jupiter.api.Assertions.fail;

/** Test that runs script files and compares their output with reference
 * files.
 *
 * <p>For each {@code script/foo.kan} under the test resources, runs the
 * script with {@code --echo}, writes the output to
 * {@code surefire/script/foo.kan.out} next to it, and compares with the
 * reference file {@code script/foo.kan.out}. */
public class ScriptTest {
  /** For {@link ParameterizedTest} runner. */
  @SuppressWarnings("unused")
  static Stream<Arguments> data() {
    // Start with a test file we know exists, then find the directory and list
    // its files.
    final String first = "script/simple.kan";
    final File firstFile = resourceFile(first);
    final int commonPrefixLength =
        firstFile.getAbsolutePath().length() - first.length();
    @SuppressWarnings("UnstableApiUsage")
    final FilenameFilter filter = new PatternFilenameFilter(".*\\.kan$");
    final File[] files = firstFile.getParentFile().listFiles(filter);
    return Stream.of(files == null ? new File[0] : files)
        .sorted()
        .map(f -> Arguments.of(f.getAbsolutePath()
            .substring(commonPrefixLength)));
  }

  @ParameterizedTest(name = "{index}: script({0})")
  @MethodSource("data")
  void test(String path) throws Exception {
    final File inFile = resourceFile(path);
    final File outFile =
        new File(inFile.getParentFile().getParentFile(),
            u2n("surefire/") + path + ".out");
    if (!outFile.getParentFile().exists()
        && !outFile.getParentFile().mkdirs()) {
      fail("cannot create directory " + outFile.getParentFile());
    }
    final List<String> args = ImmutableList.of("--echo");
    try (Reader reader = TestUtils.reader(inFile);
         Writer writer = TestUtils.printWriter(outFile)) {
      new Main(args, reader, writer, new LinkedHashMap<>()).run();
    }
    final File refFile =
        new File(inFile.getParentFile(), inFile.getName() + ".out");
    if (!refFile.exists()) {
      fail("Reference file not found: " + refFile + "\n"
          + "Out file is: " + outFile + "\n");
    }
    final String diff = TestUtils.diff(refFile, outFile);
    if (!diff.isEmpty()) {
      fail("Files differ: " + refFile + " " + outFile + "\n" + diff);
    }
  }
}

// End ScriptTest.java

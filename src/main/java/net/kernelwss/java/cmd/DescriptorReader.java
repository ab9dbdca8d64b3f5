// Copyright 2026 The Kernelwss Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.kernelwss.java.cmd;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.kernelwss.java.analysis.AnalysisContext;
import net.kernelwss.java.analysis.LoopDescriptor;
import net.kernelwss.java.eval.GridDimension;
import net.kernelwss.java.eval.KernelInvocation;
import net.kernelwss.java.eval.LaunchConfig;
import net.kernelwss.java.syntax.ExprTree;
import net.kernelwss.java.syntax.ParseError;
import net.kernelwss.java.syntax.TreeBuilder;
import net.kernelwss.java.syntax.Tokens;

/**
 * DescriptorReader loads the flat files written by the device-side pass into an {@link
 * AnalysisContext}, and reads kernel launches from an invocation file.
 *
 * <p>All files hold one whitespace-separated record per line; blank lines and lines starting with
 * {@code #} are skipped. A missing descriptor file counts as empty.
 */
public final class DescriptorReader {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final String LOOP_FILE = "loop_detail_file.lst";
  public static final String PHI_FILE = "phi_loop_file.lst";
  public static final String ACCESS_FILE = "access_detail_file.lst";
  public static final String TREE_FILE = "access_tree_file.lst";

  private static final Splitter COMMA = Splitter.on(',').omitEmptyStrings().trimResults();

  /** A FormatException reports a descriptor record that cannot be read. */
  public static final class FormatException extends Exception {
    private final String file;
    private final int line;

    FormatException(String file, int line, String message) {
      super(file + ":" + line + ": " + message);
      this.file = file;
      this.line = line;
    }

    public String file() {
      return file;
    }

    public int line() {
      return line;
    }
  }

  private final TreeBuilder treeBuilder;

  public DescriptorReader(TreeBuilder treeBuilder) {
    this.treeBuilder = treeBuilder;
  }

  public static DescriptorReader create() {
    return new DescriptorReader(TreeBuilder.create());
  }

  /** Reads the four descriptor files of a module from {@code dir}. */
  public AnalysisContext readContext(Path dir) throws IOException, FormatException {
    AnalysisContext.Builder context = AnalysisContext.builder(treeBuilder);
    readLoops(LOOP_FILE, lines(dir.resolve(LOOP_FILE)), context);
    readPhis(PHI_FILE, lines(dir.resolve(PHI_FILE)), context);
    readAccesses(ACCESS_FILE, lines(dir.resolve(ACCESS_FILE)), context);
    readAccessTrees(TREE_FILE, lines(dir.resolve(TREE_FILE)), context);
    return context.build();
  }

  private static List<String> lines(Path file) throws IOException {
    if (!Files.exists(file)) {
      logger.atFine().log("%s does not exist", file);
      return ImmutableList.of();
    }
    return Files.readAllLines(file, UTF_8);
  }

  /** Reads {@code kernel loopId parentLoopId IN rpn FIN rpn STEP rpn [IT n]} records. */
  public void readLoops(String file, List<String> lines, AnalysisContext.Builder context)
      throws FormatException {
    for (Record r : records(file, lines)) {
      r.require(3, "want: kernel loopId parentLoopId IN ... FIN ... STEP ...");
      List<String> in = new ArrayList<>();
      List<String> fin = new ArrayList<>();
      List<String> step = new ArrayList<>();
      Long iterations = null;
      List<String> section = null;
      for (int i = 3; i < r.tokens.size(); i++) {
        String token = r.tokens.get(i);
        switch (token) {
          case "IN":
            section = in;
            break;
          case "FIN":
            section = fin;
            break;
          case "STEP":
            section = step;
            break;
          case "IT":
            if (i + 1 == r.tokens.size()) {
              throw r.error("IT needs a count");
            }
            iterations = r.longAt(++i);
            section = null;
            break;
          default:
            if (section == null) {
              throw r.error("token '%s' is outside IN, FIN and STEP", token);
            }
            section.add(token);
        }
      }
      try {
        context.addLoop(
            LoopDescriptor.create(
                r.tokens.get(0), r.intAt(1), r.intAt(2), in, fin, step, iterations));
      } catch (IllegalArgumentException ex) {
        throw r.error("%s", ex.getMessage());
      }
    }
  }

  /** Reads {@code phiId loopId} records. */
  public void readPhis(String file, List<String> lines, AnalysisContext.Builder context)
      throws FormatException {
    for (Record r : records(file, lines)) {
      r.require(2, "want: phiId loopId");
      context.addPhi(r.intAt(0), r.intAt(1));
    }
  }

  /** Reads {@code kernel accessId allocArg loopId ifId ifType rpn...} records. */
  public void readAccesses(String file, List<String> lines, AnalysisContext.Builder context)
      throws FormatException {
    for (Record r : records(file, lines)) {
      r.require(6, "want: kernel accessId allocArg loopId ifId ifType expression...");
      try {
        context.addAccess(
            r.tokens.get(0),
            r.intAt(1),
            r.intAt(2),
            r.intAt(3),
            r.intAt(4),
            r.intAt(5),
            r.tokens.subList(6, r.tokens.size()));
      } catch (IllegalArgumentException ex) {
        throw r.error("%s", ex.getMessage());
      }
    }
  }

  /** Reads {@code kernel accessId ( OP child... )} records. */
  public void readAccessTrees(String file, List<String> lines, AnalysisContext.Builder context)
      throws FormatException {
    for (Record r : records(file, lines)) {
      r.require(2, "want: kernel accessId ( OP child... )");
      context.addAccessTree(r.tokens.get(0), r.intAt(1), r.tokens.subList(2, r.tokens.size()));
    }
  }

  /**
   * Reads launches, one per line:
   *
   * <pre>
   * kernel BDIM x y GRID x y [ARGn=value]... [SIZEn=bytes]... [LIV=n]
   * </pre>
   *
   * A grid extent that is not a number is a comma-separated reverse Polish expression over the
   * launch's arguments, such as {@code ARG2,31,ADD,32,UDIV}.
   */
  public ImmutableList<KernelInvocation> readInvocations(String file, List<String> lines)
      throws FormatException {
    ImmutableList.Builder<KernelInvocation> result = ImmutableList.builder();
    for (Record r : records(file, lines)) {
      r.require(7, "want: kernel BDIM x y GRID x y ...");
      r.expect(1, "BDIM");
      r.expect(4, "GRID");
      KernelInvocation.Builder invocation = KernelInvocation.builder().kernel(r.tokens.get(0));
      for (int i = 7; i < r.tokens.size(); i++) {
        String token = r.tokens.get(i);
        int eq = token.indexOf('=');
        if (eq < 0) {
          throw r.error("want key=value, got '%s'", token);
        }
        String key = token.substring(0, eq);
        long value = r.parseLong(token.substring(eq + 1));
        if (key.equals("LIV")) {
          if (value < KernelInvocation.NO_INDUCTION_ARG || value > Integer.MAX_VALUE) {
            throw r.error("LIV %d is not an argument index", value);
          }
          invocation.loopInductionArg((int) value);
        } else if (key.startsWith("ARG")) {
          invocation.putArgument(r.suffix(key, 3), value);
        } else if (key.startsWith("SIZE")) {
          invocation.putAllocationSize(r.suffix(key, 4), value);
        } else {
          throw r.error("unknown key '%s'", key);
        }
      }
      try {
        invocation.launch(
            LaunchConfig.builder()
                .blockX(r.longAt(2))
                .blockY(r.longAt(3))
                .gridX(grid(r, 5))
                .gridY(grid(r, 6))
                .build());
        result.add(invocation.build());
      } catch (IllegalArgumentException ex) {
        throw r.error("%s", ex.getMessage());
      }
    }
    return result.build();
  }

  /** Reads launches from a file. */
  public ImmutableList<KernelInvocation> readInvocations(Path file)
      throws IOException, FormatException {
    return readInvocations(file.toString(), Files.readAllLines(file, UTF_8));
  }

  private GridDimension grid(Record r, int i) throws FormatException {
    String token = r.tokens.get(i);
    if (Tokens.isNumber(token)) {
      return GridDimension.of(r.longAt(i));
    }
    try {
      ExprTree tree = treeBuilder.parseRpn(COMMA.splitToList(token));
      if (tree == null) {
        throw r.error("empty grid expression");
      }
      return GridDimension.of(tree);
    } catch (ParseError.Exception ex) {
      throw r.error("grid expression '%s': %s", token, ParseError.toString(ex.errors()));
    }
  }

  private static List<Record> records(String file, List<String> lines) {
    List<Record> records = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      records.add(new Record(file, i + 1, Tokens.split(line, /* stripBrackets= */ false)));
    }
    return records;
  }

  /** One line of a descriptor file. */
  private static final class Record {
    final String file;
    final int line;
    final ImmutableList<String> tokens;

    Record(String file, int line, ImmutableList<String> tokens) {
      this.file = file;
      this.line = line;
      this.tokens = tokens;
    }

    @FormatMethod
    FormatException error(String format, Object... args) {
      return new FormatException(file, line, String.format(format, args));
    }

    void require(int n, String usage) throws FormatException {
      if (tokens.size() < n) {
        throw error("%d fields, %s", tokens.size(), usage);
      }
    }

    void expect(int i, String keyword) throws FormatException {
      if (!tokens.get(i).equals(keyword)) {
        throw error("want %s, got '%s'", keyword, tokens.get(i));
      }
    }

    int intAt(int i) throws FormatException {
      long value = longAt(i);
      if (value != (int) value) {
        throw error("'%s' is out of range", tokens.get(i));
      }
      return (int) value;
    }

    long longAt(int i) throws FormatException {
      return parseLong(tokens.get(i));
    }

    long parseLong(String s) throws FormatException {
      try {
        return Long.parseLong(s);
      } catch (NumberFormatException ex) {
        throw error("'%s' is not an integer", s);
      }
    }

    int suffix(String key, int prefix) throws FormatException {
      String digits = key.substring(prefix);
      try {
        return Integer.parseInt(digits);
      } catch (NumberFormatException ex) {
        throw error("'%s' has no numeric suffix", key);
      }
    }
  }
}

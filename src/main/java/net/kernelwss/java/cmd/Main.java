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

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.kernelwss.java.analysis.AccessAnalyzer;
import net.kernelwss.java.analysis.AccessReport;
import net.kernelwss.java.analysis.AnalysisContext;
import net.kernelwss.java.eval.KernelInvocation;

/**
 * Main reads the descriptors of a module and a list of kernel launches, and prints one line per
 * memory access of each launch.
 */
class Main {

  private static final String USAGE = "usage: kernelwss [-v] [-d dir] -i invocations";

  // Held so that the level set by -v is not lost when the logger is collected.
  private static final Logger rootLogger = Logger.getLogger("net.kernelwss");

  private static void verbose() {
    rootLogger.setLevel(Level.FINE);
    Handler handler = new ConsoleHandler();
    handler.setLevel(Level.FINE);
    rootLogger.addHandler(handler);
    rootLogger.setUseParentHandlers(false);
  }

  /** Analyzes every launch and prints the reports. Returns the exit code. */
  static int run(Path dir, Path invocations) {
    DescriptorReader reader = DescriptorReader.create();
    AnalysisContext context;
    try {
      context = reader.readContext(dir);
      AccessAnalyzer analyzer = new AccessAnalyzer(context);
      for (KernelInvocation invocation : reader.readInvocations(invocations)) {
        if (context.accesses(invocation.kernel()).isEmpty()) {
          System.err.format("%s: no accesses described\n", invocation.kernel());
          continue;
        }
        for (AccessReport report : analyzer.analyze(invocation)) {
          System.out.println(report.format());
        }
      }
      return 0;
    } catch (DescriptorReader.FormatException ex) {
      System.err.println(ex.getMessage());
      return 1;
    } catch (IOException ex) {
      System.err.format("Error reading descriptors: %s\n", ex);
      return 1;
    }
  }

  public static void main(String[] args) {
    String dir = ".";
    String invocations = null;

    // parse flags
    int i;
    for (i = 0; i < args.length; i++) {
      if (!args[i].startsWith("-")) {
        break;
      }
      if (args[i].equals("-v")) {
        verbose();
      } else if (args[i].equals("-d")) {
        if (i + 1 == args.length) {
          System.err.println("-d <dir> flag needs an argument");
          System.exit(2);
        }
        dir = args[++i];
      } else if (args[i].equals("-i")) {
        if (i + 1 == args.length) {
          System.err.println("-i <file> flag needs an argument");
          System.exit(2);
        }
        invocations = args[++i];
      } else {
        System.err.println("unknown flag: " + args[i]);
        System.err.println(USAGE);
        System.exit(2);
      }
    }
    if (i < args.length || invocations == null) {
      System.err.println(USAGE);
      System.exit(2);
    }

    System.exit(run(Paths.get(dir), Paths.get(invocations)));
  }
}

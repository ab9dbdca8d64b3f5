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
package net.kernelwss.java.analysis;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nullable;
import net.kernelwss.java.eval.LoopTable;
import net.kernelwss.java.syntax.ExprTree;
import net.kernelwss.java.syntax.ParseError;
import net.kernelwss.java.syntax.TreeBuilder;

/**
 * AnalysisContext holds everything the device-side pass reported about one module: the memory
 * accesses and loops of each kernel, and which loop each phi belongs to. It is built once, before
 * any launch is analyzed, and is immutable afterwards.
 *
 * <p>Loop ids and phi ids are unique across the kernels of a module.
 */
public final class AnalysisContext implements LoopTable {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  // kernel -> access id -> access
  private final ImmutableMap<String, ImmutableSortedMap<Integer, AccessDescriptor>> accesses;
  private final ImmutableSortedMap<Integer, LoopDescriptor> loops;
  private final ImmutableMap<Integer, Integer> phiLoops;

  private AnalysisContext(
      ImmutableMap<String, ImmutableSortedMap<Integer, AccessDescriptor>> accesses,
      ImmutableSortedMap<Integer, LoopDescriptor> loops,
      ImmutableMap<Integer, Integer> phiLoops) {
    this.accesses = accesses;
    this.loops = loops;
    this.phiLoops = phiLoops;
  }

  /** Returns the kernels that have accesses or loops, in sorted order. */
  public ImmutableSortedSet<String> kernels() {
    ImmutableSortedSet.Builder<String> kernels = ImmutableSortedSet.naturalOrder();
    kernels.addAll(accesses.keySet());
    for (LoopDescriptor loop : loops.values()) {
      kernels.add(loop.kernel());
    }
    return kernels.build();
  }

  /** Returns the accesses of a kernel ordered by access id. */
  public ImmutableList<AccessDescriptor> accesses(String kernel) {
    ImmutableSortedMap<Integer, AccessDescriptor> byId = accesses.get(kernel);
    return byId == null ? ImmutableList.of() : byId.values().asList();
  }

  @Nullable
  public AccessDescriptor access(String kernel, int accessId) {
    ImmutableSortedMap<Integer, AccessDescriptor> byId = accesses.get(kernel);
    return byId == null ? null : byId.get(accessId);
  }

  /** Returns the loops of a kernel ordered by loop id. */
  public ImmutableList<LoopDescriptor> loops(String kernel) {
    ImmutableList.Builder<LoopDescriptor> result = ImmutableList.builder();
    for (LoopDescriptor loop : loops.values()) {
      if (loop.kernel().equals(kernel)) {
        result.add(loop);
      }
    }
    return result.build();
  }

  @Override
  @Nullable
  public LoopDescriptor loop(int loopId) {
    return loops.get(loopId);
  }

  /** Returns the id of the loop enclosing {@code loopId}, or 0. */
  public int parentLoop(int loopId) {
    LoopDescriptor loop = loops.get(loopId);
    return loop == null ? 0 : loop.parentLoopId();
  }

  @Override
  public int loopOfPhi(int phiId) {
    return phiLoops.getOrDefault(phiId, 0);
  }

  public static Builder builder(TreeBuilder treeBuilder) {
    return new Builder(treeBuilder);
  }

  public static Builder builder() {
    return builder(TreeBuilder.create());
  }

  /** The n-ary form of an access expression, or why it did not parse. */
  private static final class Advanced {
    @Nullable final ExprTree tree;
    final ImmutableList<ParseError> errors;

    Advanced(@Nullable ExprTree tree, ImmutableList<ParseError> errors) {
      this.tree = tree;
      this.errors = errors;
    }
  }

  /**
   * Collects descriptor records. Expressions are parsed as they are added; a parse failure is kept
   * with its access rather than thrown.
   */
  public static final class Builder {

    private final TreeBuilder treeBuilder;
    private final Map<String, Map<Integer, AccessDescriptor.Builder>> accesses =
        new LinkedHashMap<>();
    private final Map<String, Map<Integer, Advanced>> advanced = new HashMap<>();
    private final Map<Integer, LoopDescriptor> loops = new TreeMap<>();
    private final Map<Integer, Integer> phiLoops = new HashMap<>();

    private Builder(TreeBuilder treeBuilder) {
      this.treeBuilder = Preconditions.checkNotNull(treeBuilder);
    }

    /** Adds an access whose address expression is the reverse Polish token list {@code rpn}. */
    @CanIgnoreReturnValue
    public Builder addAccess(
        String kernel,
        int accessId,
        int allocArg,
        int loopId,
        int ifId,
        int ifType,
        List<String> rpn) {
      AccessDescriptor.Builder access =
          AccessDescriptor.builder()
              .kernel(kernel)
              .accessId(accessId)
              .allocArg(allocArg)
              .loopId(loopId)
              .ifId(ifId)
              .ifType(ifType);
      try {
        access.tree(treeBuilder.parseRpn(rpn));
      } catch (ParseError.Exception ex) {
        logger.atWarning().log(
            "%s access %d: %s", kernel, accessId, ParseError.toString(ex.errors()));
        access.errors(ex.errors());
      }
      AccessDescriptor.Builder previous =
          accesses.computeIfAbsent(kernel, k -> new TreeMap<>()).put(accessId, access);
      Preconditions.checkArgument(
          previous == null, "duplicate access %s of kernel %s", accessId, kernel);
      return this;
    }

    /**
     * Adds the n-ary form of the address expression of an access, as a parenthesized prefix token
     * list.
     */
    @CanIgnoreReturnValue
    public Builder addAccessTree(String kernel, int accessId, List<String> prefix) {
      Advanced tree;
      try {
        tree = new Advanced(treeBuilder.parsePrefix(prefix), ImmutableList.of());
      } catch (ParseError.Exception ex) {
        logger.atWarning().log(
            "%s access %d tree: %s", kernel, accessId, ParseError.toString(ex.errors()));
        tree = new Advanced(null, ex.errors());
      }
      advanced.computeIfAbsent(kernel, k -> new HashMap<>()).put(accessId, tree);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addLoop(LoopDescriptor loop) {
      Preconditions.checkArgument(loop.loopId() != 0, "loop id 0 is reserved");
      LoopDescriptor previous = loops.put(loop.loopId(), loop);
      Preconditions.checkArgument(previous == null, "duplicate loop %s", loop.loopId());
      return this;
    }

    /** Records that phi {@code phiId} is carried by loop {@code loopId}. */
    @CanIgnoreReturnValue
    public Builder addPhi(int phiId, int loopId) {
      phiLoops.put(phiId, loopId);
      return this;
    }

    public AnalysisContext build() {
      ImmutableMap.Builder<String, ImmutableSortedMap<Integer, AccessDescriptor>> byKernel =
          ImmutableMap.builder();
      for (Map.Entry<String, Map<Integer, AccessDescriptor.Builder>> e : accesses.entrySet()) {
        Map<Integer, Advanced> trees = advanced.getOrDefault(e.getKey(), ImmutableMap.of());
        ImmutableSortedMap.Builder<Integer, AccessDescriptor> byId =
            ImmutableSortedMap.naturalOrder();
        for (Map.Entry<Integer, AccessDescriptor.Builder> a : e.getValue().entrySet()) {
          AccessDescriptor.Builder access = a.getValue();
          Advanced tree = trees.get(a.getKey());
          if (tree != null) {
            access.advancedTree(tree.tree).advancedErrors(tree.errors);
          }
          byId.put(a.getKey(), access.build());
        }
        byKernel.put(e.getKey(), byId.buildOrThrow());
      }
      for (Map.Entry<String, Map<Integer, Advanced>> e : advanced.entrySet()) {
        for (int accessId : e.getValue().keySet()) {
          if (!accesses.containsKey(e.getKey())
              || !accesses.get(e.getKey()).containsKey(accessId)) {
            logger.atWarning().log(
                "%s access %d has a tree but no access record; ignored", e.getKey(), accessId);
          }
        }
      }
      return new AnalysisContext(
          byKernel.buildOrThrow(),
          ImmutableSortedMap.copyOf(loops),
          ImmutableMap.copyOf(phiLoops));
    }
  }
}

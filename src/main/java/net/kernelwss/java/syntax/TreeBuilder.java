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
package net.kernelwss.java.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * TreeBuilder turns the serialized forms of an address expression into an {@link ExprTree}.
 *
 * <p>Two forms are accepted. The reverse Polish form lists operands before their operation, so
 * {@code a b SUB} denotes {@code a - b} and {@code v n SHL} denotes {@code v << n}. The prefix form
 * parenthesizes every node, {@code ( SUB ( a ) ( b ) )}, and allows operations with any number of
 * operands.
 *
 * <p>A phi token plays two roles. The first occurrence of a given phi id is the incoming value of
 * the loop-carried variable and becomes a {@link Op#PHI_TERM} leaf; the next occurrence of the same
 * id is the merge, a binary {@link Op#PHI}. In prefix form the role follows from whether the node
 * has operands.
 *
 * <p>Both methods return null for an empty token list, a single {@link Op#POINTER_CHASE} node when
 * the list exceeds the configured size guard, and a single {@link Op#INCOMP} node when the list
 * starts with {@code INCOMP}.
 */
public final class TreeBuilder {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String INCOMPLETE = "INCOMP";

  private final TreeOptions options;

  public TreeBuilder(TreeOptions options) {
    this.options = Preconditions.checkNotNull(options);
  }

  /** Returns a builder with {@link TreeOptions#DEFAULT} options. */
  public static TreeBuilder create() {
    return new TreeBuilder(TreeOptions.DEFAULT);
  }

  public TreeOptions options() {
    return options;
  }

  /** Parses a whitespace-separated reverse Polish expression. */
  @Nullable
  public ExprTree parseRpn(String line) throws ParseError.Exception {
    return parseRpn(Tokens.split(line, options.stripBrackets()));
  }

  /** Parses a reverse Polish token list. */
  @Nullable
  public ExprTree parseRpn(List<String> tokens) throws ParseError.Exception {
    tokens = strip(tokens);
    if (tokens.isEmpty()) {
      return null;
    }
    if (tokens.size() > options.maxRpnTokens()) {
      logger.atFine().log(
          "%d tokens exceed the limit of %d; treating as pointer chase",
          tokens.size(), options.maxRpnTokens());
      return ExprTree.sentinel(Op.POINTER_CHASE);
    }
    if (tokens.get(0).equals(INCOMPLETE)) {
      return ExprTree.sentinel(Op.INCOMP);
    }

    ExprTree.Builder b = ExprTree.builder();
    Deque<Integer> stack = new ArrayDeque<>();
    Set<Integer> openPhis = new HashSet<>();
    for (int pos = 0; pos < tokens.size(); pos++) {
      String token = tokens.get(pos);
      Op op = classify(token, pos);
      if (op == Op.PHI) {
        int phiId = phiId(token, pos);
        if (openPhis.add(phiId)) {
          logger.atFine().log("%s at %d is the incoming value", token, pos);
          stack.push(b.addPhi(Op.PHI_TERM, phiId, token));
          continue;
        }
        openPhis.remove(phiId);
        logger.atFine().log("%s at %d is the merge", token, pos);
      }

      if (op.isTerminal()) {
        stack.push(addTerminal(b, op, token, pos));
        continue;
      }
      if (op.arity() == Op.VARIADIC) {
        throw error(
            pos, "%s takes any number of operands and cannot appear in reverse Polish form", token);
      }
      if (stack.size() < op.arity()) {
        throw error(
            pos, "%s needs %d operands but only %d are available", token, op.arity(), stack.size());
      }
      int[] operands = new int[op.arity()];
      for (int i = operands.length - 1; i >= 0; i--) {
        operands[i] = stack.pop();
      }
      int node = op == Op.PHI ? b.addPhi(Op.PHI, phiId(token, pos), token) : b.add(op, token);
      for (int operand : operands) {
        b.link(node, operand);
      }
      stack.push(node);
    }
    if (stack.size() != 1) {
      throw error(-1, "expression leaves %d values on the stack, want 1", stack.size());
    }
    return b.build(stack.pop());
  }

  /** Parses a whitespace-separated parenthesized prefix expression. */
  @Nullable
  public ExprTree parsePrefix(String line) throws ParseError.Exception {
    return parsePrefix(Tokens.split(line, options.stripBrackets()));
  }

  /** Parses a parenthesized prefix token list. */
  @Nullable
  public ExprTree parsePrefix(List<String> tokens) throws ParseError.Exception {
    tokens = strip(tokens);
    if (tokens.isEmpty()) {
      return null;
    }
    if (firstNonParen(tokens).equals(INCOMPLETE)) {
      return ExprTree.sentinel(Op.INCOMP);
    }

    // A node is added to the arena when its closing parenthesis is seen, after its operands,
    // so that a phi's role is known by then.
    ExprTree.Builder b = ExprTree.builder();
    Deque<Frame> open = new ArrayDeque<>();
    int root = -1;
    int count = 0;
    for (int pos = 0; pos < tokens.size(); pos++) {
      String token = tokens.get(pos);
      int node;
      if (token.equals(Tokens.OPEN)) {
        if (pos + 1 == tokens.size() || isParen(tokens.get(pos + 1))) {
          throw error(pos, "'(' must be followed by an operator");
        }
        pos++;
        if (++count > options.maxPrefixNodes()) {
          logger.atFine().log(
              "more than %d nodes; treating as pointer chase", options.maxPrefixNodes());
          return ExprTree.sentinel(Op.POINTER_CHASE);
        }
        String name = tokens.get(pos);
        open.push(new Frame(name, pos, classify(name, pos)));
        continue;
      } else if (token.equals(Tokens.CLOSE)) {
        if (open.isEmpty()) {
          throw error(pos, "unbalanced ')'");
        }
        node = close(b, open.pop());
      } else {
        Op op = classify(token, pos);
        if (op.isOperation() && op != Op.PHI) {
          throw error(pos, "operation %s must be parenthesized", token);
        }
        if (++count > options.maxPrefixNodes()) {
          return ExprTree.sentinel(Op.POINTER_CHASE);
        }
        node =
            op == Op.PHI
                ? b.addPhi(Op.PHI_TERM, phiId(token, pos), token)
                : addTerminal(b, op, token, pos);
      }

      if (!open.isEmpty()) {
        open.peek().operands.add(node);
      } else if (root == -1) {
        root = node;
      } else {
        throw error(pos, "more than one expression at top level");
      }
    }
    if (!open.isEmpty()) {
      throw error(open.peek().pos, "'(' before %s is never closed", open.peek().token);
    }
    if (root == -1) {
      return null;
    }
    return b.build(root);
  }

  /** An open parenthesis of the prefix form whose node is not yet built. */
  private static final class Frame {
    final String token;
    final int pos;
    final Op op;
    final List<Integer> operands = new ArrayList<>();

    Frame(String token, int pos, Op op) {
      this.token = token;
      this.pos = pos;
      this.op = op;
    }
  }

  private static int close(ExprTree.Builder b, Frame frame) throws ParseError.Exception {
    int node;
    if (frame.op == Op.PHI) {
      Op role = frame.operands.isEmpty() ? Op.PHI_TERM : Op.PHI;
      node = b.addPhi(role, phiId(frame.token, frame.pos), frame.token);
    } else if (frame.op.isTerminal()) {
      if (!frame.operands.isEmpty()) {
        throw error(frame.pos, "terminal %s cannot have operands", frame.token);
      }
      node = addTerminal(b, frame.op, frame.token, frame.pos);
    } else {
      node = b.add(frame.op, frame.token);
    }
    for (int operand : frame.operands) {
      b.link(node, operand);
    }
    return node;
  }

  private ImmutableList<String> strip(List<String> tokens) {
    ImmutableList.Builder<String> result = ImmutableList.builderWithExpectedSize(tokens.size());
    for (String token : tokens) {
      if (!(options.stripBrackets() && Tokens.isBracket(token))) {
        result.add(token);
      }
    }
    return result.build();
  }

  private static String firstNonParen(List<String> tokens) {
    for (String token : tokens) {
      if (!isParen(token)) {
        return token;
      }
    }
    return "";
  }

  private static boolean isParen(String token) {
    return token.equals(Tokens.OPEN) || token.equals(Tokens.CLOSE);
  }

  private static Op classify(String token, int pos) throws ParseError.Exception {
    Op op = Tokens.classify(token);
    if (op == null) {
      throw error(pos, "unknown operator '%s'", token);
    }
    return op;
  }

  private static int addTerminal(ExprTree.Builder b, Op op, String token, int pos)
      throws ParseError.Exception {
    switch (op) {
      case CONST:
        try {
          return b.addLiteral(Op.CONST, Long.parseLong(token), token);
        } catch (NumberFormatException ex) {
          throw error(pos, "integer literal %s is out of range", token);
        }
      case ARG:
        int arg;
        try {
          arg = Tokens.suffix(token);
        } catch (NumberFormatException ex) {
          throw error(pos, "invalid argument reference '%s'", token);
        }
        if (arg < 0) {
          throw error(pos, "argument reference '%s' has no index", token);
        }
        return b.addArgument(arg, token);
      default:
        return b.add(op, token);
    }
  }

  private static int phiId(String token, int pos) throws ParseError.Exception {
    try {
      return Tokens.suffix(token);
    } catch (NumberFormatException ex) {
      throw error(pos, "invalid phi reference '%s'", token);
    }
  }

  @FormatMethod
  private static ParseError.Exception error(int pos, String format, Object... args) {
    return new ParseError.Exception(ParseError.of(pos, format, args));
  }
}

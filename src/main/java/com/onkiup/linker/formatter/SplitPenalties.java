package com.onkiup.linker.formatter;

import com.onkiup.linker.formatter.tree.Leaf;
import com.onkiup.linker.formatter.tree.SyntaxNode;

/**
 * Computation of split penalties before tokens.
 * A split penalty is the cost of breaking the line immediately before a token; tokens without one
 * are left to the layout solver's default cost.
 */
public final class SplitPenalties {

  /**
   * The line can never be broken before the token
   */
  public static final int UNBREAKABLE = 1000 * 1000;
  /**
   * The line should only be broken before the token if there is no other way
   */
  public static final int STRONGLY_CONNECTED = 1000;
  /**
   * Mild resistance to breaking inside arithmetic and comparison chains
   */
  public static final int ARITHMETIC_EXPRESSION = 42;

  private SplitPenalties() {

  }

  /**
   * Computes split penalties on tokens in the given tree
   * @param tree the root of the syntax tree to annotate
   */
  public static void compute(SyntaxNode tree) {
    new PenaltyAssigner().assign(tree);
  }

  /**
   * @param leaf token to test
   * @return true if the line must not be broken before given token
   */
  public static boolean isUnbreakable(Leaf leaf) {
    return leaf.splitPenalty().map(penalty -> penalty >= UNBREAKABLE).orElse(false);
  }
}

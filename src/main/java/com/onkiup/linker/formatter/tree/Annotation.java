package com.onkiup.linker.formatter.tree;

/**
 * Kinds of values that can be attached to leaf nodes
 */
public enum Annotation {
  /**
   * Cost of breaking the line immediately before the token
   */
  SPLIT_PENALTY
}

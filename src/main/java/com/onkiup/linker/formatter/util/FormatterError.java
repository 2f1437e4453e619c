package com.onkiup.linker.formatter.util;

import java.util.Optional;

import com.onkiup.linker.formatter.tree.SyntaxNode;

/**
 * Thrown when a syntax tree does not have the shape its grammar production promises
 */
public class FormatterError extends RuntimeException {

  private final transient SyntaxNode source;

  public FormatterError(String msg, SyntaxNode source) {
    super(msg);
    this.source = source;
  }

  /**
   * @return the node at which the violation was detected
   */
  public Optional<SyntaxNode> source() {
    return Optional.ofNullable(source);
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder("Formatter error at ");
    result.append(source == null ? "<unknown>" : source.tag())
      .append(": ")
      .append(getMessage())
      .append("\n");

    SyntaxNode parent = source;
    while (parent != null) {
      result.append("\t")
        .append(parent.tag())
        .append(" :: ")
        .append(LoggerLayout.head(LoggerLayout.sanitize(parent.source()), 50))
        .append("\n");
      parent = parent.parent().orElse(null);
    }

    if (source != null) {
      result.append("\tSubtree:\n")
        .append(source.dumpTree(0, "\t\t", "\t\t", SyntaxNode::toString));
    }
    return result.toString();
  }
}

package com.onkiup.linker.formatter.tree;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.onkiup.linker.formatter.util.FormatterError;

/**
 * Common implementation for syntax nodes
 */
public abstract class AbstractNode implements SyntaxNode {

  /**
   * Non-owning back-reference, used only for lookahead
   */
  private Interior parent;
  private transient Logger logger;

  @Override
  public Optional<Interior> parent() {
    return Optional.ofNullable(parent);
  }

  /**
   * Attaches this node to a parent
   * @param parent the node that owns this node
   */
  void attach(Interior parent) {
    if (this.parent != null) {
      throw new FormatterError("Node is already attached to " + this.parent.tag(), this);
    }
    this.parent = parent;
  }

  /**
   * @return logger configured with information about this node
   */
  @Override
  public Logger logger() {
    if (logger == null) {
      logger = LoggerFactory.getLogger(getClass().getName() + "$" + name());
    }
    return logger;
  }
}

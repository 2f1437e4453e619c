package com.onkiup.linker.formatter;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.onkiup.linker.formatter.tree.Interior;
import com.onkiup.linker.formatter.tree.Leaf;
import com.onkiup.linker.formatter.tree.Production;
import com.onkiup.linker.formatter.tree.SyntaxNode;
import com.onkiup.linker.formatter.util.LoggerLayout;

/**
 * Walks a syntax tree top-down, dispatching interior nodes to the rule registered for their production.
 * Nodes without a rule have their children visited in order.
 */
public abstract class TreeVisitor {
  private static final Logger logger = LoggerFactory.getLogger(TreeVisitor.class);

  private final Map<Production, Consumer<Interior>> rules = new EnumMap<>(Production.class);
  private SyntaxNode current;

  /**
   * Registers a handler for a grammar production, replacing any previously registered one
   * @param production grammar production
   * @param rule handler that takes over the visit of matching nodes
   */
  protected void rule(Production production, Consumer<Interior> rule) {
    rules.put(production, rule);
  }

  /**
   * @param production grammar production
   * @return true if a handler is registered for the production
   */
  public boolean hasRule(Production production) {
    return rules.containsKey(production);
  }

  /**
   * Visits a node
   * @param node the node to visit
   */
  public void visit(SyntaxNode node) {
    SyntaxNode previous = current;
    current = node;
    try {
      if (node.isLeaf()) {
        visitLeaf(node.asLeaf());
        return;
      }

      Interior interior = node.asInterior();
      Consumer<Interior> rule = rules.get(interior.production());
      if (rule == null) {
        defaultNodeVisit(interior);
      } else {
        if (logger.isDebugEnabled()) {
          logger.debug("Applying {} rule to '{}'", interior.tag(), LoggerLayout.head(interior.source(), 50));
        }
        rule.accept(interior);
      }
    } finally {
      current = previous;
    }
  }

  /**
   * Visits every child of the node in order
   * @param node the node whose children should be visited
   */
  public void defaultNodeVisit(Interior node) {
    for (SyntaxNode child : node.children()) {
      visit(child);
    }
  }

  /**
   * Invoked for every visited token
   * @param leaf visited token
   */
  protected void visitLeaf(Leaf leaf) {
  }

  /**
   * @return the node that is being visited right now
   */
  public Optional<SyntaxNode> currentNode() {
    return Optional.ofNullable(current);
  }
}

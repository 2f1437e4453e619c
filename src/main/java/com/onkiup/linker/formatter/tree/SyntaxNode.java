package com.onkiup.linker.formatter.tree;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.slf4j.Logger;

import com.onkiup.linker.formatter.util.FormatterError;

/**
 * A node of a concrete syntax tree: either a {@link Leaf} (single token) or an {@link Interior} node (grammar production)
 */
public interface SyntaxNode {

  /**
   * Creates a new leaf node
   * @param kind token kind
   * @param text token text
   * @return created leaf
   */
  static Leaf leaf(TokenKind kind, String text) {
    return new Leaf(kind, text);
  }

  /**
   * Creates a new leaf node guessing its kind from the text
   * @param text token text
   * @return created leaf
   * @see TokenKind#forText(String)
   */
  static Leaf leaf(String text) {
    return new Leaf(TokenKind.forText(text), text);
  }

  /**
   * Creates a new interior node and attaches given children to it
   * @param production grammar production of the node
   * @param children node children, in source order
   * @return created node
   */
  static Interior node(Production production, SyntaxNode... children) {
    Interior result = new Interior(production);
    for (SyntaxNode child : children) {
      result.appendChild(child);
    }
    return result;
  }

  /**
   * @return parent node or empty if this node is the tree root
   */
  Optional<Interior> parent();

  /**
   * @return true if this node is a single token
   */
  boolean isLeaf();

  /**
   * @return direct children of this node (empty for leaves)
   */
  List<SyntaxNode> children();

  /**
   * @return production name for interior nodes, token kind name for leaves
   */
  String name();

  /**
   * @return String representation of the node used for logging
   */
  String tag();

  /**
   * @return a logger associated with this node
   */
  Logger logger();

  /**
   * Logs a DEBUG-level message from this node
   * @param message template for the message
   * @param arguments template arguments
   */
  default void log(CharSequence message, Object... arguments) {
    logger().debug(message.toString(), arguments);
  }

  /**
   * @param production production to test
   * @return true if this is an interior node labeled with given production
   */
  default boolean is(Production production) {
    return false;
  }

  /**
   * @param kind token kind to test
   * @return true if this is a leaf of given kind
   */
  default boolean is(TokenKind kind) {
    return false;
  }

  /**
   * @param text token text to test
   * @return true if this is a leaf with exactly given text
   */
  default boolean hasText(String text) {
    return false;
  }

  /**
   * @return this node as a leaf
   * @throws FormatterError if this node is not a leaf
   */
  default Leaf asLeaf() {
    throw new FormatterError("Expected a token but found " + tag(), this);
  }

  /**
   * @return this node as an interior node
   * @throws FormatterError if this node is a leaf
   */
  default Interior asInterior() {
    throw new FormatterError("Expected a grammar node but found " + tag(), this);
  }

  /**
   * @return leftmost token of the subtree rooted at this node
   */
  Leaf firstLeaf();

  /**
   * @return rightmost token of the subtree rooted at this node
   */
  Leaf lastLeaf();

  /**
   * @return all tokens of this subtree, in source order
   */
  default List<Leaf> leaves() {
    List<Leaf> result = new ArrayList<>();
    visit(node -> {
      if (node.isLeaf()) {
        result.add(node.asLeaf());
      }
    });
    return result;
  }

  /**
   * @return position of this node among its parent's children or -1 for the root node
   */
  default int indexInParent() {
    return parent().map(parent -> parent.indexOf(this)).orElse(-1);
  }

  /**
   * @return text of all tokens in this subtree separated by single spaces
   */
  default CharSequence source() {
    return leaves().stream()
        .map(Leaf::text)
        .filter(text -> !text.isEmpty())
        .collect(Collectors.joining(" "));
  }

  /**
   * Passes this node and its subtree to the visitor, children first
   * @param visitor node visitor
   */
  default void visit(Consumer<SyntaxNode> visitor) {
    visitor.accept(this);
  }

  /**
   * @return root node of the tree to which this node belongs
   */
  default SyntaxNode root() {
    SyntaxNode current = this;
    while (true) {
      SyntaxNode parent = current.parent().orElse(null);
      if (parent == null) {
        return current;
      }
      current = parent;
    }
  }

  /**
   * @return a list of nodes starting with the tree root and ending with this node
   */
  default LinkedList<SyntaxNode> path() {
    LinkedList<SyntaxNode> path = parent()
        .map(SyntaxNode::path)
        .orElseGet(LinkedList::new);
    path.add(this);
    return path;
  }

  /**
   * Passes this node and its parents up to the tree root to provided predicate
   * @param test the predicate to use on path nodes
   * @return first node that matched the predicate or empty
   */
  default Optional<SyntaxNode> findInPath(Predicate<SyntaxNode> test) {
    if (test.test(this)) {
      return Optional.of(this);
    }
    return parent().flatMap(parent -> parent.findInPath(test));
  }

  /**
   * @return String representation of the tree with this node as its root
   */
  default CharSequence dumpTree() {
    return dumpTree(SyntaxNode::toString);
  }

  /**
   * @param formatter formatter function to use on tree nodes
   * @return String representation of the tree with this node as its root
   */
  default CharSequence dumpTree(Function<SyntaxNode, CharSequence> formatter) {
    return dumpTree(0, "", "", formatter);
  }

  /**
   * Dumps the tree represented by this node into a String
   * @param offset nesting level of this node
   * @param prefix prefix to use when rendering this node
   * @param childPrefix prefix to use when rendering this node's children
   * @param formatter formatter function
   * @return String representation of the tree
   */
  default CharSequence dumpTree(int offset, CharSequence prefix, CharSequence childPrefix, Function<SyntaxNode, CharSequence> formatter) {
    return String.format("%s%s\n", prefix, formatter.apply(this));
  }
}

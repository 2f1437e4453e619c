package com.onkiup.linker.formatter.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

import com.onkiup.linker.formatter.util.FormatterError;

/**
 * A grammar production together with the child nodes it owns
 */
public class Interior extends AbstractNode {

  private final Production production;
  private final List<SyntaxNode> children = new ArrayList<>();

  public Interior(Production production) {
    this.production = Objects.requireNonNull(production, "production");
  }

  public Production production() {
    return production;
  }

  /**
   * Attaches a node as the last child of this node
   * @param child node to attach
   * @return this node
   */
  public Interior appendChild(SyntaxNode child) {
    if (!(child instanceof AbstractNode)) {
      throw new FormatterError("Unsupported node implementation: " + child, this);
    }
    ((AbstractNode) child).attach(this);
    children.add(child);
    return this;
  }

  @Override
  public List<SyntaxNode> children() {
    return Collections.unmodifiableList(children);
  }

  /**
   * @param index child position
   * @return child at given position
   * @throws FormatterError if this node has no child at given position
   */
  public SyntaxNode child(int index) {
    if (index < 0 || index >= children.size()) {
      throw new FormatterError(
          String.format("%s has no child #%d (%d children)", tag(), index, children.size()), this);
    }
    return children.get(index);
  }

  public int childCount() {
    return children.size();
  }

  public SyntaxNode firstChild() {
    return child(0);
  }

  public SyntaxNode lastChild() {
    return child(children.size() - 1);
  }

  /**
   * @param child node to look for
   * @return position of given node among the children of this node or -1
   */
  public int indexOf(SyntaxNode child) {
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == child) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public boolean isLeaf() {
    return false;
  }

  @Override
  public Interior asInterior() {
    return this;
  }

  @Override
  public boolean is(Production production) {
    return this.production == production;
  }

  @Override
  public Leaf firstLeaf() {
    return firstChild().firstLeaf();
  }

  @Override
  public Leaf lastLeaf() {
    return lastChild().lastLeaf();
  }

  @Override
  public String name() {
    return production.grammarName();
  }

  @Override
  public String tag() {
    return name();
  }

  @Override
  public String toString() {
    return tag();
  }

  @Override
  public void visit(Consumer<SyntaxNode> visitor) {
    children.forEach(child -> child.visit(visitor));
    visitor.accept(this);
  }

  @Override
  public CharSequence dumpTree(int offset, CharSequence prefix, CharSequence childPrefix, Function<SyntaxNode, CharSequence> formatter) {
    final int childOffset = offset + 1;
    StringBuilder result = new StringBuilder(String.format("%s%s\n", prefix, formatter.apply(this)));
    for (int i = 0; i < children.size(); i++) {
      boolean last = i == children.size() - 1;
      result.append(children.get(i).dumpTree(childOffset,
          String.format("%s %s ", childPrefix, last ? "└─" : "├─"),
          childPrefix + (last ? "   " : " │ "), formatter));
    }
    return result;
  }
}

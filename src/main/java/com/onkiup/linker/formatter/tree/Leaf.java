package com.onkiup.linker.formatter.tree;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.onkiup.linker.formatter.util.LoggerLayout;

/**
 * A single token of the source together with its annotations
 */
public class Leaf extends AbstractNode {

  private final TokenKind kind;
  private final String text;
  private final Map<Annotation, Integer> annotations = new EnumMap<>(Annotation.class);

  public Leaf(TokenKind kind, String text) {
    this.kind = Objects.requireNonNull(kind, "token kind");
    this.text = Objects.requireNonNull(text, "token text");
  }

  public TokenKind kind() {
    return kind;
  }

  public String text() {
    return text;
  }

  /**
   * @param annotation annotation kind
   * @return annotation value or empty if none was set
   */
  public Optional<Integer> annotation(Annotation annotation) {
    return Optional.ofNullable(annotations.get(annotation));
  }

  /**
   * Unconditionally sets an annotation value
   * @param annotation annotation kind
   * @param value new value
   */
  public void annotate(Annotation annotation, int value) {
    if (value < 0) {
      throw new IllegalArgumentException("Annotation value cannot be negative");
    }
    annotations.put(annotation, value);
  }

  /**
   * Removes an annotation from this token
   * @param annotation annotation kind
   */
  public void clearAnnotation(Annotation annotation) {
    if (annotations.remove(annotation) != null) {
      log("cleared {}", annotation);
    }
  }

  /**
   * @return split penalty for this token or empty if none was asserted
   */
  public Optional<Integer> splitPenalty() {
    return annotation(Annotation.SPLIT_PENALTY);
  }

  @Override
  public boolean isLeaf() {
    return true;
  }

  @Override
  public Leaf asLeaf() {
    return this;
  }

  @Override
  public boolean is(TokenKind kind) {
    return this.kind == kind;
  }

  @Override
  public boolean hasText(String text) {
    return this.text.equals(text);
  }

  @Override
  public List<SyntaxNode> children() {
    return Collections.emptyList();
  }

  @Override
  public Leaf firstLeaf() {
    return this;
  }

  @Override
  public Leaf lastLeaf() {
    return this;
  }

  @Override
  public String name() {
    return kind.name();
  }

  @Override
  public String tag() {
    return kind + " '" + LoggerLayout.sanitize(text) + "'";
  }

  @Override
  public String toString() {
    return annotations.isEmpty() ? tag() : tag() + " " + annotations;
  }
}

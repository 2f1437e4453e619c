package com.onkiup.linker.formatter;

import static com.onkiup.linker.formatter.SplitPenalties.ARITHMETIC_EXPRESSION;
import static com.onkiup.linker.formatter.SplitPenalties.STRONGLY_CONNECTED;
import static com.onkiup.linker.formatter.SplitPenalties.UNBREAKABLE;

import java.util.Arrays;
import java.util.Enumeration;
import java.util.List;

import org.apache.log4j.Appender;
import org.apache.log4j.Layout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.onkiup.linker.formatter.tree.Annotation;
import com.onkiup.linker.formatter.tree.Interior;
import com.onkiup.linker.formatter.tree.Leaf;
import com.onkiup.linker.formatter.tree.Production;
import com.onkiup.linker.formatter.tree.SyntaxNode;
import com.onkiup.linker.formatter.tree.TokenKind;
import com.onkiup.linker.formatter.util.FormatterError;
import com.onkiup.linker.formatter.util.LoggerLayout;

/**
 * Assigns split penalties to tokens, based on the structure of the syntax tree.
 * Penalties are only ever raised, so rules may overlap freely.
 */
public class PenaltyAssigner extends TreeVisitor {
  private static final Logger logger = LoggerFactory.getLogger(PenaltyAssigner.class);

  public PenaltyAssigner() {
    rule(Production.CLASSDEF, this::visitClassdef);
    rule(Production.FUNCDEF, this::visitFuncdef);
    rule(Production.LAMBDEF, this::visitLambdef);
    rule(Production.PARAMETERS, this::visitParameters);
    rule(Production.DOTTED_NAME, this::visitDottedName);
    rule(Production.DICTSETMAKER, this::visitDictsetmaker);
    rule(Production.COMPARISON, this::visitArithmeticChain);
    rule(Production.ARITH_EXPR, this::visitArithmeticChain);
    rule(Production.TERM, this::visitArithmeticChain);
    rule(Production.TRAILER, this::visitTrailer);
    rule(Production.POWER, this::visitPower);
    rule(Production.SUBSCRIPT, this::visitSubscript);
    rule(Production.COMP_FOR, this::visitCompFor);
    rule(Production.COMP_IF, this::visitCompIf);
  }

  /**
   * Annotates every token of the tree with its split penalty
   * @param tree root of the tree
   */
  public void assign(SyntaxNode tree) {
    boolean debug = logger.isDebugEnabled();
    if (debug) {
      logger.debug("Assigning split penalties to '{}'", LoggerLayout.head(LoggerLayout.sanitize(tree.source()), 50));
      setupLoggingLayouts();
    }
    try {
      visit(tree);
    } finally {
      if (debug) {
        restoreLoggingLayouts();
      }
    }
    if (debug) {
      List<Leaf> leaves = tree.leaves();
      long annotated = leaves.stream().filter(leaf -> leaf.splitPenalty().isPresent()).count();
      logger.debug("Annotated {} of {} tokens", annotated, leaves.size());
    }
  }

  // classdef ::= 'class' NAME ['(' [arglist] ')'] ':' suite
  protected void visitClassdef(Interior node) {
    defaultNodeVisit(node);
    // NAME
    setUnbreakable(node.child(1));
    if (node.childCount() > 4) {
      // opening '('
      setUnbreakable(node.child(2));
    }
    // ':'
    setUnbreakable(node.child(node.childCount() - 2));
  }

  // funcdef ::= 'def' NAME parameters ['->' test] ':' suite
  protected void visitFuncdef(Interior node) {
    defaultNodeVisit(node);
    int index = 1;
    while (node.child(index).is(Production.SIMPLE_STMT)) {
      index++;
    }
    setUnbreakable(node.child(index));

    while (index < node.childCount() && !node.child(index).is(TokenKind.COLON)) {
      index++;
    }
    if (index == node.childCount()) {
      throw new FormatterError("Function signature is not terminated by ':'", node);
    }
    setUnbreakable(node.child(index));
  }

  // lambdef ::= 'lambda' [varargslist] ':' test
  protected void visitLambdef(Interior node) {
    boolean hasArguments = !node.child(1).is(TokenKind.COLON);
    setUnbreakableOnChildren(node, hasArguments ? 3 : 2);
  }

  // parameters ::= '(' [typedargslist] ')'
  protected void visitParameters(Interior node) {
    defaultNodeVisit(node);
    setUnbreakable(node.firstChild());
    if (node.childCount() == 2) {
      // empty parameter list should stay together if at all possible
      setStronglyConnected(node.lastChild());
    }
  }

  // dotted_name ::= NAME ('.' NAME)*
  protected void visitDottedName(Interior node) {
    setUnbreakableOnChildren(node, node.childCount());
  }

  // dictsetmaker ::= ( (test ':' test (comp_for | (',' test ':' test)* [','])) |
  //                    (test (comp_for | (',' test)* [','])) )
  protected void visitDictsetmaker(Interior node) {
    SyntaxNode previous = null;
    for (SyntaxNode child : node.children()) {
      visit(child);
      if (child.is(TokenKind.COLON)) {
        if (previous == null) {
          throw new FormatterError("Dictionary entry has no key", child);
        }
        // keep the key with its colon
        setStronglyConnected(previous, child);
      }
      previous = child;
    }
  }

  // comparison ::= expr (comp_op expr)*
  // arith_expr ::= term (('+'|'-') term)*
  // term ::= factor (('*'|'/'|'%'|'//') factor)*
  protected void visitArithmeticChain(Interior node) {
    defaultNodeVisit(node);
    setArithmeticExpression(node);
  }

  // trailer ::= '(' [arglist] ')' | '[' subscriptlist ']' | '.' NAME
  protected void visitTrailer(Interior node) {
    defaultNodeVisit(node);
    SyntaxNode opening = node.firstChild();
    if (opening.hasText(".")) {
      setStronglyConnected(node.children());
    } else if (opening.hasText("[")) {
      setStronglyConnected(node.lastChild());
    }
  }

  // power ::= atom trailer* ['**' factor]
  protected void visitPower(Interior node) {
    defaultNodeVisit(node);

    // chains wrapped in parentheses may put each '.' on its own line
    boolean parenthesized = isParenthesized(node);

    if (node.childCount() > 1 && node.child(1).is(Production.TRAILER)) {
      // no break between an atom and its first trailer: only the '(', '[' or '.' is glued
      setUnbreakable(node.child(1).asInterior().firstChild());

      // atom tr1 tr2: the last token of tr1 and the first token of tr2 stay together
      int previousIndex = 1;
      while (previousIndex < node.childCount() - 1) {
        SyntaxNode next = node.child(previousIndex + 1);
        if (!next.is(Production.TRAILER)) {
          break;
        }
        Interior previous = node.child(previousIndex).asInterior();
        if (!previous.lastChild().hasText(")")) {
          // a call may still be split before its closing paren when nothing else fits
          setUnbreakable(previous.lastChild());
        }
        if (!parenthesized) {
          setUnbreakable(next.asInterior().firstChild());
        }
        previousIndex++;
      }
    }

    // no break before the closing paren of a call with arguments
    for (int i = 1; i < node.childCount(); i++) {
      SyntaxNode child = node.child(i);
      if (!child.is(Production.TRAILER)) {
        break;
      }
      Interior trailer = child.asInterior();
      if (trailer.firstChild().hasText("(") && trailer.childCount() > 2) {
        setUnbreakable(trailer.lastChild());
      }
    }
  }

  // subscript ::= test | [test] ':' [test] [sliceop]
  protected void visitSubscript(Interior node) {
    setStronglyConnected(node.children());
    defaultNodeVisit(node);
  }

  // comp_for ::= 'for' exprlist 'in' testlist_safe [comp_iter]
  protected void visitCompFor(Interior node) {
    setStronglyConnected(node.children().subList(1, node.childCount()));
    defaultNodeVisit(node);
  }

  // comp_if ::= 'if' old_test [comp_iter]
  protected void visitCompIf(Interior node) {
    // a filter may always start on a new line
    node.firstChild().asLeaf().clearAnnotation(Annotation.SPLIT_PENALTY);
    setStronglyConnected(node.children().subList(1, node.childCount()));
    defaultNodeVisit(node);
  }

  /**
   * Sets an UNBREAKABLE penalty on every token of given nodes
   * @param nodes subtrees to annotate
   */
  protected void setUnbreakable(SyntaxNode... nodes) {
    for (SyntaxNode node : nodes) {
      raiseSubtreeTo(node, UNBREAKABLE);
    }
  }

  /**
   * Sets a STRONGLY_CONNECTED penalty on every token of given nodes
   * @param nodes subtrees to annotate
   */
  protected void setStronglyConnected(SyntaxNode... nodes) {
    setStronglyConnected(Arrays.asList(nodes));
  }

  /**
   * Sets a STRONGLY_CONNECTED penalty on every token of given nodes
   * @param nodes subtrees to annotate
   */
  protected void setStronglyConnected(List<SyntaxNode> nodes) {
    for (SyntaxNode node : nodes) {
      raiseSubtreeTo(node, STRONGLY_CONNECTED);
    }
  }

  /**
   * Visits all children of the node, then sets UNBREAKABLE penalty on the given number of them, skipping the first one
   * @param node parent node
   * @param count number of leading children that must stay on one line
   */
  protected void setUnbreakableOnChildren(Interior node, int count) {
    defaultNodeVisit(node);
    for (int i = 1; i < count; i++) {
      setUnbreakable(node.child(i));
    }
  }

  /**
   * Sets ARITHMETIC_EXPRESSION penalty on every token of the subtree except its first one
   * @param node root of the expression
   */
  protected void setArithmeticExpression(SyntaxNode node) {
    raiseArithmetic(node, node.firstLeaf());
  }

  private void raiseArithmetic(SyntaxNode node, Leaf first) {
    if (node == first) {
      return;
    }
    if (node.isLeaf()) {
      raise(node.asLeaf(), ARITHMETIC_EXPRESSION);
    } else {
      for (SyntaxNode child : node.children()) {
        raiseArithmetic(child, first);
      }
    }
  }

  /**
   * Recursively raises penalty of all tokens in the subtree to at least the given value.
   * Tokens that already have a higher or equal penalty are left untouched.
   * @param tree subtree to annotate
   * @param value minimal penalty
   */
  protected void raiseSubtreeTo(SyntaxNode tree, int value) {
    if (tree.isLeaf()) {
      raise(tree.asLeaf(), value);
      return;
    }
    for (SyntaxNode child : tree.children()) {
      raiseSubtreeTo(child, value);
    }
  }

  private void raise(Leaf leaf, int value) {
    Integer current = leaf.splitPenalty().orElse(null);
    if (current == null || current < value) {
      leaf.annotate(Annotation.SPLIT_PENALTY, value);
    }
  }

  private static boolean isParenthesized(Interior node) {
    return node.parent()
        .filter(parent -> parent.is(Production.ATOM))
        .filter(parent -> parent.firstChild().hasText("(") && parent.lastChild().hasText(")"))
        .isPresent();
  }

  /**
   * Configures log4j appenders with {@link LoggerLayout} so that log lines show the node being annotated
   */
  private void setupLoggingLayouts() {
    Enumeration<?> appenders = org.apache.log4j.Logger.getRootLogger().getAllAppenders();
    while (appenders.hasMoreElements()) {
      Appender appender = (Appender) appenders.nextElement();
      appender.setLayout(new LoggerLayout(appender.getLayout(), this::currentNode));
    }
  }

  /**
   * Removes {@link LoggerLayout} configurations from log4j appenders
   */
  private void restoreLoggingLayouts() {
    Enumeration<?> appenders = org.apache.log4j.Logger.getRootLogger().getAllAppenders();
    while (appenders.hasMoreElements()) {
      Appender appender = (Appender) appenders.nextElement();
      Layout layout = appender.getLayout();
      if (layout instanceof LoggerLayout) {
        appender.setLayout(((LoggerLayout) layout).parent());
      }
    }
  }
}

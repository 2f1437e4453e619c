package com.onkiup.linker.formatter;

import static com.onkiup.linker.formatter.SplitPenalties.ARITHMETIC_EXPRESSION;
import static com.onkiup.linker.formatter.SplitPenalties.STRONGLY_CONNECTED;
import static com.onkiup.linker.formatter.SplitPenalties.UNBREAKABLE;
import static com.onkiup.linker.formatter.tree.SyntaxNode.leaf;
import static com.onkiup.linker.formatter.tree.SyntaxNode.node;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.junit.Test;

import com.onkiup.linker.formatter.tree.Annotation;
import com.onkiup.linker.formatter.tree.Interior;
import com.onkiup.linker.formatter.tree.Leaf;
import com.onkiup.linker.formatter.tree.Production;
import com.onkiup.linker.formatter.tree.SyntaxNode;
import com.onkiup.linker.formatter.tree.TokenKind;
import com.onkiup.linker.formatter.util.FormatterError;

public class PenaltyAssignerTest {

  private static Interior suite() {
    return node(Production.SUITE,
        leaf("\n"),
        leaf(TokenKind.INDENT, "    "),
        node(Production.SIMPLE_STMT, leaf("pass"), leaf("\n")),
        leaf(TokenKind.DEDENT, ""));
  }

  private static Optional<Integer> penalty(SyntaxNode node) {
    return node.asLeaf().splitPenalty();
  }

  private static void assertPenalty(int expected, SyntaxNode node) {
    assertEquals(node.tag(), Optional.of(expected), penalty(node));
  }

  private static void assertNoPenalty(SyntaxNode node) {
    assertEquals(node.tag(), Optional.empty(), penalty(node));
  }

  private static List<Optional<Integer>> snapshot(SyntaxNode tree) {
    return tree.leaves().stream().map(Leaf::splitPenalty).collect(Collectors.toList());
  }

  @Test
  public void testClassWithBases() {
    Leaf name = leaf("Foo");
    Leaf open = leaf("(");
    Leaf base = leaf("Base");
    Leaf colon = leaf(":");
    Interior tree = node(Production.CLASSDEF, leaf("class"), name, open, base, leaf(")"), colon, suite());

    SplitPenalties.compute(tree);

    assertPenalty(UNBREAKABLE, name);
    assertPenalty(UNBREAKABLE, open);
    assertPenalty(UNBREAKABLE, colon);
    assertNoPenalty(base);
  }

  @Test
  public void testClassWithoutBases() {
    Leaf name = leaf("Foo");
    Leaf colon = leaf(":");
    Interior tree = node(Production.CLASSDEF, leaf("class"), name, colon, suite());

    SplitPenalties.compute(tree);

    assertPenalty(UNBREAKABLE, name);
    assertPenalty(UNBREAKABLE, colon);
    assertNoPenalty(tree.firstChild());
  }

  @Test
  public void testLambda() {
    Interior arguments = node(Production.VARARGSLIST, leaf("x"), leaf(","), leaf("y"));
    Leaf colon = leaf(":");
    Interior body = node(Production.ARITH_EXPR, leaf("x"), leaf("+"), leaf("y"));
    Interior tree = node(Production.LAMBDEF, leaf("lambda"), arguments, colon, body);

    SplitPenalties.compute(tree);

    assertNoPenalty(tree.firstChild());
    for (SyntaxNode argument : arguments.children()) {
      assertPenalty(UNBREAKABLE, argument);
    }
    assertPenalty(UNBREAKABLE, colon);
    assertNoPenalty(body.child(0));
    assertPenalty(ARITHMETIC_EXPRESSION, body.child(1));
    assertPenalty(ARITHMETIC_EXPRESSION, body.child(2));
  }

  @Test
  public void testLambdaWithoutArguments() {
    Leaf colon = leaf(":");
    Leaf body = leaf("0");
    Interior tree = node(Production.LAMBDEF, leaf("lambda"), colon, body);

    SplitPenalties.compute(tree);

    assertPenalty(UNBREAKABLE, colon);
    assertNoPenalty(body);
  }

  @Test
  public void testFunctionWithEmptyParameters() {
    Leaf name = leaf("f");
    Leaf open = leaf("(");
    Leaf close = leaf(")");
    Leaf colon = leaf(":");
    Interior tree = node(Production.FUNCDEF, leaf("def"), name, node(Production.PARAMETERS, open, close), colon, suite());

    SplitPenalties.compute(tree);

    assertPenalty(UNBREAKABLE, name);
    assertPenalty(UNBREAKABLE, open);
    assertPenalty(STRONGLY_CONNECTED, close);
    assertPenalty(UNBREAKABLE, colon);
    assertNoPenalty(tree.firstChild());
  }

  @Test
  public void testFunctionWithReturnAnnotation() {
    Leaf parameter = leaf("x");
    Leaf close = leaf(")");
    Leaf arrow = leaf("->");
    Leaf returnType = leaf("int");
    Leaf colon = leaf(":");
    Interior tree = node(Production.FUNCDEF, leaf("def"), leaf("f"),
        node(Production.PARAMETERS, leaf("("), parameter, close), arrow, returnType, colon, suite());

    SplitPenalties.compute(tree);

    assertNoPenalty(parameter);
    assertNoPenalty(close);
    assertNoPenalty(arrow);
    assertNoPenalty(returnType);
    assertPenalty(UNBREAKABLE, colon);
  }

  @Test
  public void testFunctionSkipsLeadingStatements() {
    Interior comment = node(Production.SIMPLE_STMT, leaf("# comment"), leaf("\n"));
    Leaf name = leaf("f");
    Interior tree = node(Production.FUNCDEF, leaf("def"), comment, name,
        node(Production.PARAMETERS, leaf("("), leaf(")")), leaf(":"), suite());

    SplitPenalties.compute(tree);

    assertPenalty(UNBREAKABLE, name);
    assertNoPenalty(comment.firstChild());
  }

  @Test
  public void testFunctionWithoutColon() {
    Interior tree = node(Production.FUNCDEF, leaf("def"), leaf("f"), node(Production.PARAMETERS, leaf("("), leaf(")")));
    try {
      SplitPenalties.compute(tree);
      fail("Function without ':' was accepted");
    } catch (FormatterError e) {
      assertEquals(Optional.of(tree), e.source());
    }
  }

  @Test
  public void testDottedName() {
    Interior name = node(Production.DOTTED_NAME, leaf("os"), leaf("."), leaf("path"));
    Interior tree = node(Production.IMPORT_NAME, leaf("import"), name);

    SplitPenalties.compute(tree);

    assertNoPenalty(tree.firstChild());
    assertNoPenalty(name.child(0));
    assertPenalty(UNBREAKABLE, name.child(1));
    assertPenalty(UNBREAKABLE, name.child(2));
  }

  @Test
  public void testDictionary() {
    Interior entries = node(Production.DICTSETMAKER,
        leaf("1"), leaf(":"), leaf("2"), leaf(","), leaf("3"), leaf(":"), leaf("4"));
    Interior tree = node(Production.ATOM, leaf("{"), entries, leaf("}"));

    SplitPenalties.compute(tree);

    assertPenalty(STRONGLY_CONNECTED, entries.child(0));
    assertPenalty(STRONGLY_CONNECTED, entries.child(1));
    assertNoPenalty(entries.child(2));
    assertNoPenalty(entries.child(3));
    assertPenalty(STRONGLY_CONNECTED, entries.child(4));
    assertPenalty(STRONGLY_CONNECTED, entries.child(5));
    assertNoPenalty(entries.child(6));
  }

  @Test
  public void testDictionaryWithCompoundKey() {
    Interior key = node(Production.ARITH_EXPR, leaf("a"), leaf("+"), leaf("b"));
    Interior entries = node(Production.DICTSETMAKER, key, leaf(":"), leaf("c"));

    SplitPenalties.compute(node(Production.ATOM, leaf("{"), entries, leaf("}")));

    for (SyntaxNode token : key.children()) {
      assertPenalty(STRONGLY_CONNECTED, token);
    }
  }

  @Test
  public void testDictionaryWithoutKey() {
    Leaf colon = leaf(":");
    Interior entries = node(Production.DICTSETMAKER, colon, leaf("1"));
    try {
      SplitPenalties.compute(node(Production.ATOM, leaf("{"), entries, leaf("}")));
      fail("Dictionary entry without a key was accepted");
    } catch (FormatterError e) {
      assertEquals(Optional.of(colon), e.source());
    }
  }

  @Test
  public void testSet() {
    Interior entries = node(Production.DICTSETMAKER, leaf("1"), leaf(","), leaf("2"));

    SplitPenalties.compute(node(Production.ATOM, leaf("{"), entries, leaf("}")));

    entries.leaves().forEach(PenaltyAssignerTest::assertNoPenalty);
  }

  @Test
  public void testNestedArithmetic() {
    // a + b * c
    Interior product = node(Production.TERM, leaf("b"), leaf("*"), leaf("c"));
    Interior tree = node(Production.ARITH_EXPR, leaf("a"), leaf("+"), product);

    SplitPenalties.compute(tree);

    assertNoPenalty(tree.firstChild());
    assertPenalty(ARITHMETIC_EXPRESSION, tree.child(1));
    for (SyntaxNode token : product.children()) {
      assertPenalty(ARITHMETIC_EXPRESSION, token);
    }
  }

  @Test
  public void testComparison() {
    Interior tree = node(Production.COMPARISON, leaf("a"), leaf("<"), leaf("b"));

    SplitPenalties.compute(tree);

    assertNoPenalty(tree.child(0));
    assertPenalty(ARITHMETIC_EXPRESSION, tree.child(1));
    assertPenalty(ARITHMETIC_EXPRESSION, tree.child(2));
  }

  @Test
  public void testArithmeticDoesNotLowerPenalties() {
    // f(x) + y: the call's closing paren stays unbreakable
    Interior call = node(Production.POWER, leaf("f"), node(Production.TRAILER, leaf("("), leaf("x"), leaf(")")));
    Interior tree = node(Production.ARITH_EXPR, call, leaf("+"), leaf("y"));

    SplitPenalties.compute(tree);

    assertNoPenalty(call.firstLeaf());
    assertPenalty(UNBREAKABLE, call.lastLeaf());
    assertPenalty(UNBREAKABLE, call.child(1).firstLeaf());
    assertPenalty(ARITHMETIC_EXPRESSION, tree.child(1));
  }

  @Test
  public void testUnparenthesizedChain() {
    // a.b.c(1)[2]
    Interior attributeB = node(Production.TRAILER, leaf("."), leaf("b"));
    Interior attributeC = node(Production.TRAILER, leaf("."), leaf("c"));
    Interior call = node(Production.TRAILER, leaf("("), leaf("1"), leaf(")"));
    Interior subscript = node(Production.TRAILER, leaf("["), leaf("2"), leaf("]"));
    Interior tree = node(Production.POWER, leaf("a"), attributeB, attributeC, call, subscript);

    SplitPenalties.compute(tree);

    assertNoPenalty(tree.firstChild());
    assertPenalty(UNBREAKABLE, attributeB.child(0));
    assertPenalty(UNBREAKABLE, attributeB.child(1));
    assertPenalty(UNBREAKABLE, attributeC.child(0));
    assertPenalty(UNBREAKABLE, attributeC.child(1));
    assertPenalty(UNBREAKABLE, call.child(0));
    assertNoPenalty(call.child(1));
    assertPenalty(UNBREAKABLE, call.child(2));
    assertPenalty(UNBREAKABLE, subscript.child(0));
    assertNoPenalty(subscript.child(1));
    assertPenalty(STRONGLY_CONNECTED, subscript.child(2));
  }

  @Test
  public void testParenthesizedChain() {
    // (a.b().c())
    Interior attributeB = node(Production.TRAILER, leaf("."), leaf("b"));
    Interior firstCall = node(Production.TRAILER, leaf("("), leaf(")"));
    Interior attributeC = node(Production.TRAILER, leaf("."), leaf("c"));
    Interior secondCall = node(Production.TRAILER, leaf("("), leaf(")"));
    Interior chain = node(Production.POWER, leaf("a"), attributeB, firstCall, attributeC, secondCall);
    Interior tree = node(Production.ATOM, leaf("("), chain, leaf(")"));

    SplitPenalties.compute(tree);

    assertPenalty(UNBREAKABLE, attributeB.child(0));
    assertPenalty(UNBREAKABLE, attributeB.child(1));
    assertNoPenalty(firstCall.child(0));
    assertNoPenalty(firstCall.child(1));
    // the builder-style break before '.c' is allowed, if discouraged
    assertPenalty(STRONGLY_CONNECTED, attributeC.child(0));
    assertPenalty(UNBREAKABLE, attributeC.child(1));
    assertNoPenalty(secondCall.child(0));
    assertNoPenalty(secondCall.child(1));
  }

  @Test
  public void testChainInsideBrackets() {
    // [a.b().c]: only parentheses relax the chain
    Interior attributeB = node(Production.TRAILER, leaf("."), leaf("b"));
    Interior call = node(Production.TRAILER, leaf("("), leaf(")"));
    Interior attributeC = node(Production.TRAILER, leaf("."), leaf("c"));
    Interior chain = node(Production.POWER, leaf("a"), attributeB, call, attributeC);
    Interior tree = node(Production.ATOM, leaf("["), node(Production.LISTMAKER, chain), leaf("]"));

    SplitPenalties.compute(tree);

    assertPenalty(UNBREAKABLE, call.child(0));
    assertPenalty(UNBREAKABLE, attributeC.child(0));
    assertNoPenalty(call.child(1));
  }

  @Test
  public void testChainFollowedByPower() {
    // x[0] ** 2
    Interior subscript = node(Production.TRAILER, leaf("["), leaf("0"), leaf("]"));
    Interior tree = node(Production.POWER, leaf("x"), subscript, leaf("**"), leaf("2"));

    SplitPenalties.compute(tree);

    assertPenalty(UNBREAKABLE, subscript.child(0));
    assertPenalty(STRONGLY_CONNECTED, subscript.child(2));
    assertNoPenalty(tree.child(2));
    assertNoPenalty(tree.child(3));
  }

  @Test
  public void testSlice() {
    // x[1:2]
    Interior slice = node(Production.SUBSCRIPT, leaf("1"), leaf(":"), leaf("2"));
    Interior tree = node(Production.POWER, leaf("x"), node(Production.TRAILER, leaf("["), slice, leaf("]")));

    SplitPenalties.compute(tree);

    for (SyntaxNode token : slice.children()) {
      assertPenalty(STRONGLY_CONNECTED, token);
    }
  }

  @Test
  public void testComprehensionFilter() {
    // [x for x in y if x]
    Interior filter = node(Production.COMP_IF, leaf("if"), leaf("x"));
    Interior loop = node(Production.COMP_FOR, leaf("for"), leaf("x"), leaf("in"), leaf("y"), filter);
    Interior tree = node(Production.ATOM, leaf("["), node(Production.LISTMAKER, leaf("x"), loop), leaf("]"));

    SplitPenalties.compute(tree);

    assertNoPenalty(loop.child(0));
    assertPenalty(STRONGLY_CONNECTED, loop.child(1));
    assertPenalty(STRONGLY_CONNECTED, loop.child(2));
    assertPenalty(STRONGLY_CONNECTED, loop.child(3));
    assertNoPenalty(filter.child(0));
    assertPenalty(STRONGLY_CONNECTED, filter.child(1));
  }

  @Test
  public void testFilterClearsExistingPenalty() {
    Interior filter = node(Production.COMP_IF, leaf("if"), leaf("x"));
    filter.firstLeaf().annotate(Annotation.SPLIT_PENALTY, UNBREAKABLE);

    SplitPenalties.compute(filter);

    assertNoPenalty(filter.firstChild());
  }

  @Test
  public void testExistingPenaltiesAreNeverLowered() {
    Interior tree = node(Production.ARITH_EXPR, leaf("a"), leaf("+"), leaf("b"));
    tree.child(2).asLeaf().annotate(Annotation.SPLIT_PENALTY, UNBREAKABLE);

    SplitPenalties.compute(tree);

    assertPenalty(UNBREAKABLE, tree.child(2));
    assertPenalty(ARITHMETIC_EXPRESSION, tree.child(1));
  }

  @Test
  public void testIdempotence() {
    Interior filter = node(Production.COMP_IF, leaf("if"), leaf("x"));
    Interior loop = node(Production.COMP_FOR, leaf("for"), leaf("x"), leaf("in"),
        node(Production.POWER, leaf("a"), node(Production.TRAILER, leaf("."), leaf("b")),
            node(Production.TRAILER, leaf("("), leaf("1"), leaf(")"))),
        filter);
    Interior tree = node(Production.ATOM, leaf("["),
        node(Production.LISTMAKER, node(Production.TERM, leaf("x"), leaf("*"), leaf("2")), loop), leaf("]"));

    SplitPenalties.compute(tree);
    List<Optional<Integer>> once = snapshot(tree);
    SplitPenalties.compute(tree);

    assertEquals(once, snapshot(tree));
  }

  @Test
  public void testIsUnbreakable() {
    Interior tree = node(Production.DOTTED_NAME, leaf("a"), leaf("."), leaf("b"));

    SplitPenalties.compute(tree);

    assertFalse(SplitPenalties.isUnbreakable(tree.child(0).asLeaf()));
    assertTrue(SplitPenalties.isUnbreakable(tree.child(1).asLeaf()));
  }

  @Test
  public void testRulesCoverPenaltyProductions() {
    PenaltyAssigner assigner = new PenaltyAssigner();
    assertTrue(assigner.hasRule(Production.POWER));
    assertTrue(assigner.hasRule(Production.COMP_IF));
    assertFalse(assigner.hasRule(Production.ATOM));
    assertFalse(assigner.hasRule(Production.FILE_INPUT));
  }
}

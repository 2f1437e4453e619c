package com.onkiup.linker.formatter.tree;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Token types produced by the tokenizer. Keywords are reported as {@link #NAME} tokens.
 */
public enum TokenKind {
  NAME,
  NUMBER,
  STRING,
  COMMENT,
  NEWLINE,
  INDENT,
  DEDENT,
  ENDMARKER,

  LPAR("("),
  RPAR(")"),
  LSQB("["),
  RSQB("]"),
  LBRACE("{"),
  RBRACE("}"),
  COLON(":"),
  COMMA(","),
  SEMI(";"),
  DOT("."),
  ELLIPSIS("..."),
  AT("@"),
  RARROW("->"),
  EQUAL("="),
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  DOUBLESTAR("**"),
  SLASH("/"),
  DOUBLESLASH("//"),
  PERCENT("%"),
  TILDE("~"),
  VBAR("|"),
  AMPER("&"),
  CIRCUMFLEX("^"),
  LEFTSHIFT("<<"),
  RIGHTSHIFT(">>"),
  EQEQUAL("=="),
  NOTEQUAL("!="),
  LESS("<"),
  GREATER(">"),
  LESSEQUAL("<="),
  GREATEREQUAL(">="),
  PLUSEQUAL("+="),
  MINEQUAL("-="),
  STAREQUAL("*="),
  SLASHEQUAL("/="),
  DOUBLESLASHEQUAL("//="),
  PERCENTEQUAL("%="),
  DOUBLESTAREQUAL("**="),
  ATEQUAL("@="),
  AMPEREQUAL("&="),
  VBAREQUAL("|="),
  CIRCUMFLEXEQUAL("^="),
  LEFTSHIFTEQUAL("<<="),
  RIGHTSHIFTEQUAL(">>="),
  COLONEQUAL(":=");

  private static final Map<String, TokenKind> OPERATORS = Arrays.stream(values())
      .filter(kind -> kind.text != null)
      .collect(Collectors.toMap(kind -> kind.text, Function.identity(), (a, b) -> a, HashMap::new));

  static {
    // legacy spelling of '!='
    OPERATORS.put("<>", NOTEQUAL);
  }

  private final String text;

  TokenKind() {
    this(null);
  }

  TokenKind(String text) {
    this.text = text;
  }

  /**
   * @return fixed text of this token kind or null for tokens with variable text
   */
  public String text() {
    return text;
  }

  /**
   * Guesses token kind from the token text
   * @param text token text
   * @return matching token kind
   * @throws IllegalArgumentException if the text does not look like any known token
   */
  public static TokenKind forText(String text) {
    Objects.requireNonNull(text, "token text");
    TokenKind operator = OPERATORS.get(text);
    if (operator != null) {
      return operator;
    }
    if ("\n".equals(text) || "\r\n".equals(text)) {
      return NEWLINE;
    }
    if (text.isEmpty()) {
      throw new IllegalArgumentException("Cannot guess kind of an empty token");
    }
    char first = text.charAt(0);
    if (first == '#') {
      return COMMENT;
    }
    if (Character.isDigit(first) || (first == '.' && text.length() > 1 && Character.isDigit(text.charAt(1)))) {
      return NUMBER;
    }
    if (first == '\'' || first == '"' || isStringPrefix(text)) {
      return STRING;
    }
    if (Character.isJavaIdentifierStart(first) && text.chars().allMatch(Character::isJavaIdentifierPart)) {
      return NAME;
    }
    throw new IllegalArgumentException("Unknown token: '" + text + "'");
  }

  private static boolean isStringPrefix(String text) {
    int quote = text.indexOf('\'');
    if (quote < 0) {
      quote = text.indexOf('"');
    }
    return quote > 0 && quote <= 2 && text.substring(0, quote).chars().allMatch(c -> "rRbBuUfF".indexOf(c) > -1);
  }
}

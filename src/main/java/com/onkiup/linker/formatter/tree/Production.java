package com.onkiup.linker.formatter.tree;

import java.util.Locale;

/**
 * Grammar productions that label interior nodes of a concrete syntax tree
 */
public enum Production {
  FILE_INPUT,
  SIMPLE_STMT,
  EXPR_STMT,
  RETURN_STMT,
  IMPORT_NAME,
  DECORATOR,
  DECORATORS,
  DECORATED,
  CLASSDEF,
  FUNCDEF,
  PARAMETERS,
  TYPEDARGSLIST,
  TNAME,
  VARARGSLIST,
  LAMBDEF,
  SUITE,
  DOTTED_NAME,
  ATOM,
  DICTSETMAKER,
  LISTMAKER,
  TESTLIST_GEXP,
  TEST,
  OR_TEST,
  AND_TEST,
  NOT_TEST,
  COMPARISON,
  COMP_OP,
  EXPR,
  ARITH_EXPR,
  TERM,
  FACTOR,
  POWER,
  TRAILER,
  ARGLIST,
  ARGUMENT,
  SUBSCRIPTLIST,
  SUBSCRIPT,
  SLICEOP,
  COMP_FOR,
  COMP_IF;

  /**
   * @return production name as it is written in the grammar
   */
  public String grammarName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

package com.onkiup.linker.formatter.util;

import java.util.Optional;
import java.util.function.Supplier;

import org.apache.log4j.Layout;
import org.apache.log4j.spi.LoggingEvent;

import com.onkiup.linker.formatter.tree.SyntaxNode;

/**
 * log4j layout that prefixes every message with the source of the node being annotated
 */
public class LoggerLayout extends Layout {

  private Layout parent;
  private Supplier<Optional<SyntaxNode>> current;

  public LoggerLayout(Layout parent, Supplier<Optional<SyntaxNode>> current) {
    this.parent = parent;
    this.current = current;
  }

  @Override
  public String format(LoggingEvent event) {
    String node = current.get()
        .map(SyntaxNode::source)
        .map(LoggerLayout::sanitize)
        .map(source -> String.format("'%s'", ralign(source, 48)))
        .orElse("");
    return String.format("%50.50s || %s :: %s\n", node, ralign(event.getLoggerName(), 50), event.getRenderedMessage());
  }

  @Override
  public boolean ignoresThrowable() {
    return parent == null || parent.ignoresThrowable();
  }

  @Override
  public void activateOptions() {
    if (parent != null) {
      parent.activateOptions();
    }
  }

  public Layout parent() {
    return parent;
  }

  public static String sanitize(Object what) {
    return what == null ? "null" : sanitize(what.toString());
  }

  public static String sanitize(String what) {
    return what == null ? null : what.replaceAll("\n", "\\\\n").replaceAll("\t", "\\\\t");
  }

  public static CharSequence head(CharSequence what, int len) {
    if (what.length() < len) {
      return what;
    }
    return what.subSequence(0, len);
  }

  public static String ralign(CharSequence what, int len) {
    if (what.length() >= len) {
      what = what.subSequence(what.length() - len, what.length());
      return what.toString();
    }
    String format = String.format("%%%1$d.%1$ds%%2$s", len - what.length());
    return String.format(format, "", what);
  }
}

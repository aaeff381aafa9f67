package io.intellixity.polystore.adapter.columnar;

import io.intellixity.polystore.op.OperationValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compiles SQL containing named parameters (e.g. {@code :limit}) into JDBC SQL with '?' binds.\n
 *
 * Rules:\n
 * - Params are recognized as ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is treated as a SQL cast and not a param.\n
 * - Params inside single quotes are ignored.\n
 */
final class NamedParameterSql {
  private NamedParameterSql() {}

  record Compiled(String sql, List<Object> values) {}

  static Compiled compile(String sql, Map<String, Object> params) {
    StringBuilder out = new StringBuilder(sql.length() + 16);
    List<Object> values = new ArrayList<>();
    boolean inSingleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'') {
        // '' escape
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          String name = sql.substring(start, end);
          if (!params.containsKey(name)) throw new OperationValidationException("Missing query param: " + name);
          values.add(params.get(name));
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }
    return new Compiled(out.toString(), values);
  }

  /**
   * True when {@code sql} holds at most one statement: a ';' outside quotes and comments may only be
   * followed by whitespace, further ';' or comments.
   */
  static boolean isSingleStatement(String sql) {
    boolean terminated = false;
    int n = sql.length();
    for (int i = 0; i < n; i++) {
      char ch = sql.charAt(i);
      if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int eol = sql.indexOf('\n', i);
        i = (eol < 0) ? n : eol;
        continue;
      }
      if (ch == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int close = sql.indexOf("*/", i + 2);
        i = (close < 0) ? n : close + 1;
        continue;
      }
      if (Character.isWhitespace(ch)) continue;
      if (ch == ';') {
        terminated = true;
        continue;
      }
      if (terminated) return false;
      if (ch == '\'' || ch == '"') {
        i = skipQuoted(sql, i, ch);
      }
    }
    return true;
  }

  /**
   * The statement without trailing terminators and comments: everything up to the last character that
   * is not whitespace, ';' or part of a comment.
   */
  static String statementBody(String sql) {
    int end = 0;
    int n = sql.length();
    for (int i = 0; i < n; i++) {
      char ch = sql.charAt(i);
      if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int eol = sql.indexOf('\n', i);
        i = (eol < 0) ? n : eol;
        continue;
      }
      if (ch == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int close = sql.indexOf("*/", i + 2);
        i = (close < 0) ? n : close + 1;
        continue;
      }
      if (Character.isWhitespace(ch) || ch == ';') continue;
      if (ch == '\'' || ch == '"') i = skipQuoted(sql, i, ch);
      end = Math.min(n, i + 1);
    }
    return sql.substring(0, end);
  }

  private static int skipQuoted(String sql, int start, char quote) {
    for (int i = start + 1; i < sql.length(); i++) {
      if (sql.charAt(i) == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i++;
          continue;
        }
        return i;
      }
    }
    return sql.length();
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}

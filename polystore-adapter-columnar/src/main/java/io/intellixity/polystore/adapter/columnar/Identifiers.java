package io.intellixity.polystore.adapter.columnar;

import io.intellixity.polystore.result.StoreException;

import java.util.regex.Pattern;

/** SQL identifiers are only ever interpolated after passing this check. */
final class Identifiers {
  private Identifiers() {}

  static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

  static String require(String what, String v) {
    if (v == null || !IDENTIFIER.matcher(v).matches()) {
      throw StoreException.invalidInput(what + " must be an identifier matching " + IDENTIFIER.pattern());
    }
    return v;
  }
}

package io.intellixity.polystore.adapter;

import io.intellixity.polystore.result.ErrorCategory;

import java.util.*;
import java.util.function.Predicate;

/**
 * Ordered rules classifying backend exceptions into the error taxonomy.\n
 *
 * {@link #classify(Throwable)} walks the cause chain from the outermost exception inwards; for each
 * throwable the rules are tried in registration order and the first match wins.\n
 */
public final class ErrorMappingTable {
  private static final int MAX_CAUSE_DEPTH = 16;
  private static final ErrorMappingTable EMPTY = new ErrorMappingTable(List.of());

  public record Rule(String name, Predicate<Throwable> matcher, ErrorCategory category, boolean retryable) {
    public Rule {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(matcher, "matcher");
      Objects.requireNonNull(category, "category");
    }
  }

  /** Outcome of a successful classification; {@code source} is the throwable that matched. */
  public record Match(ErrorCategory category, boolean retryable, Throwable source, String rule) {}

  private final List<Rule> rules;

  private ErrorMappingTable(List<Rule> rules) {
    this.rules = List.copyOf(rules);
  }

  public static ErrorMappingTable empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Rule> rules() { return rules; }

  public Optional<Match> classify(Throwable t) {
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable cur = t;
    int depth = 0;
    while (cur != null && depth++ < MAX_CAUSE_DEPTH && seen.add(cur)) {
      for (Rule r : rules) {
        if (r.matcher().test(cur)) return Optional.of(new Match(r.category(), r.retryable(), cur, r.name()));
      }
      cur = cur.getCause();
    }
    return Optional.empty();
  }

  public static final class Builder {
    private final List<Rule> rules = new ArrayList<>();

    private Builder() {}

    public Builder on(Class<? extends Throwable> type, ErrorCategory category, boolean retryable) {
      Objects.requireNonNull(type, "type");
      rules.add(new Rule(type.getSimpleName(), type::isInstance, category, retryable));
      return this;
    }

    public Builder on(Class<? extends Throwable> type, ErrorCategory category) {
      return on(type, category, category.retryableByDefault());
    }

    public Builder when(String name, Predicate<Throwable> matcher, ErrorCategory category, boolean retryable) {
      rules.add(new Rule(name, matcher, category, retryable));
      return this;
    }

    public <T extends Throwable> Builder when(String name, Class<T> type, Predicate<? super T> matcher,
                                              ErrorCategory category, boolean retryable) {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(matcher, "matcher");
      rules.add(new Rule(name, t -> type.isInstance(t) && matcher.test(type.cast(t)), category, retryable));
      return this;
    }

    public ErrorMappingTable build() {
      return new ErrorMappingTable(rules);
    }
  }
}

package wordeq.solver.length;

import java.util.HashMap;
import java.util.Map;

/**
 * Gives every literal occurrence its own alias handle, so that equal words at different places are
 * told apart, and remembers the word behind each alias.
 */
public class LiteralAliases {
  private static final String ALIAS_PREFIX = "lit!";

  private final NameTable names;
  private final Map<Integer, String> words = new HashMap<>();

  public LiteralAliases(NameTable names) {
    this.names = names;
  }

  public int alias(String word) {
    final int handle = names.fresh(ALIAS_PREFIX);
    words.put(handle, word);
    return handle;
  }

  public boolean isAlias(int handle) {
    return words.containsKey(handle);
  }

  public String word(int alias) {
    final String word = words.get(alias);
    if (word == null) throw new IllegalArgumentException("not a literal alias: " + names.name(alias));
    return word;
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    words.forEach((h, w) -> builder.append(names.name(h)).append(" : '").append(w).append("'\n"));
    return builder.toString();
  }
}

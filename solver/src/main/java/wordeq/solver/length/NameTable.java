package wordeq.solver.length;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Interns names into dense integer handles, in order of first appearance. */
public class NameTable {
  private final Map<String, Integer> handles = new HashMap<>();
  private final List<String> names = new ArrayList<>();

  public int intern(String name) {
    final Integer handle = handles.get(name);
    if (handle != null) return handle;
    names.add(name);
    handles.put(name, names.size() - 1);
    return names.size() - 1;
  }

  /** @return the handle of <code>name</code>, or -1 */
  public int lookup(String name) {
    return handles.getOrDefault(name, -1);
  }

  public String name(int handle) {
    return names.get(handle);
  }

  public int size() {
    return names.size();
  }

  /** Interns a name <code>prefix + n</code> not used so far. */
  public int fresh(String prefix) {
    int n = names.size();
    while (handles.containsKey(prefix + n)) ++n;
    return intern(prefix + n);
  }
}

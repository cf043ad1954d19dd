package rps;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/** Counts of the statements in a script, nested ones included. */
@AutoValue
public abstract class StatementStatistics {
  public abstract ImmutableMap<Statement.Kind, Integer> counts();

  /** Names of all labels in source order. */
  public abstract ImmutableList<String> labelNames();

  public abstract int choiceCount();

  /** Nesting depth of the most deeply nested statement; 0 when everything is top level. */
  public abstract int maxDepth();

  public int count(Statement.Kind kind) {
    return counts().getOrDefault(kind, 0);
  }

  public int total() {
    return counts().values().stream().mapToInt(Integer::intValue).sum();
  }

  public int rawCount() {
    return count(Statement.Kind.RAW);
  }

  private static final class Counter extends StatementWalker {
    private final Map<Statement.Kind, Integer> counts = new EnumMap<>(Statement.Kind.class);
    private final List<String> labelNames = new ArrayList<>();
    private int choiceCount = 0;
    private int maxDepth = 0;

    @Override
    protected void visitStatement(Statement statement, ImmutableList<ASTNodeInterface> ancestors) {
      counts.merge(statement.kind(), 1, Integer::sum);
      if (statement.kind() == Statement.Kind.LABEL) {
        labelNames.add(statement.cast(Statement.Label.class).name());
      }
      maxDepth = Math.max(maxDepth, NodeLocator.Location.create(statement, ancestors).depth());
    }

    @Override
    public void visitImpl(Statement.Menu.Choice node) {
      choiceCount++;
      super.visitImpl(node);
    }
  }

  public static StatementStatistics of(Script script) {
    Counter counter = new Counter();
    counter.visitImpl(script);
    return new AutoValue_StatementStatistics(
        Maps.immutableEnumMap(counter.counts),
        ImmutableList.copyOf(counter.labelNames),
        counter.choiceCount,
        counter.maxDepth);
  }
}

package rps;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

/** Finds statements in a tree by id. */
public final class NodeLocator {

  /** A statement and the nodes enclosing it, outermost first. */
  @AutoValue
  public abstract static class Location {
    public abstract Statement statement();

    public abstract ImmutableList<ASTNodeInterface> ancestors();

    /** The script, label, menu choice or if branch whose body holds the statement. */
    public ASTNodeInterface parent() {
      return Iterables.getLast(ancestors());
    }

    /** 0 for top-level statements. */
    public int depth() {
      return (int) ancestors().stream().filter(a -> !isContainerOnly(a)).count() - 1;
    }

    private static boolean isContainerOnly(ASTNodeInterface node) {
      return node instanceof Statement.Menu || node instanceof Statement.If;
    }

    static Location create(Statement statement, ImmutableList<ASTNodeInterface> ancestors) {
      return new AutoValue_NodeLocator_Location(statement, ancestors);
    }
  }

  public static Optional<Location> find(Script script, NodeId id) {
    List<Location> found = new ArrayList<>();
    new StatementWalker() {
      @Override
      protected void visitStatement(
          Statement statement, ImmutableList<ASTNodeInterface> ancestors) {
        if (found.isEmpty() && statement.id().equals(id)) {
          found.add(Location.create(statement, ancestors));
        }
      }
    }.visitImpl(script);
    return found.stream().findFirst();
  }

  /** Every statement of the tree in source order, nested ones included. */
  public static ImmutableList<Statement> allStatements(Script script) {
    ImmutableList.Builder<Statement> all = ImmutableList.builder();
    new StatementWalker() {
      @Override
      protected void visitStatement(
          Statement statement, ImmutableList<ASTNodeInterface> ancestors) {
        all.add(statement);
      }
    }.visitImpl(script);
    return all.build();
  }

  private NodeLocator() {}
}

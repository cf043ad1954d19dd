package rps;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Structural edits. Trees are immutable, so every edit returns a new script that shares the
 * untouched subtrees with the old one.
 */
public final class ScriptEditor {

  /**
   * Replaces the statement {@code id}, wherever it is nested, with {@code replacements}. An empty
   * list deletes it.
   *
   * @throws IllegalArgumentException if no statement has that id
   */
  public static Script replace(
      Script script, NodeId id, Iterable<? extends Statement> replacements) {
    ImmutableList<Statement> with = ImmutableList.copyOf(replacements);
    Rewriter rewriter = new Rewriter(id, with);
    ImmutableList<Statement> statements = rewriter.rewrite(script.statements());
    Preconditions.checkArgument(rewriter.replaced, "no statement with id %s", id);
    return script.withStatements(statements);
  }

  public static Script remove(Script script, NodeId id) {
    return replace(script, id, ImmutableList.of());
  }

  private static final class Rewriter {
    private final NodeId id;
    private final ImmutableList<Statement> replacements;
    private boolean replaced = false;

    private Rewriter(NodeId id, ImmutableList<Statement> replacements) {
      this.id = id;
      this.replacements = replacements;
    }

    private ImmutableList<Statement> rewrite(List<Statement> statements) {
      ImmutableList.Builder<Statement> out = ImmutableList.builder();
      for (Statement statement : statements) {
        if (!replaced && statement.id().equals(id)) {
          replaced = true;
          out.addAll(replacements);
        } else if (replaced) {
          out.add(statement);
        } else {
          out.add(rewriteChildren(statement));
        }
      }
      return out.build();
    }

    private Statement rewriteChildren(Statement statement) {
      switch (statement.kind()) {
        case LABEL:
          {
            Statement.Label label = statement.cast();
            ImmutableList<Statement> body = rewrite(label.body());
            return replaced ? label.withBody(body) : label;
          }
        case MENU:
          {
            Statement.Menu menu = statement.cast();
            ImmutableList.Builder<Statement.Menu.Choice> choices = ImmutableList.builder();
            for (Statement.Menu.Choice choice : menu.choices()) {
              boolean before = replaced;
              ImmutableList<Statement> body = rewrite(choice.body());
              choices.add(replaced && !before ? choice.withBody(body) : choice);
            }
            return replaced ? menu.withChoices(choices.build()) : menu;
          }
        case IF:
          {
            Statement.If ifStatement = statement.cast();
            ImmutableList.Builder<Statement.If.Branch> branches = ImmutableList.builder();
            for (Statement.If.Branch branch : ifStatement.branches()) {
              boolean before = replaced;
              ImmutableList<Statement> body = rewrite(branch.body());
              branches.add(replaced && !before ? branch.withBody(body) : branch);
            }
            return replaced ? ifStatement.withBranches(branches.build()) : ifStatement;
          }
        default:
          return statement;
      }
    }
  }

  private ScriptEditor() {}
}

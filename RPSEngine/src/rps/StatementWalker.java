package rps;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Visits every statement of a tree in source order, together with the nodes enclosing it from
 * the script downwards.
 */
abstract class StatementWalker extends VoidDefaultASTVisitor {
  private final Deque<ASTNodeInterface> ancestors = new ArrayDeque<>();

  protected abstract void visitStatement(
      Statement statement, ImmutableList<ASTNodeInterface> ancestors);

  private void visitBody(ASTNodeInterface owner, List<Statement> body) {
    ancestors.addLast(owner);
    for (Statement statement : body) {
      visitStatement(statement, ImmutableList.copyOf(ancestors));
      statement.accept(this, null);
    }
    ancestors.removeLast();
  }

  @Override
  public void visitImpl(Script node) {
    visitBody(node, node.statements());
  }

  @Override
  public void visitImpl(Statement.Label node) {
    visitBody(node, node.body());
  }

  @Override
  public void visitImpl(Statement.Menu node) {
    ancestors.addLast(node);
    super.visitImpl(node);
    ancestors.removeLast();
  }

  @Override
  public void visitImpl(Statement.Menu.Choice node) {
    visitBody(node, node.body());
  }

  @Override
  public void visitImpl(Statement.If node) {
    ancestors.addLast(node);
    super.visitImpl(node);
    ancestors.removeLast();
  }

  @Override
  public void visitImpl(Statement.If.Branch node) {
    visitBody(node, node.body());
  }
}

package rps;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import rps.processor.ASTChild;
import rps.processor.ASTNode;

/** A parsed or constructed script: its top-level statements in source order. */
@ASTNode
@AutoValue
public abstract class Script implements Script_ASTNode {
  @ASTChild
  @Override
  public abstract ImmutableList<Statement> statements();

  public abstract ScriptMetadata metadata();

  public static Script create(Iterable<? extends Statement> statements, ScriptMetadata metadata) {
    return new AutoValue_Script(ImmutableList.copyOf(statements), metadata);
  }

  public Script withStatements(Iterable<? extends Statement> newStatements) {
    return create(newStatements, metadata());
  }

  public boolean isEmpty() {
    return statements().isEmpty();
  }
}

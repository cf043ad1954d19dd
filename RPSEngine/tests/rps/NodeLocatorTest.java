package rps;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class NodeLocatorTest {

  private final NodeFactory nodes = new NodeFactory(new NodeIdGenerator());

  @Test
  public void findsTopLevelStatement() {
    Statement define = nodes.define("x", "1");
    Script script = nodes.script(ImmutableList.of(define));

    NodeLocator.Location location = NodeLocator.find(script, define.id()).get();

    assertThat(location.statement()).isSameInstanceAs(define);
    assertThat(location.parent()).isSameInstanceAs(script);
    assertThat(location.depth()).isEqualTo(0);
  }

  @Test
  public void findsNestedStatement() {
    Statement jump = nodes.jump("end");
    Statement.Menu.Choice choice = nodes.choice("Go", ImmutableList.of(jump));
    Statement.Menu menu = nodes.menu(ImmutableList.of(choice));
    Statement.Label label = nodes.label("start", ImmutableList.of(menu));
    Script script = nodes.script(ImmutableList.of(label));

    NodeLocator.Location location = NodeLocator.find(script, jump.id()).get();

    assertThat(location.ancestors())
        .containsExactly(script, label, menu, choice)
        .inOrder();
    assertThat(location.parent()).isSameInstanceAs(choice);
    assertThat(location.depth()).isEqualTo(2);
  }

  @Test
  public void missingId() {
    Script script = nodes.script(ImmutableList.of(nodes.returnStatement()));

    assertThat(NodeLocator.find(script, NodeId.of(999))).isEmpty();
  }

  @Test
  public void allStatementsInSourceOrder() {
    Statement first = nodes.narration("1");
    Statement second = nodes.narration("2");
    Statement third = nodes.narration("3");
    Statement.If ifStatement =
        nodes.ifStatement(
            ImmutableList.of(
                nodes.branch("a", ImmutableList.of(first)),
                nodes.elseBranch(ImmutableList.of(second))));
    Script script = nodes.script(ImmutableList.of(ifStatement, third));

    assertThat(NodeLocator.allStatements(script))
        .containsExactly(ifStatement, first, second, third)
        .inOrder();
  }
}

package rps;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** Identity of a node, unique among the nodes created by one {@link NodeIdGenerator}. */
@AutoValue
public abstract class NodeId implements Comparable<NodeId> {
  public abstract long value();

  public static NodeId of(long value) {
    Preconditions.checkArgument(value > 0, "node ids are positive: %s", value);
    return new AutoValue_NodeId(value);
  }

  @Override
  public int compareTo(NodeId other) {
    return Long.compare(value(), other.value());
  }

  @Override
  public String toString() {
    return "#" + value();
  }
}

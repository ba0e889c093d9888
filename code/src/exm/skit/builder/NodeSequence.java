/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.skit.builder;

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.skit.tree.NodeKind;
import exm.skit.tree.SwiftTree;

/**
 * Immutable ordered list of nodes in source order.
 * Duplicates are kept; nothing is ever deduplicated or reordered.
 */
public class NodeSequence implements Iterable<SwiftTree>
{
  private static final NodeSequence EMPTY =
      new NodeSequence(ImmutableList.<SwiftTree>of());

  private final ImmutableList<SwiftTree> nodes;

  private NodeSequence(ImmutableList<SwiftTree> nodes)
  {
    this.nodes = nodes;
  }

  public static NodeSequence empty()
  {
    return EMPTY;
  }

  public static NodeSequence of(SwiftTree... nodes)
  {
    return new NodeSequence(ImmutableList.copyOf(nodes));
  }

  public static NodeSequence copyOf(Iterable<? extends SwiftTree> nodes)
  {
    return new NodeSequence(ImmutableList.<SwiftTree>copyOf(nodes));
  }

  public SwiftTree get(int i)
  {
    return nodes.get(i);
  }

  public int size()
  {
    return nodes.size();
  }

  public boolean isEmpty()
  {
    return nodes.isEmpty();
  }

  /**
   * @return number of nodes that are not placeholders
   */
  public int countContent()
  {
    int count = 0;
    for (SwiftTree node: nodes) {
      if (node.kind() != NodeKind.EMPTY) {
        count++;
      }
    }
    return count;
  }

  public List<SwiftTree> asList()
  {
    return nodes;
  }

  /**
   * @return a new sequence with this sequence's nodes followed by
   *         more
   */
  public NodeSequence concat(Iterable<? extends SwiftTree> more)
  {
    return new NodeSequence(ImmutableList.<SwiftTree>builder()
                      .addAll(nodes).addAll(more).build());
  }

  @Override
  public Iterator<SwiftTree> iterator()
  {
    return nodes.iterator();
  }

  @Override
  public boolean equals(Object o)
  {
    if (!(o instanceof NodeSequence)) {
      return false;
    }
    return nodes.equals(((NodeSequence)o).nodes);
  }

  @Override
  public int hashCode()
  {
    return nodes.hashCode();
  }

  @Override
  public String toString()
  {
    return nodes.toString();
  }
}

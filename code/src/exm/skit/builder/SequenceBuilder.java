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

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.skit.common.Logging;
import exm.skit.common.exceptions.DslMisuseError;
import exm.skit.tree.EmptyNode;
import exm.skit.tree.SwiftTree;

/**
 * Accumulates nodes in the order the authoring code produces them.
 *
 * The combinators mirror the shapes authoring code takes: single
 * items, optional items, conditional sections, two-way branches and
 * loops.  An absent optional item or a false condition contributes
 * exactly one {@link EmptyNode}, so positions stay predictable.
 * Every branch or loop iteration is flattened into this sequence at
 * the point it is reached.
 */
public class SequenceBuilder
{
  private static final Logger logger = Logging.getSKitLogger();

  /**
   * Callback for one iteration of {@link SequenceBuilder#forEach}
   */
  public static interface ItemBuilder<T>
  {
    public void build(SequenceBuilder b, T item);
  }

  private final List<SwiftTree> nodes = new ArrayList<SwiftTree>();

  public SequenceBuilder add(SwiftTree node)
  {
    if (node == null) {
      throw new DslMisuseError("SequenceBuilder",
                  "null node: use optional() for absent elements");
    }
    nodes.add(node);
    return this;
  }

  public SequenceBuilder add(SwiftTree... more)
  {
    for (SwiftTree node: more) {
      add(node);
    }
    return this;
  }

  public SequenceBuilder addAll(Iterable<? extends SwiftTree> more)
  {
    for (SwiftTree node: more) {
      add(node);
    }
    return this;
  }

  /**
   * Add node, or a placeholder if node is null
   */
  public SequenceBuilder optional(SwiftTree node)
  {
    if (node == null) {
      nodes.add(EmptyNode.INSTANCE);
    } else {
      nodes.add(node);
    }
    return this;
  }

  /**
   * Run body in place if cond holds, otherwise add one placeholder
   */
  public SequenceBuilder when(boolean cond, BlockBuilder body)
  {
    if (cond) {
      body.build(this);
    } else {
      nodes.add(EmptyNode.INSTANCE);
    }
    return this;
  }

  /**
   * Run exactly one of the two branches in place
   */
  public SequenceBuilder either(boolean cond, BlockBuilder first,
                                BlockBuilder second)
  {
    if (cond) {
      first.build(this);
    } else {
      second.build(this);
    }
    return this;
  }

  /**
   * Run body once per item, in iteration order
   */
  public <T> SequenceBuilder forEach(Iterable<T> items,
                                     ItemBuilder<? super T> body)
  {
    for (T item: items) {
      body.build(this, item);
    }
    return this;
  }

  public int size()
  {
    return nodes.size();
  }

  public NodeSequence build()
  {
    if (logger.isTraceEnabled()) {
      logger.trace("built sequence of " + nodes.size() + " nodes");
    }
    return NodeSequence.copyOf(nodes);
  }
}

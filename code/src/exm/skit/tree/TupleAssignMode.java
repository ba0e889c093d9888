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
package exm.skit.tree;

/**
 * How the value of a {@link TupleAssignment} is evaluated
 */
public enum TupleAssignMode
{
  /** let (a, b) = (x, y) */
  SYNC("", ""),
  /** let (a, b) = await (x, y) */
  ASYNC("", "await "),
  /** let (a, b) = try (x, y) */
  THROWING("", "try "),
  /** let (a, b) = try await (x, y) */
  ASYNC_THROWING("", "try await "),
  /** async let (a, b) = try await (x, y) */
  CONCURRENT_ASYNC("async ", "try await ");

  final String bindingPrefix;
  final String valuePrefix;

  private TupleAssignMode(String bindingPrefix, String valuePrefix)
  {
    this.bindingPrefix = bindingPrefix;
    this.valuePrefix = valuePrefix;
  }

  TupleAssignMode withAsync()
  {
    switch (this) {
      case SYNC:
        return ASYNC;
      case THROWING:
        return ASYNC_THROWING;
      default:
        return this;
    }
  }

  TupleAssignMode withThrowing()
  {
    switch (this) {
      case SYNC:
        return THROWING;
      case ASYNC:
        return ASYNC_THROWING;
      default:
        return this;
    }
  }
}

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

package exm.midend.common.exceptions;

/**
 * A structural invariant of a graph or declaration tree was violated,
 * e.g. an exit without a matching enter, mismatched nesting levels or
 * an accessor that can't be paired with its property.
 */
public class StructuralInvariantError extends MidendRuntimeError {

  public StructuralInvariantError(String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}

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

package exm.midend.fir.dfa;

/**
 * Outcome of a branch condition, as seen on one outgoing edge
 */
public enum Condition {
  EQ_TRUE,
  EQ_FALSE,
  EQ_NULL,
  NOT_EQ_NULL;

  public Condition negate() {
    switch (this) {
      case EQ_TRUE:
        return EQ_FALSE;
      case EQ_FALSE:
        return EQ_TRUE;
      case EQ_NULL:
        return NOT_EQ_NULL;
      case NOT_EQ_NULL:
        return EQ_NULL;
      default:
        throw new IllegalStateException("Unknown condition " + this);
    }
  }
}

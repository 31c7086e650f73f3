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

package exm.midend.ir.serialization;

/**
 * Identifier of a declaration in serialized IR.  Exported declarations
 * get the hash of their mangled name, which is the same in every unit;
 * the rest get a counter value that is only meaningful within a unit.
 */
public class UniqId {
  private final long index;
  private final boolean isLocal;

  public UniqId(long index, boolean isLocal) {
    this.index = index;
    this.isLocal = isLocal;
  }

  public long getIndex() {
    return index;
  }

  public boolean isLocal() {
    return isLocal;
  }

  @Override
  public int hashCode() {
    return (int)(index ^ (index >>> 32)) * 31 + (isLocal ? 1 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof UniqId))
      return false;
    UniqId other = (UniqId)obj;
    return index == other.index && isLocal == other.isLocal;
  }

  @Override
  public String toString() {
    return (isLocal ? "local:" : "") + index;
  }
}

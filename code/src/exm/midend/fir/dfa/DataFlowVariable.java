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

import exm.midend.fir.FirTypeRef;

/**
 * Compiler-internal handle standing for the value of an expression or
 * declaration.  Value identity: two variables are equal iff name, type
 * and synthetic flag are equal.
 *
 * isSynthetic = false for variables that represent real declarations
 * isSynthetic = true for compound expressions (e.g. a when expression)
 */
public class DataFlowVariable {
  private final String name;
  private final FirTypeRef type;
  private final boolean isSynthetic;

  public DataFlowVariable(String name, FirTypeRef type, boolean isSynthetic) {
    assert(name != null && type != null);
    this.name = name;
    this.type = type;
    this.isSynthetic = isSynthetic;
  }

  public String getName() {
    return name;
  }

  public FirTypeRef getType() {
    return type;
  }

  public boolean isSynthetic() {
    return isSynthetic;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + name.hashCode();
    result = prime * result + type.hashCode();
    result = prime * result + (isSynthetic ? 1231 : 1237);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    DataFlowVariable other = (DataFlowVariable) obj;
    return name.equals(other.name) && type.equals(other.type) &&
           isSynthetic == other.isSynthetic;
  }

  @Override
  public String toString() {
    return name;
  }
}

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

package exm.midend.fir;

import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.fir.FirDeclarations.FirDeclaration;

/**
 * Resolved reference to a declaration.  Bound exactly once.
 * @param <D> kind of declaration
 */
public class FirSymbol<D extends FirDeclaration> {
  private D fir = null;

  public void bind(D declaration) {
    assert(declaration != null);
    if (this.fir != null) {
      throw new StructuralInvariantError("Symbol already bound to "
                                  + this.fir + ", can't rebind to " + declaration);
    }
    this.fir = declaration;
  }

  public boolean isBound() {
    return fir != null;
  }

  public D getFir() {
    if (fir == null) {
      throw new StructuralInvariantError("Unbound symbol");
    }
    return fir;
  }

  @Override
  public String toString() {
    return fir == null ? "<unbound>" : "@" + fir.getName();
  }
}

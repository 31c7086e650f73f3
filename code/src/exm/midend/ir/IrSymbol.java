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

package exm.midend.ir;

import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.ir.descriptors.Descriptors.DeclarationDescriptor;

/**
 * Reference to a declaration, which may be created before the
 * declaration itself.  Bound to its owner exactly once.
 *
 * Symbols are compared by identity.
 * @param <T> kind of owner
 */
public class IrSymbol<T extends IrSymbolOwner> {

  public static enum Kind {
    FILE,
    EXTERNAL_PACKAGE_FRAGMENT,
    CLASS,
    ENUM_ENTRY,
    CONSTRUCTOR,
    SIMPLE_FUNCTION,
    PROPERTY,
    FIELD,
    VALUE_PARAMETER,
    TYPE_PARAMETER,
    VARIABLE;
  }

  private final Kind kind;
  /** Front-end descriptor, null for declarations created by the back end */
  private final DeclarationDescriptor descriptor;
  private T owner = null;

  public IrSymbol(Kind kind, DeclarationDescriptor descriptor) {
    this.kind = kind;
    this.descriptor = descriptor;
  }

  public IrSymbol(Kind kind) {
    this(kind, null);
  }

  public Kind getKind() {
    return kind;
  }

  public DeclarationDescriptor getDescriptor() {
    return descriptor;
  }

  public boolean isBound() {
    return owner != null;
  }

  public void bind(T owner) {
    assert(owner != null);
    if (this.owner != null) {
      throw new StructuralInvariantError(kind + " symbol already bound to "
                + this.owner + ", can't rebind to " + owner);
    }
    this.owner = owner;
  }

  public T getOwner() {
    if (owner == null) {
      throw new StructuralInvariantError("Unbound " + kind + " symbol "
                                         + descriptor);
    }
    return owner;
  }

  @Override
  public String toString() {
    return kind + "@" + (owner != null ? owner : descriptor);
  }
}

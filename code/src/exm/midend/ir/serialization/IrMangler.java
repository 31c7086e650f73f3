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

import exm.midend.ir.IrDeclarations.IrDeclaration;

/**
 * Produces names of declarations that are stable across units
 */
public interface IrMangler {
  /**
   * @return true if the declaration can be referred to from other units
   */
  public boolean isExported(IrDeclaration declaration);

  /**
   * @return mangled name, unique among exported declarations
   */
  public String mangledName(IrDeclaration declaration);

  /**
   * @return stable hash of the mangled name
   */
  public long hashedMangle(IrDeclaration declaration);
}

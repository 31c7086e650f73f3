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

import java.util.HashMap;
import java.util.Map;

import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrEnumEntry;
import exm.midend.ir.IrDeclarations.IrField;
import exm.midend.ir.IrDeclarations.IrFunction;
import exm.midend.ir.IrDeclarations.IrProperty;

/**
 * Assigns uniq ids to declarations of one unit.  Not shared between
 * units: local ids restart at zero for each table.
 */
public class DeclarationTable {
  private final IrMangler mangler;
  private final boolean externallyVisibleOnly;

  /** Declarations are compared by identity */
  private final Map<IrDeclaration, UniqId> table =
                                    new HashMap<IrDeclaration, UniqId>();
  private long localIndex = 0;

  /**
   * @param externallyVisibleOnly if true, only declarations visible
   *    outside their file get mangled ids.  Otherwise every named member
   *    does.
   */
  public DeclarationTable(IrMangler mangler, boolean externallyVisibleOnly) {
    this.mangler = mangler;
    this.externallyVisibleOnly = externallyVisibleOnly;
  }

  public IrMangler getMangler() {
    return mangler;
  }

  public UniqId uniqIdByDeclaration(IrDeclaration declaration) {
    UniqId id = table.get(declaration);
    if (id == null) {
      if (isExported(declaration)) {
        id = new UniqId(mangler.hashedMangle(declaration), false);
      } else {
        id = new UniqId(localIndex++, true);
      }
      table.put(declaration, id);
    }
    return id;
  }

  public boolean isExported(IrDeclaration declaration) {
    if (externallyVisibleOnly) {
      return mangler.isExported(declaration);
    }
    return isNamedMember(declaration) &&
           declaration.fqNameWhenAvailable() != null;
  }

  private static boolean isNamedMember(IrDeclaration declaration) {
    return declaration instanceof IrClass ||
           declaration instanceof IrFunction ||
           declaration instanceof IrProperty ||
           declaration instanceof IrField ||
           declaration instanceof IrEnumEntry;
  }
}

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.ir.IrDeclarationContainer;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrTreeWalker;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrPackageFragment;
import exm.midend.ir.IrExpressions.IrFunctionAccessExpression;
import exm.midend.ir.IrExpressions.IrPropertyReference;

/**
 * Entry point for collecting the external references of a unit
 */
public class ExternalReferences {

  /**
   * Walk the declarations of toplevel and mirror the target of every
   * call, constructor call and property reference outside it.
   * @param toplevel a file or a top-level class
   * @param undefinedOffsets give mirrors UNDEFINED_OFFSET offsets
   */
  public static ExternalReferencesInfo collect(Logger logger,
          IrDeclarationContainer toplevel, boolean undefinedOffsets) {
    final ExternalReferenceCollection collection =
        new ExternalReferenceCollection(logger, toplevel, undefinedOffsets);
    IrTreeWalker walker = new IrTreeWalker() {
      @Override
      public Void visitFunctionAccess(IrFunctionAccessExpression expression,
                                      Void data) {
        collection.getCopy(ownerOf(expression.getSymbol()));
        return super.visitFunctionAccess(expression, data);
      }

      @Override
      public Void visitPropertyReference(IrPropertyReference expression,
                                         Void data) {
        collection.getCopy(ownerOf(expression.getSymbol()));
        return super.visitPropertyReference(expression, data);
      }
    };
    for (IrDeclaration declaration: toplevel.getDeclarations()) {
      walker.walk(declaration);
    }

    List<IrPackageFragment> packageFragments =
                                    collection.getPackageFragments();
    Map<IrPackageFragment, Integer> packageIndex =
                                new HashMap<IrPackageFragment, Integer>();
    for (int i = 0; i < packageFragments.size(); i++) {
      packageIndex.put(packageFragments.get(i), i);
    }
    Map<IrDeclaration, Integer> references =
                              new LinkedHashMap<IrDeclaration, Integer>();
    Map<IrDeclaration, IrDeclaration> originals =
                        new HashMap<IrDeclaration, IrDeclaration>();
    for (Map.Entry<IrDeclaration, IrPackageFragment> e:
              collection.getReferenceToPackageFragmentMap().entrySet()) {
      references.put(e.getKey(), packageIndex.get(e.getValue()));
      originals.put(e.getKey(), collection.getOriginal(e.getKey()));
    }
    if (logger.isDebugEnabled()) {
      logger.debug("External references of " + toplevel + ": " +
          references.size() + " mirrors in " + packageFragments.size() +
          " packages");
    }
    return new ExternalReferencesInfo(packageFragments, references,
                                      originals);
  }

  private static <T extends IrDeclaration> T ownerOf(IrSymbol<T> symbol) {
    if (!symbol.isBound()) {
      throw new UnresolvedIdentityError("Reference to unbound symbol "
                                        + symbol);
    }
    return symbol.getOwner();
  }
}

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

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.common.exceptions.UnsupportedInputError;
import exm.midend.fir.FirElement;
import exm.midend.fir.FirSymbol;
import exm.midend.fir.FirDeclarations.FirDeclaration;
import exm.midend.fir.FirDeclarations.FirTypedDeclaration;
import exm.midend.fir.FirExpressions.FirExpression;
import exm.midend.fir.FirTypeRef;

/**
 * Registry of dataflow variables for one analyzed function body.
 *
 * Several elements (a declaration and the references to it) may map to
 * the same variable; each element maps to at most one variable.
 * Variable names are never reused until the registry is reset.
 * Not safe for concurrent use.
 */
public class DataFlowVariableStorage {
  private final SetMultimap<DataFlowVariable, FirElement> dfi2FirMap =
                                            LinkedHashMultimap.create();
  private final Map<FirElement, DataFlowVariable> fir2DfiMap =
                                new HashMap<FirElement, DataFlowVariable>();
  private int counter = 1;

  private String nextVarName() {
    return "d" + counter++;
  }

  public DataFlowVariable getOrCreateRealVariable(
                      FirSymbol<? extends FirDeclaration> symbol) {
    FirDeclaration fir = symbol.getFir();
    DataFlowVariable existing = get(fir);
    if (existing != null) {
      return existing;
    }
    DataFlowVariable variable = new DataFlowVariable(nextVarName(),
                                                     typeOf(fir), false);
    storeVariable(variable, fir);
    return variable;
  }

  public DataFlowVariable getOrCreateSyntheticVariable(FirElement fir) {
    DataFlowVariable existing = get(fir);
    if (existing != null) {
      return existing;
    }
    DataFlowVariable variable = new DataFlowVariable(nextVarName(),
                                                     typeOf(fir), true);
    storeVariable(variable, fir);
    return variable;
  }

  /**
   * Map a further element, e.g. a reference site, to an existing variable
   */
  public void attachReference(FirElement fir, DataFlowVariable variable) {
    if (!dfi2FirMap.containsKey(variable)) {
      throw new StructuralInvariantError("Variable " + variable +
                  " is not stored, can't attach " + fir);
    }
    DataFlowVariable prev = fir2DfiMap.get(fir);
    if (prev != null && !prev.equals(variable)) {
      throw new StructuralInvariantError(fir + " already mapped to " + prev
                                         + ", can't map to " + variable);
    }
    storeVariable(variable, fir);
  }

  /**
   * Purge variable and all elements mapped to it
   */
  public void remove(DataFlowVariable variable) {
    for (FirElement fir: dfi2FirMap.removeAll(variable)) {
      fir2DfiMap.remove(fir);
    }
  }

  private void storeVariable(DataFlowVariable variable, FirElement fir) {
    dfi2FirMap.put(variable, fir);
    fir2DfiMap.put(fir, variable);
  }

  /**
   * @return all elements mapped to variable, empty if none
   */
  public Collection<FirElement> getElements(DataFlowVariable variable) {
    return dfi2FirMap.get(variable);
  }

  /**
   * @return variable or null if not stored
   */
  public DataFlowVariable get(FirElement fir) {
    return fir2DfiMap.get(fir);
  }

  public DataFlowVariable get(FirSymbol<? extends FirDeclaration> symbol) {
    return fir2DfiMap.get(symbol.getFir());
  }

  public int size() {
    return dfi2FirMap.keySet().size();
  }

  /**
   * Forget everything, including the name counter.  Used when moving on
   * to a new function body.
   */
  public void reset() {
    dfi2FirMap.clear();
    fir2DfiMap.clear();
    counter = 1;
  }

  private static FirTypeRef typeOf(FirElement fir) {
    if (fir instanceof FirExpression) {
      return ((FirExpression)fir).getResultType();
    } else if (fir instanceof FirTypedDeclaration) {
      return ((FirTypedDeclaration)fir).getReturnTypeRef();
    } else {
      throw new UnsupportedInputError("No type rule for element " + fir);
    }
  }
}

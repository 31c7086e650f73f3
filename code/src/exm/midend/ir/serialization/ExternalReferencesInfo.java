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

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrPackageFragment;

/**
 * Result of collecting external references for one unit: the distinct
 * package fragments holding mirrors, in order of first use, and for
 * each directly referenced mirror the index of its package fragment.
 */
public class ExternalReferencesInfo {
  private final ImmutableList<IrPackageFragment> packageFragments;
  private final ImmutableMap<IrDeclaration, Integer> references;
  private final ImmutableMap<IrDeclaration, IrDeclaration> originals;

  public ExternalReferencesInfo(List<IrPackageFragment> packageFragments,
                                Map<IrDeclaration, Integer> references,
                                Map<IrDeclaration, IrDeclaration> originals) {
    this.packageFragments = ImmutableList.copyOf(packageFragments);
    this.references = ImmutableMap.copyOf(references);
    this.originals = ImmutableMap.copyOf(originals);
  }

  public ImmutableList<IrPackageFragment> getPackageFragments() {
    return packageFragments;
  }

  /**
   * @return map from mirror to package index, in order of first reference
   */
  public ImmutableMap<IrDeclaration, Integer> getReferences() {
    return references;
  }

  /**
   * @return the declaration that a referenced mirror was made from
   */
  public IrDeclaration getOriginal(IrDeclaration mirror) {
    IrDeclaration original = originals.get(mirror);
    if (original == null) {
      throw new UnresolvedIdentityError("Not a referenced mirror: " + mirror);
    }
    return original;
  }

  @Override
  public String toString() {
    return "ExternalReferencesInfo(packages=" + packageFragments +
           ", references=" + references + ")";
  }
}

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

import java.util.List;

import exm.midend.common.exceptions.StructuralInvariantError;

/**
 * Helpers for replacing children during a transformation
 */
public class IrTransforms {

  /**
   * @return transformed element, or null if element was null
   */
  public static <T extends IrElement, D> T transform(T element,
          Class<T> expected, IrElementTransformer<D> transformer, D data) {
    if (element == null) {
      return null;
    }
    IrElement result = element.accept(transformer, data);
    if (!expected.isInstance(result)) {
      throw new StructuralInvariantError("Transformer replaced " + element
          + " with " + result + ", expected " + expected.getSimpleName());
    }
    return expected.cast(result);
  }

  /**
   * Transform each element of a list in place.  Null entries are kept.
   */
  public static <T extends IrElement, D> void transformList(List<T> list,
          Class<T> expected, IrElementTransformer<D> transformer, D data) {
    for (int i = 0; i < list.size(); i++) {
      list.set(i, transform(list.get(i), expected, transformer, data));
    }
  }

  public static <D> void acceptIfPresent(IrElement element,
                              IrElementVisitor<?, D> visitor, D data) {
    if (element != null) {
      element.accept(visitor, data);
    }
  }

  public static <D> void acceptAll(List<? extends IrElement> elements,
                              IrElementVisitor<?, D> visitor, D data) {
    for (IrElement element: elements) {
      acceptIfPresent(element, visitor, data);
    }
  }
}

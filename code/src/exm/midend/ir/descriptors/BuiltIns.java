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

package exm.midend.ir.descriptors;

import com.google.common.collect.ImmutableMap;

import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.ir.ClassKind;
import exm.midend.ir.FqName;
import exm.midend.ir.descriptors.Descriptors.ClassDescriptor;
import exm.midend.ir.descriptors.Descriptors.PackageFragmentDescriptor;

/**
 * Descriptors of the built-in classes in package kotlin.  Fixed at
 * class load time.
 */
public class BuiltIns {
  public static final FqName BUILT_INS_PACKAGE_NAME =
                                      FqName.fromString("kotlin");

  public static final PackageFragmentDescriptor BUILT_INS_PACKAGE =
                  new PackageFragmentDescriptor(BUILT_INS_PACKAGE_NAME);

  private static final ImmutableMap<String, ClassDescriptor> classes;

  static {
    ImmutableMap.Builder<String, ClassDescriptor> builder =
                                      ImmutableMap.builder();
    for (String name: new String[] {"Any", "Nothing", "Unit", "Boolean",
                  "Char", "Byte", "Short", "Int", "Long", "Float", "Double",
                  "String"}) {
      builder.put(name, new ClassDescriptor(BUILT_INS_PACKAGE, name,
                                            ClassKind.CLASS));
    }
    classes = builder.build();
  }

  public static ClassDescriptor getBuiltInClass(String name) {
    ClassDescriptor cls = classes.get(name);
    if (cls == null) {
      throw new UnresolvedIdentityError("No built-in class kotlin." + name);
    }
    return cls;
  }

  /**
   * @return short name if classifier is a built-in class, else null
   */
  public static String builtInName(ClassDescriptor cls) {
    if (cls.getContainingDeclaration() == BUILT_INS_PACKAGE &&
        classes.get(cls.getName()) == cls) {
      return cls.getName();
    }
    return null;
  }
}

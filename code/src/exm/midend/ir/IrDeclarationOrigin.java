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

/**
 * Where a declaration came from.  Compared by identity: passes define
 * their own origins as constants.
 */
public class IrDeclarationOrigin {
  public static final IrDeclarationOrigin DEFINED =
                      new IrDeclarationOrigin("DEFINED");
  public static final IrDeclarationOrigin FAKE_OVERRIDE =
                      new IrDeclarationOrigin("FAKE_OVERRIDE");
  public static final IrDeclarationOrigin INSTANCE_RECEIVER =
                      new IrDeclarationOrigin("INSTANCE_RECEIVER");
  public static final IrDeclarationOrigin IR_EXTERNAL_DECLARATION_STUB =
                      new IrDeclarationOrigin("IR_EXTERNAL_DECLARATION_STUB");

  private final String name;

  public IrDeclarationOrigin(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}

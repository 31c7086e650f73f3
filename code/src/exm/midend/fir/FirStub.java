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

/**
 * Placeholder element of stub nodes: stands for code that can't
 * be reached by normal control flow.
 */
public final class FirStub implements FirElement {

  public static final FirStub INSTANCE = new FirStub();

  private FirStub() {
  }

  @Override
  public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
    return visitor.visitElement(this, data);
  }

  @Override
  public String toString() {
    return "<stub>";
  }
}

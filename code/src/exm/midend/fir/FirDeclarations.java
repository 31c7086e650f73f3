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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.midend.fir.FirExpressions.FirBlock;
import exm.midend.fir.FirExpressions.FirExpression;
import exm.midend.fir.FirExpressions.FirStatement;

/**
 * Declarations of the resolved syntax forest.
 *
 * Functions own a body block and parameters; variables own their
 * initializer.  Each declaration creates and binds its own symbol.
 */
public class FirDeclarations {

  public static abstract class FirDeclaration implements FirElement {
    protected final String name;

    protected FirDeclaration(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + "(" + name + ")";
    }
  }

  /**
   * Declaration with a declared value or return type
   */
  public static abstract class FirTypedDeclaration extends FirDeclaration {
    private final FirTypeRef returnTypeRef;

    protected FirTypedDeclaration(String name, FirTypeRef returnTypeRef) {
      super(name);
      assert(returnTypeRef != null);
      this.returnTypeRef = returnTypeRef;
    }

    public FirTypeRef getReturnTypeRef() {
      return returnTypeRef;
    }
  }

  public static class FirFunction extends FirTypedDeclaration
                                  implements FirStatement {
    private final FirSymbol<FirFunction> symbol;
    private final List<FirValueParameter> valueParameters;
    private FirBlock body = null;

    public FirFunction(String name, FirTypeRef returnTypeRef,
                       List<FirValueParameter> valueParameters) {
      super(name, returnTypeRef);
      this.valueParameters = new ArrayList<FirValueParameter>(valueParameters);
      this.symbol = new FirSymbol<FirFunction>();
      this.symbol.bind(this);
    }

    public FirFunction(String name, FirTypeRef returnTypeRef) {
      this(name, returnTypeRef, Collections.<FirValueParameter>emptyList());
    }

    public FirSymbol<FirFunction> getSymbol() {
      return symbol;
    }

    public List<FirValueParameter> getValueParameters() {
      return Collections.unmodifiableList(valueParameters);
    }

    /**
     * Body is attached after construction, since return expressions
     * in it refer back to this function.
     */
    public void setBody(FirBlock body) {
      this.body = body;
    }

    public FirBlock getBody() {
      return body;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitFunction(this, data);
    }
  }

  public static class FirVariable extends FirTypedDeclaration
                                  implements FirStatement {
    private final FirSymbol<FirVariable> symbol;
    private final boolean isVar;
    private final FirExpression initializer;

    public FirVariable(String name, FirTypeRef returnTypeRef, boolean isVar,
                       FirExpression initializer) {
      super(name, returnTypeRef);
      this.isVar = isVar;
      this.initializer = initializer;
      this.symbol = new FirSymbol<FirVariable>();
      this.symbol.bind(this);
    }

    public FirSymbol<FirVariable> getSymbol() {
      return symbol;
    }

    public boolean isVar() {
      return isVar;
    }

    public FirExpression getInitializer() {
      return initializer;
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitVariable(this, data);
    }
  }

  public static class FirValueParameter extends FirVariable {

    public FirValueParameter(String name, FirTypeRef returnTypeRef) {
      super(name, returnTypeRef, false, null);
    }

    @Override
    public <R, D> R accept(FirVisitor<R, D> visitor, D data) {
      return visitor.visitValueParameter(this, data);
    }
  }
}

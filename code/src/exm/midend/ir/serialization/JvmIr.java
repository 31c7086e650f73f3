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

import java.util.ArrayList;
import java.util.List;

/**
 * Wire records for serialized JVM IR.  Strings, symbols and types are
 * stored once in the tables of AuxTables and referred to by index
 * everywhere else.  Absent optional children are null; absent indices
 * are -1.
 */
public class JvmIr {

  public static final int NO_INDEX = -1;

  public static class JvmIrFile {
    public DeclarationContainer declarationContainer;
    public List<Expression> annotations = new ArrayList<Expression>();
    public AuxTables auxTables;
  }

  public static class JvmIrClass {
    public Declaration irClass;
    public AuxTables auxTables;
  }

  public static class AuxTables {
    public List<UniqIdInfo> uniqIdTable = new ArrayList<UniqIdInfo>();
    public ExternalRefs externalRefs;
    public List<Symbol> symbolTable = new ArrayList<Symbol>();
    public List<Type> typeTable = new ArrayList<Type>();
    public List<String> stringTable = new ArrayList<String>();
  }

  /**
   * Top-level declaration that a referenced uniq id belongs to
   */
  public static class UniqIdInfo {
    public long id;
    public int toplevelFqName;

    public UniqIdInfo() {
    }

    public UniqIdInfo(long id, int toplevelFqName) {
      this.id = id;
      this.toplevelFqName = toplevelFqName;
    }
  }

  public static class ExternalRefs {
    public List<ExternalPackage> packages = new ArrayList<ExternalPackage>();
    public List<ExternalReference> references =
                                        new ArrayList<ExternalReference>();
  }

  public static class ExternalPackage {
    public String fqName;
    public DeclarationContainer declarationContainer;
  }

  /**
   * Mirror with uniq id, found in the package with index in the
   * package list
   */
  public static class ExternalReference {
    public long id;
    public int index;

    public ExternalReference() {
    }

    public ExternalReference(long id, int index) {
      this.id = id;
      this.index = index;
    }
  }

  public static class DeclarationContainer {
    public List<Declaration> declarations = new ArrayList<Declaration>();
  }

  /**
   * A declaration of any kind.  Only the fields relevant to kind are
   * set.
   */
  public static class Declaration {
    public String kind;
    public int symbol = NO_INDEX;
    public int name = NO_INDEX;
    public int origin = NO_INDEX;
    public int startOffset;
    public int endOffset;
    public String visibility;
    public String modality;
    public String classKind;
    public List<String> flags = new ArrayList<String>();
    public List<Expression> annotations = new ArrayList<Expression>();

    /** Return type of a function, type of a field, parameter or variable */
    public int type = NO_INDEX;
    public int varargElementType = NO_INDEX;
    public int index;

    public List<Declaration> typeParameters;
    public List<Integer> superTypes;
    public Declaration thisReceiver;
    public Declaration dispatchReceiverParameter;
    public Declaration extensionReceiverParameter;
    public List<Declaration> valueParameters;
    public Body body;
    public DeclarationContainer declarationContainer;

    public Declaration getter;
    public Declaration setter;
    public Declaration backingField;
    public int correspondingProperty = NO_INDEX;
    public List<Integer> overridden;

    public Expression defaultValue;
    public Expression initializer;
  }

  public static class Body {
    /** Set for a block body */
    public List<Statement> statements;
    /** Set for an expression body */
    public Expression expression;
  }

  /**
   * Exactly one of declaration and expression is set
   */
  public static class Statement {
    public Declaration declaration;
    public Expression expression;
  }

  public static class Expression {
    public String kind;
    public int type = NO_INDEX;
    public int startOffset;
    public int endOffset;
    public int symbol = NO_INDEX;

    public Expression dispatchReceiver;
    public Expression extensionReceiver;
    /** Null entries for arguments not given */
    public List<Expression> valueArguments;
    /** NO_INDEX entries for arguments not given */
    public List<Integer> typeArguments;
    public int superQualifier = NO_INDEX;

    public int field = NO_INDEX;
    public int getter = NO_INDEX;
    public int setter = NO_INDEX;

    public Expression receiver;
    public int classType = NO_INDEX;
    public String constKind;
    public String constValue;
    public Expression value;
  }

  public static class Symbol {
    public String kind;
    public long uniqId;
    public boolean isLocal;

    public Symbol() {
    }

    public Symbol(String kind, long uniqId, boolean isLocal) {
      this.kind = kind;
      this.uniqId = uniqId;
      this.isLocal = isLocal;
    }
  }

  public static class Type {
    /** SIMPLE or ERROR */
    public String kind;
    public int classifier = NO_INDEX;
    public boolean nullable;
    public List<Integer> arguments = new ArrayList<Integer>();
  }
}

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.midend.common.exceptions.StructuralInvariantError;
import exm.midend.common.exceptions.UnresolvedIdentityError;
import exm.midend.ir.FqName;
import exm.midend.ir.IrDeclarationContainer;
import exm.midend.ir.IrDeclarationParent;
import exm.midend.ir.IrSymbol;
import exm.midend.ir.IrTreeWalker;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrDeclaration;
import exm.midend.ir.IrDeclarations.IrExternalPackageFragment;
import exm.midend.ir.IrDeclarations.IrFile;
import exm.midend.ir.IrDeclarations.IrModuleFragment;
import exm.midend.ir.IrDeclarations.IrPackageFragment;
import exm.midend.ir.IrExpressions.IrFunctionAccessExpression;
import exm.midend.ir.IrExpressions.IrPropertyReference;
import exm.midend.ir.descriptors.Descriptors.CallableMemberDescriptor;
import exm.midend.ir.descriptors.Descriptors.DeclarationDescriptor;
import exm.midend.ir.serialization.JvmIr.AuxTables;
import exm.midend.ir.serialization.JvmIr.ExternalPackage;
import exm.midend.ir.serialization.JvmIr.ExternalReference;
import exm.midend.ir.serialization.JvmIr.ExternalRefs;
import exm.midend.ir.serialization.JvmIr.JvmIrClass;
import exm.midend.ir.serialization.JvmIr.JvmIrFile;
import exm.midend.ir.serialization.JvmIr.UniqIdInfo;
import exm.midend.ir.util.IrUtils;

/**
 * Serializes one JVM unit, either the non-class contents of a file or
 * one top-level class, together with the tables it refers to.
 *
 * An instance handles exactly one unit.
 */
public class JvmIrSerializer extends IrModuleSerializer {
  private static final String FACADE_SUFFIX = "Kt";

  private final boolean undefinedOffsets;
  private boolean used = false;

  public JvmIrSerializer(Logger logger, DeclarationTable declarationTable,
                         boolean undefinedOffsets) {
    super(logger, declarationTable);
    this.undefinedOffsets = undefinedOffsets;
  }

  public JvmIrFile serializeJvmIrFile(IrFile file) {
    startUnit(file);
    JvmIrFile proto = new JvmIrFile();
    List<IrDeclaration> declarations = new ArrayList<IrDeclaration>();
    for (IrDeclaration declaration: file.getDeclarations()) {
      if (!(declaration instanceof IrClass)) {
        declarations.add(declaration);
      }
    }
    proto.declarationContainer = serializeIrDeclarationContainer(declarations);
    proto.annotations = serializeAnnotations(file.getAnnotations());
    proto.auxTables = serializeAuxTables(file, declarations,
                                         facadeFqName(file));
    logFinished(file, proto.auxTables);
    return proto;
  }

  public JvmIrClass serializeJvmToplevelClass(IrClass cls) {
    startUnit(cls);
    JvmIrClass proto = new JvmIrClass();
    proto.irClass = serializeIrClass(cls);
    proto.auxTables = serializeAuxTables(cls, cls.getDeclarations(),
                                         getToplevelFqName(cls));
    logFinished(cls, proto.auxTables);
    return proto;
  }

  private void startUnit(Object unit) {
    if (used) {
      throw new StructuralInvariantError("Serializer already used, can't "
                                         + "serialize " + unit);
    }
    used = true;
    logger.debug("Serializing " + unit);
  }

  private void logFinished(Object unit, AuxTables tables) {
    if (logger.isDebugEnabled()) {
      logger.debug("Serialized " + unit + ": " +
          tables.uniqIdTable.size() + " uniq ids, " +
          tables.externalRefs.references.size() + " external refs, " +
          tables.symbolTable.size() + " symbols, " +
          tables.typeTable.size() + " types, " +
          tables.stringTable.size() + " strings");
    }
  }

  /**
   * Tables must be built in this order: everything that interns strings
   * comes before the string table is frozen.
   * @param serialized the declarations the unit serializes.  Only their
   *    references go into the uniq id table, while external references
   *    are collected over the whole unit.
   */
  private AuxTables serializeAuxTables(IrDeclarationContainer unit,
                  List<IrDeclaration> serialized, FqName unitFqName) {
    AuxTables tables = new AuxTables();
    tables.uniqIdTable = serializeUniqIdTable(serialized, unitFqName);
    tables.externalRefs = serializeExternalRefs(unit);
    tables.symbolTable = getSymbolTable();
    tables.typeTable = getTypeTable();
    tables.stringTable = freezeStringTable();
    return tables;
  }

  private List<UniqIdInfo> serializeUniqIdTable(
                  List<IrDeclaration> serialized, FqName unitFqName) {
    Map<Long, FqName> toplevels = collectUniqIds(serialized, unitFqName);
    List<UniqIdInfo> result = new ArrayList<UniqIdInfo>(toplevels.size());
    for (Map.Entry<Long, FqName> e: toplevels.entrySet()) {
      result.add(new UniqIdInfo(e.getKey(),
                                serializeString(e.getValue().asString())));
    }
    return result;
  }

  /**
   * @return uniq id of each referenced declaration that belongs to
   *    another top-level, mapped to that top-level's name
   */
  private Map<Long, FqName> collectUniqIds(List<IrDeclaration> serialized,
                                           final FqName unitFqName) {
    final Map<Long, FqName> result = new LinkedHashMap<Long, FqName>();
    IrTreeWalker walker = new IrTreeWalker() {
      @Override
      public Void visitFunctionAccess(IrFunctionAccessExpression expression,
                                      Void data) {
        addTarget(expression.getSymbol());
        return super.visitFunctionAccess(expression, data);
      }

      @Override
      public Void visitPropertyReference(IrPropertyReference expression,
                                         Void data) {
        addTarget(expression.getSymbol());
        return super.visitPropertyReference(expression, data);
      }

      private void addTarget(IrSymbol<? extends IrDeclaration> symbol) {
        if (!symbol.isBound()) {
          throw new UnresolvedIdentityError("Reference to unbound symbol "
                                            + symbol);
        }
        IrDeclaration target = symbol.getOwner();
        FqName toplevel = getToplevelFqName(target);
        if (!toplevel.equals(unitFqName)) {
          result.put(declarationTable.uniqIdByDeclaration(target).getIndex(),
                     toplevel);
        }
      }
    };
    for (IrDeclaration declaration: serialized) {
      walker.walk(declaration);
    }
    return result;
  }

  private ExternalRefs serializeExternalRefs(IrDeclarationContainer unit) {
    ExternalReferencesInfo info = ExternalReferences.collect(logger, unit,
                                                          undefinedOffsets);
    ExternalRefs proto = new ExternalRefs();
    for (IrPackageFragment fragment: info.getPackageFragments()) {
      ExternalPackage pkg = new ExternalPackage();
      pkg.fqName = fragment.getFqName().asString();
      pkg.declarationContainer =
              serializeIrDeclarationContainer(fragment.getDeclarations());
      proto.packages.add(pkg);
    }
    for (Map.Entry<IrDeclaration, Integer> e:
                                  info.getReferences().entrySet()) {
      // Keyed on the original so the id matches the uniq id table
      UniqId id = declarationTable.uniqIdByDeclaration(
                                          info.getOriginal(e.getKey()));
      proto.references.add(new ExternalReference(id.getIndex(),
                                                 e.getValue()));
    }
    return proto;
  }

  /**
   * Name of the top-level class that the compiled form of declaration
   * lives in
   */
  FqName getToplevelFqName(IrDeclaration declaration) {
    IrDeclaration top = IrUtils.findTopLevelDeclaration(declaration);
    if (top instanceof IrClass) {
      FqName name = top.fqNameWhenAvailable();
      if (name == null) {
        throw new UnresolvedIdentityError("No name for class " + top);
      }
      return name;
    }
    IrDeclarationParent parent = top.getParent();
    if (parent instanceof IrFile) {
      return facadeFqName((IrFile)parent);
    } else if (parent instanceof IrExternalPackageFragment) {
      return ((IrExternalPackageFragment)parent).getFqName();
    } else if (parent instanceof IrModuleFragment) {
      DeclarationDescriptor descriptor = top.getSymbol().getDescriptor();
      if (descriptor instanceof CallableMemberDescriptor) {
        FqName implClass =
            ((CallableMemberDescriptor)descriptor).getImplClassFqName();
        if (implClass != null) {
          return implClass;
        }
      }
      throw new UnresolvedIdentityError("No implementation class for " +
                                        top + " in " + parent);
    } else {
      throw new UnresolvedIdentityError("Can't find top-level class of " +
                          declaration + ": parent of " + top + " is " + parent);
    }
  }

  /**
   * Name of the class holding the top-level functions and properties
   * of a file: the capitalized base name of the file with suffix "Kt".
   */
  static FqName facadeFqName(IrFile file) {
    String baseName = FilenameUtils.getBaseName(file.getFileName());
    return file.getFqName().child(StringUtils.capitalize(baseName)
                                  + FACADE_SUFFIX);
  }
}

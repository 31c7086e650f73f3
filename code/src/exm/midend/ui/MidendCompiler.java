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

package exm.midend.ui;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.midend.common.Logging;
import exm.midend.common.Settings;
import exm.midend.common.exceptions.InvalidOptionException;
import exm.midend.common.exceptions.MidendRuntimeError;
import exm.midend.fir.FirDeclarations.FirFunction;
import exm.midend.fir.cfg.ControlFlowGraph;
import exm.midend.fir.cfg.FunctionGraphGenerator;
import exm.midend.fir.dfa.DataFlowVariableStorage;
import exm.midend.ir.IrDeclarations.IrClass;
import exm.midend.ir.IrDeclarations.IrFile;
import exm.midend.ir.lower.LoweringPipeline;
import exm.midend.ir.serialization.DeclarationTable;
import exm.midend.ir.serialization.JvmIr.JvmIrClass;
import exm.midend.ir.serialization.JvmIr.JvmIrFile;
import exm.midend.ir.serialization.JvmIrSerializer;
import exm.midend.ir.serialization.JvmIrWriter;
import exm.midend.ir.serialization.JvmMangler;

/**
 * Runs the middle end over one unit at a time.  Every unit gets fresh
 * variable storage, declaration table and serializer, so nothing is
 * carried over between units.
 */
public class MidendCompiler {

  private final Logger logger;
  private final Settings settings;

  private final boolean validateGraphs;
  private final boolean externallyVisibleOnly;
  private final boolean undefinedOffsets;

  /**
   * @throws InvalidOptionException if a setting is malformed
   */
  public MidendCompiler(Logger logger, Settings settings)
                                        throws InvalidOptionException {
    this.logger = logger;
    this.settings = settings;
    settings.validate();
    this.validateGraphs = settings.getBoolean(Settings.VALIDATE_CFG);
    this.externallyVisibleOnly =
                settings.getBoolean(Settings.EXTERNALLY_VISIBLE_ONLY);
    this.undefinedOffsets = settings.getBoolean(Settings.UNDEFINED_OFFSETS);
  }

  /**
   * Read settings from system properties and set up logging as they
   * direct
   * @throws InvalidOptionException if a setting is malformed
   */
  public static MidendCompiler fromSystemProperties()
                                        throws InvalidOptionException {
    Settings settings = Settings.fromSystemProperties();
    Logger logger = Logging.setupLogging(settings.get(Settings.LOG_FILE),
                                 settings.getBoolean(Settings.LOG_TRACE));
    return new MidendCompiler(logger, settings);
  }

  /**
   * Build control flow graphs for the given functions and any local
   * functions inside them
   * @return graphs in order of completion
   */
  public Map<FirFunction, ControlFlowGraph> buildGraphs(
                                          List<FirFunction> functions) {
    logger.debug("Building graphs for " + functions.size() + " functions");
    FunctionGraphGenerator generator = new FunctionGraphGenerator(logger,
                          validateGraphs, new DataFlowVariableStorage());
    try {
      for (FirFunction function: functions) {
        generator.generate(function);
      }
    } catch (MidendRuntimeError e) {
      logger.error("Building graphs failed: " + e.getMessage());
      throw e;
    }
    Map<FirFunction, ControlFlowGraph> graphs =
        new LinkedHashMap<FirFunction, ControlFlowGraph>(generator.getGraphs());
    logger.debug("Built " + graphs.size() + " graphs");
    return graphs;
  }

  /**
   * Lower file, then serialize its non-class declarations
   */
  public JvmIrFile serializeFile(IrFile file) {
    try {
      LoweringPipeline.standard(settings).runPipeline(logger, file);
      return newSerializer().serializeJvmIrFile(file);
    } catch (MidendRuntimeError e) {
      logger.error("Serializing " + file.getFileName() + " failed: " +
                   e.getMessage());
      throw e;
    }
  }

  public JvmIrClass serializeToplevelClass(IrClass cls) {
    try {
      return newSerializer().serializeJvmToplevelClass(cls);
    } catch (MidendRuntimeError e) {
      logger.error("Serializing " + cls + " failed: " + e.getMessage());
      throw e;
    }
  }

  public byte[] compileFile(IrFile file) {
    byte[] bytes = new JvmIrWriter().toBytes(serializeFile(file));
    logger.debug("Wrote " + bytes.length + " bytes for " +
                 file.getFileName());
    return bytes;
  }

  public byte[] compileToplevelClass(IrClass cls) {
    byte[] bytes = new JvmIrWriter().toBytes(serializeToplevelClass(cls));
    logger.debug("Wrote " + bytes.length + " bytes for " + cls);
    return bytes;
  }

  private JvmIrSerializer newSerializer() {
    DeclarationTable table = new DeclarationTable(JvmMangler.INSTANCE,
                                                  externallyVisibleOnly);
    return new JvmIrSerializer(logger, table, undefinedOffsets);
  }
}

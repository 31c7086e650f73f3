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

package exm.midend.ir.lower;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.midend.common.Settings;
import exm.midend.common.exceptions.InvalidOptionException;
import exm.midend.common.exceptions.MidendRuntimeError;
import exm.midend.ir.IrDeclarations.IrFile;

public class LoweringPipeline {

  private final Settings settings;
  private final List<FileLoweringPass> passes =
                                      new ArrayList<FileLoweringPass>();

  public LoweringPipeline(Settings settings) {
    this.settings = settings;
  }

  /**
   * @return pipeline with the standard passes in order
   */
  public static LoweringPipeline standard(Settings settings) {
    LoweringPipeline pipeline = new LoweringPipeline(settings);
    pipeline.addPass(new PrivateMembersLowering());
    return pipeline;
  }

  public void addPass(FileLoweringPass pass) {
    passes.add(pass);
  }

  public List<FileLoweringPass> getPasses() {
    return passes;
  }

  public void runPipeline(Logger logger, IrFile file) {
    for (FileLoweringPass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("File: " + file.getFileName() + " Pass: "
                     + pass.getPassName());
        pass.lower(logger, file);
      } else {
        logger.trace("Skipping disabled pass " + pass.getPassName());
      }
    }
  }

  public boolean passEnabled(FileLoweringPass pass) {
    String key = pass.getConfigEnabledKey();
    try {
      return key == null || settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new MidendRuntimeError("Expected config key " + key
          + " to be a boolean: " + e.getMessage());
    }
  }
}

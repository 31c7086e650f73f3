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

import java.nio.charset.StandardCharsets;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import exm.midend.common.exceptions.UnsupportedInputError;
import exm.midend.ir.serialization.JvmIr.JvmIrClass;
import exm.midend.ir.serialization.JvmIr.JvmIrFile;

/**
 * Encodes serialized units as UTF-8 JSON and decodes them again.
 * Null fields are omitted from the output.
 */
public class JvmIrWriter {
  private final Gson gson;

  public JvmIrWriter() {
    this(false);
  }

  public JvmIrWriter(boolean prettyPrint) {
    GsonBuilder builder = new GsonBuilder();
    if (prettyPrint) {
      builder.setPrettyPrinting();
    }
    this.gson = builder.create();
  }

  public String toJson(Object unit) {
    return gson.toJson(unit);
  }

  public byte[] toBytes(JvmIrFile file) {
    return toJson(file).getBytes(StandardCharsets.UTF_8);
  }

  public byte[] toBytes(JvmIrClass cls) {
    return toJson(cls).getBytes(StandardCharsets.UTF_8);
  }

  public JvmIrFile readFile(byte[] bytes) {
    return decode(bytes, JvmIrFile.class);
  }

  public JvmIrClass readClass(byte[] bytes) {
    return decode(bytes, JvmIrClass.class);
  }

  private <T> T decode(byte[] bytes, Class<T> cls) {
    String json = new String(bytes, StandardCharsets.UTF_8);
    try {
      T result = gson.fromJson(json, cls);
      if (result == null) {
        throw new UnsupportedInputError("Empty input for " +
                                        cls.getSimpleName());
      }
      return result;
    } catch (JsonParseException e) {
      throw new UnsupportedInputError("Malformed " + cls.getSimpleName() +
                                      ": " + e.getMessage());
    }
  }
}

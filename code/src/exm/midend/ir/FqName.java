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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.midend.common.exceptions.StructuralInvariantError;

/**
 * Fully-qualified dotted name, e.g. of a package or class.
 * The root name has no segments.
 */
public class FqName {
  public static final FqName ROOT = new FqName(Collections.<String>emptyList());

  private final List<String> segments;

  private FqName(List<String> segments) {
    this.segments = segments;
  }

  public static FqName fromString(String name) {
    if (StringUtils.isEmpty(name)) {
      return ROOT;
    }
    List<String> segments = new ArrayList<String>();
    for (String seg: StringUtils.split(name, '.')) {
      segments.add(seg);
    }
    return new FqName(Collections.unmodifiableList(segments));
  }

  public FqName child(String name) {
    assert(!StringUtils.isEmpty(name));
    List<String> segments = new ArrayList<String>(this.segments);
    segments.add(name);
    return new FqName(Collections.unmodifiableList(segments));
  }

  public boolean isRoot() {
    return segments.isEmpty();
  }

  public FqName parent() {
    if (isRoot()) {
      throw new StructuralInvariantError("Root name has no parent");
    }
    return new FqName(segments.subList(0, segments.size() - 1));
  }

  public String shortName() {
    if (isRoot()) {
      throw new StructuralInvariantError("Root name has no short name");
    }
    return segments.get(segments.size() - 1);
  }

  public String asString() {
    return StringUtils.join(segments, '.');
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof FqName))
      return false;
    return segments.equals(((FqName)obj).segments);
  }

  @Override
  public String toString() {
    return asString();
  }
}

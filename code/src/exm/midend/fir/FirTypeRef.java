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
 * A resolved type, as produced by type inference.
 * Only the classifier name and nullability are tracked.
 */
public class FirTypeRef {
  public static final FirTypeRef NOTHING = new FirTypeRef("kotlin.Nothing", false, false);
  public static final FirTypeRef UNIT = new FirTypeRef("kotlin.Unit", false, false);
  public static final FirTypeRef BOOLEAN = new FirTypeRef("kotlin.Boolean", false, false);
  public static final FirTypeRef INT = new FirTypeRef("kotlin.Int", false, false);
  public static final FirTypeRef STRING = new FirTypeRef("kotlin.String", false, false);
  public static final FirTypeRef ANY = new FirTypeRef("kotlin.Any", false, false);
  public static final FirTypeRef NULLABLE_ANY = new FirTypeRef("kotlin.Any", true, false);
  public static final FirTypeRef ERROR = new FirTypeRef("<error>", false, true);

  private final String classifier;
  private final boolean nullable;
  private final boolean error;

  private FirTypeRef(String classifier, boolean nullable, boolean error) {
    this.classifier = classifier;
    this.nullable = nullable;
    this.error = error;
  }

  public static FirTypeRef of(String classifier) {
    return new FirTypeRef(classifier, false, false);
  }

  public static FirTypeRef nullable(String classifier) {
    return new FirTypeRef(classifier, true, false);
  }

  public String getClassifier() {
    return classifier;
  }

  public boolean isNullable() {
    return nullable;
  }

  public boolean isError() {
    return error;
  }

  /**
   * @return true if evaluating an expression of this type never completes
   *        normally.  Nothing? does complete, with null.
   */
  public boolean isNothing() {
    return !nullable && !error && classifier.equals(NOTHING.classifier);
  }

  public FirTypeRef makeNullable() {
    if (nullable) {
      return this;
    }
    return new FirTypeRef(classifier, true, error);
  }

  @Override
  public int hashCode() {
    return (classifier.hashCode() * 31 + (nullable ? 1 : 0)) * 31
            + (error ? 1 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof FirTypeRef))
      return false;
    FirTypeRef other = (FirTypeRef) obj;
    return classifier.equals(other.classifier) && nullable == other.nullable
        && error == other.error;
  }

  @Override
  public String toString() {
    return nullable ? classifier + "?" : classifier;
  }
}

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
package exm.gotoc.common.exceptions;

/**
 * No free numeric suffix could be found for a name within the
 * configured bound.
 */
public class NameCollisionExhaustedException extends TransformException {

  private final String baseName;
  private final long attempts;

  public NameCollisionExhaustedException(String baseName, long attempts) {
    super("could not find unused name for " + baseName + " after "
          + attempts + " attempts");
    this.baseName = baseName;
    this.attempts = attempts;
  }

  public String getBaseName() {
    return baseName;
  }

  public long getAttempts() {
    return attempts;
  }

  private static final long serialVersionUID = 1L;
}

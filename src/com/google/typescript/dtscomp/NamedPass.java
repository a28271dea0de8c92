/*
 * Copyright 2026 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package com.google.typescript.dtscomp;

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.ForOverride;
import java.util.function.Predicate;

/** A pipeline stage with the name it is logged and disabled by. */
@AutoValue
public abstract class NamedPass {
  public abstract String getName();

  /** Whether the stage runs at all for the given options. */
  public abstract Predicate<DtsOptions> getCondition();

  public abstract FilePass getPass();

  NamedPass() {}

  public static Builder builder() {
    return new AutoValue_NamedPass.Builder().setCondition(options -> true);
  }

  public static NamedPass of(String name, FilePass pass) {
    return builder().setName(name).setPass(pass).build();
  }

  /** Builder for {@link NamedPass}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setCondition(Predicate<DtsOptions> condition);

    public abstract Builder setPass(FilePass pass);

    @ForOverride
    abstract NamedPass autoBuild();

    public final NamedPass build() {
      NamedPass result = autoBuild();
      checkState(!result.getName().isEmpty());
      return result;
    }
  }
}

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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.typescript.dts.tree.TsIdentLibrary;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;

/** Settings for one run of the pipeline. */
public class DtsOptions {
  static final String LIBRARY_NAME = "dts.libraryName";
  static final String PEDANTIC = "dts.pedantic";
  static final String LIBRARY_SPECIFIC = "dts.librarySpecific";
  static final String DISABLED_PASSES = "dts.disabledPasses";

  private TsIdentLibrary libraryName = TsIdentLibrary.DUMMY_LIBRARY;

  /** Whether unresolvable names abort the run. */
  private boolean pedantic = false;

  /** Whether the hand written fixes in {@link LibrarySpecific} are applied. */
  private boolean librarySpecific = true;

  private final Set<String> disabledPasses = new LinkedHashSet<>();

  public DtsOptions() {}

  /**
   * Reads options from {@code properties}. Missing keys keep their defaults. Disabled passes are
   * given as a comma separated list of pass names.
   */
  public static DtsOptions fromProperties(Properties properties) {
    DtsOptions options = new DtsOptions();
    String libraryName = properties.getProperty(LIBRARY_NAME);
    if (libraryName != null && !libraryName.isBlank()) {
      options.setLibraryName(TsIdentLibrary.of(libraryName.trim()));
    }
    String pedantic = properties.getProperty(PEDANTIC);
    if (pedantic != null) {
      options.setPedantic(Boolean.parseBoolean(pedantic.trim()));
    }
    String librarySpecific = properties.getProperty(LIBRARY_SPECIFIC);
    if (librarySpecific != null) {
      options.setLibrarySpecific(Boolean.parseBoolean(librarySpecific.trim()));
    }
    String disabled = properties.getProperty(DISABLED_PASSES);
    if (disabled != null) {
      for (String name : Splitter.on(',').trimResults().omitEmptyStrings().split(disabled)) {
        options.disablePass(name);
      }
    }
    return options;
  }

  public TsIdentLibrary getLibraryName() {
    return libraryName;
  }

  public void setLibraryName(TsIdentLibrary libraryName) {
    this.libraryName = libraryName;
  }

  public boolean isPedantic() {
    return pedantic;
  }

  public void setPedantic(boolean pedantic) {
    this.pedantic = pedantic;
  }

  public boolean isLibrarySpecific() {
    return librarySpecific;
  }

  public void setLibrarySpecific(boolean librarySpecific) {
    this.librarySpecific = librarySpecific;
  }

  public void disablePass(String name) {
    disabledPasses.add(name);
  }

  public ImmutableSet<String> getDisabledPasses() {
    return ImmutableSet.copyOf(disabledPasses);
  }

  public boolean isPassEnabled(String name) {
    return !disabledPasses.contains(name);
  }
}

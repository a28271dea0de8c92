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

package com.google.typescript.dts.tree;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single entry in the annotation bag carried by every tree node. Raw comments come from the
 * source file and are emitted verbatim, markers are internal annotations that passes read and
 * propagate.
 */
public sealed interface Comment permits Comment.Raw, Comment.Marker {

  /** Creates a raw comment carrying an import warning. */
  static Comment warning(String message) {
    return new Raw("/* import warning: " + message + " */");
  }

  /** A source comment, kept as text. */
  record Raw(String raw) implements Comment {
    public Raw {
      checkNotNull(raw);
    }
  }

  /** An internal annotation. */
  sealed interface Marker extends Comment permits SimpleMarker, NameHint {}

  /** Markers without payload. */
  enum SimpleMarker implements Marker {
    /** The declaration only re-points at another declaration and may be inlined. */
    IS_TRIVIAL,
    /** The class was synthesized from a variable and must not be copied again. */
    EXPANDED_CLASS
  }

  /** A preferred name for a synthesized declaration. */
  record NameHint(String value) implements Marker {}
}

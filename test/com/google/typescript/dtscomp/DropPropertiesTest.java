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

import static com.google.common.truth.Truth.assertThat;
import static com.google.typescript.dtscomp.TsTrees.file;
import static com.google.typescript.dtscomp.TsTrees.fn;
import static com.google.typescript.dtscomp.TsTrees.iface;
import static com.google.typescript.dtscomp.TsTrees.run;
import static com.google.typescript.dtscomp.TsTrees.sig;
import static com.google.typescript.dtscomp.TsTrees.var;

import com.google.typescript.dts.tree.TsDeclInterface;
import com.google.typescript.dts.tree.TsMemberProperty;
import com.google.typescript.dts.tree.TsParsedFile;
import com.google.typescript.dts.tree.TsTypeRef;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DropPropertiesTest {
  @Test
  public void testDropsPromisify() {
    TsParsedFile result =
        run(
            DropProperties.INSTANCE,
            file(
                var("__promisify__", TsTypeRef.ANY),
                fn("__promisify__", sig(TsTypeRef.ANY)),
                var("kept", TsTypeRef.ANY)));
    assertThat(result.members()).containsExactly(var("kept", TsTypeRef.ANY));
  }

  @Test
  public void testDropsUnusableProperties() {
    TsMemberProperty kept = TsMemberProperty.of("name", TsTypeRef.STRING);
    TsParsedFile result =
        run(
            DropProperties.INSTANCE,
            file(
                iface(
                    "I",
                    TsMemberProperty.of("prototype", TsTypeRef.ANY),
                    TsMemberProperty.of("\\u0041", TsTypeRef.STRING),
                    TsMemberProperty.of("impossible", TsTypeRef.NEVER),
                    kept)));
    assertThat(((TsDeclInterface) result.members().get(0)).members()).containsExactly(kept);
  }

  @Test
  public void testNothingToDrop() {
    TsParsedFile file = file(iface("I", TsMemberProperty.of("name", TsTypeRef.STRING)));
    assertThat(run(DropProperties.INSTANCE, file)).isSameInstanceAs(file);
  }
}

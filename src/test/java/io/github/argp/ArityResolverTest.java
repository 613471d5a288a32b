// Copyright 2026 The Argp Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package io.github.argp;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ArityResolver}. */
@RunWith(JUnit4.class)
public class ArityResolverTest {

  private static final ImmutableList<String> ARGS = ImmutableList.of("prog", "--x", "5", "6");

  /** An option that reports whatever parameter count it was built with. */
  private static final class FixedArityOption implements OptionDescriptor {
    private final int paramCount;

    FixedArityOption(int paramCount) {
      this.paramCount = paramCount;
    }

    @Override
    public OptionKind getKind() {
      return OptionKind.KEYWORD;
    }

    @Override
    public boolean matches(String token) {
      return true;
    }

    @Override
    public int getParamCount() {
      return paramCount;
    }

    @Override
    public void parse(List<String> tokens) {}

    @Override
    public boolean isSet() {
      return false;
    }

    @Override
    public HelpEntry getHelp() {
      return new HelpEntry("fixed" + paramCount, "");
    }
  }

  @Test
  public void fixedCountWithinRange() throws Exception {
    assertThat(ArityResolver.resolve(new FixedArityOption(0), ARGS, 1)).isEqualTo(0);
    assertThat(ArityResolver.resolve(new FixedArityOption(1), ARGS, 1)).isEqualTo(1);
    assertThat(ArityResolver.resolve(new FixedArityOption(2), ARGS, 1)).isEqualTo(2);
  }

  @Test
  public void tooFewRemainingTokens() {
    ArgumentCountException e =
        assertThrows(
            ArgumentCountException.class,
            () -> ArityResolver.resolve(new FixedArityOption(3), ARGS, 1));
    assertThat(e).hasMessageThat().isEqualTo("Expected 3 parameters after '--x' but only 2 remain");
    assertThat(e.getInvalidArgument()).isEqualTo("--x");
    assertThat(e.getExpected()).isEqualTo(3);
    assertThat(e.getAvailable()).isEqualTo(2);
  }

  @Test
  public void lastTokenWithOneParameter() {
    ArgumentCountException e =
        assertThrows(
            ArgumentCountException.class,
            () -> ArityResolver.resolve(new FixedArityOption(1), ImmutableList.of("--x"), 0));
    assertThat(e).hasMessageThat().isEqualTo("Expected 1 parameter after '--x' but only 0 remain");
  }

  @Test
  public void variadicTakesEverythingLeft() throws Exception {
    FixedArityOption variadic = new FixedArityOption(OptionDescriptor.VARIADIC);
    assertThat(ArityResolver.resolve(variadic, ARGS, 1)).isEqualTo(2);
    assertThat(ArityResolver.resolve(variadic, ARGS, 3)).isEqualTo(0);
  }

  @Test
  public void otherNegativeCountsAreIllegal() {
    IllegalArityException e =
        assertThrows(
            IllegalArityException.class,
            () -> ArityResolver.resolve(new FixedArityOption(-2), ARGS, 1));
    assertThat(e.getParamCount()).isEqualTo(-2);
    assertThat(e).hasMessageThat().isEqualTo("Option 'fixed-2' reports illegal parameter count -2");
  }

  @Test
  public void sliceStartsWithMatchedToken() {
    assertThat(ArityResolver.slice(ARGS, 1, 1)).containsExactly("--x", "5").inOrder();
    assertThat(ArityResolver.slice(ARGS, 1, 0)).containsExactly("--x");
    assertThat(ArityResolver.slice(ARGS, 1, 2)).containsExactly("--x", "5", "6").inOrder();
  }
}

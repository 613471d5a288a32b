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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** A test for {@link EnumConverter}. */
@RunWith(JUnit4.class)
public class EnumConverterTest {

  private enum CompressionLevel {
    FAST,
    BEST
  }

  private static class CompressionLevelConverter extends EnumConverter<CompressionLevel> {
    public CompressionLevelConverter() {
      super(CompressionLevel.class, "compression level");
    }
  }

  @Test
  public void converterForEnumWithTwoValues() throws Exception {
    CompressionLevelConverter converter = new CompressionLevelConverter();
    assertThat(converter.convert("fast")).isEqualTo(CompressionLevel.FAST);
    assertThat(converter.convert("best")).isEqualTo(CompressionLevel.BEST);
    ConversionException e =
        assertThrows(ConversionException.class, () -> converter.convert("none"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Not a valid compression level: 'none' (should be fast or best)");
    assertThat(converter.getTypeDescription()).isEqualTo("fast or best");
  }

  private enum Fruit {
    Apple,
    Banana,
    Cherry
  }

  @Test
  public void typeDescriptionForEnumWithThreeValues() {
    // User-visible messages are always lowercase.
    assertThat(EnumConverter.of(Fruit.class, "fruit").getTypeDescription())
        .isEqualTo("apple, banana or cherry");
  }

  @Test
  public void converterIsCaseInsensitive() throws Exception {
    assertThat(EnumConverter.of(Fruit.class, "fruit").convert("bAnANa"))
        .isSameInstanceAs(Fruit.Banana);
  }

  @Test
  public void enumKeywordOption() throws Exception {
    KeywordOption<Fruit> fruit =
        KeywordOption.of(
            ImmutableList.of("--fruit"),
            "what to eat",
            OptionType.scalar(EnumConverter.of(Fruit.class, "fruit")),
            Fruit.Apple);
    ArgumentParser parser = ArgumentParser.builder().options(fruit).skip(0).build();

    assertThat(parser.parse("--fruit", "cherry")).isTrue();
    assertThat(fruit.getValue()).isEqualTo(Fruit.Cherry);

    ConversionException e =
        assertThrows(ConversionException.class, () -> parser.parse("--fruit", "kiwi"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "While parsing option --fruit: Not a valid fruit: 'kiwi' "
                + "(should be apple, banana or cherry)");
    assertThat(fruit.getValue()).isEqualTo(Fruit.Cherry);
  }
}

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
import java.net.InetSocketAddress;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link OptionType}. */
@RunWith(JUnit4.class)
public class OptionTypeTest {

  /** host:port, resolved lazily. */
  private static final class AddressConverter implements Converter<InetSocketAddress> {
    @Override
    public InetSocketAddress convert(String input) throws ConversionException {
      int colon = input.lastIndexOf(':');
      if (colon <= 0) {
        throw new ConversionException("'" + input + "' is not host:port", input);
      }
      int port = new Converters.IntegerConverter().convert(input.substring(colon + 1));
      return InetSocketAddress.createUnresolved(input.substring(0, colon), port);
    }

    @Override
    public String getTypeDescription() {
      return "a host:port pair";
    }
  }

  @Test
  public void flag() throws Exception {
    assertThat(OptionType.flag().getValueCount()).isEqualTo(0);
    assertThat(OptionType.flag().convert(ImmutableList.of())).isTrue();
  }

  @Test
  public void scalarUsesConverter() throws Exception {
    OptionType<Long> type = OptionType.of(Long.class);
    assertThat(type.getValueCount()).isEqualTo(1);
    assertThat(type.convert(ImmutableList.of("12"))).isEqualTo(12L);
    assertThat(type.getTypeDescription()).isEqualTo("a long integer");
  }

  @Test
  public void remainingConvertsEachToken() throws Exception {
    OptionType<ImmutableList<Integer>> type =
        OptionType.remaining(new Converters.IntegerConverter());
    assertThat(type.getValueCount()).isEqualTo(OptionDescriptor.VARIADIC);
    assertThat(type.convert(ImmutableList.of("1", "2", "3"))).containsExactly(1, 2, 3).inOrder();
    assertThat(type.convert(ImmutableList.of())).isEmpty();
    assertThat(type.getTypeDescription()).isEqualTo("a list of an integer");
    assertThrows(ConversionException.class, () -> type.convert(ImmutableList.of("1", "two")));
  }

  @Test
  public void customScalarTypeNeedsOnlyAConverter() throws Exception {
    KeywordOption<InetSocketAddress> bind =
        KeywordOption.of(
            ImmutableList.of("--bind"),
            "listen address",
            OptionType.scalar(new AddressConverter()),
            null);
    ArgumentParser parser = ArgumentParser.builder().options(bind).skip(0).build();

    assertThat(parser.parse("--bind", "localhost:8080")).isTrue();
    assertThat(bind.getValue().getHostString()).isEqualTo("localhost");
    assertThat(bind.getValue().getPort()).isEqualTo(8080);

    ConversionException e =
        assertThrows(ConversionException.class, () -> parser.parse("--bind", "nowhere"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("While parsing option --bind: 'nowhere' is not host:port");
  }
}

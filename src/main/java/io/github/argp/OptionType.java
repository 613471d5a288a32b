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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The value side of an option: how many tokens its value takes and how those tokens become a T.
 *
 * <p>There are three shapes:
 *
 * <ul>
 *   <li>{@link #flag()}: no value tokens, the value is {@code true} whenever the option is seen.
 *   <li>{@link #scalar}: one value token, converted by a {@link Converter}.
 *   <li>{@link #remaining}: every token left on the command line, each converted by a {@link
 *       Converter}.
 * </ul>
 */
public abstract class OptionType<T> {

  private static final OptionType<Boolean> FLAG =
      new OptionType<Boolean>() {
        @Override
        public int getValueCount() {
          return 0;
        }

        @Override
        public Boolean convert(List<String> values) {
          return true;
        }

        @Override
        public String getTypeDescription() {
          return "";
        }
      };

  private static final OptionType<String> STRING = scalar(new Converters.StringConverter());

  /**
   * Returns the number of value tokens this type converts, or {@link OptionDescriptor#VARIADIC} if
   * it takes all that are left.
   */
  public abstract int getValueCount();

  /**
   * Converts the value tokens. {@code values} has exactly {@link #getValueCount()} elements, or any
   * number for a variadic type.
   */
  public abstract T convert(List<String> values) throws ConversionException;

  /** A short description of the accepted values, used in error messages. */
  public abstract String getTypeDescription();

  /** The presence-only boolean flag. */
  public static OptionType<Boolean> flag() {
    return FLAG;
  }

  /** A string taken verbatim from the command line. */
  public static OptionType<String> string() {
    return STRING;
  }

  /** A single-token value of the given type, using its {@link Converters#forType default}. */
  public static <T> OptionType<T> of(Class<T> type) {
    return scalar(Converters.forType(type));
  }

  /** A single-token value produced by {@code converter}. */
  public static <T> OptionType<T> scalar(Converter<T> converter) {
    Preconditions.checkNotNull(converter);
    return new OptionType<T>() {
      @Override
      public int getValueCount() {
        return 1;
      }

      @Override
      public T convert(List<String> values) throws ConversionException {
        return converter.convert(values.get(0));
      }

      @Override
      public String getTypeDescription() {
        return converter.getTypeDescription();
      }
    };
  }

  /** Takes every remaining token, converting each one with {@code converter}. */
  public static <E> OptionType<ImmutableList<E>> remaining(Converter<E> converter) {
    Preconditions.checkNotNull(converter);
    return new OptionType<ImmutableList<E>>() {
      @Override
      public int getValueCount() {
        return OptionDescriptor.VARIADIC;
      }

      @Override
      public ImmutableList<E> convert(List<String> values) throws ConversionException {
        ImmutableList.Builder<E> result = ImmutableList.builderWithExpectedSize(values.size());
        for (String value : values) {
          result.add(converter.convert(value));
        }
        return result.build();
      }

      @Override
      public String getTypeDescription() {
        return "a list of " + converter.getTypeDescription();
      }
    };
  }

  /** Takes every remaining token verbatim. */
  public static OptionType<ImmutableList<String>> remainingStrings() {
    return remaining(new Converters.StringConverter());
  }
}

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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.Iterator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** The converters that ship with the parser. */
public final class Converters {

  private static final ImmutableList<String> ENABLED_REPS =
      ImmutableList.of("true", "1", "yes", "t", "y");

  private static final ImmutableList<String> DISABLED_REPS =
      ImmutableList.of("false", "0", "no", "f", "n");

  private Converters() {}

  /** Standard converter for booleans. Accepts common shorthands/synonyms. */
  public static class BooleanConverter implements Converter<Boolean> {
    @Override
    public Boolean convert(String input) throws ConversionException {
      String lower = Ascii.toLowerCase(input);
      if (ENABLED_REPS.contains(lower)) {
        return true;
      }
      if (DISABLED_REPS.contains(lower)) {
        return false;
      }
      throw new ConversionException("'" + input + "' is not a boolean", input);
    }

    @Override
    public String getTypeDescription() {
      return "a boolean";
    }
  }

  /** Standard converter for Strings. The token is taken verbatim. */
  public static class StringConverter implements Converter<String> {
    @Override
    public String convert(String input) {
      return input;
    }

    @Override
    public String getTypeDescription() {
      return "a string";
    }
  }

  /** Standard converter for integers. Decimal only; a leading zero is not an octal prefix. */
  public static class IntegerConverter implements Converter<Integer> {
    @Override
    public Integer convert(String input) throws ConversionException {
      try {
        return Integer.parseInt(input);
      } catch (NumberFormatException e) {
        throw new ConversionException("'" + input + "' is not an int", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "an integer";
    }
  }

  /** Standard converter for longs. Decimal only, like {@link IntegerConverter}. */
  public static class LongConverter implements Converter<Long> {
    @Override
    public Long convert(String input) throws ConversionException {
      try {
        return Long.parseLong(input);
      } catch (NumberFormatException e) {
        throw new ConversionException("'" + input + "' is not a long", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a long integer";
    }
  }

  /**
   * Standard converter for doubles in plain decimal or scientific notation. Java literal forms
   * that {@link Double#parseDouble} also takes ({@code 1.5f}, {@code 2d}, hex floats,
   * {@code NaN}, {@code Infinity}, surrounding whitespace) are rejected.
   */
  public static class DoubleConverter implements Converter<Double> {
    private static final Pattern DECIMAL_REGEX =
        Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    @Override
    public Double convert(String input) throws ConversionException {
      if (!DECIMAL_REGEX.matcher(input).matches()) {
        throw new ConversionException("'" + input + "' is not a double", input);
      }
      try {
        return Double.parseDouble(input);
      } catch (NumberFormatException e) {
        throw new ConversionException("'" + input + "' is not a double", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "a double";
    }
  }

  /** Standard converter for the {@link java.time.Duration} type. */
  public static class DurationConverter implements Converter<Duration> {
    private static final Pattern DURATION_REGEX = Pattern.compile("^([0-9]+)(d|h|m|s|ms)$");

    @Override
    public Duration convert(String input) throws ConversionException {
      // '0' doesn't need a unit.
      if ("0".equals(input)) {
        return Duration.ZERO;
      }
      Matcher m = DURATION_REGEX.matcher(input);
      if (!m.matches()) {
        throw new ConversionException("Illegal duration '" + input + "'.", input);
      }
      long duration;
      try {
        duration = Long.parseLong(m.group(1));
      } catch (NumberFormatException e) {
        throw new ConversionException("Illegal duration '" + input + "'.", input, e);
      }
      try {
        switch (m.group(2)) {
          case "d":
            return Duration.ofDays(duration);
          case "h":
            return Duration.ofHours(duration);
          case "m":
            return Duration.ofMinutes(duration);
          case "s":
            return Duration.ofSeconds(duration);
          case "ms":
            return Duration.ofMillis(duration);
          default:
            throw new IllegalStateException(
                "This must not happen. Did you update the regex without the switch case?");
        }
      } catch (ArithmeticException e) {
        throw new ConversionException("Illegal duration '" + input + "'.", input, e);
      }
    }

    @Override
    public String getTypeDescription() {
      return "an immutable length of time";
    }
  }

  /**
   * The converters used when an option only declares its value type. Boolean here is the textual
   * converter ("yes", "0", ...); presence-only flags use {@link OptionType#flag()} instead.
   */
  public static final ImmutableMap<Class<?>, Converter<?>> DEFAULT_CONVERTERS =
      new ImmutableMap.Builder<Class<?>, Converter<?>>()
          .put(String.class, new StringConverter())
          .put(Integer.class, new IntegerConverter())
          .put(Long.class, new LongConverter())
          .put(Double.class, new DoubleConverter())
          .put(Boolean.class, new BooleanConverter())
          .put(Duration.class, new DurationConverter())
          .build();

  /**
   * Returns the default converter for {@code type}.
   *
   * @throws IllegalArgumentException if there is no default converter for the type
   */
  @SuppressWarnings("unchecked") // DEFAULT_CONVERTERS maps each class to a converter of it.
  public static <T> Converter<T> forType(Class<T> type) {
    Converter<?> converter = DEFAULT_CONVERTERS.get(type);
    Preconditions.checkArgument(
        converter != null, "No default converter for %s, supply one", type.getName());
    return (Converter<T>) converter;
  }

  /**
   * Join a list of words as in English. Examples: "nothing" "one" "one or two" "one, two or
   * three". The toString method of each element is used.
   */
  static String joinEnglishList(Iterable<?> choices) {
    StringBuilder buf = new StringBuilder();
    for (Iterator<?> ii = choices.iterator(); ii.hasNext(); ) {
      Object choice = ii.next();
      if (buf.length() > 0) {
        buf.append(ii.hasNext() ? ", " : " or ");
      }
      buf.append(choice);
    }
    return buf.length() == 0 ? "nothing" : buf.toString();
  }
}

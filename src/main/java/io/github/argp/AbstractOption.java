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
import java.util.List;
import javax.annotation.Nullable;

/**
 * Holds the typed value and set state shared by {@link KeywordOption} and {@link
 * PositionalOption}. The conversion itself is delegated to an {@link OptionType}.
 */
public abstract class AbstractOption<T> implements OptionDescriptor {

  private final String help;
  private final OptionType<T> type;
  @Nullable private final T defaultValue;
  @Nullable private T value;
  private boolean set;

  AbstractOption(String help, OptionType<T> type, @Nullable T defaultValue) {
    this.help = Preconditions.checkNotNull(help);
    this.type = Preconditions.checkNotNull(type);
    this.defaultValue = defaultValue;
    this.value = defaultValue;
  }

  /** Selects the tokens holding the value out of the slice given to {@link #parse}. */
  abstract List<String> valueTokens(List<String> tokens);

  @Override
  public final void parse(List<String> tokens) throws ConversionException {
    Preconditions.checkArgument(!tokens.isEmpty(), "No matched token given to %s", this);
    String matched = tokens.get(0);
    int paramCount = getParamCount();
    if (paramCount != VARIADIC) {
      Preconditions.checkArgument(
          tokens.size() == paramCount + 1,
          "Option %s takes %s parameters, got %s",
          matched,
          paramCount,
          tokens.size() - 1);
    }
    T converted;
    try {
      converted = type.convert(valueTokens(tokens));
    } catch (ConversionException e) {
      throw ConversionException.whileParsing(matched, e);
    }
    value = converted;
    set = true;
  }

  @Override
  public final boolean isSet() {
    return set;
  }

  /** Returns the parsed value, or the default value if the option was never set. */
  @Nullable
  public T getValue() {
    return value;
  }

  @Nullable
  public T getDefaultValue() {
    return defaultValue;
  }

  public OptionType<T> getType() {
    return type;
  }

  String getDescription() {
    return help;
  }

  @Override
  public String toString() {
    return getHelp().label();
  }
}

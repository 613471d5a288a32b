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
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * An option filled by position. It claims the first token that no keyword option wants, whatever
 * that token looks like, and stops matching once set. Positional options fill in the order they
 * were declared.
 *
 * <p>The claimed token is the value itself. A scalar positional option therefore takes no further
 * parameters, while a variadic one takes the claimed token plus everything after it.
 */
public final class PositionalOption<T> extends AbstractOption<T> {

  private final String name;
  private final boolean required;

  private PositionalOption(
      String name, String help, boolean required, OptionType<T> type, @Nullable T defaultValue) {
    super(help, type, defaultValue);
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "A positional option needs a name");
    Preconditions.checkArgument(
        type.getValueCount() != 0, "Positional option '%s' cannot be a flag", name);
    this.name = name;
    this.required = required;
  }

  public static <T> PositionalOption<T> of(
      String name, String help, boolean required, OptionType<T> type, @Nullable T defaultValue) {
    return new PositionalOption<>(name, help, required, type, defaultValue);
  }

  /** A positional option holding its token verbatim. */
  public static PositionalOption<String> string(
      String name, String help, boolean required, @Nullable String defaultValue) {
    return of(name, help, required, OptionType.string(), defaultValue);
  }

  /** A positional option holding its token and all tokens after it, verbatim. */
  public static PositionalOption<ImmutableList<String>> remaining(
      String name, String help, boolean required) {
    return of(name, help, required, OptionType.remainingStrings(), ImmutableList.of());
  }

  public String getName() {
    return name;
  }

  public boolean isRequired() {
    return required;
  }

  @Override
  public OptionKind getKind() {
    return OptionKind.POSITIONAL;
  }

  @Override
  public boolean matches(String token) {
    return !isSet();
  }

  @Override
  public int getParamCount() {
    int valueCount = getType().getValueCount();
    return valueCount == VARIADIC ? VARIADIC : valueCount - 1;
  }

  @Override
  List<String> valueTokens(List<String> tokens) {
    return tokens;
  }

  /** The name as shown in usage lines: bracketed when the option may be left out. */
  String getUsageLabel() {
    return required ? name : "[" + name + "]";
  }

  @Override
  public HelpEntry getHelp() {
    return new HelpEntry(getUsageLabel(), getDescription());
  }
}

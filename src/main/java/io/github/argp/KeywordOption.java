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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * An option matched by exact comparison of a token with one of its identifiers, e.g. {@code -n} or
 * {@code --count}. The tokens following the identifier carry its value:
 *
 * <pre>
 * KeywordOption&lt;Boolean&gt; verbose =
 *     KeywordOption.flag(ImmutableList.of("-v", "--verbose"), "print more");
 * KeywordOption&lt;Integer&gt; count =
 *     KeywordOption.of(ImmutableList.of("-n"), "number of runs", OptionType.of(Integer.class), 1);
 * </pre>
 *
 * <p>A keyword option keeps matching after it was set; a repeated identifier overwrites the value.
 */
public final class KeywordOption<T> extends AbstractOption<T> {

  private static final Joiner LABEL_JOINER = Joiner.on(", ");

  private final ImmutableList<String> identifiers;

  private KeywordOption(
      ImmutableList<String> identifiers,
      String help,
      OptionType<T> type,
      @Nullable T defaultValue) {
    super(help, type, defaultValue);
    Preconditions.checkArgument(!identifiers.isEmpty(), "A keyword option needs an identifier");
    for (String identifier : identifiers) {
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(identifier), "Empty identifier in %s", identifiers);
    }
    this.identifiers = identifiers;
  }

  public static <T> KeywordOption<T> of(
      List<String> identifiers, String help, OptionType<T> type, @Nullable T defaultValue) {
    return new KeywordOption<>(ImmutableList.copyOf(identifiers), help, type, defaultValue);
  }

  /** A presence-only flag, {@code false} until one of its identifiers is seen. */
  public static KeywordOption<Boolean> flag(List<String> identifiers, String help) {
    return of(identifiers, help, OptionType.flag(), false);
  }

  /** An option taking one verbatim string. */
  public static KeywordOption<String> string(
      List<String> identifiers, String help, @Nullable String defaultValue) {
    return of(identifiers, help, OptionType.string(), defaultValue);
  }

  /** An option taking every token after it, verbatim. Defaults to the empty list. */
  public static KeywordOption<ImmutableList<String>> remaining(
      List<String> identifiers, String help) {
    return of(identifiers, help, OptionType.remainingStrings(), ImmutableList.of());
  }

  public ImmutableList<String> getIdentifiers() {
    return identifiers;
  }

  @Override
  public OptionKind getKind() {
    return OptionKind.KEYWORD;
  }

  @Override
  public boolean matches(String token) {
    return identifiers.contains(token);
  }

  @Override
  public int getParamCount() {
    return getType().getValueCount();
  }

  @Override
  List<String> valueTokens(List<String> tokens) {
    return tokens.subList(1, tokens.size());
  }

  @Override
  public HelpEntry getHelp() {
    return new HelpEntry(LABEL_JOINER.join(identifiers), getDescription());
  }
}

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

import javax.annotation.Nullable;

/**
 * Base of the checked failures raised while {@link ArgumentParser} applies matched options.
 * Parsing stops at the first failure; options applied before it keep their values and the
 * unrecognized tokens seen so far stay recorded.
 *
 * <p>Two tokens may be attached. {@link #getOption()} is the identifier (or, for a positional
 * option, the token) that selected the failing option. {@link #getInvalidArgument()} is the token
 * that could not be used. A converter called on its own knows only the latter.
 *
 * @see ArgumentParser#parse(java.util.List)
 */
public class OptionsParsingException extends Exception {
  @Nullable private final String option;
  @Nullable private final String invalidArgument;

  public OptionsParsingException(String message) {
    this(message, null, null, null);
  }

  public OptionsParsingException(String message, @Nullable String invalidArgument) {
    this(message, null, invalidArgument, null);
  }

  public OptionsParsingException(
      String message, @Nullable String invalidArgument, @Nullable Throwable cause) {
    this(message, null, invalidArgument, cause);
  }

  OptionsParsingException(
      String message,
      @Nullable String option,
      @Nullable String invalidArgument,
      @Nullable Throwable cause) {
    super(message, cause);
    this.option = option;
    this.invalidArgument = invalidArgument;
  }

  /**
   * The token that matched the option being applied when parsing failed, or {@code null} if the
   * failure was raised outside the parse loop.
   */
  @Nullable
  public String getOption() {
    return option;
  }

  /**
   * The token that could not be used: the parameter a converter rejected, or the identifier of an
   * option that ran out of parameters. {@code null} when no single token is to blame.
   */
  @Nullable
  public String getInvalidArgument() {
    return invalidArgument;
  }
}

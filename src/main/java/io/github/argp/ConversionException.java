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

/** Thrown when a raw token cannot be converted into the type an option declares. */
public class ConversionException extends OptionsParsingException {

  public ConversionException(String message) {
    super(message);
  }

  public ConversionException(String message, @Nullable String argument) {
    super(message, argument);
  }

  public ConversionException(String message, @Nullable String argument, Throwable cause) {
    super(message, argument, cause);
  }

  /** Rethrows {@code cause} with the token that selected the option attached. */
  static ConversionException whileParsing(String option, ConversionException cause) {
    return new ConversionException(
        String.format("While parsing option %s: %s", option, cause.getMessage()),
        option,
        cause.getInvalidArgument(),
        cause);
  }

  private ConversionException(
      String message, String option, @Nullable String argument, Throwable cause) {
    super(message, option, argument, cause);
  }
}

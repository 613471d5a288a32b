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

/**
 * Thrown when fewer tokens remain on the command line than a matched option needs for its
 * parameters.
 */
public class ArgumentCountException extends OptionsParsingException {
  private final int expected;
  private final int available;

  public ArgumentCountException(String argument, int expected, int available) {
    super(
        String.format(
            "Expected %d parameter%s after '%s' but only %d remain%s",
            expected, expected == 1 ? "" : "s", argument, available, available == 1 ? "s" : ""),
        argument,
        argument,
        null);
    this.expected = expected;
    this.available = available;
  }

  /** The number of parameters the option asked for. */
  public int getExpected() {
    return expected;
  }

  /** The number of tokens that were left after the option's identifier. */
  public int getAvailable() {
    return available;
  }
}

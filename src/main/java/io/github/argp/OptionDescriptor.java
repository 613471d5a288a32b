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

import java.util.List;

/**
 * A single option the command line is parsed against.
 *
 * <p>Descriptors belong to the caller. {@link ArgumentParser} and {@link HelpRenderer} only hold
 * references to them, and the parser mutates them in place, so a descriptor must not be shared
 * between threads without external synchronization.
 *
 * <p>All keyword descriptors are tried before any positional one, see {@link OptionMatcher}.
 */
public interface OptionDescriptor {

  /** Parameter count meaning "every token left on the command line". */
  int VARIADIC = -1;

  /** Whether this option is found by identifier or by position. */
  OptionKind getKind();

  /**
   * Tells the parser whether this option claims {@code token}. Must not modify the option. If it
   * returns true, {@link #parse} is called with the token and its parameters.
   */
  boolean matches(String token);

  /**
   * The number of tokens after the matched one that belong to this option: zero or more, or
   * {@link #VARIADIC} to take all remaining tokens.
   */
  int getParamCount();

  /**
   * Converts and stores the value, then marks the option as set, even when the value equals the
   * default. {@code tokens} starts with the matched token, followed by the parameters requested by
   * {@link #getParamCount()}. On failure nothing changes.
   */
  void parse(List<String> tokens) throws ConversionException;

  /** Whether a value was parsed into this option. Never reverts to false. */
  boolean isSet();

  /** The label and description shown in help output. */
  HelpEntry getHelp();
}

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

/** Works out which tokens belong to a matched option. */
final class ArityResolver {

  private ArityResolver() {}

  /**
   * Returns how many tokens after {@code args.get(index)} belong to {@code option}.
   *
   * @throws ArgumentCountException if the option wants more tokens than remain
   * @throws IllegalArityException if the option reports a negative count other than {@link
   *     OptionDescriptor#VARIADIC}
   */
  static int resolve(OptionDescriptor option, List<String> args, int index)
      throws ArgumentCountException {
    int paramCount = option.getParamCount();
    int available = args.size() - index - 1;
    if (paramCount == OptionDescriptor.VARIADIC) {
      return available;
    }
    if (paramCount < 0) {
      throw new IllegalArityException(option, paramCount);
    }
    if (paramCount > available) {
      throw new ArgumentCountException(args.get(index), paramCount, available);
    }
    return paramCount;
  }

  /** The matched token followed by its {@code paramCount} parameters. */
  static List<String> slice(List<String> args, int index, int paramCount) {
    return args.subList(index, index + paramCount + 1);
  }
}

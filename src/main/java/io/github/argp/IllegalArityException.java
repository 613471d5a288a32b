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
 * Thrown when an {@link OptionDescriptor} reports a negative parameter count other than {@link
 * OptionDescriptor#VARIADIC}. This indicates a broken descriptor implementation, not bad user
 * input.
 */
public class IllegalArityException extends IllegalStateException {
  private final int paramCount;

  public IllegalArityException(OptionDescriptor option, int paramCount) {
    super(
        String.format(
            "Option '%s' reports illegal parameter count %d",
            option.getHelp().label(), paramCount));
    this.paramCount = paramCount;
  }

  public int getParamCount() {
    return paramCount;
  }
}

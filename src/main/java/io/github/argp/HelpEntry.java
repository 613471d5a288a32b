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

/**
 * The two columns of an option's help entry.
 *
 * @param label the identifiers or name of the option, e.g. {@code "-v, --verbose"}
 * @param description free text, may contain line breaks
 */
public record HelpEntry(String label, String description) {
  public HelpEntry {
    Preconditions.checkNotNull(label);
    Preconditions.checkNotNull(description);
  }
}

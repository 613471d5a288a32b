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
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/**
 * Decides which option claims a token.
 *
 * <p>Keyword options are tried first, in declaration order, and the first one that matches wins.
 * This also settles duplicate identifiers: the option declared first gets them. Only when no
 * keyword option matches are positional options tried, again in declaration order, so the first
 * unfilled positional slot takes the token.
 */
final class OptionMatcher {

  private final ImmutableList<OptionDescriptor> keyword;
  private final ImmutableList<OptionDescriptor> positional;

  OptionMatcher(List<? extends OptionDescriptor> options) {
    ImmutableList.Builder<OptionDescriptor> keywordBuilder = ImmutableList.builder();
    ImmutableList.Builder<OptionDescriptor> positionalBuilder = ImmutableList.builder();
    for (OptionDescriptor option : options) {
      Preconditions.checkNotNull(option, "null option in %s", options);
      switch (option.getKind()) {
        case KEYWORD:
          keywordBuilder.add(option);
          break;
        case POSITIONAL:
          positionalBuilder.add(option);
          break;
      }
    }
    this.keyword = keywordBuilder.build();
    this.positional = positionalBuilder.build();
  }

  /** Returns the option claiming {@code token}, or empty if the token is unrecognized. */
  Optional<OptionDescriptor> match(String token) {
    for (OptionDescriptor option : keyword) {
      if (option.matches(token)) {
        return Optional.of(option);
      }
    }
    for (OptionDescriptor option : positional) {
      if (option.matches(token)) {
        return Optional.of(option);
      }
    }
    return Optional.empty();
  }

  ImmutableList<OptionDescriptor> getKeywordOptions() {
    return keyword;
  }

  ImmutableList<OptionDescriptor> getPositionalOptions() {
    return positional;
  }
}

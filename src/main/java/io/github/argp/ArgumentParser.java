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
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Parses an argument vector against a list of {@link OptionDescriptor}s. Use it like this:
 *
 * <pre>
 * KeywordOption&lt;Boolean&gt; verbose =
 *     KeywordOption.flag(ImmutableList.of("-v", "--verbose"), "print more");
 * PositionalOption&lt;String&gt; input =
 *     PositionalOption.string("input", "file to read", true, null);
 *
 * ArgumentParser parser = ArgumentParser.builder().options(verbose, input).build();
 * if (!parser.parse(args)) {
 *   System.err.println("Unknown arguments: " + parser.getUnrecognized());
 * }
 * </pre>
 *
 * <p>The scan goes left to right. At each token the {@link OptionMatcher} picks an option, the
 * {@link ArityResolver} says how many following tokens it takes, and the option converts them.
 * Tokens no option claims are collected and the scan moves on. The first conversion or argument
 * count failure aborts the scan; options applied before it keep their values.
 *
 * <p>The parser does not own the options; it mutates the caller's instances. It is not thread-safe.
 */
public class ArgumentParser {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** By default the first argument, the program name, is skipped. */
  public static final int DEFAULT_SKIP = 1;

  /** A helper class to create new instances of {@link ArgumentParser}. */
  public static final class Builder {
    private final List<OptionDescriptor> options = new ArrayList<>();
    private int skip = DEFAULT_SKIP;

    private Builder() {}

    /** Adds options, in declaration order. */
    @CanIgnoreReturnValue
    public Builder options(OptionDescriptor... options) {
      return options(Arrays.asList(options));
    }

    /** Adds options, in declaration order. */
    @CanIgnoreReturnValue
    public Builder options(Iterable<? extends OptionDescriptor> options) {
      for (OptionDescriptor option : options) {
        this.options.add(Preconditions.checkNotNull(option));
      }
      return this;
    }

    /** Sets how many leading arguments every {@link #parse} call ignores. */
    @CanIgnoreReturnValue
    public Builder skip(int skip) {
      Preconditions.checkArgument(skip >= 0, "skip must not be negative: %s", skip);
      this.skip = skip;
      return this;
    }

    public ArgumentParser build() {
      return new ArgumentParser(ImmutableList.copyOf(options), skip);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  private final ImmutableList<OptionDescriptor> options;
  private final OptionMatcher matcher;
  private final int skip;
  private final List<String> unrecognized = new ArrayList<>();

  private ArgumentParser(ImmutableList<OptionDescriptor> options, int skip) {
    this.options = options;
    this.matcher = new OptionMatcher(options);
    this.skip = skip;
  }

  /**
   * Parses {@code args} once against {@code options} and returns the arguments no option
   * recognized.
   */
  public static ImmutableList<String> parseArgs(
      List<String> args, List<? extends OptionDescriptor> options, int skip)
      throws OptionsParsingException {
    ArgumentParser parser = builder().options(options).skip(skip).build();
    parser.parse(args);
    return parser.getUnrecognized();
  }

  /** See {@link #parse(List)}. */
  @CanIgnoreReturnValue
  public boolean parse(String... args) throws OptionsParsingException {
    return parse(Arrays.asList(args));
  }

  /**
   * Parses {@code args}, skipping the configured number of leading arguments. May be called more
   * than once; unrecognized arguments accumulate across calls.
   *
   * @return true if no argument has gone unrecognized so far, see {@link #getUnrecognized()}
   * @throws ConversionException if an option cannot convert its tokens
   * @throws ArgumentCountException if an option needs more tokens than remain
   */
  @CanIgnoreReturnValue
  public boolean parse(List<String> args) throws OptionsParsingException {
    ImmutableList<String> argv = ImmutableList.copyOf(args);
    int index = skip;
    while (index < argv.size()) {
      String arg = argv.get(index);
      Optional<OptionDescriptor> option = matcher.match(arg);
      if (!option.isPresent()) {
        logger.atFine().log("Unrecognized argument '%s' at position %d", arg, index);
        unrecognized.add(arg);
        index++;
        continue;
      }
      index += apply(option.get(), argv, index);
    }
    return unrecognized.isEmpty();
  }

  /** Feeds the option its tokens and returns how many tokens it used. */
  private static int apply(OptionDescriptor option, ImmutableList<String> argv, int index)
      throws OptionsParsingException {
    try {
      int paramCount = ArityResolver.resolve(option, argv, index);
      List<String> tokens = ArityResolver.slice(argv, index, paramCount);
      option.parse(tokens);
      logger.atFinest().log("Applied %s to option %s", tokens, option.getHelp().label());
      return paramCount + 1;
    } catch (OptionsParsingException e) {
      logger.atFine().withCause(e).log("Parsing stopped at argument %d", index);
      throw e;
    }
  }

  /** Returns the arguments no option claimed, in the order they were seen, over all calls. */
  public ImmutableList<String> getUnrecognized() {
    return ImmutableList.copyOf(unrecognized);
  }

  /** Returns the required positional options that have not been set yet, in declaration order. */
  public ImmutableList<PositionalOption<?>> getMissingRequired() {
    ImmutableList.Builder<PositionalOption<?>> missing = ImmutableList.builder();
    for (OptionDescriptor option : matcher.getPositionalOptions()) {
      if (option instanceof PositionalOption) {
        PositionalOption<?> positional = (PositionalOption<?>) option;
        if (positional.isRequired() && !positional.isSet()) {
          missing.add(positional);
        }
      }
    }
    return missing.build();
  }

  /** The options this parser was built with, in declaration order. */
  public ImmutableList<OptionDescriptor> getOptions() {
    return options;
  }

  public int getSkip() {
    return skip;
  }
}

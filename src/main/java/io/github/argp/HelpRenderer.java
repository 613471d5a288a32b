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
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import java.io.PrintStream;
import java.util.List;

/**
 * A renderer for usage messages. The output looks like this:
 *
 * <pre>
 * Usage: cp &lt;options&gt; source [target]
 *
 * source                   file to copy
 * [target]                 where to copy it,
 *                          defaults to the working directory
 * -r, --recursive          copy directories
 * --a-rather-long-identifier
 *                          description on its own line
 * </pre>
 *
 * <p>Rendering only reads the options, so rendering the same options twice gives the same text.
 */
public final class HelpRenderer {

  /** Label column width used when positional options are present. */
  public static final int DEFAULT_MIN_WIDTH = 25;

  /** A narrower label column that suits tools with keyword options only. */
  public static final int KEYWORD_ONLY_MIN_WIDTH = 15;

  private static final Splitter NEWLINE_SPLITTER = Splitter.on('\n');

  private HelpRenderer() {}

  /**
   * Appends the usage line and one entry per option to {@code usage}.
   *
   * @param command shown after {@code Usage:}, normally the program name
   * @param minWidth the width of the label column; longer labels push their description to the
   *     next line. Negative values are treated as zero.
   */
  public static void getUsage(
      StringBuilder usage, String command, List<? extends OptionDescriptor> options, int minWidth) {
    int width = Math.max(minWidth, 0);
    appendUsageLine(usage, command, options);
    if (!options.isEmpty()) {
      usage.append('\n');
    }
    for (OptionDescriptor option : options) {
      appendEntry(usage, option.getHelp(), width);
    }
  }

  /** Returns the text {@link #getUsage} would append. */
  public static String describe(
      String command, List<? extends OptionDescriptor> options, int minWidth) {
    StringBuilder usage = new StringBuilder();
    getUsage(usage, command, options, minWidth);
    return usage.toString();
  }

  /** Uses {@link #DEFAULT_MIN_WIDTH}. */
  public static String describe(String command, List<? extends OptionDescriptor> options) {
    return describe(command, options, DEFAULT_MIN_WIDTH);
  }

  /** Writes the help text to {@code out}. */
  public static void printHelp(
      PrintStream out, String command, List<? extends OptionDescriptor> options, int minWidth) {
    out.print(describe(command, options, minWidth));
    out.flush();
  }

  /** Uses {@link #DEFAULT_MIN_WIDTH}. */
  public static void printHelp(
      PrintStream out, String command, List<? extends OptionDescriptor> options) {
    printHelp(out, command, options, DEFAULT_MIN_WIDTH);
  }

  static void appendUsageLine(
      StringBuilder usage, String command, List<? extends OptionDescriptor> options) {
    usage.append("Usage: ").append(command);
    if (options.stream().anyMatch(option -> option.getKind() == OptionKind.KEYWORD)) {
      usage.append(" <options>");
    }
    for (OptionDescriptor option : options) {
      if (option.getKind() == OptionKind.POSITIONAL) {
        usage.append(' ').append(option.getHelp().label());
      }
    }
    usage.append('\n');
  }

  /**
   * Appends {@code label} padded to {@code width}, followed by the description. Every line of the
   * description after the first is indented to {@code width}.
   *
   * <p>A label that fills the column exactly is treated like a longer one: the description moves
   * to the next line, so label and description are always separated by whitespace.
   */
  static void appendEntry(StringBuilder usage, HelpEntry entry, int width) {
    String label = entry.label();
    if (entry.description().isEmpty()) {
      usage.append(label).append('\n');
      return;
    }
    String indent = " ".repeat(width);
    if (label.length() >= width) {
      usage.append(label).append('\n').append(indent);
    } else {
      usage.append(Strings.padEnd(label, width, ' '));
    }
    Joiner.on("\n" + indent).appendTo(usage, NEWLINE_SPLITTER.split(entry.description()));
    usage.append('\n');
  }
}

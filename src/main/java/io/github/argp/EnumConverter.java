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

import com.google.common.base.Ascii;
import java.util.Arrays;

/**
 * A converter for enum-valued options.
 *
 * <p>Either subclass it with a zero argument constructor that calls {@link #EnumConverter(Class,
 * String)}, or use {@link #of}.
 *
 * <p>The input is compared to the toString() of each enum member, ignoring case. Usually that is
 * the name of the constant, but beware if you override toString()!
 */
public class EnumConverter<T extends Enum<T>> implements Converter<T> {

  private final Class<T> enumType;
  private final String typeName;

  /**
   * @param enumType The type of your enumeration; usually a class literal like MyEnum.class
   * @param typeName The intuitive name of your enumeration, for example, the type name for
   *     CompressionLevel might be "compression level".
   */
  protected EnumConverter(Class<T> enumType, String typeName) {
    this.enumType = enumType;
    this.typeName = typeName;
  }

  public static <T extends Enum<T>> EnumConverter<T> of(Class<T> enumType, String typeName) {
    return new EnumConverter<>(enumType, typeName);
  }

  @Override
  public T convert(String input) throws ConversionException {
    for (T value : enumType.getEnumConstants()) {
      if (Ascii.equalsIgnoreCase(value.toString(), input)) {
        return value;
      }
    }
    throw new ConversionException(
        "Not a valid " + typeName + ": '" + input + "' (should be " + getTypeDescription() + ")",
        input);
  }

  @Override
  public final String getTypeDescription() {
    return Ascii.toLowerCase(
        Converters.joinEnglishList(Arrays.asList(enumType.getEnumConstants())));
  }
}

/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.gotoc.ir.transform;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import exm.gotoc.ir.tree.Types;

/**
 * Grammar of identifiers accepted by the C text output, and the fixed
 * substitution used to bring other names into it.
 */
public class CIdentifiers {

  /** Words that cannot be used as identifiers */
  public static final Set<String> RESERVED_WORDS = ImmutableSet.of(
      "auto", "break", "case", "char", "const", "continue", "default", "do",
      "double", "else", "enum", "extern", "float", "for", "goto", "if",
      "inline", "int", "long", "register", "restrict", "return", "short",
      "signed", "sizeof", "static", "struct", "switch", "typedef", "union",
      "unsigned", "void", "volatile", "while", "_Alignas", "_Alignof",
      "_Atomic", "_Bool", "_Complex", "_Generic", "_Imaginary",
      "_Noreturn", "_Static_assert", "_Thread_local");

  /** Names defined by the headers the C text output includes */
  public static final Set<String> HEADER_NAMES = ImmutableSet.of(
      "bool", "true", "false", "NULL", "offsetof", "size_t", "ssize_t",
      "ptrdiff_t", "wchar_t", "int8_t", "int16_t", "int32_t", "int64_t",
      "uint8_t", "uint16_t", "uint32_t", "uint64_t", "intptr_t",
      "uintptr_t", "intmax_t", "uintmax_t", "off_t", "pid_t");

  public static final char REPLACEMENT = '_';

  /**
   * @return true if s is a keyword or a name the output headers define
   */
  public static boolean isReserved(String s) {
    return RESERVED_WORDS.contains(s) || HEADER_NAMES.contains(s);
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') ||
            c == '_' || c == '$';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || (c >= '0' && c <= '9');
  }

  /**
   * @return true if s is a plain C identifier
   */
  public static boolean isIdentifier(String s) {
    if (s.isEmpty() || !isIdentifierStart(s.charAt(0))) {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      if (!isIdentifierPart(s.charAt(i))) {
        return false;
      }
    }
    return !isReserved(s);
  }

  /**
   * @return true if name is a legal symbol table key: an identifier,
   *          optionally with the aggregate tag prefix
   */
  public static boolean isLegalName(String name) {
    if (name.startsWith(Types.TAG_PREFIX)) {
      return isIdentifier(name.substring(Types.TAG_PREFIX.length()));
    }
    return isIdentifier(name);
  }

  /**
   * Context-free substitution into the identifier grammar.
   * Does not handle the tag prefix: callers strip it first.
   */
  public static String sanitize(String name) {
    if (name.isEmpty()) {
      return String.valueOf(REPLACEMENT);
    }
    StringBuilder sb = new StringBuilder(name.length() + 1);
    if (name.charAt(0) >= '0' && name.charAt(0) <= '9') {
      sb.append(REPLACEMENT);
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      sb.append(isIdentifierPart(c) ? c : REPLACEMENT);
    }
    String result = sb.toString();
    if (isReserved(result)) {
      result = result + REPLACEMENT;
    }
    return result;
  }
}

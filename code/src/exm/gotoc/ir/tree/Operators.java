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
package exm.gotoc.ir.tree;

/**
 * Operators that can appear in goto program expressions.
 * Each carries its irep id and, where one exists, C syntax.
 */
public class Operators {

  public static enum BinaryOperator {
    AND("and", "&&", Category.LOGICAL),
    ASHR("ashr", ">>", Category.SHIFT),
    BITAND("bitand", "&", Category.ARITHMETIC),
    BITOR("bitor", "|", Category.ARITHMETIC),
    BITXOR("bitxor", "^", Category.ARITHMETIC),
    DIV("/", "/", Category.ARITHMETIC),
    EQUAL("=", "==", Category.COMPARISON),
    GE(">=", ">=", Category.COMPARISON),
    GT(">", ">", Category.COMPARISON),
    IEEE_FLOAT_EQUAL("ieee_float_equal", "==", Category.COMPARISON),
    IEEE_FLOAT_NOTEQUAL("ieee_float_notequal", "!=", Category.COMPARISON),
    /** a ==> b; has no C equivalent */
    IMPLIES("=>", null, Category.LOGICAL),
    LE("<=", "<=", Category.COMPARISON),
    LSHR("lshr", ">>", Category.SHIFT),
    LT("<", "<", Category.COMPARISON),
    MINUS("-", "-", Category.ARITHMETIC),
    MOD("mod", "%", Category.ARITHMETIC),
    MULT("*", "*", Category.ARITHMETIC),
    NOTEQUAL("notequal", "!=", Category.COMPARISON),
    OR("or", "||", Category.LOGICAL),
    PLUS("+", "+", Category.ARITHMETIC),
    SHL("shl", "<<", Category.SHIFT),
    XOR("xor", "^", Category.LOGICAL),
    ;

    public static enum Category {
      /** operands of same type, result of that type */
      ARITHMETIC,
      /** operands of same type, boolean result */
      COMPARISON,
      /** boolean operands and result */
      LOGICAL,
      /** result has type of left operand */
      SHIFT,
    }

    private final String irepId;
    private final String cSyntax;
    private final Category category;

    private BinaryOperator(String irepId, String cSyntax, Category category) {
      this.irepId = irepId;
      this.cSyntax = cSyntax;
      this.category = category;
    }

    public String irepId() {
      return irepId;
    }

    /**
     * @return C operator, or null if not expressible in C
     */
    public String cSyntax() {
      return cSyntax;
    }

    public Category category() {
      return category;
    }
  }

  public static enum UnaryOperator {
    BITNOT("bitnot", "~"),
    BSWAP("bswap", null),
    NOT("not", "!"),
    POPCOUNT("popcount", null),
    UNARY_MINUS("unary-", "-"),
    ;

    private final String irepId;
    private final String cSyntax;

    private UnaryOperator(String irepId, String cSyntax) {
      this.irepId = irepId;
      this.cSyntax = cSyntax;
    }

    public String irepId() {
      return irepId;
    }

    /**
     * @return prefix C operator, or null if rendered as a builtin call
     */
    public String cSyntax() {
      return cSyntax;
    }
  }

  /**
   * Operators with side effects on their operand
   */
  public static enum SelfOperator {
    POSTDECREMENT("postdecrement", "--", false),
    POSTINCREMENT("postincrement", "++", false),
    PREDECREMENT("predecrement", "--", true),
    PREINCREMENT("preincrement", "++", true),
    ;

    private final String irepId;
    private final String cSyntax;
    private final boolean prefix;

    private SelfOperator(String irepId, String cSyntax, boolean prefix) {
      this.irepId = irepId;
      this.cSyntax = cSyntax;
      this.prefix = prefix;
    }

    public String irepId() {
      return irepId;
    }

    public String cSyntax() {
      return cSyntax;
    }

    public boolean isPrefix() {
      return prefix;
    }
  }
}

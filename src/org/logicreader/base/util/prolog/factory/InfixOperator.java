package org.logicreader.base.util.prolog.factory;

/**
 * Infix operators and the prefix symbols they are rewritten to.  <code>X =:= Y</code> is read as the atom
 * <code>equals(X, Y)</code> and <code>X + Y</code> as the function <code>plus(X, Y)</code>.
 */
public enum InfixOperator
{
  EQUALS("=:=", "equals", Category.RELATIONAL),
  NOT_EQUALS("=\\=", "not_equals", Category.RELATIONAL),
  LESS_THAN_EQ("=<", "lessThanEq", Category.RELATIONAL),
  GREATER_THAN_EQ(">=", "greaterThanEq", Category.RELATIONAL),
  LESS_THAN("<", "lessThan", Category.RELATIONAL),
  GREATER_THAN(">", "greaterThan", Category.RELATIONAL),

  PLUS("+", "plus", Category.ARITHMETIC),
  MINUS("-", "minus", Category.ARITHMETIC),
  PRODUCT("*", "product", Category.ARITHMETIC),
  DIVIDE("/", "divide", Category.ARITHMETIC),
  MODULO("%", "modulo", Category.ARITHMETIC);

  /**
   * Relational operators build atoms.  Arithmetic operators build functions.
   */
  public static enum Category
  {
    RELATIONAL,
    ARITHMETIC
  }

  private final String   token;
  private final String   symbol;
  private final Category category;

  private InfixOperator(String token, String symbol, Category category)
  {
    this.token = token;
    this.symbol = symbol;
    this.category = category;
  }

  /**
   * @return the operator as written, e.g. "=<".
   */
  public String getToken()
  {
    return token;
  }

  /**
   * @return the name of the atom or function that the operator is rewritten to, e.g. "lessThanEq".
   */
  public String getSymbol()
  {
    return symbol;
  }

  public Category getCategory()
  {
    return category;
  }

  /**
   * @return the rewritten prefix form of <code>left op right</code>.
   */
  public String rewrite(String left, String right)
  {
    return symbol + "(" + left + ", " + right + ")";
  }

  /**
   * Find the operator of the given category whose token is at the start of the given region of text.  Longer tokens
   * take precedence, so ">=" is found rather than ">".
   *
   * @return the operator, or null if there isn't one.
   */
  public static InfixOperator match(String text, int start, Category category)
  {
    InfixOperator result = null;
    for (InfixOperator operator : values())
    {
      if ((operator.category == category) &&
          text.startsWith(operator.token, start) &&
          ((result == null) || (operator.token.length() > result.token.length())))
      {
        result = operator;
      }
    }
    return result;
  }
}

package org.logicreader.base.util.prolog.grammar;

import java.util.Set;

/**
 * A <i>constant</i> is a boolean, an integer, a floating point number or a string.  Constants are always ground.
 *
 * The four kinds of constant are separate subclasses.  Two constants are equal only if they are of the same kind and
 * hold the same value, so the integer <code>1</code> is not equal to the string <code>"1"</code>.
 *
 * See {@link Term} for a description of the term hierarchy.
 */
@SuppressWarnings("serial")
public abstract class Constant extends Term
{
  /**
   * The kinds of constant.
   */
  public static enum Type
  {
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING
  }

  /**
   * @return which kind of constant this is.
   */
  public abstract Type getType();

  @Override
  public final Kind getKind()
  {
    return Kind.CONSTANT;
  }

  @Override
  public final boolean isGround()
  {
    return true;
  }

  @Override
  final void addVariablesTo(Set<Variable> variables)
  {
    // Nothing to add.
  }

  @Override
  final void addConstantsTo(Set<Constant> constants)
  {
    constants.add(this);
  }

  @Override
  final void addFunctionsTo(Set<TermFunction> functions)
  {
    // Nothing to add.
  }

  @Override
  public String toString()
  {
    return getClass().getSimpleName() + "(" + toText() + ")";
  }
}

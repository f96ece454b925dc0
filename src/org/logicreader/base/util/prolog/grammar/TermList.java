package org.logicreader.base.util.prolog.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A <i>list</i> is an ordered sequence of <i>terms</i>, written <code>[a, B, f(c)]</code>.  The head/tail forms
 * <code>[H | T]</code> and <code>[1 | [2, 3]]</code> are flattened by the parser, so <code>[1 | [2, 3]]</code> is the
 * same list as <code>[1, 2, 3]</code>.
 *
 * See {@link Term} for a description of the term hierarchy.
 */
@SuppressWarnings("serial")
public final class TermList extends Term
{
  /**
   * The symbol shared by all lists.  It takes part in hashing only and is never printed.
   */
  public static final String SYMBOL = "{L}";

  private final List<Term> terms;
  private final int        hash;

  private transient Set<Variable>     variables;
  private transient Set<Constant>     constants;
  private transient Set<TermFunction> functions;

  public TermList(List<? extends Term> terms)
  {
    this.terms = Collections.unmodifiableList(new ArrayList<Term>(terms));
    hash = 31 * SYMBOL.hashCode() + this.terms.hashCode();
  }

  public TermList(Term... terms)
  {
    this(Arrays.asList(terms));
  }

  public String getSymbol()
  {
    return SYMBOL;
  }

  public List<Term> getTerms()
  {
    return terms;
  }

  public Term get(int index)
  {
    return terms.get(index);
  }

  public int size()
  {
    return terms.size();
  }

  public boolean isEmpty()
  {
    return terms.isEmpty();
  }

  public Set<Variable> getVariables()
  {
    if (variables == null)
    {
      variables = TermCollector.collectVariables(terms);
    }
    return variables;
  }

  public Set<Constant> getConstants()
  {
    if (constants == null)
    {
      constants = TermCollector.collectConstants(terms);
    }
    return constants;
  }

  public Set<TermFunction> getFunctions()
  {
    if (functions == null)
    {
      functions = TermCollector.collectFunctions(terms);
    }
    return functions;
  }

  @Override
  public Kind getKind()
  {
    return Kind.LIST;
  }

  @Override
  public boolean isGround()
  {
    return getVariables().isEmpty();
  }

  @Override
  void addVariablesTo(Set<Variable> variableSet)
  {
    variableSet.addAll(getVariables());
  }

  @Override
  void addConstantsTo(Set<Constant> constantSet)
  {
    constantSet.addAll(getConstants());
  }

  @Override
  void addFunctionsTo(Set<TermFunction> functionSet)
  {
    functionSet.addAll(getFunctions());
  }

  @Override
  public String toText()
  {
    return "[" + toText(terms) + "]";
  }

  @Override
  public String toString()
  {
    return "TermList(" + toText() + ")";
  }

  @Override
  public int hashCode()
  {
    return hash;
  }

  @Override
  public boolean equals(Object other)
  {
    if (this == other)
    {
      return true;
    }
    if (!(other instanceof TermList))
    {
      return false;
    }
    return (((TermList)other).hash == hash) && ((TermList)other).terms.equals(terms);
  }
}

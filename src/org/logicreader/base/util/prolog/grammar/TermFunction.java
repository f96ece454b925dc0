package org.logicreader.base.util.prolog.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A <i>function</i> is a complex <i>term</i> that contains other <i>terms</i>.  It has a name and a body consisting of
 * other terms, much like an <i>atom</i>.  Unlike an atom, however, it does not have a truth value.
 *
 * A function may also be associated with one or more values, as in <code>foo(X)=bar</code> or
 * <code>foo(X)=(bar, baz)</code>.  The values count towards the arity, so both <code>foo(X, Y)</code> and
 * <code>foo(X)=Y</code> have arity 2.
 *
 * A function with an empty name is an anonymous tuple, written <code>(a, b)</code>.
 *
 * See {@link Term} for a description of the term hierarchy.
 */
@SuppressWarnings("serial")
public final class TermFunction extends Term
{

  private final String     symbol;
  private final List<Term> terms;
  private final List<Term> values;
  private final int        hash;

  private transient Set<Variable>     variables;
  private transient Set<Constant>     constants;
  private transient Set<TermFunction> functions;
  private transient AtomSignature     signature;

  public TermFunction(String symbol, List<? extends Term> terms)
  {
    this(symbol, terms, Collections.<Term>emptyList());
  }

  public TermFunction(String symbol, List<? extends Term> terms, List<? extends Term> values)
  {
    if (symbol == null)
    {
      throw new NullPointerException("A function must have a symbol");
    }
    this.symbol = symbol;
    this.terms = Collections.unmodifiableList(new ArrayList<Term>(terms));
    this.values = Collections.unmodifiableList(new ArrayList<Term>(values));
    hash = computeHash();
  }

  public String getSymbol()
  {
    return symbol;
  }

  public List<Term> getTerms()
  {
    return terms;
  }

  public List<Term> getValues()
  {
    return values;
  }

  public Term get(int index)
  {
    return terms.get(index);
  }

  public int arity()
  {
    return terms.size() + values.size();
  }

  public boolean isMultivalued()
  {
    return !values.isEmpty();
  }

  /**
   * @return the signature of this function.  Throws IllegalArgumentException for an anonymous tuple, which has no
   *         name to sign with.
   */
  public AtomSignature getSignature()
  {
    if (signature == null)
    {
      signature = new AtomSignature(symbol, arity());
    }
    return signature;
  }

  public Set<Variable> getVariables()
  {
    if (variables == null)
    {
      variables = TermCollector.collectVariablesLists(Arrays.asList(terms, values));
    }
    return variables;
  }

  public Set<Constant> getConstants()
  {
    if (constants == null)
    {
      constants = TermCollector.collectConstantsLists(Arrays.asList(terms, values));
    }
    return constants;
  }

  /**
   * @return the functions nested anywhere inside this one (not including this function itself).
   */
  public Set<TermFunction> getFunctions()
  {
    if (functions == null)
    {
      functions = TermCollector.collectFunctionsLists(Arrays.asList(terms, values));
    }
    return functions;
  }

  @Override
  public Kind getKind()
  {
    return Kind.FUNCTION;
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
    functionSet.add(this);
    functionSet.addAll(getFunctions());
  }

  @Override
  public String toText()
  {
    StringBuilder sb = new StringBuilder();

    sb.append(symbol).append('(').append(toText(terms)).append(')');
    if (values.size() == 1)
    {
      sb.append('=').append(values.get(0).toText());
    }
    else if (values.size() > 1)
    {
      sb.append("=(").append(toText(values)).append(')');
    }

    return sb.toString();
  }

  @Override
  public String toString()
  {
    return "TermFunction(" + toText() + ")";
  }

  private int computeHash()
  {
    int code = symbol.hashCode();
    code = 31 * code + terms.hashCode();
    code = 31 * code + values.hashCode();
    return code;
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
    if (!(other instanceof TermFunction))
    {
      return false;
    }

    TermFunction function = (TermFunction)other;
    return (function.hash == hash) &&
           (function.arity() == arity()) &&
           function.symbol.equals(symbol) &&
           function.terms.equals(terms) &&
           function.values.equals(values);
  }

}

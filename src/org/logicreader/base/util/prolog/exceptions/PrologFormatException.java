package org.logicreader.base.util.prolog.exceptions;

/**
 * Thrown when text can't be parsed as the requested construct.
 */
public final class PrologFormatException extends PrologException
{
  private static final long serialVersionUID = 1L;

  /**
   * The constructs that can be requested from the parser.
   */
  public static enum TargetConstruct
  {
    TERM("a term"),
    TERM_LIST("a list of terms"),
    FUNCTION("a function"),
    ATOMIC_FORMULA("an Atomic Formula"),
    DEFINITE_CLAUSE("a definite clause construct"),
    RULE("a rule"),
    RULES("a sequence of rules");

    private final String mDescription;

    private TargetConstruct(String xiDescription)
    {
      mDescription = xiDescription;
    }

    public String getDescription()
    {
      return mDescription;
    }
  }

  private final TargetConstruct mTarget;
  private final String mSource;
  private final String mRemainder;

  /**
   * Create an exception for a failed parse.
   *
   * @param xiTarget    - the construct that was being parsed.
   * @param xiSource    - the complete text that was being parsed.
   * @param xiRemainder - the text that couldn't be consumed.
   */
  public PrologFormatException(TargetConstruct xiTarget, String xiSource, String xiRemainder)
  {
    super("Cannot parse the following expression as " + xiTarget.getDescription() + ": '" + xiSource + "'" +
          " (failed at: '" + xiRemainder + "')");
    mTarget = xiTarget;
    mSource = xiSource;
    mRemainder = xiRemainder;
  }

  public TargetConstruct getTarget()
  {
    return mTarget;
  }

  public String getSource()
  {
    return mSource;
  }

  public String getRemainder()
  {
    return mRemainder;
  }
}

package org.logicreader.base.util.prolog.exceptions;

/**
 * Thrown when a fragment of text can't be classified as any kind of term.
 */
public final class TermFormatException extends PrologException
{
  private static final long serialVersionUID = 1L;

  private final String mFragment;

  public TermFormatException(String xiFragment)
  {
    super("Cannot parse term symbol '" + xiFragment + "'");
    mFragment = xiFragment;
  }

  public TermFormatException(String xiFragment, Throwable xiCause)
  {
    super("Cannot parse term symbol '" + xiFragment + "'", xiCause);
    mFragment = xiFragment;
  }

  /**
   * @return the fragment that couldn't be classified.
   */
  public String getFragment()
  {
    return mFragment;
  }
}

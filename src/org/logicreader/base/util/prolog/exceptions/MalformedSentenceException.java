package org.logicreader.base.util.prolog.exceptions;

/**
 * Thrown when a sentence can't be reformatted, e.g. because it has more than one ":-" separator.
 */
public final class MalformedSentenceException extends PrologException
{
  private static final long serialVersionUID = 1L;

  private final String mSentence;

  public MalformedSentenceException(String xiSentence, String xiReason)
  {
    super("The sentence '" + xiSentence + "' is invalid: " + xiReason);
    mSentence = xiSentence;
  }

  public String getSentence()
  {
    return mSentence;
  }
}

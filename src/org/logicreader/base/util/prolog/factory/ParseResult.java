package org.logicreader.base.util.prolog.factory;

/**
 * The successful outcome of a grammar production: the value produced and the position just after the text that the
 * production consumed.  Failure is represented by a null result, so the caller can go on to try its next alternative.
 *
 * @param <T> the type of value produced.
 */
final class ParseResult<T>
{
  final T   value;
  final int end;

  ParseResult(T value, int end)
  {
    this.value = value;
    this.end = end;
  }
}

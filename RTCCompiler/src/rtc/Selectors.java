package rtc;

/**
 * The productions the trigger grammar delegates to. Each one consumes its clause from the cursor
 * and returns a finished subtree, which the trigger grammar attaches as is.
 *
 * <p>The {@code starts*} predicates look at a bounded number of tokens from the cursor and never
 * advance it. Exceptions thrown by any method here reach the caller of the trigger parser
 * unchanged.
 */
public interface Selectors {

  /** Which objects a clause is about, e.g. "another creature you control". */
  Node subset(TokenCursor cursor) throws CompilerException;

  /** Which zones a clause is about, e.g. "your graveyard". */
  Node zoneSubset(TokenCursor cursor) throws CompilerException;

  /** A keyword ability, e.g. "flying". */
  Node keywordReference(TokenCursor cursor) throws CompilerException;

  /** A counter count, e.g. "three or more charge counters on it". */
  Node hasCounters(TokenCursor cursor) throws CompilerException;

  boolean startsZoneSubset(TokenCursor cursor);

  boolean startsKeywordReference(TokenCursor cursor);

  boolean startsHasCounters(TokenCursor cursor);
}

package rtc;

/**
 * Parses condition clauses:
 *
 * <pre>
 * condition : HAS ( raw_keyword_ref -> ^(HAS raw_keyword_ref)
 *                 | has_counters    -> has_counters )
 * </pre>
 *
 * Only the keyword form keeps HAS as a parent. A counter count is returned exactly as the counter
 * production built it.
 */
final class ConditionParser {
  private final Selectors selectors;

  ConditionParser(Selectors selectors) {
    this.selectors = selectors;
  }

  static boolean startsCondition(TokenCursor cursor) {
    return cursor.at(TokenKind.HAS);
  }

  Node.Condition parse(TokenCursor cursor) throws CompilerException {
    Token has = cursor.expect(TokenKind.HAS);
    if (selectors.startsKeywordReference(cursor)) {
      return Nodes.condition(Nodes.has(selectors.keywordReference(cursor), has.pos()), has.pos());
    } else if (selectors.startsHasCounters(cursor)) {
      return Nodes.condition(selectors.hasCounters(cursor), has.pos());
    }
    throw cursor.error("expected a keyword ability or counters");
  }
}

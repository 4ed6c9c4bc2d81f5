package rtc;

import java.util.List;

/**
 * Parses trigger clauses:
 *
 * <pre>
 * trigger : (subset | zone_subset) (event | condition)
 *         -> ^(TRIGGER subset_or_zone_subset event_or_condition)
 * </pre>
 *
 * <p>The subset is parsed once, ahead of the branch, because event and condition clauses would
 * otherwise both begin with it. After it, a single token decides the branch.
 *
 * <p>Instances hold no per-parse state and may be shared between threads.
 */
public final class TriggerParser {
  private final Selectors selectors;
  private final EventParser eventParser;
  private final ConditionParser conditionParser;

  public TriggerParser(Selectors selectors) {
    this.selectors = selectors;
    this.eventParser = new EventParser(selectors);
    this.conditionParser = new ConditionParser(selectors);
  }

  /** Parses one trigger and leaves the cursor on the first token after it. */
  public Node.Trigger parse(TokenCursor cursor) throws CompilerException {
    Node subject =
        selectors.startsZoneSubset(cursor)
            ? selectors.zoneSubset(cursor)
            : selectors.subset(cursor);

    Node body;
    if (EventParser.startsEvent(cursor)) {
      body = eventParser.parse(cursor);
    } else if (ConditionParser.startsCondition(cursor)) {
      body = conditionParser.parse(cursor);
    } else {
      throw cursor.error("expected an event or a condition");
    }
    return Nodes.trigger(subject, body);
  }

  /**
   * Parses a clause that must consist of exactly one trigger, optionally followed by a period.
   */
  public Node.Trigger parseClause(List<Token> tokens) throws CompilerException {
    TokenCursor cursor = new TokenCursor(tokens);
    Node.Trigger trigger = parse(cursor);
    cursor.accept(TokenKind.PERIOD);
    if (!cursor.atEnd()) {
      throw cursor.error("expected end of clause");
    }
    return trigger;
  }
}

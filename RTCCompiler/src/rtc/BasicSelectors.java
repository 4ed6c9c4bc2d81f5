package rtc;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Selector productions covering the plain noun phrases of trigger clauses.
 *
 * <pre>
 * subset       : modifier* (OBJ_TYPE | OBJ_SUBTYPE | SELF)+
 * zone_subset  : modifier* zone_word | OUTSIDE (DETERMINER (GAME | SUBGAME))?
 * modifier     : A | DETERMINER | OTHER | NONTOKEN | QUALIFIER | PLAYER_POSS | NUMBER
 *              | NUMBER_WORD
 * keyword_ref  : KEYWORD_ABILITY
 * has_counters : (NUMBER | NUMBER_WORD | A | NO) (OR (MORE | FEWER))? counter_type? COUNTER
 *                (ON SELF)?
 * counter_type : COUNTER_TYPE | OBJ_SUBTYPE | KEYWORD_ABILITY
 * </pre>
 *
 * <p>Some counter types share their word with a subtype or a keyword ability ("mine", "echo").
 * Those tokens name a counter type only when "counter" follows them.
 */
public class BasicSelectors implements Selectors {

  private static final Set<TokenKind> MODIFIERS =
      EnumSet.of(
          TokenKind.A,
          TokenKind.DETERMINER,
          TokenKind.OTHER,
          TokenKind.NONTOKEN,
          TokenKind.QUALIFIER,
          TokenKind.PLAYER_POSS,
          TokenKind.NUMBER,
          TokenKind.NUMBER_WORD);

  private static final Set<TokenKind> SHARED_COUNTER_TYPES =
      EnumSet.of(TokenKind.OBJ_SUBTYPE, TokenKind.KEYWORD_ABILITY);

  private static final Set<TokenKind> HEADS =
      EnumSet.of(TokenKind.OBJ_TYPE, TokenKind.OBJ_SUBTYPE, TokenKind.SELF);

  @Override
  public Node subset(TokenCursor cursor) throws CompilerException {
    List<Token> words = modifiers(cursor);
    if (!atAny(cursor, HEADS)) {
      throw cursor.error("expected an object description");
    }
    while (atAny(cursor, HEADS)) {
      words.add(cursor.advance());
    }
    return Nodes.subset(words);
  }

  @Override
  public Node zoneSubset(TokenCursor cursor) throws CompilerException {
    List<Token> words = modifiers(cursor);
    if (!cursor.peek().map(t -> t.kind().isZone()).orElse(false)) {
      throw cursor.error("expected a zone");
    }
    Token zone = cursor.advance();
    words.add(zone);
    if (zone.is(TokenKind.COMMAND)) {
      cursor.accept(TokenKind.ZONE).ifPresent(words::add);
    } else if (zone.is(TokenKind.OUTSIDE) && cursor.at(TokenKind.DETERMINER)) {
      words.add(cursor.advance());
      words.add(cursor.expect(TokenKind.GAME, TokenKind.SUBGAME));
    }
    return Nodes.zoneSubset(words);
  }

  @Override
  public boolean startsZoneSubset(TokenCursor cursor) {
    int ahead = 0;
    while (cursor.peek(ahead).map(t -> MODIFIERS.contains(t.kind())).orElse(false)) {
      ahead++;
    }
    return cursor.peek(ahead).map(t -> t.kind().isZone()).orElse(false);
  }

  @Override
  public Node keywordReference(TokenCursor cursor) throws CompilerException {
    return Nodes.keywordReference(cursor.expect(TokenKind.KEYWORD_ABILITY));
  }

  @Override
  public boolean startsKeywordReference(TokenCursor cursor) {
    return cursor.at(TokenKind.KEYWORD_ABILITY);
  }

  @Override
  public Node hasCounters(TokenCursor cursor) throws CompilerException {
    Token numeral =
        cursor.expect(TokenKind.NUMBER, TokenKind.NUMBER_WORD, TokenKind.A, TokenKind.NO);

    Node.CounterCount.Comparison comparison;
    if (cursor.accept(TokenKind.OR).isPresent()) {
      Token bound = cursor.expect(TokenKind.MORE, TokenKind.FEWER);
      comparison =
          bound.is(TokenKind.MORE)
              ? Node.CounterCount.Comparison.OR_MORE
              : Node.CounterCount.Comparison.OR_FEWER;
    } else if (numeral.is(TokenKind.A)) {
      // "has a counter on it" holds with any positive number of counters.
      comparison = Node.CounterCount.Comparison.OR_MORE;
    } else {
      comparison = Node.CounterCount.Comparison.EXACTLY;
    }

    Optional<String> counterType = Optional.empty();
    if (startsCounterType(cursor, 0)) {
      counterType = Optional.of(cursor.advance().text());
    }
    Token last = cursor.expect(TokenKind.COUNTER);
    if (cursor.accept(TokenKind.ON).isPresent()) {
      last = cursor.expect(TokenKind.SELF);
    }
    return Nodes.counterCount(Nodes.number(numeral), comparison, counterType, last.endPos());
  }

  @Override
  public boolean startsHasCounters(TokenCursor cursor) {
    boolean numeral = cursor.peek().map(t -> t.kind().isNumeral()).orElse(false);
    return numeral
        && (cursor.peekIs(1, TokenKind.COUNTER)
            || startsCounterType(cursor, 1)
            || cursor.peekIs(1, TokenKind.OR));
  }

  private static boolean startsCounterType(TokenCursor cursor, int ahead) {
    if (cursor.peekIs(ahead, TokenKind.COUNTER_TYPE)) return true;
    return cursor.peek(ahead).map(t -> SHARED_COUNTER_TYPES.contains(t.kind())).orElse(false)
        && cursor.peekIs(ahead + 1, TokenKind.COUNTER);
  }

  private static List<Token> modifiers(TokenCursor cursor) {
    List<Token> words = new ArrayList<>();
    while (atAny(cursor, MODIFIERS)) {
      words.add(cursor.advance());
    }
    return words;
  }

  private static boolean atAny(TokenCursor cursor, Set<TokenKind> kinds) {
    return cursor.peek().map(t -> kinds.contains(t.kind())).orElse(false);
  }
}

package rtc;

import java.util.EnumSet;
import java.util.Set;

/** Terminal symbols produced by the {@link Tokenizer}. */
public enum TokenKind {
  // Verbs and particles of the trigger grammar.
  ENTER,
  IS,
  ARE,
  PUT,
  INTO,
  ONTO,
  FROM,
  ANYWHERE,
  LEAVE,
  DIE,
  PHASE,
  IN,
  OUT,
  HAS,

  // Zones
  BATTLEFIELD,
  COMMAND,
  EXILE,
  GRAVEYARD,
  HAND,
  LIBRARY,
  STACK,
  ZONE,
  DECK,
  SIDEBOARD,
  GAME,
  SUBGAME,
  OUTSIDE,

  // Object descriptions
  A,
  DETERMINER,
  PLAYER_POSS,
  OTHER,
  NONTOKEN,
  // Supertypes, colors and combat status: "legendary", "green", "attacking".
  QUALIFIER,
  OBJ_TYPE,
  OBJ_SUBTYPE,
  SELF,

  // Counters
  NUMBER,
  NUMBER_WORD,
  NO,
  OR,
  MORE,
  FEWER,
  COUNTER_TYPE,
  COUNTER,
  ON,

  KEYWORD_ABILITY,

  COMMA,
  PERIOD,

  // Anything the keyword table does not know.
  WORD;

  private static final Set<TokenKind> ZONES =
      EnumSet.of(
          BATTLEFIELD,
          COMMAND,
          EXILE,
          GRAVEYARD,
          HAND,
          LIBRARY,
          STACK,
          ZONE,
          DECK,
          SIDEBOARD,
          GAME,
          SUBGAME,
          OUTSIDE);

  private static final Set<TokenKind> NUMERALS = EnumSet.of(NUMBER, NUMBER_WORD, A, NO);

  public boolean isZone() {
    return ZONES.contains(this);
  }

  /** True for tokens that carry a count: digits, number words, "a"/"an" and "no". */
  public boolean isNumeral() {
    return NUMERALS.contains(this);
  }

  public boolean isPunctuation() {
    return this == COMMA || this == PERIOD;
  }
}

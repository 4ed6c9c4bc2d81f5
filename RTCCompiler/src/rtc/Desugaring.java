package rtc;

import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Shorthand verbs and the canonical trees they stand for. An expansion depends only on the
 * shorthand itself: the synthetic nodes take the shorthand token's span and nothing else.
 */
public final class Desugaring {

  @FunctionalInterface
  public interface Expansion {
    Node expand(Token shorthand);
  }

  private static final ImmutableMap<TokenKind, Expansion> SHORTHANDS =
      ImmutableMap.of(TokenKind.DIE, Desugaring::dies);

  public static boolean isShorthand(TokenKind kind) {
    return SHORTHANDS.containsKey(kind);
  }

  public static Node expand(Token shorthand) {
    Expansion expansion = SHORTHANDS.get(shorthand.kind());
    Preconditions.checkArgument(expansion != null, "not a shorthand: %s", shorthand);
    return expansion.expand(shorthand);
  }

  // "dies" means "is put into a graveyard from the battlefield":
  // ENTER(ZONE_SET(NUMBER=1, GRAVEYARD), FROM(BATTLEFIELD))
  private static Node dies(Token die) {
    return Nodes.enter(
        Nodes.zoneSet(Nodes.number(1, die), Nodes.graveyard(die)),
        Optional.of(Nodes.from(Nodes.battlefield(die), die.pos())),
        die.pos());
  }

  private Desugaring() {}
}

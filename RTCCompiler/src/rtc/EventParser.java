package rtc;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Parses event clauses:
 *
 * <pre>
 * event         : zone_transfer | PHASE (IN | OUT) -> ^(PHASE IN|OUT)
 * zone_transfer : (ENTER | (IS | ARE) PUT (INTO | ONTO)) zone_subset
 *                     (FROM (zone_subset | ANYWHERE))?
 *                     -> ^(ENTER zone_subset ^(FROM zone_subset|ANYWHERE)?)
 *               | LEAVE zone_subset -> ^(LEAVE zone_subset)
 *               | DIE -> ^(ENTER ^(ZONE_SET NUMBER[1] GRAVEYARD) ^(FROM BATTLEFIELD))
 * </pre>
 *
 * The zone transfer alternatives are tried in the order above.
 */
final class EventParser {
  private static final Set<TokenKind> FIRST =
      EnumSet.of(
          TokenKind.ENTER,
          TokenKind.IS,
          TokenKind.ARE,
          TokenKind.LEAVE,
          TokenKind.DIE,
          TokenKind.PHASE);

  private final Selectors selectors;

  EventParser(Selectors selectors) {
    this.selectors = selectors;
  }

  static boolean startsEvent(TokenCursor cursor) {
    return cursor.peek().map(t -> FIRST.contains(t.kind())).orElse(false);
  }

  Node.Event parse(TokenCursor cursor) throws CompilerException {
    if (cursor.at(TokenKind.PHASE)) {
      return Nodes.event(phase(cursor));
    }
    return Nodes.event(zoneTransfer(cursor));
  }

  private Node zoneTransfer(TokenCursor cursor) throws CompilerException {
    if (startsDestination(cursor)) {
      return destination(cursor);
    } else if (cursor.at(TokenKind.LEAVE)) {
      Token leave = cursor.advance();
      return Nodes.leave(selectors.zoneSubset(cursor), leave.pos());
    } else if (cursor.peek().map(t -> Desugaring.isShorthand(t.kind())).orElse(false)) {
      return Desugaring.expand(cursor.advance());
    }
    throw cursor.error("expected a zone change");
  }

  private static boolean startsDestination(TokenCursor cursor) {
    return cursor.at(TokenKind.ENTER) || cursor.at(TokenKind.IS) || cursor.at(TokenKind.ARE);
  }

  private Node destination(TokenCursor cursor) throws CompilerException {
    Token first = cursor.advance();
    if (!first.is(TokenKind.ENTER)) {
      cursor.expect(TokenKind.PUT);
      cursor.expect(TokenKind.INTO, TokenKind.ONTO);
    }
    Node destination = selectors.zoneSubset(cursor);

    Optional<Node.From> from = Optional.empty();
    Optional<Token> fromToken = cursor.accept(TokenKind.FROM);
    if (fromToken.isPresent()) {
      Optional<Token> anywhere = cursor.accept(TokenKind.ANYWHERE);
      Node source =
          anywhere.isPresent()
              ? Nodes.anywhere(anywhere.get())
              : selectors.zoneSubset(cursor);
      from = Optional.of(Nodes.from(source, fromToken.get().pos()));
    }
    return Nodes.enter(destination, from, first.pos());
  }

  private static Node phase(TokenCursor cursor) throws CompilerException {
    Token phase = cursor.expect(TokenKind.PHASE);
    Token direction = cursor.expect(TokenKind.IN, TokenKind.OUT);
    return Nodes.phase(phase, direction);
  }
}

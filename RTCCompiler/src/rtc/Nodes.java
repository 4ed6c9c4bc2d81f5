package rtc;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Builds tree nodes with the child order each grammar rule fixes, and materializes the synthetic
 * terminals that have no token of their own. Checks shape only, never content.
 */
public final class Nodes {

  public static Node.Trigger trigger(Node subject, Node body) {
    return new Node.Trigger(subject, body);
  }

  public static Node.Event event(Node event) {
    return new Node.Event(event);
  }

  public static Node.Condition condition(Node condition, Tokenizer.Pos pos) {
    return new Node.Condition(condition, pos);
  }

  public static Node.Enter enter(Node destination, Optional<Node.From> from, Tokenizer.Pos pos) {
    return new Node.Enter(destination, from, pos);
  }

  public static Node.Leave leave(Node zone, Tokenizer.Pos pos) {
    return new Node.Leave(zone, pos);
  }

  public static Node.From from(Node source, Tokenizer.Pos pos) {
    return new Node.From(source, pos);
  }

  /** PHASE(IN) or PHASE(OUT); the phase keyword contributes its position only. */
  public static Node.Phase phase(Token phase, Token direction) {
    return new Node.Phase(direction(direction), phase.pos());
  }

  public static Node.Has has(Node keyword, Tokenizer.Pos pos) {
    return new Node.Has(keyword, pos);
  }

  public static Node.ZoneSet zoneSet(Node.NumberLiteral count, Node zone) {
    return new Node.ZoneSet(count, zone);
  }

  public static Node.NumberLiteral number(int value, Tokenizer.Pos pos) {
    return new Node.NumberLiteral(value, pos, pos);
  }

  /** A synthetic number spanning the token it was expanded from. */
  public static Node.NumberLiteral number(int value, Token origin) {
    return new Node.NumberLiteral(value, origin.pos(), origin.endPos());
  }

  /** A number read from a numeral token. */
  public static Node.NumberLiteral number(Token numeral) {
    return number(
        numeral
            .value()
            .orElseThrow(() -> new IllegalArgumentException("not a numeral: " + numeral)),
        numeral);
  }

  public static Node.Marker anywhere(Tokenizer.Pos pos) {
    return new Node.Marker(Node.Kind.ANYWHERE, pos, pos);
  }

  public static Node.Marker anywhere(Token origin) {
    return marker(Node.Kind.ANYWHERE, origin);
  }

  public static Node.Marker battlefield(Tokenizer.Pos pos) {
    return new Node.Marker(Node.Kind.BATTLEFIELD, pos, pos);
  }

  public static Node.Marker battlefield(Token origin) {
    return marker(Node.Kind.BATTLEFIELD, origin);
  }

  public static Node.Marker graveyard(Tokenizer.Pos pos) {
    return new Node.Marker(Node.Kind.GRAVEYARD, pos, pos);
  }

  public static Node.Marker graveyard(Token origin) {
    return marker(Node.Kind.GRAVEYARD, origin);
  }

  private static Node.Marker marker(Node.Kind kind, Token origin) {
    return new Node.Marker(kind, origin.pos(), origin.endPos());
  }

  private static Node.Marker direction(Token direction) {
    switch (direction.kind()) {
      case IN:
        return marker(Node.Kind.IN, direction);
      case OUT:
        return marker(Node.Kind.OUT, direction);
      default:
        throw new IllegalArgumentException("not a phasing direction: " + direction);
    }
  }

  public static Node.Subset subset(List<Token> words) {
    return new Node.Subset(ImmutableList.copyOf(words));
  }

  public static Node.ZoneSubset zoneSubset(List<Token> words) {
    return new Node.ZoneSubset(ImmutableList.copyOf(words));
  }

  public static Node.KeywordReference keywordReference(Token keyword) {
    return new Node.KeywordReference(keyword);
  }

  public static Node.CounterCount counterCount(
      Node.NumberLiteral count,
      Node.CounterCount.Comparison comparison,
      Optional<String> counterType) {
    return counterCount(count, comparison, counterType, count.endPos());
  }

  /** A counter count whose clause runs on to {@code endPos}, past the count itself. */
  public static Node.CounterCount counterCount(
      Node.NumberLiteral count,
      Node.CounterCount.Comparison comparison,
      Optional<String> counterType,
      Tokenizer.Pos endPos) {
    return new Node.CounterCount(count, comparison, counterType, endPos);
  }

  private Nodes() {}
}

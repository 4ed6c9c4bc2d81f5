package rtc;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import rtc.processor.ASTChild;
import rtc.processor.ASTNode;

/**
 * A node of a trigger tree. The set of node classes is closed: every class below is an
 * {@link ASTNode}, so an {@link ASTVisitor} must handle each of them.
 *
 * <p>Nodes are immutable and never reference their parent. Child order is fixed per node class
 * and is part of the tree's meaning. Use {@link Nodes} to build them.
 */
public abstract class Node implements ASTNodeInterface {

  public enum Kind {
    TRIGGER,
    EVENT,
    CONDITION,

    // Events
    ENTER,
    LEAVE,
    FROM,
    PHASE,

    // Conditions
    HAS,

    // Synthetic terminals
    ZONE_SET,
    NUMBER,
    ANYWHERE,
    BATTLEFIELD,
    GRAVEYARD,
    IN,
    OUT,

    // Produced by the selector productions, opaque to the trigger grammar.
    SUBSET,
    ZONE_SUBSET,
    KEYWORD_REF,
    COUNTER_COUNT;

    private static final Set<Kind> MARKERS = EnumSet.of(ANYWHERE, BATTLEFIELD, GRAVEYARD, IN, OUT);
    private static final Set<Kind> EVENTS = EnumSet.of(ENTER, LEAVE, PHASE);
    private static final Set<Kind> ORIGINS =
        EnumSet.of(ZONE_SUBSET, ZONE_SET, ANYWHERE, BATTLEFIELD);

    public boolean isMarker() {
      return MARKERS.contains(this);
    }

    public boolean isEventBody() {
      return EVENTS.contains(this);
    }

    public boolean isTriggerBody() {
      return this == EVENT || this == CONDITION;
    }

    /** Kinds a FROM node may hold: a zone selection or the ANYWHERE and BATTLEFIELD markers. */
    public boolean isOrigin() {
      return ORIGINS.contains(this);
    }
  }

  private final Kind kind;
  private final Tokenizer.Pos pos;
  private final Tokenizer.Pos endPos;

  protected Node(Kind kind, Tokenizer.Pos pos, Tokenizer.Pos endPos) {
    this.kind = kind;
    this.pos = pos;
    this.endPos = endPos;
  }

  public Kind kind() {
    return kind;
  }

  public boolean is(Kind kind) {
    return this.kind == kind;
  }

  /** Where the text this node was built from starts; internal for fully synthetic nodes. */
  public Tokenizer.Pos pos() {
    return pos;
  }

  /** Where that text ends. Synthetic nodes span the token they were expanded from. */
  public Tokenizer.Pos endPos() {
    return endPos;
  }

  public abstract ImmutableList<Node> children();

  /** Literal content of terminal nodes, such as a number's value or a selector's words. */
  public Optional<String> payload() {
    return Optional.empty();
  }

  @Override
  public String toString() {
    return TreePrinter.print(this);
  }

  private static void checkNotTriggerPart(Node node, String role) {
    Preconditions.checkArgument(
        !node.is(Kind.TRIGGER) && !node.kind().isTriggerBody(),
        "%s cannot be a %s node",
        role,
        node.kind());
  }

  private static Tokenizer.Pos firstPos(ImmutableList<Token> words) {
    Preconditions.checkArgument(!words.isEmpty(), "selector without words");
    return words.get(0).pos();
  }

  private static Tokenizer.Pos lastEndPos(ImmutableList<Token> words) {
    return words.get(words.size() - 1).endPos();
  }

  @ASTNode
  public static final class Trigger extends Node implements Node_Trigger_ASTNode {
    private final Node subject;
    private final Node body;

    Trigger(Node subject, Node body) {
      super(Kind.TRIGGER, subject.pos(), body.endPos());
      checkNotTriggerPart(subject, "trigger subject");
      Preconditions.checkArgument(
          body.kind().isTriggerBody(), "trigger body must be EVENT or CONDITION: %s", body.kind());
      this.subject = subject;
      this.body = body;
    }

    /** The leading subset or zone-subset. */
    @ASTChild
    @Override
    public Node subject() {
      return subject;
    }

    /** Either an {@link Event} or a {@link Condition}. */
    @ASTChild
    @Override
    public Node body() {
      return body;
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of(subject, body);
    }
  }

  @ASTNode
  public static final class Event extends Node implements Node_Event_ASTNode {
    private final Node event;

    Event(Node event) {
      super(Kind.EVENT, event.pos(), event.endPos());
      Preconditions.checkArgument(event.kind().isEventBody(), "not an event: %s", event.kind());
      this.event = event;
    }

    @ASTChild
    @Override
    public Node event() {
      return event;
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of(event);
    }
  }

  @ASTNode
  public static final class Condition extends Node implements Node_Condition_ASTNode {
    private final Node condition;

    Condition(Node condition, Tokenizer.Pos pos) {
      super(Kind.CONDITION, pos, condition.endPos());
      checkNotTriggerPart(condition, "condition");
      this.condition = condition;
    }

    /** A {@link Has} node, or the counter-count subtree exactly as its production built it. */
    @ASTChild
    @Override
    public Node condition() {
      return condition;
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of(condition);
    }
  }

  @ASTNode
  public static final class Enter extends Node implements Node_Enter_ASTNode {
    private final Node destination;
    private final Optional<From> from;

    Enter(Node destination, Optional<From> from, Tokenizer.Pos pos) {
      super(Kind.ENTER, pos, from.map(Node::endPos).orElse(destination.endPos()));
      checkNotTriggerPart(destination, "destination");
      Preconditions.checkArgument(!destination.is(Kind.FROM), "destination cannot be FROM");
      this.destination = destination;
      this.from = from;
    }

    @ASTChild
    @Override
    public Node destination() {
      return destination;
    }

    /** Absent when the clause names no origin. */
    @ASTChild
    @Override
    public Optional<From> from() {
      return from;
    }

    @Override
    public ImmutableList<Node> children() {
      return from.isPresent()
          ? ImmutableList.of(destination, from.get())
          : ImmutableList.of(destination);
    }
  }

  @ASTNode
  public static final class Leave extends Node implements Node_Leave_ASTNode {
    private final Node zone;

    Leave(Node zone, Tokenizer.Pos pos) {
      super(Kind.LEAVE, pos, zone.endPos());
      checkNotTriggerPart(zone, "left zone");
      this.zone = zone;
    }

    @ASTChild
    @Override
    public Node zone() {
      return zone;
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of(zone);
    }
  }

  @ASTNode
  public static final class From extends Node implements Node_From_ASTNode {
    private final Node source;

    From(Node source, Tokenizer.Pos pos) {
      super(Kind.FROM, pos, source.endPos());
      Preconditions.checkArgument(
          source.kind().isOrigin(), "origin cannot be a %s node", source.kind());
      this.source = source;
    }

    /** A zone-subset, or one of the ANYWHERE and BATTLEFIELD markers. */
    @ASTChild
    @Override
    public Node source() {
      return source;
    }

    public boolean isAnywhere() {
      return source.is(Kind.ANYWHERE);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of(source);
    }
  }

  @ASTNode
  public static final class Phase extends Node implements Node_Phase_ASTNode {
    private final Marker direction;

    Phase(Marker direction, Tokenizer.Pos pos) {
      super(Kind.PHASE, pos, direction.endPos());
      Preconditions.checkArgument(
          direction.is(Kind.IN) || direction.is(Kind.OUT),
          "phasing direction must be IN or OUT: %s",
          direction.kind());
      this.direction = direction;
    }

    @ASTChild
    @Override
    public Marker direction() {
      return direction;
    }

    public boolean phasesIn() {
      return direction.is(Kind.IN);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of(direction);
    }
  }

  @ASTNode
  public static final class Has extends Node implements Node_Has_ASTNode {
    private final Node keyword;

    Has(Node keyword, Tokenizer.Pos pos) {
      super(Kind.HAS, pos, keyword.endPos());
      checkNotTriggerPart(keyword, "keyword reference");
      this.keyword = keyword;
    }

    @ASTChild
    @Override
    public Node keyword() {
      return keyword;
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of(keyword);
    }
  }

  @ASTNode
  public static final class ZoneSet extends Node implements Node_ZoneSet_ASTNode {
    private final NumberLiteral count;
    private final Node zone;

    ZoneSet(NumberLiteral count, Node zone) {
      super(Kind.ZONE_SET, count.pos(), zone.endPos());
      this.count = count;
      this.zone = zone;
    }

    @ASTChild
    @Override
    public NumberLiteral count() {
      return count;
    }

    @ASTChild
    @Override
    public Node zone() {
      return zone;
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of(count, zone);
    }
  }

  @ASTNode
  public static final class NumberLiteral extends Node implements Node_NumberLiteral_ASTNode {
    private final int value;

    NumberLiteral(int value, Tokenizer.Pos pos, Tokenizer.Pos endPos) {
      super(Kind.NUMBER, pos, endPos);
      this.value = value;
    }

    public int value() {
      return value;
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public Optional<String> payload() {
      return Optional.of(Integer.toString(value));
    }
  }

  // ANYWHERE, BATTLEFIELD, GRAVEYARD, IN and OUT.
  @ASTNode
  public static final class Marker extends Node implements Node_Marker_ASTNode {
    Marker(Kind kind, Tokenizer.Pos pos, Tokenizer.Pos endPos) {
      super(kind, pos, endPos);
      Preconditions.checkArgument(kind.isMarker(), "not a marker kind: %s", kind);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }
  }

  @ASTNode
  public static final class Subset extends Node implements Node_Subset_ASTNode {
    private final ImmutableList<Token> words;

    Subset(ImmutableList<Token> words) {
      super(Kind.SUBSET, firstPos(words), lastEndPos(words));
      this.words = words;
    }

    public ImmutableList<Token> words() {
      return words;
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public Optional<String> payload() {
      return Optional.of(Joiner.on(' ').join(words));
    }
  }

  @ASTNode
  public static final class ZoneSubset extends Node implements Node_ZoneSubset_ASTNode {
    private final ImmutableList<Token> words;

    ZoneSubset(ImmutableList<Token> words) {
      super(Kind.ZONE_SUBSET, firstPos(words), lastEndPos(words));
      this.words = words;
    }

    public ImmutableList<Token> words() {
      return words;
    }

    /** The last word, which names the zone ("command zone" ends in "zone"). */
    public Token zone() {
      return words.get(words.size() - 1);
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public Optional<String> payload() {
      return Optional.of(Joiner.on(' ').join(words));
    }
  }

  @ASTNode
  public static final class KeywordReference extends Node
      implements Node_KeywordReference_ASTNode {
    private final Token keyword;

    KeywordReference(Token keyword) {
      super(Kind.KEYWORD_REF, keyword.pos(), keyword.endPos());
      this.keyword = keyword;
    }

    public Token keyword() {
      return keyword;
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of();
    }

    @Override
    public Optional<String> payload() {
      return Optional.of(keyword.text());
    }
  }

  @ASTNode
  public static final class CounterCount extends Node implements Node_CounterCount_ASTNode {
    public enum Comparison {
      EXACTLY,
      OR_MORE,
      OR_FEWER;
    }

    private final NumberLiteral count;
    private final Comparison comparison;
    private final Optional<String> counterType;

    CounterCount(
        NumberLiteral count,
        Comparison comparison,
        Optional<String> counterType,
        Tokenizer.Pos endPos) {
      super(Kind.COUNTER_COUNT, count.pos(), endPos);
      this.count = count;
      this.comparison = comparison;
      this.counterType = counterType;
    }

    @ASTChild
    @Override
    public NumberLiteral count() {
      return count;
    }

    public Comparison comparison() {
      return comparison;
    }

    /** Absent for "counters" of any type. */
    public Optional<String> counterType() {
      return counterType;
    }

    @Override
    public ImmutableList<Node> children() {
      return ImmutableList.of(count);
    }

    @Override
    public Optional<String> payload() {
      return Optional.of(
          counterType.isPresent()
              ? comparison.name() + " " + counterType.get()
              : comparison.name());
    }
  }
}

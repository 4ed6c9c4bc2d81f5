package rtc;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class TriggerParserTest {

  private static final String DIES_EVENT =
      "(EVENT (ENTER (ZONE_SET (NUMBER 1) GRAVEYARD) (FROM BATTLEFIELD)))";

  private static ImmutableList<Token> tokens(String clause) throws CompilerException {
    ImmutableList<ImmutableList<Token>> clauses = new Tokenizer("test", clause).tokenize();
    assertThat(clauses).hasSize(1);
    return clauses.get(0);
  }

  private static Node.Trigger parse(String clause) throws CompilerException {
    return new TriggerParser(new BasicSelectors()).parseClause(tokens(clause));
  }

  private static void assertParses(String clause, String tree) throws CompilerException {
    assertThat(parse(clause).toString()).isEqualTo(tree);
  }

  private static SyntaxException assertSyntaxError(String errorSubstr, String clause) {
    SyntaxException ex = assertThrows(SyntaxException.class, () -> parse(clause));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
    return ex;
  }

  @Test
  public void enters() throws CompilerException {
    assertParses(
        "~ enters the battlefield",
        "(TRIGGER (SUBSET ~) (EVENT (ENTER (ZONE_SUBSET the battlefield))))");
    assertParses(
        "another creature enters the battlefield.",
        "(TRIGGER (SUBSET another creature) (EVENT (ENTER (ZONE_SUBSET the battlefield))))");
  }

  @Test
  public void enterWithoutOriginHasNoFromChild() throws CompilerException {
    for (String clause :
        ImmutableList.of(
            "~ enters the battlefield",
            "a creature is put into a graveyard",
            "creatures are put onto the battlefield")) {
      Node.Event event = (Node.Event) parse(clause).body();
      Node.Enter enter = (Node.Enter) event.event();

      assertThat(enter.from()).isEmpty();
      assertThat(enter.children()).hasSize(1);
      assertThat(enter.children().get(0).kind()).isEqualTo(Node.Kind.ZONE_SUBSET);
    }
  }

  @Test
  public void putIntoAndOnto() throws CompilerException {
    assertParses(
        "a creature is put into a graveyard from anywhere",
        "(TRIGGER (SUBSET a creature) "
            + "(EVENT (ENTER (ZONE_SUBSET a graveyard) (FROM ANYWHERE))))");
    assertParses(
        "target creatures are put onto the battlefield from your hand",
        "(TRIGGER (SUBSET target creatures) "
            + "(EVENT (ENTER (ZONE_SUBSET the battlefield) (FROM (ZONE_SUBSET your hand)))))");
    assertParses(
        "~ is put into exile from the stack",
        "(TRIGGER (SUBSET ~) "
            + "(EVENT (ENTER (ZONE_SUBSET exile) (FROM (ZONE_SUBSET the stack)))))");
  }

  @Test
  public void fromAnywhereHoldsOnlyTheMarker() throws CompilerException {
    for (String clause :
        ImmutableList.of(
            "~ enters the battlefield from anywhere",
            "a card is put into your graveyard from anywhere",
            "cards are put into a library from anywhere")) {
      Node.Enter enter = (Node.Enter) ((Node.Event) parse(clause).body()).event();
      Node.From from = enter.from().get();

      assertThat(from.isAnywhere()).isTrue();
      assertThat(from.children()).hasSize(1);
      assertThat(from.source().kind()).isEqualTo(Node.Kind.ANYWHERE);
      assertThat(from.source().children()).isEmpty();
    }
  }

  @Test
  public void leaves() throws CompilerException {
    assertParses(
        "a nontoken creature leaves the battlefield",
        "(TRIGGER (SUBSET a nontoken creature) (EVENT (LEAVE (ZONE_SUBSET the battlefield))))");
    assertParses(
        "~ leaves your graveyard",
        "(TRIGGER (SUBSET ~) (EVENT (LEAVE (ZONE_SUBSET your graveyard))))");
  }

  @Test
  public void diesIsAlwaysTheSameEnter() throws CompilerException {
    for (String subject :
        ImmutableList.of(
            "~", "this creature", "another goblin", "a nontoken creature", "two zombies")) {
      Node.Trigger trigger = parse(subject + " dies");

      assertThat(trigger.subject().payload()).hasValue(subject);
      assertThat(trigger.body().toString()).isEqualTo(DIES_EVENT);
    }
  }

  @Test
  public void diesAndEntersAreBothEnterEvents() throws CompilerException {
    for (String clause : ImmutableList.of("~ enters the battlefield", "~ dies")) {
      Node.Trigger trigger = parse(clause);

      assertThat(trigger.children()).hasSize(2);
      assertThat(trigger.body().kind()).isEqualTo(Node.Kind.EVENT);
      assertThat(((Node.Event) trigger.body()).event().kind()).isEqualTo(Node.Kind.ENTER);
    }
  }

  @Test
  public void phases() throws CompilerException {
    assertParses("~ phases in", "(TRIGGER (SUBSET ~) (EVENT (PHASE IN)))");
    assertParses("~ phases out.", "(TRIGGER (SUBSET ~) (EVENT (PHASE OUT)))");

    Node.Phase phase = (Node.Phase) ((Node.Event) parse("~ phases out").body()).event();
    assertThat(phase.phasesIn()).isFalse();
    assertThat(phase.children()).containsExactly(phase.direction());
    assertThat(phase.direction().kind()).isEqualTo(Node.Kind.OUT);
  }

  @Test
  public void hasKeyword() throws CompilerException {
    assertParses(
        "enchanted creature has flying",
        "(TRIGGER (SUBSET enchanted creature) (CONDITION (HAS (KEYWORD_REF flying))))");
    assertParses(
        "~ has first strike",
        "(TRIGGER (SUBSET ~) (CONDITION (HAS (KEYWORD_REF first strike))))");
  }

  @Test
  public void hasCountersIsNotWrappedInHas() throws CompilerException {
    assertParses(
        "~ has three or more charge counters on it",
        "(TRIGGER (SUBSET ~) (CONDITION (COUNTER_COUNT OR_MORE charge (NUMBER 3))))");
    assertParses(
        "~ has a +1/+1 counter on it",
        "(TRIGGER (SUBSET ~) (CONDITION (COUNTER_COUNT OR_MORE +1/+1 (NUMBER 1))))");
    assertParses(
        "~ has no counters on it",
        "(TRIGGER (SUBSET ~) (CONDITION (COUNTER_COUNT EXACTLY (NUMBER 0))))");

    Node.Condition condition = (Node.Condition) parse("~ has 2 time counters").body();
    assertThat(condition.condition().kind()).isEqualTo(Node.Kind.COUNTER_COUNT);
  }

  @Test
  public void wholeVocabulary() throws CompilerException {
    assertParses("a sliver dies", "(TRIGGER (SUBSET a sliver) " + DIES_EVENT + ")");
    assertParses(
        "a legendary creature dies", "(TRIGGER (SUBSET a legendary creature) " + DIES_EVENT + ")");
    for (String ability : ImmutableList.of("horsemanship", "flanking", "bushido")) {
      assertParses(
          "~ has " + ability,
          "(TRIGGER (SUBSET ~) (CONDITION (HAS (KEYWORD_REF " + ability + "))))");
    }
    assertParses(
        "a creature is put into your sideboard",
        "(TRIGGER (SUBSET a creature) (EVENT (ENTER (ZONE_SUBSET your sideboard))))");
    assertParses(
        "a card is put into your hand from outside the game",
        "(TRIGGER (SUBSET a card) (EVENT (ENTER (ZONE_SUBSET your hand) "
            + "(FROM (ZONE_SUBSET outside the game)))))");
  }

  @Test
  public void sharedCounterTypesInConditions() throws CompilerException {
    assertParses(
        "~ has a mine counter on it",
        "(TRIGGER (SUBSET ~) (CONDITION (COUNTER_COUNT OR_MORE mine (NUMBER 1))))");
    assertParses(
        "~ has echo", "(TRIGGER (SUBSET ~) (CONDITION (HAS (KEYWORD_REF echo))))");
    assertParses(
        "~ has two echo counters",
        "(TRIGGER (SUBSET ~) (CONDITION (COUNTER_COUNT EXACTLY echo (NUMBER 2))))");
  }

  @Test
  public void nodesSpanTheirText() throws CompilerException {
    Node.Trigger trigger = parse("~ has first   strike");
    Node.Has has = (Node.Has) ((Node.Condition) trigger.body()).condition();

    assertThat(has.keyword().pos()).isEqualTo(new Tokenizer.Pos("test", 0, 6));
    assertThat(has.keyword().endPos()).isEqualTo(new Tokenizer.Pos("test", 0, 20));
    assertThat(has.endPos()).isEqualTo(has.keyword().endPos());
    assertThat(trigger.pos()).isEqualTo(new Tokenizer.Pos("test", 0, 0));
    assertThat(trigger.endPos()).isEqualTo(new Tokenizer.Pos("test", 0, 20));

    trigger = parse("a creature is put into a graveyard from the battlefield");
    Node.Enter enter = (Node.Enter) ((Node.Event) trigger.body()).event();
    assertThat(enter.pos()).isEqualTo(new Tokenizer.Pos("test", 0, 11));
    assertThat(enter.destination().endPos()).isEqualTo(new Tokenizer.Pos("test", 0, 34));
    assertThat(trigger.endPos()).isEqualTo(new Tokenizer.Pos("test", 0, 55));
  }

  @Test
  public void zoneSubsetSubject() throws CompilerException {
    Node.Trigger trigger = parse("your graveyard has no counters");

    assertThat(trigger.subject().kind()).isEqualTo(Node.Kind.ZONE_SUBSET);
    assertThat(trigger.subject().payload()).hasValue("your graveyard");
  }

  @Test
  public void missingBranch() {
    SyntaxException ex = assertSyntaxError("expected an event or a condition", "this creature");
    assertThat(ex).hasMessageThat().contains("end of clause");
    assertThat(ex.pos()).isEqualTo(new Tokenizer.Pos("test", 0, 13));

    ex = assertSyntaxError("but found 'draws'", "this creature draws a card");
    assertThat(ex.pos()).isEqualTo(new Tokenizer.Pos("test", 0, 14));
  }

  @Test
  public void malformedBranches() {
    assertSyntaxError("expected put, but found 'tapped'", "~ is tapped");
    assertSyntaxError("expected into or onto", "~ is put in a graveyard");
    assertSyntaxError("expected in or out, but found end of clause", "~ phases");
    assertSyntaxError("expected in or out, but found 'away'", "~ phases away");
    assertSyntaxError("expected a keyword ability or counters", "~ has");
    assertSyntaxError("expected a keyword ability or counters", "~ has power");
    assertSyntaxError("expected end of clause, but found 'twice'", "~ dies twice");
  }

  @Test
  public void selectorErrorsPassThrough() {
    assertThrows(CompilerException.class, () -> parse("~ enters"));
    CompilerException ex =
        assertThrows(CompilerException.class, () -> parse("~ enters from anywhere"));
    assertThat(ex).hasMessageThat().contains("expected a zone");
  }

  @Test
  public void parseLeavesTrailingTokens() throws CompilerException {
    TokenCursor cursor = new TokenCursor(tokens("~ dies, draw a card"));
    Node.Trigger trigger = new TriggerParser(new BasicSelectors()).parse(cursor);

    assertThat(trigger.body().toString()).isEqualTo(DIES_EVENT);
    assertThat(cursor.at(TokenKind.COMMA)).isTrue();
  }

  @Test
  public void parsersShareNoState() throws Exception {
    TriggerParser parser = new TriggerParser(new BasicSelectors());
    ImmutableList<Token> dies = tokens("another creature dies");
    ImmutableList<Token> phases = tokens("~ phases out");

    List<String> trees =
        IntStream.range(0, 200)
            .parallel()
            .mapToObj(
                i -> {
                  try {
                    return parser.parseClause(i % 2 == 0 ? dies : phases).toString();
                  } catch (CompilerException ex) {
                    throw new AssertionError(ex);
                  }
                })
            .collect(Collectors.toList());

    assertThat(trees.stream().distinct().collect(Collectors.toList()))
        .containsExactly(
            "(TRIGGER (SUBSET another creature) " + DIES_EVENT + ")",
            "(TRIGGER (SUBSET ~) (EVENT (PHASE OUT)))");
  }
}

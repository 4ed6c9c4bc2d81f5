package rtc;

import static com.google.common.truth.Truth.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class TreeShapeValidatorTest {

  private static final Tokenizer.Pos POS = new Tokenizer.Pos("test", 0, 0);

  private static Node subject() {
    return Nodes.subset(ImmutableList.of(Token.create(TokenKind.SELF, "~", POS)));
  }

  private static Node.Event phaseOut(Tokenizer.Pos pos) {
    return Nodes.event(
        Nodes.phase(
            Token.create(TokenKind.PHASE, "phases", pos),
            Token.create(TokenKind.OUT, "out", pos.addColumns(7))));
  }

  // Wraps a foreign node the way a selector production could hand one back.
  private static Node smuggle(Node node) {
    return Nodes.zoneSet(Nodes.number(1, POS), node);
  }

  private static ImmutableList<String> errors(Node.Trigger trigger) {
    return TreeShapeValidator.validate(trigger).stream()
        .map(CompilerException::errorMsg)
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void parsedTreesAreValid() throws CompilerException {
    TriggerParser parser = new TriggerParser(new BasicSelectors());
    ImmutableList<ImmutableList<Token>> clauses =
        new Tokenizer(
                "test",
                "~ dies\n"
                    + "a creature is put into a graveyard from anywhere\n"
                    + "~ enters the battlefield from your hand\n"
                    + "~ has flying\n"
                    + "~ has two or more charge counters on it\n")
            .tokenize();

    for (ImmutableList<Token> clause : clauses) {
      assertThat(TreeShapeValidator.validate(parser.parseClause(clause))).isEmpty();
    }
  }

  @Test
  public void eventOutsideTheBody() {
    Tokenizer.Pos inner = new Tokenizer.Pos("test", 0, 10);
    Node.Trigger trigger =
        Nodes.trigger(subject(), Nodes.event(Nodes.leave(smuggle(phaseOut(inner)), POS)));

    ImmutableList<CompilerException> errors = TreeShapeValidator.validate(trigger);

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).errorMsg()).isEqualTo("EVENT outside of the trigger body");
    assertThat(errors.get(0).pos()).isEqualTo(inner);
  }

  @Test
  public void conditionOutsideTheBody() {
    Node condition =
        Nodes.condition(
            Nodes.keywordReference(Token.create(TokenKind.KEYWORD_ABILITY, "flying", POS)), POS);
    Node.Trigger trigger =
        Nodes.trigger(subject(), Nodes.event(Nodes.leave(smuggle(condition), POS)));

    assertThat(errors(trigger)).containsExactly("CONDITION outside of the trigger body");
  }

  @Test
  public void nestedTrigger() {
    Node.Trigger nested = Nodes.trigger(subject(), phaseOut(POS));
    Node.Trigger trigger = Nodes.trigger(smuggle(nested), phaseOut(POS));

    assertThat(errors(trigger))
        .containsExactly(
            "trigger nested inside another trigger", "EVENT outside of the trigger body")
        .inOrder();
  }

  @Test
  public void fromOutsideAnEnter() {
    Node.From stray = Nodes.from(Nodes.anywhere(POS), POS);
    Node.Trigger trigger =
        Nodes.trigger(subject(), Nodes.event(Nodes.leave(smuggle(stray), POS)));

    assertThat(errors(trigger)).containsExactly("FROM outside of an ENTER");
  }

  @Test
  public void fromUnderEnterIsFine() {
    Node.Trigger trigger =
        Nodes.trigger(
            subject(),
            Nodes.event(
                Nodes.enter(
                    smuggle(Nodes.graveyard(POS)),
                    Optional.of(Nodes.from(Nodes.battlefield(POS), POS)),
                    POS)));

    assertThat(errors(trigger)).isEmpty();
  }
}

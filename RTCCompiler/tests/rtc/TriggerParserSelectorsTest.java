package rtc;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

/** How the trigger grammar treats the subtrees and errors of its selector productions. */
public class TriggerParserSelectorsTest {

  private final StubSelectors selectors = new StubSelectors();

  private Node.Trigger parse(String clause) throws CompilerException {
    ImmutableList<Token> tokens = new Tokenizer("test", clause).tokenize().get(0);
    return new TriggerParser(selectors).parseClause(tokens);
  }

  @Test
  public void subjectIsParsedOnce() throws CompilerException {
    parse("goblin dies");
    assertThat(selectors.calls).containsExactly("subset");

    selectors.calls.clear();
    parse("goblin has flying");
    assertThat(selectors.calls).containsExactly("subset", "keywordReference").inOrder();

    selectors.calls.clear();
    selectors.zoneSubsetSubject = true;
    parse("graveyard leaves exile");
    assertThat(selectors.calls).containsExactly("zoneSubset", "zoneSubset").inOrder();
  }

  @Test
  public void subtreesAreAttachedUnchanged() throws CompilerException {
    Token word = Token.create(TokenKind.WORD, "x", new Tokenizer.Pos("test", 0, 0));
    Node subject = Nodes.subset(ImmutableList.of(word));
    Node zone = Nodes.zoneSet(Nodes.number(7, word.pos()), Nodes.graveyard(word.pos()));
    Node counters =
        Nodes.counterCount(
            Nodes.number(2, word.pos()), Node.CounterCount.Comparison.OR_FEWER, Optional.empty());
    selectors.subset = t -> subject;
    selectors.zoneSubset = t -> zone;
    selectors.hasCounters = t -> counters;

    Node.Trigger enters = parse("goblin enters somewhere");
    assertThat(enters.subject()).isSameInstanceAs(subject);
    Node.Enter enter = (Node.Enter) ((Node.Event) enters.body()).event();
    assertThat(enter.destination()).isSameInstanceAs(zone);

    Node.Trigger has = parse("goblin has two");
    assertThat(((Node.Condition) has.body()).condition()).isSameInstanceAs(counters);
  }

  @Test
  public void selectorExceptionsPropagateUnchanged() {
    CompilerException failure =
        new CompilerException(new Tokenizer.Pos("other", 3, 4), "no such zone");
    selectors.zoneSubset =
        t -> {
          throw failure;
        };

    CompilerException thrown =
        assertThrows(CompilerException.class, () -> parse("goblin enters nowhere"));
    assertThat(thrown).isSameInstanceAs(failure);

    thrown = assertThrows(CompilerException.class, () -> parse("goblin is put into nowhere"));
    assertThat(thrown).isSameInstanceAs(failure);
  }

  @Test
  public void dieNeedsNoSelectors() throws CompilerException {
    Node.Trigger trigger = parse("goblin dies");
    Node.Enter enter = (Node.Enter) ((Node.Event) trigger.body()).event();

    assertThat(enter.destination().kind()).isEqualTo(Node.Kind.ZONE_SET);
    assertThat(enter.from().get().source().kind()).isEqualTo(Node.Kind.BATTLEFIELD);
  }
}

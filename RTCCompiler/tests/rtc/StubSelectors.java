package rtc;

import java.util.ArrayList;
import java.util.List;

/**
 * Selectors that consume a single token per production and hand back preset subtrees, recording
 * which productions ran.
 */
class StubSelectors implements Selectors {

  interface Production {
    Node build(Token token) throws CompilerException;
  }

  final List<String> calls = new ArrayList<>();

  Production subset = t -> Nodes.subset(List.of(t));
  Production zoneSubset = t -> Nodes.zoneSubset(List.of(t));
  Production keywordReference = Nodes::keywordReference;
  Production hasCounters = t -> Nodes.number(t);

  boolean zoneSubsetSubject = false;

  private Node run(String name, Production production, TokenCursor cursor)
      throws CompilerException {
    calls.add(name);
    if (cursor.atEnd()) throw cursor.error("expected a " + name);
    return production.build(cursor.advance());
  }

  @Override
  public Node subset(TokenCursor cursor) throws CompilerException {
    return run("subset", subset, cursor);
  }

  @Override
  public Node zoneSubset(TokenCursor cursor) throws CompilerException {
    return run("zoneSubset", zoneSubset, cursor);
  }

  @Override
  public Node keywordReference(TokenCursor cursor) throws CompilerException {
    return run("keywordReference", keywordReference, cursor);
  }

  @Override
  public Node hasCounters(TokenCursor cursor) throws CompilerException {
    return run("hasCounters", hasCounters, cursor);
  }

  @Override
  public boolean startsZoneSubset(TokenCursor cursor) {
    return zoneSubsetSubject && cursor.index() == 0;
  }

  @Override
  public boolean startsKeywordReference(TokenCursor cursor) {
    return cursor.at(TokenKind.KEYWORD_ABILITY);
  }

  @Override
  public boolean startsHasCounters(TokenCursor cursor) {
    return cursor.peek().map(t -> t.kind().isNumeral()).orElse(false);
  }
}

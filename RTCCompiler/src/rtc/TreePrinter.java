package rtc;

/**
 * Renders a tree as an s-expression, e.g. {@code (TRIGGER (SUBSET ~) (EVENT (PHASE OUT)))}.
 * Terminals without a payload print as their bare kind.
 */
public final class TreePrinter implements ASTVisitor<StringBuilder> {

  private static final TreePrinter INSTANCE = new TreePrinter();

  public static String print(Node node) {
    return node.accept(INSTANCE, new StringBuilder()).toString();
  }

  private TreePrinter() {}

  private StringBuilder render(Node node, StringBuilder out) {
    if (node.children().isEmpty() && !node.payload().isPresent()) {
      return out.append(node.kind().name());
    }

    out.append('(').append(node.kind().name());
    node.payload().ifPresent(p -> out.append(' ').append(p));
    for (Node child : node.children()) {
      out.append(' ');
      child.accept(this, out);
    }
    return out.append(')');
  }

  @Override
  public StringBuilder visit(Node.Trigger node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.Event node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.Condition node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.Enter node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.Leave node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.From node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.Phase node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.Has node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.ZoneSet node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.NumberLiteral node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.Marker node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.Subset node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.ZoneSubset node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.KeywordReference node, StringBuilder value) {
    return render(node, value);
  }

  @Override
  public StringBuilder visit(Node.CounterCount node, StringBuilder value) {
    return render(node, value);
  }
}

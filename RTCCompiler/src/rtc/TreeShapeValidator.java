package rtc;

import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

/**
 * Checks a finished trigger tree against the structural rules that node constructors cannot see
 * locally: EVENT and CONDITION occur only as the body of the root TRIGGER, no TRIGGER is nested,
 * and FROM occurs only as the origin of an ENTER. Subtrees built by {@link Selectors} are walked
 * too, since the trigger grammar attaches them unexamined.
 */
public class TreeShapeValidator extends ErrorCollectingValidator {

  private final Node.Trigger root;
  private final Set<Node> origins = Sets.newIdentityHashSet();

  private TreeShapeValidator(Node.Trigger root) {
    this.root = root;
  }

  public static ImmutableList<CompilerException> validate(Node.Trigger trigger) {
    TreeShapeValidator validator = new TreeShapeValidator(trigger);
    trigger.accept(validator, null);
    return validator.errors();
  }

  @Override
  public void visitImpl(Node.Trigger trigger) {
    if (trigger != root) {
      logError(trigger.pos(), "trigger nested inside another trigger");
    }
    super.visitImpl(trigger);
  }

  @Override
  public void visitImpl(Node.Event event) {
    checkBody(event);
    super.visitImpl(event);
  }

  @Override
  public void visitImpl(Node.Condition condition) {
    checkBody(condition);
    super.visitImpl(condition);
  }

  @Override
  public void visitImpl(Node.Enter enter) {
    enter.from().ifPresent(origins::add);
    super.visitImpl(enter);
  }

  @Override
  public void visitImpl(Node.From from) {
    if (!origins.contains(from)) {
      logError(from.pos(), "FROM outside of an ENTER");
    }
    super.visitImpl(from);
  }

  private void checkBody(Node body) {
    if (body != root.body()) {
      logError(body.pos(), String.format("%s outside of the trigger body", body.kind()));
    }
  }
}

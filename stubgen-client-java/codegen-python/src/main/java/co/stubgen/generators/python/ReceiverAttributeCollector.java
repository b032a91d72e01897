package co.stubgen.generators.python;

import co.stubgen.core.TreeTraverser;
import co.stubgen.core.model.Expression;
import co.stubgen.core.model.Expression.MemberExpr;
import co.stubgen.core.model.Expression.NameExpr;
import co.stubgen.core.model.Statement.Assignment;
import co.stubgen.core.model.Statement.FunctionDef;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds instance attributes a function body assigns through {@code self}, such as
 * {@code self.size = 0} in a constructor.
 *
 * <p>Only the first target of each assignment is examined. Names come back in order of
 * first appearance and may repeat; callers deduplicate.
 */
final class ReceiverAttributeCollector extends TreeTraverser {

    static final String RECEIVER = "self";

    private final List<String> attributes = new ArrayList<>();

    static List<String> collect(FunctionDef function) {
        ReceiverAttributeCollector collector = new ReceiverAttributeCollector();
        collector.visitBlock(function.body());
        return collector.attributes;
    }

    @Override
    protected void visitAssignment(Assignment assignment) {
        Expression target = assignment.targets().get(0);
        if (target instanceof MemberExpr member
                && member.expr() instanceof NameExpr receiver
                && RECEIVER.equals(receiver.name())) {
            attributes.add(member.name());
        }
    }
}

package work.lcod.ui.lowering;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.ActionStep;
import work.lcod.ui.ast.Expression;

/**
 * Lowers action steps under a frame. Total over every step: unknown steps become {@link ActionStep.NoOp}.
 */
public final class ActionLowerer {
    private static final Logger LOG = LoggerFactory.getLogger(ActionLowerer.class);

    private final ExpressionLowerer expressions;

    public ActionLowerer(ExpressionLowerer expressions) {
        this.expressions = expressions;
    }

    public List<ActionDefinition> lowerAll(List<ActionDefinition> actions, SubstitutionFrame frame) {
        var lowered = new ArrayList<ActionDefinition>(actions.size());
        for (var action : actions) {
            lowered.add(lower(action, frame));
        }
        return lowered;
    }

    public ActionDefinition lower(ActionDefinition action, SubstitutionFrame frame) {
        return new ActionDefinition(action.name(), lowerSteps(action.steps(), frame));
    }

    public List<ActionStep> lowerSteps(List<ActionStep> steps, SubstitutionFrame frame) {
        var lowered = new ArrayList<ActionStep>(steps.size());
        for (var step : steps) {
            lowered.add(lower(step, frame));
        }
        return lowered;
    }

    public ActionStep lower(ActionStep step, SubstitutionFrame frame) {
        return step.accept(new StepLowering(frame));
    }

    private final class StepLowering implements ActionStep.Visitor<ActionStep> {
        private final SubstitutionFrame frame;

        private StepLowering(SubstitutionFrame frame) {
            this.frame = frame;
        }

        private Expression expr(Expression expr) {
            return expressions.lowerOptional(expr, frame);
        }

        private List<ActionStep> steps(List<ActionStep> steps) {
            return lowerSteps(steps, frame);
        }

        @Override
        public ActionStep visitSet(ActionStep.Set step) {
            return new ActionStep.Set(step.target(), expr(step.value()));
        }

        @Override
        public ActionStep visitUpdate(ActionStep.Update step) {
            return new ActionStep.Update(
                step.target(),
                step.operation(),
                expr(step.value()),
                expr(step.index()),
                expr(step.deleteCount())
            );
        }

        @Override
        public ActionStep visitSetPath(ActionStep.SetPath step) {
            return new ActionStep.SetPath(step.target(), expr(step.path()), expr(step.value()));
        }

        @Override
        public ActionStep visitFetch(ActionStep.Fetch step) {
            return new ActionStep.Fetch(
                expr(step.url()),
                step.method(),
                expr(step.body()),
                step.result(),
                steps(step.onSuccess()),
                steps(step.onError())
            );
        }

        @Override
        public ActionStep visitStorage(ActionStep.Storage step) {
            return new ActionStep.Storage(
                step.operation(),
                expr(step.key()),
                step.storage(),
                expr(step.value()),
                step.result(),
                steps(step.onSuccess()),
                steps(step.onError())
            );
        }

        @Override
        public ActionStep visitClipboard(ActionStep.Clipboard step) {
            return new ActionStep.Clipboard(
                step.operation(),
                expr(step.value()),
                step.result(),
                steps(step.onSuccess()),
                steps(step.onError())
            );
        }

        @Override
        public ActionStep visitNavigate(ActionStep.Navigate step) {
            return new ActionStep.Navigate(expr(step.url()), step.target(), step.replace());
        }

        @Override
        public ActionStep visitImport(ActionStep.Import step) {
            return new ActionStep.Import(step.module(), step.result(), steps(step.onSuccess()), steps(step.onError()));
        }

        @Override
        public ActionStep visitCall(ActionStep.Call step) {
            return new ActionStep.Call(
                expr(step.target()),
                expressions.lowerAll(step.args(), frame),
                step.result(),
                steps(step.onSuccess()),
                steps(step.onError())
            );
        }

        @Override
        public ActionStep visitSubscribe(ActionStep.Subscribe step) {
            return new ActionStep.Subscribe(expr(step.target()), step.event(), step.action());
        }

        @Override
        public ActionStep visitDispose(ActionStep.Dispose step) {
            return new ActionStep.Dispose(expr(step.target()));
        }

        @Override
        public ActionStep visitDom(ActionStep.Dom step) {
            return new ActionStep.Dom(step.operation(), expr(step.selector()), expr(step.value()), step.attribute());
        }

        @Override
        public ActionStep visitIf(ActionStep.If step) {
            return new ActionStep.If(expr(step.condition()), steps(step.then()), steps(step.otherwise()));
        }

        @Override
        public ActionStep visitDelay(ActionStep.Delay step) {
            return new ActionStep.Delay(expr(step.ms()), steps(step.then()), step.result());
        }

        @Override
        public ActionStep visitInterval(ActionStep.Interval step) {
            return new ActionStep.Interval(expr(step.ms()), step.action(), step.result());
        }

        @Override
        public ActionStep visitClearTimer(ActionStep.ClearTimer step) {
            return new ActionStep.ClearTimer(expr(step.target()));
        }

        @Override
        public ActionStep visitFocus(ActionStep.Focus step) {
            return new ActionStep.Focus(expr(step.target()), step.operation(), steps(step.onSuccess()), steps(step.onError()));
        }

        @Override
        public ActionStep visitUnknown(ActionStep.Unknown step) {
            LOG.debug("Unknown action step '{}' lowered to noop", step.tag());
            return ActionStep.NoOp.INSTANCE;
        }

        @Override
        public ActionStep visitNoOp(ActionStep.NoOp step) {
            return step;
        }
    }
}

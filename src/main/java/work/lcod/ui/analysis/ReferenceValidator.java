package work.lcod.ui.analysis;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.ActionStep;
import work.lcod.ui.ast.ComponentDef;
import work.lcod.ui.ast.EventHandler;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.PropValue;
import work.lcod.ui.ast.RouteSource;
import work.lcod.ui.ast.StateField;
import work.lcod.ui.ast.ViewNode;

/**
 * Name-resolution walk shared by the page and layout analyzers. Errors are appended in walk order.
 */
final class ReferenceValidator {

    /**
     * Program-level declarations. {@code routeParams} is null when the program declares no route.
     */
    record Declarations(
        Set<String> state,
        Set<String> actions,
        Map<String, ComponentDef> components,
        Set<String> routeParams,
        Set<String> imports
    ) {}

    /**
     * Lexical scope of the walk: bound loop/lambda variables, the component being checked (null at program
     * level), names contributed by an enclosing island, and whether var-refs are exempt (handler payloads and
     * action steps).
     */
    private record Scope(
        Set<String> locals,
        ComponentDef component,
        Set<String> islandState,
        Set<String> islandActions,
        boolean varsExempt
    ) {
        static Scope program() {
            return new Scope(Set.of(), null, Set.of(), Set.of(), false);
        }

        static Scope component(ComponentDef component) {
            return new Scope(Set.of(), component, Set.of(), Set.of(), false);
        }

        Scope bind(String... names) {
            var next = new HashSet<>(locals);
            for (String name : names) {
                if (name != null) {
                    next.add(name);
                }
            }
            return new Scope(next, component, islandState, islandActions, varsExempt);
        }

        Scope exemptVars() {
            return new Scope(locals, component, islandState, islandActions, true);
        }

        Scope island(Set<String> state, Set<String> actions) {
            var nextState = new HashSet<>(islandState);
            nextState.addAll(state);
            var nextActions = new HashSet<>(islandActions);
            nextActions.addAll(actions);
            return new Scope(locals, component, nextState, nextActions, varsExempt);
        }
    }

    private final Declarations declarations;
    private final boolean layout;
    private final int maxDepth;
    private final List<CompileError> errors = new ArrayList<>();
    private final Set<String> refs = new HashSet<>();
    private final Map<String, Integer> expansionHeights = new HashMap<>();

    ReferenceValidator(Declarations declarations, boolean layout, int maxDepth) {
        this.declarations = declarations;
        this.layout = layout;
        this.maxDepth = maxDepth;
    }

    List<CompileError> errors() {
        return errors;
    }

    void report(CompileError error) {
        errors.add(error);
    }

    /**
     * Full check of a program body: duplicate names, refs and islands, component graph and definitions, the
     * program actions, then the view.
     */
    void validate(List<ActionDefinition> actions, ViewNode view) {
        checkDuplicateActions(actions, ErrorPath.root().child("actions"));
        collectRefsAndIslands(view);
        checkComponentCycles();
        for (var entry : declarations.components().entrySet()) {
            checkComponentDefinition(entry.getKey(), entry.getValue());
        }
        checkActionList(actions, Scope.program(), ErrorPath.root().child("actions"));
        checkView(view, Scope.program(), ErrorPath.root().child("view"), 1);
    }

    private void checkDuplicateActions(List<ActionDefinition> actions, ErrorPath base) {
        var seen = new HashSet<String>();
        for (int i = 0; i < actions.size(); i++) {
            String name = actions.get(i).name();
            if (!seen.add(name)) {
                report(CompileErrors.duplicateAction(name, base.index(i)));
            }
        }
    }

    private void collectRefsAndIslands(ViewNode view) {
        var islandIds = new HashSet<String>();
        var trees = new LinkedHashMap<ErrorPath, ViewNode>();
        trees.put(ErrorPath.root().child("view"), view);
        for (var entry : declarations.components().entrySet()) {
            trees.put(ErrorPath.root().child("components").child(entry.getKey()).child("view"), entry.getValue().view());
        }
        for (var tree : trees.entrySet()) {
            var treeRefs = new HashSet<String>();
            ViewWalker.walk(tree.getValue(), tree.getKey(), maxDepth, (node, path, inLoop) -> {
                if (node instanceof ViewNode.Element element && element.ref() != null) {
                    if (!treeRefs.add(element.ref())) {
                        report(CompileErrors.duplicateRef(element.ref(), path.child("ref")));
                    }
                    refs.add(element.ref());
                } else if (node instanceof ViewNode.Island island && !islandIds.add(island.id())) {
                    report(CompileErrors.duplicateIslandId(island.id(), path.child("id")));
                }
            });
        }
    }

    private void checkComponentCycles() {
        var graph = new LinkedHashMap<String, Set<String>>();
        for (var entry : declarations.components().entrySet()) {
            var targets = new LinkedHashSet<String>();
            ViewWalker.walk(entry.getValue().view(), ErrorPath.root(), maxDepth, (node, path, inLoop) -> {
                if (node instanceof ViewNode.Component component) {
                    targets.add(component.name());
                }
            });
            graph.put(entry.getKey(), targets);
        }
        var done = new HashSet<String>();
        for (String name : graph.keySet()) {
            findCycles(name, graph, new ArrayList<>(), done);
        }
    }

    private void findCycles(String name, Map<String, Set<String>> graph, List<String> stack, Set<String> done) {
        if (done.contains(name) || !graph.containsKey(name)) {
            return;
        }
        int position = stack.indexOf(name);
        if (position >= 0) {
            var cycle = new ArrayList<>(stack.subList(position, stack.size()));
            cycle.add(name);
            report(CompileErrors.componentCycle(cycle, ErrorPath.root().child("components").child(stack.get(position))));
            return;
        }
        stack.add(name);
        for (String target : graph.get(name)) {
            findCycles(target, graph, stack, done);
        }
        stack.remove(stack.size() - 1);
        done.add(name);
    }

    private void checkComponentDefinition(String name, ComponentDef definition) {
        var base = ErrorPath.root().child("components").child(name);
        var scope = Scope.component(definition);
        checkDuplicateActions(definition.localActions(), base.child("localActions"));
        for (var entry : definition.localState().entrySet()) {
            if (entry.getValue().initial() instanceof Expression initial) {
                checkExpression(
                    initial,
                    scope.exemptVars(),
                    base.child("localState").child(entry.getKey()).child("initial")
                );
            }
        }
        checkActionList(definition.localActions(), scope, base.child("localActions"));
        checkView(definition.view(), scope, base.child("view"), 1);
    }

    // ---------------------------------------------------------------- view

    private void checkView(ViewNode node, Scope scope, ErrorPath path, int depth) {
        if (depth > maxDepth) {
            report(CompileErrors.maxDepthExceeded(maxDepth, path));
            return;
        }
        node.accept(new ViewNode.Visitor<Void>() {
            @Override
            public Void visitElement(ViewNode.Element element) {
                checkProps(element.props(), scope, path.child("props"));
                checkChildren(element.children(), scope, path.child("children"), depth);
                return null;
            }

            @Override
            public Void visitText(ViewNode.Text text) {
                checkExpression(text.value(), scope, path.child("value"));
                return null;
            }

            @Override
            public Void visitIf(ViewNode.If branch) {
                checkExpression(branch.condition(), scope, path.child("condition"));
                checkView(branch.then(), scope, path.child("then"), depth + 1);
                if (branch.otherwise() != null) {
                    checkView(branch.otherwise(), scope, path.child("else"), depth + 1);
                }
                return null;
            }

            @Override
            public Void visitEach(ViewNode.Each each) {
                checkExpression(each.items(), scope, path.child("items"));
                var inner = scope.bind(each.as(), each.index());
                if (each.key() != null) {
                    checkExpression(each.key(), inner, path.child("key"));
                }
                checkView(each.body(), inner, path.child("body"), depth + 1);
                return null;
            }

            @Override
            public Void visitComponent(ViewNode.Component component) {
                var definition = declarations.components().get(component.name());
                if (definition == null) {
                    report(CompileErrors.componentNotFound(component.name(), path.child("name")));
                } else {
                    for (var param : definition.params().entrySet()) {
                        if (param.getValue().required() && !component.props().containsKey(param.getKey())) {
                            report(CompileErrors.componentPropMissing(component.name(), param.getKey(), path));
                        }
                    }
                    if (depth + componentHeight(component.name(), new HashSet<>()) > maxDepth) {
                        report(CompileErrors.maxDepthExceeded(maxDepth, path));
                    }
                }
                checkProps(component.props(), scope, path.child("props"));
                checkChildren(component.children(), scope, path.child("children"), depth);
                return null;
            }

            @Override
            public Void visitSlot(ViewNode.Slot slot) {
                if (!layout && scope.component() == null) {
                    report(CompileErrors.slotOutsideComponent(path));
                }
                return null;
            }

            @Override
            public Void visitMarkdown(ViewNode.Markdown markdown) {
                checkExpression(markdown.content(), scope, path.child("content"));
                return null;
            }

            @Override
            public Void visitCode(ViewNode.Code code) {
                checkExpression(code.language(), scope, path.child("language"));
                checkExpression(code.content(), scope, path.child("content"));
                return null;
            }

            @Override
            public Void visitPortal(ViewNode.Portal portal) {
                checkChildren(portal.children(), scope, path.child("children"), depth);
                return null;
            }

            @Override
            public Void visitIsland(ViewNode.Island island) {
                var actionNames = new HashSet<String>();
                for (var action : island.actions()) {
                    actionNames.add(action.name());
                }
                var inner = scope.island(island.state().keySet(), actionNames);
                checkActionList(island.actions(), inner, path.child("actions"));
                checkView(island.content(), inner, path.child("content"), depth + 1);
                return null;
            }

            @Override
            public Void visitSuspense(ViewNode.Suspense suspense) {
                checkView(suspense.fallback(), scope, path.child("fallback"), depth + 1);
                checkView(suspense.content(), scope, path.child("content"), depth + 1);
                return null;
            }

            @Override
            public Void visitErrorBoundary(ViewNode.ErrorBoundary boundary) {
                checkView(boundary.fallback(), scope, path.child("fallback"), depth + 1);
                checkView(boundary.content(), scope, path.child("content"), depth + 1);
                return null;
            }
        });
    }

    /**
     * Levels a component's view occupies once inlined, nested expansions included. The lowerer places the
     * definition view one level below the call, so a call at depth {@code d} reaches {@code d + height}.
     * Components already being expanded count as zero; such cycles are reported separately.
     */
    private int componentHeight(String name, Set<String> expanding) {
        var definition = declarations.components().get(name);
        if (definition == null || expanding.contains(name)) {
            return 0;
        }
        var cached = expansionHeights.get(name);
        if (cached != null) {
            return cached;
        }
        expanding.add(name);
        int height = expansionHeight(definition.view(), expanding);
        expanding.remove(name);
        expansionHeights.put(name, height);
        return height;
    }

    private int expansionHeight(ViewNode node, Set<String> expanding) {
        int below = node instanceof ViewNode.Component call ? componentHeight(call.name(), expanding) : 0;
        for (var child : ViewWalker.childNodes(node)) {
            below = Math.max(below, expansionHeight(child, expanding));
        }
        return 1 + below;
    }

    private void checkChildren(List<ViewNode> children, Scope scope, ErrorPath base, int depth) {
        for (int i = 0; i < children.size(); i++) {
            checkView(children.get(i), scope, base.index(i), depth + 1);
        }
    }

    private void checkProps(Map<String, PropValue> props, Scope scope, ErrorPath base) {
        for (var entry : props.entrySet()) {
            var path = base.child(entry.getKey());
            if (entry.getValue() instanceof EventHandler handler) {
                checkHandler(handler, scope, path);
            } else {
                checkExpression((Expression) entry.getValue(), scope, path);
            }
        }
    }

    private void checkHandler(EventHandler handler, Scope scope, ErrorPath path) {
        if (!isAction(handler.action(), scope)) {
            report(CompileErrors.undefinedAction(handler.action(), path));
        }
        var payloadScope = scope.exemptVars();
        if (handler.payload() != null) {
            checkExpression(handler.payload(), payloadScope, path.child("payload"));
        }
        for (var field : handler.payloadFields().entrySet()) {
            checkExpression(field.getValue(), payloadScope, path.child("payload").child(field.getKey()));
        }
    }

    // ---------------------------------------------------------------- names

    private boolean isState(String name, Scope scope) {
        if (declarations.state().contains(name) || scope.islandState().contains(name)) {
            return true;
        }
        var component = scope.component();
        return component != null && (component.localState().containsKey(name) || component.params().containsKey(name));
    }

    private boolean isWritableState(String name, Scope scope) {
        if (declarations.state().contains(name) || scope.islandState().contains(name)) {
            return true;
        }
        var component = scope.component();
        return component != null && component.localState().containsKey(name);
    }

    private boolean isAction(String name, Scope scope) {
        if (declarations.actions().contains(name) || scope.islandActions().contains(name)) {
            return true;
        }
        var component = scope.component();
        if (component == null) {
            return false;
        }
        for (var action : component.localActions()) {
            if (action.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------- expressions

    private void checkOptional(Expression expr, Scope scope, ErrorPath path) {
        if (expr != null) {
            checkExpression(expr, scope, path);
        }
    }

    private void checkExpressions(List<Expression> exprs, Scope scope, ErrorPath base) {
        for (int i = 0; i < exprs.size(); i++) {
            checkExpression(exprs.get(i), scope, base.index(i));
        }
    }

    private void checkExpression(Expression expr, Scope scope, ErrorPath path) {
        expr.accept(new Expression.Visitor<Void>() {
            @Override
            public Void visitLiteral(Expression.Literal literal) {
                return null;
            }

            @Override
            public Void visitState(Expression.StateRef ref) {
                if (!isState(ref.name(), scope)) {
                    report(CompileErrors.undefinedState(ref.name(), path));
                }
                return null;
            }

            @Override
            public Void visitVar(Expression.VarRef ref) {
                if (!scope.varsExempt() && !scope.locals().contains(ref.name())) {
                    report(CompileErrors.undefinedVar(ref.name(), path));
                }
                return null;
            }

            @Override
            public Void visitBinary(Expression.Binary binary) {
                checkExpression(binary.left(), scope, path.child("left"));
                checkExpression(binary.right(), scope, path.child("right"));
                return null;
            }

            @Override
            public Void visitNot(Expression.Not not) {
                checkExpression(not.operand(), scope, path.child("operand"));
                return null;
            }

            @Override
            public Void visitConditional(Expression.Conditional conditional) {
                checkExpression(conditional.condition(), scope, path.child("if"));
                checkExpression(conditional.then(), scope, path.child("then"));
                checkExpression(conditional.otherwise(), scope, path.child("else"));
                return null;
            }

            @Override
            public Void visitGet(Expression.PropertyGet get) {
                checkExpression(get.base(), scope, path.child("base"));
                return null;
            }

            @Override
            public Void visitRoute(Expression.RouteRef route) {
                var params = declarations.routeParams();
                if (params != null && route.source() == RouteSource.PARAM && !params.contains(route.name())) {
                    report(CompileErrors.undefinedRouteParam(route.name(), path));
                }
                return null;
            }

            @Override
            public Void visitImport(Expression.ImportRef ref) {
                if (!declarations.imports().contains(ref.name())) {
                    report(CompileErrors.undefinedImport(ref.name(), path));
                }
                return null;
            }

            @Override
            public Void visitData(Expression.DataRef ref) {
                return null;
            }

            @Override
            public Void visitRef(Expression.DomRef ref) {
                if (!refs.contains(ref.name())) {
                    report(CompileErrors.undefinedRef(ref.name(), path));
                }
                return null;
            }

            @Override
            public Void visitIndex(Expression.IndexGet index) {
                checkExpression(index.base(), scope, path.child("base"));
                checkExpression(index.key(), scope, path.child("key"));
                return null;
            }

            @Override
            public Void visitParam(Expression.ParamRef ref) {
                var component = scope.component();
                if (component != null) {
                    if (!component.params().containsKey(ref.name())) {
                        report(CompileErrors.paramUndefined(ref.name(), path));
                    }
                } else if (!layout) {
                    report(CompileErrors.paramUndefined(ref.name(), path));
                }
                return null;
            }

            @Override
            public Void visitCall(Expression.Call call) {
                checkOptional(call.target(), scope, path.child("target"));
                checkExpressions(call.args(), scope, path.child("args"));
                return null;
            }

            @Override
            public Void visitLambda(Expression.Lambda lambda) {
                checkExpression(lambda.body(), scope.bind(lambda.param(), lambda.index()), path.child("body"));
                return null;
            }

            @Override
            public Void visitArray(Expression.ArrayLiteral array) {
                checkExpressions(array.elements(), scope, path.child("elements"));
                return null;
            }

            @Override
            public Void visitConcat(Expression.Concat concat) {
                checkExpressions(concat.items(), scope, path.child("items"));
                return null;
            }
        });
    }

    // ---------------------------------------------------------------- actions

    private void checkActionList(List<ActionDefinition> actions, Scope scope, ErrorPath base) {
        var stepScope = scope.exemptVars();
        for (int i = 0; i < actions.size(); i++) {
            checkSteps(actions.get(i).steps(), stepScope, base.index(i).child("steps"));
        }
    }

    private void checkSteps(List<ActionStep> steps, Scope scope, ErrorPath base) {
        for (int i = 0; i < steps.size(); i++) {
            checkStep(steps.get(i), scope, base.index(i));
        }
    }

    private void checkTarget(String target, Scope scope, ErrorPath path) {
        if (!isWritableState(target, scope)) {
            report(CompileErrors.undefinedState(target, path));
        }
    }

    private void checkStep(ActionStep step, Scope scope, ErrorPath path) {
        step.accept(new ActionStep.Visitor<Void>() {
            @Override
            public Void visitSet(ActionStep.Set set) {
                checkTarget(set.target(), scope, path.child("target"));
                checkExpression(set.value(), scope, path.child("value"));
                return null;
            }

            @Override
            public Void visitUpdate(ActionStep.Update update) {
                checkTarget(update.target(), scope, path.child("target"));
                checkOptional(update.value(), scope, path.child("value"));
                checkOptional(update.index(), scope, path.child("index"));
                checkOptional(update.deleteCount(), scope, path.child("deleteCount"));
                return null;
            }

            @Override
            public Void visitSetPath(ActionStep.SetPath setPath) {
                checkTarget(setPath.target(), scope, path.child("target"));
                checkExpression(setPath.path(), scope, path.child("path"));
                checkExpression(setPath.value(), scope, path.child("value"));
                return null;
            }

            @Override
            public Void visitFetch(ActionStep.Fetch fetch) {
                checkExpression(fetch.url(), scope, path.child("url"));
                checkOptional(fetch.body(), scope, path.child("body"));
                checkSteps(fetch.onSuccess(), scope, path.child("onSuccess"));
                checkSteps(fetch.onError(), scope, path.child("onError"));
                return null;
            }

            @Override
            public Void visitStorage(ActionStep.Storage storage) {
                checkExpression(storage.key(), scope, path.child("key"));
                checkOptional(storage.value(), scope, path.child("value"));
                checkSteps(storage.onSuccess(), scope, path.child("onSuccess"));
                checkSteps(storage.onError(), scope, path.child("onError"));
                return null;
            }

            @Override
            public Void visitClipboard(ActionStep.Clipboard clipboard) {
                checkOptional(clipboard.value(), scope, path.child("value"));
                checkSteps(clipboard.onSuccess(), scope, path.child("onSuccess"));
                checkSteps(clipboard.onError(), scope, path.child("onError"));
                return null;
            }

            @Override
            public Void visitNavigate(ActionStep.Navigate navigate) {
                checkExpression(navigate.url(), scope, path.child("url"));
                return null;
            }

            @Override
            public Void visitImport(ActionStep.Import importStep) {
                checkSteps(importStep.onSuccess(), scope, path.child("onSuccess"));
                checkSteps(importStep.onError(), scope, path.child("onError"));
                return null;
            }

            @Override
            public Void visitCall(ActionStep.Call call) {
                checkExpression(call.target(), scope, path.child("target"));
                checkExpressions(call.args(), scope, path.child("args"));
                checkSteps(call.onSuccess(), scope, path.child("onSuccess"));
                checkSteps(call.onError(), scope, path.child("onError"));
                return null;
            }

            @Override
            public Void visitSubscribe(ActionStep.Subscribe subscribe) {
                checkExpression(subscribe.target(), scope, path.child("target"));
                if (!isAction(subscribe.action(), scope)) {
                    report(CompileErrors.undefinedAction(subscribe.action(), path.child("action")));
                }
                return null;
            }

            @Override
            public Void visitDispose(ActionStep.Dispose dispose) {
                checkExpression(dispose.target(), scope, path.child("target"));
                return null;
            }

            @Override
            public Void visitDom(ActionStep.Dom dom) {
                checkExpression(dom.selector(), scope, path.child("selector"));
                checkOptional(dom.value(), scope, path.child("value"));
                return null;
            }

            @Override
            public Void visitIf(ActionStep.If branch) {
                checkExpression(branch.condition(), scope, path.child("condition"));
                checkSteps(branch.then(), scope, path.child("then"));
                checkSteps(branch.otherwise(), scope, path.child("else"));
                return null;
            }

            @Override
            public Void visitDelay(ActionStep.Delay delay) {
                checkExpression(delay.ms(), scope, path.child("ms"));
                checkSteps(delay.then(), scope, path.child("then"));
                return null;
            }

            @Override
            public Void visitInterval(ActionStep.Interval interval) {
                checkExpression(interval.ms(), scope, path.child("ms"));
                if (!isAction(interval.action(), scope)) {
                    report(CompileErrors.undefinedAction(interval.action(), path.child("action")));
                }
                return null;
            }

            @Override
            public Void visitClearTimer(ActionStep.ClearTimer clearTimer) {
                checkExpression(clearTimer.target(), scope, path.child("target"));
                return null;
            }

            @Override
            public Void visitFocus(ActionStep.Focus focus) {
                checkExpression(focus.target(), scope, path.child("target"));
                checkSteps(focus.onSuccess(), scope, path.child("onSuccess"));
                checkSteps(focus.onError(), scope, path.child("onError"));
                return null;
            }

            @Override
            public Void visitUnknown(ActionStep.Unknown unknown) {
                return null;
            }

            @Override
            public Void visitNoOp(ActionStep.NoOp noOp) {
                return null;
            }
        });
    }

    static Set<String> stateNames(Map<String, StateField> state) {
        return new LinkedHashSet<>(state.keySet());
    }

    static Set<String> actionNames(List<ActionDefinition> actions) {
        var names = new LinkedHashSet<String>();
        for (var action : actions) {
            names.add(action.name());
        }
        return names;
    }
}

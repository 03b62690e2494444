package work.lcod.ui.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import work.lcod.ui.ast.ViewNode;

/**
 * Depth-first pre-order walk over a source view, tracking the pointer of each node and whether it sits in an
 * {@code each} body. Descent stops past {@code maxDepth}; the optional overflow callback receives the pointer
 * of each node left unvisited there.
 */
final class ViewWalker {

    interface Callback {
        void visit(ViewNode node, ErrorPath path, boolean inLoop);
    }

    private record Child(ViewNode node, ErrorPath path, boolean loopBody) {}

    private ViewWalker() {}

    static void walk(ViewNode root, ErrorPath path, int maxDepth, Callback callback) {
        walk(root, path, maxDepth, callback, overflow -> {});
    }

    static void walk(ViewNode root, ErrorPath path, int maxDepth, Callback callback, Consumer<ErrorPath> overflow) {
        walk(root, path, false, 1, maxDepth, callback, overflow);
    }

    /** Direct structural children of a node, in walk order. */
    static List<ViewNode> childNodes(ViewNode node) {
        var nodes = new ArrayList<ViewNode>();
        for (var child : children(node, ErrorPath.root())) {
            if (child.node() != null) {
                nodes.add(child.node());
            }
        }
        return nodes;
    }

    private static void walk(
        ViewNode node,
        ErrorPath path,
        boolean inLoop,
        int depth,
        int maxDepth,
        Callback callback,
        Consumer<ErrorPath> overflow
    ) {
        if (node == null) {
            return;
        }
        if (depth > maxDepth) {
            overflow.accept(path);
            return;
        }
        callback.visit(node, path, inLoop);
        for (var child : children(node, path)) {
            walk(child.node(), child.path(), inLoop || child.loopBody(), depth + 1, maxDepth, callback, overflow);
        }
    }

    private static List<Child> children(ViewNode node, ErrorPath path) {
        return node.accept(new ViewNode.Visitor<List<Child>>() {
            @Override
            public List<Child> visitElement(ViewNode.Element element) {
                return list(element.children(), path.child("children"));
            }

            @Override
            public List<Child> visitText(ViewNode.Text text) {
                return List.of();
            }

            @Override
            public List<Child> visitIf(ViewNode.If branch) {
                var result = new ArrayList<Child>();
                result.add(new Child(branch.then(), path.child("then"), false));
                if (branch.otherwise() != null) {
                    result.add(new Child(branch.otherwise(), path.child("else"), false));
                }
                return result;
            }

            @Override
            public List<Child> visitEach(ViewNode.Each each) {
                return List.of(new Child(each.body(), path.child("body"), true));
            }

            @Override
            public List<Child> visitComponent(ViewNode.Component component) {
                return list(component.children(), path.child("children"));
            }

            @Override
            public List<Child> visitSlot(ViewNode.Slot slot) {
                return List.of();
            }

            @Override
            public List<Child> visitMarkdown(ViewNode.Markdown markdown) {
                return List.of();
            }

            @Override
            public List<Child> visitCode(ViewNode.Code code) {
                return List.of();
            }

            @Override
            public List<Child> visitPortal(ViewNode.Portal portal) {
                return list(portal.children(), path.child("children"));
            }

            @Override
            public List<Child> visitIsland(ViewNode.Island island) {
                return List.of(new Child(island.content(), path.child("content"), false));
            }

            @Override
            public List<Child> visitSuspense(ViewNode.Suspense suspense) {
                return List.of(
                    new Child(suspense.fallback(), path.child("fallback"), false),
                    new Child(suspense.content(), path.child("content"), false)
                );
            }

            @Override
            public List<Child> visitErrorBoundary(ViewNode.ErrorBoundary boundary) {
                return List.of(
                    new Child(boundary.fallback(), path.child("fallback"), false),
                    new Child(boundary.content(), path.child("content"), false)
                );
            }
        });
    }

    private static List<Child> list(List<ViewNode> nodes, ErrorPath base) {
        var result = new ArrayList<Child>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            result.add(new Child(nodes.get(i), base.index(i), false));
        }
        return result;
    }
}

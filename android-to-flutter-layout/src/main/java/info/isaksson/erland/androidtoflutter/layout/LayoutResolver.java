package info.isaksson.erland.androidtoflutter.layout;

import info.isaksson.erland.androidtoflutter.ir.Alignment;
import info.isaksson.erland.androidtoflutter.ir.AnchorRelation;
import info.isaksson.erland.androidtoflutter.ir.ContainerKind;
import info.isaksson.erland.androidtoflutter.ir.ConversionWarnings;
import info.isaksson.erland.androidtoflutter.ir.MarkupNode;
import info.isaksson.erland.androidtoflutter.ir.Orientation;
import info.isaksson.erland.androidtoflutter.ir.PositionRef;
import info.isaksson.erland.androidtoflutter.ir.ResolvedLayoutNode;
import info.isaksson.erland.androidtoflutter.markup.DocumentRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Turns a parsed layout document into a {@link ResolvedLayoutNode} tree.
 *
 * <p>Includes, view stubs and fragments with a {@code tools:layout} are substituted from the
 * {@link DocumentRegistry}; merges are flattened into their parent. Relative containers get
 * their children sorted by the ordering relations, constraint containers keep declaration
 * order with only parent centering and bias honored.</p>
 *
 * <p>The resolver is stateless between calls and may be shared across threads; all
 * per-resolution state (the visiting set of document ids) lives in a {@link Resolution}.</p>
 */
public final class LayoutResolver {

    private static final Logger log = LoggerFactory.getLogger(LayoutResolver.class);

    static final String TOOLS_LAYOUT = "tools:layout";

    private static final Set<String> PARENT_ANCHORS = Set.of(
            "layout_constraintTop_toTopOf",
            "layout_constraintBottom_toBottomOf",
            "layout_constraintStart_toStartOf",
            "layout_constraintEnd_toEndOf",
            "layout_constraintLeft_toLeftOf",
            "layout_constraintRight_toRightOf");

    private static final Set<String> BIAS_ATTRIBUTES = Set.of(
            "layout_constraintHorizontal_bias",
            "layout_constraintVertical_bias");

    private final DocumentRegistry registry;

    public LayoutResolver(DocumentRegistry registry) {
        this.registry = registry == null ? DocumentRegistry.EMPTY : registry;
    }

    /**
     * Resolves {@code root}. A {@code merge} root has no parent to merge into and becomes a
     * frame container holding its children.
     */
    public ResolvedLayoutNode resolve(MarkupNode root, ConversionWarnings warnings) {
        if (root == null) throw new IllegalArgumentException("root is null");
        Resolution r = new Resolution(warnings == null ? new ConversionWarnings() : warnings);
        if (root.documentId != null) r.visiting.add(root.documentId);

        List<ResolvedLayoutNode> out = r.resolveNode(root, Parent.ROOT);
        if (ViewTag.of(root.tag) == ViewTag.MERGE || out.size() != 1) {
            return ResolvedLayoutNode.builder(root)
                    .containerKind(ContainerKind.FRAME)
                    .children(out)
                    .build();
        }
        return out.get(0);
    }

    /** Layout facts of the container a node is placed in. */
    private record Parent(ContainerKind kind, Orientation orientation, ViewTag tag) {
        static final Parent ROOT = new Parent(ContainerKind.NONE, Orientation.NONE, ViewTag.UNKNOWN);
        static final Parent WRAPPER = new Parent(ContainerKind.FRAME, Orientation.NONE, ViewTag.INCLUDE);
    }

    private final class Resolution {
        private final ConversionWarnings warnings;
        private final Set<String> visiting = new HashSet<>();

        Resolution(ConversionWarnings warnings) {
            this.warnings = warnings;
        }

        /** Resolves one markup node; may yield zero or several nodes (merge) for the parent. */
        List<ResolvedLayoutNode> resolveNode(MarkupNode node, Parent parent) {
            ViewTag tag = ViewTag.of(node.tag);
            switch (tag) {
                case MERGE:
                    return resolveChildren(node.children, parent);
                case INCLUDE:
                    return resolveReference(node, MarkupNode.resourceName(node.attr("layout")), parent);
                case VIEW_STUB: {
                    String target = MarkupNode.resourceName(node.attr("layout"));
                    if (target == null) {
                        warnings.warn(ConversionWarnings.EMPTY_VIEW_STUB, "ViewStub without a layout",
                                context(node));
                        return List.of(placeholder(node, "ViewStub without layout", parent));
                    }
                    return resolveReference(node, target, parent);
                }
                case FRAGMENT: {
                    String target = MarkupNode.resourceName(node.attr(TOOLS_LAYOUT));
                    if (target != null) return resolveReference(node, target, parent);
                    return List.of(resolveElement(node, tag, parent));
                }
                default:
                    return List.of(resolveElement(node, tag, parent));
            }
        }

        List<ResolvedLayoutNode> resolveChildren(List<MarkupNode> children, Parent parent) {
            List<ResolvedLayoutNode> out = new ArrayList<>();
            for (MarkupNode c : children) {
                out.addAll(resolveNode(c, parent));
            }
            return out;
        }

        private List<ResolvedLayoutNode> resolveReference(MarkupNode node, String target, Parent parent) {
            if (target == null) {
                warnings.warn(ConversionWarnings.UNRESOLVED_INCLUDE, node.tag + " without a layout reference",
                        context(node));
                return List.of(placeholder(node, "missing layout reference", parent));
            }
            if (visiting.contains(target)) {
                warnings.warn(ConversionWarnings.INCLUDE_CYCLE, "recursive include of " + target,
                        "document", target, "from", String.valueOf(node.documentId));
                log.debug("Breaking include cycle at {}", target);
                return List.of(placeholder(node, "recursive include of " + target, parent));
            }
            var doc = registry.lookup(target);
            if (doc.isEmpty()) {
                warnings.warn(ConversionWarnings.UNRESOLVED_INCLUDE, "layout not found: " + target,
                        "document", target, "from", String.valueOf(node.documentId));
                return List.of(placeholder(node, "layout not found: " + target, parent));
            }

            visiting.add(target);
            try {
                MarkupNode included = doc.get();
                if (ViewTag.of(included.tag) == ViewTag.MERGE) {
                    return resolveChildren(included.children, parent);
                }
                List<ResolvedLayoutNode> inner = resolveNode(included, Parent.WRAPPER);
                ResolvedLayoutNode.Builder b = ResolvedLayoutNode.builder(node)
                        .origin(ResolvedLayoutNode.Origin.INCLUDE)
                        .containerKind(ContainerKind.FRAME)
                        .children(inner);
                place(b, node, parent);
                return List.of(b.build());
            } finally {
                visiting.remove(target);
            }
        }

        private ResolvedLayoutNode placeholder(MarkupNode node, String reason, Parent parent) {
            ResolvedLayoutNode p = ResolvedLayoutNode.placeholder(node, reason);
            ResolvedLayoutNode.Builder b = p.toBuilder();
            place(b, node, parent);
            return b.build();
        }

        private ResolvedLayoutNode resolveElement(MarkupNode node, ViewTag tag, Parent parent) {
            ContainerKind kind = tag.containerKind();
            Orientation orientation = orientationOf(node, tag);
            List<ResolvedLayoutNode> children = resolveChildren(node.children, new Parent(kind, orientation, tag));

            if (kind == ContainerKind.RELATIVE) {
                children = orderRelative(node, children);
                orientation = relativeOrientation(children);
            } else if (tag == ViewTag.TABLE_ROW) {
                children = expandTableCells(children);
            }

            ResolvedLayoutNode.Builder b = ResolvedLayoutNode.builder(node)
                    .containerKind(kind)
                    .orientation(orientation)
                    .children(children);
            place(b, node, parent);
            return b.build();
        }

        /** Records how {@code node} sits in {@code parent}: refs, alignment, expansion, bias. */
        private void place(ResolvedLayoutNode.Builder b, MarkupNode node, Parent parent) {
            switch (parent.kind()) {
                case LINEAR -> {
                    b.alignment(Gravity.crossAxis(node.attr("layout_gravity"), parent.orientation()));
                    b.expanded(isExpanded(node, parent.orientation()));
                }
                case FRAME -> b.alignment(frameAlignment(node.attr("layout_gravity")));
                case RELATIVE -> {
                    b.positionRefs(parsePositionRefs(node));
                    b.alignment(relativeAlignment(node));
                }
                case CONSTRAINT -> placeInConstraint(b, node);
                case NONE -> {
                    // no layout semantics for children of leaves and unknown tags
                }
            }
        }

        private void placeInConstraint(ResolvedLayoutNode.Builder b, MarkupNode node) {
            for (Map.Entry<String, String> a : node.attributes.entrySet()) {
                String name = a.getKey();
                if (!name.startsWith("layout_constraint")) continue;
                if (BIAS_ATTRIBUTES.contains(name)) continue;
                if (PARENT_ANCHORS.contains(name) && "parent".equals(a.getValue())) continue;
                warnings.warn(ConversionWarnings.CONSTRAINT_DROPPED, "unsupported constraint " + name,
                        "attribute", name, "view", describe(node));
            }

            boolean horizontal = anchoredToParent(node, "layout_constraintStart_toStartOf", "layout_constraintLeft_toLeftOf")
                    && anchoredToParent(node, "layout_constraintEnd_toEndOf", "layout_constraintRight_toRightOf");
            boolean vertical = anchoredToParent(node, "layout_constraintTop_toTopOf", null)
                    && anchoredToParent(node, "layout_constraintBottom_toBottomOf", null);

            Double hBias = horizontal ? bias(node.attr("layout_constraintHorizontal_bias")) : null;
            Double vBias = vertical ? bias(node.attr("layout_constraintVertical_bias")) : null;
            b.bias(hBias, vBias);
            b.alignment(horizontal || vertical ? Alignment.CENTER : Alignment.NONE);
        }

        private List<ResolvedLayoutNode> orderRelative(MarkupNode container, List<ResolvedLayoutNode> children) {
            int n = children.size();
            Map<String, Integer> indexById = new LinkedHashMap<>();
            for (int i = 0; i < n; i++) {
                String id = siblingId(children.get(i));
                if (id != null) indexById.putIfAbsent(id, i);
            }

            List<ResolvedLayoutNode> filtered = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                ResolvedLayoutNode c = children.get(i);
                List<PositionRef> kept = new ArrayList<>();
                for (PositionRef ref : c.positionRefs) {
                    Integer target = indexById.get(ref.targetId());
                    if (target == null || target == i) {
                        warnings.warn(ConversionWarnings.RELATIVE_REF_DROPPED,
                                "reference to " + ref.targetId() + " is not a sibling",
                                "view", describe(c.markup), "relation", ref.relation().name());
                        continue;
                    }
                    kept.add(ref);
                }
                filtered.add(kept.size() == c.positionRefs.size() ? c : c.toBuilder().positionRefs(kept).build());
            }

            List<Set<Integer>> graph = new ArrayList<>(n);
            for (int i = 0; i < n; i++) graph.add(new LinkedHashSet<>());
            for (int i = 0; i < n; i++) {
                for (PositionRef ref : filtered.get(i).positionRefs) {
                    if (!ref.relation().isOrdering()) continue;
                    int t = indexById.get(ref.targetId());
                    graph.get(ref.relation().precedesTarget() ? i : t).add(ref.relation().precedesTarget() ? t : i);
                }
            }

            // Members of a cycle are left unordered among themselves.
            int[] component = components(graph);
            int[] componentSize = new int[n];
            for (int c : component) componentSize[c]++;

            List<Set<Integer>> successors = new ArrayList<>(n);
            for (int i = 0; i < n; i++) successors.add(new LinkedHashSet<>());
            int[] indegree = new int[n];
            for (int i = 0; i < n; i++) {
                for (PositionRef ref : filtered.get(i).positionRefs) {
                    if (!ref.relation().isOrdering()) continue;
                    int t = indexById.get(ref.targetId());
                    int from = ref.relation().precedesTarget() ? i : t;
                    int to = ref.relation().precedesTarget() ? t : i;
                    if (component[from] == component[to] && componentSize[component[from]] > 1) {
                        warnings.warn(ConversionWarnings.RELATIVE_CYCLE,
                                "ignoring " + ref.relation().name() + " " + ref.targetId() + " inside a cycle",
                                "view", describe(filtered.get(i).markup), "container", describe(container));
                        continue;
                    }
                    if (successors.get(from).add(to)) indegree[to]++;
                }
            }

            // Kahn's algorithm, smallest declaration index first among ready nodes.
            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int i = 0; i < n; i++) {
                if (indegree[i] == 0) ready.add(i);
            }
            List<ResolvedLayoutNode> ordered = new ArrayList<>(n);
            while (!ready.isEmpty()) {
                int i = ready.poll();
                ordered.add(filtered.get(i));
                for (int s : successors.get(i)) {
                    if (--indegree[s] == 0) ready.add(s);
                }
            }
            return ordered;
        }

        private List<ResolvedLayoutNode> expandTableCells(List<ResolvedLayoutNode> cells) {
            List<ResolvedLayoutNode> out = new ArrayList<>(cells.size());
            for (int i = 0; i < cells.size(); i++) {
                ResolvedLayoutNode c = cells.get(i);
                out.add(i == 0 || c.expanded ? c : c.toBuilder().expanded(true).build());
            }
            return out;
        }
    }

    /** Strongly connected component index of every node (Tarjan). */
    static int[] components(List<Set<Integer>> graph) {
        int n = graph.size();
        int[] component = new int[n];
        int[] index = new int[n];
        int[] low = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);
        Deque<Integer> stack = new ArrayDeque<>();
        int[] counters = new int[2];
        for (int v = 0; v < n; v++) {
            if (index[v] < 0) strongConnect(v, graph, index, low, onStack, stack, component, counters);
        }
        return component;
    }

    private static void strongConnect(int v, List<Set<Integer>> graph, int[] index, int[] low, boolean[] onStack,
                                      Deque<Integer> stack, int[] component, int[] counters) {
        index[v] = low[v] = counters[0]++;
        stack.push(v);
        onStack[v] = true;
        for (int w : graph.get(v)) {
            if (index[w] < 0) {
                strongConnect(w, graph, index, low, onStack, stack, component, counters);
                low[v] = Math.min(low[v], low[w]);
            } else if (onStack[w]) {
                low[v] = Math.min(low[v], index[w]);
            }
        }
        if (low[v] == index[v]) {
            int c = counters[1]++;
            int w;
            do {
                w = stack.pop();
                onStack[w] = false;
                component[w] = c;
            } while (w != v);
        }
    }

    /** Id a sibling is referenced by; an include without its own id exposes its root's id. */
    static String siblingId(ResolvedLayoutNode node) {
        String id = node.id();
        if (id != null) return id;
        if (node.origin == ResolvedLayoutNode.Origin.INCLUDE && node.children.size() == 1) {
            return node.children.get(0).id();
        }
        return null;
    }

    static Orientation orientationOf(MarkupNode node, ViewTag tag) {
        if (tag.hasFixedOrientation()) return tag.defaultOrientation();
        String o = node.attr("orientation");
        if ("horizontal".equals(o)) return Orientation.HORIZONTAL;
        if ("vertical".equals(o)) return Orientation.VERTICAL;
        return tag.defaultOrientation();
    }

    /** Horizontal when every ordering relation among the children is horizontal. */
    static Orientation relativeOrientation(List<ResolvedLayoutNode> children) {
        boolean anyHorizontal = false;
        for (ResolvedLayoutNode c : children) {
            for (PositionRef ref : c.positionRefs) {
                if (ref.relation().axis() == Orientation.VERTICAL) return Orientation.VERTICAL;
                if (ref.relation().axis() == Orientation.HORIZONTAL) anyHorizontal = true;
            }
        }
        return anyHorizontal ? Orientation.HORIZONTAL : Orientation.VERTICAL;
    }

    static List<PositionRef> parsePositionRefs(MarkupNode node) {
        List<PositionRef> refs = new ArrayList<>();
        for (AnchorRelation rel : AnchorRelation.values()) {
            for (String attr : rel.attributeNames()) {
                String target = MarkupNode.stripIdRef(node.attr(attr));
                if (target != null) {
                    refs.add(new PositionRef(rel, target));
                    break;
                }
            }
        }
        return refs;
    }

    static Alignment relativeAlignment(MarkupNode node) {
        if (isTrue(node.attr("layout_centerInParent")) || isTrue(node.attr("layout_centerHorizontal"))) {
            return Alignment.CENTER;
        }
        if (isTrue(node.attr("layout_alignParentEnd")) || isTrue(node.attr("layout_alignParentRight"))) {
            return Alignment.END;
        }
        if (isTrue(node.attr("layout_alignParentStart")) || isTrue(node.attr("layout_alignParentLeft"))) {
            return Alignment.START;
        }
        return Alignment.NONE;
    }

    static Alignment frameAlignment(String layoutGravity) {
        Set<String> t = Gravity.tokens(layoutGravity);
        if (t.isEmpty()) return Alignment.NONE;
        if (t.contains("center")) return Alignment.CENTER;
        Alignment h = Gravity.horizontal(t);
        return h != Alignment.NONE ? h : Gravity.vertical(t);
    }

    static boolean isExpanded(MarkupNode node, Orientation parentAxis) {
        String weight = node.attr("layout_weight");
        if (weight != null) {
            try {
                if (Double.parseDouble(weight.trim()) > 0) return true;
            } catch (NumberFormatException e) {
                log.debug("Ignoring malformed layout_weight '{}'", weight);
            }
        }
        String size = parentAxis == Orientation.HORIZONTAL ? node.attr("layout_width") : node.attr("layout_height");
        return "match_parent".equals(size) || "fill_parent".equals(size);
    }

    private static boolean anchoredToParent(MarkupNode node, String attr, String alternative) {
        if ("parent".equals(node.attr(attr))) return true;
        return alternative != null && "parent".equals(node.attr(alternative));
    }

    /** Bias in [0, 1]; 0.5 when absent or malformed. */
    static Double bias(String raw) {
        if (raw == null) return 0.5;
        try {
            double v = Double.parseDouble(raw.trim());
            return Math.max(0.0, Math.min(1.0, v));
        } catch (NumberFormatException e) {
            return 0.5;
        }
    }

    private static boolean isTrue(String v) {
        return "true".equals(v);
    }

    private static Map<String, String> context(MarkupNode node) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put("view", describe(node));
        if (node.documentId != null) ctx.put("document", node.documentId);
        return ctx;
    }

    static String describe(MarkupNode node) {
        String id = node.id();
        return id == null ? node.tag : node.tag + "#" + id;
    }
}

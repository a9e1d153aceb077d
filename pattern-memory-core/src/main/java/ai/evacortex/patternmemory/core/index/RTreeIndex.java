/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.index;

import ai.evacortex.patternmemory.core.exceptions.IndexInconsistencyException;
import ai.evacortex.patternmemory.core.geometry.BoundingBox;
import ai.evacortex.patternmemory.core.geometry.Coordinate;
import ai.evacortex.patternmemory.core.util.AutoLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * R-tree over points in {@code [-1,1]^3}.
 *
 * <ul>
 *     <li>insert: least-enlargement descent, quadratic split on overflow;</li>
 *     <li>remove: condense-tree with re-insertion of entries from underfull nodes;</li>
 *     <li>bulk load: Sort-Tile-Recursive packing, one level at a time;</li>
 *     <li>range query: descends only into nodes within {@code radius} of the center;</li>
 *     <li>k-NN: best-first traversal ordered by box min-distance.</li>
 * </ul>
 *
 * <p>The whole tree is guarded by one fair read/write lock.</p>
 */
public class RTreeIndex implements SpatialIndex {

    private static final Logger log = LoggerFactory.getLogger(RTreeIndex.class);

    public static final int DEFAULT_MAX_ENTRIES = 16;
    public static final int MIN_CAPACITY = 4;
    public static final int MAX_CAPACITY = 64;

    private final int maxEntries;
    private final int minEntries;

    private final ReadWriteLock lock = AutoLock.fairReadWriteLock();
    private final Map<String, Coordinate> points = new HashMap<>();
    private final AtomicInteger lastVisits = new AtomicInteger();
    private volatile boolean linearScan;
    private Node root;

    private record Entry(String id, Coordinate point) {
        BoundingBox box() {
            return BoundingBox.of(point);
        }
    }

    private record QueueItem(double distanceSquared, Node node, Entry entry) {}

    private static final Comparator<QueueItem> QUEUE_ORDER = Comparator
            .comparingDouble(QueueItem::distanceSquared)
            .thenComparing((QueueItem q) -> q.entry() == null ? 0 : 1)
            .thenComparing(q -> q.entry() == null ? "" : q.entry().id());

    private static final class Node {
        final boolean leaf;
        final List<Node> children;
        final List<Entry> entries;
        Node parent;
        BoundingBox box;

        Node(boolean leaf) {
            this.leaf = leaf;
            this.children = leaf ? List.of() : new ArrayList<>();
            this.entries = leaf ? new ArrayList<>() : List.of();
        }

        int size() {
            return leaf ? entries.size() : children.size();
        }

        void addChild(Node child) {
            children.add(child);
            child.parent = this;
            box = box == null ? child.box : (child.box == null ? box : box.union(child.box));
        }

        void addEntry(Entry e) {
            entries.add(e);
            box = box == null ? e.box() : box.union(e.point());
        }

        void recomputeBox() {
            BoundingBox b = null;
            if (leaf) {
                for (Entry e : entries) b = b == null ? e.box() : b.union(e.point());
            } else {
                for (Node c : children) {
                    if (c.box != null) b = b == null ? c.box : b.union(c.box);
                }
            }
            box = b;
        }
    }

    public RTreeIndex() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public RTreeIndex(int maxEntries) {
        if (maxEntries < MIN_CAPACITY || maxEntries > MAX_CAPACITY) {
            throw new IllegalArgumentException("Node capacity must be in [" + MIN_CAPACITY + ", "
                    + MAX_CAPACITY + "]: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.minEntries = Math.max(2, (int) Math.floor(maxEntries * 0.4));
        this.root = new Node(true);
    }

    public int maxEntries() {
        return maxEntries;
    }

    public int minEntries() {
        return minEntries;
    }

    @Override
    public void bulkLoad(Map<String, Coordinate> batch) {
        try (AutoLock ignored = AutoLock.write(lock)) {
            for (Map.Entry<String, Coordinate> e : batch.entrySet()) {
                points.put(e.getKey(), sanitize(e.getKey(), e.getValue()));
            }
            List<Entry> all = new ArrayList<>(points.size());
            points.forEach((id, p) -> all.add(new Entry(id, p)));
            root = packTree(all);
            log.debug("Bulk loaded {} entries ({} new), height {}", all.size(), batch.size(), height(root));
        }
    }

    @Override
    public void insert(String id, Coordinate point) {
        try (AutoLock ignored = AutoLock.write(lock)) {
            if (points.containsKey(id)) {
                removeLocked(id);
            }
            Coordinate p = sanitize(id, point);
            points.put(id, p);
            insertEntry(new Entry(id, p));
        }
    }

    @Override
    public boolean remove(String id) {
        try (AutoLock ignored = AutoLock.write(lock)) {
            return removeLocked(id);
        }
    }

    @Override
    public List<String> rangeQuery(Coordinate center, double radius) {
        if (!(radius >= 0)) throw new IllegalArgumentException("radius must be >= 0: " + radius);
        double r2 = radius * radius;
        try (AutoLock ignored = AutoLock.read(lock)) {
            List<String> out = new ArrayList<>();
            if (linearScan) {
                for (Map.Entry<String, Coordinate> e : points.entrySet()) {
                    if (e.getValue().distanceSquared(center) <= r2) out.add(e.getKey());
                }
                lastVisits.set(points.size());
            } else {
                int[] visits = new int[1];
                search(root, center, r2, out, visits);
                lastVisits.set(visits[0]);
            }
            out.sort(Comparator.naturalOrder());
            return out;
        }
    }

    @Override
    public List<Neighbor> kNearest(Coordinate point, int k) {
        try (AutoLock ignored = AutoLock.read(lock)) {
            return nearestLocked(point, k, null);
        }
    }

    @Override
    public List<Neighbor> kNearest(String id, int k) {
        try (AutoLock ignored = AutoLock.read(lock)) {
            Coordinate p = points.get(id);
            if (p == null) return List.of();
            return nearestLocked(p, k, id);
        }
    }

    @Override
    public boolean contains(String id) {
        try (AutoLock ignored = AutoLock.read(lock)) {
            return points.containsKey(id);
        }
    }

    @Override
    public Coordinate pointOf(String id) {
        try (AutoLock ignored = AutoLock.read(lock)) {
            return points.get(id);
        }
    }

    @Override
    public int size() {
        try (AutoLock ignored = AutoLock.read(lock)) {
            return points.size();
        }
    }

    @Override
    public Set<String> ids() {
        try (AutoLock ignored = AutoLock.read(lock)) {
            return new HashSet<>(points.keySet());
        }
    }

    @Override
    public void clear() {
        try (AutoLock ignored = AutoLock.write(lock)) {
            points.clear();
            root = new Node(true);
        }
    }

    @Override
    public IndexStats stats() {
        try (AutoLock ignored = AutoLock.read(lock)) {
            int[] counts = new int[3]; // nodes, leaves, slots
            countNodes(root, counts);
            double occupancy = counts[0] == 0 ? 0.0 : (double) counts[2] / counts[0];
            return new IndexStats(points.size(), counts[0], counts[1], points.isEmpty() ? 0 : height(root),
                    occupancy, lastVisits.get(), linearScan);
        }
    }

    @Override
    public void setLinearScan(boolean enabled) {
        if (enabled != linearScan) {
            log.info("Spatial index linear scan {}", enabled ? "enabled" : "disabled");
        }
        this.linearScan = enabled;
    }

    @Override
    public boolean isLinearScan() {
        return linearScan;
    }

    @Override
    public List<String> verifyStructure() {
        try (AutoLock ignored = AutoLock.read(lock)) {
            List<String> violations = new ArrayList<>();
            Set<Integer> leafDepths = new HashSet<>();
            int[] entryCount = new int[1];
            verify(root, null, 1, leafDepths, entryCount, violations);
            if (leafDepths.size() > 1) {
                violations.add("Leaves found at different depths: " + leafDepths);
            }
            if (entryCount[0] != points.size()) {
                violations.add("Tree holds " + entryCount[0] + " entries but " + points.size() + " are registered");
            }
            return violations;
        }
    }

    /**
     * @throws IndexInconsistencyException when {@link #verifyStructure()} reports a violation
     */
    public void checkInvariants() {
        List<String> violations = verifyStructure();
        if (!violations.isEmpty()) {
            throw new IndexInconsistencyException("Spatial index structure is corrupted: " + violations);
        }
    }

    private Coordinate sanitize(String id, Coordinate point) {
        if (point.inRange()) return point;
        log.debug("Clamping out-of-range point {} for {}", point, id);
        return point.clamp();
    }

    // ---- insertion ----

    private void insertEntry(Entry e) {
        Node leaf = chooseLeaf(root, e.box());
        leaf.addEntry(e);
        adjustTree(leaf);
    }

    private Node chooseLeaf(Node node, BoundingBox box) {
        Node n = node;
        while (!n.leaf) {
            Node best = null;
            double bestEnlargement = Double.POSITIVE_INFINITY;
            double bestVolume = Double.POSITIVE_INFINITY;
            for (Node c : n.children) {
                double enlargement = c.box == null ? 0.0 : c.box.enlargement(box);
                double volume = c.box == null ? 0.0 : c.box.volume();
                if (enlargement < bestEnlargement || (enlargement == bestEnlargement && volume < bestVolume)) {
                    best = c;
                    bestEnlargement = enlargement;
                    bestVolume = volume;
                }
            }
            n = best;
        }
        return n;
    }

    private void adjustTree(Node start) {
        Node n = start;
        while (n != null) {
            if (n.size() > maxEntries) {
                Node sibling = split(n);
                if (n.parent == null) {
                    Node newRoot = new Node(false);
                    newRoot.addChild(n);
                    newRoot.addChild(sibling);
                    root = newRoot;
                    return;
                }
                n.parent.addChild(sibling);
                n.parent.recomputeBox();
            } else if (n.parent != null) {
                n.parent.recomputeBox();
            }
            n = n.parent;
        }
    }

    /**
     * Quadratic split. {@code node} keeps the first group, the returned sibling holds the second.
     */
    private Node split(Node node) {
        Node sibling = new Node(node.leaf);
        if (node.leaf) {
            List<List<Entry>> groups = quadraticSplit(new ArrayList<>(node.entries), Entry::box);
            node.entries.clear();
            groups.get(0).forEach(node.entries::add);
            groups.get(1).forEach(sibling::addEntry);
        } else {
            List<List<Node>> groups = quadraticSplit(new ArrayList<>(node.children), c -> c.box);
            node.children.clear();
            for (Node c : groups.get(0)) {
                node.children.add(c);
                c.parent = node;
            }
            groups.get(1).forEach(sibling::addChild);
        }
        node.recomputeBox();
        sibling.recomputeBox();
        return sibling;
    }

    private <T> List<List<T>> quadraticSplit(List<T> items, Function<T, BoundingBox> boxOf) {
        int seedA = 0;
        int seedB = 1;
        double worst = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < items.size(); i++) {
            BoundingBox bi = boxOf.apply(items.get(i));
            for (int j = i + 1; j < items.size(); j++) {
                BoundingBox bj = boxOf.apply(items.get(j));
                double waste = bi.union(bj).volume() - bi.volume() - bj.volume();
                if (waste > worst) {
                    worst = waste;
                    seedA = i;
                    seedB = j;
                }
            }
        }

        List<T> groupA = new ArrayList<>();
        List<T> groupB = new ArrayList<>();
        groupA.add(items.get(seedA));
        groupB.add(items.get(seedB));
        BoundingBox boxA = boxOf.apply(items.get(seedA));
        BoundingBox boxB = boxOf.apply(items.get(seedB));

        List<T> remaining = new ArrayList<>(items);
        remaining.remove(Math.max(seedA, seedB));
        remaining.remove(Math.min(seedA, seedB));

        while (!remaining.isEmpty()) {
            if (groupA.size() + remaining.size() == minEntries) {
                groupA.addAll(remaining);
                break;
            }
            if (groupB.size() + remaining.size() == minEntries) {
                groupB.addAll(remaining);
                break;
            }

            int pick = 0;
            double maxPreference = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < remaining.size(); i++) {
                BoundingBox b = boxOf.apply(remaining.get(i));
                double preference = Math.abs(boxA.enlargement(b) - boxB.enlargement(b));
                if (preference > maxPreference) {
                    maxPreference = preference;
                    pick = i;
                }
            }

            T item = remaining.remove(pick);
            BoundingBox b = boxOf.apply(item);
            double growA = boxA.enlargement(b);
            double growB = boxB.enlargement(b);
            boolean toA;
            if (growA != growB) {
                toA = growA < growB;
            } else if (boxA.volume() != boxB.volume()) {
                toA = boxA.volume() < boxB.volume();
            } else {
                toA = groupA.size() <= groupB.size();
            }
            if (toA) {
                groupA.add(item);
                boxA = boxA.union(b);
            } else {
                groupB.add(item);
                boxB = boxB.union(b);
            }
        }
        return List.of(groupA, groupB);
    }

    // ---- removal ----

    private boolean removeLocked(String id) {
        Coordinate p = points.remove(id);
        if (p == null) return false;
        Node leaf = findLeaf(root, id, p);
        if (leaf == null) {
            log.warn("Entry {} registered but missing from tree, repacking", id);
            List<Entry> all = new ArrayList<>(points.size());
            points.forEach((k, v) -> all.add(new Entry(k, v)));
            root = packTree(all);
            return true;
        }
        leaf.entries.removeIf(e -> e.id().equals(id));
        condenseTree(leaf);
        return true;
    }

    private Node findLeaf(Node node, String id, Coordinate p) {
        if (node.box == null || !node.box.contains(p)) return null;
        if (node.leaf) {
            for (Entry e : node.entries) {
                if (e.id().equals(id)) return node;
            }
            return null;
        }
        for (Node c : node.children) {
            Node found = findLeaf(c, id, p);
            if (found != null) return found;
        }
        return null;
    }

    private void condenseTree(Node leaf) {
        List<Entry> orphans = new ArrayList<>();
        Node n = leaf;
        while (n.parent != null) {
            Node parent = n.parent;
            if (n.size() < minEntries) {
                parent.children.remove(n);
                n.parent = null;
                collectEntries(n, orphans);
            } else {
                n.recomputeBox();
            }
            n = parent;
        }
        root.recomputeBox();

        while (!root.leaf && root.children.size() == 1) {
            root = root.children.get(0);
            root.parent = null;
        }
        if (!root.leaf && root.children.isEmpty()) {
            root = new Node(true);
        }
        for (Entry e : orphans) {
            insertEntry(e);
        }
    }

    private void collectEntries(Node node, List<Entry> out) {
        if (node.leaf) {
            out.addAll(node.entries);
        } else {
            for (Node c : node.children) collectEntries(c, out);
        }
    }

    // ---- bulk load ----

    private Node packTree(List<Entry> all) {
        if (all.isEmpty()) return new Node(true);

        List<Node> level = new ArrayList<>();
        for (List<Entry> group : tile(all, e -> e.point().x(), e -> e.point().y(), e -> e.point().z())) {
            Node leaf = new Node(true);
            group.forEach(leaf::addEntry);
            level.add(leaf);
        }

        while (level.size() > 1) {
            List<Node> parents = new ArrayList<>();
            for (List<Node> group : tile(level, n -> n.box.center().x(), n -> n.box.center().y(),
                    n -> n.box.center().z())) {
                Node parent = new Node(false);
                group.forEach(parent::addChild);
                parents.add(parent);
            }
            level = parents;
        }
        return level.get(0);
    }

    /**
     * Sort-Tile-Recursive grouping: x slabs, y runs inside each slab, z-sorted groups of
     * at most {@code maxEntries} inside each run.
     */
    private <T> List<List<T>> tile(List<T> items,
                                   ToDoubleFunction<T> xOf,
                                   ToDoubleFunction<T> yOf,
                                   ToDoubleFunction<T> zOf) {
        int n = items.size();
        int pages = (int) Math.ceil((double) n / maxEntries);
        int slices = (int) Math.ceil(Math.cbrt(pages));

        List<T> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingDouble(xOf));

        List<List<T>> groups = new ArrayList<>();
        for (List<T> slab : partition(sorted, slices)) {
            slab.sort(Comparator.comparingDouble(yOf));
            for (List<T> run : partition(slab, slices)) {
                run.sort(Comparator.comparingDouble(zOf));
                int chunks = (int) Math.ceil((double) run.size() / maxEntries);
                groups.addAll(partition(run, chunks));
            }
        }
        return groups;
    }

    /** Splits into {@code parts} contiguous chunks whose sizes differ by at most one. */
    private static <T> List<List<T>> partition(List<T> items, int parts) {
        int n = items.size();
        int count = Math.max(1, Math.min(parts, n));
        List<List<T>> out = new ArrayList<>(count);
        int base = n / count;
        int extra = n % count;
        int from = 0;
        for (int i = 0; i < count; i++) {
            int len = base + (i < extra ? 1 : 0);
            if (len == 0) continue;
            out.add(new ArrayList<>(items.subList(from, from + len)));
            from += len;
        }
        return out;
    }

    // ---- queries ----

    private void search(Node node, Coordinate center, double r2, List<String> out, int[] visits) {
        visits[0]++;
        if (node.box == null || node.box.minDistanceSquared(center) > r2) return;
        if (node.leaf) {
            for (Entry e : node.entries) {
                if (e.point().distanceSquared(center) <= r2) out.add(e.id());
            }
            return;
        }
        for (Node c : node.children) {
            if (c.box != null && c.box.minDistanceSquared(center) <= r2) {
                search(c, center, r2, out, visits);
            }
        }
    }

    private List<Neighbor> nearestLocked(Coordinate point, int k, String exclude) {
        if (k <= 0 || points.isEmpty()) return List.of();

        if (linearScan) {
            List<Neighbor> all = new ArrayList<>(points.size());
            points.forEach((id, p) -> {
                if (!id.equals(exclude)) all.add(new Neighbor(id, p.distanceTo(point)));
            });
            all.sort(Neighbor.ORDER);
            lastVisits.set(points.size());
            return List.copyOf(all.subList(0, Math.min(k, all.size())));
        }

        PriorityQueue<QueueItem> queue = new PriorityQueue<>(QUEUE_ORDER);
        queue.add(new QueueItem(root.box == null ? 0 : root.box.minDistanceSquared(point), root, null));
        List<Neighbor> out = new ArrayList<>(k);
        int visits = 0;

        while (!queue.isEmpty() && out.size() < k) {
            QueueItem item = queue.poll();
            if (item.entry() != null) {
                if (!item.entry().id().equals(exclude)) {
                    out.add(new Neighbor(item.entry().id(), Math.sqrt(item.distanceSquared())));
                }
                continue;
            }
            Node node = item.node();
            visits++;
            if (node.leaf) {
                for (Entry e : node.entries) {
                    queue.add(new QueueItem(e.point().distanceSquared(point), null, e));
                }
            } else {
                for (Node c : node.children) {
                    if (c.box != null) queue.add(new QueueItem(c.box.minDistanceSquared(point), c, null));
                }
            }
        }
        lastVisits.set(visits);
        out.sort(Neighbor.ORDER);
        return out;
    }

    // ---- diagnostics ----

    private static int height(Node node) {
        int h = 1;
        Node n = node;
        while (!n.leaf) {
            if (n.children.isEmpty()) break;
            n = n.children.get(0);
            h++;
        }
        return h;
    }

    private static void countNodes(Node node, int[] counts) {
        counts[0]++;
        counts[2] += node.size();
        if (node.leaf) {
            counts[1]++;
            return;
        }
        for (Node c : node.children) countNodes(c, counts);
    }

    private void verify(Node node, Node expectedParent, int depth, Set<Integer> leafDepths,
                        int[] entryCount, List<String> violations) {
        if (node.parent != expectedParent) {
            violations.add("Broken parent link at depth " + depth);
        }
        if (node.size() > maxEntries) {
            violations.add("Node at depth " + depth + " holds " + node.size() + " > " + maxEntries);
        }
        if (node.leaf) {
            leafDepths.add(depth);
            for (Entry e : node.entries) {
                entryCount[0]++;
                if (!containsUpward(node, e.point())) {
                    violations.add("Entry " + e.id() + " escapes an enclosing bounding box");
                }
                Coordinate registered = points.get(e.id());
                if (!e.point().equals(registered)) {
                    violations.add("Entry " + e.id() + " does not match its registered point");
                }
            }
            return;
        }
        if (node.children.isEmpty()) {
            violations.add("Empty internal node at depth " + depth);
        }
        for (Node c : node.children) {
            if (c.box != null && (node.box == null || !node.box.contains(c.box))) {
                violations.add("Child box escapes parent box at depth " + depth);
            }
            verify(c, node, depth + 1, leafDepths, entryCount, violations);
        }
    }

    private static boolean containsUpward(Node node, Coordinate p) {
        for (Node n = node; n != null; n = n.parent) {
            if (n.box == null || !n.box.contains(p)) return false;
        }
        return true;
    }
}

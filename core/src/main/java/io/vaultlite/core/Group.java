// file: src/main/java/io/vaultlite/core/Group.java
package io.vaultlite.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A named folder holding an ordered list of entries and nested groups.
 * <p>
 * The group exclusively owns its children. All searches are iterative
 * (explicit stack), so arbitrarily deep trees do not exhaust the call stack.
 * <p>
 * Single-writer discipline: do not mutate a tree while a traversal of it is
 * in progress.
 */
public final class Group implements Node {

    private final NodeId id;
    private final List<Node> children = new ArrayList<>();
    private String name;
    private Times times;

    /** New group with a fresh identity, timestamped now. */
    public Group(String name) {
        this(NodeId.random(), name, Times.now());
    }

    public Group(NodeId id, String name, Times times) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.times = Objects.requireNonNull(times, "times");
    }

    @Override public NodeId id() { return id; }

    @Override public Kind kind() { return Kind.GROUP; }

    @Override public Times times() { return times; }

    public void setTimes(Times times) {
        this.times = Objects.requireNonNull(times, "times");
    }

    public String name() { return name; }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /** Direct children in order (read-only view). */
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Append a child.
     * <p>
     * Precondition: no node with {@code node.id()} exists anywhere in the tree
     * this group belongs to, and {@code node} has no other parent. This is not
     * checked; duplicates are undefined behavior. Use
     * {@link Database#addChild(NodeId, Node)} for a checked insert.
     */
    public Group addChild(Node node) {
        children.add(Objects.requireNonNull(node, "node"));
        return this;
    }

    /** Detach the direct child at {@code index}; later siblings shift left. */
    public Node removeChildAt(int index) {
        return children.remove(index);
    }

    /** Detach the direct child with this identity, if any. */
    public Optional<Node> removeChild(NodeId childId) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).id().equals(childId)) {
                return Optional.of(children.remove(i));
            }
        }
        return Optional.empty();
    }

    // ---------- lookup ----------

    /**
     * Pre-order depth-first search, this group included. Returns the first
     * node with the identity.
     */
    public Optional<Node> findById(NodeId target) {
        for (Node n : traverse()) {
            if (n.id().equals(target)) return Optional.of(n);
        }
        return Optional.empty();
    }

    /** Like {@link #findById(NodeId)} but only matches entries. */
    public Optional<Entry> findEntry(NodeId target) {
        return findById(target).filter(Node::isEntry).map(Entry.class::cast);
    }

    /** Like {@link #findById(NodeId)} but only matches groups. */
    public Optional<Group> findGroup(NodeId target) {
        return findById(target).filter(Node::isGroup).map(Group.class::cast);
    }

    public Optional<Node> findByPath(String... path) {
        return findByPath(List.of(path));
    }

    /**
     * Resolve a path of names below this group.
     * <p>
     * Every segment but the last must name a child group. The last segment
     * names either a child group or a child entry whose {@link Entry#TITLE}
     * is equal to it. The first match in child order wins. Any miss returns
     * empty; an empty path resolves to this group.
     */
    public Optional<Node> findByPath(List<String> path) {
        Group current = this;
        for (int i = 0; i < path.size(); i++) {
            String segment = path.get(i);
            boolean last = i == path.size() - 1;
            Node next = null;
            for (Node child : current.children) {
                if (child instanceof Group g && g.name.equals(segment)) {
                    next = g;
                    break;
                }
                if (last && child instanceof Entry e && e.title().filter(segment::equals).isPresent()) {
                    next = e;
                    break;
                }
            }
            if (next == null) return Optional.empty();
            if (last) return Optional.of(next);
            current = (Group) next;
        }
        return Optional.of(current);
    }

    /**
     * Read-only search for the position of a strict descendant.
     * The group itself has no location and yields empty.
     */
    public Optional<NodeLocation> locate(NodeId target) {
        record Frame(Group group, List<NodeId> ancestry) {}

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(this, List.of(id)));
        while (!stack.isEmpty()) {
            Frame f = stack.pop();
            List<Node> kids = f.group().children;
            // Visit children in order; push subgroups in reverse so the stack stays pre-order.
            List<Frame> pending = new ArrayList<>();
            for (int i = 0; i < kids.size(); i++) {
                Node child = kids.get(i);
                if (child.id().equals(target)) {
                    return Optional.of(new NodeLocation(f.ancestry(), i, target));
                }
                if (child instanceof Group g) {
                    List<NodeId> ancestry = new ArrayList<>(f.ancestry());
                    ancestry.add(g.id);
                    pending.add(new Frame(g, ancestry));
                }
            }
            for (int i = pending.size() - 1; i >= 0; i--) {
                stack.push(pending.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Walk a location's ancestry from this group down to the parent group.
     * Empty if the tree changed so that the path no longer resolves.
     */
    public Optional<Group> resolveParent(NodeLocation location) {
        List<NodeId> ancestry = location.ancestry();
        if (!ancestry.get(0).equals(id)) return Optional.empty();
        Group current = this;
        for (int i = 1; i < ancestry.size(); i++) {
            NodeId step = ancestry.get(i);
            Group next = null;
            for (Node child : current.children) {
                if (child instanceof Group g && g.id.equals(step)) {
                    next = g;
                    break;
                }
            }
            if (next == null) return Optional.empty();
            current = next;
        }
        return Optional.of(current);
    }

    // ---------- traversal ----------

    /**
     * Pre-order, depth-first walk over this group and all descendants.
     * Each call (and each {@code iterator()}) starts a fresh walk.
     */
    public Iterable<Node> traverse() {
        return () -> new PreOrderIterator(this);
    }

    public Stream<Node> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(traverse().iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /** All entries below this group, pre-order. */
    public Stream<Entry> entries() {
        return stream().filter(Node::isEntry).map(Entry.class::cast);
    }

    /** This group and all groups below it, pre-order. */
    public Stream<Group> groups() {
        return stream().filter(Node::isGroup).map(Group.class::cast);
    }

    /** Number of nodes in this subtree, this group included. */
    public int size() {
        int n = 0;
        for (Node ignored : traverse()) n++;
        return n;
    }

    private static final class PreOrderIterator implements Iterator<Node> {
        private final Deque<Node> stack = new ArrayDeque<>();

        PreOrderIterator(Group start) {
            stack.push(start);
        }

        @Override public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override public Node next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            Node n = stack.pop();
            if (n instanceof Group g) {
                for (int i = g.children.size() - 1; i >= 0; i--) {
                    stack.push(g.children.get(i));
                }
            }
            return n;
        }
    }

    // ---------- copy ----------

    @Override
    public Group deepCopy() {
        record Pair(Group source, Group target) {}

        Group copy = shallowCopy();
        Deque<Pair> work = new ArrayDeque<>();
        work.push(new Pair(this, copy));
        while (!work.isEmpty()) {
            Pair p = work.pop();
            for (Node child : p.source().children) {
                if (child instanceof Group g) {
                    Group c = g.shallowCopy();
                    p.target().children.add(c);
                    work.push(new Pair(g, c));
                } else {
                    p.target().children.add(child.deepCopy());
                }
            }
        }
        return copy;
    }

    /** Same identity, name and times, no children. */
    public Group shallowCopy() {
        return new Group(id, name, times);
    }

    @Override
    public String toString() {
        return "Group{" + id + ", name=" + name + ", children=" + children.size() + "}";
    }
}

package com.minipar.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arena of scope frames owned by one interpreter.
 *
 * Frames are pushed and popped in LIFO order, so the innermost frame is always the
 * last one in the arena. Each frame records the index of its parent: a block frame's
 * parent is the frame that was innermost when it was pushed, a function frame's
 * parent is the root. Lookup follows parent indices, never the arena order.
 *
 * Declarations bind in the innermost frame. A plain assignment to a name that is
 * not bound anywhere creates it in the nearest function frame (the root at top
 * level), so values assigned inside if/while/SEQ bodies outlive the block.
 */
public final class ScopeChain {
    public static final int ROOT = 0;
    private static final int NO_PARENT = -1;

    private static final class Frame {
        final Map<String, Value> bindings;
        final int parent;
        final boolean function;

        Frame(Map<String, Value> bindings, int parent, boolean function) {
            this.bindings = bindings;
            this.parent = parent;
            this.function = function;
        }
    }

    private final List<Frame> frames = new ArrayList<>();

    public ScopeChain() {
        frames.add(new Frame(new LinkedHashMap<>(), NO_PARENT, true));
    }

    private ScopeChain(List<Frame> copy) {
        frames.addAll(copy);
    }

    /** Child of the current innermost frame (if/while bodies, SEQ and bare blocks). */
    public void pushBlock() {
        frames.add(new Frame(new LinkedHashMap<>(), innermost(), false));
    }

    /** Function call frame: sees globals and its own locals only. */
    public void pushFunction() {
        frames.add(new Frame(new LinkedHashMap<>(), ROOT, true));
    }

    public void pop() {
        if (frames.size() <= 1) throw new IllegalStateException("cannot pop the root frame");
        frames.remove(frames.size() - 1);
    }

    private int innermost() { return frames.size() - 1; }

    /** First binding found walking outward, or null. */
    public Value lookup(String name) {
        for (int i = innermost(); i != NO_PARENT; i = frames.get(i).parent) {
            Value v = frames.get(i).bindings.get(name);
            if (v != null) return v;
        }
        return null;
    }

    /** Plain assignment: update the visible binding, else create one in the nearest function frame. */
    public void assign(String name, Value value) {
        int owner = NO_PARENT;
        for (int i = innermost(); i != NO_PARENT; i = frames.get(i).parent) {
            Frame f = frames.get(i);
            if (f.bindings.containsKey(name)) {
                f.bindings.put(name, value);
                return;
            }
            if (owner == NO_PARENT && f.function) owner = i;
        }
        frames.get(owner).bindings.put(name, value);
    }

    /** Declaration: always binds in the innermost frame. */
    public void declare(String name, Value value) {
        frames.get(innermost()).bindings.put(name, value);
    }

    public void defineGlobal(String name, Value value) {
        frames.get(ROOT).bindings.put(name, value);
    }

    /**
     * Independent copy of every frame. Values are immutable and are shared;
     * only the maps are copied.
     */
    public ScopeChain snapshot() {
        List<Frame> copy = new ArrayList<>(frames.size());
        for (Frame f : frames) {
            copy.add(new Frame(new LinkedHashMap<>(f.bindings), f.parent, f.function));
        }
        return new ScopeChain(copy);
    }

    /** Read-only copy of the root frame's bindings. */
    public Map<String, Value> globals() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(frames.get(ROOT).bindings));
    }
}

/*
 * AbstractDeepMap.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.otree;
import java.util.*;

/**
 * This class provides a skeletal implementation of the DeepMap interface.  All
 * the deep operations are implemented here in terms of the ordinary
 * <code>Map</code> operations plus {@link #moveToEnd} and
 * {@link #boundaryEntry}, which a subclass must supply along with
 * <code>entrySet</code> and <code>put</code>.
 *
 * @author Scott L. Burson
 */

public abstract class AbstractDeepMap<Key, Val>
    extends AbstractMap<Key, Node<Key, Val>>
    implements DeepMap<Key, Val>
{

    /**
     * Returns the first (or, if <code>last</code>, the last) entry of this level,
     * or null if this level is empty.
     */
    protected abstract Map.Entry<Key, Node<Key, Val>> boundaryEntry(boolean last);

    public abstract void moveToEnd(Key key, boolean last);

    /****************/
    // Node

    /**
     * Returns true.
     */
    public final boolean isMap() {
	return true;
    }

    /**
     * Returns this map.
     */
    public final DeepMap<Key, Val> asMap() {
	return this;
    }

    /**
     * Unsupported; a map has no plain value.
     */
    public final Val value() {
	throw new UnsupportedOperationException();
    }

    /****************/
    // Single-level access

    public Node<Key, Val> putValue(Key key, Val value) {
	return put(key, Leaf.<Key, Val>of(value));
    }

    public Val getValue(Object key) {
	Node<Key, Val> node = get(key);
	return node == null || node.isMap() ? null : node.value();
    }

    public DeepMap<Key, Val> getMap(Object key) {
	Node<Key, Val> node = get(key);
	return node != null && node.isMap() ? node.asMap() : null;
    }

    public Key firstKey() {
	Map.Entry<Key, Node<Key, Val>> ent = boundaryEntry(false);
	if (ent == null) throw new NoSuchElementException();
	return ent.getKey();
    }

    public Key lastKey() {
	Map.Entry<Key, Node<Key, Val>> ent = boundaryEntry(true);
	if (ent == null) throw new NoSuchElementException();
	return ent.getKey();
    }

    public Iterator<Map.Entry<Key, Node<Key, Val>>> iterator() {
	return entrySet().iterator();
    }

    /****************/
    // Deep containment

    public boolean deepContains(Object target, boolean byKey, int depth) {
	if (byKey ? containsKey(target) : containsNode(target)) return true;
	if (depth != 0) {
	    for (Node<Key, Val> node : values()) {
		if (node.isMap() && node.asMap().deepContains(target, byKey, depth - 1))
		    return true;
	    }
	}
	return false;
    }

    public boolean deepContainsKey(Object key) {
	return deepContains(key, true, -1);
    }

    public boolean deepContainsValue(Object value) {
	return deepContains(value, false, -1);
    }

    private boolean containsNode(Object target) {
	for (Node<Key, Val> node : values()) {
	    if (eql(node, target) || (!node.isMap() && eql(node.value(), target)))
		return true;
	}
	return false;
    }

    /****************/
    // Deep move

    public void deepMoveToEnd(Key key, boolean last, int depth) {
	if (!tryDeepMoveToEnd(key, last, depth))
	    throw new NoSuchElementException("Key not found: " + key);
    }

    public void deepMoveToEnd(Key key) {
	deepMoveToEnd(key, true, -1);
    }

    public boolean tryDeepMoveToEnd(Key key, boolean last, int depth) {
	// Moves below reorder this level, so walk a copy of the original order.
	List<Key> snapshot = new ArrayList<Key>(keySet());
	boolean moved = false;
	if (containsKey(key)) {
	    moveToEnd(key, last);
	    moved = true;
	}
	if (depth != 0) {
	    for (Key k : snapshot) {
		DeepMap<Key, Val> child = getMap(k);
		// The existence check is unbounded; the move itself honors `depth', so a
		// child whose only occurrences lie too deep reports false here.
		if (child != null && child.deepContainsKey(key) &&
		    child.tryDeepMoveToEnd(key, last, depth - 1)) {
		    moveToEnd(k, last);
		    moved = true;
		}
	    }
	}
	return moved;
    }

    /****************/
    // Boundary entries

    public Object end(EndKind kind, boolean last, int depth) {
	if (kind == null) throw new IllegalArgumentException("End kind must not be null");
	return kind.select(endEntry(last, depth));
    }

    public Key endKey(boolean last, int depth) {
	return endEntry(last, depth).getKey();
    }

    public Node<Key, Val> endValue(boolean last, int depth) {
	return endEntry(last, depth).getValue();
    }

    public Map.Entry<Key, Node<Key, Val>> endEntry(boolean last, int depth) {
	Map.Entry<Key, Node<Key, Val>> ent = boundaryEntry(last);
	if (ent == null) throw new NoSuchElementException();
	Node<Key, Val> node = ent.getValue();
	if (depth != 0 && node.isMap() && !node.asMap().isEmpty())
	    return node.asMap().endEntry(last, depth - 1);
	return new AbstractMap.SimpleImmutableEntry<Key, Node<Key, Val>>(ent);
    }

    public Map<Key, Key> endKeysOfChildren(boolean last) {
	Map<Key, Key> res = new LinkedHashMap<Key, Key>();
	for (Map.Entry<Key, Node<Key, Val>> ent : this) {
	    Node<Key, Val> node = ent.getValue();
	    if (node.isMap() && !node.asMap().isEmpty())
		res.put(ent.getKey(), node.asMap().endKey(last, 0));
	}
	return res;
    }

    /****************/
    // Extremum comparisons

    public boolean lessThan(Object other, boolean useMax, boolean byKey) {
	return compareExtremum(other, useMax, byKey) < 0;
    }

    public boolean greaterThan(Object other, boolean useMax, boolean byKey) {
	return compareExtremum(other, useMax, byKey) > 0;
    }

    private int compareExtremum(Object other, boolean useMax, boolean byKey) {
	if (isEmpty())
	    throw new IllegalArgumentException("Cannot take the " + (useMax ? "max" : "min") +
					       " of an empty level");
	Comparable<Object> ext = null;
	try {
	    for (Object elt : byKey ? keySet() : plainValues()) {
		Comparable<Object> c = comparable(elt);
		if (ext == null) ext = c;
		else {
		    int res = c.compareTo(ext);
		    if (useMax ? res > 0 : res < 0) ext = c;
		}
	    }
	    return ext.compareTo(comparable(other));
	} catch (ClassCastException e) {
	    throw new IllegalArgumentException("Elements are not mutually comparable", e);
	}
    }

    private List<Object> plainValues() {
	List<Object> res = new ArrayList<Object>(size());
	for (Node<Key, Val> node : values())
	    res.add(node.isMap() ? node : node.value());
	return res;
    }

    @SuppressWarnings("unchecked")
    private static Comparable<Object> comparable(Object x) {
	if (!(x instanceof Comparable))
	    throw new IllegalArgumentException("Not comparable: " + x);
	return (Comparable<Object>)x;
    }

    /****************/
    // Debugging

    /**
     * Returns a multi-line rendering of this map and everything nested in it, one
     * entry per line, indented by depth.
     */
    String dump() {
	StringBuilder sb = new StringBuilder();
	dump(this, "", sb);
	return sb.toString();
    }

    private static void dump(DeepMap<?, ?> map, String indent, StringBuilder sb) {
	for (Map.Entry<?, ? extends Node<?, ?>> ent : map.entrySet()) {
	    Node<?, ?> node = ent.getValue();
	    sb.append(indent).append(ent.getKey()).append(" ->");
	    if (!node.isMap()) sb.append(' ').append(node.value()).append('\n');
	    else if (node.asMap().isEmpty()) sb.append(" {}\n");
	    else {
		sb.append('\n');
		dump(node.asMap(), indent + "  ", sb);
	    }
	}
    }

    static boolean eql(Object x, Object y) {
	return x == null ? y == null : x.equals(y);
    }

}

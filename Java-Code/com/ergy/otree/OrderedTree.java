/*
 * OrderedTree.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.otree;
import java.util.*;

/**
 * A mutable, insertion-ordered {@link DeepMap}.  Nested levels are usually
 * <code>OrderedTree</code>s as well, created with {@link #putMap}, but any
 * <code>DeepMap</code> may be stored as a value.
 *
 * <p>It is implemented as a hash table indexing a circular doubly-linked list of
 * entries, so that an entry can be moved to either end of the iteration order in
 * constant time.
 *
 * <p>Time costs: <code>get</code>, <code>put</code>, <code>remove</code>,
 * <code>containsKey</code>, <code>moveToEnd</code>, <code>firstKey</code>, and
 * <code>lastKey</code> take O(1) time.  <code>containsValue</code> takes O(n)
 * time.  The deep operations take time linear in the number of entries in the
 * levels they examine; <code>deepMoveToEnd</code> may examine a nested level once
 * for each of its ancestors.
 *
 * <p><code>OrderedTree</code> accepts the null key.  It does not accept null
 * values; to store a null plain value, use {@link #putValue} (or store
 * <code>Leaf.of(null)</code>).
 *
 * <p>A constructor taking an <code>Object[][]</code> is provided for convenience
 * in writing literals; one may write, for instance,
 *
 * <pre>
 *     OrderedTree&lt;String, Integer&gt; sched = new OrderedTree&lt;String, Integer&gt;(
 *         new Object[][] { { "0:0", new OrderedTree&lt;String, Integer&gt;(
 *                                   new Object[][] { { "m1", 5 } }) },
 *                          { "0:1", 7 } });
 * </pre>
 *
 * <p>The iterators returned by this class's collection views are fail-fast: any
 * change to the map's contents or order after the iterator is created, except
 * through the iterator's own <code>remove</code>, causes it to throw
 * <code>ConcurrentModificationException</code>.  Note that <code>moveToEnd</code>
 * is such a change.  This class is not synchronized.
 *
 * <p><code>OrderedTree</code> implements {@link java.io.Serializable}; an instance
 * is serializable provided that all keys and nodes it contains are.
 *
 * @author Scott L. Burson
 * @see DeepMap
 */

public class OrderedTree<Key, Val>
    extends AbstractDeepMap<Key, Val>
    implements java.io.Serializable
{

    /**
     * Constructs an empty <code>OrderedTree</code>.
     */
    public OrderedTree() {
	initialize();
    }

    /**
     * Constructs an <code>OrderedTree</code> containing the same entries as
     * <code>map</code>, in the iteration order of <code>map</code>.  Nested maps
     * are stored as they are, not copied.
     *
     * @param map the map to use the entries of
     */
    public OrderedTree(Map<? extends Key, ? extends Node<Key, Val>> map) {
	initialize();
	putAll(map);
    }

    /**
     * Constructs an <code>OrderedTree</code>, initializing it from
     * <code>ary</code>, which should be an array of key/value pairs represented as
     * arrays of length 2, containing the key at index 0 and the value at index 1.
     * A value which is a {@link Node} is stored as is; any other value is wrapped
     * in a {@link Leaf}.  Entries appear in the order given; if a key is
     * duplicated, its last value is kept at its first position.
     *
     * @param ary the array of pairs
     * @throws IllegalArgumentException if some element of <code>ary</code> is not
     * of length 2
     */
    @SuppressWarnings("unchecked")
    public OrderedTree(Object[][] ary) {
	initialize();
	for (int i = 0, len = ary.length; i < len; ++i) {
	    Object[] pr = ary[i];
	    if (pr.length != 2)
		throw new IllegalArgumentException("Pair " + i + " has length " + pr.length);
	    Object v = pr[1];
	    put((Key)pr[0], v instanceof Node ? (Node<Key, Val>)v : Leaf.<Key, Val>of((Val)v));
	}
    }

    /**
     * Constructs and returns an <code>OrderedTree</code> containing the pairs
     * enumerated by <code>pairs</code>, in that order.
     *
     * @param pairs the pairs
     * @return the new <code>OrderedTree</code>
     */
    public static <Key, Val> OrderedTree<Key, Val>
	   fromPairs(Iterable<? extends Map.Entry<? extends Key, ? extends Node<Key, Val>>> pairs) {
	OrderedTree<Key, Val> t = new OrderedTree<Key, Val>();
	for (Map.Entry<? extends Key, ? extends Node<Key, Val>> ent : pairs)
	    t.put(ent.getKey(), ent.getValue());
	return t;
    }

    private void initialize() {
	index = new HashMap<Object, Entry<Key, Val>>();
	header = new Entry<Key, Val>(null, null);
	header.prev = header.next = header;
	modCount = 0;
    }

    public int size() {
	return index.size();
    }

    public boolean isEmpty() {
	return index.isEmpty();
    }

    public boolean containsKey(Object key) {
	return index.containsKey(key);
    }

    public Node<Key, Val> get(Object key) {
	Entry<Key, Val> e = index.get(key);
	return e == null ? null : e.value;
    }

    /**
     * Stores <code>node</code> under <code>key</code>.  A new key goes at the end
     * of the iteration order; an existing key keeps its position.
     *
     * @throws NullPointerException if <code>node</code> is null
     * @throws IllegalArgumentException if <code>node</code> is this map or has this
     * map nested in it
     */
    public Node<Key, Val> put(Key key, Node<Key, Val> node) {
	checkNode(node);
	Entry<Key, Val> e = index.get(key);
	if (e != null) {
	    Node<Key, Val> old = e.value;
	    e.value = node;
	    return old;
	}
	e = new Entry<Key, Val>(key, node);
	linkBefore(e, header);
	index.put(key, e);
	++modCount;
	return null;
    }

    public Node<Key, Val> remove(Object key) {
	Entry<Key, Val> e = index.remove(key);
	if (e == null) return null;
	unlink(e);
	++modCount;
	return e.value;
    }

    public void clear() {
	index.clear();
	header.prev = header.next = header;
	++modCount;
    }

    /**
     * Returns the nested map stored under <code>key</code>, first storing a new,
     * empty <code>OrderedTree</code> there if <code>key</code> is not present.
     *
     * @param key the key
     * @return the nested map
     * @throws IllegalArgumentException if <code>key</code> maps to a leaf
     */
    public DeepMap<Key, Val> putMap(Key key) {
	Node<Key, Val> node = get(key);
	if (node == null) {
	    OrderedTree<Key, Val> child = new OrderedTree<Key, Val>();
	    put(key, child);
	    return child;
	} else if (!node.isMap())
	    throw new IllegalArgumentException("Key " + key + " maps to leaf " + node);
	else return node.asMap();
    }

    public void moveToEnd(Key key, boolean last) {
	Entry<Key, Val> e = index.get(key);
	if (e == null) throw new NoSuchElementException("Key not found: " + key);
	if ((last ? e.next : e.prev) == header) return;
	unlink(e);
	if (last) linkBefore(e, header);
	else linkBefore(e, header.next);
	++modCount;
    }

    protected Map.Entry<Key, Node<Key, Val>> boundaryEntry(boolean last) {
	if (header.next == header) return null;
	return last ? header.prev : header.next;
    }

    /**
     * Returns a copy of this map in which every nested map, at every depth, is
     * also copied (as an <code>OrderedTree</code>).  Leaves are shared.
     *
     * @return the copy
     */
    public OrderedTree<Key, Val> deepCopy() {
	return copyOf(this);
    }

    private static <Key, Val> OrderedTree<Key, Val> copyOf(DeepMap<Key, Val> map) {
	OrderedTree<Key, Val> res = new OrderedTree<Key, Val>();
	for (Map.Entry<Key, Node<Key, Val>> ent : map) {
	    Node<Key, Val> node = ent.getValue();
	    res.put(ent.getKey(), node.isMap() ? copyOf(node.asMap()) : node);
	}
	return res;
    }

    public Set<Map.Entry<Key, Node<Key, Val>>> entrySet() {
	if (entrySet == null) entrySet = new EntrySet();
	return entrySet;
    }

    private void checkNode(Node<Key, Val> node) {
	if (node == null)
	    throw new NullPointerException("OrderedTree does not accept null values; use Leaf.of(null)");
	if (node.isMap() && (node == this || reaches(node.asMap(), this)))
	    throw new IllegalArgumentException("A map may not be stored inside itself");
    }

    // True if `target' is `map' itself or is nested anywhere in it.
    private static boolean reaches(DeepMap<?, ?> map, Object target) {
	for (Node<?, ?> node : map.values()) {
	    if (node.isMap() && (node == target || reaches(node.asMap(), target)))
		return true;
	}
	return false;
    }

    private static <Key, Val> void linkBefore(Entry<Key, Val> e, Entry<Key, Val> succ) {
	e.next = succ;
	e.prev = succ.prev;
	succ.prev.next = e;
	succ.prev = e;
    }

    private static <Key, Val> void unlink(Entry<Key, Val> e) {
	e.prev.next = e.next;
	e.next.prev = e.prev;
	e.prev = e.next = null;
    }

    /****************/
    // Debugging

    /**
     * Checks the internal consistency of this level: the links are symmetric, the
     * list and the index hold the same entries, and nothing stored here is this
     * map itself.
     */
    boolean verify() {
	int n = 0;
	for (Entry<Key, Val> e = header.next; e != header; e = e.next) {
	    if (e.next.prev != e || e.prev.next != e) return false;
	    if (index.get(e.key) != e) return false;
	    if (e.value == null || e.value == this) return false;
	    if (++n > index.size()) return false;
	}
	return n == index.size();
    }

    /****************/
    // Internal classes

    private static final class Entry<Key, Val> implements Map.Entry<Key, Node<Key, Val>> {
	Entry(Key k, Node<Key, Val> v) {
	    key = k;
	    value = v;
	}
	final Key key;
	Node<Key, Val> value;
	Entry<Key, Val> prev, next;

	public Key getKey() {
	    return key;
	}
	public Node<Key, Val> getValue() {
	    return value;
	}
	public Node<Key, Val> setValue(Node<Key, Val> v) {
	    // Callers check `v' with checkNode first.
	    Node<Key, Val> old = value;
	    value = v;
	    return old;
	}
	public boolean equals(Object obj) {
	    if (!(obj instanceof Map.Entry)) return false;
	    Map.Entry<?, ?> ent = (Map.Entry<?, ?>)obj;
	    return eql(key, ent.getKey()) && eql(value, ent.getValue());
	}
	public int hashCode() {
	    return (key == null ? 0 : key.hashCode()) ^ (value == null ? 0 : value.hashCode());
	}
	public String toString() {
	    return key + "=" + value;
	}
    }

    private final class EntrySet extends AbstractSet<Map.Entry<Key, Node<Key, Val>>> {
	public Iterator<Map.Entry<Key, Node<Key, Val>>> iterator() {
	    return new OTIterator();
	}
	public int size() {
	    return index.size();
	}
	public boolean contains(Object obj) {
	    if (!(obj instanceof Map.Entry)) return false;
	    Map.Entry<?, ?> ent = (Map.Entry<?, ?>)obj;
	    Entry<Key, Val> e = index.get(ent.getKey());
	    return e != null && eql(e.value, ent.getValue());
	}
	public boolean remove(Object obj) {
	    if (!contains(obj)) return false;
	    OrderedTree.this.remove(((Map.Entry<?, ?>)obj).getKey());
	    return true;
	}
	public void clear() {
	    OrderedTree.this.clear();
	}
    }

    private final class OTIterator implements Iterator<Map.Entry<Key, Node<Key, Val>>> {
	private Entry<Key, Val> next = header.next;
	private Entry<Key, Val> lastReturned = null;
	private int expectedModCount = modCount;

	public boolean hasNext() {
	    return next != header;
	}

	public Map.Entry<Key, Node<Key, Val>> next() {
	    if (modCount != expectedModCount) throw new ConcurrentModificationException();
	    if (next == header) throw new NoSuchElementException();
	    lastReturned = next;
	    next = next.next;
	    return new IteratorEntry(lastReturned);
	}

	public void remove() {
	    if (lastReturned == null) throw new IllegalStateException();
	    if (modCount != expectedModCount) throw new ConcurrentModificationException();
	    OrderedTree.this.remove(lastReturned.key);
	    lastReturned = null;
	    expectedModCount = modCount;
	}
    }

    // Wraps a live entry so that `setValue' goes through the same checks as `put'.
    private final class IteratorEntry implements Map.Entry<Key, Node<Key, Val>> {
	private final Entry<Key, Val> entry;
	IteratorEntry(Entry<Key, Val> e) {
	    entry = e;
	}
	public Key getKey() {
	    return entry.key;
	}
	public Node<Key, Val> getValue() {
	    return entry.value;
	}
	public Node<Key, Val> setValue(Node<Key, Val> v) {
	    checkNode(v);
	    return entry.setValue(v);
	}
	public boolean equals(Object obj) {
	    return entry.equals(obj);
	}
	public int hashCode() {
	    return entry.hashCode();
	}
	public String toString() {
	    return entry.toString();
	}
    }

    private transient HashMap<Object, Entry<Key, Val>> index;
    // Sentinel of the circular list: `header.next' is the first entry and
    // `header.prev' the last.
    private transient Entry<Key, Val> header;
    private transient int modCount;
    private transient EntrySet entrySet;

    private static final long serialVersionUID = 1L;

    /**
     * Saves the state of this <code>OrderedTree</code> to a stream.
     *
     * @serialData The size of the map [<code>int</code>]; then the key/node
     * pairs in iteration order [<code>Object</code>s].
     */
    private void writeObject(java.io.ObjectOutputStream strm)
        throws java.io.IOException {
	strm.defaultWriteObject();
	strm.writeInt(size());
	for (Entry<Key, Val> e = header.next; e != header; e = e.next) {
	    strm.writeObject(e.key);
	    strm.writeObject(e.value);
	}
    }

    /**
     * Reconstitutes the <code>OrderedTree</code> instance from a stream.
     */
    @SuppressWarnings("unchecked")
    private void readObject(java.io.ObjectInputStream strm)
        throws java.io.IOException, ClassNotFoundException {
	strm.defaultReadObject();
	initialize();
	int size = strm.readInt();
	for (int i = 0; i < size; ++i) {
	    Key key = (Key)strm.readObject();
	    Entry<Key, Val> e = new Entry<Key, Val>(key, (Node<Key, Val>)strm.readObject());
	    linkBefore(e, header);
	    index.put(key, e);
	}
    }

}

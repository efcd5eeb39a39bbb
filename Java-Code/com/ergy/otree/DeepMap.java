/*
 * DeepMap.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.otree;
import java.util.*;

/**
 * An insertion-ordered map whose values are {@link Node}s, some of which may
 * themselves be <code>DeepMap</code>s.  Viewed as a whole, a <code>DeepMap</code>
 * and the maps nested in it form a tree; each map is one <i>level</i> of that
 * tree.
 *
 * <p>In addition to the operations of {@link Map}, this interface declares
 * several <i>deep</i> operations, whose search or effect spans nested levels.
 * Each takes a <code>depth</code> argument that bounds how far down it goes:
 * <code>0</code> restricts it to this level, a positive <i>n</i> allows <i>n</i>
 * levels below this one, and any negative value leaves it unbounded.
 *
 * <p>Iteration order is insertion order, except as changed by
 * {@link #moveToEnd} and {@link #deepMoveToEnd}.  Storing a value under a key
 * which is already present does not change the key's position.
 *
 * <p>The same key may occur at several levels at once; keys are unique only
 * within a single level.  A map may not contain itself, directly or at any depth;
 * attempting to store a map where it would create such a cycle throws
 * <code>IllegalArgumentException</code>.
 *
 * <p>Implementations are not required to be thread-safe.  Deep operations update
 * several levels one after another, so a tree shared between threads should be
 * guarded by a single lock for the whole tree rather than one per level.
 *
 * @author Scott L. Burson
 * @see OrderedTree
 */

public interface DeepMap<Key, Val>
    extends Map<Key, Node<Key, Val>>, Node<Key, Val>, Iterable<Map.Entry<Key, Node<Key, Val>>>
{

    /**
     * Stores <code>value</code>, wrapped in a {@link Leaf}, under <code>key</code>.
     *
     * @param key the key
     * @param value the plain value
     * @return the previous node stored under <code>key</code>, or null if none
     */
    public Node<Key, Val> putValue(Key key, Val value);

    /**
     * Returns the plain value stored under <code>key</code>, or null if there is
     * none or if the key maps to a nested map.
     *
     * @param key the key
     * @return the leaf value, or null
     */
    public Val getValue(Object key);

    /**
     * Returns the nested map stored under <code>key</code>, or null if there is
     * none or if the key maps to a leaf.
     *
     * @param key the key
     * @return the nested map, or null
     */
    public DeepMap<Key, Val> getMap(Object key);

    /**
     * Returns the first key of this level.
     *
     * @return the first key
     * @throws NoSuchElementException if this map is empty
     */
    public Key firstKey();

    /**
     * Returns the last key of this level.
     *
     * @return the last key
     * @throws NoSuchElementException if this map is empty
     */
    public Key lastKey();

    /**
     * Moves the entry for <code>key</code> to the end of this level's iteration
     * order if <code>last</code> is true, or to the front if it is false.  Nested
     * levels are not examined.
     *
     * @param key the key to move
     * @param last whether to move to the end rather than the front
     * @throws NoSuchElementException if this level does not contain <code>key</code>
     */
    public void moveToEnd(Key key, boolean last);

    /**
     * Returns true if <code>target</code> occurs in this map or in a nested map
     * no more than <code>depth</code> levels down.  If <code>byKey</code> is true,
     * the keys of each level are searched; otherwise the values are, in which case
     * <code>target</code> matches a node equal to it (so a whole nested map counts
     * as one value) or a leaf whose plain value is equal to it.
     *
     * <p>The current level is always searched, even when <code>depth</code> is 0.
     *
     * @param target the key or value to look for
     * @param byKey whether to search keys rather than values
     * @param depth the depth bound
     * @return whether <code>target</code> was found
     */
    public boolean deepContains(Object target, boolean byKey, int depth);

    /**
     * Equivalent to <code>deepContains(key, true, -1)</code>.
     */
    public boolean deepContainsKey(Object key);

    /**
     * Equivalent to <code>deepContains(value, false, -1)</code>.
     */
    public boolean deepContainsValue(Object value);

    /**
     * Moves <code>key</code> to the end (or front) of every level, down to
     * <code>depth</code> levels, at which it occurs, and pulls the entry linking
     * each such level to its parent to the same boundary of the parent, all the way
     * up to this map.  After the call, every path from this map to a relocated
     * occurrence of <code>key</code> runs along the chosen boundary.
     *
     * <p>The entries of this level are examined in the order they had before the
     * call.  Every nested map that contains <code>key</code> anywhere below it is
     * processed, not only the first.  When <code>key</code> occurs in several
     * branches, each branch is pulled to the boundary in turn, so the branch
     * processed last ends up nearest the boundary; no other ordering among them is
     * guaranteed.
     *
     * @param key the key to move
     * @param last whether to move to the end rather than the front
     * @param depth the depth bound
     * @throws NoSuchElementException if <code>key</code> occurs nowhere within
     * <code>depth</code> levels; in that case this map is left unchanged
     */
    public void deepMoveToEnd(Key key, boolean last, int depth);

    /**
     * Equivalent to <code>deepMoveToEnd(key, true, -1)</code>.
     */
    public void deepMoveToEnd(Key key);

    /**
     * Like {@link #deepMoveToEnd(Object, boolean, int)}, but returns false instead
     * of throwing when <code>key</code> is not found.
     *
     * @param key the key to move
     * @param last whether to move to the end rather than the front
     * @param depth the depth bound
     * @return whether any occurrence of <code>key</code> was moved
     */
    public boolean tryDeepMoveToEnd(Key key, boolean last, int depth);

    /**
     * Descends along the last (or first) entries of successive levels, at most
     * <code>depth</code> levels down, and returns the part of the final boundary
     * entry selected by <code>kind</code>.  Descent stops early at an entry whose
     * value is a leaf or an empty map.
     *
     * @param kind which part of the entry to return
     * @param last whether to follow the last entries rather than the first
     * @param depth the depth bound
     * @return the key, value, or entry found
     * @throws IllegalArgumentException if <code>kind</code> is null
     * @throws NoSuchElementException if this map is empty
     */
    public Object end(EndKind kind, boolean last, int depth);

    /**
     * Returns the key found by {@link #end}.
     */
    public Key endKey(boolean last, int depth);

    /**
     * Returns the value found by {@link #end}.
     */
    public Node<Key, Val> endValue(boolean last, int depth);

    /**
     * Returns the entry found by {@link #end}, as an immutable
     * <code>Map.Entry</code>.
     */
    public Map.Entry<Key, Node<Key, Val>> endEntry(boolean last, int depth);

    /**
     * Returns, for each nested map stored in this level, in iteration order, the
     * first or last key of that nested map.  Leaves and empty nested maps are
     * skipped.
     *
     * @param last whether to take the last keys rather than the first
     * @return a map from each key of this level to the boundary key below it
     */
    public Map<Key, Key> endKeysOfChildren(boolean last);

    /**
     * Returns true if the least (or, if <code>useMax</code>, the greatest) of this
     * level's keys (if <code>byKey</code>) or values is less than
     * <code>other</code>, by natural ordering.  Leaves are compared by their plain
     * values.  Nested levels are not examined.
     *
     * @param other the value to compare against
     * @param useMax whether to use the greatest element rather than the least
     * @param byKey whether to use the keys rather than the values
     * @return the result of the comparison
     * @throws IllegalArgumentException if this level is empty, or if its elements
     * are not mutually comparable or not comparable to <code>other</code>
     */
    public boolean lessThan(Object other, boolean useMax, boolean byKey);

    /**
     * Like {@link #lessThan}, but tests for greater than.
     */
    public boolean greaterThan(Object other, boolean useMax, boolean byKey);

    /**
     * Returns an iterator over the entries of this level, in order.
     *
     * @return the iterator
     */
    public Iterator<Map.Entry<Key, Node<Key, Val>>> iterator();

}

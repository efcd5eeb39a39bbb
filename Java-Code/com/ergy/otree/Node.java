/*
 * Node.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.otree;

/**
 * A value stored in a {@link DeepMap}: either a {@link Leaf}, which wraps a plain
 * value, or another <code>DeepMap</code>, which is a nested level of the same tree.
 *
 * <p>Deep operations decide whether to descend into a value by calling
 * {@link #isMap}; they never probe a value by trying to use it as a map and
 * catching the failure.
 *
 * @author Scott L. Burson
 * @see Leaf
 * @see DeepMap
 */

public interface Node<Key, Val> {

    /**
     * Returns true if this node is itself a map, i.e., a nested level that deep
     * operations may descend into.
     *
     * @return whether this node is a map
     */
    public boolean isMap();

    /**
     * Returns this node as a map.
     *
     * @return this node, viewed as a map
     * @throws ClassCastException if this node is a leaf
     */
    public DeepMap<Key, Val> asMap();

    /**
     * Returns the plain value wrapped by this node.
     *
     * @return the leaf value
     * @throws UnsupportedOperationException if this node is a map
     */
    public Val value();

}

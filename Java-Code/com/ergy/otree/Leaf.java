/*
 * Leaf.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.otree;

/**
 * An immutable node wrapping a plain value.  Two leaves are equal if their
 * values are equal.  A leaf may wrap <code>null</code>.
 *
 * @author Scott L. Burson
 */

public final class Leaf<Key, Val> implements Node<Key, Val>, java.io.Serializable {

    private final Val value;

    private Leaf(Val value) {
	this.value = value;
    }

    /**
     * Returns a leaf wrapping <code>value</code>.
     *
     * @param value the value to wrap
     * @return the new leaf
     */
    public static <Key, Val> Leaf<Key, Val> of(Val value) {
	return new Leaf<Key, Val>(value);
    }

    public boolean isMap() {
	return false;
    }

    /**
     * Unsupported; a leaf is never a map.
     */
    public DeepMap<Key, Val> asMap() {
	throw new ClassCastException("Leaf " + this + " is not a map");
    }

    public Val value() {
	return value;
    }

    public boolean equals(Object obj) {
	if (obj == this) return true;
	else if (!(obj instanceof Leaf)) return false;
	else {
	    Object v = ((Leaf<?, ?>)obj).value;
	    return value == null ? v == null : value.equals(v);
	}
    }

    public int hashCode() {
	return value == null ? 0 : value.hashCode();
    }

    public String toString() {
	return String.valueOf(value);
    }

}

/*
 * EndKind.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.otree;
import java.util.*;

/**
 * Selects what {@link DeepMap#end} returns for the boundary entry it finds.
 *
 * @author Scott L. Burson
 */

public enum EndKind {

    /** The key of the boundary entry. */
    KEY {
	Object select(Map.Entry<?, ?> entry) {
	    return entry.getKey();
	}
    },

    /** The value (a {@link Node}) of the boundary entry. */
    VALUE {
	Object select(Map.Entry<?, ?> entry) {
	    return entry.getValue();
	}
    },

    /** The boundary entry itself, as an immutable {@link Map.Entry}. */
    ENTRY {
	Object select(Map.Entry<?, ?> entry) {
	    return new AbstractMap.SimpleImmutableEntry<Object, Object>(entry);
	}
    };

    abstract Object select(Map.Entry<?, ?> entry);

    /**
     * Returns the kind named by <code>name</code>, ignoring case.  Accepts
     * <code>"key"</code>, <code>"value"</code>, and either <code>"entry"</code>
     * or <code>"item"</code> for {@link #ENTRY}.
     *
     * @param name the name of the kind
     * @return the kind
     * @throws IllegalArgumentException if <code>name</code> is null or names no kind
     */
    public static EndKind forName(String name) {
	if (name != null) {
	    String s = name.trim().toLowerCase(Locale.ROOT);
	    if (s.equals("key")) return KEY;
	    else if (s.equals("value")) return VALUE;
	    else if (s.equals("entry") || s.equals("item")) return ENTRY;
	}
	throw new IllegalArgumentException("Unknown end kind '" + name +
					   "'; must be one of 'key', 'value', or 'entry'");
    }

}

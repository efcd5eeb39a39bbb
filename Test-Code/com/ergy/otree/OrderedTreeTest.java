/*
 * OrderedTreeTest.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.otree;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.AbstractMap;
import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderedTreeTest {

    private static OrderedTree<String, Integer> tree(Object[][] ary) {
        return new OrderedTree<String, Integer>(ary);
    }

    @Test
    void put_NewKeysAppend_ExistingKeyKeepsPosition() {
        // Given
        OrderedTree<String, Integer> t = tree(new Object[][] { { "c", 1 }, { "a", 2 }, { "b", 3 } });

        // When
        t.putValue("a", 20);
        t.putValue("d", 4);

        // Then
        assertThat(t.keySet()).containsExactly("c", "a", "b", "d");
        assertThat(t.getValue("a")).isEqualTo(20);
        assertThat(t.size()).isEqualTo(4);
        assertThat(t.verify()).isTrue();
    }

    @Test
    void remove_ThenPutAgain_MovesKeyToEnd() {
        OrderedTree<String, Integer> t = tree(new Object[][] { { "a", 1 }, { "b", 2 }, { "c", 3 } });

        assertThat(t.remove("a")).isEqualTo(Leaf.of(1));
        assertThat(t.remove("a")).isNull();
        t.putValue("a", 1);

        assertThat(t.keySet()).containsExactly("b", "c", "a");
        assertThat(t.verify()).isTrue();
    }

    @Test
    void moveToEnd_BothDirections_ReordersSingleLevel() {
        OrderedTree<String, Integer> t = tree(new Object[][] {
            { "a", 1 }, { "b", tree(new Object[][] { { "a", 9 }, { "x", 8 } }) }, { "c", 3 }
        });

        t.moveToEnd("a", true);
        assertThat(t.keySet()).containsExactly("b", "c", "a");

        t.moveToEnd("c", false);
        assertThat(t.keySet()).containsExactly("c", "b", "a");
        assertThat(t.getMap("b").keySet()).containsExactly("a", "x");

        t.moveToEnd("c", false);
        assertThat(t.keySet()).containsExactly("c", "b", "a");
        assertThat(t.verify()).isTrue();
    }

    @Test
    void moveToEnd_AbsentKey_Throws() {
        OrderedTree<String, Integer> t = tree(new Object[][] { { "a", 1 } });

        assertThatThrownBy(() -> t.moveToEnd("z", true))
            .isInstanceOf(NoSuchElementException.class)
            .hasMessageContaining("z");
    }

    @Test
    void firstKeyAndLastKey_FollowIterationOrder() {
        OrderedTree<String, Integer> t = tree(new Object[][] { { "x", 1 }, { "y", 2 } });

        assertThat(t.firstKey()).isEqualTo("x");
        assertThat(t.lastKey()).isEqualTo("y");

        t.clear();
        assertThat(t.isEmpty()).isTrue();
        assertThatThrownBy(t::firstKey).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(t::lastKey).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void nulls_NullKeyAndNullLeafAccepted_NullNodeRejected() {
        OrderedTree<String, Integer> t = new OrderedTree<String, Integer>();

        t.putValue(null, 1);
        t.putValue("n", null);

        assertThat(t.containsKey(null)).isTrue();
        assertThat(t.getValue(null)).isEqualTo(1);
        assertThat(t.get("n")).isEqualTo(Leaf.of(null));
        assertThat(t.getValue("n")).isNull();
        assertThatThrownBy(() -> t.put("x", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void put_MapIntoItself_Rejected() {
        // Given
        OrderedTree<String, Integer> root = new OrderedTree<String, Integer>();
        DeepMap<String, Integer> child = root.putMap("child");
        DeepMap<String, Integer> grandchild = ((OrderedTree<String, Integer>)child).putMap("grandchild");

        // When & Then
        assertThatThrownBy(() -> root.put("self", root)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> grandchild.put("up", root)).isInstanceOf(IllegalArgumentException.class);
        assertThat(grandchild.isEmpty()).isTrue();
        assertThat(root.keySet()).containsExactly("child");
    }

    @Test
    void setValue_ThroughIterator_ChecksLikePut() {
        OrderedTree<String, Integer> root = tree(new Object[][] { { "a", 1 } });
        Map.Entry<String, Node<String, Integer>> ent = root.iterator().next();

        assertThatThrownBy(() -> ent.setValue(root)).isInstanceOf(IllegalArgumentException.class);
        ent.setValue(Leaf.<String, Integer>of(5));

        assertThat(root.getValue("a")).isEqualTo(5);
    }

    @Test
    void iterator_Remove_UnlinksEntry() {
        OrderedTree<String, Integer> t = tree(new Object[][] { { "a", 1 }, { "b", 2 }, { "c", 3 } });

        for (Iterator<Map.Entry<String, Node<String, Integer>>> it = t.iterator(); it.hasNext(); ) {
            if (it.next().getKey().equals("b")) it.remove();
        }

        assertThat(t.keySet()).containsExactly("a", "c");
        assertThat(t.verify()).isTrue();
    }

    @Test
    void iterator_MoveDuringIteration_FailsFast() {
        OrderedTree<String, Integer> t = tree(new Object[][] { { "a", 1 }, { "b", 2 }, { "c", 3 } });

        assertThatThrownBy(() -> {
            for (String k : t.keySet()) t.moveToEnd(k, true);
        }).isInstanceOf(ConcurrentModificationException.class);
    }

    @Test
    void equals_FollowsMapContract() {
        OrderedTree<String, Integer> t = tree(new Object[][] { { "a", 1 }, { "b", 2 } });
        Map<String, Node<String, Integer>> other = new LinkedHashMap<String, Node<String, Integer>>();
        other.put("b", Leaf.<String, Integer>of(2));
        other.put("a", Leaf.<String, Integer>of(1));

        assertThat(t.equals(other)).isTrue();
        assertThat(other.equals(t)).isTrue();
        assertThat(t.hashCode()).isEqualTo(other.hashCode());
        assertThat(new OrderedTree<String, Integer>(other).keySet()).containsExactly("b", "a");
    }

    @Test
    void constructor_MalformedPair_Throws() {
        assertThatThrownBy(() -> tree(new Object[][] { { "a", 1 }, { "b" } }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("1");
    }

    @Test
    void fromPairs_KeepsGivenOrder() {
        OrderedTree<String, Integer> t = OrderedTree.fromPairs(Arrays.asList(
            new AbstractMap.SimpleEntry<String, Node<String, Integer>>("z", Leaf.<String, Integer>of(1)),
            new AbstractMap.SimpleEntry<String, Node<String, Integer>>("m", Leaf.<String, Integer>of(2)),
            new AbstractMap.SimpleEntry<String, Node<String, Integer>>("a", Leaf.<String, Integer>of(3))));

        assertThat(t.keySet()).containsExactly("z", "m", "a");
    }

    @Test
    void putMap_CreatesOnceAndRejectsLeaf() {
        OrderedTree<String, Integer> t = new OrderedTree<String, Integer>();
        t.putValue("leaf", 1);

        DeepMap<String, Integer> first = t.putMap("sub");
        DeepMap<String, Integer> second = t.putMap("sub");

        assertThat((Object)second).isSameAs(first);
        assertThat((Object)t.getMap("sub")).isSameAs(first);
        assertThat((Object)t.getMap("leaf")).isNull();
        assertThat(t.getValue("sub")).isNull();
        assertThatThrownBy(() -> t.putMap("leaf")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nodeCapability_DistinguishesMapsFromLeaves() {
        OrderedTree<String, Integer> t = new OrderedTree<String, Integer>();
        Leaf<String, Integer> leaf = Leaf.of(3);

        assertThat(t.isMap()).isTrue();
        assertThat((Object)t.asMap()).isSameAs(t);
        assertThatThrownBy(t::value).isInstanceOf(UnsupportedOperationException.class);
        assertThat(leaf.isMap()).isFalse();
        assertThat(leaf.value()).isEqualTo(3);
        assertThatThrownBy(leaf::asMap).isInstanceOf(ClassCastException.class);
    }

    @Test
    void deepCopy_CopiesEveryLevel() {
        // Given
        OrderedTree<String, Integer> t = tree(new Object[][] {
            { "a", tree(new Object[][] { { "b", tree(new Object[][] { { "c", 1 } }) } }) },
            { "d", 2 }
        });

        // When
        OrderedTree<String, Integer> copy = t.deepCopy();
        copy.getMap("a").getMap("b").putValue("e", 3);
        copy.deepMoveToEnd("a");

        // Then
        assertThat(t.keySet()).containsExactly("a", "d");
        assertThat(t.getMap("a").getMap("b").keySet()).containsExactly("c");
        assertThat(copy.keySet()).containsExactly("d", "a");
        assertThat(copy.get("d")).isSameAs(t.get("d"));
    }

    @Test
    void serialization_PreservesOrderAndNesting() throws Exception {
        // Given
        OrderedTree<String, Integer> t = tree(new Object[][] {
            { "0:1", tree(new Object[][] { { "m2", tree(new Object[][] { { "p2", 3 } }) } }) },
            { "0:0", tree(new Object[][] { { "m1", 5 } }) }
        });
        t.moveToEnd("0:1", true);

        // When
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ObjectOutputStream out = new ObjectOutputStream(bytes);
        out.writeObject(t);
        out.close();
        ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()));
        @SuppressWarnings("unchecked")
        OrderedTree<String, Integer> back = (OrderedTree<String, Integer>)in.readObject();

        // Then
        assertThat(back.dump()).isEqualTo(t.dump());
        assertThat(back.verify()).isTrue();
        back.putValue("1:0", 7);
        back.moveToEnd("0:0", true);
        assertThat(back.keySet()).containsExactly("0:1", "1:0", "0:0");
    }

    @Test
    void dump_RendersOneEntryPerLineIndentedByDepth() {
        OrderedTree<String, Integer> t = tree(new Object[][] {
            { "0:0", tree(new Object[][] { { "m1", tree(new Object[][] { { "p1", 5 } }) } }) },
            { "e", new OrderedTree<String, Integer>() },
            { "x", 1 }
        });

        assertThat(t.dump()).isEqualTo(
            "0:0 ->\n" +
            "  m1 ->\n" +
            "    p1 -> 5\n" +
            "e -> {}\n" +
            "x -> 1\n");
    }

}

/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.exceptions.IllegalActionException;

import java.util.*;

/**
 * The input shapes accepted by the accessors of a {@link GridAction}.
 * <p>
 * Element ids are either integers or element names. How a variant is read depends on the domain of
 * the accessor: a single id or a list of ids toggles elements, pairs and mappings assign values, a
 * dense vector gives one value per element.
 *
 * @author PowSyBl grid action team
 */
public interface ElementInput {

    /**
     * A single element id, only accepted by toggle accessors.
     */
    record Single(Object id) implements ElementInput {
        public Single {
            Objects.requireNonNull(id);
        }
    }

    /**
     * An element id and the value to assign to it.
     */
    record Pair(Object id, Object value) implements ElementInput {
        public Pair {
            if (id == null || value == null) {
                throw new IllegalActionException("An (id, value) pair cannot hold a null, got (" + id + ", " + value + ")");
            }
        }
    }

    record Pairs(List<Pair> pairs) implements ElementInput {
        public Pairs {
            pairs = List.copyOf(requireNoNull(pairs, "pair"));
        }
    }

    /**
     * Bare ids for toggle accessors. Value accessors read it as a dense vector when its size equals
     * the number of elements.
     */
    record Ids(List<Object> ids) implements ElementInput {
        public Ids {
            ids = List.copyOf(requireNoNull(ids, "element id"));
        }
    }

    /**
     * One value per element, an {@code int[]}, {@code boolean[]} or {@code double[]}.
     */
    record Dense(Object values) implements ElementInput {
        public Dense {
            Objects.requireNonNull(values);
            if (!(values instanceof int[] || values instanceof boolean[] || values instanceof double[])) {
                throw new IllegalActionException("A dense vector must be an int[], a boolean[] or a double[], got "
                        + values.getClass().getSimpleName());
            }
        }

        public int length() {
            if (values instanceof int[] ints) {
                return ints.length;
            }
            if (values instanceof boolean[] booleans) {
                return booleans.length;
            }
            return ((double[]) values).length;
        }
    }

    record Mapping(Map<?, ?> values) implements ElementInput {
        public Mapping {
            if (values.entrySet().stream().anyMatch(e -> e.getKey() == null || e.getValue() == null)) {
                throw new IllegalActionException("A mapping cannot hold a null key or value");
            }
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }

    private static <T> List<T> requireNoNull(List<T> items, String what) {
        if (items.stream().anyMatch(Objects::isNull)) {
            throw new IllegalActionException("A list of " + what + "s cannot hold a null");
        }
        return items;
    }

    static ElementInput of(int id) {
        return new Single(id);
    }

    static ElementInput of(String name) {
        return new Single(name);
    }

    static ElementInput pair(Object id, Object value) {
        return new Pair(id, value);
    }

    static ElementInput pairs(Pair... pairs) {
        return new Pairs(Arrays.asList(pairs));
    }

    static ElementInput ids(Object... ids) {
        return new Ids(Arrays.asList(ids));
    }

    static ElementInput dense(int... values) {
        return new Dense(values.clone());
    }

    static ElementInput dense(boolean... values) {
        return new Dense(values.clone());
    }

    static ElementInput dense(double... values) {
        return new Dense(values.clone());
    }

    static ElementInput mapping(Map<?, ?> values) {
        return new Mapping(values);
    }

    /**
     * Classifies a loosely typed value, as found in an action dictionary, into one of the variants.
     * A {@link Map.Entry} is a pair, a list of entries a list of pairs, any other list or set a list of
     * ids, and a primitive array a dense vector.
     */
    static ElementInput from(Object raw) {
        Objects.requireNonNull(raw);
        if (raw instanceof ElementInput input) {
            return input;
        }
        if (raw instanceof Boolean) {
            throw new IllegalActionException("A single boolean is not a valid element id");
        }
        if (raw instanceof Double || raw instanceof Float) {
            throw new IllegalActionException("A single floating point number is not a valid element id");
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte || raw instanceof String) {
            return new Single(raw);
        }
        if (raw instanceof Map.Entry<?, ?> entry) {
            return new Pair(entry.getKey(), entry.getValue());
        }
        if (raw instanceof int[] || raw instanceof boolean[] || raw instanceof double[]) {
            return new Dense(raw);
        }
        if (raw instanceof Map<?, ?> map) {
            return new Mapping(map);
        }
        if (raw instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection);
            if (!items.isEmpty() && items.stream().allMatch(Map.Entry.class::isInstance)) {
                return new Pairs(items.stream()
                        .map(item -> (Map.Entry<?, ?>) item)
                        .map(entry -> new Pair(entry.getKey(), entry.getValue()))
                        .toList());
            }
            if (items.stream().anyMatch(Map.Entry.class::isInstance)) {
                throw new IllegalActionException("A list cannot mix (id, value) pairs and bare values");
            }
            if (!items.isEmpty() && items.stream().allMatch(Boolean.class::isInstance)) {
                boolean[] mask = new boolean[items.size()];
                for (int i = 0; i < mask.length; i++) {
                    mask[i] = (Boolean) items.get(i);
                }
                return new Dense(mask);
            }
            return new Ids(items);
        }
        throw new IllegalActionException("Unsupported input of type " + raw.getClass().getSimpleName());
    }
}

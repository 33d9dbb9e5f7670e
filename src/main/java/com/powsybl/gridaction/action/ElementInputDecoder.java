/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.exceptions.ElementOutOfRangeException;
import com.powsybl.gridaction.exceptions.IllegalActionException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntUnaryOperator;
import java.util.function.ToIntFunction;

/**
 * Decodes an {@link ElementInput} into a target vector for one kind of element. Ids are resolved
 * against the element count and, when a resolver is given, names. A resolved id is then mapped to
 * its index in the target vector.
 * <p>
 * Decoding writes into the vector it is given as it goes, callers pass a working copy.
 *
 * @author PowSyBl grid action team
 */
class ElementInputDecoder {

    private final String kind;

    private final int count;

    private final ToIntFunction<String> nameResolver;

    private final IntUnaryOperator indexMapping;

    ElementInputDecoder(String kind, int count, ToIntFunction<String> nameResolver, IntUnaryOperator indexMapping) {
        this.kind = Objects.requireNonNull(kind);
        this.count = count;
        this.nameResolver = nameResolver;
        this.indexMapping = Objects.requireNonNull(indexMapping);
    }

    void applyInt(ElementInput input, int[] target, ValueDomain domain) {
        Objects.requireNonNull(input);
        if (input instanceof ElementInput.Pair pair) {
            target[indexOf(pair.id())] = toInt(pair.value(), domain);
        } else if (input instanceof ElementInput.Pairs pairs) {
            for (ElementInput.Pair pair : pairs.pairs()) {
                target[indexOf(pair.id())] = toInt(pair.value(), domain);
            }
        } else if (input instanceof ElementInput.Mapping mapping) {
            for (Map.Entry<?, ?> entry : mapping.values().entrySet()) {
                target[indexOf(entry.getKey())] = toInt(entry.getValue(), domain);
            }
        } else if (input instanceof ElementInput.Dense dense) {
            if (!(dense.values() instanceof int[] values)) {
                throw new IllegalActionException("Expecting integer values for the " + kind + "s, got a "
                        + dense.values().getClass().getSimpleName());
            }
            checkDenseLength(values.length);
            for (int id = 0; id < count; id++) {
                target[indexMapping.applyAsInt(id)] = checkDomain(values[id], domain);
            }
        } else if (input instanceof ElementInput.Ids ids) {
            checkListAsDense(ids.ids());
            for (int id = 0; id < count; id++) {
                target[indexMapping.applyAsInt(id)] = toInt(ids.ids().get(id), domain);
            }
        } else if (input instanceof ElementInput.Single) {
            throw new IllegalActionException("A single id cannot be used to assign a value to a " + kind
                    + ", use an (id, value) pair");
        } else {
            throw unsupported(input);
        }
    }

    void applyToggle(ElementInput input, boolean[] target) {
        Objects.requireNonNull(input);
        if (input instanceof ElementInput.Single single) {
            toggle(target, single.id());
        } else if (input instanceof ElementInput.Ids ids) {
            for (Object id : ids.ids()) {
                toggle(target, id);
            }
        } else if (input instanceof ElementInput.Dense dense) {
            if (dense.values() instanceof boolean[] mask) {
                checkDenseLength(mask.length);
                for (int id = 0; id < count; id++) {
                    if (mask[id]) {
                        int index = indexMapping.applyAsInt(id);
                        target[index] = !target[index];
                    }
                }
            } else if (dense.values() instanceof int[] ids) {
                for (int id : ids) {
                    toggle(target, id);
                }
            } else {
                throw new IllegalActionException("Floating point values cannot be used to toggle " + kind + "s");
            }
        } else if (input instanceof ElementInput.Mapping mapping) {
            for (Map.Entry<?, ?> entry : mapping.values().entrySet()) {
                if (!(entry.getValue() instanceof Boolean doToggle)) {
                    throw new IllegalActionException("Expecting a boolean for " + kind + " " + entry.getKey()
                            + ", got " + entry.getValue());
                }
                if (doToggle) {
                    toggle(target, entry.getKey());
                }
            }
        } else if (input instanceof ElementInput.Pair || input instanceof ElementInput.Pairs) {
            throw new IllegalActionException("(id, value) pairs cannot be used to toggle " + kind
                    + "s, give the ids of the elements to toggle");
        } else {
            throw unsupported(input);
        }
    }

    /**
     * Non finite values mean no change.
     */
    void applyFloat(ElementInput input, double[] target) {
        Objects.requireNonNull(input);
        if (input instanceof ElementInput.Pair pair) {
            assignFloat(target, indexOf(pair.id()), toDouble(pair.value()));
        } else if (input instanceof ElementInput.Pairs pairs) {
            for (ElementInput.Pair pair : pairs.pairs()) {
                assignFloat(target, indexOf(pair.id()), toDouble(pair.value()));
            }
        } else if (input instanceof ElementInput.Mapping mapping) {
            for (Map.Entry<?, ?> entry : mapping.values().entrySet()) {
                assignFloat(target, indexOf(entry.getKey()), toDouble(entry.getValue()));
            }
        } else if (input instanceof ElementInput.Dense dense) {
            if (!(dense.values() instanceof double[] values)) {
                throw new IllegalActionException("Expecting floating point values for the " + kind + "s, got a "
                        + dense.values().getClass().getSimpleName());
            }
            checkDenseLength(values.length);
            for (int id = 0; id < count; id++) {
                assignFloat(target, indexMapping.applyAsInt(id), values[id]);
            }
        } else if (input instanceof ElementInput.Ids ids) {
            checkListAsDense(ids.ids());
            for (int id = 0; id < count; id++) {
                assignFloat(target, indexMapping.applyAsInt(id), toDouble(ids.ids().get(id)));
            }
        } else if (input instanceof ElementInput.Single) {
            throw new IllegalActionException("A single id cannot be used to assign a value to a " + kind
                    + ", use an (id, value) pair");
        } else {
            throw unsupported(input);
        }
    }

    /**
     * Resolves an integer id or a name to an index in the target vector.
     */
    int indexOf(Object id) {
        return indexMapping.applyAsInt(resolveId(id));
    }

    int resolveId(Object id) {
        if (id instanceof Boolean) {
            throw new IllegalActionException("A boolean is not a valid " + kind + " id");
        }
        if (id instanceof Double || id instanceof Float) {
            throw new IllegalActionException("A floating point number is not a valid " + kind + " id: " + id);
        }
        if (id instanceof Integer || id instanceof Long || id instanceof Short || id instanceof Byte) {
            long value = ((Number) id).longValue();
            if (value < 0 || value >= count) {
                throw new ElementOutOfRangeException(kind, (int) Math.min(Math.max(value, Integer.MIN_VALUE), Integer.MAX_VALUE), count);
            }
            return (int) value;
        }
        if (id instanceof String name) {
            if (nameResolver == null) {
                throw new IllegalActionException("Names cannot be used to identify a " + kind);
            }
            return nameResolver.applyAsInt(name);
        }
        throw new IllegalActionException("Invalid " + kind + " id " + id);
    }

    private void toggle(boolean[] target, Object id) {
        int index = indexOf(id);
        target[index] = !target[index];
    }

    private static void assignFloat(double[] target, int index, double value) {
        if (Double.isFinite(value)) {
            target[index] = value;
        }
    }

    private int toInt(Object value, ValueDomain domain) {
        if (value instanceof Boolean) {
            throw new IllegalActionException("A boolean is not a valid value for a " + kind + ": " + value);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long longValue = ((Number) value).longValue();
            if (longValue < domain.getMin() || longValue > domain.getMax()) {
                throw outOfDomain(String.valueOf(longValue), domain);
            }
            return (int) longValue;
        }
        if (value instanceof Double || value instanceof Float) {
            double doubleValue = ((Number) value).doubleValue();
            if (doubleValue != Math.rint(doubleValue) || Double.isInfinite(doubleValue)) {
                throw new IllegalActionException("Expecting an integer value for a " + kind + ", got " + doubleValue);
            }
            if (doubleValue < domain.getMin() || doubleValue > domain.getMax()) {
                throw outOfDomain(String.valueOf(doubleValue), domain);
            }
            return (int) doubleValue;
        }
        throw new IllegalActionException("Invalid value for a " + kind + ": " + value);
    }

    private int checkDomain(int value, ValueDomain domain) {
        if (!domain.contains(value)) {
            throw outOfDomain(String.valueOf(value), domain);
        }
        return value;
    }

    private IllegalActionException outOfDomain(String value, ValueDomain domain) {
        return new IllegalActionException("Value " + value + " for a " + kind + " is outside ["
                + domain.getMin() + ", " + domain.getMax() + "]");
    }

    private double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalActionException("Expecting a number for a " + kind + ", got " + value);
    }

    private void checkDenseLength(int length) {
        if (length != count) {
            throw new IllegalActionException("A vector with " + length + " values cannot be assigned to the "
                    + count + " " + kind + "s");
        }
    }

    private void checkListAsDense(List<Object> values) {
        if (values.size() != count) {
            throw new IllegalActionException("A list of " + values.size() + " bare values cannot be assigned to the "
                    + count + " " + kind + "s, use (id, value) pairs");
        }
    }

    private IllegalActionException unsupported(ElementInput input) {
        return new IllegalActionException("Unsupported input " + input.getClass().getSimpleName() + " for the " + kind + "s");
    }
}

/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.exceptions.AmbiguousActionException;
import com.powsybl.gridaction.exceptions.GridActionException;
import com.powsybl.gridaction.exceptions.IncorrectNumberOfElementsException;
import com.powsybl.gridaction.network.GridSchema;

import java.util.*;

/**
 * Flat vector encoding of the actions of one type on one grid.
 * <p>
 * The vector concatenates the supported attributes in {@link ActionAttribute} declaration order.
 * Booleans are encoded as 0 and 1, injections which are not overridden as NaN.
 *
 * @author PowSyBl grid action team
 */
public class ActionVectorCodec {

    private final GridSchema schema;

    private final ActionType type;

    private final List<ActionAttribute> attributes;

    private final int[] shape;

    private final int size;

    public ActionVectorCodec(GridSchema schema, ActionType type) {
        this.schema = Objects.requireNonNull(schema);
        this.type = Objects.requireNonNull(type);
        this.attributes = type.getAttributes(schema);
        this.shape = attributes.stream().mapToInt(attribute -> attribute.getDimension(schema)).toArray();
        this.size = Arrays.stream(shape).sum();
    }

    public GridSchema getSchema() {
        return schema;
    }

    public ActionType getType() {
        return type;
    }

    public List<ActionAttribute> attributes() {
        return attributes;
    }

    /**
     * Size of each attribute, in vector order.
     */
    public int[] shape() {
        return shape.clone();
    }

    public int size() {
        return size;
    }

    public double[] toVector(GridAction action) {
        Objects.requireNonNull(action);
        if (!schema.sameGrid(action.schema)) {
            throw new GridActionException("The action is defined on another grid");
        }
        double[] vector = new double[size];
        int offset = 0;
        for (int i = 0; i < attributes.size(); i++) {
            double[] values = encode(action, attributes.get(i));
            if (values.length != shape[i]) {
                throw new IncorrectNumberOfElementsException("Attribute '" + attributes.get(i).getName() + "' has "
                        + values.length + " values, " + shape[i] + " expected");
            }
            System.arraycopy(values, 0, vector, offset, values.length);
            offset += shape[i];
        }
        return vector;
    }

    private static double[] encode(GridAction action, ActionAttribute attribute) {
        return switch (attribute) {
            case PROD_P -> action.getProdP();
            case PROD_V -> action.getProdV();
            case LOAD_P -> action.getLoadP();
            case LOAD_Q -> action.getLoadQ();
            case REDISPATCH -> action.redispatch.clone();
            case SET_LINE_STATUS -> toDoubles(action.setLineStatus);
            case CHANGE_LINE_STATUS -> toDoubles(action.changeLineStatus);
            case SET_BUS -> toDoubles(action.setBus);
            case CHANGE_BUS -> toDoubles(action.changeBus);
            case HAZARDS -> toDoubles(action.hazards);
            case MAINTENANCE -> toDoubles(action.maintenance);
            case STORAGE_POWER -> action.storagePower.clone();
            case SHUNT_P -> action.shuntP.clone();
            case SHUNT_Q -> action.shuntQ.clone();
            case SHUNT_BUS -> toDoubles(action.shuntBus);
        };
    }

    private static double[] toDoubles(int[] values) {
        return Arrays.stream(values).asDoubleStream().toArray();
    }

    private static double[] toDoubles(boolean[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] ? 1 : 0;
        }
        return result;
    }

    private static int[] toInts(double[] values) {
        return Arrays.stream(values).mapToInt(v -> (int) v).toArray();
    }

    private static boolean[] toBooleans(double[] values) {
        boolean[] result = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i] != 0 && !Double.isNaN(values[i]);
        }
        return result;
    }

    public GridAction fromVector(double[] vector) {
        return fromVector(vector, true);
    }

    /**
     * Decodes a flat vector into a new action, the modified flags being derived from the values.
     *
     * @param checkLegit whether to run the ambiguity checker on the decoded action
     */
    public GridAction fromVector(double[] vector, boolean checkLegit) {
        Objects.requireNonNull(vector);
        if (vector.length != size) {
            throw new IncorrectNumberOfElementsException("The vector has " + vector.length + " values, "
                    + size + " expected for actions of type " + type);
        }
        Map<ActionAttribute, double[]> values = new EnumMap<>(ActionAttribute.class);
        int offset = 0;
        for (int i = 0; i < attributes.size(); i++) {
            values.put(attributes.get(i), Arrays.copyOfRange(vector, offset, offset + shape[i]));
            offset += shape[i];
        }
        return fromAttributes(values, checkLegit);
    }

    /**
     * Values of each supported attribute, in vector order. Injections which are not overridden are
     * left out.
     */
    public Map<ActionAttribute, double[]> toAttributes(GridAction action) {
        Objects.requireNonNull(action);
        if (!schema.sameGrid(action.schema)) {
            throw new GridActionException("The action is defined on another grid");
        }
        Map<ActionAttribute, double[]> values = new LinkedHashMap<>();
        for (ActionAttribute attribute : attributes) {
            InjectionKey key = InjectionKey.fromName(attribute.getName()).orElse(null);
            if (key == null || action.injections.containsKey(key)) {
                values.put(attribute, encode(action, attribute));
            }
        }
        return values;
    }

    /**
     * Builds an action from attribute values, assigned as given: their lengths are only verified by
     * the ambiguity checker. Missing attributes keep their do nothing value.
     *
     * @throws AmbiguousActionException if an attribute is not supported by the action type
     */
    public GridAction fromAttributes(Map<ActionAttribute, double[]> values, boolean checkLegit) {
        Objects.requireNonNull(values);
        GridAction action = new GridAction(schema, type);
        for (Map.Entry<ActionAttribute, double[]> e : values.entrySet()) {
            if (!attributes.contains(e.getKey())) {
                throw new AmbiguousActionException("Attribute '" + e.getKey().getName()
                        + "' is not supported by actions of type " + type + " on this grid");
            }
            decode(action, e.getKey(), e.getValue().clone());
        }
        action.deriveModifiedFlags();
        if (checkLegit) {
            action.check();
        }
        return action;
    }

    private static void decode(GridAction action, ActionAttribute attribute, double[] values) {
        switch (attribute) {
            case PROD_P -> decodeInjection(action, InjectionKey.PROD_P, values);
            case PROD_V -> decodeInjection(action, InjectionKey.PROD_V, values);
            case LOAD_P -> decodeInjection(action, InjectionKey.LOAD_P, values);
            case LOAD_Q -> decodeInjection(action, InjectionKey.LOAD_Q, values);
            case REDISPATCH -> action.redispatch = values;
            case SET_LINE_STATUS -> action.setLineStatus = toInts(values);
            case CHANGE_LINE_STATUS -> action.changeLineStatus = toBooleans(values);
            case SET_BUS -> action.setBus = toInts(values);
            case CHANGE_BUS -> action.changeBus = toBooleans(values);
            case HAZARDS -> action.hazards = toBooleans(values);
            case MAINTENANCE -> action.maintenance = toBooleans(values);
            case STORAGE_POWER -> action.storagePower = values;
            case SHUNT_P -> action.shuntP = values;
            case SHUNT_Q -> action.shuntQ = values;
            case SHUNT_BUS -> action.shuntBus = toInts(values);
        }
    }

    private static void decodeInjection(GridAction action, InjectionKey key, double[] values) {
        if (Arrays.stream(values).anyMatch(Double::isFinite)) {
            action.injections.put(key, values);
        }
    }
}

/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridaction.exceptions.GridActionException;
import com.powsybl.gridaction.network.GridSchema;
import com.powsybl.gridaction.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Composes two actions into the action doing the first one, then the second one, in the same step.
 * <ul>
 *     <li>injections: finite values of the second action overwrite the first</li>
 *     <li>redispatching and storage: values are summed</li>
 *     <li>line status and buses: a change on top of a change cancels it, a set clears a pending change,
 *     a change on top of a set inverts the set value, a set overwrites</li>
 *     <li>shunts: finite values, and non zero buses, of the second action overwrite the first</li>
 * </ul>
 * The composition keeps the type of the first action: modifications it does not support are dropped
 * with a warning. It is therefore not commutative.
 *
 * @author PowSyBl grid action team
 */
public final class ActionComposer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActionComposer.class);

    private ActionComposer() {
    }

    /**
     * @return a new action, the composition of {@code first} then {@code second}
     */
    public static GridAction combine(GridAction first, GridAction second) {
        return combine(first, second, ReportNode.NO_OP);
    }

    public static GridAction combine(GridAction first, GridAction second, ReportNode reportNode) {
        GridAction result = Objects.requireNonNull(first).copy();
        compose(result, second, reportNode);
        return result;
    }

    /**
     * Composes {@code other} into {@code action} in place.
     */
    static void compose(GridAction action, GridAction other, ReportNode reportNode) {
        Objects.requireNonNull(action);
        Objects.requireNonNull(other);
        Objects.requireNonNull(reportNode);
        if (!action.schema.sameGrid(other.schema)) {
            throw new GridActionException("Actions on different grids cannot be composed");
        }

        composeInjections(action, other, reportNode);
        composeRedispatch(action, other, reportNode);
        composeStorage(action, other, reportNode);
        composeLineStatus(action, other, reportNode);
        composeBuses(action, other, reportNode);
        composeShunts(action, other, reportNode);

        // flags of dropped modifications are not carried over
        action.injectionModified |= other.injectionModified
                && other.injections.keySet().stream().anyMatch(key -> action.supports(key.getAttribute()));
        action.setBusModified |= other.setBusModified && action.supports(ActionAttribute.SET_BUS);
        action.changeBusModified |= other.changeBusModified && action.supports(ActionAttribute.CHANGE_BUS);
        action.setStatusModified |= other.setStatusModified && action.supports(ActionAttribute.SET_LINE_STATUS);
        action.changeStatusModified |= other.changeStatusModified && action.supports(ActionAttribute.CHANGE_LINE_STATUS);
        action.redispatchModified |= other.redispatchModified && action.supports(ActionAttribute.REDISPATCH);
        action.storageModified |= other.storageModified && action.supports(ActionAttribute.STORAGE_POWER);
        action.invalidate();
    }

    private static void drop(GridAction action, ActionAttribute attribute, ReportNode reportNode) {
        LOGGER.warn("Modification of '{}' dropped: not supported by actions of type {}", attribute.getName(), action.type);
        Reports.reportModificationDropped(reportNode, attribute.getName(), action.type.name());
    }

    private static void composeInjections(GridAction action, GridAction other, ReportNode reportNode) {
        for (Map.Entry<InjectionKey, double[]> e : other.injections.entrySet()) {
            InjectionKey key = e.getKey();
            double[] incoming = e.getValue();
            if (!action.supports(key.getAttribute())) {
                drop(action, key.getAttribute(), reportNode);
                continue;
            }
            double[] current = action.injections.get(key);
            if (current == null) {
                action.injections.put(key, incoming.clone());
            } else {
                double[] merged = current.clone();
                for (int i = 0; i < Math.min(merged.length, incoming.length); i++) {
                    if (Double.isFinite(incoming[i])) {
                        merged[i] = incoming[i];
                    }
                }
                action.injections.put(key, merged);
            }
        }
    }

    private static boolean anyRequested(double[] values) {
        return Arrays.stream(values).anyMatch(v -> Double.isFinite(v) && v != 0);
    }

    private static double[] sumFinite(double[] current, double[] incoming) {
        double[] sum = current.clone();
        for (int i = 0; i < sum.length; i++) {
            if (Double.isFinite(incoming[i])) {
                sum[i] += incoming[i];
            }
        }
        return sum;
    }

    private static void composeRedispatch(GridAction action, GridAction other, ReportNode reportNode) {
        if (!anyRequested(other.redispatch)) {
            return;
        }
        if (action.supports(ActionAttribute.REDISPATCH)) {
            action.redispatch = sumFinite(action.redispatch, other.redispatch);
        } else {
            drop(action, ActionAttribute.REDISPATCH, reportNode);
        }
    }

    private static void composeStorage(GridAction action, GridAction other, ReportNode reportNode) {
        if (!anyRequested(other.storagePower)) {
            return;
        }
        if (action.supports(ActionAttribute.STORAGE_POWER)) {
            action.storagePower = sumFinite(action.storagePower, other.storagePower);
        } else {
            drop(action, ActionAttribute.STORAGE_POWER, reportNode);
        }
    }

    private static void composeLineStatus(GridAction action, GridAction other, ReportNode reportNode) {
        int[] set = action.setLineStatus.clone();
        boolean[] change = action.changeLineStatus.clone();
        for (int line = 0; line < set.length; line++) {
            boolean incomingChange = other.changeLineStatus[line];
            int incomingSet = other.setLineStatus[line];
            if (incomingChange) {
                change[line] = !change[line];
            }
            if (incomingSet != 0) {
                change[line] = false;
            }
            if (set[line] != 0 && incomingChange) {
                set[line] = -set[line];
                change[line] = false;
            }
            if (incomingSet != 0) {
                set[line] = incomingSet;
            }
        }
        action.setLineStatus = assignOrDrop(action, ActionAttribute.SET_LINE_STATUS, action.setLineStatus, set, reportNode);
        action.changeLineStatus = assignOrDrop(action, ActionAttribute.CHANGE_LINE_STATUS, action.changeLineStatus, change, reportNode);
    }

    /**
     * Same algebra as line status, the inversion of a set bus swaps bus 1 and bus 2. A change on an
     * element set to be disconnected has no effect.
     */
    private static void composeBuses(GridAction action, GridAction other, ReportNode reportNode) {
        int[] set = action.setBus.clone();
        boolean[] change = action.changeBus.clone();
        for (int pos = 0; pos < set.length; pos++) {
            boolean incomingChange = other.changeBus[pos];
            int incomingSet = other.setBus[pos];
            if (incomingChange) {
                change[pos] = !change[pos];
            }
            if (incomingSet != 0) {
                change[pos] = false;
            }
            if (set[pos] != 0 && incomingChange) {
                if (set[pos] > 0) {
                    set[pos] = GridSchema.MAX_BUSBARS_PER_SUBSTATION + 1 - set[pos];
                }
                change[pos] = false;
            }
            if (incomingSet != 0) {
                set[pos] = incomingSet;
            }
        }
        action.setBus = assignOrDrop(action, ActionAttribute.SET_BUS, action.setBus, set, reportNode);
        action.changeBus = assignOrDrop(action, ActionAttribute.CHANGE_BUS, action.changeBus, change, reportNode);
    }

    private static void composeShunts(GridAction action, GridAction other, ReportNode reportNode) {
        if (action.shuntP == null || other.shuntP == null) {
            return;
        }
        double[] p = action.shuntP.clone();
        double[] q = action.shuntQ.clone();
        int[] bus = action.shuntBus.clone();
        for (int shunt = 0; shunt < p.length; shunt++) {
            if (Double.isFinite(other.shuntP[shunt])) {
                p[shunt] = other.shuntP[shunt];
            }
            if (Double.isFinite(other.shuntQ[shunt])) {
                q[shunt] = other.shuntQ[shunt];
            }
            if (other.shuntBus[shunt] != 0) {
                bus[shunt] = other.shuntBus[shunt];
            }
        }
        action.shuntP = assignOrDrop(action, ActionAttribute.SHUNT_P, action.shuntP, p, reportNode);
        action.shuntQ = assignOrDrop(action, ActionAttribute.SHUNT_Q, action.shuntQ, q, reportNode);
        action.shuntBus = assignOrDrop(action, ActionAttribute.SHUNT_BUS, action.shuntBus, bus, reportNode);
    }

    private static int[] assignOrDrop(GridAction action, ActionAttribute attribute, int[] current, int[] composed, ReportNode reportNode) {
        if (action.supports(attribute)) {
            return composed;
        }
        if (!Arrays.equals(current, composed)) {
            drop(action, attribute, reportNode);
        }
        return current;
    }

    private static boolean[] assignOrDrop(GridAction action, ActionAttribute attribute, boolean[] current, boolean[] composed, ReportNode reportNode) {
        if (action.supports(attribute)) {
            return composed;
        }
        if (!Arrays.equals(current, composed)) {
            drop(action, attribute, reportNode);
        }
        return current;
    }

    private static double[] assignOrDrop(GridAction action, ActionAttribute attribute, double[] current, double[] composed, ReportNode reportNode) {
        if (action.supports(attribute)) {
            return composed;
        }
        if (!Arrays.equals(current, composed)) {
            drop(action, attribute, reportNode);
        }
        return current;
    }
}

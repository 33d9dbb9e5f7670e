/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.exceptions.*;
import com.powsybl.gridaction.network.ElementType;
import com.powsybl.gridaction.network.GeneratorDispatchData;
import com.powsybl.gridaction.network.GridSchema;
import com.powsybl.gridaction.network.StorageUnitData;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Detects actions whose content is ambiguous or out of the grid capabilities. Checks always run in
 * the same order so that the reported violation is deterministic:
 * <ol>
 *     <li>a line both set and changed</li>
 *     <li>injection vector lengths</li>
 *     <li>topology, line status and redispatch vector lengths</li>
 *     <li>redispatching</li>
 *     <li>storage set points</li>
 *     <li>set bus values below -1, then above 2</li>
 *     <li>a topology position both set and changed</li>
 *     <li>a line disconnected at one end and connected at the other</li>
 *     <li>bus edits on the ends of a disconnected or reconnected line</li>
 *     <li>shunts</li>
 * </ol>
 * Nothing is ever repaired.
 *
 * @author PowSyBl grid action team
 */
public final class AmbiguityChecker {

    private AmbiguityChecker() {
    }

    public static void check(GridAction action) {
        Objects.requireNonNull(action);
        GridSchema schema = action.schema;
        checkLineStatusConflict(action);
        checkInjectionLengths(action, schema);
        checkVectorLengths(action, schema);
        checkRedispatching(action, schema);
        checkStorage(action, schema);
        checkBusRange(action);
        checkBusConflict(action);
        checkLineEnds(action, schema);
        checkLineStatusVersusBuses(action, schema);
        checkShunts(action, schema);
    }

    public static boolean isAmbiguous(GridAction action) {
        return findAmbiguity(action).isPresent();
    }

    public static Optional<AmbiguousActionException> findAmbiguity(GridAction action) {
        try {
            check(action);
            return Optional.empty();
        } catch (AmbiguousActionException e) {
            return Optional.of(e);
        }
    }

    private static void checkLineStatusConflict(GridAction action) {
        int size = Math.min(action.setLineStatus.length, action.changeLineStatus.length);
        for (int line = 0; line < size; line++) {
            if (action.changeLineStatus[line] && action.setLineStatus[line] != 0) {
                throw new InvalidLineStatusException("Line " + line + " has its status both set and changed");
            }
        }
    }

    private static void checkInjectionLengths(GridAction action, GridSchema schema) {
        for (Map.Entry<InjectionKey, double[]> e : action.injections.entrySet()) {
            checkLength(e.getKey().getName(), schema.getElementCount(e.getKey().getElementType()), e.getValue().length);
        }
    }

    private static void checkVectorLengths(GridAction action, GridSchema schema) {
        checkLength(ActionAttribute.CHANGE_BUS.getName(), schema.getDimTopo(), action.changeBus.length);
        checkLength(ActionAttribute.SET_BUS.getName(), schema.getDimTopo(), action.setBus.length);
        checkLength(ActionAttribute.SET_LINE_STATUS.getName(), schema.getLineCount(), action.setLineStatus.length);
        checkLength(ActionAttribute.CHANGE_LINE_STATUS.getName(), schema.getLineCount(), action.changeLineStatus.length);
        checkLength(ActionAttribute.REDISPATCH.getName(), schema.getGeneratorCount(), action.redispatch.length);
    }

    private static void checkLength(String attribute, int expected, int actual) {
        if (expected != actual) {
            throw new InvalidNumberOfElementsException(attribute, expected, actual);
        }
    }

    private static void checkRedispatching(GridAction action, GridSchema schema) {
        double[] redispatch = action.redispatch;
        boolean requested = false;
        for (double value : redispatch) {
            if (value != 0 && !Double.isNaN(value)) {
                requested = true;
                break;
            }
        }
        if (!requested) {
            return;
        }
        GeneratorDispatchData data = schema.getDispatchData()
                .orElseThrow(() -> new RedispatchingNotAvailableException("Redispatching is not available on this grid"));
        double[] prodP = action.injections.get(InjectionKey.PROD_P);
        for (int gen = 0; gen < redispatch.length; gen++) {
            double value = redispatch[gen];
            if (value == 0 || Double.isNaN(value)) {
                continue;
            }
            if (!data.isRedispatchable(gen)) {
                throw new InvalidRedispatchingException("Generator " + gen + " is not redispatchable");
            }
            if (value > data.getMaxRampUp(gen)) {
                throw new InvalidRedispatchingException("Redispatching of " + value + " MW on generator " + gen
                        + " is above its maximum ramp up " + data.getMaxRampUp(gen));
            }
            if (-value > data.getMaxRampDown(gen)) {
                throw new InvalidRedispatchingException("Redispatching of " + value + " MW on generator " + gen
                        + " is below its maximum ramp down -" + data.getMaxRampDown(gen));
            }
            if (prodP != null && Double.isFinite(prodP[gen])) {
                double target = prodP[gen] + value;
                if (target > data.getPmax(gen)) {
                    throw new InvalidRedispatchingException("Generator " + gen + " would produce " + target
                            + " MW, above its pmax " + data.getPmax(gen));
                }
                if (target < data.getPmin(gen)) {
                    throw new InvalidRedispatchingException("Generator " + gen + " would produce " + target
                            + " MW, below its pmin " + data.getPmin(gen));
                }
            }
        }
    }

    private static void checkStorage(GridAction action, GridSchema schema) {
        if (action.storageModified) {
            if (schema.getStorageCount() == 0) {
                throw new InvalidStorageException("There is no storage unit on this grid");
            }
            StorageUnitData data = schema.getStorageData()
                    .orElseThrow(() -> new InvalidStorageException("Storage units of this grid have no static data"));
            checkLength(ActionAttribute.STORAGE_POWER.getName(), schema.getStorageCount(), action.storagePower.length);
            for (int storage = 0; storage < action.storagePower.length; storage++) {
                double power = action.storagePower[storage];
                if (power < -data.getMaxPProd(storage)) {
                    throw new InvalidStorageException("Storage unit " + storage + " is asked to produce " + -power
                            + " MW, more than its maximum " + data.getMaxPProd(storage));
                }
                if (power > data.getMaxPAbsorb(storage)) {
                    throw new InvalidStorageException("Storage unit " + storage + " is asked to absorb " + power
                            + " MW, more than its maximum " + data.getMaxPAbsorb(storage));
                }
            }
        }
        if (!action.supports(ActionAttribute.STORAGE_POWER)) {
            for (int storage = 0; storage < schema.getStorageCount(); storage++) {
                int pos = schema.getTopologyIndex(ElementType.STORAGE, storage);
                if (action.setBus[pos] > 0 || action.changeBus[pos]) {
                    throw new InvalidStorageException("Storage unit " + storage
                            + " cannot be connected or moved by an action of type " + action.type);
                }
            }
        }
    }

    private static void checkBusRange(GridAction action) {
        for (int pos = 0; pos < action.setBus.length; pos++) {
            if (action.setBus[pos] < -1) {
                throw new InvalidBusStatusException("Topology position " + pos + " is set to bus " + action.setBus[pos]
                        + ", values below -1 are not allowed");
            }
        }
        for (int pos = 0; pos < action.setBus.length; pos++) {
            if (action.setBus[pos] > GridSchema.MAX_BUSBARS_PER_SUBSTATION) {
                throw new InvalidBusStatusException("Topology position " + pos + " is set to bus " + action.setBus[pos]
                        + ", values above " + GridSchema.MAX_BUSBARS_PER_SUBSTATION + " are not allowed");
            }
        }
    }

    private static void checkBusConflict(GridAction action) {
        for (int pos = 0; pos < action.setBus.length; pos++) {
            if (action.setBus[pos] != 0 && action.changeBus[pos]) {
                throw new InvalidBusStatusException("Topology position " + pos + " has its bus both set and changed");
            }
        }
    }

    private static void checkLineEnds(GridAction action, GridSchema schema) {
        for (int line = 0; line < schema.getLineCount(); line++) {
            int or = action.setBus[schema.getTopologyIndex(ElementType.LINE_OR, line)];
            int ex = action.setBus[schema.getTopologyIndex(ElementType.LINE_EX, line)];
            if (or == -1 && ex > 0) {
                throw new InvalidLineStatusException("Line " + line + " is disconnected at its origin but connected at its extremity");
            }
        }
        for (int line = 0; line < schema.getLineCount(); line++) {
            int or = action.setBus[schema.getTopologyIndex(ElementType.LINE_OR, line)];
            int ex = action.setBus[schema.getTopologyIndex(ElementType.LINE_EX, line)];
            if (ex == -1 && or > 0) {
                throw new InvalidLineStatusException("Line " + line + " is disconnected at its extremity but connected at its origin");
            }
        }
    }

    private static void checkLineStatusVersusBuses(GridAction action, GridSchema schema) {
        int lineCount = schema.getLineCount();
        for (int line = 0; line < lineCount; line++) {
            if (action.setLineStatus[line] == -1
                    && (action.setBus[orPos(schema, line)] > 0 || action.setBus[exPos(schema, line)] > 0)) {
                throw new InvalidLineStatusException("Line " + line + " is disconnected while one of its ends is assigned to a bus");
            }
        }
        for (int line = 0; line < lineCount; line++) {
            if (action.setLineStatus[line] == -1
                    && (action.changeBus[orPos(schema, line)] || action.changeBus[exPos(schema, line)])) {
                throw new InvalidLineStatusException("Line " + line + " is disconnected while the bus of one of its ends is changed");
            }
        }
        for (int line = 0; line < lineCount; line++) {
            if (action.setLineStatus[line] == 1 && action.changeBus[orPos(schema, line)]) {
                throw new InvalidLineStatusException("Line " + line + " is reconnected while the bus of its origin is changed");
            }
        }
        for (int line = 0; line < lineCount; line++) {
            if (action.setLineStatus[line] == 1 && action.changeBus[exPos(schema, line)]) {
                throw new InvalidLineStatusException("Line " + line + " is reconnected while the bus of its extremity is changed");
            }
        }
    }

    private static int orPos(GridSchema schema, int line) {
        return schema.getTopologyIndex(ElementType.LINE_OR, line);
    }

    private static int exPos(GridSchema schema, int line) {
        return schema.getTopologyIndex(ElementType.LINE_EX, line);
    }

    private static void checkShunts(GridAction action, GridSchema schema) {
        if (schema.getCapabilities().shunts()) {
            int shuntCount = schema.getShuntCount();
            checkLength(ActionAttribute.SHUNT_P.getName(), shuntCount, action.shuntP.length);
            checkLength(ActionAttribute.SHUNT_Q.getName(), shuntCount, action.shuntQ.length);
            checkLength(ActionAttribute.SHUNT_BUS.getName(), shuntCount, action.shuntBus.length);
            for (int shunt = 0; shunt < shuntCount; shunt++) {
                if (action.shuntBus[shunt] > GridSchema.MAX_BUSBARS_PER_SUBSTATION) {
                    throw new AmbiguousActionException("Shunt " + shunt + " is set to bus " + action.shuntBus[shunt]
                            + ", values above " + GridSchema.MAX_BUSBARS_PER_SUBSTATION + " are not allowed");
                }
                if (action.shuntBus[shunt] < -1) {
                    throw new AmbiguousActionException("Shunt " + shunt + " is set to bus " + action.shuntBus[shunt]
                            + ", values below -1 are not allowed");
                }
            }
        } else if (action.shuntP != null || action.shuntQ != null || action.shuntBus != null) {
            throw new AmbiguousActionException("Shunts are modified but they are not supported on this grid");
        }
    }
}

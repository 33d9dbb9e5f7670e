/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.network;

import com.google.common.base.Stopwatch;
import com.powsybl.gridaction.exceptions.GridSchemaException;
import com.powsybl.gridaction.exceptions.IncorrectNumberOfElementsException;
import com.powsybl.gridaction.exceptions.IncorrectPositionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;

import static com.powsybl.gridaction.util.Markers.PERFORMANCE_MARKER;

/**
 * Collects the description of a grid and validates it into an immutable {@link GridSchema}.
 * <p>
 * Positions inside substations are optional: when none are given, elements are placed sequentially
 * in each substation, loads first, then generators, line origins, line extremities and storage units.
 *
 * @author PowSyBl grid action team
 */
public class GridSchemaBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(GridSchemaBuilder.class);

    private Integer substationCount;
    private int[] subInfo;
    private final EnumMap<ElementType, int[]> toSubId = new EnumMap<>(ElementType.class);
    private final EnumMap<ElementType, int[]> toSubPos = new EnumMap<>(ElementType.class);

    private String[] loadNames;
    private String[] generatorNames;
    private String[] lineNames;
    private String[] substationNames;
    private String[] storageNames;

    private GeneratorDispatchData dispatchData;
    private StorageUnitData storageData;
    private ShuntData shuntData;

    // filled by build()
    int computedSubstationCount;
    int[] computedSubInfo;
    int dimTopo;
    final EnumMap<ElementType, int[]> computedToSubId = new EnumMap<>(ElementType.class);
    final EnumMap<ElementType, int[]> computedToSubPos = new EnumMap<>(ElementType.class);
    final EnumMap<ElementType, int[]> posTopoVect = new EnumMap<>(ElementType.class);
    String[] computedLoadNames;
    String[] computedGeneratorNames;
    String[] computedLineNames;
    String[] computedSubstationNames;
    String[] computedStorageNames;
    String[] computedShuntNames;

    public GridSchemaBuilder() {
        for (ElementType type : ElementType.values()) {
            toSubId.put(type, new int[0]);
        }
    }

    public GridSchemaBuilder setSubstationCount(int substationCount) {
        this.substationCount = substationCount;
        return this;
    }

    public GridSchemaBuilder setSubInfo(int... subInfo) {
        this.subInfo = Objects.requireNonNull(subInfo).clone();
        return this;
    }

    public GridSchemaBuilder setLoadToSubId(int... loadToSubId) {
        toSubId.put(ElementType.LOAD, Objects.requireNonNull(loadToSubId).clone());
        return this;
    }

    public GridSchemaBuilder setGeneratorToSubId(int... generatorToSubId) {
        toSubId.put(ElementType.GENERATOR, Objects.requireNonNull(generatorToSubId).clone());
        return this;
    }

    public GridSchemaBuilder setLineOrToSubId(int... lineOrToSubId) {
        toSubId.put(ElementType.LINE_OR, Objects.requireNonNull(lineOrToSubId).clone());
        return this;
    }

    public GridSchemaBuilder setLineExToSubId(int... lineExToSubId) {
        toSubId.put(ElementType.LINE_EX, Objects.requireNonNull(lineExToSubId).clone());
        return this;
    }

    public GridSchemaBuilder setStorageToSubId(int... storageToSubId) {
        toSubId.put(ElementType.STORAGE, Objects.requireNonNull(storageToSubId).clone());
        return this;
    }

    /**
     * Position of each element of the given kind inside its substation. Either every kind gets its
     * positions or none.
     */
    public GridSchemaBuilder setToSubPos(ElementType type, int... positions) {
        toSubPos.put(Objects.requireNonNull(type), Objects.requireNonNull(positions).clone());
        return this;
    }

    public GridSchemaBuilder setLoadNames(String... loadNames) {
        this.loadNames = Objects.requireNonNull(loadNames).clone();
        return this;
    }

    public GridSchemaBuilder setGeneratorNames(String... generatorNames) {
        this.generatorNames = Objects.requireNonNull(generatorNames).clone();
        return this;
    }

    public GridSchemaBuilder setLineNames(String... lineNames) {
        this.lineNames = Objects.requireNonNull(lineNames).clone();
        return this;
    }

    public GridSchemaBuilder setSubstationNames(String... substationNames) {
        this.substationNames = Objects.requireNonNull(substationNames).clone();
        return this;
    }

    public GridSchemaBuilder setStorageNames(String... storageNames) {
        this.storageNames = Objects.requireNonNull(storageNames).clone();
        return this;
    }

    public GridSchemaBuilder setDispatchData(GeneratorDispatchData dispatchData) {
        this.dispatchData = dispatchData;
        return this;
    }

    public GridSchemaBuilder setStorageData(StorageUnitData storageData) {
        this.storageData = storageData;
        return this;
    }

    public GridSchemaBuilder setShuntData(ShuntData shuntData) {
        this.shuntData = shuntData;
        return this;
    }

    public GridSchema build() {
        Stopwatch stopwatch = Stopwatch.createStarted();

        computedSubstationCount = computeSubstationCount();
        if (toSubId.get(ElementType.LINE_OR).length != toSubId.get(ElementType.LINE_EX).length) {
            throw new IncorrectNumberOfElementsException("Lines have " + toSubId.get(ElementType.LINE_OR).length
                    + " origin substations but " + toSubId.get(ElementType.LINE_EX).length + " extremity substations");
        }
        for (ElementType type : ElementType.values()) {
            int[] subIds = toSubId.get(type);
            for (int id = 0; id < subIds.length; id++) {
                if (subIds[id] < 0 || subIds[id] >= computedSubstationCount) {
                    throw new IncorrectPositionException(type.getLabel() + " " + id + " is connected to substation " + subIds[id]
                            + " but the grid has " + computedSubstationCount + " substations");
                }
            }
            computedToSubId.put(type, subIds.clone());
        }

        computeSubInfo();
        computeSubPositions();
        computePositionsInTopologyVector();
        computeNames();
        checkStaticData();

        GridSchema schema = new GridSchema(this);
        stopwatch.stop();
        LOGGER.debug(PERFORMANCE_MARKER, "Grid schema with {} substations and {} topology positions built in {} us",
                computedSubstationCount, dimTopo, stopwatch.elapsed(TimeUnit.MICROSECONDS));
        return schema;
    }

    private int computeSubstationCount() {
        int count;
        if (substationCount != null) {
            count = substationCount;
        } else if (subInfo != null) {
            count = subInfo.length;
        } else {
            throw new IncorrectNumberOfElementsException("The number of substations is not defined");
        }
        if (count < 0) {
            throw new IncorrectNumberOfElementsException("The number of substations cannot be negative: " + count);
        }
        return count;
    }

    private void computeSubInfo() {
        int[] counts = new int[computedSubstationCount];
        for (ElementType type : ElementType.values()) {
            for (int sub : computedToSubId.get(type)) {
                counts[sub]++;
            }
        }
        if (subInfo != null) {
            if (subInfo.length != computedSubstationCount) {
                throw new IncorrectNumberOfElementsException("Sub info has " + subInfo.length + " values but the grid has "
                        + computedSubstationCount + " substations");
            }
            for (int sub = 0; sub < computedSubstationCount; sub++) {
                if (subInfo[sub] != counts[sub]) {
                    throw new IncorrectNumberOfElementsException("Substation " + sub + " is declared with " + subInfo[sub]
                            + " elements but " + counts[sub] + " elements are connected to it");
                }
            }
        }
        for (int sub = 0; sub < computedSubstationCount; sub++) {
            if (counts[sub] == 0) {
                throw new IncorrectNumberOfElementsException("Substation " + sub + " has no element connected to it");
            }
        }
        computedSubInfo = counts;
        dimTopo = Arrays.stream(counts).sum();
    }

    private void computeSubPositions() {
        List<ElementType> missing = Arrays.stream(ElementType.values())
                .filter(type -> !toSubPos.containsKey(type) && computedToSubId.get(type).length > 0)
                .toList();
        if (missing.isEmpty()) {
            for (ElementType type : ElementType.values()) {
                int[] subIds = computedToSubId.get(type);
                int[] positions = toSubPos.getOrDefault(type, new int[0]);
                if (positions.length != subIds.length) {
                    throw new IncorrectNumberOfElementsException("There are " + subIds.length + " elements of kind "
                            + type.getLabel() + " but " + positions.length + " positions in substations");
                }
                for (int id = 0; id < subIds.length; id++) {
                    if (positions[id] < 0 || positions[id] >= computedSubInfo[subIds[id]]) {
                        throw new IncorrectPositionException(type.getLabel() + " " + id + " has position " + positions[id]
                                + " in substation " + subIds[id] + " which has " + computedSubInfo[subIds[id]] + " elements");
                    }
                }
                computedToSubPos.put(type, positions.clone());
            }
        } else if (missing.size() == (int) Arrays.stream(ElementType.values()).filter(type -> computedToSubId.get(type).length > 0).count()) {
            int[] next = new int[computedSubstationCount];
            for (ElementType type : ElementType.values()) {
                int[] subIds = computedToSubId.get(type);
                int[] positions = new int[subIds.length];
                for (int id = 0; id < subIds.length; id++) {
                    positions[id] = next[subIds[id]]++;
                }
                computedToSubPos.put(type, positions);
            }
        } else {
            throw new GridSchemaException("Positions in substations are given for some element kinds but not for " + missing);
        }
    }

    private void computePositionsInTopologyVector() {
        int[] offsets = new int[computedSubstationCount];
        for (int sub = 1; sub < computedSubstationCount; sub++) {
            offsets[sub] = offsets[sub - 1] + computedSubInfo[sub - 1];
        }
        boolean[] used = new boolean[dimTopo];
        for (ElementType type : ElementType.values()) {
            int[] subIds = computedToSubId.get(type);
            int[] positions = computedToSubPos.get(type);
            int[] topoPositions = new int[subIds.length];
            for (int id = 0; id < subIds.length; id++) {
                int pos = offsets[subIds[id]] + positions[id];
                if (used[pos]) {
                    throw new IncorrectPositionException(type.getLabel() + " " + id + " uses topology position " + pos
                            + " which is already used by another element of substation " + subIds[id]);
                }
                used[pos] = true;
                topoPositions[id] = pos;
            }
            posTopoVect.put(type, topoPositions);
        }
        for (int pos = 0; pos < dimTopo; pos++) {
            if (!used[pos]) {
                throw new IncorrectPositionException("No element at topology position " + pos);
            }
        }
    }

    private void computeNames() {
        int[] loadSubs = computedToSubId.get(ElementType.LOAD);
        int[] genSubs = computedToSubId.get(ElementType.GENERATOR);
        int[] orSubs = computedToSubId.get(ElementType.LINE_OR);
        int[] exSubs = computedToSubId.get(ElementType.LINE_EX);
        int[] storageSubs = computedToSubId.get(ElementType.STORAGE);
        computedLoadNames = namesOrDefault("load", loadNames, loadSubs.length, id -> "load_" + loadSubs[id] + "_" + id);
        computedGeneratorNames = namesOrDefault("generator", generatorNames, genSubs.length, id -> "gen_" + genSubs[id] + "_" + id);
        computedLineNames = namesOrDefault("line", lineNames, orSubs.length, id -> orSubs[id] + "_" + exSubs[id] + "_" + id);
        computedSubstationNames = namesOrDefault("substation", substationNames, computedSubstationCount, id -> "sub_" + id);
        computedStorageNames = namesOrDefault("storage unit", storageNames, storageSubs.length, id -> "storage_" + storageSubs[id] + "_" + id);
        if (shuntData != null) {
            computedShuntNames = namesOrDefault("shunt", shuntData.getNames(), shuntData.getShuntCount(),
                id -> "shunt_" + shuntData.getSubstationId(id) + "_" + id);
        } else {
            computedShuntNames = new String[0];
        }
    }

    private static String[] namesOrDefault(String kind, String[] names, int count, IntFunction<String> defaultName) {
        String[] result;
        if (names == null) {
            result = new String[count];
            for (int id = 0; id < count; id++) {
                result[id] = defaultName.apply(id);
            }
            if (count > 0) {
                LOGGER.warn("No names given for the {} elements, default names are used", kind);
            }
        } else {
            if (names.length != count) {
                throw new IncorrectNumberOfElementsException(names.length + " names given for " + count + " " + kind + " elements");
            }
            Set<String> unique = new HashSet<>();
            for (String name : names) {
                if (name == null) {
                    throw new GridSchemaException("A " + kind + " has no name");
                }
                if (!unique.add(name)) {
                    throw new GridSchemaException("Duplicate " + kind + " name '" + name + "'");
                }
            }
            result = names.clone();
        }
        return result;
    }

    private void checkStaticData() {
        int genCount = computedToSubId.get(ElementType.GENERATOR).length;
        if (dispatchData != null && dispatchData.getGeneratorCount() != genCount) {
            throw new IncorrectNumberOfElementsException("Dispatch data describes " + dispatchData.getGeneratorCount()
                    + " generators but the grid has " + genCount);
        }
        int storageCount = computedToSubId.get(ElementType.STORAGE).length;
        if (storageData != null && storageData.getStorageCount() != storageCount) {
            throw new IncorrectNumberOfElementsException("Storage data describes " + storageData.getStorageCount()
                    + " storage units but the grid has " + storageCount);
        }
        if (shuntData != null) {
            for (int shunt = 0; shunt < shuntData.getShuntCount(); shunt++) {
                int sub = shuntData.getSubstationId(shunt);
                if (sub < 0 || sub >= computedSubstationCount) {
                    throw new IncorrectPositionException("Shunt " + shunt + " is connected to substation " + sub
                            + " but the grid has " + computedSubstationCount + " substations");
                }
            }
        }
    }

    GeneratorDispatchData getDispatchData() {
        return dispatchData;
    }

    StorageUnitData getStorageData() {
        return storageData;
    }

    ShuntData getShuntData() {
        return shuntData;
    }
}

/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.network;

import com.powsybl.gridaction.exceptions.ElementOutOfRangeException;
import com.powsybl.gridaction.exceptions.GridActionException;
import com.powsybl.gridaction.exceptions.UnknownElementNameException;
import org.apache.commons.lang3.ArrayUtils;

import java.util.*;
import java.util.stream.IntStream;

/**
 * Immutable description of a grid: element counts, substation membership and the bijection between
 * the elements and the positions of the flat topology vector.
 * <p>
 * The topology vector holds one entry per element end. The entries of a substation are contiguous
 * and substations are laid out by increasing id, so that the position of an element is the number
 * of elements of all the lower numbered substations plus its position inside its own substation.
 * <p>
 * Bus assignments are limited to {@value #MAX_BUSBARS_PER_SUBSTATION} busbars per substation, which
 * is what bus inversion in action composition relies on.
 *
 * @author PowSyBl grid action team
 */
public final class GridSchema {

    public static final int MAX_BUSBARS_PER_SUBSTATION = 2;

    private final int substationCount;
    private final int[] subInfo;
    private final int[] subOffsets;
    private final int dimTopo;
    private final EnumMap<ElementType, int[]> toSubId;
    private final EnumMap<ElementType, int[]> toSubPos;
    private final EnumMap<ElementType, int[]> posTopoVect;
    private final int[] topoVectToSub;
    private final ElementType[] topoVectElementType;
    private final int[] topoVectElementId;

    private final String[] loadNames;
    private final String[] generatorNames;
    private final String[] lineNames;
    private final String[] substationNames;
    private final String[] storageNames;
    private final String[] shuntNames;

    private final GeneratorDispatchData dispatchData;
    private final StorageUnitData storageData;
    private final int[] shuntToSubId;
    private final GridCapabilities capabilities;

    GridSchema(GridSchemaBuilder builder) {
        substationCount = builder.computedSubstationCount;
        subInfo = builder.computedSubInfo.clone();
        dimTopo = builder.dimTopo;
        toSubId = new EnumMap<>(builder.computedToSubId);
        toSubPos = new EnumMap<>(builder.computedToSubPos);
        posTopoVect = new EnumMap<>(builder.posTopoVect);
        subOffsets = new int[substationCount];
        for (int sub = 1; sub < substationCount; sub++) {
            subOffsets[sub] = subOffsets[sub - 1] + subInfo[sub - 1];
        }
        topoVectToSub = new int[dimTopo];
        topoVectElementType = new ElementType[dimTopo];
        topoVectElementId = new int[dimTopo];
        for (ElementType type : ElementType.values()) {
            int[] positions = posTopoVect.get(type);
            for (int id = 0; id < positions.length; id++) {
                topoVectToSub[positions[id]] = toSubId.get(type)[id];
                topoVectElementType[positions[id]] = type;
                topoVectElementId[positions[id]] = id;
            }
        }
        loadNames = builder.computedLoadNames;
        generatorNames = builder.computedGeneratorNames;
        lineNames = builder.computedLineNames;
        substationNames = builder.computedSubstationNames;
        storageNames = builder.computedStorageNames;
        shuntNames = builder.computedShuntNames;
        dispatchData = builder.getDispatchData();
        storageData = builder.getStorageData();
        ShuntData shuntData = builder.getShuntData();
        shuntToSubId = shuntData != null ? shuntData.getShuntToSubId() : null;
        capabilities = new GridCapabilities(dispatchData != null,
                getStorageCount() > 0 && storageData != null,
                shuntData != null);
    }

    public static GridSchemaBuilder builder() {
        return new GridSchemaBuilder();
    }

    public int getLoadCount() {
        return toSubId.get(ElementType.LOAD).length;
    }

    public int getGeneratorCount() {
        return toSubId.get(ElementType.GENERATOR).length;
    }

    public int getLineCount() {
        return toSubId.get(ElementType.LINE_OR).length;
    }

    public int getStorageCount() {
        return toSubId.get(ElementType.STORAGE).length;
    }

    public int getShuntCount() {
        return shuntToSubId != null ? shuntToSubId.length : 0;
    }

    public int getSubstationCount() {
        return substationCount;
    }

    public int getDimTopo() {
        return dimTopo;
    }

    public int getElementCount(ElementType type) {
        return toSubId.get(Objects.requireNonNull(type)).length;
    }

    public int getSubInfo(int sub) {
        return subInfo[sub];
    }

    public int[] getSubInfo() {
        return subInfo.clone();
    }

    /**
     * Topology position of the first element of a substation.
     */
    public int getSubstationStart(int sub) {
        return subOffsets[sub];
    }

    public int getSubstationId(ElementType type, int id) {
        return toSubId.get(type)[id];
    }

    public int getSubPosition(ElementType type, int id) {
        return toSubPos.get(type)[id];
    }

    public int getTopologyIndex(ElementType type, int id) {
        return posTopoVect.get(type)[id];
    }

    public int[] getToSubId(ElementType type) {
        return toSubId.get(Objects.requireNonNull(type)).clone();
    }

    public int[] getToSubPos(ElementType type) {
        return toSubPos.get(Objects.requireNonNull(type)).clone();
    }

    public int[] getPosTopoVect(ElementType type) {
        return posTopoVect.get(Objects.requireNonNull(type)).clone();
    }

    public int getSubstationOfTopologyIndex(int pos) {
        return topoVectToSub[pos];
    }

    public int[] getTopoVectToSub() {
        return topoVectToSub.clone();
    }

    public ElementType getElementTypeAt(int pos) {
        return topoVectElementType[pos];
    }

    public int getElementIdAt(int pos) {
        return topoVectElementId[pos];
    }

    public int getShuntSubstationId(int shunt) {
        return shuntToSubId[shunt];
    }

    public TopologyPosition resolve(ElementType type, int id) {
        checkElementId(type, id);
        return new TopologyPosition(toSubId.get(type)[id], posTopoVect.get(type)[id]);
    }

    public void checkElementId(ElementType type, int id) {
        int count = getElementCount(type);
        if (id < 0 || id >= count) {
            throw new ElementOutOfRangeException(type.getLabel(), id, count);
        }
    }

    public void checkSubstationId(int sub) {
        if (sub < 0 || sub >= substationCount) {
            throw new ElementOutOfRangeException("substation", sub, substationCount);
        }
    }

    /**
     * One row per element connected to the substation, ordered by position inside the substation.
     * Columns are the substation id, then the load, generator, line origin, line extremity and
     * storage unit id of the element, -1 where the element is not of that kind.
     */
    public int[][] elementsOfSubstation(int sub) {
        checkSubstationId(sub);
        int[][] result = new int[subInfo[sub]][];
        for (int i = 0; i < subInfo[sub]; i++) {
            result[i] = gridObjectsTypesRow(subOffsets[sub] + i);
        }
        return result;
    }

    /**
     * Same encoding as {@link #elementsOfSubstation(int)}, one row per topology position.
     */
    public int[][] getGridObjectsTypes() {
        int[][] result = new int[dimTopo][];
        for (int pos = 0; pos < dimTopo; pos++) {
            result[pos] = gridObjectsTypesRow(pos);
        }
        return result;
    }

    private int[] gridObjectsTypesRow(int pos) {
        int[] row = new int[ElementType.COLUMN_COUNT];
        Arrays.fill(row, -1);
        row[ElementType.SUBSTATION_COLUMN] = topoVectToSub[pos];
        row[topoVectElementType[pos].getColumn()] = topoVectElementId[pos];
        return row;
    }

    public ConnectedObjects getObjectsConnectedTo(int sub) {
        checkSubstationId(sub);
        return new ConnectedObjects(idsAt(ElementType.LOAD, sub),
                idsAt(ElementType.GENERATOR, sub),
                idsAt(ElementType.LINE_OR, sub),
                idsAt(ElementType.LINE_EX, sub),
                idsAt(ElementType.STORAGE, sub),
                subInfo[sub]);
    }

    private int[] idsAt(ElementType type, int sub) {
        int[] subIds = toSubId.get(type);
        return IntStream.range(0, subIds.length).filter(id -> subIds[id] == sub).toArray();
    }

    public int[] getLoadsId(int sub) {
        checkSubstationId(sub);
        return idsAt(ElementType.LOAD, sub);
    }

    public int[] getGeneratorsId(int sub) {
        checkSubstationId(sub);
        return idsAt(ElementType.GENERATOR, sub);
    }

    public int[] getStoragesId(int sub) {
        checkSubstationId(sub);
        return idsAt(ElementType.STORAGE, sub);
    }

    /**
     * Lines connecting two substations, whatever their orientation.
     */
    public int[] getLinesId(int fromSub, int toSub) {
        checkSubstationId(fromSub);
        checkSubstationId(toSub);
        int[] or = toSubId.get(ElementType.LINE_OR);
        int[] ex = toSubId.get(ElementType.LINE_EX);
        int[] lines = IntStream.range(0, or.length)
                .filter(line -> or[line] == fromSub && ex[line] == toSub || or[line] == toSub && ex[line] == fromSub)
                .toArray();
        if (lines.length == 0) {
            throw new GridActionException("No line connects substation " + fromSub + " to substation " + toSub);
        }
        return lines;
    }

    public String[] getNames(ElementType type) {
        return namesOf(type).clone();
    }

    private String[] namesOf(ElementType type) {
        return switch (Objects.requireNonNull(type)) {
            case LOAD -> loadNames;
            case GENERATOR -> generatorNames;
            case LINE_OR, LINE_EX -> lineNames;
            case STORAGE -> storageNames;
        };
    }

    public String getName(ElementType type, int id) {
        return namesOf(type)[id];
    }

    public String[] getLoadNames() {
        return loadNames.clone();
    }

    public String[] getGeneratorNames() {
        return generatorNames.clone();
    }

    public String[] getLineNames() {
        return lineNames.clone();
    }

    public String[] getSubstationNames() {
        return substationNames.clone();
    }

    public String[] getStorageNames() {
        return storageNames.clone();
    }

    public String[] getShuntNames() {
        return shuntNames.clone();
    }

    public int indexOfName(ElementType type, String name) {
        String kind = type == ElementType.LINE_OR || type == ElementType.LINE_EX ? "line" : type.getLabel();
        return indexOf(namesOf(type), kind, name);
    }

    public int indexOfSubstation(String name) {
        return indexOf(substationNames, "substation", name);
    }

    public int indexOfShunt(String name) {
        return indexOf(shuntNames, "shunt", name);
    }

    private static int indexOf(String[] names, String kind, String name) {
        int index = ArrayUtils.indexOf(names, Objects.requireNonNull(name));
        if (index == ArrayUtils.INDEX_NOT_FOUND) {
            throw new UnknownElementNameException(kind, name);
        }
        return index;
    }

    public Optional<GeneratorDispatchData> getDispatchData() {
        return Optional.ofNullable(dispatchData);
    }

    public Optional<StorageUnitData> getStorageData() {
        return Optional.ofNullable(storageData);
    }

    public Optional<ShuntData> getShuntData() {
        return shuntToSubId == null ? Optional.empty() : Optional.of(new ShuntData(shuntToSubId, shuntNames));
    }

    public GridCapabilities getCapabilities() {
        return capabilities;
    }

    /**
     * Two schemas describe the same grid when they have the same elements, names and positions.
     * Static dispatch and storage data are not compared.
     */
    public boolean sameGrid(GridSchema other) {
        if (this == other) {
            return true;
        }
        if (other == null || substationCount != other.substationCount || dimTopo != other.dimTopo
                || !Arrays.equals(subInfo, other.subInfo)
                || !Arrays.equals(shuntToSubId, other.shuntToSubId)) {
            return false;
        }
        for (ElementType type : ElementType.values()) {
            if (!Arrays.equals(toSubId.get(type), other.toSubId.get(type))
                    || !Arrays.equals(posTopoVect.get(type), other.posTopoVect.get(type))) {
                return false;
            }
        }
        return Arrays.equals(loadNames, other.loadNames)
                && Arrays.equals(generatorNames, other.generatorNames)
                && Arrays.equals(lineNames, other.lineNames)
                && Arrays.equals(substationNames, other.substationNames)
                && Arrays.equals(storageNames, other.storageNames)
                && Arrays.equals(shuntNames, other.shuntNames);
    }

    @Override
    public String toString() {
        return "GridSchema(substations=" + substationCount
                + ", loads=" + getLoadCount()
                + ", generators=" + getGeneratorCount()
                + ", lines=" + getLineCount()
                + ", storageUnits=" + getStorageCount()
                + ", shunts=" + getShuntCount()
                + ", dimTopo=" + dimTopo + ")";
    }

    /**
     * Ids of the elements connected to a substation, per kind.
     */
    public record ConnectedObjects(int[] loadIds, int[] generatorIds, int[] lineOrIds, int[] lineExIds, int[] storageIds,
                                   int elementCount) {
    }
}

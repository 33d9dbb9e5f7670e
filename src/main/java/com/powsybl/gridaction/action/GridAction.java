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
import com.powsybl.gridaction.exceptions.IllegalActionException;
import com.powsybl.gridaction.network.ElementType;
import com.powsybl.gridaction.network.GridSchema;

import java.util.*;
import java.util.function.Consumer;
import java.util.stream.IntStream;

/**
 * Pending modifications of a grid for one decision: bus assignments, line status, injections,
 * redispatching, storage and shunt set points.
 * <p>
 * Bus assignments are indexed by position in the topology vector of the {@link GridSchema}. A set
 * bus value is -1 (disconnect), 0 (no change), 1 or 2. A change bus flag toggles the element between
 * bus 1 and bus 2. Line status works the same way with -1 (disconnect), 0 and 1 (reconnect).
 * <p>
 * Every setter is all or nothing: the input is decoded into a working copy which replaces the live
 * vector only when the whole input is valid. Otherwise an {@link IllegalActionException} is thrown
 * and the action is unchanged.
 * <p>
 * Instances are not thread safe.
 *
 * @author PowSyBl grid action team
 */
public class GridAction {

    final GridSchema schema;

    final ActionType type;

    private final List<ActionAttribute> attributes;

    int[] setBus;
    boolean[] changeBus;
    int[] setLineStatus;
    boolean[] changeLineStatus;
    final EnumMap<InjectionKey, double[]> injections = new EnumMap<>(InjectionKey.class);
    double[] redispatch;
    double[] storagePower;
    boolean[] hazards;
    boolean[] maintenance;
    double[] shuntP;
    double[] shuntQ;
    int[] shuntBus;

    boolean injectionModified;
    boolean setBusModified;
    boolean changeBusModified;
    boolean setStatusModified;
    boolean changeStatusModified;
    boolean redispatchModified;
    boolean storageModified;

    private TopologicalImpact topologicalImpact;

    public GridAction(GridSchema schema, ActionType type) {
        this.schema = Objects.requireNonNull(schema);
        this.type = Objects.requireNonNull(type);
        this.attributes = type.getAttributes(schema);
        reset();
    }

    public GridSchema getSchema() {
        return schema;
    }

    public ActionType getType() {
        return type;
    }

    /**
     * Attributes this action supports on its grid, in flat vector order.
     */
    public List<ActionAttribute> getAttributes() {
        return attributes;
    }

    public boolean supports(ActionAttribute attribute) {
        return attributes.contains(attribute);
    }

    /**
     * Back to the do nothing action.
     */
    public void reset() {
        setBus = new int[schema.getDimTopo()];
        changeBus = new boolean[schema.getDimTopo()];
        setLineStatus = new int[schema.getLineCount()];
        changeLineStatus = new boolean[schema.getLineCount()];
        injections.clear();
        redispatch = new double[schema.getGeneratorCount()];
        storagePower = new double[schema.getStorageCount()];
        hazards = new boolean[schema.getLineCount()];
        maintenance = new boolean[schema.getLineCount()];
        if (schema.getCapabilities().shunts()) {
            shuntP = nanVector(schema.getShuntCount());
            shuntQ = nanVector(schema.getShuntCount());
            shuntBus = new int[schema.getShuntCount()];
        } else {
            shuntP = null;
            shuntQ = null;
            shuntBus = null;
        }
        injectionModified = false;
        setBusModified = false;
        changeBusModified = false;
        setStatusModified = false;
        changeStatusModified = false;
        redispatchModified = false;
        storageModified = false;
        invalidate();
    }

    public GridAction copy() {
        GridAction copy = new GridAction(schema, type);
        copy.copyStateFrom(this);
        return copy;
    }

    private void copyStateFrom(GridAction other) {
        setBus = other.setBus.clone();
        changeBus = other.changeBus.clone();
        setLineStatus = other.setLineStatus.clone();
        changeLineStatus = other.changeLineStatus.clone();
        injections.clear();
        other.injections.forEach((key, values) -> injections.put(key, values.clone()));
        redispatch = other.redispatch.clone();
        storagePower = other.storagePower.clone();
        hazards = other.hazards.clone();
        maintenance = other.maintenance.clone();
        shuntP = other.shuntP != null ? other.shuntP.clone() : null;
        shuntQ = other.shuntQ != null ? other.shuntQ.clone() : null;
        shuntBus = other.shuntBus != null ? other.shuntBus.clone() : null;
        injectionModified = other.injectionModified;
        setBusModified = other.setBusModified;
        changeBusModified = other.changeBusModified;
        setStatusModified = other.setStatusModified;
        changeStatusModified = other.changeStatusModified;
        redispatchModified = other.redispatchModified;
        storageModified = other.storageModified;
        invalidate();
    }

    static double[] nanVector(int size) {
        double[] vector = new double[size];
        Arrays.fill(vector, Double.NaN);
        return vector;
    }

    void invalidate() {
        topologicalImpact = null;
    }

    private void checkSupported(ActionAttribute attribute, String what) {
        if (!supports(attribute)) {
            throw new IllegalActionException("Impossible to " + what + " with an action of type " + type);
        }
    }

    private static <T> T decode(T working, Consumer<T> decoding, String what) {
        try {
            decoding.accept(working);
        } catch (GridActionException e) {
            throw new IllegalActionException("Impossible to " + what + ": " + e.getMessage(), e);
        }
        return working;
    }

    private ElementInputDecoder topologyDecoder(ElementType elementType) {
        return new ElementInputDecoder(elementType.getLabel(), schema.getElementCount(elementType),
            name -> schema.indexOfName(elementType, name),
            id -> schema.getTopologyIndex(elementType, id));
    }

    private ElementInputDecoder elementDecoder(ElementType elementType) {
        return new ElementInputDecoder(elementType.getLabel(), schema.getElementCount(elementType),
            name -> schema.indexOfName(elementType, name), id -> id);
    }

    private ElementInputDecoder lineDecoder() {
        return new ElementInputDecoder("line", schema.getLineCount(),
            name -> schema.indexOfName(ElementType.LINE_OR, name), id -> id);
    }

    private ElementInputDecoder shuntDecoder() {
        return new ElementInputDecoder("shunt", schema.getShuntCount(), schema::indexOfShunt, id -> id);
    }

    // set bus

    private GridAction setElementBus(ElementType elementType, ElementInput input) {
        String what = "set the bus of a " + elementType.getLabel();
        checkSupported(ActionAttribute.SET_BUS, what);
        setBus = decode(setBus.clone(), v -> topologyDecoder(elementType).applyInt(input, v, ValueDomain.BUS), what);
        setBusModified = true;
        invalidate();
        return this;
    }

    public GridAction setLoadSetBus(ElementInput input) {
        return setElementBus(ElementType.LOAD, input);
    }

    public GridAction setGenSetBus(ElementInput input) {
        return setElementBus(ElementType.GENERATOR, input);
    }

    public GridAction setStorageSetBus(ElementInput input) {
        return setElementBus(ElementType.STORAGE, input);
    }

    public GridAction setLineOrSetBus(ElementInput input) {
        return setElementBus(ElementType.LINE_OR, input);
    }

    public GridAction setLineExSetBus(ElementInput input) {
        return setElementBus(ElementType.LINE_EX, input);
    }

    /**
     * Assigns buses by topology vector position.
     */
    public GridAction setSetBus(ElementInput input) {
        String what = "set the bus of a topology position";
        checkSupported(ActionAttribute.SET_BUS, what);
        ElementInputDecoder decoder = new ElementInputDecoder("topology position", schema.getDimTopo(), null, pos -> pos);
        setBus = decode(setBus.clone(), v -> decoder.applyInt(input, v, ValueDomain.BUS), what);
        setBusModified = true;
        invalidate();
        return this;
    }

    /**
     * Assigns the buses of whole substations, given as (substation, topology) pairs or as a full
     * topology vector.
     */
    public GridAction setSubSetBus(ElementInput input) {
        String what = "set the buses of a substation";
        checkSupported(ActionAttribute.SET_BUS, what);
        setBus = decode(setBus.clone(), v -> new SubstationInputDecoder(schema).applyInt(input, v), what);
        setBusModified = true;
        invalidate();
        return this;
    }

    // change bus

    private GridAction changeElementBus(ElementType elementType, ElementInput input) {
        String what = "change the bus of a " + elementType.getLabel();
        checkSupported(ActionAttribute.CHANGE_BUS, what);
        changeBus = decode(changeBus.clone(), v -> topologyDecoder(elementType).applyToggle(input, v), what);
        changeBusModified = true;
        invalidate();
        return this;
    }

    public GridAction setLoadChangeBus(ElementInput input) {
        return changeElementBus(ElementType.LOAD, input);
    }

    public GridAction setGenChangeBus(ElementInput input) {
        return changeElementBus(ElementType.GENERATOR, input);
    }

    public GridAction setStorageChangeBus(ElementInput input) {
        return changeElementBus(ElementType.STORAGE, input);
    }

    public GridAction setLineOrChangeBus(ElementInput input) {
        return changeElementBus(ElementType.LINE_OR, input);
    }

    public GridAction setLineExChangeBus(ElementInput input) {
        return changeElementBus(ElementType.LINE_EX, input);
    }

    public GridAction setChangeBus(ElementInput input) {
        String what = "change the bus of a topology position";
        checkSupported(ActionAttribute.CHANGE_BUS, what);
        ElementInputDecoder decoder = new ElementInputDecoder("topology position", schema.getDimTopo(), null, pos -> pos);
        changeBus = decode(changeBus.clone(), v -> decoder.applyToggle(input, v), what);
        changeBusModified = true;
        invalidate();
        return this;
    }

    public GridAction setSubChangeBus(ElementInput input) {
        String what = "change the buses of a substation";
        checkSupported(ActionAttribute.CHANGE_BUS, what);
        changeBus = decode(changeBus.clone(), v -> new SubstationInputDecoder(schema).applyToggle(input, v), what);
        changeBusModified = true;
        invalidate();
        return this;
    }

    // line status

    public GridAction setLineSetStatus(ElementInput input) {
        String what = "set the status of a line";
        checkSupported(ActionAttribute.SET_LINE_STATUS, what);
        setLineStatus = decode(setLineStatus.clone(), v -> lineDecoder().applyInt(input, v, ValueDomain.LINE_STATUS), what);
        setStatusModified = true;
        invalidate();
        return this;
    }

    public GridAction setLineChangeStatus(ElementInput input) {
        String what = "change the status of a line";
        checkSupported(ActionAttribute.CHANGE_LINE_STATUS, what);
        changeLineStatus = decode(changeLineStatus.clone(), v -> lineDecoder().applyToggle(input, v), what);
        changeStatusModified = true;
        invalidate();
        return this;
    }

    // redispatching and storage

    public GridAction setRedispatch(ElementInput input) {
        String what = "redispatch a generator";
        checkSupported(ActionAttribute.REDISPATCH, what);
        redispatch = decode(redispatch.clone(), v -> elementDecoder(ElementType.GENERATOR).applyFloat(input, v), what);
        redispatchModified = true;
        invalidate();
        return this;
    }

    public GridAction setStorageP(ElementInput input) {
        String what = "set the power of a storage unit";
        if (schema.getStorageCount() == 0) {
            throw new IllegalActionException("Impossible to " + what + ": there is no storage unit on this grid");
        }
        checkSupported(ActionAttribute.STORAGE_POWER, what);
        storagePower = decode(storagePower.clone(), v -> elementDecoder(ElementType.STORAGE).applyFloat(input, v), what);
        storageModified = true;
        invalidate();
        return this;
    }

    // injections

    private GridAction setInjection(InjectionKey key, ElementInput input) {
        String what = "set " + key.getName();
        checkSupported(key.getAttribute(), what);
        double[] current = injections.get(key);
        double[] working = current != null ? current.clone() : nanVector(schema.getElementCount(key.getElementType()));
        injections.put(key, decode(working, v -> elementDecoder(key.getElementType()).applyFloat(input, v), what));
        injectionModified = true;
        invalidate();
        return this;
    }

    public GridAction setLoadP(ElementInput input) {
        return setInjection(InjectionKey.LOAD_P, input);
    }

    public GridAction setLoadQ(ElementInput input) {
        return setInjection(InjectionKey.LOAD_Q, input);
    }

    public GridAction setProdP(ElementInput input) {
        return setInjection(InjectionKey.PROD_P, input);
    }

    public GridAction setProdV(ElementInput input) {
        return setInjection(InjectionKey.PROD_V, input);
    }

    /**
     * Stores an injection vector as given, its length is only verified by the ambiguity checker.
     */
    void putInjection(InjectionKey key, double[] values) {
        injections.put(key, values.clone());
        injectionModified = true;
        invalidate();
    }

    // shunts

    private void checkShunts(ActionAttribute attribute, String what) {
        if (!schema.getCapabilities().shunts()) {
            throw new IllegalActionException("Impossible to " + what + ": shunts are not supported on this grid");
        }
        checkSupported(attribute, what);
    }

    public GridAction setShuntP(ElementInput input) {
        String what = "set the active power of a shunt";
        checkShunts(ActionAttribute.SHUNT_P, what);
        shuntP = decode(shuntP.clone(), v -> shuntDecoder().applyFloat(input, v), what);
        invalidate();
        return this;
    }

    public GridAction setShuntQ(ElementInput input) {
        String what = "set the reactive power of a shunt";
        checkShunts(ActionAttribute.SHUNT_Q, what);
        shuntQ = decode(shuntQ.clone(), v -> shuntDecoder().applyFloat(input, v), what);
        invalidate();
        return this;
    }

    public GridAction setShuntBus(ElementInput input) {
        String what = "set the bus of a shunt";
        checkShunts(ActionAttribute.SHUNT_BUS, what);
        shuntBus = decode(shuntBus.clone(), v -> shuntDecoder().applyInt(input, v, ValueDomain.BUS), what);
        invalidate();
        return this;
    }

    /**
     * Disconnects a line because of a hazard or a maintenance, dropping any bus edit on its ends.
     */
    void applyOutage(int line, boolean hazard) {
        setLineStatus[line] = -1;
        if (hazard) {
            hazards[line] = true;
        } else {
            maintenance[line] = true;
        }
        int or = schema.getTopologyIndex(ElementType.LINE_OR, line);
        int ex = schema.getTopologyIndex(ElementType.LINE_EX, line);
        setBus[or] = 0;
        setBus[ex] = 0;
        changeBus[or] = false;
        changeBus[ex] = false;
        changeLineStatus[line] = false;
        setStatusModified = true;
        invalidate();
    }

    /**
     * Changes the status of lines, leaving alone the lines disconnected by a hazard or a maintenance.
     */
    void setLineChangeStatusOutsideOutages(ElementInput input) {
        setLineChangeStatus(input);
        boolean cleared = false;
        for (int line = 0; line < changeLineStatus.length; line++) {
            if ((hazards[line] || maintenance[line]) && changeLineStatus[line]) {
                changeLineStatus[line] = false;
                cleared = true;
            }
        }
        if (cleared) {
            changeStatusModified = anyTrue(changeLineStatus);
            invalidate();
        }
    }

    // getters, all returning copies

    private int[] gatherInt(int[] vector, ElementType elementType) {
        return Arrays.stream(schema.getPosTopoVect(elementType)).map(pos -> vector[pos]).toArray();
    }

    private boolean[] gatherBoolean(boolean[] vector, ElementType elementType) {
        int[] positions = schema.getPosTopoVect(elementType);
        boolean[] result = new boolean[positions.length];
        for (int i = 0; i < positions.length; i++) {
            result[i] = vector[positions[i]];
        }
        return result;
    }

    public int[] getLoadSetBus() {
        return gatherInt(setBus, ElementType.LOAD);
    }

    public int[] getGenSetBus() {
        return gatherInt(setBus, ElementType.GENERATOR);
    }

    public int[] getStorageSetBus() {
        return gatherInt(setBus, ElementType.STORAGE);
    }

    public int[] getLineOrSetBus() {
        return gatherInt(setBus, ElementType.LINE_OR);
    }

    public int[] getLineExSetBus() {
        return gatherInt(setBus, ElementType.LINE_EX);
    }

    public int[] getSetBus() {
        return setBus.clone();
    }

    /**
     * Set bus values sliced per substation.
     */
    public int[][] getSubSetBus() {
        int[][] result = new int[schema.getSubstationCount()][];
        for (int sub = 0; sub < result.length; sub++) {
            int start = schema.getSubstationStart(sub);
            result[sub] = Arrays.copyOfRange(setBus, start, start + schema.getSubInfo(sub));
        }
        return result;
    }

    public boolean[] getLoadChangeBus() {
        return gatherBoolean(changeBus, ElementType.LOAD);
    }

    public boolean[] getGenChangeBus() {
        return gatherBoolean(changeBus, ElementType.GENERATOR);
    }

    public boolean[] getStorageChangeBus() {
        return gatherBoolean(changeBus, ElementType.STORAGE);
    }

    public boolean[] getLineOrChangeBus() {
        return gatherBoolean(changeBus, ElementType.LINE_OR);
    }

    public boolean[] getLineExChangeBus() {
        return gatherBoolean(changeBus, ElementType.LINE_EX);
    }

    public boolean[] getChangeBus() {
        return changeBus.clone();
    }

    public boolean[][] getSubChangeBus() {
        boolean[][] result = new boolean[schema.getSubstationCount()][];
        for (int sub = 0; sub < result.length; sub++) {
            int start = schema.getSubstationStart(sub);
            result[sub] = Arrays.copyOfRange(changeBus, start, start + schema.getSubInfo(sub));
        }
        return result;
    }

    public int[] getLineSetStatus() {
        return setLineStatus.clone();
    }

    public boolean[] getLineChangeStatus() {
        return changeLineStatus.clone();
    }

    public double[] getRedispatch() {
        return redispatch.clone();
    }

    public double[] getStorageP() {
        return storagePower.clone();
    }

    public boolean[] getHazards() {
        return hazards.clone();
    }

    public boolean[] getMaintenance() {
        return maintenance.clone();
    }

    public Optional<double[]> getInjection(InjectionKey key) {
        return Optional.ofNullable(injections.get(Objects.requireNonNull(key))).map(double[]::clone);
    }

    /**
     * Override of an injection, NaN where nothing is overridden.
     */
    private double[] injectionOrNan(InjectionKey key) {
        return getInjection(key).orElseGet(() -> nanVector(schema.getElementCount(key.getElementType())));
    }

    public double[] getLoadP() {
        return injectionOrNan(InjectionKey.LOAD_P);
    }

    public double[] getLoadQ() {
        return injectionOrNan(InjectionKey.LOAD_Q);
    }

    public double[] getProdP() {
        return injectionOrNan(InjectionKey.PROD_P);
    }

    public double[] getProdV() {
        return injectionOrNan(InjectionKey.PROD_V);
    }

    private void checkShuntsAvailable() {
        if (shuntP == null) {
            throw new IllegalActionException("Shunts are not supported on this grid");
        }
    }

    public double[] getShuntP() {
        checkShuntsAvailable();
        return shuntP.clone();
    }

    public double[] getShuntQ() {
        checkShuntsAvailable();
        return shuntQ.clone();
    }

    public int[] getShuntBus() {
        checkShuntsAvailable();
        return shuntBus.clone();
    }

    public boolean isInjectionModified() {
        return injectionModified;
    }

    public boolean isSetBusModified() {
        return setBusModified;
    }

    public boolean isChangeBusModified() {
        return changeBusModified;
    }

    public boolean isSetStatusModified() {
        return setStatusModified;
    }

    public boolean isChangeStatusModified() {
        return changeStatusModified;
    }

    public boolean isRedispatchModified() {
        return redispatchModified;
    }

    public boolean isStorageModified() {
        return storageModified;
    }

    /**
     * Recomputes the modified flags from the content of the vectors.
     */
    void deriveModifiedFlags() {
        injectionModified = !injections.isEmpty();
        setBusModified = Arrays.stream(setBus).anyMatch(v -> v != 0);
        changeBusModified = anyTrue(changeBus);
        setStatusModified = Arrays.stream(setLineStatus).anyMatch(v -> v != 0);
        changeStatusModified = anyTrue(changeLineStatus);
        redispatchModified = Arrays.stream(redispatch).anyMatch(v -> Double.isFinite(v) && v != 0);
        storageModified = Arrays.stream(storagePower).anyMatch(v -> Double.isFinite(v) && v != 0);
        invalidate();
    }

    static boolean anyTrue(boolean[] vector) {
        for (boolean value : vector) {
            if (value) {
                return true;
            }
        }
        return false;
    }

    public boolean canAffectSomething() {
        return injectionModified || setBusModified || changeBusModified || setStatusModified || changeStatusModified
                || redispatchModified || storageModified
                || shuntP != null && (Arrays.stream(shuntP).anyMatch(Double::isFinite)
                    || Arrays.stream(shuntQ).anyMatch(Double::isFinite)
                    || Arrays.stream(shuntBus).anyMatch(v -> v != 0));
    }

    // validation, composition and impact

    /**
     * @throws com.powsybl.gridaction.exceptions.AmbiguousActionException if the action is ambiguous
     */
    public void check() {
        AmbiguityChecker.check(this);
    }

    public boolean isAmbiguous() {
        return AmbiguityChecker.isAmbiguous(this);
    }

    /**
     * Composes the other action into this one, see {@link ActionComposer}.
     */
    public GridAction add(GridAction other) {
        return add(other, ReportNode.NO_OP);
    }

    public GridAction add(GridAction other, ReportNode reportNode) {
        ActionComposer.compose(this, other, reportNode);
        return this;
    }

    public GridAction update(Map<String, ?> dict) {
        return update(dict, ReportNode.NO_OP);
    }

    public GridAction update(Map<String, ?> dict, ReportNode reportNode) {
        ActionDictionaryUpdater.update(this, dict, reportNode);
        return this;
    }

    /**
     * Impact regardless of the current line status, cached until the next modification.
     */
    public TopologicalImpact getTopologicalImpact() {
        if (topologicalImpact == null) {
            topologicalImpact = ImpactAnalyzer.analyze(this, null);
        }
        return topologicalImpact;
    }

    public TopologicalImpact getTopologicalImpact(boolean[] knownLineStatus) {
        if (knownLineStatus == null) {
            return getTopologicalImpact();
        }
        return ImpactAnalyzer.analyze(this, knownLineStatus);
    }

    public ActionCategories getCategories() {
        boolean injection = injections.containsKey(InjectionKey.LOAD_P) || injections.containsKey(InjectionKey.PROD_P);
        boolean voltage = injections.containsKey(InjectionKey.PROD_V)
                || shuntP != null && (Arrays.stream(shuntP).anyMatch(Double::isFinite)
                    || Arrays.stream(shuntQ).anyMatch(Double::isFinite)
                    || Arrays.stream(shuntBus).anyMatch(v -> v != 0));
        TopologicalImpact impact = getTopologicalImpact();
        boolean topology = anyTrue(impact.subsImpacted());
        boolean line = anyTrue(impact.linesImpacted());
        boolean redispatching = Arrays.stream(redispatch).anyMatch(v -> v != 0);
        return new ActionCategories(injection, voltage, topology, line, redispatching, storageModified);
    }

    public ElementModification.LoadModification getLoadModification() {
        return new ElementModification.LoadModification(getLoadP(), getLoadQ(), getLoadSetBus(), getLoadChangeBus());
    }

    public ElementModification.GeneratorModification getGeneratorModification() {
        return new ElementModification.GeneratorModification(getProdP(), getProdV(), getGenSetBus(), getGenChangeBus());
    }

    public ElementModification.StorageModification getStorageModification() {
        return new ElementModification.StorageModification(getStorageP(), getStorageSetBus(), getStorageChangeBus());
    }

    /**
     * Pending modifications touching exactly one element.
     */
    public ElementEffect effectOn(EffectQuery query) {
        Objects.requireNonNull(query);
        if (query.getSelectorCount() != 1) {
            throw new GridActionException("Exactly one of load, generator, line, storage or substation must be queried, got "
                    + query.getSelectorCount());
        }
        if (query.getLoadId() != null) {
            int id = query.getLoadId();
            int pos = schema.resolve(ElementType.LOAD, id).topologyIndex();
            return new ElementEffect.LoadEffect(injectionValue(InjectionKey.LOAD_P, id), injectionValue(InjectionKey.LOAD_Q, id),
                    setBus[pos], changeBus[pos]);
        }
        if (query.getGeneratorId() != null) {
            int id = query.getGeneratorId();
            int pos = schema.resolve(ElementType.GENERATOR, id).topologyIndex();
            return new ElementEffect.GeneratorEffect(injectionValue(InjectionKey.PROD_P, id), injectionValue(InjectionKey.PROD_V, id),
                    setBus[pos], changeBus[pos], redispatch[id]);
        }
        if (query.getLineId() != null) {
            int id = query.getLineId();
            int or = schema.resolve(ElementType.LINE_OR, id).topologyIndex();
            int ex = schema.resolve(ElementType.LINE_EX, id).topologyIndex();
            return new ElementEffect.LineEffect(setBus[or], changeBus[or], setBus[ex], changeBus[ex],
                    setLineStatus[id], changeLineStatus[id]);
        }
        if (query.getStorageId() != null) {
            int id = query.getStorageId();
            int pos = schema.resolve(ElementType.STORAGE, id).topologyIndex();
            return new ElementEffect.StorageEffect(storagePower[id], setBus[pos], changeBus[pos]);
        }
        int sub = query.getSubstationId();
        schema.checkSubstationId(sub);
        int start = schema.getSubstationStart(sub);
        int end = start + schema.getSubInfo(sub);
        return new ElementEffect.SubstationEffect(sub, Arrays.copyOfRange(setBus, start, end), Arrays.copyOfRange(changeBus, start, end));
    }

    private double injectionValue(InjectionKey key, int id) {
        double[] values = injections.get(key);
        return values != null ? values[id] : Double.NaN;
    }

    public ObjectsImpact impactOnObjects() {
        List<ObjectsImpact.InjectionChange> injectionChanges = new ArrayList<>();
        injections.forEach((key, values) -> injectionChanges.add(new ObjectsImpact.InjectionChange(key, values.clone())));

        List<ObjectsImpact.BusEdit> busSwitches = new ArrayList<>();
        List<ObjectsImpact.BusEdit> assignedBuses = new ArrayList<>();
        List<ObjectsImpact.BusEdit> disconnected = new ArrayList<>();
        for (int pos = 0; pos < schema.getDimTopo(); pos++) {
            ElementType elementType = schema.getElementTypeAt(pos);
            int elementId = schema.getElementIdAt(pos);
            int sub = schema.getSubstationOfTopologyIndex(pos);
            if (changeBus[pos]) {
                busSwitches.add(new ObjectsImpact.BusEdit(elementType, elementId, sub, 0));
            }
            if (setBus[pos] > 0) {
                assignedBuses.add(new ObjectsImpact.BusEdit(elementType, elementId, sub, setBus[pos]));
            } else if (setBus[pos] < 0) {
                disconnected.add(new ObjectsImpact.BusEdit(elementType, elementId, sub, -1));
            }
        }

        List<ObjectsImpact.RedispatchEntry> redispatches = new ArrayList<>();
        for (int gen = 0; gen < redispatch.length; gen++) {
            if (redispatch[gen] != 0) {
                redispatches.add(new ObjectsImpact.RedispatchEntry(gen, schema.getName(ElementType.GENERATOR, gen), redispatch[gen]));
            }
        }
        List<ObjectsImpact.StorageEntry> storages = new ArrayList<>();
        for (int storage = 0; storage < storagePower.length; storage++) {
            if (Double.isFinite(storagePower[storage]) && storagePower[storage] != 0) {
                storages.add(new ObjectsImpact.StorageEntry(storage, schema.getName(ElementType.STORAGE, storage), storagePower[storage]));
            }
        }
        return new ObjectsImpact(injectionChanges,
                IntStream.range(0, setLineStatus.length).filter(line -> setLineStatus[line] == 1).toArray(),
                IntStream.range(0, setLineStatus.length).filter(line -> setLineStatus[line] == -1).toArray(),
                IntStream.range(0, changeLineStatus.length).filter(line -> changeLineStatus[line]).toArray(),
                busSwitches, assignedBuses, disconnected, redispatches, storages);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GridAction other) || !schema.sameGrid(other.schema)) {
            return false;
        }
        for (InjectionKey key : InjectionKey.values()) {
            if (!sameValues(injections.get(key), other.injections.get(key))) {
                return false;
            }
        }
        return Arrays.equals(setBus, other.setBus)
                && Arrays.equals(changeBus, other.changeBus)
                && Arrays.equals(setLineStatus, other.setLineStatus)
                && Arrays.equals(changeLineStatus, other.changeLineStatus)
                && Arrays.equals(hazards, other.hazards)
                && Arrays.equals(maintenance, other.maintenance)
                && sameValues(redispatch, other.redispatch)
                && sameValues(storagePower, other.storagePower)
                && sameValues(shuntP, other.shuntP)
                && sameValues(shuntQ, other.shuntQ)
                && Arrays.equals(shuntBus, other.shuntBus);
    }

    /**
     * NaN equals NaN, an absent vector equals a vector of NaN.
     */
    private static boolean sameValues(double[] values, double[] otherValues) {
        if (values == null || otherValues == null) {
            double[] present = values != null ? values : otherValues;
            return present == null || Arrays.stream(present).allMatch(Double::isNaN);
        }
        if (values.length != otherValues.length) {
            return false;
        }
        for (int i = 0; i < values.length; i++) {
            boolean bothNan = Double.isNaN(values[i]) && Double.isNaN(otherValues[i]);
            if (!bothNan && values[i] != otherValues[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(setBus), Arrays.hashCode(changeBus), Arrays.hashCode(setLineStatus),
                Arrays.hashCode(changeLineStatus));
    }

    @Override
    public String toString() {
        return ActionDescriptions.describe(this);
    }
}

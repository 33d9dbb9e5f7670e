/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.exceptions.*;
import com.powsybl.gridaction.network.GridSchema;
import com.powsybl.gridaction.network.ThreeSubstationGridFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl grid action team
 */
class AmbiguityCheckerTest {

    private GridSchema schema;

    private ActionVectorCodec codec;

    @BeforeEach
    void setUp() {
        schema = ThreeSubstationGridFactory.create();
        codec = new ActionVectorCodec(schema, ActionType.COMPLETE);
    }

    private GridAction newAction() {
        return new GridAction(schema, ActionType.PLAYABLE);
    }

    private GridAction raw(ActionAttribute attribute, double... values) {
        Map<ActionAttribute, double[]> attributes = new EnumMap<>(ActionAttribute.class);
        attributes.put(attribute, values);
        return codec.fromAttributes(attributes, false);
    }

    @Test
    void testLegalActions() {
        assertFalse(newAction().isAmbiguous());
        GridAction action = newAction()
                .setLineSetStatus(ElementInput.pair(0, -1))
                .setLineChangeStatus(ElementInput.of(1))
                .setLoadSetBus(ElementInput.pair(0, 2))
                .setGenChangeBus(ElementInput.of(1))
                .setRedispatch(ElementInput.pair("G1", -15.0))
                .setStorageP(ElementInput.pair(0, -5.0));
        action.check();
        assertTrue(AmbiguityChecker.findAmbiguity(action).isEmpty());
    }

    @Test
    void testLineSetAndChanged() {
        GridAction action = newAction()
                .setLineSetStatus(ElementInput.pair(0, 1))
                .setLineChangeStatus(ElementInput.of(0));
        InvalidLineStatusException e = assertThrows(InvalidLineStatusException.class, action::check);
        assertEquals("Line 0 has its status both set and changed", e.getMessage());
        assertTrue(action.isAmbiguous());
    }

    @Test
    void testInjectionLength() {
        GridAction action = raw(ActionAttribute.LOAD_P, 1, 2, 3);
        InvalidNumberOfElementsException e = assertThrows(InvalidNumberOfElementsException.class, action::check);
        assertTrue(e.getMessage().contains("load_p"));

        // the line status conflict is reported first
        action.setLineSetStatus(ElementInput.pair(2, -1));
        action.setLineChangeStatus(ElementInput.of(2));
        assertThrows(InvalidLineStatusException.class, action::check);
    }

    @Test
    void testVectorLengths() {
        assertThrows(InvalidNumberOfElementsException.class, raw(ActionAttribute.SET_BUS, new double[10])::check);
        assertThrows(InvalidNumberOfElementsException.class, raw(ActionAttribute.CHANGE_BUS, new double[12])::check);
        assertThrows(InvalidNumberOfElementsException.class, raw(ActionAttribute.SET_LINE_STATUS, 1, 1)::check);
        assertThrows(InvalidNumberOfElementsException.class, raw(ActionAttribute.CHANGE_LINE_STATUS, 1, 0, 0, 0)::check);
        assertThrows(InvalidNumberOfElementsException.class, raw(ActionAttribute.REDISPATCH, 1)::check);
    }

    @Test
    void testRedispatching() {
        GridAction notRedispatchable = newAction().setRedispatch(ElementInput.pair("G2", 1.0));
        assertThrows(InvalidRedispatchingException.class, notRedispatchable::check);

        GridAction aboveRampUp = newAction().setRedispatch(ElementInput.pair(0, 20.5));
        assertThrows(InvalidRedispatchingException.class, aboveRampUp::check);

        GridAction belowRampDown = newAction().setRedispatch(ElementInput.pair(0, -16.0));
        assertThrows(InvalidRedispatchingException.class, belowRampDown::check);

        GridAction complete = new GridAction(schema, ActionType.COMPLETE)
                .setProdP(ElementInput.pair(0, 90.0))
                .setRedispatch(ElementInput.pair(0, 15.0));
        InvalidRedispatchingException e = assertThrows(InvalidRedispatchingException.class, complete::check);
        assertTrue(e.getMessage().contains("pmax"));

        complete.setProdP(ElementInput.pair(0, 80.0));
        complete.check();
        complete.setProdP(ElementInput.pair(0, 11.0)).setRedispatch(ElementInput.pair(0, -16.0));
        assertThrows(InvalidRedispatchingException.class, complete::check);

        GridAction bare = new GridAction(ThreeSubstationGridFactory.createWithoutStaticData(), ActionType.PLAYABLE)
                .setRedispatch(ElementInput.pair(0, 1.0));
        assertThrows(RedispatchingNotAvailableException.class, bare::check);
    }

    @Test
    void testStorage() {
        assertThrows(InvalidStorageException.class, newAction().setStorageP(ElementInput.pair(0, -5.5))::check);
        assertThrows(InvalidStorageException.class, newAction().setStorageP(ElementInput.pair(0, 4.5))::check);
        newAction().setStorageP(ElementInput.pair(0, 4.0)).check();

        GridAction bare = new GridAction(ThreeSubstationGridFactory.createWithoutStaticData(), ActionType.PLAYABLE)
                .setStorageP(ElementInput.pair(0, 1.0));
        assertThrows(InvalidStorageException.class, bare::check);

        GridAction topology = new GridAction(schema, ActionType.TOPOLOGY).setStorageSetBus(ElementInput.pair(0, 1));
        assertThrows(InvalidStorageException.class, topology::check);
        new GridAction(schema, ActionType.TOPOLOGY).setStorageSetBus(ElementInput.pair(0, -1)).check();
    }

    @Test
    void testBusRange() {
        double[] setBus = new double[ThreeSubstationGridFactory.DIM_TOPO];
        setBus[1] = 3;
        setBus[2] = -2;
        InvalidBusStatusException e = assertThrows(InvalidBusStatusException.class, raw(ActionAttribute.SET_BUS, setBus)::check);
        assertTrue(e.getMessage().contains("below -1"));

        setBus[2] = 0;
        e = assertThrows(InvalidBusStatusException.class, raw(ActionAttribute.SET_BUS, setBus)::check);
        assertTrue(e.getMessage().contains("above 2"));
    }

    @Test
    void testBusSetAndChanged() {
        GridAction action = newAction()
                .setLoadSetBus(ElementInput.pair(0, 1))
                .setLoadChangeBus(ElementInput.of(0));
        InvalidBusStatusException e = assertThrows(InvalidBusStatusException.class, action::check);
        assertEquals("Topology position 3 has its bus both set and changed", e.getMessage());
    }

    @Test
    void testLineEnds() {
        GridAction originDisconnected = newAction()
                .setLineOrSetBus(ElementInput.pair(0, -1))
                .setLineExSetBus(ElementInput.pair(0, 1));
        InvalidLineStatusException e = assertThrows(InvalidLineStatusException.class, originDisconnected::check);
        assertTrue(e.getMessage().contains("disconnected at its origin"));

        GridAction extremityDisconnected = newAction()
                .setLineOrSetBus(ElementInput.pair(1, 2))
                .setLineExSetBus(ElementInput.pair(1, -1));
        e = assertThrows(InvalidLineStatusException.class, extremityDisconnected::check);
        assertTrue(e.getMessage().contains("disconnected at its extremity"));

        newAction().setLineOrSetBus(ElementInput.pair(0, -1)).setLineExSetBus(ElementInput.pair(0, -1)).check();
    }

    @Test
    void testLineStatusVersusBuses() {
        GridAction disconnectedWithBus = newAction()
                .setLineSetStatus(ElementInput.pair(2, -1))
                .setLineExSetBus(ElementInput.pair(2, 1));
        assertThrows(InvalidLineStatusException.class, disconnectedWithBus::check);

        GridAction disconnectedWithChange = newAction()
                .setLineSetStatus(ElementInput.pair(2, -1))
                .setLineOrChangeBus(ElementInput.of(2));
        assertThrows(InvalidLineStatusException.class, disconnectedWithChange::check);

        GridAction reconnectedWithChange = newAction()
                .setLineSetStatus(ElementInput.pair(1, 1))
                .setLineExChangeBus(ElementInput.of(1));
        InvalidLineStatusException e = assertThrows(InvalidLineStatusException.class, reconnectedWithChange::check);
        assertTrue(e.getMessage().contains("extremity"));

        // a reconnection may come with the buses of both ends
        newAction()
                .setLineSetStatus(ElementInput.pair(1, 1))
                .setLineOrSetBus(ElementInput.pair(1, 2))
                .setLineExSetBus(ElementInput.pair(1, 1))
                .check();
    }

    @Test
    void testShunts() {
        assertThrows(AmbiguousActionException.class, raw(ActionAttribute.SHUNT_BUS, 3)::check);
        assertThrows(AmbiguousActionException.class, raw(ActionAttribute.SHUNT_BUS, -2)::check);
        assertThrows(InvalidNumberOfElementsException.class, raw(ActionAttribute.SHUNT_P, 1, 2)::check);
        raw(ActionAttribute.SHUNT_BUS, -1).check();
    }

    @Test
    void testCheckOrder() {
        // wrong length of set_bus and a forbidden redispatching: lengths are checked first
        GridAction action = raw(ActionAttribute.SET_BUS, 1, 1);
        action.setRedispatch(ElementInput.pair(1, 5.0));
        assertThrows(InvalidNumberOfElementsException.class, action::check);

        // forbidden redispatching and invalid bus: redispatching is checked first
        GridAction other = newAction()
                .setRedispatch(ElementInput.pair(1, 5.0))
                .setLoadSetBus(ElementInput.pair(0, 1))
                .setLoadChangeBus(ElementInput.of(0));
        assertThrows(InvalidRedispatchingException.class, other::check);
    }

    @Test
    void testNothingIsRepaired() {
        GridAction action = newAction()
                .setLineSetStatus(ElementInput.pair(0, 1))
                .setLineChangeStatus(ElementInput.of(0));
        GridAction copy = action.copy();
        assertTrue(action.isAmbiguous());
        assertEquals(copy, action);
        assertArrayEquals(new int[] {1, 0, 0}, action.getLineSetStatus());
    }
}

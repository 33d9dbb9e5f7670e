/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction;

import com.powsybl.gridaction.action.ActionDictionaryUpdater;
import com.powsybl.gridaction.action.ActionType;
import com.powsybl.gridaction.action.GridAction;
import com.powsybl.gridaction.exceptions.ElementOutOfRangeException;
import com.powsybl.gridaction.exceptions.IllegalActionException;
import com.powsybl.gridaction.exceptions.InvalidLineStatusException;
import com.powsybl.gridaction.exceptions.UnknownElementNameException;
import com.powsybl.gridaction.network.Case14GridFactory;
import com.powsybl.gridaction.network.GridSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl grid action team
 */
class ActionSpaceTest {

    private GridSchema schema;

    private ActionSpace actionSpace;

    @BeforeEach
    void setUp() {
        schema = Case14GridFactory.create();
        actionSpace = new ActionSpace(schema, new ActionSpaceParameters());
    }

    @Test
    void testDefaultParameters() {
        ActionSpace defaultSpace = new ActionSpace(schema);
        assertEquals(ActionType.PLAYABLE, defaultSpace.getActionType());
        assertSame(schema, defaultSpace.getSchema());
    }

    @Test
    void testSize() {
        // redispatch, line status set and change, bus set and change, no storage on this grid
        assertEquals(6 + 2 * 20 + 2 * Case14GridFactory.DIM_TOPO, actionSpace.size());
        assertEquals(actionSpace.size(), actionSpace.getCodec().size());

        ActionSpace dispatch = new ActionSpace(schema, new ActionSpaceParameters().setActionType(ActionType.DISPATCH));
        assertEquals(6, dispatch.size());
    }

    @Test
    void testNewAction() {
        GridAction doNothing = actionSpace.newAction();
        assertEquals(ActionType.PLAYABLE, doNothing.getType());
        assertFalse(doNothing.canAffectSomething());

        GridAction action = actionSpace.newAction(Map.of(ActionDictionaryUpdater.SET_BUS,
                Map.of(ActionDictionaryUpdater.SUBSTATIONS_ID, List.of(Map.entry(1, new int[] {1, 2, 2, 1, 1, 2})))));
        assertArrayEquals(new int[] {1, 2, 2, 1, 1, 2}, action.getSubSetBus()[1]);
        assertArrayEquals(new int[] {1}, action.getTopologicalImpact().getImpactedSubstations());
    }

    @Test
    void testVectors() {
        GridAction action = actionSpace.newAction(Map.of(
                ActionDictionaryUpdater.REDISPATCH, List.of(Map.entry("gen_0_5", -5.0)),
                ActionDictionaryUpdater.CHANGE_LINE_STATUS, List.of(3)));
        double[] vector = actionSpace.toVector(action);
        assertEquals(actionSpace.size(), vector.length);
        assertEquals(-5.0, vector[5], 0.0);
        assertEquals(action, actionSpace.fromVector(vector));
    }

    @Test
    void testCheckLegitOnDecode() {
        double[] vector = new double[actionSpace.size()];
        // line 0 both set and changed
        vector[6] = 1;
        vector[26] = 1;
        assertThrows(InvalidLineStatusException.class, () -> actionSpace.fromVector(vector));

        ActionSpace lenient = new ActionSpace(schema, new ActionSpaceParameters().setCheckLegitOnDecode(false));
        assertTrue(lenient.fromVector(vector).isAmbiguous());
    }

    @Test
    void testDisconnectPowerline() {
        GridAction action = actionSpace.disconnectPowerline(3);
        assertEquals(-1, action.getLineSetStatus()[3]);
        assertArrayEquals(new int[] {3}, action.getTopologicalImpact().getImpactedLines());
        assertEquals(actionSpace.disconnectPowerline("1_3_3"), action);
        assertThrows(ElementOutOfRangeException.class, () -> actionSpace.disconnectPowerline(20));
        assertThrows(UnknownElementNameException.class, () -> actionSpace.disconnectPowerline("unknown"));
    }

    @Test
    void testReconnectPowerline() {
        GridAction action = actionSpace.reconnectPowerline(0, 2, 1);
        assertEquals(1, action.getLineSetStatus()[0]);
        assertEquals(2, action.getLineOrSetBus()[0]);
        assertEquals(1, action.getLineExSetBus()[0]);
        assertFalse(action.isAmbiguous());
        assertEquals(action, actionSpace.reconnectPowerline("0_1_0", 2, 1));
        assertThrows(IllegalActionException.class, () -> actionSpace.reconnectPowerline(0, 3, 1));
    }

    @Test
    void testRestrictedSpace() {
        ActionSpace powerlineSet = new ActionSpace(schema, new ActionSpaceParameters().setActionType(ActionType.POWERLINE_SET));
        assertEquals(-1, powerlineSet.disconnectPowerline(0).getLineSetStatus()[0]);
        assertThrows(IllegalActionException.class, () -> powerlineSet.reconnectPowerline(0, 1, 1));
    }
}

/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridaction.exceptions.AmbiguousActionException;
import com.powsybl.gridaction.exceptions.IllegalActionException;
import com.powsybl.gridaction.exceptions.InvalidNumberOfElementsException;
import com.powsybl.gridaction.network.GridSchema;
import com.powsybl.gridaction.network.ThreeSubstationGridFactory;
import com.powsybl.gridaction.util.Reports;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl grid action team
 */
class ActionDictionaryUpdaterTest {

    private GridSchema schema;

    private ReportNode reportNode;

    @BeforeEach
    void setUp() {
        schema = ThreeSubstationGridFactory.create();
        reportNode = Reports.createRootReportNode("gridAction.update");
    }

    private GridAction playable() {
        return new GridAction(schema, ActionType.PLAYABLE);
    }

    private GridAction complete() {
        return new GridAction(schema, ActionType.COMPLETE);
    }

    @Test
    void testEmptyDictionary() {
        GridAction action = playable().update(null).update(Map.of());
        assertEquals(playable(), action);
        assertFalse(action.canAffectSomething());
    }

    @Test
    void testSetBusByElementType() {
        Map<String, Object> dict = Map.of(ActionDictionaryUpdater.SET_BUS, Map.of(
                ActionDictionaryUpdater.LOADS_ID, List.of(Map.entry(0, 2)),
                ActionDictionaryUpdater.LINES_OR_ID, Map.of("AB", 1),
                ActionDictionaryUpdater.SUBSTATIONS_ID, List.of(Map.entry("C", new int[] {1, 1, 2, 2}))));
        GridAction action = playable().update(dict, reportNode);
        // substation C layout puts load 1 on bus 1
        assertArrayEquals(new int[] {2, 1}, action.getLoadSetBus());
        assertArrayEquals(new int[] {1, 0, 0}, action.getLineOrSetBus());
        assertArrayEquals(new int[] {1, 1, 2, 2}, action.getSubSetBus()[2]);
        assertTrue(reportNode.getChildren().isEmpty());
    }

    @Test
    void testDenseTopology() {
        int[] setBus = new int[ThreeSubstationGridFactory.DIM_TOPO];
        setBus[3] = 2;
        GridAction action = playable().update(Map.of(ActionDictionaryUpdater.SET_BUS, setBus));
        assertArrayEquals(new int[] {2, 0}, action.getLoadSetBus());

        GridAction changed = playable().update(Map.of(ActionDictionaryUpdater.CHANGE_BUS,
                Map.of(ActionDictionaryUpdater.GENERATORS_ID, List.of(1))));
        assertArrayEquals(new boolean[] {false, true}, changed.getGenChangeBus());
    }

    @Test
    void testTopologyDictionaryWithoutElementType() {
        GridAction action = playable();
        Map<String, Object> dict = Map.of(ActionDictionaryUpdater.SET_BUS, Map.of("loads", List.of(Map.entry(0, 2))));
        assertThrows(AmbiguousActionException.class, () -> action.update(dict));
    }

    @Test
    void testLineStatusRedispatchAndStorage() {
        Map<String, Object> dict = Map.of(
                ActionDictionaryUpdater.SET_LINE_STATUS, List.of(Map.entry("BC", -1)),
                ActionDictionaryUpdater.CHANGE_LINE_STATUS, List.of(0, 2),
                ActionDictionaryUpdater.REDISPATCH, List.of(Map.entry("G1", 3.0)),
                ActionDictionaryUpdater.SET_STORAGE, Map.entry(0, 1.5));
        GridAction action = playable().update(dict);
        assertArrayEquals(new int[] {0, -1, 0}, action.getLineSetStatus());
        assertArrayEquals(new boolean[] {true, false, true}, action.getLineChangeStatus());
        assertArrayEquals(new double[] {3.0, 0.0}, action.getRedispatch(), 0.0);
        assertArrayEquals(new double[] {1.5}, action.getStorageP(), 0.0);
        assertFalse(action.isAmbiguous());
    }

    @Test
    void testUnknownKeys() {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("bogus", 1);
        dict.put(ActionDictionaryUpdater.SET_BUS, Map.of(ActionDictionaryUpdater.LOADS_ID, List.of(Map.entry(1, 1)), "foo", 2));
        GridAction action = playable().update(dict, reportNode);
        assertArrayEquals(new int[] {0, 1}, action.getLoadSetBus());

        List<ReportNode> children = reportNode.getChildren();
        assertEquals(2, children.size());
        assertEquals("Unknown key 'bogus' ignored while updating the action", children.get(0).getMessage());
        assertEquals("Unknown key 'set_bus/foo' ignored while updating the action", children.get(1).getMessage());
    }

    @Test
    void testUnsupportedKeys() {
        Map<String, Object> dict = Map.of(
                ActionDictionaryUpdater.INJECTION, Map.of("load_p", List.of(1.0, 2.0)),
                ActionDictionaryUpdater.HAZARDS, List.of(0));
        GridAction action = playable().update(dict, reportNode);
        assertFalse(action.canAffectSomething());

        List<ReportNode> children = reportNode.getChildren();
        assertEquals(2, children.size());
        assertEquals("Key 'injection' ignored: not supported by actions of type PLAYABLE", children.get(0).getMessage());
        assertEquals("Key 'hazards' ignored: not supported by actions of type PLAYABLE", children.get(1).getMessage());
    }

    @Test
    void testInjections() {
        Map<String, Object> injections = new LinkedHashMap<>();
        injections.put("load_p", List.of(1.0, 2.0));
        injections.put("prod_v", new double[] {1.02, Double.NaN});
        injections.put("prod_x", List.of(1.0));
        GridAction action = complete().update(Map.of(ActionDictionaryUpdater.INJECTION, injections), reportNode);
        assertArrayEquals(new double[] {1.0, 2.0}, action.getLoadP(), 0.0);
        assertEquals(1.02, action.getProdV()[0], 0.0);
        assertTrue(action.isInjectionModified());
        assertEquals(1, reportNode.getChildren().size());

        GridAction wrong = complete();
        Map<String, Object> dict = Map.of(ActionDictionaryUpdater.INJECTION, Map.of("load_p", List.of("a")));
        assertThrows(IllegalActionException.class, () -> wrong.update(dict));

        // lengths are verified by the ambiguity checker only
        GridAction tooLong = complete().update(Map.of(ActionDictionaryUpdater.INJECTION, Map.of("load_q", List.of(1, 2, 3))));
        assertThrows(InvalidNumberOfElementsException.class, tooLong::check);
    }

    @Test
    void testHazardsWinOverBusEdits() {
        Map<String, Object> dict = Map.of(
                ActionDictionaryUpdater.SET_BUS, Map.of(ActionDictionaryUpdater.LINES_OR_ID, List.of(Map.entry(1, 2))),
                ActionDictionaryUpdater.CHANGE_BUS, Map.of(ActionDictionaryUpdater.LINES_EX_ID, List.of(1)),
                ActionDictionaryUpdater.SET_LINE_STATUS, List.of(Map.entry(1, 1)),
                ActionDictionaryUpdater.HAZARDS, List.of("BC"));
        GridAction action = complete().update(dict);
        assertArrayEquals(new int[] {0, -1, 0}, action.getLineSetStatus());
        assertArrayEquals(new boolean[] {false, true, false}, action.getHazards());
        assertArrayEquals(new int[3], action.getLineOrSetBus());
        assertArrayEquals(new boolean[3], action.getLineExChangeBus());
        assertFalse(action.isAmbiguous());
    }

    @Test
    void testOutagesWinOverStatusChange() {
        Map<String, Object> dict = Map.of(
                ActionDictionaryUpdater.HAZARDS, List.of(1),
                ActionDictionaryUpdater.CHANGE_LINE_STATUS, List.of(1, 2));
        GridAction action = complete().update(dict);
        assertArrayEquals(new int[] {0, -1, 0}, action.getLineSetStatus());
        assertArrayEquals(new boolean[] {false, false, true}, action.getLineChangeStatus());
        assertTrue(action.isChangeStatusModified());
        assertFalse(action.isAmbiguous());

        // a change pending from an earlier update is dropped by the outage
        GridAction changed = complete().update(Map.of(ActionDictionaryUpdater.CHANGE_LINE_STATUS, List.of(0)));
        changed.update(Map.of(ActionDictionaryUpdater.MAINTENANCE, List.of(0)));
        assertArrayEquals(new boolean[3], changed.getLineChangeStatus());
        assertArrayEquals(new int[] {-1, 0, 0}, changed.getLineSetStatus());
        assertFalse(changed.isAmbiguous());

        GridAction onlyOutaged = complete().update(Map.of(
                ActionDictionaryUpdater.MAINTENANCE, List.of(2),
                ActionDictionaryUpdater.CHANGE_LINE_STATUS, List.of(2)));
        assertArrayEquals(new boolean[3], onlyOutaged.getLineChangeStatus());
        assertFalse(onlyOutaged.isChangeStatusModified());
    }

    @Test
    void testNullElements() {
        GridAction action = complete();
        Map<String, Object> nullId = Map.of(ActionDictionaryUpdater.CHANGE_LINE_STATUS, Arrays.asList(0, null));
        assertThrows(IllegalActionException.class, () -> action.update(nullId));
        Map<String, Object> nullValue = Map.of(ActionDictionaryUpdater.REDISPATCH,
                List.of(new AbstractMap.SimpleEntry<>(0, null)));
        assertThrows(IllegalActionException.class, () -> action.update(nullValue));
        Map<Object, Object> mapping = new HashMap<>();
        mapping.put("G1", null);
        Map<String, Object> nullMapping = Map.of(ActionDictionaryUpdater.REDISPATCH, mapping);
        assertThrows(IllegalActionException.class, () -> action.update(nullMapping));
        assertFalse(action.canAffectSomething());
    }

    @Test
    void testMaintenance() {
        GridAction action = complete().update(Map.of(ActionDictionaryUpdater.MAINTENANCE, new boolean[] {true, false, false}));
        assertArrayEquals(new boolean[] {true, false, false}, action.getMaintenance());
        assertArrayEquals(new int[] {-1, 0, 0}, action.getLineSetStatus());

        GridAction byIds = complete().update(Map.of(ActionDictionaryUpdater.MAINTENANCE, new int[] {2}));
        assertArrayEquals(new boolean[] {false, false, true}, byIds.getMaintenance());

        GridAction wrongMask = complete();
        Map<String, Object> mask = Map.of(ActionDictionaryUpdater.MAINTENANCE, new boolean[] {true});
        assertThrows(InvalidNumberOfElementsException.class, () -> wrongMask.update(mask));

        GridAction unknownLine = complete();
        Map<String, Object> unknown = Map.of(ActionDictionaryUpdater.HAZARDS, List.of("XY"));
        assertThrows(IllegalActionException.class, () -> unknownLine.update(unknown));
        Map<String, Object> outOfRange = Map.of(ActionDictionaryUpdater.HAZARDS, 5);
        assertThrows(IllegalActionException.class, () -> unknownLine.update(outOfRange));
    }

    @Test
    void testShunts() {
        Map<String, Object> shunt = Map.of(
                ActionDictionaryUpdater.SHUNT_P, List.of(Map.entry(0, 2.0)),
                ActionDictionaryUpdater.SET_BUS, List.of(Map.entry("SH1", -1)),
                "shunt_x", 1);
        GridAction action = complete().update(Map.of(ActionDictionaryUpdater.SHUNT, shunt), reportNode);
        assertArrayEquals(new double[] {2.0}, action.getShuntP(), 0.0);
        assertArrayEquals(new int[] {-1}, action.getShuntBus());
        assertEquals(1, reportNode.getChildren().size());
        assertEquals("Unknown key 'shunt/shunt_x' ignored while updating the action", reportNode.getChildren().get(0).getMessage());

        GridAction notADictionary = complete();
        Map<String, Object> dict = Map.of(ActionDictionaryUpdater.SHUNT, List.of(1));
        assertThrows(IllegalActionException.class, () -> notADictionary.update(dict));
    }

    @Test
    void testFailingValueKeepsPreviousKeys() {
        GridAction action = playable();
        Map<String, Object> dict = Map.of(
                ActionDictionaryUpdater.REDISPATCH, List.of(Map.entry(0, 1.0)),
                ActionDictionaryUpdater.SET_LINE_STATUS, List.of(Map.entry(0, 3)));
        assertThrows(IllegalActionException.class, () -> action.update(dict));
        // redispatch is digested before set_line_status
        assertArrayEquals(new double[] {1.0, 0.0}, action.getRedispatch(), 0.0);
        assertArrayEquals(new int[3], action.getLineSetStatus());
    }
}

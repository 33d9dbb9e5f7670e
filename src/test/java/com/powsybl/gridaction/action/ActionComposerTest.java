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
import com.powsybl.gridaction.network.Case14GridFactory;
import com.powsybl.gridaction.network.GridSchema;
import com.powsybl.gridaction.network.ThreeSubstationGridFactory;
import com.powsybl.gridaction.util.Reports;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl grid action team
 */
class ActionComposerTest {

    private GridSchema schema;

    @BeforeEach
    void setUp() {
        schema = ThreeSubstationGridFactory.create();
    }

    private GridAction newAction() {
        return new GridAction(schema, ActionType.PLAYABLE);
    }

    @Test
    void testLineStatusAlgebra() {
        GridAction first = newAction()
                .setLineSetStatus(ElementInput.pair(0, 1))
                .setLineChangeStatus(ElementInput.ids(1, 2));
        GridAction second = newAction()
                .setLineChangeStatus(ElementInput.ids(0, 1))
                .setLineSetStatus(ElementInput.pair(2, -1));
        GridAction result = ActionComposer.combine(first, second);

        // change on a set inverts it, change on a change cancels it, set on a change overwrites it
        assertArrayEquals(new int[] {-1, 0, -1}, result.getLineSetStatus());
        assertArrayEquals(new boolean[] {false, false, false}, result.getLineChangeStatus());
        assertFalse(result.isAmbiguous());

        // inputs are left untouched
        assertArrayEquals(new int[] {1, 0, 0}, first.getLineSetStatus());
        assertArrayEquals(new boolean[] {false, true, true}, first.getLineChangeStatus());
    }

    @Test
    void testBusAlgebra() {
        GridAction first = newAction()
                .setLoadSetBus(ElementInput.pair(0, 1))
                .setGenSetBus(ElementInput.pair(0, -1))
                .setLineOrChangeBus(ElementInput.of(0))
                .setStorageChangeBus(ElementInput.of(0));
        GridAction second = newAction()
                .setLoadChangeBus(ElementInput.of(0))
                .setGenChangeBus(ElementInput.ids(0, 1))
                .setLineOrSetBus(ElementInput.pair(0, 2))
                .setStorageChangeBus(ElementInput.of(0));
        GridAction result = ActionComposer.combine(first, second);

        assertArrayEquals(new int[] {2, 0}, result.getLoadSetBus());
        assertArrayEquals(new boolean[] {false, false}, result.getLoadChangeBus());
        assertArrayEquals(new int[] {-1, 0}, result.getGenSetBus());
        assertArrayEquals(new boolean[] {false, true}, result.getGenChangeBus());
        assertArrayEquals(new int[] {2, 0, 0}, result.getLineOrSetBus());
        assertArrayEquals(new boolean[] {false, false, false}, result.getLineOrChangeBus());
        assertArrayEquals(new boolean[] {false}, result.getStorageChangeBus());
        assertArrayEquals(new int[] {0}, result.getStorageSetBus());
    }

    @Test
    void testSetOverwritesSet() {
        GridAction first = newAction().setLoadSetBus(ElementInput.pair(1, 1));
        GridAction second = newAction().setLoadSetBus(ElementInput.pair(1, 2));
        assertArrayEquals(new int[] {0, 2}, ActionComposer.combine(first, second).getLoadSetBus());
        assertArrayEquals(new int[] {0, 1}, ActionComposer.combine(second, first).getLoadSetBus());
    }

    @Test
    void testRedispatchAndStorageAreSummed() {
        GridAction first = newAction()
                .setRedispatch(ElementInput.pair(0, 5.0))
                .setStorageP(ElementInput.pair(0, 1.5));
        GridAction second = newAction()
                .setRedispatch(ElementInput.pair(0, -2.0))
                .setStorageP(ElementInput.pair(0, 2.0));
        GridAction result = first.copy().add(second);
        assertArrayEquals(new double[] {3.0, 0.0}, result.getRedispatch(), 0.0);
        assertArrayEquals(new double[] {3.5}, result.getStorageP(), 0.0);
        assertTrue(result.isRedispatchModified());
        assertTrue(result.isStorageModified());
    }

    @Test
    void testInjectionsOverwrite() {
        GridAction first = new GridAction(schema, ActionType.COMPLETE).setLoadP(ElementInput.pair(0, 1.0));
        GridAction second = new GridAction(schema, ActionType.COMPLETE)
                .setLoadP(ElementInput.pair(1, 5.0))
                .setProdV(ElementInput.pair(0, 1.01));
        GridAction result = ActionComposer.combine(first, second);
        assertArrayEquals(new double[] {1.0, 5.0}, result.getLoadP(), 0.0);
        assertEquals(1.01, result.getProdV()[0], 0.0);
        assertTrue(result.getInjection(InjectionKey.PROD_P).isEmpty());

        GridAction overwrite = new GridAction(schema, ActionType.COMPLETE).setLoadP(ElementInput.pair(0, 2.0));
        assertArrayEquals(new double[] {2.0, 5.0}, result.add(overwrite).getLoadP(), 0.0);
    }

    @Test
    void testModifiedFlagsUnion() {
        GridAction first = newAction().setLoadSetBus(ElementInput.pair(0, 1));
        GridAction second = newAction().setLineChangeStatus(ElementInput.of(0));
        GridAction result = ActionComposer.combine(first, second);
        assertTrue(result.isSetBusModified());
        assertTrue(result.isChangeStatusModified());
        assertFalse(result.isRedispatchModified());
    }

    @Test
    void testUnsupportedModificationsDropped() {
        ReportNode reportNode = Reports.createRootReportNode("gridAction.composition");
        GridAction first = new GridAction(schema, ActionType.POWERLINE_SET).setLineSetStatus(ElementInput.pair(1, -1));
        GridAction second = newAction()
                .setRedispatch(ElementInput.pair(0, 4.0))
                .setLineChangeStatus(ElementInput.of(0))
                .setLineSetStatus(ElementInput.pair(2, 1));
        GridAction result = ActionComposer.combine(first, second, reportNode);

        assertEquals(ActionType.POWERLINE_SET, result.getType());
        assertArrayEquals(new int[] {0, -1, 1}, result.getLineSetStatus());
        assertArrayEquals(new boolean[3], result.getLineChangeStatus());
        assertArrayEquals(new double[2], result.getRedispatch(), 0.0);

        List<ReportNode> children = reportNode.getChildren();
        assertEquals(2, children.size());
        assertEquals("Modification of 'redispatch' dropped: not supported by actions of type POWERLINE_SET", children.get(0).getMessage());
        assertEquals("Modification of 'change_line_status' dropped: not supported by actions of type POWERLINE_SET", children.get(1).getMessage());
    }

    @Test
    void testNotCommutative() {
        GridAction topology = new GridAction(schema, ActionType.TOPOLOGY).setLoadSetBus(ElementInput.pair(0, 2));
        GridAction dispatch = newAction().setRedispatch(ElementInput.pair(0, 3.0));
        assertArrayEquals(new double[2], ActionComposer.combine(topology, dispatch).getRedispatch(), 0.0);
        GridAction result = ActionComposer.combine(dispatch, topology);
        assertArrayEquals(new double[] {3.0, 0.0}, result.getRedispatch(), 0.0);
        assertArrayEquals(new int[] {2, 0}, result.getLoadSetBus());
    }

    @Test
    void testDroppedModificationsLeaveNoFlag() {
        GridAction topology = new GridAction(schema, ActionType.TOPOLOGY);
        GridAction dispatch = new GridAction(schema, ActionType.DISPATCH).setRedispatch(ElementInput.pair(0, 1.0));
        GridAction result = ActionComposer.combine(topology, dispatch);
        assertArrayEquals(new double[2], result.getRedispatch(), 0.0);
        assertFalse(result.isRedispatchModified());
        assertFalse(result.canAffectSomething());

        GridAction mixed = ActionComposer.combine(topology, newAction()
                .setRedispatch(ElementInput.pair(1, 2.0))
                .setLineChangeStatus(ElementInput.of(0)));
        assertFalse(mixed.isRedispatchModified());
        assertTrue(mixed.isChangeStatusModified());
        assertTrue(mixed.canAffectSomething());
    }

    @Test
    void testDoNothingIsNeutral() {
        GridAction action = newAction()
                .setLineSetStatus(ElementInput.pair(0, -1))
                .setLineChangeStatus(ElementInput.of(2))
                .setLoadSetBus(ElementInput.pair(1, 2))
                .setGenChangeBus(ElementInput.of(0))
                .setRedispatch(ElementInput.pair(1, -2.5))
                .setStorageP(ElementInput.pair(0, 1.0));

        GridAction right = ActionComposer.combine(action, newAction());
        assertEquals(action, right);
        assertTrue(right.isSetStatusModified());
        assertTrue(right.isStorageModified());

        GridAction left = ActionComposer.combine(newAction(), action);
        assertEquals(action, left);
        assertTrue(left.isChangeBusModified());
        assertTrue(left.isRedispatchModified());
    }

    @Test
    void testDifferentGrids() {
        GridAction action = newAction();
        GridAction other = new GridAction(Case14GridFactory.create(), ActionType.PLAYABLE);
        GridActionException e = assertThrows(GridActionException.class, () -> action.add(other));
        assertEquals("Actions on different grids cannot be composed", e.getMessage());
    }

    @Test
    void testCompositionInvalidatesImpact() {
        GridAction action = newAction();
        assertArrayEquals(new int[0], action.getTopologicalImpact().getImpactedSubstations());
        action.add(newAction().setGenSetBus(ElementInput.pair(1, 2)));
        assertArrayEquals(new int[] {2}, action.getTopologicalImpact().getImpactedSubstations());
    }
}

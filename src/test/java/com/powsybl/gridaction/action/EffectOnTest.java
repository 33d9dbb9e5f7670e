/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.exceptions.ElementOutOfRangeException;
import com.powsybl.gridaction.exceptions.GridActionException;
import com.powsybl.gridaction.network.ThreeSubstationGridFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl grid action team
 */
class EffectOnTest {

    private GridAction action;

    @BeforeEach
    void setUp() {
        action = new GridAction(ThreeSubstationGridFactory.create(), ActionType.COMPLETE)
                .setLoadP(ElementInput.pair(1, 7.5))
                .setLoadSetBus(ElementInput.pair(1, 2))
                .setProdV(ElementInput.pair(0, 1.03))
                .setGenChangeBus(ElementInput.of(0))
                .setRedispatch(ElementInput.pair(0, -4.0))
                .setLineSetStatus(ElementInput.pair(2, 1))
                .setLineExSetBus(ElementInput.pair(2, 2))
                .setLineOrChangeBus(ElementInput.of(1))
                .setStorageP(ElementInput.pair(0, 2.0));
    }

    @Test
    void testLoad() {
        ElementEffect.LoadEffect effect = (ElementEffect.LoadEffect) action.effectOn(EffectQuery.load(1));
        assertEquals(7.5, effect.newP(), 0.0);
        assertTrue(Double.isNaN(effect.newQ()));
        assertEquals(2, effect.setBus());
        assertFalse(effect.changeBus());

        ElementEffect.LoadEffect untouched = (ElementEffect.LoadEffect) action.effectOn(EffectQuery.load(0));
        assertTrue(Double.isNaN(untouched.newP()));
        assertEquals(0, untouched.setBus());
    }

    @Test
    void testGenerator() {
        ElementEffect.GeneratorEffect effect = (ElementEffect.GeneratorEffect) action.effectOn(EffectQuery.generator(0));
        assertTrue(Double.isNaN(effect.newP()));
        assertEquals(1.03, effect.newV(), 0.0);
        assertEquals(0, effect.setBus());
        assertTrue(effect.changeBus());
        assertEquals(-4.0, effect.redispatch(), 0.0);
    }

    @Test
    void testLine() {
        ElementEffect.LineEffect effect = (ElementEffect.LineEffect) action.effectOn(EffectQuery.line(2));
        assertEquals(0, effect.setBusOr());
        assertEquals(2, effect.setBusEx());
        assertEquals(1, effect.setLineStatus());
        assertFalse(effect.changeLineStatus());

        ElementEffect.LineEffect other = (ElementEffect.LineEffect) action.effectOn(EffectQuery.line(1));
        assertTrue(other.changeBusOr());
        assertFalse(other.changeBusEx());
        assertEquals(0, other.setLineStatus());
    }

    @Test
    void testStorage() {
        ElementEffect.StorageEffect effect = (ElementEffect.StorageEffect) action.effectOn(EffectQuery.storage(0));
        assertEquals(2.0, effect.power(), 0.0);
        assertEquals(0, effect.setBus());
        assertFalse(effect.changeBus());
    }

    @Test
    void testSubstation() {
        ElementEffect.SubstationEffect effect = (ElementEffect.SubstationEffect) action.effectOn(EffectQuery.substation(2));
        assertEquals(2, effect.substationId());
        // load 1, generator 1, extremities of lines 1 and 2
        assertArrayEquals(new int[] {2, 0, 0, 2}, effect.setBus());
        assertArrayEquals(new boolean[4], effect.changeBus());

        ElementEffect.SubstationEffect sub1 = (ElementEffect.SubstationEffect) action.effectOn(EffectQuery.substation(1));
        assertArrayEquals(new boolean[] {false, true, false, false}, sub1.changeBus());
    }

    @Test
    void testInvalidQueries() {
        GridActionException none = assertThrows(GridActionException.class, () -> action.effectOn(new EffectQuery()));
        assertTrue(none.getMessage().contains("got 0"));

        EffectQuery two = EffectQuery.load(0).setLineId(1);
        assertThrows(GridActionException.class, () -> action.effectOn(two));

        assertThrows(ElementOutOfRangeException.class, () -> action.effectOn(EffectQuery.generator(2)));
        assertThrows(GridActionException.class, () -> action.effectOn(EffectQuery.substation(3)));
    }
}

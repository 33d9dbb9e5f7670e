/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import com.powsybl.gridaction.action.ActionType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author PowSyBl grid action team
 */
class ActionSpaceParametersTest {

    private InMemoryPlatformConfig platformConfig;

    private FileSystem fileSystem;

    @BeforeEach
    public void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
    }

    @AfterEach
    public void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testDefaultValues() {
        ActionSpaceParameters parameters = ActionSpaceParameters.load(platformConfig);
        assertEquals(ActionSpaceParameters.ACTION_TYPE_DEFAULT_VALUE, parameters.getActionType());
        assertTrue(parameters.isCheckLegitOnDecode());
        assertEquals("ActionSpaceParameters(actionType=PLAYABLE, checkLegitOnDecode=true)", parameters.toString());
    }

    @Test
    void testConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(ActionSpaceParameters.MODULE_NAME);
        moduleConfig.setStringProperty(ActionSpaceParameters.ACTION_TYPE_PARAM_NAME, "TOPOLOGY");
        moduleConfig.setStringProperty(ActionSpaceParameters.CHECK_LEGIT_ON_DECODE_PARAM_NAME, "false");

        ActionSpaceParameters parameters = ActionSpaceParameters.load(platformConfig);
        assertEquals(ActionType.TOPOLOGY, parameters.getActionType());
        assertFalse(parameters.isCheckLegitOnDecode());
    }

    @Test
    void testPartialConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(ActionSpaceParameters.MODULE_NAME);
        moduleConfig.setStringProperty(ActionSpaceParameters.CHECK_LEGIT_ON_DECODE_PARAM_NAME, "false");

        ActionSpaceParameters parameters = ActionSpaceParameters.load(platformConfig);
        assertEquals(ActionType.PLAYABLE, parameters.getActionType());
        assertFalse(parameters.isCheckLegitOnDecode());
    }

    @Test
    void testUpdateFromMap() {
        ActionSpaceParameters parameters = ActionSpaceParameters.load(Map.of(ActionSpaceParameters.ACTION_TYPE_PARAM_NAME, "COMPLETE"));
        assertEquals(ActionType.COMPLETE, parameters.getActionType());
        assertTrue(parameters.isCheckLegitOnDecode());

        parameters.update(Map.of(ActionSpaceParameters.CHECK_LEGIT_ON_DECODE_PARAM_NAME, "false"));
        assertEquals(ActionType.COMPLETE, parameters.getActionType());
        assertFalse(parameters.isCheckLegitOnDecode());

        Map<String, String> wrongType = Map.of(ActionSpaceParameters.ACTION_TYPE_PARAM_NAME, "EVERYTHING");
        assertThrows(IllegalArgumentException.class, () -> parameters.update(wrongType));
    }

    @Test
    void testToMap() {
        ActionSpaceParameters parameters = new ActionSpaceParameters()
                .setActionType(ActionType.DISPATCH)
                .setCheckLegitOnDecode(false);
        assertEquals(Map.of(ActionSpaceParameters.ACTION_TYPE_PARAM_NAME, ActionType.DISPATCH,
                ActionSpaceParameters.CHECK_LEGIT_ON_DECODE_PARAM_NAME, false), parameters.toMap());
        assertThrows(NullPointerException.class, () -> parameters.setActionType(null));
    }
}

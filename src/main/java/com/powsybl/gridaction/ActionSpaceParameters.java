/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.gridaction.action.ActionType;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of an {@link ActionSpace}, loaded from the {@code grid-action-default-parameters}
 * module of the platform configuration.
 *
 * @author PowSyBl grid action team
 */
public class ActionSpaceParameters {

    public static final String MODULE_NAME = "grid-action-default-parameters";

    public static final String ACTION_TYPE_PARAM_NAME = "actionType";

    public static final String CHECK_LEGIT_ON_DECODE_PARAM_NAME = "checkLegitOnDecode";

    public static final ActionType ACTION_TYPE_DEFAULT_VALUE = ActionType.PLAYABLE;

    public static final boolean CHECK_LEGIT_ON_DECODE_DEFAULT_VALUE = true;

    private ActionType actionType = ACTION_TYPE_DEFAULT_VALUE;

    private boolean checkLegitOnDecode = CHECK_LEGIT_ON_DECODE_DEFAULT_VALUE;

    public ActionType getActionType() {
        return actionType;
    }

    public ActionSpaceParameters setActionType(ActionType actionType) {
        this.actionType = Objects.requireNonNull(actionType);
        return this;
    }

    /**
     * Whether actions decoded from a flat vector go through the ambiguity checker.
     */
    public boolean isCheckLegitOnDecode() {
        return checkLegitOnDecode;
    }

    public ActionSpaceParameters setCheckLegitOnDecode(boolean checkLegitOnDecode) {
        this.checkLegitOnDecode = checkLegitOnDecode;
        return this;
    }

    public static ActionSpaceParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static ActionSpaceParameters load(PlatformConfig platformConfig) {
        ActionSpaceParameters parameters = new ActionSpaceParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setActionType(config.getEnumProperty(ACTION_TYPE_PARAM_NAME, ActionType.class, ACTION_TYPE_DEFAULT_VALUE))
                .setCheckLegitOnDecode(config.getBooleanProperty(CHECK_LEGIT_ON_DECODE_PARAM_NAME, CHECK_LEGIT_ON_DECODE_DEFAULT_VALUE)));
        return parameters;
    }

    public static ActionSpaceParameters load(Map<String, String> properties) {
        return new ActionSpaceParameters().update(properties);
    }

    public ActionSpaceParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(ACTION_TYPE_PARAM_NAME))
                .ifPresent(prop -> this.setActionType(ActionType.valueOf(prop)));
        Optional.ofNullable(properties.get(CHECK_LEGIT_ON_DECODE_PARAM_NAME))
                .ifPresent(prop -> this.setCheckLegitOnDecode(Boolean.parseBoolean(prop)));
        return this;
    }

    public Map<String, Object> toMap() {
        return Map.of(ACTION_TYPE_PARAM_NAME, actionType,
                CHECK_LEGIT_ON_DECODE_PARAM_NAME, checkLegitOnDecode);
    }

    @Override
    public String toString() {
        return "ActionSpaceParameters(" +
                "actionType=" + actionType +
                ", checkLegitOnDecode=" + checkLegitOnDecode +
                ')';
    }
}

/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridaction.action.ActionType;
import com.powsybl.gridaction.action.ActionVectorCodec;
import com.powsybl.gridaction.action.ElementInput;
import com.powsybl.gridaction.action.GridAction;
import com.powsybl.gridaction.network.ElementType;
import com.powsybl.gridaction.network.GridSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Creates the actions of one type on one grid, and converts them from and to flat vectors.
 *
 * @author PowSyBl grid action team
 */
public class ActionSpace {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActionSpace.class);

    private final GridSchema schema;

    private final ActionSpaceParameters parameters;

    private final ActionVectorCodec codec;

    public ActionSpace(GridSchema schema) {
        this(schema, ActionSpaceParameters.load());
    }

    public ActionSpace(GridSchema schema, ActionSpaceParameters parameters) {
        this.schema = Objects.requireNonNull(schema);
        this.parameters = Objects.requireNonNull(parameters);
        this.codec = new ActionVectorCodec(schema, parameters.getActionType());
        LOGGER.debug("Action space of type {} created on {}, flat vector size {}", parameters.getActionType(), schema, codec.size());
    }

    public GridSchema getSchema() {
        return schema;
    }

    public ActionSpaceParameters getParameters() {
        return parameters;
    }

    public ActionType getActionType() {
        return parameters.getActionType();
    }

    public ActionVectorCodec getCodec() {
        return codec;
    }

    /**
     * @return a new do nothing action
     */
    public GridAction newAction() {
        return new GridAction(schema, parameters.getActionType());
    }

    public GridAction newAction(Map<String, ?> dict) {
        return newAction(dict, ReportNode.NO_OP);
    }

    public GridAction newAction(Map<String, ?> dict, ReportNode reportNode) {
        return newAction().update(dict, reportNode);
    }

    public int size() {
        return codec.size();
    }

    public double[] toVector(GridAction action) {
        return codec.toVector(action);
    }

    public GridAction fromVector(double[] vector) {
        return codec.fromVector(vector, parameters.isCheckLegitOnDecode());
    }

    public GridAction disconnectPowerline(int line) {
        schema.checkElementId(ElementType.LINE_OR, line);
        return newAction().setLineSetStatus(ElementInput.pair(line, -1));
    }

    public GridAction disconnectPowerline(String lineName) {
        return disconnectPowerline(schema.indexOfName(ElementType.LINE_OR, lineName));
    }

    /**
     * Reconnects a line, its origin on {@code busOr} and its extremity on {@code busEx} (1 or 2).
     */
    public GridAction reconnectPowerline(int line, int busOr, int busEx) {
        schema.checkElementId(ElementType.LINE_OR, line);
        return newAction()
                .setLineSetStatus(ElementInput.pair(line, 1))
                .setLineOrSetBus(ElementInput.pair(line, busOr))
                .setLineExSetBus(ElementInput.pair(line, busEx));
    }

    public GridAction reconnectPowerline(String lineName, int busOr, int busEx) {
        return reconnectPowerline(schema.indexOfName(ElementType.LINE_OR, lineName), busOr, busEx);
    }
}

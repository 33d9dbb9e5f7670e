/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import com.powsybl.gridaction.exceptions.GridActionException;
import com.powsybl.gridaction.network.ElementType;
import com.powsybl.gridaction.network.GridSchema;

import java.util.Objects;

/**
 * Computes the lines and substations an action touches, from the requested edits only: disconnecting
 * an already disconnected line still impacts it.
 * <p>
 * A line is impacted when its status is set or changed. A topology position is impacted when its bus
 * is set or changed, unless it is the end of a status impacted line that is disconnected, in which
 * case the bus edit goes with the status change. When the line status is unknown, every line is
 * considered disconnected for that rule.
 * <p>
 * With a known line status, setting a positive bus on an end of a disconnected line reconnects it
 * and setting -1 on an end of a connected line disconnects it: both impact the line, not the
 * substations.
 *
 * @author PowSyBl grid action team
 */
public final class ImpactAnalyzer {

    private ImpactAnalyzer() {
    }

    /**
     * @param knownLineStatus connection status of every line, or null if unknown
     */
    public static TopologicalImpact analyze(GridAction action, boolean[] knownLineStatus) {
        Objects.requireNonNull(action);
        GridSchema schema = action.schema;
        int lineCount = schema.getLineCount();
        if (knownLineStatus != null && knownLineStatus.length != lineCount) {
            throw new GridActionException("The line status has " + knownLineStatus.length + " values but the grid has "
                    + lineCount + " lines");
        }

        boolean[] linesImpacted = new boolean[lineCount];
        for (int line = 0; line < lineCount; line++) {
            linesImpacted[line] = action.changeLineStatus[line] || action.setLineStatus[line] != 0;
        }

        int[] setBus = action.setBus;
        boolean[] effectiveChange = new boolean[schema.getDimTopo()];
        for (int pos = 0; pos < effectiveChange.length; pos++) {
            effectiveChange[pos] = action.changeBus[pos] || setBus[pos] != 0;
        }

        for (int line = 0; line < lineCount; line++) {
            boolean disconnected = knownLineStatus == null || !knownLineStatus[line];
            int or = schema.getTopologyIndex(ElementType.LINE_OR, line);
            int ex = schema.getTopologyIndex(ElementType.LINE_EX, line);
            if (linesImpacted[line] && disconnected) {
                effectiveChange[or] = false;
                effectiveChange[ex] = false;
            }
            if (knownLineStatus != null) {
                boolean implicitReconnection = disconnected && (setBus[or] > 0 || setBus[ex] > 0);
                boolean implicitDisconnection = !disconnected && (setBus[or] < 0 || setBus[ex] < 0);
                if (implicitReconnection || implicitDisconnection) {
                    linesImpacted[line] = true;
                    effectiveChange[or] = false;
                    effectiveChange[ex] = false;
                }
            }
        }

        boolean[] subsImpacted = new boolean[schema.getSubstationCount()];
        for (int pos = 0; pos < effectiveChange.length; pos++) {
            if (effectiveChange[pos]) {
                subsImpacted[schema.getSubstationOfTopologyIndex(pos)] = true;
            }
        }
        return new TopologicalImpact(linesImpacted, subsImpacted);
    }
}

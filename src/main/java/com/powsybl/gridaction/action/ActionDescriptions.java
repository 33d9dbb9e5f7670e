/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.action;

import java.util.Arrays;
import java.util.Locale;

/**
 * Human readable description of an action.
 *
 * @author PowSyBl grid action team
 */
final class ActionDescriptions {

    private ActionDescriptions() {
    }

    static String describe(GridAction action) {
        ObjectsImpact impact = action.impactOnObjects();
        StringBuilder sb = new StringBuilder("This action will:");
        if (impact.injections().isEmpty()) {
            line(sb, "NOT change anything to the injections");
        } else {
            for (ObjectsImpact.InjectionChange change : impact.injections()) {
                line(sb, "Set " + change.key().getName() + " to " + Arrays.toString(change.values()));
            }
        }
        if (impact.redispatches().isEmpty()) {
            line(sb, "NOT perform any redispatching action");
        } else {
            line(sb, "Modify the generators with redispatching in the following way:");
            for (ObjectsImpact.RedispatchEntry entry : impact.redispatches()) {
                subLine(sb, String.format(Locale.ROOT, "Redispatch \"%s\" of %.2f MW", entry.generatorName(), entry.amount()));
            }
        }
        if (impact.storageSetPoints().isEmpty()) {
            line(sb, "NOT modify any storage capacity");
        } else {
            line(sb, "Modify the storage units in the following way:");
            for (ObjectsImpact.StorageEntry entry : impact.storageSetPoints()) {
                subLine(sb, String.format(Locale.ROOT, "Ask unit \"%s\" to %s %.2f MW (setpoint: %.2f MW)",
                        entry.storageName(), entry.power() > 0 ? "absorb" : "produce", Math.abs(entry.power()), entry.power()));
            }
        }
        if (impact.reconnectedLines().length == 0 && impact.disconnectedLines().length == 0) {
            line(sb, "NOT force any line status");
        } else {
            if (impact.reconnectedLines().length > 0) {
                line(sb, "Force reconnection of " + impact.reconnectedLines().length + " powerlines "
                        + Arrays.toString(impact.reconnectedLines()));
            }
            if (impact.disconnectedLines().length > 0) {
                line(sb, "Force disconnection of " + impact.disconnectedLines().length + " powerlines "
                        + Arrays.toString(impact.disconnectedLines()));
            }
        }
        if (impact.switchedLines().length == 0) {
            line(sb, "NOT switch any line status");
        } else {
            line(sb, "Switch status of " + impact.switchedLines().length + " powerlines " + Arrays.toString(impact.switchedLines()));
        }
        if (impact.busSwitches().isEmpty()) {
            line(sb, "NOT switch anything in the topology");
        } else {
            line(sb, "Change the bus of the following element(s):");
            for (ObjectsImpact.BusEdit edit : impact.busSwitches()) {
                subLine(sb, "Switch bus of " + edit.elementType().getLabel() + " id " + edit.elementId()
                        + " [on substation " + edit.substationId() + "]");
            }
        }
        if (impact.assignedBuses().isEmpty() && impact.disconnectedElements().isEmpty()) {
            line(sb, "NOT force any particular bus configuration");
        } else {
            if (!impact.assignedBuses().isEmpty()) {
                line(sb, "Set the bus of the following element(s):");
            }
            for (ObjectsImpact.BusEdit edit : impact.assignedBuses()) {
                subLine(sb, "Assign bus " + edit.bus() + " to " + edit.elementType().getLabel() + " id " + edit.elementId()
                        + " [on substation " + edit.substationId() + "]");
            }
            if (!impact.disconnectedElements().isEmpty()) {
                line(sb, "Disconnect the following element(s):");
            }
            for (ObjectsImpact.BusEdit edit : impact.disconnectedElements()) {
                subLine(sb, "Disconnect " + edit.elementType().getLabel() + " id " + edit.elementId()
                        + " [on substation " + edit.substationId() + "]");
            }
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, String text) {
        sb.append(System.lineSeparator()).append("\t - ").append(text);
    }

    private static void subLine(StringBuilder sb, String text) {
        sb.append(System.lineSeparator()).append("\t \t - ").append(text);
    }
}

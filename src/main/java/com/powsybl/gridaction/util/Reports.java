/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;

/**
 * Functional report messages, templates are in the {@code com.powsybl.gridaction.reports} bundle.
 *
 * @author PowSyBl grid action team
 */
public final class Reports {

    private static final String ATTRIBUTE = "attribute";
    private static final String ACTION_TYPE = "actionType";

    private Reports() {
    }

    public static ReportNode createRootReportNode(String messageKey) {
        return ReportNode.newRootReportNode()
                .withResourceBundles(PowsyblGridActionReportResourceBundle.BASE_NAME)
                .withMessageTemplate(messageKey)
                .build();
    }

    public static void reportModificationDropped(ReportNode reportNode, String attribute, String actionType) {
        reportNode.newReportNode()
                .withMessageTemplate("gridAction.modificationDropped")
                .withUntypedValue(ATTRIBUTE, attribute)
                .withUntypedValue(ACTION_TYPE, actionType)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportUnknownUpdateKey(ReportNode reportNode, String key) {
        reportNode.newReportNode()
                .withMessageTemplate("gridAction.unknownUpdateKey")
                .withUntypedValue("key", key)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportUnsupportedUpdateKey(ReportNode reportNode, String key, String actionType) {
        reportNode.newReportNode()
                .withMessageTemplate("gridAction.unsupportedUpdateKey")
                .withUntypedValue("key", key)
                .withUntypedValue(ACTION_TYPE, actionType)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }
}

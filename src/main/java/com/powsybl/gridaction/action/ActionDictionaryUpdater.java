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
import com.powsybl.gridaction.exceptions.GridActionException;
import com.powsybl.gridaction.exceptions.IllegalActionException;
import com.powsybl.gridaction.exceptions.InvalidNumberOfElementsException;
import com.powsybl.gridaction.network.ElementType;
import com.powsybl.gridaction.network.GridSchema;
import com.powsybl.gridaction.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Applies an action dictionary, the loosely typed form of an action, to a {@link GridAction}.
 * <p>
 * Keys are digested in a fixed order so that hazards and maintenance always win over bus and line
 * status edits of the same dictionary: shunt, injection, redispatch, set_storage, set_bus, change_bus,
 * set_line_status, hazards, maintenance, change_line_status. The status change of a line under a hazard or
 * a maintenance is skipped. Unknown keys, and keys the action type does not support, are ignored with a
 * warning.
 *
 * @author PowSyBl grid action team
 */
public final class ActionDictionaryUpdater {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActionDictionaryUpdater.class);

    public static final String INJECTION = "injection";
    public static final String SET_BUS = "set_bus";
    public static final String CHANGE_BUS = "change_bus";
    public static final String SET_LINE_STATUS = "set_line_status";
    public static final String CHANGE_LINE_STATUS = "change_line_status";
    public static final String REDISPATCH = "redispatch";
    public static final String SET_STORAGE = "set_storage";
    public static final String HAZARDS = "hazards";
    public static final String MAINTENANCE = "maintenance";
    public static final String SHUNT = "shunt";

    public static final String LOADS_ID = "loads_id";
    public static final String GENERATORS_ID = "generators_id";
    public static final String LINES_OR_ID = "lines_or_id";
    public static final String LINES_EX_ID = "lines_ex_id";
    public static final String STORAGES_ID = "storages_id";
    public static final String SUBSTATIONS_ID = "substations_id";

    public static final String SHUNT_P = "shunt_p";
    public static final String SHUNT_Q = "shunt_q";
    public static final String SHUNT_BUS = "shunt_bus";

    private static final List<String> DIGEST_ORDER = List.of(SHUNT, INJECTION, REDISPATCH, SET_STORAGE, SET_BUS, CHANGE_BUS,
            SET_LINE_STATUS, HAZARDS, MAINTENANCE, CHANGE_LINE_STATUS);

    private static final List<String> TOPOLOGY_KEYS = List.of(LOADS_ID, GENERATORS_ID, LINES_OR_ID, LINES_EX_ID, STORAGES_ID,
            SUBSTATIONS_ID);

    private ActionDictionaryUpdater() {
    }

    public static void update(GridAction action, Map<String, ?> dict, ReportNode reportNode) {
        Objects.requireNonNull(action);
        Objects.requireNonNull(reportNode);
        if (dict == null) {
            return;
        }
        for (String key : dict.keySet()) {
            if (!DIGEST_ORDER.contains(key)) {
                warnUnknown(key, reportNode);
            }
        }
        for (String key : DIGEST_ORDER) {
            Object value = dict.get(key);
            if (value == null) {
                continue;
            }
            if (!isSupported(action, key)) {
                LOGGER.warn("Key '{}' ignored: not supported by actions of type {} on this grid", key, action.type);
                Reports.reportUnsupportedUpdateKey(reportNode, key, action.type.name());
                continue;
            }
            digest(action, key, value, reportNode);
        }
    }

    private static void warnUnknown(String key, ReportNode reportNode) {
        LOGGER.warn("Key '{}' is not recognized and is ignored", key);
        Reports.reportUnknownUpdateKey(reportNode, key);
    }

    private static boolean isSupported(GridAction action, String key) {
        return switch (key) {
            case INJECTION -> Arrays.stream(InjectionKey.values()).anyMatch(k -> action.supports(k.getAttribute()));
            case SET_BUS -> action.supports(ActionAttribute.SET_BUS);
            case CHANGE_BUS -> action.supports(ActionAttribute.CHANGE_BUS);
            case SET_LINE_STATUS -> action.supports(ActionAttribute.SET_LINE_STATUS);
            case CHANGE_LINE_STATUS -> action.supports(ActionAttribute.CHANGE_LINE_STATUS);
            case REDISPATCH -> action.supports(ActionAttribute.REDISPATCH);
            case SET_STORAGE -> action.supports(ActionAttribute.STORAGE_POWER);
            case HAZARDS -> action.supports(ActionAttribute.HAZARDS);
            case MAINTENANCE -> action.supports(ActionAttribute.MAINTENANCE);
            case SHUNT -> action.supports(ActionAttribute.SHUNT_P) || action.supports(ActionAttribute.SHUNT_Q)
                    || action.supports(ActionAttribute.SHUNT_BUS);
            default -> false;
        };
    }

    private static void digest(GridAction action, String key, Object value, ReportNode reportNode) {
        switch (key) {
            case SHUNT -> digestShunt(action, asMap(key, value), reportNode);
            case INJECTION -> digestInjection(action, asMap(key, value), reportNode);
            case REDISPATCH -> action.setRedispatch(ElementInput.from(value));
            case SET_STORAGE -> action.setStorageP(ElementInput.from(value));
            case SET_BUS -> digestTopology(action, key, value, action::setSetBus, Map.of(
                    LOADS_ID, action::setLoadSetBus,
                    GENERATORS_ID, action::setGenSetBus,
                    LINES_OR_ID, action::setLineOrSetBus,
                    LINES_EX_ID, action::setLineExSetBus,
                    STORAGES_ID, action::setStorageSetBus,
                    SUBSTATIONS_ID, action::setSubSetBus), reportNode);
            case CHANGE_BUS -> digestTopology(action, key, value, action::setChangeBus, Map.of(
                    LOADS_ID, action::setLoadChangeBus,
                    GENERATORS_ID, action::setGenChangeBus,
                    LINES_OR_ID, action::setLineOrChangeBus,
                    LINES_EX_ID, action::setLineExChangeBus,
                    STORAGES_ID, action::setStorageChangeBus,
                    SUBSTATIONS_ID, action::setSubChangeBus), reportNode);
            case SET_LINE_STATUS -> action.setLineSetStatus(ElementInput.from(value));
            case HAZARDS -> outageLines(action, key, value).forEach(line -> action.applyOutage(line, true));
            case MAINTENANCE -> outageLines(action, key, value).forEach(line -> action.applyOutage(line, false));
            case CHANGE_LINE_STATUS -> action.setLineChangeStatusOutsideOutages(ElementInput.from(value));
            default -> throw new IllegalStateException("Unexpected key: " + key);
        }
    }

    private static Map<?, ?> asMap(String key, Object value) {
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalActionException("The value of '" + key + "' must be a dictionary, got " + value.getClass().getSimpleName());
    }

    private static void digestShunt(GridAction action, Map<?, ?> shunts, ReportNode reportNode) {
        for (Map.Entry<?, ?> e : shunts.entrySet()) {
            String subKey = String.valueOf(e.getKey());
            if (e.getValue() == null) {
                continue;
            }
            ElementInput input = ElementInput.from(e.getValue());
            switch (subKey) {
                case SHUNT_P -> action.setShuntP(input);
                case SHUNT_Q -> action.setShuntQ(input);
                case SHUNT_BUS, SET_BUS -> action.setShuntBus(input);
                default -> warnUnknown(SHUNT + "/" + subKey, reportNode);
            }
        }
    }

    private static void digestInjection(GridAction action, Map<?, ?> injections, ReportNode reportNode) {
        for (Map.Entry<?, ?> e : injections.entrySet()) {
            String subKey = String.valueOf(e.getKey());
            Optional<InjectionKey> injectionKey = InjectionKey.fromName(subKey);
            if (injectionKey.isEmpty()) {
                warnUnknown(INJECTION + "/" + subKey, reportNode);
            } else if (!action.supports(injectionKey.get().getAttribute())) {
                LOGGER.warn("Injection '{}' ignored: not supported by actions of type {}", subKey, action.type);
                Reports.reportUnsupportedUpdateKey(reportNode, INJECTION + "/" + subKey, action.type.name());
            } else if (e.getValue() != null) {
                action.putInjection(injectionKey.get(), toDoubles(subKey, e.getValue()));
            }
        }
    }

    private static double[] toDoubles(String key, Object value) {
        if (value instanceof double[] doubles) {
            return doubles;
        }
        if (value instanceof int[] ints) {
            return Arrays.stream(ints).asDoubleStream().toArray();
        }
        if (value instanceof Collection<?> collection) {
            double[] result = new double[collection.size()];
            int i = 0;
            for (Object item : collection) {
                if (!(item instanceof Number number)) {
                    throw new IllegalActionException("The values of '" + key + "' must be numbers, got " + item);
                }
                result[i++] = number.doubleValue();
            }
            return result;
        }
        throw new IllegalActionException("The value of '" + key + "' must be a vector of numbers, got "
                + value.getClass().getSimpleName());
    }

    private static void digestTopology(GridAction action, String key, Object value, Function<ElementInput, GridAction> dense,
                                       Map<String, Function<ElementInput, GridAction>> setters, ReportNode reportNode) {
        if (!(value instanceof Map<?, ?> map)) {
            dense.apply(ElementInput.from(value));
            return;
        }
        if (TOPOLOGY_KEYS.stream().noneMatch(map::containsKey)) {
            throw new AmbiguousActionException("The dictionary of '" + key + "' must contain at least one of " + TOPOLOGY_KEYS);
        }
        for (Object subKey : map.keySet()) {
            if (!TOPOLOGY_KEYS.contains(subKey)) {
                warnUnknown(key + "/" + subKey, reportNode);
            }
        }
        // same order for every dictionary, whatever the map iteration order
        for (String subKey : TOPOLOGY_KEYS) {
            Object subValue = map.get(subKey);
            if (subValue != null) {
                setters.get(subKey).apply(ElementInput.from(subValue));
            }
        }
    }

    /**
     * Lines of a hazards or maintenance entry: a boolean mask over all lines, or line ids and names.
     */
    private static List<Integer> outageLines(GridAction action, String key, Object value) {
        GridSchema schema = action.schema;
        ElementInput input = ElementInput.from(value);
        List<Integer> lines = new ArrayList<>();
        try {
            if (input instanceof ElementInput.Dense dense && dense.values() instanceof boolean[] mask) {
                if (mask.length != schema.getLineCount()) {
                    throw new InvalidNumberOfElementsException(key, schema.getLineCount(), mask.length);
                }
                for (int line = 0; line < mask.length; line++) {
                    if (mask[line]) {
                        lines.add(line);
                    }
                }
            } else if (input instanceof ElementInput.Dense dense && dense.values() instanceof int[] ids) {
                for (int id : ids) {
                    lines.add(checkLine(schema, id));
                }
            } else if (input instanceof ElementInput.Ids ids) {
                for (Object id : ids.ids()) {
                    lines.add(lineOf(schema, key, id));
                }
            } else if (input instanceof ElementInput.Single single) {
                lines.add(lineOf(schema, key, single.id()));
            } else {
                throw new IllegalActionException("'" + key + "' must be a boolean vector or a list of lines");
            }
        } catch (InvalidNumberOfElementsException | IllegalActionException e) {
            throw e;
        } catch (GridActionException e) {
            throw new IllegalActionException("Impossible to apply '" + key + "': " + e.getMessage(), e);
        }
        return lines;
    }

    private static int lineOf(GridSchema schema, String key, Object id) {
        if (id instanceof String name) {
            return schema.indexOfName(ElementType.LINE_OR, name);
        }
        if (id instanceof Integer || id instanceof Long || id instanceof Short || id instanceof Byte) {
            return checkLine(schema, ((Number) id).intValue());
        }
        throw new IllegalActionException("Invalid line id in '" + key + "': " + id);
    }

    private static int checkLine(GridSchema schema, int line) {
        schema.checkElementId(ElementType.LINE_OR, line);
        return line;
    }
}

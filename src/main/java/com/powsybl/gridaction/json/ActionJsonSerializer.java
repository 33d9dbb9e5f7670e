/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridaction.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.powsybl.commons.json.JsonUtil;
import com.powsybl.gridaction.action.ActionAttribute;
import com.powsybl.gridaction.action.ActionVectorCodec;
import com.powsybl.gridaction.action.GridAction;
import com.powsybl.gridaction.exceptions.AmbiguousActionException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * JSON form of an action: an object mapping each attribute name to its values. Bus and line status
 * values are written as integers, toggles as booleans, and non finite floats as strings.
 * <p>
 * Reading needs the grid and the action type, both given by the codec.
 *
 * @author PowSyBl grid action team
 */
public class ActionJsonSerializer {

    private final ActionVectorCodec codec;

    public ActionJsonSerializer(ActionVectorCodec codec) {
        this.codec = Objects.requireNonNull(codec);
    }

    public void write(GridAction action, Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(action, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String toJson(GridAction action) {
        StringWriter writer = new StringWriter();
        write(action, writer);
        return writer.toString();
    }

    public void write(GridAction action, Writer writer) {
        Objects.requireNonNull(writer);
        Map<ActionAttribute, double[]> values = codec.toAttributes(action);
        try (JsonGenerator jsonGenerator = new JsonFactory()
                .createGenerator(writer)
                .useDefaultPrettyPrinter()) {
            jsonGenerator.writeStartObject();
            for (Map.Entry<ActionAttribute, double[]> e : values.entrySet()) {
                jsonGenerator.writeFieldName(e.getKey().getName());
                jsonGenerator.writeStartArray();
                for (double value : e.getValue()) {
                    writeValue(jsonGenerator, e.getKey(), value);
                }
                jsonGenerator.writeEndArray();
            }
            jsonGenerator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeValue(JsonGenerator jsonGenerator, ActionAttribute attribute, double value) throws IOException {
        switch (attribute.getDomain()) {
            case BUS, LINE_STATUS -> jsonGenerator.writeNumber((int) value);
            case TOGGLE -> jsonGenerator.writeBoolean(value != 0);
            case FLOAT -> {
                if (Double.isFinite(value)) {
                    jsonGenerator.writeNumber(value);
                } else {
                    jsonGenerator.writeString(Double.toString(value));
                }
            }
        }
    }

    public GridAction read(Path file) {
        return read(file, true);
    }

    public GridAction read(Path file, boolean checkLegit) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, checkLegit);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public GridAction fromJson(String json) {
        return read(new StringReader(json), true);
    }

    /**
     * @param checkLegit whether to run the ambiguity checker on the action read
     * @throws AmbiguousActionException on an unknown attribute or a value of the wrong kind
     */
    public GridAction read(Reader reader, boolean checkLegit) {
        Objects.requireNonNull(reader);
        JsonNode root;
        try {
            root = JsonUtil.createObjectMapper().readTree(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (root == null || !root.isObject()) {
            throw new AmbiguousActionException("An action must be a JSON object");
        }
        Map<ActionAttribute, double[]> values = new EnumMap<>(ActionAttribute.class);
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            ActionAttribute attribute = ActionAttribute.fromName(field.getKey())
                    .orElseThrow(() -> new AmbiguousActionException("Unknown action attribute '" + field.getKey() + "'"));
            values.put(attribute, readValues(attribute, field.getValue()));
        }
        return codec.fromAttributes(values, checkLegit);
    }

    private static double[] readValues(ActionAttribute attribute, JsonNode node) {
        if (!node.isArray()) {
            throw new AmbiguousActionException("Attribute '" + attribute.getName() + "' must be an array");
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode item = node.get(i);
            if (item.isBoolean()) {
                values[i] = item.booleanValue() ? 1 : 0;
            } else if (item.isNumber()) {
                values[i] = item.doubleValue();
            } else if (item.isTextual()) {
                try {
                    values[i] = Double.parseDouble(item.textValue());
                } catch (NumberFormatException e) {
                    throw new AmbiguousActionException("Invalid value '" + item.textValue() + "' for attribute '"
                            + attribute.getName() + "'", e);
                }
            } else {
                throw new AmbiguousActionException("Invalid value " + item + " for attribute '" + attribute.getName() + "'");
            }
        }
        return values;
    }
}

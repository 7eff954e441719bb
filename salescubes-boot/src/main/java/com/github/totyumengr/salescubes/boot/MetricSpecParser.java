/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.salescubes.boot;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.salescubes.core.ConfigurationException;
import com.github.totyumengr.salescubes.core.MetricSpec;

/**
 * Read {@link MetricSpec} from JSON like <code>{"sale_amount_usd":["sum","mean"],"transaction_id":"count"}</code>. 
 * A single function may be given as a string, key order is kept and a repeated metric is rejected.
 * 
 * @author mengran
 *
 */
public class MetricSpecParser {
    
    private ObjectMapper objectMapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY);
    
    public MetricSpec parse(String json) throws ConfigurationException {
        
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Metric spec is not valid JSON: " + json, e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Metric spec must be a JSON object: " + json);
        }
        
        MetricSpec.Builder builder = MetricSpec.builder();
        for (Iterator<Entry<String, JsonNode>> it = root.fields(); it.hasNext();) {
            Entry<String, JsonNode> metric = it.next();
            builder.metric(metric.getKey(), functionsOf(metric.getKey(), metric.getValue()));
        }
        return builder.build();
    }
    
    private static List<String> functionsOf(String metric, JsonNode value) {
        
        List<String> functions = new ArrayList<String>();
        if (value.isTextual()) {
            functions.add(value.asText());
        } else if (value.isArray()) {
            for (JsonNode function : value) {
                if (!function.isTextual()) {
                    throw new ConfigurationException("Function " + function + " of metric " + metric 
                            + " must be a string.");
                }
                functions.add(function.asText());
            }
        } else {
            throw new ConfigurationException("Functions of metric " + metric 
                    + " must be a string or a list of strings, but is " + value);
        }
        return functions;
    }
    
}

package io.taskgateway.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Final split of caller data between the JSON body and the query string.
 *
 * @param body  the JSON body; always empty for GET and DELETE
 * @param query the query parameters
 */
public record PlacedParameters(ObjectNode body, ObjectNode query) {}

package org.operaton.hikeprep.controller;

import java.util.Map;

/**
 * Body of a 400 response: a summary message and one message per rejected field.
 */
public record ErrorResponse(String error, Map<String, String> fieldErrors) {
}

/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.mcpengine.util;

import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks tool names before they are registered: 1 to 128 characters drawn from
 * {@code A-Z a-z 0-9 _ - .}.
 */
public final class ToolNameValidator {

	private static final Logger logger = LoggerFactory.getLogger(ToolNameValidator.class);

	private static final int MAX_LENGTH = 128;

	private static final Pattern VALID_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_\\-.]+$");

	/**
	 * System property that downgrades validation failures to warnings when set to
	 * {@code true}.
	 */
	public static final String LENIENT_PROPERTY = "io.mcpengine.lenientToolNames";

	private ToolNameValidator() {
	}

	/**
	 * Validates a tool name, honouring {@link #LENIENT_PROPERTY}.
	 * @param name the tool name
	 * @throws IllegalArgumentException if the name is invalid and lenient mode is off
	 */
	public static void validate(String name) {
		validate(name, Boolean.getBoolean(LENIENT_PROPERTY));
	}

	public static void validate(String name, boolean lenient) {
		String problem = null;
		if (name == null || name.isEmpty()) {
			problem = "Tool name must not be empty";
		}
		else if (name.length() > MAX_LENGTH) {
			problem = "Tool name must not exceed " + MAX_LENGTH + " characters";
		}
		else if (!VALID_NAME_PATTERN.matcher(name).matches()) {
			problem = "Tool name may only contain A-Z, a-z, 0-9, '_', '-' and '.'";
		}
		if (problem == null) {
			return;
		}
		if (lenient) {
			logger.warn("{}: '{}'. Registering it anyway.", problem, name);
		}
		else {
			throw new IllegalArgumentException(problem + ": '" + name + "'");
		}
	}

}

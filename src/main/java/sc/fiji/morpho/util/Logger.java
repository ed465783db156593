/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2025 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.morpho.util;

import org.scijava.log.LogService;

import sc.fiji.morpho.MorphoUtils;

/**
 * The Logger class provides functionality for logging messages with different levels such as
 * debug, warn and error. Debug messages are only issued in debug mode.
 *
 * Relies on a SciJava LogService, by default the one shared by
 * {@link MorphoUtils#getLogService()}.
 */
public class Logger {

	private final LogService logService;

	private final boolean debug;
	private final String callerIdentifier;

	public Logger(final Class<?> clazz) {
		this(MorphoUtils.getLogService(), clazz.getSimpleName());
	}

	/**
	 * Constructs a new Logger with the specified service and caller identifier.
	 *
	 * @param logService the service receiving messages
	 * @param callerIdentifier the identifier for the calling class/component
	 */
	public Logger(final LogService logService, final String callerIdentifier) {
		if (logService == null) throw new IllegalArgumentException("LogService cannot be null");
		this.logService = logService;
		this.callerIdentifier = callerIdentifier;
		debug = MorphoUtils.isDebugMode() || logService.isDebug();
	}

	/**
	 * Logs a debug message (only if debug mode is enabled).
	 *
	 * @param msg the debug message to log
	 */
	public void debug(final Object msg) {
		if (debug) logService.info(callerIdentifier + ": " + msg);
	}

	public void warn(final String string) {
		logService.warn(callerIdentifier + ": " + string);
	}

	public void error(final String string, final Throwable t) {
		if (debug && t != null)
			logService.error(callerIdentifier + ": " + string, t);
		else
			logService.error(callerIdentifier + ": " + string);
	}

}

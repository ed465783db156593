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

package sc.fiji.morpho;

import java.util.concurrent.TimeUnit;

import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;
import org.scijava.util.VersionUtils;

/** Static utilities for Morpho **/
public class MorphoUtils {

	/**
	 * Tolerance used when comparing coordinates and diameters read from
	 * reconstruction files.
	 */
	public static final double EPSILON = 1e-6;

	/** System property enabling debug mode at startup */
	public static final String DEBUG_PROPERTY = "morpho.debug";

	public static final String VERSION = getVersion();

	private static LogService logService;
	private static volatile boolean debug = Boolean.getBoolean(DEBUG_PROPERTY);

	private MorphoUtils() {}

	/**
	 * Retrieves Morpho's version
	 *
	 * @return the version or a non-empty place holder string if version could
	 *         not be retrieved.
	 */
	private static String getVersion() {
		try {
			final String version = VersionUtils.getVersion(MorphoUtils.class);
			return (version == null) ? "N/A" : version;
		} catch (final Throwable ignored) {
			return "N/A";
		}
	}

	public static String getReadableVersion() {
		return "Morpho " + VERSION;
	}

	/**
	 * Gets the LogService used by all of Morpho's loggers. A
	 * {@link StderrLogService} is created on first access if none has been set.
	 *
	 * @return the shared LogService
	 */
	public static synchronized LogService getLogService() {
		if (logService == null) logService = new StderrLogService();
		return logService;
	}

	/**
	 * Replaces the shared LogService, e.g., with one obtained from a SciJava
	 * context.
	 *
	 * @param service the new LogService. Null resets to the default.
	 */
	public static synchronized void setLogService(final LogService service) {
		logService = service;
	}

	public static synchronized void log(final String string) {
		if (!isDebugMode()) return;
		getLogService().info("[Morpho] " + string);
	}

	/**
	 * Assesses if Morpho is running in debug mode
	 *
	 * @return the debug flag
	 */
	public static boolean isDebugMode() {
		return debug;
	}

	/**
	 * Enables/disables debug mode
	 *
	 * @param b verbose flag
	 */
	public static void setDebugMode(final boolean b) {
		if (isDebugMode() && !b) {
			log("Exiting debug mode...");
		}
		debug = b;
		if (isDebugMode()) {
			log("Entering debug mode...");
		}
	}

	public static String getElapsedTime(final long fromStart) {
		final long time = System.currentTimeMillis() - fromStart;
		if (time < 1000)
			return String.format("%02d msec", time);
		else if (time < 90000)
			return String.format("%02d sec", TimeUnit.MILLISECONDS.toSeconds(time));
		return String.format("%02d min, %02d sec", TimeUnit.MILLISECONDS.toMinutes(time),
				TimeUnit.MILLISECONDS.toSeconds(time)
						- TimeUnit.MINUTES.toSeconds(TimeUnit.MILLISECONDS.toMinutes(time)));
	}

}

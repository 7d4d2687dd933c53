/*
 * montgomery-primality is a Miller-Rabin probable prime test working in Montgomery form.
 * Copyright (C) 2018 Tilman Neumann - tilman.neumann@web.de
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU General Public License
 * as published by the Free Software Foundation; either version 3 of the License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along with this program;
 * if not, see <http://www.gnu.org/licenses/>.
 */
package de.tilman_neumann.primality.util;

/**
 * Formatting of durations.
 *
 * @author Tilman Neumann
 */
public class TimeUtil {

	private TimeUtil() {
		// static methods only
	}

	/**
	 * Format a duration like "1h, 2m, 3s, 456ms". Leading zero units are omitted.
	 * @param millis duration in milliseconds
	 * @return formatted duration
	 */
	public static String timeStr(long millis) {
		if (millis < 0) return "-" + timeStr(-millis);

		long ms = millis % 1000;
		long totalSeconds = millis / 1000;
		long s = totalSeconds % 60;
		long totalMinutes = totalSeconds / 60;
		long m = totalMinutes % 60;
		long h = totalMinutes / 60;

		StringBuilder sb = new StringBuilder();
		if (h > 0) sb.append(h).append("h, ");
		if (h > 0 || m > 0) sb.append(m).append("m, ");
		if (h > 0 || m > 0 || s > 0) sb.append(s).append("s, ");
		sb.append(ms).append("ms");
		return sb.toString();
	}
}

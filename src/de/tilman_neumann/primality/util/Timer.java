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
 * A simple stop watch measuring milliseconds.
 *
 * @author Tilman Neumann
 */
public class Timer {
	private long startTime;
	private long lastCaptureTime;

	public Timer() {
		start();
	}

	/**
	 * (Re-)start this timer.
	 */
	public void start() {
		startTime = System.currentTimeMillis();
		lastCaptureTime = startTime;
	}

	/**
	 * @return milliseconds since the last capture() or start()
	 */
	public long capture() {
		long now = System.currentTimeMillis();
		long duration = now - lastCaptureTime;
		lastCaptureTime = now;
		return duration;
	}

	/**
	 * @return milliseconds since start()
	 */
	public long totalRuntime() {
		return System.currentTimeMillis() - startTime;
	}
}

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
package de.tilman_neumann.primality.modular;

import java.math.BigInteger;

/**
 * Thrown if Montgomery arithmetic is requested for a modulus that is not odd and positive.
 *
 * @author Tilman Neumann
 */
public class InvalidModulusException extends IllegalArgumentException {
	private static final long serialVersionUID = -2318772012574402911L;

	private final BigInteger modulus;

	public InvalidModulusException(BigInteger modulus) {
		super("modulus must be odd and positive, but is " + modulus);
		this.modulus = modulus;
	}

	public BigInteger getModulus() {
		return modulus;
	}
}

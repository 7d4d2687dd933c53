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
package de.tilman_neumann.primality.probable;

import java.math.BigInteger;

/**
 * Thrown if an explicitly given Miller-Rabin base is not in [2, n-2].
 *
 * @author Tilman Neumann
 */
public class InvalidBaseRangeException extends IllegalArgumentException {
	private static final long serialVersionUID = 7460829264093185311L;

	private final BigInteger base;

	public InvalidBaseRangeException(BigInteger base, BigInteger n) {
		super("invalid base (must be in the range [2, n-2]): " + base + ", n = " + n);
		this.base = base;
	}

	public BigInteger getBase() {
		return base;
	}
}

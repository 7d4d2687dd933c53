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
package de.tilman_neumann.primality.base;

import java.math.BigInteger;

/**
 * Bit-level integer utilities needed by the Montgomery engine and the Miller-Rabin test.
 *
 * @author Tilman Neumann
 */
public class BitUtil {

	private BitUtil() {
		// static methods only
	}

	/**
	 * Compute the number of bits required to represent a non-negative integer, without leading zeros.
	 *
	 * @param n a non-negative integer
	 * @return bit length of n; 0 for n=0
	 * @throws IllegalArgumentException if n is negative
	 */
	public static int bitLength(BigInteger n) {
		if (n.signum() < 0) throw new IllegalArgumentException("bitLength() requires a non-negative argument, but n = " + n);
		return n.bitLength();
	}

	/**
	 * Compute the multiplicity of the prime factor 2 in n, i.e. the largest k such that 2^k divides n.
	 * So if n = 2^k * d with d odd, then k is returned.
	 *
	 * @param n an integer
	 * @return k; 0 for n=0
	 */
	public static int twoMultiplicity(BigInteger n) {
		if (n.signum() == 0) return 0;
		// n != 0 has a lowest 1-bit
		return n.getLowestSetBit();
	}
}

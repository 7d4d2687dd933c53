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
package de.tilman_neumann.primality.gcd;

import static de.tilman_neumann.primality.base.BigIntConstants.*;

import java.math.BigInteger;

import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.LogManager;

import static org.junit.Assert.*;

/**
 * Binary gcd (Stein's algorithm) for non-negative BigIntegers.
 * Works with shifts, comparisons and subtractions only; no divisions.
 *
 * @author Tilman Neumann
 */
public class BinaryGcd {
	private static final Logger LOG = LogManager.getLogger(BinaryGcd.class);
	private static final boolean DEBUG = false;

	/**
	 * Compute gcd(a, b).
	 * @param a non-negative
	 * @param b non-negative
	 * @return gcd(a, b)
	 * @throws IllegalArgumentException if a or b is negative
	 */
	public BigInteger gcd(BigInteger a, BigInteger b) {
		if (a.signum() < 0 || b.signum() < 0) {
			throw new IllegalArgumentException("binary gcd requires non-negative arguments, but a = " + a + ", b = " + b);
		}
		if (a.equals(b)) return a;
		if (a.signum() == 0) return b;
		if (b.signum() == 0) return a;

		final BigInteger a0 = a, b0 = b;

		// strip common factors of 2; they are re-added at the end
		int sharedTwoFactors = Math.min(a.getLowestSetBit(), b.getLowestSetBit());
		a = a.shiftRight(sharedTwoFactors);
		b = b.shiftRight(sharedTwoFactors);

		while (!a.equals(b) && b.compareTo(I_1) > 0) {
			// the remaining factors of 2 do not contribute to the gcd
			a = a.shiftRight(a.getLowestSetBit());
			b = b.shiftRight(b.getLowestSetBit());

			// Euclid with subtractions, keeping a > b
			int cmp = b.compareTo(a);
			if (cmp > 0) {
				BigInteger tmp = a;
				a = b;
				b = tmp;
			} else if (cmp == 0) {
				break;
			}
			a = a.subtract(b);
		}

		BigInteger gcd = b.shiftLeft(sharedTwoFactors);
		if (DEBUG) {
			LOG.debug("gcd(" + a0 + ", " + b0 + ") = " + gcd);
			assertEquals(a0.gcd(b0), gcd);
		}
		return gcd;
	}
}

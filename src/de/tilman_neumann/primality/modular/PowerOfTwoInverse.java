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

import static de.tilman_neumann.primality.base.BigIntConstants.*;

import java.math.BigInteger;

/**
 * Modular inverse of powers of 2 modulo odd numbers.
 *
 * This is Penk's right-shift inversion method restricted to powers of 2:
 * Starting from 1, we halve exponent times, adding the modulus whenever necessary to stay even.
 *
 * @author Tilman Neumann
 */
public class PowerOfTwoInverse {

	private PowerOfTwoInverse() {
		// static methods only
	}

	/**
	 * Compute (1/2^exponent) (mod oddModulus).
	 *
	 * @param exponent the exponent of the power of 2 to invert, not the power itself
	 * @param oddModulus
	 * @return the inverse of 2^exponent modulo oddModulus
	 * @throws InvalidModulusException if the modulus is not odd and positive
	 */
	public static BigInteger invert(int exponent, BigInteger oddModulus) {
		if (exponent < 0) throw new IllegalArgumentException("exponent must be non-negative, but is " + exponent);
		if (oddModulus.signum() <= 0 || !oddModulus.testBit(0)) throw new InvalidModulusException(oddModulus);

		BigInteger inv = I_1;
		for (int i = 0; i < exponent; i++) {
			if (inv.testBit(0)) {
				inv = inv.add(oddModulus);
			}
			inv = inv.shiftRight(1);
		}
		return inv;
	}
}

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

import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.LogManager;

import de.tilman_neumann.primality.base.BitUtil;

import static org.junit.Assert.*;

/**
 * Precomputed values to transform numbers to and from Montgomery form for a given odd modulus,
 * and arithmetic operating on numbers in Montgomery form.
 *
 * The auxiliary modulus is r = 2^shift with shift = bitLength(modulus), the smallest power of 2 bigger than the modulus.
 * Thus reduction modulo r is a bit mask and division by r is a right shift.
 *
 * References:
 * [1] Peter Montgomery: "Modular multiplication without trial division", Math. Comp. 44, 1985, p. 519-521.
 * [2] Richard Crandall, Carl Pomerance: "Prime Numbers: A Computational Perspective", Springer, 2001.
 *
 * Instances are immutable.
 *
 * @author Tilman Neumann
 */
public class MontgomeryContext {
	private static final Logger LOG = LogManager.getLogger(MontgomeryContext.class);
	private static final boolean DEBUG = false;

	/** the odd modulus */
	private final BigInteger modulus;
	/** r = 2^shift */
	private final int shift;
	private final BigInteger r;
	/** r-1, to compute x (mod r) as x & rMask */
	private final BigInteger rMask;
	/** (1/r) (mod modulus) */
	private final BigInteger rInverse;
	/** (1/modulus) (mod r) */
	private final BigInteger modulusInverse;
	/** 1 in Montgomery form */
	private final BigInteger one;

	private MontgomeryContext(BigInteger modulus) {
		this.modulus = modulus;
		this.shift = BitUtil.bitLength(modulus);
		this.r = I_1.shiftLeft(shift);
		this.rMask = r.subtract(I_1);
		this.rInverse = PowerOfTwoInverse.invert(shift, modulus);
		// From modulus*modulusInverse + r*rInverse == 1 (mod r).
		// r*rInverse - 1 is a multiple of modulus, so the division is exact.
		this.modulusInverse = r.subtract(rInverse.multiply(r).subtract(I_1).divide(modulus).mod(r));
		this.one = toMontgomery(I_1);

		if (DEBUG) {
			LOG.debug("modulus = " + modulus + ", shift = " + shift + ", rInverse = " + rInverse + ", modulusInverse = " + modulusInverse);
			assertEquals(I_1, rInverse.multiply(r).mod(modulus));
			assertEquals(I_1, modulus.multiply(modulusInverse).mod(r));
		}
	}

	/**
	 * Create the Montgomery context for the given modulus.
	 * @param modulus an odd positive number
	 * @return Montgomery context
	 * @throws InvalidModulusException if modulus is even or not positive
	 */
	public static MontgomeryContext create(BigInteger modulus) {
		if (modulus.signum() <= 0 || !modulus.testBit(0)) throw new InvalidModulusException(modulus);
		return new MontgomeryContext(modulus);
	}

	public BigInteger getModulus() {
		return modulus;
	}

	public int getShift() {
		return shift;
	}

	public BigInteger getR() {
		return r;
	}

	public BigInteger getRInverse() {
		return rInverse;
	}

	public BigInteger getModulusInverse() {
		return modulusInverse;
	}

	/**
	 * @return 1 in Montgomery form
	 */
	public BigInteger one() {
		return one;
	}

	/**
	 * Transform n into Montgomery form.
	 * @param n any number
	 * @return n*r (mod modulus)
	 */
	public BigInteger toMontgomery(BigInteger n) {
		return n.shiftLeft(shift).mod(modulus);
	}

	/**
	 * Transform n out of Montgomery form.
	 * @param n a number in Montgomery form
	 * @return n/r (mod modulus)
	 */
	public BigInteger fromMontgomery(BigInteger n) {
		return n.multiply(rInverse).mod(modulus);
	}

	/**
	 * Montgomery multiplication (REDC). Does not need any division by the modulus.
	 * @param a number in Montgomery form
	 * @param b number in Montgomery form
	 * @return a*b/r (mod modulus), in [0, modulus)
	 */
	public BigInteger multiply(BigInteger a, BigInteger b) {
		// 0 has the same representation in both domains
		if (a.signum() == 0 || b.signum() == 0) return I_0;

		BigInteger t = a.multiply(b);
		BigInteger m = t.and(rMask).multiply(modulusInverse).and(rMask);
		// t - m*modulus == 0 (mod r)
		BigInteger product = t.subtract(m.multiply(modulus)).shiftRight(shift);
		if (product.compareTo(modulus) >= 0) {
			product = product.subtract(modulus);
		} else if (product.signum() < 0) {
			product = product.add(modulus);
		}

		if (DEBUG) assertEquals(a.multiply(b).multiply(rInverse).mod(modulus), product);
		return product;
	}

	/**
	 * Montgomery squaring.
	 * @param a number in Montgomery form
	 * @return a^2/r (mod modulus)
	 */
	public BigInteger square(BigInteger a) {
		return multiply(a, a);
	}

	/**
	 * Exponentiation by squaring in Montgomery form, processing the exponent bits from lowest to highest.
	 *
	 * @param base number in Montgomery form
	 * @param exponent non-negative exponent, not in Montgomery form
	 * @return base^exponent in Montgomery form
	 */
	public BigInteger pow(BigInteger base, BigInteger exponent) {
		int expBits = BitUtil.bitLength(exponent); // throws for negative exponents
		BigInteger result = one;
		BigInteger x = base;
		for (int i = 0; i < expBits; i++) {
			if (exponent.testBit(i)) {
				result = multiply(result, x);
			}
			x = square(x);
		}
		return result;
	}

	/**
	 * Modular power of ordinary residues, computed in Montgomery form.
	 * @param base not in Montgomery form
	 * @param exponent non-negative
	 * @return base^exponent (mod modulus)
	 */
	public BigInteger modPow(BigInteger base, BigInteger exponent) {
		return fromMontgomery(pow(toMontgomery(base), exponent));
	}

	@Override
	public String toString() {
		return "MontgomeryContext(modulus=" + modulus + ", shift=" + shift + ")";
	}
}

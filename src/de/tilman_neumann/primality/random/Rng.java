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
package de.tilman_neumann.primality.random;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Random;

/**
 * RandomBitSource backed by a java.util.Random.
 * The default constructor uses a SecureRandom; a seeded instance gives reproducible bit sequences.
 *
 * Thread-safe as far as the underlying Random is.
 *
 * @author Tilman Neumann
 */
public class Rng implements RandomBitSource {
	private final Random random;

	public Rng() {
		this(new SecureRandom());
	}

	public Rng(long seed) {
		this(new Random(seed));
	}

	public Rng(Random random) {
		this.random = random;
	}

	@Override
	public BigInteger nextBits(int numBits) {
		if (numBits < 0) throw new IllegalArgumentException("numBits must be non-negative, but is " + numBits);
		return new BigInteger(numBits, random);
	}

	/**
	 * @param min
	 * @param max
	 * @return a uniformly distributed random number from [min, max]
	 */
	public BigInteger nextBigInteger(BigInteger min, BigInteger max) {
		BigInteger range = max.subtract(min);
		if (range.signum() < 0) throw new IllegalArgumentException("max = " + max + " < min = " + min);
		int bits = range.bitLength();
		BigInteger x;
		do {
			x = nextBits(bits);
		} while (x.compareTo(range) > 0);
		return min.add(x);
	}
}
